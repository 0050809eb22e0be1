/**
 * Root API of the upload queue: a durable, local-first queue that keeps field
 * inspection data (photos, results, signatures, lifecycle states, audit entries)
 * until a remote backend confirms it.
 *
 * <h2>Core Design</h2>
 * <p>Producers call {@link uploadqueue.UploadQueue#enqueue enqueue}; the record is
 * persisted before the call returns. A {@linkplain uploadqueue.process.UploadProcessor
 * processor} drains the store in passes, highest priority and oldest first, calling the
 * {@linkplain uploadqueue.UploadHandler handler} registered for each
 * {@linkplain uploadqueue.UploadType type}. Delivered records are deleted; failed ones
 * stay with an incremented retry count until {@code maxRetries}, after which they are
 * kept but no longer attempted. A {@linkplain uploadqueue.scheduler.UploadScheduler
 * scheduler} runs passes at startup, every 30 seconds while online, and on reconnect.
 *
 * <p>Delivery is at-least-once. Handlers must be idempotent: a crash between a
 * successful upload and the delete causes a second attempt.
 *
 * <p>One queue instance per store. Two processes draining the same database would
 * deliver records twice; the embedded H2 file lock normally prevents that setup.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>uploadqueue-core</b>: API, processor, scheduler, registry</li>
 *   <li><b>uploadqueue-jdbc</b>: {@linkplain uploadqueue.jdbc JDBC store} on embedded H2</li>
 *   <li><b>uploadqueue-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>uploadqueue-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * JdbcDataSource ds = new JdbcDataSource();
 * ds.setURL("jdbc:h2:file:./data/uploads");
 * H2UploadStore store = new H2UploadStore();
 * try (Connection conn = ds.getConnection()) {
 *   store.createSchema(conn);
 * }
 *
 * ConnectivityTracker connectivity = new ConnectivityTracker(true);
 * try (UploadQueue queue = UploadQueue.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(ds))
 *     .uploadStore(store)
 *     .networkMonitor(connectivity)
 *     .build()) {
 *   queue.registerHandler(UploadType.BINARY_UPLOAD, photoUploader)
 *       .registerHandler(UploadType.RECORD_INSERT, resultInserter);
 *   queue.start();
 *   queue.enqueue(new UploadPayload.Photo(Map.of("inspection_id", "42")),
 *       BinaryAttachment.of(bytes, "42/front.png", "image/png"), 10);
 * }
 * }</pre>
 */
package uploadqueue;
