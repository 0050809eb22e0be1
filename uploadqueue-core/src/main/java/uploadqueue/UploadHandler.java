package uploadqueue;

/**
 * Domain-supplied function performing the remote write for one {@link UploadType}.
 *
 * <p>Handlers are executed <b>synchronously</b> on the thread running the pass,
 * one record at a time. The queue imposes no timeout, so a handler must bound its
 * own latency; a hung handler stalls the pass.
 *
 * <h2>Outcome</h2>
 * <ul>
 *   <li>{@code true}: the remote write is confirmed; the record is deleted.</li>
 *   <li>{@code false} or any thrown exception: the record is kept and its retry
 *       count incremented. Exceptions never escape the processor.</li>
 * </ul>
 *
 * <h2>Idempotency</h2>
 * <p>A handler may be invoked again for a record whose previous attempt succeeded
 * server-side but whose acknowledgment was lost. A repeat call must be a no-op or
 * an overwrite, never a duplicate: use upsert-by-key for state, overwriting object
 * writes for binaries, and deterministic names or ids for inserts.
 *
 * <pre>{@code
 * registry.register(UploadType.LIFECYCLE_UPSERT, upload -> {
 *   var lifecycle = (UploadPayload.Lifecycle) upload.payload();
 *   return backend.upsertLifecycle(lifecycle.elementGuid(), lifecycle.projectId(), lifecycle.state());
 * });
 * }</pre>
 *
 * @see uploadqueue.registry.HandlerRegistry
 */
@FunctionalInterface
public interface UploadHandler {

  /**
   * Delivers one pending upload.
   *
   * @param upload the record to deliver
   * @return {@code true} if delivery is confirmed
   * @throws Exception if delivery fails; treated exactly like returning {@code false}
   */
  boolean upload(PendingUpload upload) throws Exception;
}
