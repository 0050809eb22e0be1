package uploadqueue;

import uploadqueue.process.PassResult;
import uploadqueue.process.ProgressListener;
import uploadqueue.process.RetryPolicy;
import uploadqueue.process.UploadProcessor;
import uploadqueue.registry.DefaultHandlerRegistry;
import uploadqueue.registry.HandlerRegistry;
import uploadqueue.scheduler.UploadScheduler;
import uploadqueue.spi.ConnectionProvider;
import uploadqueue.spi.MetricsExporter;
import uploadqueue.spi.NetworkMonitor;
import uploadqueue.spi.UploadStore;
import uploadqueue.spi.UploadStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires an {@link UploadWriter}, {@link UploadProcessor} and
 * {@link UploadScheduler} over one durable store into a single {@link AutoCloseable} unit.
 *
 * <p>Each instance owns its processor and scheduler thread; there is no global state,
 * so tests and multi-tenant hosts can run several queues side by side.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (UploadQueue queue = UploadQueue.builder()
 *     .connectionProvider(connectionProvider)
 *     .uploadStore(new H2UploadStore())
 *     .networkMonitor(connectivity)
 *     .build()) {
 *   queue.registerHandler(UploadType.RECORD_INSERT, upload -> backend.insertResult(upload));
 *   queue.start();
 *   String id = queue.enqueue(new UploadPayload.InspectionResult(row));
 * }
 * }</pre>
 *
 * @see UploadWriter
 * @see UploadProcessor
 * @see UploadScheduler
 */
public final class UploadQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(UploadQueue.class.getName());

  private final ConnectionProvider connectionProvider;
  private final UploadStore uploadStore;
  private final HandlerRegistry handlerRegistry;
  private final UploadWriter writer;
  private final UploadProcessor processor;
  private final UploadScheduler scheduler;
  private final MetricsExporter metrics;

  private UploadQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.uploadStore = Objects.requireNonNull(builder.uploadStore, "uploadStore");
    this.handlerRegistry = builder.handlerRegistry != null ? builder.handlerRegistry : new DefaultHandlerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    this.writer = new UploadWriter(connectionProvider, uploadStore, metrics, clock);
    this.processor = UploadProcessor.builder()
        .connectionProvider(connectionProvider)
        .uploadStore(uploadStore)
        .handlerRegistry(handlerRegistry)
        .maxRetries(builder.maxRetries)
        .retryPolicy(builder.retryPolicy)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.scheduler = UploadScheduler.builder()
        .processor(processor)
        .networkMonitor(builder.networkMonitor)
        .metrics(metrics)
        .intervalMs(builder.intervalMs)
        .requireOnline(builder.requireOnline)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public UploadWriter writer() {
    return writer;
  }

  public HandlerRegistry handlerRegistry() {
    return handlerRegistry;
  }

  /** @see UploadWriter#enqueue(UploadPayload) */
  public String enqueue(UploadPayload payload) {
    return writer.enqueue(payload);
  }

  /** @see UploadWriter#enqueue(UploadPayload, int) */
  public String enqueue(UploadPayload payload, int priority) {
    return writer.enqueue(payload, priority);
  }

  /** @see UploadWriter#enqueue(UploadPayload, BinaryAttachment) */
  public String enqueue(UploadPayload payload, BinaryAttachment binary) {
    return writer.enqueue(payload, binary);
  }

  /** @see UploadWriter#enqueue(UploadPayload, BinaryAttachment, int) */
  public String enqueue(UploadPayload payload, BinaryAttachment binary, int priority) {
    return writer.enqueue(payload, binary, priority);
  }

  /**
   * Registers the handler for a type, replacing any previous one.
   *
   * @param type    the upload type
   * @param handler the handler
   * @return this queue for chaining
   * @throws UnsupportedOperationException if the queue was built with a custom
   *                                       {@link HandlerRegistry} that is not a {@link DefaultHandlerRegistry}
   */
  public UploadQueue registerHandler(UploadType type, UploadHandler handler) {
    if (!(handlerRegistry instanceof DefaultHandlerRegistry registry)) {
      throw new UnsupportedOperationException(
          "Handlers must be registered on the custom registry " + handlerRegistry.getClass().getName());
    }
    registry.register(type, handler);
    return this;
  }

  /**
   * Returns the number of stored records, exhausted ones included.
   *
   * @return the pending record count
   */
  public int count() {
    return withConnection("count pending uploads", uploadStore::count);
  }

  /**
   * Returns a snapshot of stored records in processing order, for diagnostics.
   *
   * @return the pending records
   */
  public List<PendingUpload> pending() {
    List<PendingUpload> uploads = new ArrayList<>(withConnection("read pending uploads", uploadStore::selectAll));
    uploads.sort(UploadProcessor.PASS_ORDER);
    return uploads;
  }

  /**
   * Returns the number of records that reached the retry ceiling and are no longer attempted.
   *
   * @return the exhausted record count
   */
  public int exhaustedCount() {
    return withConnection("count exhausted uploads",
        conn -> uploadStore.countExhausted(conn, processor.maxRetries()));
  }

  /**
   * Re-arms a record so the next pass attempts it again.
   *
   * @param id the record id
   * @return {@code true} if the record exists
   */
  public boolean resetRetries(String id) {
    Objects.requireNonNull(id, "id");
    boolean found = withConnection("reset retries of upload " + id, conn -> uploadStore.resetRetries(conn, id)) > 0;
    if (found) {
      logger.info("Reset retries of upload " + id);
    }
    return found;
  }

  /**
   * Discards every stored record. Intended for operator use; data not yet uploaded is lost.
   *
   * @return the number of records discarded
   */
  public int clear() {
    int removed = withConnection("clear pending uploads", uploadStore::deleteAll);
    logger.log(Level.WARNING, "Cleared {0} pending upload(s)", removed);
    return removed;
  }

  /**
   * Starts background processing: a startup pass, the interval tick and reconnect passes.
   *
   * @return the startup pass
   * @see UploadScheduler#start()
   */
  public CompletableFuture<PassResult> start() {
    return scheduler.start();
  }

  /**
   * Stops background processing without interrupting a running pass.
   *
   * @see UploadScheduler#stop()
   */
  public void stop() {
    scheduler.stop();
  }

  /**
   * Runs one pass on the calling thread.
   *
   * @return the pass outcome; {@link PassResult#notRun()} if another pass was running
   * @throws UploadStoreException if the store failed
   */
  public PassResult runOnce() {
    return processor.runPass(null);
  }

  /**
   * Runs one pass on the calling thread, reporting progress.
   *
   * @param progress progress callback
   * @return the pass outcome; {@link PassResult#notRun()} if another pass was running
   * @throws UploadStoreException if the store failed
   */
  public PassResult runOnce(ProgressListener progress) {
    return processor.runPass(progress);
  }

  /**
   * Asks the background scheduler for a pass as soon as possible ("retry now").
   *
   * @return {@code false} if the request was dropped or the queue is not started
   */
  public boolean requestPass() {
    return scheduler.requestPass();
  }

  /**
   * Stops the scheduler permanently and closes a closeable metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private <T> T withConnection(String action, Function<Connection, T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      throw new UploadStoreException("Failed to " + action, e);
    }
  }

  /**
   * Builder for {@link UploadQueue}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private UploadStore uploadStore;
    private HandlerRegistry handlerRegistry;
    private NetworkMonitor networkMonitor;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private int maxRetries = UploadProcessor.DEFAULT_MAX_RETRIES;
    private long intervalMs = UploadScheduler.DEFAULT_INTERVAL_MS;
    private boolean requireOnline = true;
    private long drainTimeoutMs = UploadScheduler.DEFAULT_DRAIN_TIMEOUT_MS;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <b>Required.</b> Source of connections to the local store. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Durable store backend. */
    public Builder uploadStore(UploadStore uploadStore) {
      this.uploadStore = uploadStore;
      return this;
    }

    /** Optional. Defaults to an empty {@link DefaultHandlerRegistry}. */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /** Optional. Defaults to {@link NetworkMonitor#ALWAYS_ONLINE}. */
    public Builder networkMonitor(NetworkMonitor networkMonitor) {
      this.networkMonitor = networkMonitor;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}; closed with the queue if closeable. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link RetryPolicy#NONE}. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@value UploadProcessor#DEFAULT_MAX_RETRIES}. */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /** Optional. Defaults to {@code true}: interval passes only run while online. */
    public Builder requireOnline(boolean requireOnline) {
      this.requireOnline = requireOnline;
      return this;
    }

    /** Optional. Defaults to 5 seconds. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the queue. The scheduler is not started; call {@link UploadQueue#start()}.
     *
     * @return a new {@link UploadQueue}
     * @throws IllegalStateException    if this builder was already used
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if a numeric option is out of range
     */
    public UploadQueue build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new UploadQueue(this);
    }
  }
}
