package uploadqueue.process;

import uploadqueue.PendingUpload;
import uploadqueue.UploadHandler;
import uploadqueue.registry.HandlerRegistry;
import uploadqueue.spi.ConnectionProvider;
import uploadqueue.spi.MetricsExporter;
import uploadqueue.spi.UploadStore;
import uploadqueue.spi.UploadStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the upload store once per invocation of {@link #runPass}.
 *
 * <p>A pass snapshots every stored record, orders the snapshot by priority (highest
 * first) and creation time (oldest first within a priority band), then handles the
 * records strictly one after another:
 * <ul>
 *   <li>records at or over {@code maxRetries} are skipped and kept (never dropped);</li>
 *   <li>records with no registered handler are skipped and kept untouched;</li>
 *   <li>records whose retry delay has not elapsed are skipped and kept;</li>
 *   <li>otherwise the handler runs; success deletes the record, failure or anything
 *       thrown increments its retry count.</li>
 * </ul>
 *
 * <p>Nothing a handler throws escapes a pass, {@link Error}s included; only a
 * {@link VirtualMachineError} is rethrown. Store exceptions do escape: a snapshot that cannot
 * be read, or a delete or retry update that fails, aborts the pass with
 * {@link UploadStoreException}.
 *
 * <p>At most one pass runs per processor. A call made while another pass is in flight
 * returns {@link PassResult#notRun()} without touching the store.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see PassResult
 * @see ProgressListener
 */
public final class UploadProcessor {
  private static final Logger logger = Logger.getLogger(UploadProcessor.class.getName());

  public static final int DEFAULT_MAX_RETRIES = 5;
  private static final int MAX_ERROR_LENGTH = 4000;

  /** Processing order: priority descending, then oldest first, then id. */
  public static final Comparator<PendingUpload> PASS_ORDER = Comparator
      .comparingInt(PendingUpload::priority).reversed()
      .thenComparing(PendingUpload::createdAt)
      .thenComparing(PendingUpload::id);

  private final ConnectionProvider connectionProvider;
  private final UploadStore uploadStore;
  private final HandlerRegistry handlerRegistry;
  private final int maxRetries;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private UploadProcessor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.uploadStore = Objects.requireNonNull(builder.uploadStore, "uploadStore");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    this.maxRetries = builder.maxRetries;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.NONE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns {@code true} while a pass is in flight.
   *
   * @return whether a pass is running
   */
  public boolean isRunning() {
    return running.get();
  }

  /**
   * Runs one pass over a snapshot of the store.
   *
   * @param progress progress callback; {@code null} for none
   * @return the pass outcome, or {@link PassResult#notRun()} if another pass was in flight
   * @throws UploadStoreException if the store cannot be read or updated
   */
  public PassResult runPass(ProgressListener progress) {
    ProgressListener listener = progress != null ? progress : ProgressListener.NOOP;
    if (!running.compareAndSet(false, true)) {
      metrics.incrementPassDropped();
      logger.fine("Upload pass already in flight; request dropped");
      return PassResult.notRun();
    }
    long startNanos = System.nanoTime();
    try {
      List<PendingUpload> snapshot = snapshot();
      snapshot.sort(PASS_ORDER);
      PassResult result = process(snapshot, listener);
      metrics.recordPendingCount(snapshot.size() - result.success());
      metrics.recordPassDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      return result;
    } catch (UploadStoreException e) {
      metrics.incrementPassFailed();
      throw e;
    } finally {
      running.set(false);
    }
  }

  private List<PendingUpload> snapshot() {
    try (Connection conn = connectionProvider.getConnection()) {
      return new ArrayList<>(uploadStore.selectAll(conn));
    } catch (SQLException e) {
      throw new UploadStoreException("Failed to read pending uploads", e);
    }
  }

  private PassResult process(List<PendingUpload> uploads, ProgressListener listener) {
    int total = uploads.size();
    int success = 0;
    int failed = 0;
    int skipped = 0;
    if (total > 0) {
      logger.log(Level.INFO, "Processing {0} pending upload(s)", total);
    }

    for (int i = 0; i < total; i++) {
      PendingUpload upload = uploads.get(i);
      report(listener, i, total, upload);

      if (upload.retryCount() >= maxRetries) {
        logger.log(Level.WARNING, "Skipping upload {0} ({1}): retry limit {2} reached",
            new Object[]{upload.id(), upload.type(), maxRetries});
        metrics.incrementSkippedExhausted();
        skipped++;
        continue;
      }
      UploadHandler handler = handlerRegistry.handlerFor(upload.type());
      if (handler == null) {
        logger.log(Level.WARNING, "Skipping upload {0}: no handler registered for {1}",
            new Object[]{upload.id(), upload.type()});
        metrics.incrementSkippedUnroutable();
        skipped++;
        continue;
      }
      Instant now = clock.instant();
      if (!upload.isEligibleAt(now)) {
        metrics.incrementSkippedDeferred();
        skipped++;
        continue;
      }

      if (deliver(handler, upload, now)) {
        success++;
      } else {
        failed++;
      }
    }

    report(listener, total, total, null);
    if (total > 0) {
      logger.log(Level.INFO, "Upload pass complete: {0} succeeded, {1} failed, {2} skipped",
          new Object[]{success, failed, skipped});
    }
    return new PassResult(success, failed, skipped, true);
  }

  private boolean deliver(UploadHandler handler, PendingUpload upload, Instant now) {
    Throwable failure = null;
    boolean delivered;
    try {
      delivered = handler.upload(upload);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable t) {
      failure = t;
      delivered = false;
    }

    if (delivered) {
      delete(upload.id());
      metrics.incrementUploadSuccess();
      return true;
    }

    int nextRetry = upload.retryCount() + 1;
    long delayMs = retryPolicy.computeDelayMs(nextRetry);
    Instant nextAt = delayMs > 0 ? now.plusMillis(delayMs) : null;
    String error = failure != null ? describe(failure) : "Handler reported failure";
    recordFailure(upload.id(), nextRetry, nextAt, error);
    metrics.incrementUploadFailure();
    logger.log(Level.WARNING, "Upload " + upload.id() + " (" + upload.type() + ") failed, attempt "
        + nextRetry + " of " + maxRetries, failure);
    return false;
  }

  private void delete(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      uploadStore.delete(conn, id);
    } catch (SQLException e) {
      throw new UploadStoreException("Failed to delete delivered upload " + id, e);
    }
  }

  private void recordFailure(String id, int retryCount, Instant nextAt, String error) {
    try (Connection conn = connectionProvider.getConnection()) {
      uploadStore.updateRetryCount(conn, id, retryCount, nextAt, error);
    } catch (SQLException e) {
      throw new UploadStoreException("Failed to record failed attempt for upload " + id, e);
    }
  }

  private static void report(ProgressListener listener, int processed, int total, PendingUpload upload) {
    try {
      listener.onProgress(processed, total, upload == null ? null : upload.type());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Progress listener failed", e);
    }
  }

  private static String describe(Throwable failure) {
    String message = failure.getClass().getSimpleName()
        + (failure.getMessage() == null ? "" : ": " + failure.getMessage());
    return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  /**
   * Builder for {@link UploadProcessor}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private UploadStore uploadStore;
    private HandlerRegistry handlerRegistry;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the connection provider used for every store operation.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the durable store to drain.
     *
     * <p><b>Required.</b>
     *
     * @param uploadStore the persistence backend
     * @return this builder
     */
    public Builder uploadStore(UploadStore uploadStore) {
      this.uploadStore = uploadStore;
      return this;
    }

    /**
     * Sets the registry resolving a handler per upload type.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the retry ceiling. Records whose retry count reaches it are kept but no
     * longer attempted.
     *
     * <p>Optional. Defaults to {@value UploadProcessor#DEFAULT_MAX_RETRIES}. Must be &ge; 1.
     *
     * @param maxRetries the retry ceiling
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the per-record retry delay policy.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#NONE}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to evaluate retry delays.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the processor.
     *
     * @return a new {@link UploadProcessor}
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if {@code maxRetries < 1}
     */
    public UploadProcessor build() {
      return new UploadProcessor(this);
    }
  }
}
