package uploadqueue.spi;

/**
 * Observability hook for exporting upload queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of records durably enqueued.
     */
    void incrementEnqueued();

    /**
     * Increments the count of records delivered and deleted.
     */
    void incrementUploadSuccess();

    /**
     * Increments the count of failed attempts (record kept, retry count incremented).
     */
    void incrementUploadFailure();

    /**
     * Increments the count of records skipped because they reached the retry ceiling.
     */
    void incrementSkippedExhausted();

    /**
     * Increments the count of records skipped because no handler is registered for their type.
     */
    void incrementSkippedUnroutable();

    /**
     * Increments the count of records skipped because their retry delay has not elapsed.
     */
    default void incrementSkippedDeferred() {
    }

    /**
     * Increments the count of pass requests dropped because a pass was already running.
     */
    default void incrementPassDropped() {
    }

    /**
     * Increments the count of passes aborted by a store failure.
     */
    default void incrementPassFailed() {
    }

    /**
     * Records the number of records left in the store after a pass.
     *
     * @param pending pending record count
     */
    void recordPendingCount(int pending);

    /**
     * Records the wall-clock duration of a completed pass.
     *
     * @param durationMs pass duration in milliseconds (always non-negative)
     */
    default void recordPassDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementUploadSuccess() {
        }

        @Override
        public void incrementUploadFailure() {
        }

        @Override
        public void incrementSkippedExhausted() {
        }

        @Override
        public void incrementSkippedUnroutable() {
        }

        @Override
        public void recordPendingCount(int pending) {
        }
    }
}
