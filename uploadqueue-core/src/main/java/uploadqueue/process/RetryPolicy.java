package uploadqueue.process;

/**
 * Strategy for computing how long a failed record waits before it becomes eligible again.
 *
 * <p>The default, {@link #NONE}, makes failed records eligible on the very next pass;
 * the scheduler interval is then the only throttle.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * No per-record delay.
     */
    RetryPolicy NONE = retryCount -> 0L;

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param retryCount the retry count after the failure just recorded (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryCount);
}
