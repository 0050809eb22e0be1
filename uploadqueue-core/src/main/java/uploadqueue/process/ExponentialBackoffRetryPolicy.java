package uploadqueue.process;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(retryCount-1)}, capped at {@code maxDelay},
 * with random jitter in the range [0.5, 1.5). Jitter keeps a fleet of devices that
 * reconnect together from retrying in lockstep.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount <= 0) {
      return 0L;
    }
    long exponential;
    if (retryCount >= 31) {
      exponential = maxDelayMs;
    } else {
      long factor = 1L << (retryCount - 1);
      // factor * base would overflow before reaching the cap
      exponential = factor > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * factor;
    }
    long capped = Math.min(maxDelayMs, exponential);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }
}
