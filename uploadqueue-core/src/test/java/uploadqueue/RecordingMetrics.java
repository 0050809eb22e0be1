package uploadqueue;

import uploadqueue.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * MetricsExporter that counts every call, for assertions in unit tests.
 */
public class RecordingMetrics implements MetricsExporter {
  public final AtomicInteger enqueued = new AtomicInteger();
  public final AtomicInteger success = new AtomicInteger();
  public final AtomicInteger failure = new AtomicInteger();
  public final AtomicInteger exhausted = new AtomicInteger();
  public final AtomicInteger unroutable = new AtomicInteger();
  public final AtomicInteger deferred = new AtomicInteger();
  public final AtomicInteger passDropped = new AtomicInteger();
  public final AtomicInteger passFailed = new AtomicInteger();
  public final AtomicInteger passesCompleted = new AtomicInteger();
  public volatile int lastPending = -1;

  @Override
  public void incrementEnqueued() {
    enqueued.incrementAndGet();
  }

  @Override
  public void incrementUploadSuccess() {
    success.incrementAndGet();
  }

  @Override
  public void incrementUploadFailure() {
    failure.incrementAndGet();
  }

  @Override
  public void incrementSkippedExhausted() {
    exhausted.incrementAndGet();
  }

  @Override
  public void incrementSkippedUnroutable() {
    unroutable.incrementAndGet();
  }

  @Override
  public void incrementSkippedDeferred() {
    deferred.incrementAndGet();
  }

  @Override
  public void incrementPassDropped() {
    passDropped.incrementAndGet();
  }

  @Override
  public void incrementPassFailed() {
    passFailed.incrementAndGet();
  }

  @Override
  public void recordPendingCount(int pending) {
    lastPending = pending;
  }

  @Override
  public void recordPassDurationMs(long durationMs) {
    passesCompleted.incrementAndGet();
  }
}
