package uploadqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import uploadqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code upload.queue.enqueued}: records durably enqueued</li>
 *   <li>{@code upload.queue.upload.success}: records delivered and deleted</li>
 *   <li>{@code upload.queue.upload.failure}: failed attempts (record kept)</li>
 *   <li>{@code upload.queue.skipped.exhausted}: records skipped at the retry ceiling</li>
 *   <li>{@code upload.queue.skipped.unroutable}: records skipped for lack of a handler</li>
 *   <li>{@code upload.queue.skipped.deferred}: records skipped until their retry delay elapses</li>
 *   <li>{@code upload.queue.pass.dropped}: pass requests dropped while a pass was running</li>
 *   <li>{@code upload.queue.pass.failed}: passes aborted by a store failure</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code upload.queue.pending}: records left after the last pass</li>
 *   <li>{@code upload.queue.pass.duration.ms}: duration of the last pass</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "upload.queue";

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter uploadSuccess;
  private final Counter uploadFailure;
  private final Counter skippedExhausted;
  private final Counter skippedUnroutable;
  private final Counter skippedDeferred;
  private final Counter passDropped;
  private final Counter passFailed;
  private final Gauge pendingGauge;
  private final Gauge passDurationGauge;

  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicLong passDurationMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for hosts running several queues.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "signatures.queue"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = counter(namePrefix + ".enqueued", "Uploads durably enqueued");
    this.uploadSuccess = counter(namePrefix + ".upload.success", "Uploads delivered and removed");
    this.uploadFailure = counter(namePrefix + ".upload.failure", "Failed upload attempts");
    this.skippedExhausted = counter(namePrefix + ".skipped.exhausted", "Uploads skipped at the retry limit");
    this.skippedUnroutable = counter(namePrefix + ".skipped.unroutable", "Uploads skipped without a handler");
    this.skippedDeferred = counter(namePrefix + ".skipped.deferred", "Uploads waiting for their retry delay");
    this.passDropped = counter(namePrefix + ".pass.dropped", "Pass requests dropped while a pass was running");
    this.passFailed = counter(namePrefix + ".pass.failed", "Passes aborted by a store failure");

    this.pendingGauge = Gauge.builder(namePrefix + ".pending", pending, AtomicInteger::get)
        .description("Uploads left after the last pass")
        .register(registry);
    this.passDurationGauge = Gauge.builder(namePrefix + ".pass.duration.ms", passDurationMs, AtomicLong::get)
        .description("Duration of the last pass in milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementUploadSuccess() {
    if (closed) return;
    uploadSuccess.increment();
  }

  @Override
  public void incrementUploadFailure() {
    if (closed) return;
    uploadFailure.increment();
  }

  @Override
  public void incrementSkippedExhausted() {
    if (closed) return;
    skippedExhausted.increment();
  }

  @Override
  public void incrementSkippedUnroutable() {
    if (closed) return;
    skippedUnroutable.increment();
  }

  @Override
  public void incrementSkippedDeferred() {
    if (closed) return;
    skippedDeferred.increment();
  }

  @Override
  public void incrementPassDropped() {
    if (closed) return;
    passDropped.increment();
  }

  @Override
  public void incrementPassFailed() {
    if (closed) return;
    passFailed.increment();
  }

  @Override
  public void recordPendingCount(int pending) {
    if (closed) return;
    this.pending.set(pending);
  }

  @Override
  public void recordPassDurationMs(long durationMs) {
    if (closed) return;
    this.passDurationMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link uploadqueue.UploadQueue#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, uploadSuccess, uploadFailure,
        skippedExhausted, skippedUnroutable, skippedDeferred, passDropped, passFailed,
        pendingGauge, passDurationGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
