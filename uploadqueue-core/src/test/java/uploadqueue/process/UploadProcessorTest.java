package uploadqueue.process;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uploadqueue.InMemoryUploadStore;
import uploadqueue.MutableClock;
import uploadqueue.PendingUpload;
import uploadqueue.RecordingMetrics;
import uploadqueue.UploadType;
import uploadqueue.registry.DefaultHandlerRegistry;
import uploadqueue.spi.UploadStoreException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static uploadqueue.Uploads.T0;
import static uploadqueue.Uploads.photo;
import static uploadqueue.Uploads.record;

class UploadProcessorTest {

  private InMemoryUploadStore store;
  private DefaultHandlerRegistry registry;
  private RecordingMetrics metrics;
  private MutableClock clock;

  @BeforeEach
  void setUp() {
    store = new InMemoryUploadStore();
    registry = new DefaultHandlerRegistry();
    metrics = new RecordingMetrics();
    clock = new MutableClock(T0.plusSeconds(3600));
  }

  private UploadProcessor.Builder processorBuilder() {
    return UploadProcessor.builder()
        .connectionProvider(() -> null)
        .uploadStore(store)
        .handlerRegistry(registry)
        .metrics(metrics)
        .clock(clock);
  }

  private UploadProcessor processor() {
    return processorBuilder().build();
  }

  @Test
  void emptyStoreRunsAndReportsFinalProgress() {
    List<String> progress = new ArrayList<>();

    PassResult result = processor().runPass((i, total, type) -> progress.add(i + "/" + total + ":" + type));

    assertEquals(new PassResult(0, 0, 0, true), result);
    assertEquals(List.of("0/0:null"), progress);
    assertEquals(0, metrics.lastPending);
  }

  @Test
  void processesHigherPriorityFirstThenOldest() {
    store.put(record("low-old", 0, T0));
    store.put(record("high-new", 10, T0.plusSeconds(20)));
    store.put(record("high-old", 10, T0.plusSeconds(10)));
    store.put(record("low-new", 0, T0.plusSeconds(30)));
    List<String> order = new ArrayList<>();
    registry.register(UploadType.RECORD_INSERT, upload -> order.add(upload.id()));

    processor().runPass(null);

    assertEquals(List.of("high-old", "high-new", "low-old", "low-new"), order);
  }

  @Test
  void successfulUploadIsDeleted() {
    store.put(record("a", 0, T0));
    store.put(photo("b", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> true);
    registry.register(UploadType.BINARY_UPLOAD, upload -> upload.binary().size() == 3);

    PassResult result = processor().runPass(null);

    assertEquals(new PassResult(2, 0, 0, true), result);
    assertEquals(0, store.size());
    assertEquals(2, metrics.success.get());
    assertEquals(0, metrics.lastPending);
  }

  @Test
  void reportedFailureKeepsRecordAndIncrementsRetryCount() {
    store.put(record("a", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> false);

    PassResult result = processor().runPass(null);

    assertEquals(new PassResult(0, 1, 0, true), result);
    PendingUpload kept = store.get("a");
    assertEquals(1, kept.retryCount());
    assertNull(kept.nextAttemptAt());
    assertEquals("Handler reported failure", kept.lastError());
    assertEquals(1, metrics.failure.get());
    assertEquals(1, metrics.lastPending);
  }

  @Test
  void thrownExceptionCountsAsFailure() {
    store.put(record("a", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> {
      throw new IOException("backend unreachable");
    });

    PassResult result = processor().runPass(null);

    assertEquals(1, result.failed());
    assertEquals(1, store.get("a").retryCount());
    assertEquals("IOException: backend unreachable", store.get("a").lastError());
  }

  @Test
  void handlerErrorCountsAsFailureAndPassContinues() {
    store.put(record("a", 5, T0));
    store.put(record("b", 0, T0));
    List<String> seen = new ArrayList<>();
    registry.register(UploadType.RECORD_INSERT, upload -> {
      seen.add(upload.id());
      if (upload.id().equals("a")) {
        throw new AssertionError("handler bug");
      }
      return true;
    });
    UploadProcessor processor = processor();

    PassResult result = processor.runPass(null);

    assertEquals(new PassResult(1, 1, 0, true), result);
    assertEquals(List.of("a", "b"), seen);
    assertEquals(1, store.size());
    assertEquals(1, store.get("a").retryCount());
    assertEquals("AssertionError: handler bug", store.get("a").lastError());
    assertFalse(processor.isRunning());
  }

  @Test
  void linkageErrorFromHandlerIsRecorded() {
    store.put(record("a", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> {
      throw new NoClassDefFoundError("com/example/BackendClient");
    });

    PassResult result = processor().runPass(null);

    assertEquals(1, result.failed());
    assertEquals("NoClassDefFoundError: com/example/BackendClient", store.get("a").lastError());
  }

  @Test
  void virtualMachineErrorFromHandlerPropagates() {
    store.put(record("a", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> {
      throw new OutOfMemoryError("simulated");
    });
    UploadProcessor processor = processor();

    assertThrows(OutOfMemoryError.class, () -> processor.runPass(null));
    assertFalse(processor.isRunning());
  }

  @Test
  void failuresAccumulateUntilRetryLimitThenRecordIsKeptButSkipped() {
    store.put(record("a", 0, T0));
    List<String> attempts = new ArrayList<>();
    registry.register(UploadType.RECORD_INSERT, upload -> {
      attempts.add(upload.id());
      return false;
    });
    UploadProcessor processor = processorBuilder().maxRetries(3).build();

    for (int pass = 1; pass <= 3; pass++) {
      processor.runPass(null);
      assertEquals(pass, store.get("a").retryCount());
    }
    PassResult fourth = processor.runPass(null);

    assertEquals(3, attempts.size());
    assertEquals(new PassResult(0, 0, 1, true), fourth);
    assertEquals(3, store.get("a").retryCount());
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void exhaustedRecordIsNeverHandedToHandler() {
    store.put(record("spent", 0, T0, UploadProcessor.DEFAULT_MAX_RETRIES));
    registry.register(UploadType.RECORD_INSERT, upload -> fail("exhausted record attempted"));

    PassResult result = processor().runPass(null);

    assertEquals(new PassResult(0, 0, 1, true), result);
    assertEquals(1, store.size());
    assertEquals(0, store.updateCount.get());
  }

  @Test
  void recordWithoutHandlerIsSkippedUntouched() {
    PendingUpload original = store.put(photo("p", 0, T0));

    PassResult result = processor().runPass(null);

    assertEquals(new PassResult(0, 0, 1, true), result);
    assertSame(original, store.get("p"));
    assertEquals(0, store.updateCount.get());
    assertEquals(1, metrics.unroutable.get());
  }

  @Test
  void progressIsReportedBeforeEachRecordAndOnceAtTheEnd() {
    store.put(record("a", 5, T0));
    store.put(photo("b", 1, T0));
    store.put(record("c", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> true);
    List<String> progress = new ArrayList<>();

    processor().runPass((i, total, type) -> progress.add(i + "/" + total + ":" + type));

    assertEquals(List.of(
        "0/3:RECORD_INSERT",
        "1/3:BINARY_UPLOAD",
        "2/3:RECORD_INSERT",
        "3/3:null"), progress);
  }

  @Test
  void throwingProgressListenerDoesNotAbortPass() {
    store.put(record("a", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> true);

    PassResult result = processor().runPass((i, total, type) -> {
      throw new IllegalStateException("progress bar gone");
    });

    assertEquals(1, result.success());
    assertEquals(0, store.size());
  }

  @Test
  void unreadableStoreAbortsPassAndReleasesInFlightFlag() {
    store.put(record("a", 0, T0));
    store.failReads = true;
    registry.register(UploadType.RECORD_INSERT, upload -> fail("must not run"));
    UploadProcessor processor = processor();

    assertThrows(UploadStoreException.class, () -> processor.runPass(null));
    assertEquals(1, metrics.passFailed.get());
    assertFalse(processor.isRunning());

    store.failReads = false;
    registry.register(UploadType.RECORD_INSERT, upload -> true);
    assertEquals(1, processor.runPass(null).success());
  }

  @Test
  void overlappingPassIsDroppedNotQueued() throws Exception {
    store.put(record("a", 0, T0));
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    registry.register(UploadType.RECORD_INSERT, upload -> {
      entered.countDown();
      return release.await(5, TimeUnit.SECONDS);
    });
    UploadProcessor processor = processor();
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<PassResult> first = executor.submit(() -> processor.runPass(null));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      assertTrue(processor.isRunning());

      PassResult second = processor.runPass(null);

      assertFalse(second.ran());
      assertSame(PassResult.notRun(), second);
      assertEquals(1, metrics.passDropped.get());
      release.countDown();
      assertEquals(1, first.get(5, TimeUnit.SECONDS).success());
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void retryPolicyDefersRecordUntilDelayElapses() {
    store.put(record("a", 0, T0));
    List<String> attempts = new ArrayList<>();
    registry.register(UploadType.RECORD_INSERT, upload -> {
      attempts.add(upload.id());
      return false;
    });
    UploadProcessor processor = processorBuilder().retryPolicy(retryCount -> 60_000L).build();

    processor.runPass(null);
    assertEquals(clock.instant().plusSeconds(60), store.get("a").nextAttemptAt());

    PassResult deferred = processor.runPass(null);
    assertEquals(new PassResult(0, 0, 1, true), deferred);
    assertEquals(1, metrics.deferred.get());

    clock.advance(Duration.ofSeconds(61));
    PassResult retried = processor.runPass(null);
    assertEquals(1, retried.failed());
    assertEquals(2, attempts.size());
    assertEquals(2, store.get("a").retryCount());
  }

  @Test
  void longErrorMessageIsTruncated() {
    store.put(record("a", 0, T0));
    registry.register(UploadType.RECORD_INSERT, upload -> {
      throw new IllegalStateException("x".repeat(10_000));
    });

    processor().runPass(null);

    String error = store.get("a").lastError();
    assertEquals(4000, error.length());
    assertTrue(error.endsWith("..."));
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> UploadProcessor.builder()
        .uploadStore(store).handlerRegistry(registry).build());
    assertThrows(NullPointerException.class, () -> UploadProcessor.builder()
        .connectionProvider(() -> null).handlerRegistry(registry).build());
    assertThrows(NullPointerException.class, () -> UploadProcessor.builder()
        .connectionProvider(() -> null).uploadStore(store).build());
    assertThrows(IllegalArgumentException.class, () -> processorBuilder().maxRetries(0).build());
  }
}
