package uploadqueue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uploadqueue.process.PassResult;
import uploadqueue.registry.HandlerRegistry;
import uploadqueue.spi.UploadStoreException;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static uploadqueue.Uploads.T0;

class UploadQueueTest {

  private InMemoryUploadStore store;
  private RecordingMetrics metrics;
  private MutableClock clock;
  private UploadQueue queue;

  @BeforeEach
  void setUp() {
    store = new InMemoryUploadStore();
    metrics = new RecordingMetrics();
    clock = new MutableClock(T0);
    queue = UploadQueue.builder()
        .connectionProvider(() -> null)
        .uploadStore(store)
        .metrics(metrics)
        .maxRetries(2)
        .clock(clock)
        .build();
  }

  @AfterEach
  void tearDown() {
    queue.close();
  }

  @Test
  void enqueuedRecordsAreDeliveredAndRemoved() {
    List<String> delivered = new ArrayList<>();
    queue.registerHandler(UploadType.RECORD_INSERT, upload -> delivered.add((String) upload.payload().fields().get("id")))
        .registerHandler(UploadType.BINARY_UPLOAD, upload -> delivered.add(upload.binary().fileName()));

    queue.enqueue(new UploadPayload.InspectionResult(Map.of("id", "r1")));
    clock.advance(Duration.ofSeconds(1));
    queue.enqueue(new UploadPayload.Photo(Map.of()), BinaryAttachment.of(new byte[] {1}, "p1.png", null), 5);
    assertEquals(2, queue.count());

    PassResult result = queue.runOnce();

    assertEquals(new PassResult(2, 0, 0, true), result);
    assertEquals(List.of("p1.png", "r1"), delivered);
    assertEquals(0, queue.count());
  }

  @Test
  void pendingIsInProcessingOrder() {
    String low = queue.enqueue(new UploadPayload.AuditEntry(Map.of()));
    clock.advance(Duration.ofSeconds(1));
    String high = queue.enqueue(new UploadPayload.AuditEntry(Map.of()), 3);
    clock.advance(Duration.ofSeconds(1));
    String lowLater = queue.enqueue(new UploadPayload.AuditEntry(Map.of()));

    List<String> ids = queue.pending().stream().map(PendingUpload::id).toList();

    assertEquals(List.of(high, low, lowLater), ids);
  }

  @Test
  void exhaustedRecordsCanBeReArmed() {
    queue.registerHandler(UploadType.RECORD_INSERT, upload -> false);
    String id = queue.enqueue(new UploadPayload.InspectionResult(Map.of()));
    queue.runOnce();
    queue.runOnce();
    assertEquals(1, queue.exhaustedCount());
    assertEquals(1, queue.runOnce().skipped());

    assertTrue(queue.resetRetries(id));

    assertEquals(0, queue.exhaustedCount());
    PendingUpload reArmed = queue.pending().get(0);
    assertEquals(0, reArmed.retryCount());
    assertNull(reArmed.lastError());
    queue.registerHandler(UploadType.RECORD_INSERT, upload -> true);
    assertEquals(1, queue.runOnce().success());
    assertEquals(0, queue.count());
  }

  @Test
  void resetRetriesOfUnknownIdReturnsFalse() {
    assertFalse(queue.resetRetries("missing"));
  }

  @Test
  void clearDiscardsEverything() {
    queue.enqueue(new UploadPayload.AuditEntry(Map.of()));
    queue.enqueue(new UploadPayload.Signature("u1"), BinaryAttachment.of(new byte[] {1}, "s.png", null));

    assertEquals(2, queue.clear());
    assertEquals(0, queue.count());
  }

  @Test
  void progressIsForwarded() {
    queue.enqueue(new UploadPayload.AuditEntry(Map.of()));
    List<Integer> seen = new ArrayList<>();

    queue.runOnce((index, total, type) -> seen.add(index));

    assertEquals(List.of(0, 1), seen);
  }

  @Test
  void startRunsStartupPassInBackground() throws Exception {
    queue.registerHandler(UploadType.AUDIT_LOG_INSERT, upload -> true);
    queue.enqueue(new UploadPayload.AuditEntry(Map.of()));

    PassResult startup = queue.start().get(5, TimeUnit.SECONDS);

    assertEquals(1, startup.success());
    assertTrue(queue.requestPass());
    queue.stop();
    assertFalse(queue.requestPass());
  }

  @Test
  void registerHandlerNeedsDefaultRegistry() {
    HandlerRegistry custom = type -> null;
    try (UploadQueue withCustom = UploadQueue.builder()
        .connectionProvider(() -> null)
        .uploadStore(store)
        .handlerRegistry(custom)
        .build()) {
      assertSame(custom, withCustom.handlerRegistry());
      assertThrows(UnsupportedOperationException.class,
          () -> withCustom.registerHandler(UploadType.RECORD_INSERT, upload -> true));
    }
  }

  @Test
  void connectionFailureSurfacesAsStoreException() {
    try (UploadQueue broken = UploadQueue.builder()
        .connectionProvider(() -> {
          throw new SQLException("locked");
        })
        .uploadStore(store)
        .build()) {
      assertThrows(UploadStoreException.class, broken::count);
      assertThrows(UploadStoreException.class, broken::clear);
    }
  }

  @Test
  void closeClosesCloseableMetrics() {
    AtomicBoolean closed = new AtomicBoolean();
    class CloseableMetrics extends RecordingMetrics implements AutoCloseable {
      @Override
      public void close() {
        closed.set(true);
      }
    }
    UploadQueue withMetrics = UploadQueue.builder()
        .connectionProvider(() -> null)
        .uploadStore(store)
        .metrics(new CloseableMetrics())
        .build();

    withMetrics.close();

    assertTrue(closed.get());
    assertThrows(IllegalStateException.class, withMetrics::start);
  }

  @Test
  void builderCannotBeReused() {
    UploadQueue.Builder builder = UploadQueue.builder().connectionProvider(() -> null).uploadStore(store);
    builder.build().close();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void builderRequiresStoreAndConnections() {
    assertThrows(NullPointerException.class, () -> UploadQueue.builder().uploadStore(store).build());
    assertThrows(NullPointerException.class, () -> UploadQueue.builder().connectionProvider(() -> null).build());
    assertThrows(IllegalArgumentException.class,
        () -> UploadQueue.builder().connectionProvider(() -> null).uploadStore(store).maxRetries(0).build());
  }
}
