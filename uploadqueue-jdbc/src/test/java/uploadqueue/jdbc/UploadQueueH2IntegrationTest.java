package uploadqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uploadqueue.BinaryAttachment;
import uploadqueue.PendingUpload;
import uploadqueue.UploadPayload;
import uploadqueue.UploadQueue;
import uploadqueue.UploadType;
import uploadqueue.jdbc.store.H2UploadStore;
import uploadqueue.network.ConnectivityTracker;
import uploadqueue.process.ExponentialBackoffRetryPolicy;
import uploadqueue.process.PassResult;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UploadQueueH2IntegrationTest {

  private JdbcDataSource dataSource;
  private ConnectivityTracker connectivity;
  private UploadQueue queue;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    H2UploadStore store = new H2UploadStore();
    try (Connection conn = dataSource.getConnection()) {
      store.createSchema(conn);
    }
    connectivity = new ConnectivityTracker(false);
    queue = UploadQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .uploadStore(store)
        .networkMonitor(connectivity)
        .intervalMs(60_000)
        .build();
  }

  @AfterEach
  void tearDown() {
    queue.close();
  }

  @Test
  void offlineCaptureIsUploadedOnReconnect() throws Exception {
    CountDownLatch uploaded = new CountDownLatch(3);
    queue.registerHandler(UploadType.BINARY_UPLOAD, upload -> {
      uploaded.countDown();
      return true;
    }).registerHandler(UploadType.RESULT_PHOTO_INSERT, upload -> {
      uploaded.countDown();
      return true;
    }).registerHandler(UploadType.SIGNATURE_UPLOAD, upload -> {
      uploaded.countDown();
      return true;
    });

    queue.start().get(5, TimeUnit.SECONDS);

    queue.enqueue(new UploadPayload.Photo(Map.of("inspection_id", "3")),
        BinaryAttachment.of(new byte[] {1, 2}, "3-1.png", null));
    queue.enqueue(new UploadPayload.ResultPhoto(Map.of("result_id", "3", "photo", "3-1.png")));
    queue.enqueue(new UploadPayload.Signature("inspector-4"),
        BinaryAttachment.of(new byte[] {3}, "inspector-4.png", "image/png"));
    assertEquals(3, queue.count());

    connectivity.update(true);

    assertTrue(uploaded.await(5, TimeUnit.SECONDS));
    long deadline = System.currentTimeMillis() + 5000;
    while (queue.count() > 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(0, queue.count());
  }

  @Test
  void failedRecordKeepsItsPlaceAndError() {
    queue.registerHandler(UploadType.RECORD_INSERT, upload -> {
      throw new IOException("connection reset");
    });
    String id = queue.enqueue(new UploadPayload.InspectionResult(Map.of("inspection_id", "3")));

    PassResult result = queue.runOnce();

    assertEquals(1, result.failed());
    PendingUpload kept = queue.pending().get(0);
    assertEquals(id, kept.id());
    assertEquals(1, kept.retryCount());
    assertNull(kept.nextAttemptAt());
    assertEquals("IOException: connection reset", kept.lastError());
  }

  @Test
  void backoffPersistsNextAttemptTime() throws SQLException {
    H2UploadStore store = new H2UploadStore("backoff_uploads");
    try (Connection conn = dataSource.getConnection()) {
      store.createSchema(conn);
    }
    try (UploadQueue withBackoff = UploadQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .uploadStore(store)
        .retryPolicy(new ExponentialBackoffRetryPolicy(60_000, 600_000))
        .build()) {
      withBackoff.registerHandler(UploadType.AUDIT_LOG_INSERT, upload -> false);
      withBackoff.enqueue(new UploadPayload.AuditEntry(Map.of("action", "sync")));

      assertEquals(1, withBackoff.runOnce().failed());
      PendingUpload deferred = withBackoff.pending().get(0);
      assertNotNull(deferred.nextAttemptAt());

      PassResult again = withBackoff.runOnce();
      assertEquals(List.of(0, 0, 1), List.of(again.success(), again.failed(), again.skipped()));
    }
  }
}
