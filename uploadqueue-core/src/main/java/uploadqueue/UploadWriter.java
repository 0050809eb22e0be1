package uploadqueue;

import com.github.f4b6a3.ulid.UlidCreator;
import uploadqueue.spi.ConnectionProvider;
import uploadqueue.spi.MetricsExporter;
import uploadqueue.spi.UploadStore;
import uploadqueue.spi.UploadStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for durably enqueuing uploads.
 *
 * <p>Every {@code enqueue} call persists exactly one new record with a fresh id, the
 * current time, zero retries and the given priority, then returns its id. When the call
 * returns, the record survives a process restart. A binary attachment without an
 * explicit storage location is routed to the type's default location
 * ({@value #DEFAULT_PHOTO_LOCATION} for photos, {@value #DEFAULT_SIGNATURE_LOCATION}
 * for signatures).
 *
 * @see UploadPayload
 * @see uploadqueue.spi.UploadStore
 */
public final class UploadWriter {
    private static final Logger logger = Logger.getLogger(UploadWriter.class.getName());

    public static final String DEFAULT_PHOTO_LOCATION = "inspection-photos";
    public static final String DEFAULT_SIGNATURE_LOCATION = "inspection-signatures";

    private final ConnectionProvider connectionProvider;
    private final UploadStore uploadStore;
    private final MetricsExporter metrics;
    private final Clock clock;

    /**
     * Creates a writer with no metrics and the system clock.
     *
     * @param connectionProvider source of connections to the local store
     * @param uploadStore        persistence backend for pending uploads
     */
    public UploadWriter(ConnectionProvider connectionProvider, UploadStore uploadStore) {
        this(connectionProvider, uploadStore, MetricsExporter.NOOP, Clock.systemUTC());
    }

    /**
     * Creates a writer.
     *
     * @param connectionProvider source of connections to the local store
     * @param uploadStore        persistence backend for pending uploads
     * @param metrics            metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
     * @param clock              clock stamping {@code createdAt}; {@code null} defaults to UTC system time
     */
    public UploadWriter(
            ConnectionProvider connectionProvider,
            UploadStore uploadStore,
            MetricsExporter metrics,
            Clock clock
    ) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.uploadStore = Objects.requireNonNull(uploadStore, "uploadStore");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Enqueues a record-only upload with priority 0.
     *
     * @param payload the typed payload; its type must not carry a binary
     * @return the new record id (ULID)
     * @throws IllegalArgumentException if the payload's type requires a binary
     * @throws UploadStoreException     if the record could not be persisted
     */
    public String enqueue(UploadPayload payload) {
        return enqueue(payload, null, 0);
    }

    /**
     * Enqueues a record-only upload.
     *
     * @param payload  the typed payload; its type must not carry a binary
     * @param priority processing priority; higher values go first
     * @return the new record id (ULID)
     */
    public String enqueue(UploadPayload payload, int priority) {
        return enqueue(payload, null, priority);
    }

    /**
     * Enqueues an upload with priority 0.
     *
     * @param payload the typed payload
     * @param binary  attachment, required exactly when the payload's type carries one
     * @return the new record id (ULID)
     * @throws IllegalArgumentException if the attachment does not match the payload's type
     * @throws UploadStoreException     if the record could not be persisted
     */
    public String enqueue(UploadPayload payload, BinaryAttachment binary) {
        return enqueue(payload, binary, 0);
    }

    /**
     * Enqueues an upload.
     *
     * @param payload  the typed payload
     * @param binary   attachment, required exactly when the payload's type carries one
     * @param priority processing priority; higher values go first
     * @return the new record id (ULID)
     * @throws IllegalArgumentException if the attachment does not match the payload's type
     * @throws UploadStoreException     if the record could not be persisted
     */
    public String enqueue(UploadPayload payload, BinaryAttachment binary, int priority) {
        Objects.requireNonNull(payload, "payload");
        BinaryAttachment routed = binary;
        if (routed != null && routed.storageLocation() == null) {
            routed = routed.withStorageLocation(defaultLocation(payload.type()));
        }
        // Millisecond precision so the stored and in-memory timestamps compare equal.
        Instant createdAt = Instant.ofEpochMilli(clock.millis());
        PendingUpload upload = new PendingUpload(
                UlidCreator.getMonotonicUlid().toString(),
                payload, routed, createdAt, 0, priority, null, null);

        try (Connection conn = connectionProvider.getConnection()) {
            uploadStore.insertNew(conn, upload);
        } catch (SQLException e) {
            throw new UploadStoreException("Failed to enqueue " + payload.type() + " upload", e);
        }
        metrics.incrementEnqueued();
        logger.log(Level.FINE, "Enqueued upload {0} ({1}, priority {2})",
                new Object[]{upload.id(), upload.type(), priority});
        return upload.id();
    }

    static String defaultLocation(UploadType type) {
        if (type == UploadType.SIGNATURE_UPLOAD) {
            return DEFAULT_SIGNATURE_LOCATION;
        }
        return DEFAULT_PHOTO_LOCATION;
    }
}
