package uploadqueue;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted upload awaiting delivery, as read from the {@linkplain uploadqueue.spi.UploadStore store}.
 *
 * <p>Created once by the {@link UploadWriter}; afterwards only the processor changes
 * it (retry count, next attempt time, last error) and only the processor deletes it,
 * after its handler confirmed delivery.
 *
 * @param id            unique identifier (monotonic ULID)
 * @param payload       typed payload; determines {@link #type()}
 * @param binary        attachment for binary-carrying types, otherwise {@code null}
 * @param createdAt     enqueue time
 * @param retryCount    failed attempts so far, never negative
 * @param priority      higher values are processed first
 * @param nextAttemptAt earliest retry time, or {@code null} when eligible immediately
 * @param lastError     message from the most recent failed attempt, or {@code null}
 */
public record PendingUpload(
    String id,
    UploadPayload payload,
    BinaryAttachment binary,
    Instant createdAt,
    int retryCount,
    int priority,
    Instant nextAttemptAt,
    String lastError
) {

  public PendingUpload {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    if (payload.type().carriesBinary() && binary == null) {
      throw new IllegalArgumentException(payload.type() + " requires a binary attachment");
    }
    if (!payload.type().carriesBinary() && binary != null) {
      throw new IllegalArgumentException(payload.type() + " cannot carry a binary attachment");
    }
  }

  public UploadType type() {
    return payload.type();
  }

  /**
   * Returns {@code true} if this record may be attempted at {@code now}.
   *
   * @param now the current time
   * @return whether the retry delay, if any, has elapsed
   */
  public boolean isEligibleAt(Instant now) {
    return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
  }

  @Override
  public String toString() {
    return "PendingUpload{id=" + id + ", type=" + type() + ", priority=" + priority
        + ", retryCount=" + retryCount + ", createdAt=" + createdAt + '}';
  }
}
