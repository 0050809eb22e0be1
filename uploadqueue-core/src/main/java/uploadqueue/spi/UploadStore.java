package uploadqueue.spi;

import uploadqueue.PendingUpload;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Persistence contract for pending uploads: a durable key-value store addressed by
 * record id that survives process restarts.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls its
 * lifetime. Each operation must be atomic per record: after an unclean shutdown a
 * record is either fully present or absent. No cross-record consistency is required.
 * Implementations live in the {@code uploadqueue-jdbc} module.
 *
 * <p>Implementations report failures as {@link UploadStoreException}.
 *
 * @see uploadqueue.jdbc.store.AbstractJdbcUploadStore
 */
public interface UploadStore {

    /**
     * Persists a new record.
     *
     * @param conn   the JDBC connection
     * @param upload the record to persist
     * @throws DuplicateUploadIdException if a record with the same id exists
     */
    void insertNew(Connection conn, PendingUpload upload);

    /**
     * Returns a consistent snapshot of every stored record, in no guaranteed order.
     *
     * @param conn the JDBC connection
     * @return all stored records
     * @throws UploadStoreException if the store is unreadable or a row cannot be decoded
     */
    List<PendingUpload> selectAll(Connection conn);

    /**
     * Deletes a record.
     *
     * @param conn the JDBC connection
     * @param id   the record id
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, String id);

    /**
     * Records a failed attempt.
     *
     * @param conn          the JDBC connection
     * @param id            the record id
     * @param retryCount    the new retry count
     * @param nextAttemptAt earliest time for the next attempt ({@code null} for immediately)
     * @param lastError     error message from the failed attempt (may be {@code null})
     * @return the number of rows updated (0 or 1)
     */
    int updateRetryCount(Connection conn, String id, int retryCount, Instant nextAttemptAt, String lastError);

    /**
     * Counts all stored records.
     *
     * @param conn the JDBC connection
     * @return the pending record count
     */
    int count(Connection conn);

    /**
     * Counts records whose retry count reached {@code maxRetries}.
     *
     * @param conn       the JDBC connection
     * @param maxRetries the retry ceiling
     * @return the number of exhausted records
     */
    default int countExhausted(Connection conn, int maxRetries) {
        int n = 0;
        for (PendingUpload upload : selectAll(conn)) {
            if (upload.retryCount() >= maxRetries) {
                n++;
            }
        }
        return n;
    }

    /**
     * Resets a record's retry count, next attempt time and last error so it is
     * attempted again on the next pass.
     *
     * @param conn the JDBC connection
     * @param id   the record id
     * @return the number of rows updated (0 or 1)
     */
    default int resetRetries(Connection conn, String id) {
        return updateRetryCount(conn, id, 0, null, null);
    }

    /**
     * Deletes every stored record.
     *
     * @param conn the JDBC connection
     * @return the number of rows deleted
     */
    int deleteAll(Connection conn);
}
