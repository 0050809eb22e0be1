package uploadqueue.jdbc.store;

import uploadqueue.BinaryAttachment;
import uploadqueue.PendingUpload;
import uploadqueue.UploadPayload;
import uploadqueue.UploadType;
import uploadqueue.jdbc.JdbcTemplate;
import uploadqueue.jdbc.TableNames;
import uploadqueue.spi.DuplicateUploadIdException;
import uploadqueue.spi.UploadStore;
import uploadqueue.spi.UploadStoreException;
import uploadqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base JDBC upload store with standard SQL implementations.
 *
 * <p>One row per pending upload. The payload is stored as a JSON object of its
 * {@linkplain UploadPayload#fields() fields}; the binary attachment, if any, is stored
 * natively in a BLOB column next to its metadata. Times are stored as epoch milliseconds.
 *
 * <p>Every statement runs on the caller's connection in auto-commit mode, so each
 * operation is atomic per record.
 */
public abstract class AbstractJdbcUploadStore implements UploadStore {
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final String UNIQUE_VIOLATION_STATE = "23505";

  protected static final String COLUMNS = "id, upload_type, payload, binary_data, file_name, "
      + "content_type, storage_location, created_at, retry_count, priority, next_attempt_at, last_error";

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcUploadStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcUploadStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcUploadStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g. "h2").
   */
  public abstract String name();

  /**
   * Idempotent DDL statements creating the table and its indexes.
   */
  protected abstract List<String> schemaStatements();

  public String tableName() {
    return tableName;
  }

  /**
   * Creates the table if it does not exist yet.
   *
   * @param conn the JDBC connection
   */
  public void createSchema(Connection conn) {
    try (Statement st = conn.createStatement()) {
      for (String ddl : schemaStatements()) {
        st.execute(ddl);
      }
    } catch (SQLException e) {
      throw new UploadStoreException("Failed to create table " + tableName, e);
    }
  }

  @Override
  public void insertNew(Connection conn, PendingUpload upload) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    BinaryAttachment binary = upload.binary();
    try {
      JdbcTemplate.update(conn, sql,
          upload.id(),
          upload.type().name(),
          jsonCodec.toJson(upload.payload().fields()),
          binary == null ? null : binary.bytes(),
          binary == null ? null : binary.fileName(),
          binary == null ? null : binary.contentType(),
          binary == null ? null : binary.storageLocation(),
          upload.createdAt().toEpochMilli(),
          upload.retryCount(),
          upload.priority(),
          toMillis(upload.nextAttemptAt()),
          truncateError(upload.lastError()));
    } catch (UploadStoreException e) {
      if (isUniqueViolation(e.getCause())) {
        throw new DuplicateUploadIdException(upload.id(), e.getCause());
      }
      throw e;
    }
  }

  @Override
  public List<PendingUpload> selectAll(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " ORDER BY priority DESC, created_at, id";
    return JdbcTemplate.query(conn, sql, this::mapRow);
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id=?", id);
  }

  @Override
  public int updateRetryCount(Connection conn, String id, int retryCount, Instant nextAttemptAt, String lastError) {
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    String sql = "UPDATE " + tableName + " SET retry_count=?, next_attempt_at=?, last_error=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, retryCount, toMillis(nextAttemptAt), truncateError(lastError), id);
  }

  @Override
  public int count(Connection conn) {
    return JdbcTemplate.queryForInt(conn, "SELECT COUNT(*) FROM " + tableName);
  }

  @Override
  public int countExhausted(Connection conn, int maxRetries) {
    return JdbcTemplate.queryForInt(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE retry_count >= ?", maxRetries);
  }

  @Override
  public int deleteAll(Connection conn) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName);
  }

  private PendingUpload mapRow(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    try {
      UploadType type = UploadType.valueOf(rs.getString("upload_type"));
      Map<String, Object> fields = jsonCodec.parseObject(rs.getString("payload"));
      byte[] bytes = rs.getBytes("binary_data");
      BinaryAttachment binary = bytes == null ? null : new BinaryAttachment(
          bytes, rs.getString("file_name"), rs.getString("content_type"), rs.getString("storage_location"));
      long nextAttempt = rs.getLong("next_attempt_at");
      Instant nextAttemptAt = rs.wasNull() ? null : Instant.ofEpochMilli(nextAttempt);
      return new PendingUpload(
          id,
          UploadPayload.decode(type, fields),
          binary,
          Instant.ofEpochMilli(rs.getLong("created_at")),
          rs.getInt("retry_count"),
          rs.getInt("priority"),
          nextAttemptAt,
          rs.getString("last_error"));
    } catch (RuntimeException e) {
      // A row that no longer decodes aborts the snapshot instead of being dropped.
      throw new UploadStoreException("Unreadable pending upload row id=" + id, e);
    }
  }

  private static Long toMillis(Instant instant) {
    return instant == null ? null : instant.toEpochMilli();
  }

  private static boolean isUniqueViolation(Throwable cause) {
    return cause instanceof SQLIntegrityConstraintViolationException
        || (cause instanceof SQLException sql && UNIQUE_VIOLATION_STATE.equals(sql.getSQLState()));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
