package uploadqueue.jdbc.store;

import uploadqueue.util.JsonCodec;

import java.util.List;

/**
 * H2 upload store, meant for an embedded file database such as
 * {@code jdbc:h2:file:./data/uploads}.
 *
 * <p>{@link #createSchema} also runs {@code SET WRITE_DELAY 0}, a persistent database
 * setting: every commit is written to the file before the statement returns, so an
 * enqueued record survives the process being killed while the database is open. The
 * setting needs admin rights. When the schema is managed elsewhere, add
 * {@code ;WRITE_DELAY=0} to the JDBC URL instead.
 */
public final class H2UploadStore extends AbstractJdbcUploadStore {

  public H2UploadStore() {
    super();
  }

  public H2UploadStore(String tableName) {
    super(tableName);
  }

  public H2UploadStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  protected List<String> schemaStatements() {
    String table = tableName();
    return List.of(
        "SET WRITE_DELAY 0",
        "CREATE TABLE IF NOT EXISTS " + table + " (" +
            "id VARCHAR(36) PRIMARY KEY," +
            "upload_type VARCHAR(32) NOT NULL," +
            "payload CLOB," +
            "binary_data BLOB," +
            "file_name VARCHAR(512)," +
            "content_type VARCHAR(128)," +
            "storage_location VARCHAR(255)," +
            "created_at BIGINT NOT NULL," +
            "retry_count INT NOT NULL DEFAULT 0," +
            "priority INT NOT NULL DEFAULT 0," +
            "next_attempt_at BIGINT," +
            "last_error VARCHAR(4000)" +
            ")",
        "CREATE INDEX IF NOT EXISTS idx_" + table + "_order ON " + table + " (priority, created_at)");
  }
}
