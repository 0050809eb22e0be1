/**
 * JDBC-based {@link uploadqueue.spi.UploadStore} implementations.
 *
 * <p>{@link uploadqueue.jdbc.store.AbstractJdbcUploadStore} provides the shared SQL and row
 * mapping; subclasses supply the schema DDL for their database.
 *
 * @see uploadqueue.jdbc.store.AbstractJdbcUploadStore
 * @see uploadqueue.jdbc.store.H2UploadStore
 */
package uploadqueue.jdbc.store;
