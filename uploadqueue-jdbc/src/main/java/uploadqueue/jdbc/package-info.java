/**
 * JDBC plumbing shared by the {@link uploadqueue.spi.UploadStore} implementations in
 * {@link uploadqueue.jdbc.store}.
 *
 * @see uploadqueue.jdbc.JdbcTemplate
 * @see uploadqueue.jdbc.DataSourceConnectionProvider
 */
package uploadqueue.jdbc;
