package uploadqueue.spring.boot;

import uploadqueue.UploadQueue;
import uploadqueue.UploadWriter;
import uploadqueue.jdbc.DataSourceConnectionProvider;
import uploadqueue.jdbc.store.AbstractJdbcUploadStore;
import uploadqueue.jdbc.store.H2UploadStore;
import uploadqueue.network.ConnectivityTracker;
import uploadqueue.process.ExponentialBackoffRetryPolicy;
import uploadqueue.process.RetryPolicy;
import uploadqueue.registry.DefaultHandlerRegistry;
import uploadqueue.registry.HandlerRegistry;
import uploadqueue.spi.ConnectionProvider;
import uploadqueue.spi.MetricsExporter;
import uploadqueue.spi.NetworkMonitor;
import uploadqueue.spi.UploadStore;
import uploadqueue.spi.UploadStoreException;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;

/**
 * Auto-configuration for the upload queue.
 *
 * <p>Wires an {@link UploadQueue} over an H2 {@link AbstractJdbcUploadStore} on the
 * application's {@link DataSource}, registers {@link UploadHandlerFor}-annotated handler
 * beans and, unless {@code upload-queue.scheduler.auto-start=false}, starts background
 * processing with the application context.
 *
 * <p>The default {@link NetworkMonitor} is a {@link ConnectivityTracker} that starts
 * online; hosts feed it connectivity changes via {@link ConnectivityTracker#update(boolean)}
 * or declare their own {@link NetworkMonitor} bean.
 *
 * @see UploadQueueProperties
 * @see UploadQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(UploadQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(UploadQueueProperties.class)
public class UploadQueueAutoConfiguration {
  private static final Logger logger = Logger.getLogger(UploadQueueAutoConfiguration.class.getName());
  private static final String H2_URL_PREFIX = "jdbc:h2:";

  @Bean
  @ConditionalOnMissingBean(UploadStore.class)
  public AbstractJdbcUploadStore uploadStore(UploadQueueProperties props) {
    return new H2UploadStore(props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(HandlerRegistry.class)
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean(NetworkMonitor.class)
  public ConnectivityTracker networkMonitor() {
    return new ConnectivityTracker(true);
  }

  @Bean
  @ConditionalOnMissingBean
  public UploadHandlerRegistrar uploadHandlerRegistrar(
      ListableBeanFactory beanFactory,
      HandlerRegistry handlerRegistry) {
    return new UploadHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public UploadQueue uploadQueue(UploadQueueProperties props,
      ConnectionProvider connectionProvider,
      UploadStore uploadStore,
      HandlerRegistry handlerRegistry,
      NetworkMonitor networkMonitor,
      ObjectProvider<MetricsExporter> metricsProvider) {

    if (props.isInitializeSchema() && uploadStore instanceof AbstractJdbcUploadStore jdbcStore) {
      initializeSchema(connectionProvider, jdbcStore);
    }

    var builder = UploadQueue.builder()
        .connectionProvider(connectionProvider)
        .uploadStore(uploadStore)
        .handlerRegistry(handlerRegistry)
        .networkMonitor(networkMonitor)
        .retryPolicy(retryPolicy(props.getRetry()))
        .maxRetries(props.getMaxRetries())
        .intervalMs(props.getScheduler().getIntervalMs())
        .requireOnline(props.getScheduler().isRequireOnline())
        .drainTimeoutMs(props.getScheduler().getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public UploadWriter uploadWriter(UploadQueue uploadQueue) {
    return uploadQueue.writer();
  }

  @Bean
  @ConditionalOnProperty(prefix = "upload-queue.scheduler", name = "auto-start", matchIfMissing = true)
  public UploadQueueLifecycle uploadQueueLifecycle(UploadQueue uploadQueue) {
    return new UploadQueueLifecycle(uploadQueue);
  }

  private static void initializeSchema(ConnectionProvider connectionProvider, AbstractJdbcUploadStore store) {
    try (Connection conn = connectionProvider.getConnection()) {
      String url = conn.getMetaData().getURL();
      if (store instanceof H2UploadStore && (url == null || !url.startsWith(H2_URL_PREFIX))) {
        logger.warning("Skipping upload queue schema initialization: " + url
            + " is not an H2 database; create table " + store.tableName() + " with its own DDL");
        return;
      }
      store.createSchema(conn);
    } catch (SQLException e) {
      throw new UploadStoreException("Failed to initialize table " + store.tableName(), e);
    }
    logger.info("Upload queue table " + store.tableName() + " ready");
  }

  private static RetryPolicy retryPolicy(UploadQueueProperties.Retry retry) {
    if (!retry.isBackoffEnabled()) {
      return RetryPolicy.NONE;
    }
    return new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs());
  }
}
