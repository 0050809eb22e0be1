package uploadqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import uploadqueue.micrometer.MicrometerMetricsExporter;
import uploadqueue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code upload-queue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link UploadQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the queue.
 */
@AutoConfiguration(before = UploadQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "upload-queue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(UploadQueueProperties.class)
public class UploadQueueMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, UploadQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
