package workpipe.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import workpipe.micrometer.MicrometerMetricsExporter;
import workpipe.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code workpipe.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link WorkPipeAutoConfiguration} so the rate limiter, runner and event
 * channel pick the exporter up.
 */
@AutoConfiguration(before = WorkPipeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "workpipe.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WorkPipeProperties.class)
public class WorkPipeMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  @ConditionalOnBean(MeterRegistry.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, WorkPipeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
