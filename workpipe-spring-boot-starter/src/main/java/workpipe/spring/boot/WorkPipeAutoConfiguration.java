package workpipe.spring.boot;

import workpipe.jdbc.DataSourceConnectionProvider;
import workpipe.jdbc.JdbcWorkQueue;
import workpipe.jdbc.ratelimit.JdbcRateLimitBackend;
import workpipe.jdbc.store.AbstractJdbcWorkStore;
import workpipe.jdbc.store.JdbcWorkStores;
import workpipe.pipeline.EventChannel;
import workpipe.pipeline.EventSink;
import workpipe.pipeline.PipelineEventListener;
import workpipe.pipeline.PipelineRunner;
import workpipe.pipeline.PipelineStage;
import workpipe.ratelimit.ExponentialBackoff;
import workpipe.ratelimit.InMemoryRateLimitBackend;
import workpipe.ratelimit.RateLimitBackend;
import workpipe.ratelimit.RateLimitConfig;
import workpipe.ratelimit.RateLimitGate;
import workpipe.ratelimit.RateLimiter;
import workpipe.spi.ConnectionProvider;
import workpipe.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Auto-configuration for workpipe.
 *
 * <p>Wires a {@link JdbcWorkQueue} and a {@link RateLimiter} from a {@link DataSource} and
 * {@link WorkPipeProperties}. When the context holds {@link PipelineStage} beans a
 * {@link PipelineRunner} is created over them, in bean order, and scheduled if
 * {@code workpipe.runner.schedule-interval} is set. A {@link PipelineEventListener} bean
 * receives progress events through an {@link EventChannel}.
 *
 * @see WorkPipeProperties
 * @see WorkPipeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcWorkQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(WorkPipeProperties.class)
public class WorkPipeAutoConfiguration {
  private static final Logger logger = Logger.getLogger(WorkPipeAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcWorkStore workStore(DataSource dataSource, WorkPipeProperties props) {
    AbstractJdbcWorkStore detected = JdbcWorkStores.detect(dataSource);
    WorkPipeProperties.Queue queue = props.getQueue();
    if (!"work_item".equals(queue.getItemTable()) || !"work_claim".equals(queue.getClaimTable())) {
      return detected.withTables(queue.getItemTable(), queue.getClaimTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcWorkQueue workQueue(ConnectionProvider connectionProvider, AbstractJdbcWorkStore workStore,
      WorkPipeProperties props) {
    return JdbcWorkQueue.builder()
        .connectionProvider(connectionProvider)
        .store(workStore)
        .ownerId(props.getQueue().getOwnerId())
        .claimExpiry(props.getQueue().getClaimExpiry())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitBackend rateLimitBackend(ConnectionProvider connectionProvider, WorkPipeProperties props) {
    WorkPipeProperties.RateLimit rateLimit = props.getRateLimit();
    if (rateLimit.getBackend() == WorkPipeProperties.Backend.MEMORY) {
      return new InMemoryRateLimitBackend();
    }
    return new JdbcRateLimitBackend(connectionProvider, rateLimit.getStateTable(),
        rateLimit.getForbiddenTable(), JdbcRateLimitBackend.DEFAULT_MAX_ATTEMPTS);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitConfig rateLimitConfig(WorkPipeProperties props) {
    WorkPipeProperties.RateLimit rateLimit = props.getRateLimit();
    return RateLimitConfig.builder()
        .baseDelay(rateLimit.getBaseDelay())
        .minDelay(rateLimit.getMinDelay())
        .maxDelay(rateLimit.getMaxDelay())
        .backoffMultiplier(rateLimit.getBackoffMultiplier())
        .recoveryMultiplier(rateLimit.getRecoveryMultiplier())
        .recoveryThreshold(rateLimit.getRecoveryThreshold())
        .forbiddenWindow(rateLimit.getForbiddenWindow())
        .forbiddenThreshold(rateLimit.getForbiddenThreshold())
        .retryAfterCap(rateLimit.getRetryAfterCap())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimiter rateLimiter(RateLimitBackend rateLimitBackend, RateLimitConfig rateLimitConfig,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return new RateLimiter(rateLimitBackend, rateLimitConfig, Clock.systemUTC(), metricsProvider.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitGate rateLimitGate(RateLimiter rateLimiter, WorkPipeProperties props) {
    WorkPipeProperties.Gate gate = props.getRateLimit().getGate();
    return RateLimitGate.builder()
        .limiter(rateLimiter)
        .maxRetries(gate.getMaxRetries())
        .backoff(new ExponentialBackoff(gate.getBackoffBaseMs(), gate.getBackoffMaxMs()))
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(PipelineEventListener.class)
  public EventChannel eventChannel(PipelineEventListener listener, WorkPipeProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return EventChannel.builder()
        .listener(listener)
        .capacity(props.getEvents().getCapacity())
        .offerTimeoutMs(props.getEvents().getOfferTimeoutMs())
        .metrics(metricsProvider.getIfAvailable())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(PipelineStage.class)
  public PipelineRunner pipelineRunner(ObjectProvider<PipelineStage> stageProvider, WorkPipeProperties props,
      ObjectProvider<EventChannel> eventChannelProvider, ObjectProvider<MetricsExporter> metricsProvider) {
    WorkPipeProperties.Runner runnerProps = props.getRunner();
    List<PipelineStage> stages = stageProvider.orderedStream().toList();
    PipelineRunner runner = PipelineRunner.builder()
        .stages(stages)
        .chunkSize(runnerProps.getChunkSize())
        .limit(runnerProps.getLimit())
        .recheckIntervalMs(runnerProps.getRecheckIntervalMs())
        .shutdownTimeoutMs(runnerProps.getShutdownTimeoutMs())
        .metrics(metricsProvider.getIfAvailable())
        .build();
    if (runnerProps.getScheduleInterval() != null) {
      EventSink sink = Objects.requireNonNullElse(eventChannelProvider.getIfAvailable(), EventSink.NOOP);
      runner.start(runnerProps.getStrategy(), sink, runnerProps.getScheduleInterval());
      logger.info("Scheduled " + runnerProps.getStrategy() + " pipeline runs over " + stages.size()
          + " stages every " + runnerProps.getScheduleInterval());
    }
    return runner;
  }
}
