package dailymsg.spring.boot;

import dailymsg.Generator;
import dailymsg.HistoryStore;
import dailymsg.Sender;
import dailymsg.SubscriberDirectory;
import dailymsg.delivery.DeliveryWorker;
import dailymsg.delivery.ExponentialBackoffRetryPolicy;
import dailymsg.delivery.RetryPolicy;
import dailymsg.jdbc.DataSourceConnectionProvider;
import dailymsg.jdbc.JdbcTemplate;
import dailymsg.jdbc.TableNames;
import dailymsg.jdbc.store.JdbcBucketStore;
import dailymsg.jdbc.store.JdbcDeliveryStore;
import dailymsg.jdbc.store.JdbcHistoryStore;
import dailymsg.ratelimit.BucketSpec;
import dailymsg.ratelimit.DistributedRateLimiter;
import dailymsg.ratelimit.LocalRateLimiter;
import dailymsg.ratelimit.RateLimiter;
import dailymsg.schedule.Scheduler;
import dailymsg.spi.BucketStore;
import dailymsg.spi.ConnectionProvider;
import dailymsg.spi.DeliveryStore;
import dailymsg.spi.MetricsExporter;
import dailymsg.status.DeliveryStatusService;
import dailymsg.time.TimezoneResolver;
import dailymsg.trigger.PipelineTrigger;

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
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auto-configuration for the daily message pipeline.
 *
 * <p>Wires the JDBC stores, rate limiter, {@link Scheduler} and {@link DeliveryStatusService}
 * from a {@link DataSource} and {@link DailyMsgProperties}. The {@link DeliveryWorker} is
 * created once the application supplies a {@link SubscriberDirectory}, a {@link Generator}
 * and a {@link Sender}; the {@link PipelineTrigger} additionally requires
 * {@code dailymsg.trigger.enabled=true}.
 *
 * @see DailyMsgProperties
 * @see DailyMsgMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(DeliveryWorker.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(DailyMsgProperties.class)
public class DailyMsgAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(JdbcTemplate.class)
  public JdbcTemplate dailyMsgJdbcTemplate(DailyMsgProperties props) {
    return new JdbcTemplate(Math.toIntExact(props.getQueryTimeout().toSeconds()));
  }

  @Bean
  @ConditionalOnMissingBean(DeliveryStore.class)
  public JdbcDeliveryStore deliveryStore(DailyMsgProperties props, JdbcTemplate dailyMsgJdbcTemplate) {
    return new JdbcDeliveryStore(
        TableNames.prefixed(props.getTablePrefix(), TableNames.DELIVERY_TABLE), dailyMsgJdbcTemplate);
  }

  @Bean
  @ConditionalOnMissingBean(BucketStore.class)
  public JdbcBucketStore bucketStore(DailyMsgProperties props, JdbcTemplate dailyMsgJdbcTemplate) {
    return new JdbcBucketStore(
        TableNames.prefixed(props.getTablePrefix(), TableNames.BUCKET_TABLE), dailyMsgJdbcTemplate);
  }

  @Bean
  @ConditionalOnMissingBean(HistoryStore.class)
  public JdbcHistoryStore historyStore(DailyMsgProperties props, ConnectionProvider connectionProvider,
      JdbcTemplate dailyMsgJdbcTemplate, ObjectProvider<Clock> clockProvider) {
    return new JdbcHistoryStore(connectionProvider,
        TableNames.prefixed(props.getTablePrefix(), TableNames.HISTORY_TABLE),
        props.getHistory().getRetention(),
        clock(clockProvider),
        dailyMsgJdbcTemplate);
  }

  @Bean
  @ConditionalOnMissingBean(RateLimiter.class)
  public RateLimiter rateLimiter(DailyMsgProperties props, ConnectionProvider connectionProvider,
      BucketStore bucketStore, ObjectProvider<Clock> clockProvider) {
    DailyMsgProperties.RateLimit rateLimit = props.getRateLimit();
    Map<String, BucketSpec> specs = new LinkedHashMap<>();
    rateLimit.getBuckets().forEach((name, bucket) ->
        specs.put(name, new BucketSpec(bucket.getCapacity(), bucket.getRefillPerSecond())));
    Clock clock = clock(clockProvider);
    return switch (rateLimit.getMode()) {
      case LOCAL -> new LocalRateLimiter(specs, clock);
      case DISTRIBUTED -> DistributedRateLimiter.builder()
          .connectionProvider(connectionProvider)
          .bucketStore(bucketStore)
          .buckets(specs)
          .clock(clock)
          .maxCasAttempts(rateLimit.getMaxCasAttempts())
          .build();
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public TimezoneResolver timezoneResolver() {
    return new TimezoneResolver();
  }

  @Bean
  @ConditionalOnMissingBean
  public Scheduler scheduler(ConnectionProvider connectionProvider,
      DeliveryStore deliveryStore,
      TimezoneResolver timezoneResolver,
      ObjectProvider<SubscriberDirectory> directoryProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {
    return Scheduler.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(deliveryStore)
        .subscriberDirectory(directoryProvider.getIfAvailable())
        .timezoneResolver(timezoneResolver)
        .metrics(metricsProvider.getIfAvailable())
        .clock(clock(clockProvider))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliveryStatusService deliveryStatusService(ConnectionProvider connectionProvider,
      DeliveryStore deliveryStore) {
    return new DeliveryStatusService(connectionProvider, deliveryStore);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({SubscriberDirectory.class, Generator.class, Sender.class})
  public DeliveryWorker deliveryWorker(DailyMsgProperties props,
      ConnectionProvider connectionProvider,
      DeliveryStore deliveryStore,
      SubscriberDirectory subscriberDirectory,
      Generator generator,
      Sender sender,
      HistoryStore historyStore,
      RateLimiter rateLimiter,
      ObjectProvider<RetryPolicy> retryPolicyProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {
    DailyMsgProperties.Worker worker = props.getWorker();
    RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(() -> new ExponentialBackoffRetryPolicy(
        props.getRetry().getBaseDelay().toMillis(), props.getRetry().getMaxDelay().toMillis()));
    // zero disables stale-claim recovery
    Duration claimTimeout = worker.getClaimTimeout() == null || worker.getClaimTimeout().isZero()
        ? null : worker.getClaimTimeout();
    String ownerId = worker.getOwnerId() == null || worker.getOwnerId().isBlank() ? null : worker.getOwnerId();

    return DeliveryWorker.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(deliveryStore)
        .subscriberDirectory(subscriberDirectory)
        .generator(generator)
        .sender(sender)
        .historyStore(historyStore)
        .rateLimiter(rateLimiter)
        .retryPolicy(retryPolicy)
        .maxAttempts(worker.getMaxAttempts())
        .batchSize(worker.getBatchSize())
        .workerCount(worker.getWorkerCount())
        .callTimeout(worker.getCallTimeout())
        .claimTimeout(claimTimeout)
        .maxThrottleDelay(worker.getMaxThrottleDelay())
        .historyLimit(worker.getHistoryLimit())
        .generationResource(worker.getGenerationResource())
        .sendResource(worker.getSendResource())
        .generationCost(worker.getGenerationCost())
        .ownerId(ownerId)
        .metrics(metricsProvider.getIfAvailable())
        .clock(clock(clockProvider))
        .build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean({DeliveryWorker.class, SubscriberDirectory.class})
  @ConditionalOnProperty(prefix = "dailymsg.trigger", name = "enabled", havingValue = "true")
  public PipelineTrigger pipelineTrigger(DailyMsgProperties props, Scheduler scheduler,
      DeliveryWorker deliveryWorker, ObjectProvider<Clock> clockProvider) {
    DailyMsgProperties.Trigger trigger = props.getTrigger();
    return PipelineTrigger.builder()
        .scheduler(scheduler)
        .worker(deliveryWorker)
        .tickInterval(trigger.getTickInterval())
        .scheduleAt(LocalTime.parse(trigger.getScheduleAt()))
        .clock(clock(clockProvider))
        .build();
  }

  private static Clock clock(ObjectProvider<Clock> clockProvider) {
    return clockProvider.getIfAvailable(Clock::systemUTC);
  }
}
