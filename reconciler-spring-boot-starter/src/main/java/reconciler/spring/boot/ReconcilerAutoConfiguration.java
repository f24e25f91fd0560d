package reconciler.spring.boot;

import reconciler.IntentWriter;
import reconciler.Reconciler;
import reconciler.drain.ExponentialBackoffRetryPolicy;
import reconciler.feedback.FireCallbackReceiver;
import reconciler.jdbc.DataSourceConnectionProvider;
import reconciler.jdbc.JdbcStores;
import reconciler.jdbc.dialect.Dialects;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.MetricsExporter;
import reconciler.spi.SchedulerClient;
import reconciler.util.JsonCodec;

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

/**
 * Auto-configuration for the schedule reconciler.
 *
 * <p>Wires a started {@link Reconciler} from a {@link DataSource}, the application's
 * {@link SchedulerClient} bean and {@link ReconcilerProperties}. Startup fails when no
 * {@code SchedulerClient} bean is defined.
 *
 * @see ReconcilerProperties
 * @see ReconcilerMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Reconciler.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "reconciler", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ReconcilerProperties.class)
public class ReconcilerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JdbcStores reconcilerStores(DataSource dataSource, ReconcilerProperties props,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    return JdbcStores.builder(Dialects.detect(dataSource))
        .outboxTable(props.getOutbox().getTableName())
        .inboxTable(props.getInbox().getTableName())
        .reminderTable(props.getReminderTable())
        .taskTable(props.getTaskTable())
        .jsonCodec(jsonCodecProvider.getIfAvailable())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public Reconciler reconciler(ReconcilerProperties props,
      ConnectionProvider connectionProvider,
      JdbcStores stores,
      ObjectProvider<SchedulerClient> schedulerClientProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<JsonCodec> jsonCodecProvider) {

    SchedulerClient schedulerClient = schedulerClientProvider.getIfAvailable();
    if (schedulerClient == null) {
      throw new IllegalStateException(
          "No SchedulerClient bean found; define one or set reconciler.enabled=false");
    }

    var retry = props.getRetry();
    var builder = Reconciler.builder()
        .connectionProvider(connectionProvider)
        .outboxStore(stores.outbox())
        .inboxStore(stores.inbox())
        .definitionReader(stores.reader())
        .definitionWriter(stores.writer())
        .schedulerClient(schedulerClient)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            retry.getBaseDelay().toMillis(), retry.getMaxDelay().toMillis()))
        .maxAttempts(retry.getMaxAttempts())
        .sweepInterval(props.getSweep().getInterval())
        .drainTimeout(props.getDrainTimeout())
        .callTimeout(props.getGateway().getCallTimeout())
        .describeAttempts(props.getGateway().getDescribeAttempts())
        .describeBackoff(props.getGateway().getDescribeBackoff())
        .maxConcurrentCalls(props.getGateway().getMaxConcurrentCalls());
    apply(builder.outbox(), props.getOutbox());
    apply(builder.inbox(), props.getInbox());

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    JsonCodec jsonCodec = jsonCodecProvider.getIfAvailable();
    if (jsonCodec != null) {
      builder.jsonCodec(jsonCodec);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public IntentWriter intentWriter(Reconciler reconciler) {
    return reconciler.intentWriter();
  }

  @Bean
  @ConditionalOnMissingBean
  public FireCallbackReceiver fireCallbackReceiver(Reconciler reconciler) {
    return reconciler.callbackReceiver();
  }

  private static void apply(Reconciler.QueueSettings settings, ReconcilerProperties.Queue queue) {
    settings.batchSize(queue.getBatchSize())
        .concurrency(queue.getConcurrency())
        .pollInterval(queue.getPollInterval())
        .lease(queue.getLease());
  }
}
