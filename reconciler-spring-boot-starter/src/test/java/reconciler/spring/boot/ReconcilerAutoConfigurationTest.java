package reconciler.spring.boot;

import reconciler.IntentWriter;
import reconciler.Reconciler;
import reconciler.feedback.FireCallbackReceiver;
import reconciler.jdbc.DataSourceConnectionProvider;
import reconciler.jdbc.JdbcStores;
import reconciler.jdbc.dialect.H2Dialect;
import reconciler.model.EntityType;
import reconciler.spi.ConnectionProvider;
import reconciler.spi.SchedulerClient;
import reconciler.testing.InMemorySchedulerClient;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ReconcilerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          ReconcilerAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:reconciler_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema.sql",
          "reconciler.outbox.poll-interval=50ms",
          "reconciler.inbox.poll-interval=50ms");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(SchedulerConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("reconcilerStores"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("reconciler"));
      assertTrue(ctx.containsBean("intentWriter"));
      assertTrue(ctx.containsBean("fireCallbackReceiver"));

      assertInstanceOf(H2Dialect.class, ctx.getBean(JdbcStores.class).dialect());
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      Reconciler reconciler = ctx.getBean(Reconciler.class);
      assertSame(reconciler.intentWriter(), ctx.getBean(IntentWriter.class));
      assertSame(reconciler.callbackReceiver(), ctx.getBean(FireCallbackReceiver.class));
    });
  }

  @Test
  void failsFastWithoutSchedulerClient() {
    runner.run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      Throwable root = findRootCause(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, root);
      assertTrue(root.getMessage().contains("SchedulerClient"));
    });
  }

  @Test
  void disabledByProperty() {
    runner.withPropertyValues("reconciler.enabled=false").run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertFalse(ctx.containsBean("reconciler"));
      assertFalse(ctx.containsBean("reconcilerStores"));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ReconcilerAutoConfiguration.class))
        .withUserConfiguration(SchedulerConfig.class)
        .run(ctx -> assertFalse(ctx.containsBean("reconciler")));
  }

  @Test
  void customTableNames() {
    runner
        .withPropertyValues(
            "reconciler.outbox.table-name=sched_outbox",
            "reconciler.inbox.table-name=sched_inbox",
            "reconciler.enabled=true")
        .withUserConfiguration(SchedulerConfig.class)
        .run(ctx -> {
          JdbcStores stores = ctx.getBean(JdbcStores.class);
          assertEquals("sched_outbox", stores.outbox().tableName());
          assertEquals("sched_inbox", stores.inbox().tableName());
        });
  }

  @Test
  void invalidTableNameFailsStartup() {
    runner
        .withPropertyValues("reconciler.outbox.table-name=outbox; DROP TABLE tasks")
        .withUserConfiguration(SchedulerConfig.class)
        .run(ctx -> assertInstanceOf(IllegalArgumentException.class,
            findRootCause(ctx.getStartupFailure())));
  }

  @Test
  void syncsReminderWrittenThroughIntentWriter() {
    runner.withUserConfiguration(SchedulerConfig.class).run(ctx -> {
      InMemorySchedulerClient scheduler = ctx.getBean(InMemorySchedulerClient.class);
      IntentWriter intentWriter = ctx.getBean(IntentWriter.class);
      Instant at = Instant.now().plus(Duration.ofHours(1)).truncatedTo(ChronoUnit.SECONDS);

      try (Connection conn = ctx.getBean(DataSource.class).getConnection()) {
        conn.setAutoCommit(false);
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO reminders (id, kind, fire_at, tz) VALUES (?, 'one_off', ?, 'UTC')")) {
          ps.setLong(1, 1);
          ps.setTimestamp(2, Timestamp.from(at));
          ps.executeUpdate();
        }
        intentWriter.enqueueUpsert(conn, EntityType.REMINDER, 1);
        conn.commit();
      }

      long deadline = System.currentTimeMillis() + 5_000;
      while (!scheduler.exists("reminder-1") && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
      assertTrue(scheduler.exists("reminder-1"));
    });
  }

  @Test
  void closingContextClosesSchedulerClient() {
    runner.withUserConfiguration(SchedulerConfig.class).run(ctx -> {
      InMemorySchedulerClient scheduler = ctx.getBean(InMemorySchedulerClient.class);
      ctx.close();
      assertTrue(scheduler.isClosed());
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class SchedulerConfig {
    @Bean(destroyMethod = "")
    InMemorySchedulerClient schedulerClient() {
      return new InMemorySchedulerClient(Clock.systemUTC());
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
