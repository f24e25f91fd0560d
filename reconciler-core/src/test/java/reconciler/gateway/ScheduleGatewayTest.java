package reconciler.gateway;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reconciler.model.EntityType;
import reconciler.schedule.IntervalSpec;
import reconciler.schedule.ScheduleDescription;
import reconciler.schedule.ScheduleHandle;
import reconciler.schedule.ScheduleSpec;
import reconciler.schedule.WorkAction;
import reconciler.spi.ScheduleNotFoundException;
import reconciler.spi.SchedulerClient;
import reconciler.spi.SchedulerException;
import reconciler.spi.SchedulerTimeoutException;
import reconciler.testing.InMemorySchedulerClient;
import reconciler.testing.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleGatewayTest {

  private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");
  private static final ScheduleHandle HANDLE = ScheduleHandle.of(EntityType.REMINDER, 42L);

  private final MutableClock clock = new MutableClock(NOW);
  private final InMemorySchedulerClient client = new InMemorySchedulerClient(clock);
  private final List<Duration> sleeps = new ArrayList<>();
  private final ScheduleGateway gateway = ScheduleGateway.builder()
      .client(client)
      .sleeper(sleeps::add)
      .build();

  @AfterEach
  void tearDown() {
    gateway.close();
  }

  private static ScheduleSpec everyMinutes(int minutes) {
    return ScheduleSpec.interval(IntervalSpec.every(Duration.ofMinutes(minutes)), "UTC", null, null);
  }

  private static WorkAction action() {
    return new WorkAction("reminder_fire", Map.of(WorkAction.ARG_HANDLE, HANDLE.id()));
  }

  @Test
  void upsertCreatesThenUpdatesInPlace() {
    gateway.upsert(HANDLE, everyMinutes(5), action());
    gateway.upsert(HANDLE, everyMinutes(10), action());

    assertEquals(2, client.creates());
    assertEquals(1, client.updates());
    assertEquals(everyMinutes(10), client.get("reminder-42").spec());
  }

  @Test
  void upsertTwiceEqualsUpsertOnce() {
    gateway.upsert(HANDLE, everyMinutes(5), action());
    InMemorySchedulerClient.Entry once = client.get("reminder-42");

    gateway.upsert(HANDLE, everyMinutes(5), action());

    assertEquals(once, client.get("reminder-42"));
    assertEquals(1, client.scheduleIds().size());
  }

  @Test
  void deleteOfAbsentHandleSucceeds() {
    assertEquals(DeleteOutcome.ALREADY_ABSENT, gateway.delete(HANDLE));

    gateway.upsert(HANDLE, everyMinutes(5), action());
    assertEquals(DeleteOutcome.DELETED, gateway.delete(HANDLE));
    assertFalse(client.exists("reminder-42"));
  }

  @Test
  void deletePropagatesOtherFailures() {
    client.failNextCall(new SchedulerException("unavailable"));

    assertThrows(SchedulerException.class, () -> gateway.delete(HANDLE));
  }

  @Test
  void recreateReplacesExistingSchedule() {
    gateway.upsert(HANDLE, everyMinutes(5), action());

    gateway.recreate(HANDLE, everyMinutes(30), action());

    assertEquals(1, client.deletes());
    assertEquals(everyMinutes(30), client.get("reminder-42").spec());
  }

  @Test
  void nextFireTimeReturnsEarliestFireTime() {
    gateway.upsert(HANDLE, everyMinutes(5), action());

    NextFireTime next = gateway.nextFireTime(HANDLE);

    assertEquals(NextFireTime.scheduled(NOW.plus(Duration.ofMinutes(5))), next);
  }

  @Test
  void nextFireTimeRetriesUntilVisible() {
    gateway.upsert(HANDLE, everyMinutes(5), action());
    client.hideFromDescribe("reminder-42", 3);

    NextFireTime next = gateway.nextFireTime(HANDLE);

    assertEquals(NextFireTime.Status.SCHEDULED, next.status());
    assertEquals(List.of(Duration.ofMillis(150), Duration.ofMillis(300), Duration.ofMillis(450)), sleeps);
  }

  @Test
  void nextFireTimeGivesUpAfterSixAttempts() {
    NextFireTime next = gateway.nextFireTime(HANDLE);

    assertEquals(NextFireTime.unknown(), next);
    assertEquals(6, client.describes());
    assertEquals(5, sleeps.size());
  }

  @Test
  void nextFireTimeReportsExhaustion() {
    gateway.upsert(HANDLE, everyMinutes(5), action());
    client.overrideFireTimes("reminder-42", List.of());

    assertEquals(NextFireTime.exhausted(), gateway.nextFireTime(HANDLE));
  }

  @Test
  void pausedScheduleWithoutFireTimesIsUnknown() {
    gateway.upsert(HANDLE, everyMinutes(5), action());
    client.overrideFireTimes("reminder-42", List.of());
    client.paused(true);

    assertEquals(NextFireTime.unknown(), gateway.nextFireTime(HANDLE));
  }

  @Test
  void slowCallTimesOut() {
    InMemorySchedulerClient slow = new InMemorySchedulerClient(clock);
    slow.callDelay(Duration.ofSeconds(2));
    try (ScheduleGateway timed = ScheduleGateway.builder()
        .client(slow)
        .callTimeout(Duration.ofMillis(100))
        .build()) {
      assertThrows(SchedulerTimeoutException.class, () -> timed.upsert(HANDLE, everyMinutes(5), action()));
    }
  }

  @Test
  void callsIgnoringInterruptsPinAtMostThePoolSize() {
    CountDownLatch release = new CountDownLatch(1);
    Set<Thread> callThreads = ConcurrentHashMap.newKeySet();
    SchedulerClient stuck = new SchedulerClient() {
      @Override
      public void createSchedule(String scheduleId, ScheduleSpec spec, WorkAction action) {
      }

      @Override
      public void updateSchedule(String scheduleId, ScheduleSpec spec, WorkAction action) {
      }

      @Override
      public void deleteSchedule(String scheduleId) {
        callThreads.add(Thread.currentThread());
        boolean released = false;
        while (!released) {
          try {
            released = release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException ignored) {
            // keeps running, like a client that does not honour interruption
          }
        }
      }

      @Override
      public ScheduleDescription describeSchedule(String scheduleId) {
        throw new ScheduleNotFoundException(scheduleId);
      }
    };
    ScheduleGateway bounded = ScheduleGateway.builder()
        .client(stuck)
        .callTimeout(Duration.ofMillis(20))
        .maxConcurrentCalls(4)
        .build();
    try {
      for (int i = 0; i < 50; i++) {
        assertThrows(SchedulerException.class, () -> bounded.delete(HANDLE));
      }
      assertTrue(callThreads.size() <= 4, "call threads: " + callThreads.size());
    } finally {
      release.countDown();
      bounded.close();
    }
  }

  @Test
  void closeClosesClient() {
    gateway.close();

    assertTrue(client.isClosed());
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> ScheduleGateway.builder().build());
    assertThrows(IllegalArgumentException.class, () ->
        ScheduleGateway.builder().client(client).describeAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () ->
        ScheduleGateway.builder().client(client).callTimeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () ->
        ScheduleGateway.builder().client(client).maxConcurrentCalls(0).build());
  }
}
