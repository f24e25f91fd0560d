package reconciler.feedback;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reconciler.model.EntityType;
import reconciler.model.FeedbackKind;
import reconciler.model.IntentOp;
import reconciler.model.ReminderTrigger;
import reconciler.model.RollSpec;
import reconciler.testing.InMemoryDefinitions;
import reconciler.testing.InMemoryOutboxStore;
import reconciler.testing.InMemoryQueue;
import reconciler.testing.ReconcilerHarness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackProcessorTest {

  private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

  private final ReconcilerHarness harness = new ReconcilerHarness(NOW);

  @AfterEach
  void tearDown() {
    harness.close();
  }

  @Test
  void oneOffReminderFiresOnceThenIsRetired() throws Exception {
    Instant at = NOW.plus(Duration.ofHours(1));
    InMemoryDefinitions.ReminderRow row = harness.definitions.addReminder(1L, ReminderTrigger.OneOff.KIND);
    row.at = at;
    harness.enqueueUpsert(EntityType.REMINDER, 1L);
    harness.settle();
    assertTrue(harness.scheduler.exists("reminder-1"));
    assertEquals(at, row.nextFireAt);

    harness.advance(Duration.ofHours(1));
    harness.callbacks.fired("reminder-1", at);
    harness.settle();

    assertFalse(harness.scheduler.exists("reminder-1"));
    assertFalse(row.enabled);
    assertNull(row.nextFireAt);
  }

  @Test
  void fireReportedAfterRescheduleKeepsNewSchedule() throws Exception {
    Instant first = NOW.plus(Duration.ofHours(1));
    Instant second = NOW.plus(Duration.ofDays(1));
    InMemoryDefinitions.ReminderRow row = harness.definitions.addReminder(1L, ReminderTrigger.OneOff.KIND);
    row.at = first;
    harness.enqueueUpsert(EntityType.REMINDER, 1L);
    harness.settle();

    harness.advance(Duration.ofHours(1));
    harness.callbacks.fired("reminder-1", first);
    row.at = second;
    harness.enqueueUpsert(EntityType.REMINDER, 1L);
    harness.outboxDrainer.drainBatch();
    harness.settle();

    assertTrue(row.enabled);
    assertTrue(harness.scheduler.exists("reminder-1"));
    assertEquals(second, harness.scheduler.get("reminder-1").spec().startAt());
    assertEquals(second, row.nextFireAt);
    assertTrue(harness.inbox.pendingRows().isEmpty());
  }

  @Test
  void dueBeforeFireReportedAfterDueDateMovedKeepsNewSchedule() throws Exception {
    Instant due = NOW.plus(Duration.ofHours(2));
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = due;
    InMemoryDefinitions.ReminderRow row = harness.definitions.addReminder(4L, ReminderTrigger.TaskDueBefore.KIND);
    row.before = Duration.ofHours(1);
    row.taskId = 5L;
    harness.enqueueUpsert(EntityType.REMINDER, 4L);
    harness.settle();

    harness.advance(Duration.ofHours(1));
    harness.callbacks.fired("reminder-4", NOW.plus(Duration.ofHours(1)));
    task.dueDate = due.plus(Duration.ofDays(1));
    harness.enqueueUpsert(EntityType.REMINDER, 4L);
    harness.settle();

    assertTrue(row.enabled);
    assertEquals(NOW.plus(Duration.ofHours(1)).plus(Duration.ofDays(1)),
        harness.scheduler.get("reminder-4").spec().startAt());
  }

  @Test
  void intervalReminderRefreshesNextFireTimeAfterFire() throws Exception {
    InMemoryDefinitions.ReminderRow row = harness.definitions.addReminder(2L, ReminderTrigger.Interval.KIND);
    row.every = Duration.ofMinutes(15);
    harness.enqueueUpsert(EntityType.REMINDER, 2L);
    harness.settle();
    assertFalse(row.nextFireAt.isAfter(NOW.plus(Duration.ofHours(1))));

    harness.advance(Duration.ofMinutes(15));
    harness.callbacks.fired("reminder-2", null);
    harness.settle();

    assertTrue(row.enabled);
    assertEquals(NOW.plus(Duration.ofMinutes(30)), row.nextFireAt);
    assertTrue(harness.scheduler.exists("reminder-2"));
  }

  @Test
  void reminderOnDoneTaskIsDeletedWithoutError() {
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = NOW.plus(Duration.ofDays(1));
    task.done = true;
    InMemoryDefinitions.ReminderRow row = harness.definitions.addReminder(3L, ReminderTrigger.TaskDueBefore.KIND);
    row.before = Duration.ofHours(1);
    row.taskId = 5L;
    long id = harness.enqueueUpsert(EntityType.REMINDER, 3L);

    harness.settle();

    assertFalse(harness.scheduler.exists("reminder-3"));
    assertNotNull(harness.outbox.row(id).processedAt);
    assertNull(harness.outbox.row(id).lastError);
  }

  @Test
  void rolloverAdvancesDueDateAndResyncsDependentReminders() {
    Instant nextDue = NOW.plus(Duration.ofDays(1));
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = NOW;
    task.roll = true;
    task.rollSpec = new RollSpec.CronRoll(List.of("0 12 * * *"));
    InMemoryDefinitions.ReminderRow reminder = harness.definitions.addReminder(6L, ReminderTrigger.TaskDueBefore.KIND);
    reminder.before = Duration.ofHours(1);
    reminder.taskId = 5L;
    harness.scheduler.overrideFireTimes("task-rollover-5", List.of(nextDue));
    harness.enqueueUpsert(EntityType.TASK_ROLLOVER, 5L);

    harness.settle();

    assertEquals(nextDue, task.dueDate);
    assertTrue(harness.scheduler.exists("task-rollover-5"));
    assertEquals(nextDue.minus(Duration.ofHours(1)),
        harness.scheduler.get("reminder-6").spec().startAt());
    assertTrue(harness.outbox.pendingRows().isEmpty());
    assertTrue(harness.inbox.pendingRows().isEmpty());
  }

  @Test
  void rolloverFireAdvancesDueDate() throws Exception {
    Instant nextDue = NOW.plus(Duration.ofDays(2));
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = NOW;
    task.roll = true;
    task.rollSpec = new RollSpec.CronRoll(List.of("0 12 * * *"));
    harness.scheduler.overrideFireTimes("task-rollover-5", List.of(nextDue));
    harness.enqueueUpsert(EntityType.TASK_ROLLOVER, 5L);
    harness.settle();

    Instant later = NOW.plus(Duration.ofDays(3));
    harness.scheduler.overrideFireTimes("task-rollover-5", List.of(later));
    harness.callbacks.fired("task-rollover-5", nextDue);
    harness.settle();

    assertEquals(later, task.dueDate);
  }

  @Test
  void staleNextDueDoesNotMoveDueDateBackwards() throws Exception {
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = NOW.plus(Duration.ofDays(5));
    harness.inbox.append(null, FeedbackKind.NEXT_DUE_COMPUTED, EntityType.TASK_ROLLOVER, 5L,
        "{\"nextDueAt\":\"2025-03-11T12:00:00Z\"}", NOW);

    harness.inboxDrainer.drainBatch();

    assertEquals(NOW.plus(Duration.ofDays(5)), task.dueDate);
    assertTrue(harness.outbox.rows().isEmpty());
  }

  @Test
  void duplicateNextDueQueuesSyncsOnce() {
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = NOW;
    String payload = "{\"nextDueAt\":\"2025-03-11T12:00:00Z\"}";
    harness.inbox.append(null, FeedbackKind.NEXT_DUE_COMPUTED, EntityType.TASK_ROLLOVER, 5L, payload, NOW);
    harness.inbox.append(null, FeedbackKind.NEXT_DUE_COMPUTED, EntityType.TASK_ROLLOVER, 5L, payload, NOW);

    harness.inboxDrainer.drainBatch();

    assertEquals(Instant.parse("2025-03-11T12:00:00Z"), task.dueDate);
    assertEquals(1, harness.outbox.rows().size());
  }

  @Test
  void exhaustedReminderIsDisabledAndDeleted() {
    InMemoryDefinitions.ReminderRow row = harness.definitions.addReminder(7L, ReminderTrigger.Interval.KIND);
    row.every = Duration.ofMinutes(10);
    harness.scheduler.overrideFireTimes("reminder-7", List.of());
    harness.enqueueUpsert(EntityType.REMINDER, 7L);

    harness.settle();

    assertFalse(row.enabled);
    assertFalse(harness.scheduler.exists("reminder-7"));
    List<InMemoryQueue.Row<InMemoryOutboxStore.Intent>> intents = harness.outbox.rows();
    assertEquals(IntentOp.DELETE, intents.get(intents.size() - 1).payload.op());
  }

  @Test
  void exhaustedRolloverTurnsRollOff() throws Exception {
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.roll = true;
    task.rollSpec = new RollSpec.CronRoll(List.of("0 12 * * *"));

    harness.callbacks.exhausted("task-rollover-5");
    harness.settle();

    assertFalse(task.roll);
    assertFalse(harness.scheduler.exists("task-rollover-5"));
  }

  @Test
  void nextDueWithoutPayloadIsIgnored() {
    InMemoryDefinitions.TaskRow task = harness.definitions.addTask(5L);
    task.dueDate = NOW;
    long id = harness.inbox.append(null, FeedbackKind.NEXT_DUE_COMPUTED, EntityType.TASK_ROLLOVER, 5L, null, NOW);

    harness.inboxDrainer.drainBatch();

    assertEquals(NOW, task.dueDate);
    assertNotNull(harness.inbox.row(id).processedAt);
  }

  @Test
  void malformedPayloadIsRetried() {
    harness.definitions.addTask(5L);
    long id = harness.inbox.append(null, FeedbackKind.NEXT_DUE_COMPUTED, EntityType.TASK_ROLLOVER, 5L,
        "{\"nextDueAt\":\"tomorrow\"}", NOW);

    harness.inboxDrainer.drainBatch();

    assertNull(harness.inbox.row(id).processedAt);
    assertTrue(harness.inbox.row(id).lastError.contains("nextDueAt"));
  }

  @Test
  void callbackRejectsForeignHandle() {
    assertThrows(IllegalArgumentException.class, () -> harness.callbacks.fired("invoice-1", NOW));
  }
}
