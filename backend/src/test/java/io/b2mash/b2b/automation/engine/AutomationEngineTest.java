package io.b2mash.b2b.automation.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.automation.action.CallWebhookAction;
import io.b2mash.b2b.automation.action.UpdateStatusAction;
import io.b2mash.b2b.automation.execution.ExecutionStatus;
import io.b2mash.b2b.automation.execution.WorkflowExecution;
import io.b2mash.b2b.automation.reminder.ReminderConfig;
import io.b2mash.b2b.automation.reminder.ReminderKind;
import io.b2mash.b2b.automation.reminder.ReminderStatus;
import io.b2mash.b2b.automation.rule.Condition;
import io.b2mash.b2b.automation.rule.ConditionOperator;
import io.b2mash.b2b.automation.rule.RuleDraft;
import io.b2mash.b2b.automation.rule.RuleMatcher;
import io.b2mash.b2b.automation.rule.Trigger;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.testutil.AutomationFixture;
import io.b2mash.b2b.automation.testutil.FlakyTabularStore;
import io.b2mash.b2b.automation.testutil.MutableClock;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AutomationEngineTest {

  private AutomationFixture fixture;
  private AutomationEngine engine;

  @BeforeEach
  void setUp() {
    fixture = new AutomationFixture(MutableClock.at("2025-03-01T10:00:00Z"));
    engine = fixture.engine;
    fixture.insert(
        StoreCollections.CLIENTS, Map.of("id", "c-1", "name", "Acme", "email", "ap@acme.test"));
    fixture.insert(
        StoreCollections.PROJECTS,
        Map.of("id", "p-1", "name", "Website", "client_id", "c-1", "status", "active"));
  }

  @Test
  void triggerEvent_firesMatchingRuleOnce() {
    engine.createRule(
        new RuleDraft(
            "Close project",
            null,
            Trigger.of(TriggerType.TASK_COMPLETED),
            List.of(),
            List.of(new UpdateStatusAction("project", "{{project_id}}", "completed")),
            true));

    var executions =
        engine.triggerEvent(TriggerType.TASK_COMPLETED, "t-1", Map.of("project_id", "p-1"));

    assertThat(executions)
        .singleElement()
        .satisfies(
            execution -> {
              assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
              assertThat(execution.actionsExecuted()).containsExactly("update-status");
              assertThat(execution.triggerContext())
                  .containsEntry("entity_id", "t-1")
                  .containsEntry("trigger_type", "task_completed");
            });
    assertThat(fixture.executionRepository.findAll()).hasSize(1);
    assertThat(fixture.row(StoreCollections.PROJECTS, "p-1")).containsEntry("status", "completed");
  }

  @Test
  void triggerEvent_ignoresRulesOfOtherTriggersAndInactiveRules() {
    var inactive =
        engine.createRule(
            new RuleDraft(
                "Inactive",
                null,
                Trigger.of(TriggerType.TASK_COMPLETED),
                List.of(),
                List.of(new UpdateStatusAction("project", "p-1", "on_hold")),
                false));
    engine.createRule(
        new RuleDraft(
            "Other trigger",
            null,
            Trigger.of(TriggerType.PAYMENT_RECEIVED),
            List.of(),
            List.of(new UpdateStatusAction("project", "p-1", "on_hold")),
            true));

    assertThat(engine.triggerEvent(TriggerType.TASK_COMPLETED, "t-1", Map.of())).isEmpty();
    assertThat(inactive.active()).isFalse();
    assertThat(fixture.row(StoreCollections.PROJECTS, "p-1")).containsEntry("status", "active");
  }

  @Test
  void triggerEvent_neverThrowsWhenMatchingFails() {
    var matcher = mock(RuleMatcher.class);
    when(matcher.match(any(TriggerType.class), anyMap()))
        .thenThrow(new IllegalStateException("store offline"));
    var broken =
        new AutomationEngine(
            matcher,
            fixture.ruleService,
            fixture.executionTracker,
            fixture.analyticsService,
            fixture.reminderScheduler,
            fixture.logService,
            fixture.store,
            fixture.properties,
            fixture.clock);

    assertThatCode(() -> broken.triggerEvent(TriggerType.TASK_COMPLETED, "t-1", null))
        .doesNotThrowAnyException();
    assertThat(broken.triggerEvent(TriggerType.TASK_COMPLETED, "t-1", null)).isEmpty();
  }

  @Test
  void triggerEvent_nonFiniteContextValue_onlyFailsTheGuardedRule() {
    engine.createRule(
        new RuleDraft(
            "Always notify",
            null,
            Trigger.of(TriggerType.TASK_COMPLETED),
            List.of(),
            List.of(new CallWebhookAction("https://hooks.example.test/tasks", Map.of())),
            true));
    engine.createRule(
        new RuleDraft(
            "Ratio guard",
            null,
            Trigger.of(TriggerType.TASK_COMPLETED),
            List.of(Condition.of("ratio", ConditionOperator.GREATER_THAN, 1)),
            List.of(new CallWebhookAction("https://hooks.example.test/ratio", Map.of())),
            true));

    var executions =
        engine.triggerEvent(
            TriggerType.TASK_COMPLETED, "t-1", Map.of("ratio", Double.POSITIVE_INFINITY));

    assertThat(executions)
        .singleElement()
        .extracting(WorkflowExecution::status)
        .isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(fixture.webhooks.calls())
        .singleElement()
        .satisfies(call -> assertThat(call.url()).isEqualTo("https://hooks.example.test/tasks"));
  }

  @Test
  void triggerEvent_withoutTriggerType_returnsEmpty() {
    assertThatCode(() -> engine.triggerEvent(null, "x", Map.of())).doesNotThrowAnyException();
    assertThat(engine.triggerEvent(null, "x", Map.of())).isEmpty();
    assertThat(fixture.executionRepository.findAll()).isEmpty();
  }

  @Test
  void start_whenReminderStoreFails_staysStoppedAndCanStartLater() {
    var store = new FlakyTabularStore();
    var flaky = new AutomationFixture(MutableClock.at("2025-03-01T10:00:00Z"), store);
    store.failOn(StoreCollections.REMINDER_SCHEDULES);

    assertThatThrownBy(flaky.engine::start).isInstanceOf(StoreException.class);
    assertThat(flaky.engine.isRunning()).isFalse();
    assertThat(flaky.reminderScheduler.isRunning()).isFalse();

    store.recover();
    flaky.engine.start();

    assertThat(flaky.engine.isRunning()).isTrue();
    assertThat(flaky.reminderScheduler.isRunning()).isTrue();
  }

  @Test
  void onTaskCompleted_lastOpenTask_completesProjectAndFiresMilestone() {
    engine.createRule(
        new RuleDraft(
            "Announce completion",
            null,
            Trigger.of(TriggerType.PROJECT_MILESTONE),
            List.of(
                Condition.of("milestone_type", ConditionOperator.EQUALS, "project_completed")),
            List.of(new CallWebhookAction("https://hooks.example.test/{{project_id}}", Map.of())),
            true));
    fixture.insert(
        StoreCollections.TASKS,
        Map.of("id", "t-1", "project_id", "p-1", "title", "Design", "status", "completed"));
    fixture.insert(
        StoreCollections.TASKS,
        Map.of("id", "t-2", "project_id", "p-1", "title", "Build", "status", "done"));

    var executions = engine.onTaskCompleted("t-2");

    assertThat(executions)
        .extracting(WorkflowExecution::triggerType)
        .containsExactly(TriggerType.PROJECT_MILESTONE);
    var project = fixture.row(StoreCollections.PROJECTS, "p-1");
    assertThat(RowValues.string(project, "status")).isEqualTo("completed");
    assertThat(RowValues.integer(project, "progress_percentage", 0)).isEqualTo(100);
    assertThat(fixture.webhooks.calls())
        .singleElement()
        .satisfies(call -> assertThat(call.url()).isEqualTo("https://hooks.example.test/p-1"));
  }

  @Test
  void onTaskCompleted_withOpenTasksLeft_leavesProjectActive() {
    fixture.insert(
        StoreCollections.TASKS,
        Map.of("id", "t-1", "project_id", "p-1", "title", "Design", "status", "completed"));
    fixture.insert(
        StoreCollections.TASKS,
        Map.of("id", "t-2", "project_id", "p-1", "title", "Build", "status", "in_progress"));

    engine.onTaskCompleted("t-1");

    assertThat(fixture.row(StoreCollections.PROJECTS, "p-1")).containsEntry("status", "active");
  }

  @Test
  void onTaskCompleted_unknownTask_returnsEmpty() {
    assertThat(engine.onTaskCompleted("missing")).isEmpty();
  }

  @Test
  void onPaymentReceived_thanksClientAndCancelsPaymentReminders() {
    fixture.seedDefaults();
    fixture.insert(
        StoreCollections.INVOICES,
        Map.of(
            "id", "inv-1",
            "client_id", "c-1",
            "invoice_number", "INV-7",
            "total_amount", "500.00",
            "due_date", "2025-03-10"));
    engine.start();
    fixture.reminderService.scheduleInvoicePaymentReminder(
        "inv-1", ReminderConfig.daysBefore(3, "invoice_payment_reminder"));
    assertThat(fixture.timers.liveCount()).isEqualTo(1);

    var executions = engine.onPaymentReceived("inv-1", new BigDecimal("500.00"), Map.of());

    assertThat(executions)
        .singleElement()
        .satisfies(e -> assertThat(e.actionsExecuted()).containsExactly("send-notification"));
    assertThat(fixture.email.deliveries())
        .singleElement()
        .satisfies(delivery -> assertThat(delivery.recipient()).isEqualTo("ap@acme.test"));
    assertThat(fixture.scheduleRepository.findAll())
        .singleElement()
        .satisfies(schedule -> assertThat(schedule.status()).isEqualTo(ReminderStatus.CANCELLED));
    assertThat(fixture.scheduleRepository.hasPending(ReminderKind.INVOICE_PAYMENT, "inv-1"))
        .isFalse();
    assertThat(fixture.timers.liveCount()).isZero();
  }

  @Test
  void startAndStop_areIdempotent() {
    fixture.insert(
        StoreCollections.PROJECTS,
        Map.of("id", "p-2", "client_id", "c-1", "status", "active", "end_date", "2025-03-20"));
    fixture.reminderService.scheduleProjectDeadlineReminder(
        "p-2", ReminderConfig.daysBefore(2, "project_deadline_approaching"));
    assertThat(fixture.timers.liveCount()).isZero();

    engine.start();
    engine.start();

    assertThat(engine.isRunning()).isTrue();
    assertThat(fixture.timers.liveCount()).isEqualTo(1);

    engine.stop();
    engine.stop();

    assertThat(engine.isRunning()).isFalse();
    assertThat(fixture.timers.liveCount()).isZero();
    assertThat(fixture.scheduleRepository.findPending()).hasSize(1);
  }

  @Test
  void engines_overSeparateStores_areIndependent() {
    var other = new AutomationFixture(MutableClock.at("2025-03-01T10:00:00Z"));
    engine.createRule(
        new RuleDraft(
            "Close project",
            null,
            Trigger.of(TriggerType.TASK_COMPLETED),
            List.of(),
            List.of(new UpdateStatusAction("project", "p-1", "completed")),
            true));

    assertThat(other.engine.triggerEvent(TriggerType.TASK_COMPLETED, "t-1", Map.of())).isEmpty();
    assertThat(other.engine.listRules()).isEmpty();
    assertThat(engine.listRules()).hasSize(1);
  }
}
