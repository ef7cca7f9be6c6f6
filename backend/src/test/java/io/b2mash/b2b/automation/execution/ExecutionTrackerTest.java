package io.b2mash.b2b.automation.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.automation.action.Action;
import io.b2mash.b2b.automation.action.ActionDispatcher;
import io.b2mash.b2b.automation.action.ActionResult;
import io.b2mash.b2b.automation.action.ActionResult.Outcome;
import io.b2mash.b2b.automation.action.UnrecognizedAction;
import io.b2mash.b2b.automation.action.UpdateStatusAction;
import io.b2mash.b2b.automation.rule.Rule;
import io.b2mash.b2b.automation.rule.Trigger;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.testutil.AutomationFixture;
import io.b2mash.b2b.automation.testutil.MutableClock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutionTrackerTest {

  private AutomationFixture fixture;

  @BeforeEach
  void setUp() {
    fixture = new AutomationFixture(MutableClock.at("2025-03-01T10:00:00Z"));
    fixture.insert(StoreCollections.PROJECTS, Map.of("id", "p-1", "status", "active"));
  }

  @Test
  void fire_recordsEveryAttemptedActionAndCompletes() {
    var rule =
        rule(
            new UnrecognizedAction("launch_rocket", Map.of()),
            new UpdateStatusAction("project", "p-404", "completed"),
            new UpdateStatusAction("project", "p-1", "completed"));

    var execution =
        fixture.executionTracker.fire(
            rule, TriggerType.TASK_COMPLETED, "t-1", Map.of("project_id", "p-1"));

    assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(execution.actionsExecuted())
        .containsExactly("launch_rocket", "update-status", "update-status");
    assertThat(execution.actionResults())
        .extracting(ActionResult::outcome)
        .containsExactly(Outcome.SKIPPED, Outcome.FAILED, Outcome.SUCCEEDED);
    assertThat(execution.completedAt()).isNotNull();
    assertThat(fixture.executionRepository.findById(execution.id()))
        .get()
        .extracting(WorkflowExecution::status)
        .isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(fixture.row(StoreCollections.PROJECTS, "p-1")).containsEntry("status", "completed");
  }

  @Test
  void fire_unexpectedFailure_endsFailedAndIsNeverLeftRunning() {
    var dispatcher = mock(ActionDispatcher.class);
    when(dispatcher.execute(any(Action.class), anyMap()))
        .thenThrow(new IllegalStateException("boom"));
    var tracker =
        new ExecutionTracker(
            fixture.executionRepository, dispatcher, fixture.logService, fixture.clock);

    var execution =
        tracker.fire(
            rule(new UpdateStatusAction("project", "p-1", "completed")),
            TriggerType.TASK_COMPLETED,
            "t-1",
            Map.of());

    assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(execution.errorMessage()).isEqualTo("boom");
    assertThat(execution.actionsExecuted()).containsExactly("update-status");
    assertThat(fixture.executionRepository.findAll())
        .singleElement()
        .satisfies(
            stored -> {
              assertThat(stored.status()).isEqualTo(ExecutionStatus.FAILED);
              assertThat(stored.errorMessage()).isEqualTo("boom");
            });
  }

  @Test
  void fire_writesExecutionLogEntry() {
    var execution =
        fixture.executionTracker.fire(
            rule(new UpdateStatusAction("project", "p-1", "on_hold")),
            TriggerType.PROJECT_MILESTONE,
            "p-1",
            Map.of());

    assertThat(fixture.logService.findBetween(fixture.clock.instant(), fixture.clock.instant()))
        .filteredOn(entry -> "automation_rule_executed".equals(entry.action()))
        .singleElement()
        .satisfies(
            entry -> assertThat(entry.details()).containsEntry("execution_id", execution.id()));
  }

  private Rule rule(Action... actions) {
    return new Rule(
        "rule-1",
        "Close project",
        null,
        Trigger.of(TriggerType.TASK_COMPLETED),
        List.of(),
        List.of(actions),
        true,
        fixture.clock.instant(),
        fixture.clock.instant());
  }
}
