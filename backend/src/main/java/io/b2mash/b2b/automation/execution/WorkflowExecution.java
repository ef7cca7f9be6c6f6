package io.b2mash.b2b.automation.execution;

import io.b2mash.b2b.automation.action.ActionResult;
import io.b2mash.b2b.automation.rule.TriggerType;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One firing of one rule.
 *
 * @param id row id; null until persisted
 * @param ruleId rule that fired
 * @param triggerType event that fired it
 * @param entityId entity the event concerned
 * @param triggerContext context snapshot the conditions and actions saw
 * @param status running until every action has been attempted
 * @param startedAt when the firing began
 * @param completedAt when it reached a terminal status
 * @param errorMessage set when the firing itself failed, not when an action reported failure
 * @param actionsExecuted type of every attempted action, in order, regardless of outcome
 * @param actionResults per-action outcome, parallel to {@code actionsExecuted}
 */
public record WorkflowExecution(
    String id,
    String ruleId,
    TriggerType triggerType,
    String entityId,
    Map<String, Object> triggerContext,
    ExecutionStatus status,
    Instant startedAt,
    Instant completedAt,
    String errorMessage,
    List<String> actionsExecuted,
    List<ActionResult> actionResults) {

  public WorkflowExecution {
    triggerContext = triggerContext != null ? triggerContext : Map.of();
    actionsExecuted = actionsExecuted != null ? List.copyOf(actionsExecuted) : List.of();
    actionResults = actionResults != null ? List.copyOf(actionResults) : List.of();
  }

  public WorkflowExecution withId(String newId) {
    return new WorkflowExecution(
        newId,
        ruleId,
        triggerType,
        entityId,
        triggerContext,
        status,
        startedAt,
        completedAt,
        errorMessage,
        actionsExecuted,
        actionResults);
  }

  public WorkflowExecution finish(
      ExecutionStatus finalStatus,
      Instant finishedAt,
      String error,
      List<String> executed,
      List<ActionResult> results) {
    return new WorkflowExecution(
        id,
        ruleId,
        triggerType,
        entityId,
        triggerContext,
        finalStatus,
        startedAt,
        finishedAt,
        error,
        executed,
        results);
  }

  /** Wall-clock duration of a finished execution; null while running. */
  public Duration duration() {
    return completedAt != null && startedAt != null
        ? Duration.between(startedAt, completedAt)
        : null;
  }
}
