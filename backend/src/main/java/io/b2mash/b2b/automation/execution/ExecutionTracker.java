package io.b2mash.b2b.automation.execution;

import io.b2mash.b2b.automation.action.Action;
import io.b2mash.b2b.automation.action.ActionDispatcher;
import io.b2mash.b2b.automation.action.ActionResult;
import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.rule.Rule;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.store.StoreException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs a matched rule as a recorded {@link WorkflowExecution}.
 *
 * <p>Actions are not atomic. Each one is attempted in order and its type appended to {@code
 * actionsExecuted} whatever its outcome; an action that reports failure does not stop the others.
 * The execution ends {@code FAILED} only when an exception escapes the dispatcher, and it is never
 * left {@code RUNNING}: when the final write fails, a minimal failed status is written instead and
 * the returned execution says failed.
 */
@Component
public class ExecutionTracker {

  private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

  private final WorkflowExecutionRepository executionRepository;
  private final ActionDispatcher actionDispatcher;
  private final AutomationLogService automationLogService;
  private final Clock clock;

  public ExecutionTracker(
      WorkflowExecutionRepository executionRepository,
      ActionDispatcher actionDispatcher,
      AutomationLogService automationLogService,
      Clock clock) {
    this.executionRepository = executionRepository;
    this.actionDispatcher = actionDispatcher;
    this.automationLogService = automationLogService;
    this.clock = clock;
  }

  public WorkflowExecution fire(
      Rule rule, TriggerType triggerType, String entityId, Map<String, Object> context) {
    var started =
        new WorkflowExecution(
            null,
            rule.id(),
            triggerType,
            entityId,
            new LinkedHashMap<>(context),
            ExecutionStatus.RUNNING,
            clock.instant(),
            null,
            null,
            List.of(),
            List.of());
    WorkflowExecution execution;
    try {
      execution = executionRepository.create(started);
    } catch (StoreException e) {
      log.error("Could not record execution of rule {} for entity={}", rule.id(), entityId, e);
      return started.finish(
          ExecutionStatus.FAILED,
          clock.instant(),
          "Could not record execution: " + e.getMessage(),
          List.of(),
          List.of());
    }

    var executed = new ArrayList<String>();
    var results = new ArrayList<ActionResult>();
    ExecutionStatus status = ExecutionStatus.COMPLETED;
    String error = null;
    try {
      for (Action action : rule.actions()) {
        executed.add(action.typeName());
        results.add(actionDispatcher.execute(action, context));
      }
    } catch (RuntimeException e) {
      status = ExecutionStatus.FAILED;
      error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      log.error("Execution {} of rule {} failed", execution.id(), rule.id(), e);
    }

    var finished = execution.finish(status, clock.instant(), error, executed, results);
    finished = recordOutcome(finished);
    logExecution(rule, finished);
    return finished;
  }

  private WorkflowExecution recordOutcome(WorkflowExecution finished) {
    try {
      executionRepository.complete(finished);
      return finished;
    } catch (StoreException e) {
      String message = "Could not record execution outcome: " + e.getMessage();
      log.error("Execution {} outcome was not saved", finished.id(), e);
      try {
        executionRepository.markFailed(finished.id(), message, clock.instant());
      } catch (StoreException retryFailure) {
        log.error("Execution {} remains unfinished in the store", finished.id(), retryFailure);
      }
      return finished.finish(
          ExecutionStatus.FAILED,
          finished.completedAt(),
          message,
          finished.actionsExecuted(),
          finished.actionResults());
    }
  }

  private void logExecution(Rule rule, WorkflowExecution execution) {
    var entry =
        AutomationLogBuilder.builder()
            .action("automation_rule_executed")
            .entityId(execution.entityId())
            .detail("rule_id", rule.id())
            .detail("execution_id", execution.id())
            .detail("actions_executed", execution.actionsExecuted());
    if (execution.status() == ExecutionStatus.FAILED) {
      entry.error(execution.errorMessage());
    }
    automationLogService.log(entry.build(clock));
    log.info(
        "Rule '{}' ({}) executed for entity={}: status={} actions={}",
        rule.name(),
        rule.id(),
        execution.entityId(),
        execution.status().wireName(),
        execution.actionsExecuted());
  }
}
