package io.b2mash.b2b.automation.execution;

import io.b2mash.b2b.automation.action.ActionResult;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.store.JsonColumns;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Maps {@link WorkflowExecution} to rows of the {@code workflow_executions} collection. Rows that
 * no longer decode (malformed JSON cells, an unknown action outcome) are skipped with a warning.
 */
@Repository
public class WorkflowExecutionRepository {

  private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionRepository.class);

  private final TabularStore store;
  private final JsonColumns jsonColumns;

  public WorkflowExecutionRepository(TabularStore store, JsonColumns jsonColumns) {
    this.store = store;
    this.jsonColumns = jsonColumns;
  }

  public WorkflowExecution create(WorkflowExecution execution) {
    var row = new LinkedHashMap<String, Object>();
    row.put("rule_id", execution.ruleId());
    row.put("trigger_type", execution.triggerType().wireName());
    row.put("entity_id", execution.entityId());
    row.put("trigger_data", jsonColumns.write(execution.triggerContext()));
    row.put("status", execution.status().wireName());
    row.put("started_at", execution.startedAt().toString());
    row.put("actions_executed", jsonColumns.write(List.of()));
    return execution.withId(store.create(StoreCollections.WORKFLOW_EXECUTIONS, row));
  }

  /** Writes the terminal state. Returns false when the row no longer exists. */
  public boolean complete(WorkflowExecution execution) {
    var patch = new LinkedHashMap<String, Object>();
    patch.put("status", execution.status().wireName());
    patch.put("completed_at", execution.completedAt().toString());
    patch.put("error_message", execution.errorMessage());
    patch.put("actions_executed", jsonColumns.write(execution.actionsExecuted()));
    patch.put("action_results", jsonColumns.write(encodeResults(execution.actionResults())));
    return store.update(StoreCollections.WORKFLOW_EXECUTIONS, execution.id(), patch);
  }

  /** Minimal fallback write used when {@link #complete} itself failed. */
  public void markFailed(String id, String errorMessage, Instant at) {
    store.update(
        StoreCollections.WORKFLOW_EXECUTIONS,
        id,
        Map.of(
            "status", ExecutionStatus.FAILED.wireName(),
            "error_message", errorMessage,
            "completed_at", at.toString()));
  }

  public Optional<WorkflowExecution> findById(String id) {
    return store.findById(StoreCollections.WORKFLOW_EXECUTIONS, id).flatMap(this::toExecution);
  }

  public List<WorkflowExecution> findAll() {
    return store.readAll(StoreCollections.WORKFLOW_EXECUTIONS).stream()
        .map(this::toExecution)
        .flatMap(Optional::stream)
        .toList();
  }

  /** Executions with {@code start <= startedAt <= end}. */
  public List<WorkflowExecution> findStartedBetween(Instant start, Instant end) {
    return findAll().stream()
        .filter(e -> e.startedAt() != null)
        .filter(e -> !e.startedAt().isBefore(start) && !e.startedAt().isAfter(end))
        .toList();
  }

  public boolean delete(String id) {
    return store.delete(StoreCollections.WORKFLOW_EXECUTIONS, id);
  }

  private static List<Map<String, Object>> encodeResults(List<ActionResult> results) {
    var encoded = new ArrayList<Map<String, Object>>();
    for (ActionResult result : results) {
      var entry = new LinkedHashMap<String, Object>();
      entry.put("type", result.actionType());
      entry.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
      entry.put("success", result.isSuccess());
      entry.put("message", result.message());
      encoded.add(entry);
    }
    return encoded;
  }

  private Optional<WorkflowExecution> toExecution(Map<String, Object> row) {
    String id = RowValues.string(row, "id");
    try {
      var results = new ArrayList<ActionResult>();
      for (Object raw : jsonColumns.readList(row.get("action_results"))) {
        if (raw instanceof Map<?, ?> map) {
          Object outcome = map.get("outcome");
          results.add(
              new ActionResult(
                  String.valueOf(map.get("type")),
                  outcome != null
                      ? ActionResult.Outcome.valueOf(outcome.toString().toUpperCase(Locale.ROOT))
                      : ActionResult.Outcome.FAILED,
                  map.get("message") != null ? map.get("message").toString() : null));
        }
      }
      return Optional.of(
          new WorkflowExecution(
              id,
              RowValues.string(row, "rule_id"),
              TriggerType.fromWire(RowValues.string(row, "trigger_type")).orElse(null),
              RowValues.string(row, "entity_id"),
              jsonColumns.readMap(row.get("trigger_data")),
              ExecutionStatus.fromWire(RowValues.string(row, "status")),
              RowValues.instant(row, "started_at"),
              RowValues.instant(row, "completed_at"),
              RowValues.string(row, "error_message"),
              jsonColumns.readList(row.get("actions_executed")).stream()
                  .map(String::valueOf)
                  .toList(),
              results));
    } catch (StoreException | IllegalArgumentException e) {
      log.warn("Skipping malformed workflow execution id={}: {}", id, e.getMessage());
      return Optional.empty();
    }
  }
}
