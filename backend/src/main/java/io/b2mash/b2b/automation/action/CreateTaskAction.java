package io.b2mash.b2b.automation.action;

import java.util.Map;

/**
 * @param fields column values of the new task row (title, description, priority...)
 * @param projectId project to attach the task to; falls back to the context's {@code project_id}
 *     and then the trigger entity
 */
public record CreateTaskAction(Map<String, Object> fields, String projectId) implements Action {

  public CreateTaskAction {
    fields = fields != null ? Map.copyOf(fields) : Map.of();
  }

  @Override
  public ActionType type() {
    return ActionType.CREATE_TASK;
  }
}
