package io.b2mash.b2b.automation.action;

/**
 * @param entityType entity to update ("project", "task", "invoice", "client")
 * @param entityId explicit id; when blank the context's {@code <entity>_id}, then the trigger
 *     entity, is used
 * @param newStatus status value written to the row
 */
public record UpdateStatusAction(String entityType, String entityId, String newStatus)
    implements Action {

  @Override
  public ActionType type() {
    return ActionType.UPDATE_STATUS;
  }
}
