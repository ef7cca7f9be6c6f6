package io.b2mash.b2b.automation.action;

/**
 * Outcome of one action within an execution.
 *
 * @param actionType type name as recorded in the execution
 * @param outcome whether the action ran, failed, or was skipped
 * @param message detail for failures and skips; null on success
 */
public record ActionResult(String actionType, Outcome outcome, String message) {

  public enum Outcome {
    SUCCEEDED,
    FAILED,
    SKIPPED
  }

  public static ActionResult succeeded(String actionType) {
    return new ActionResult(actionType, Outcome.SUCCEEDED, null);
  }

  public static ActionResult succeeded(String actionType, String message) {
    return new ActionResult(actionType, Outcome.SUCCEEDED, message);
  }

  public static ActionResult failed(String actionType, String message) {
    return new ActionResult(actionType, Outcome.FAILED, message);
  }

  public static ActionResult skipped(String actionType, String message) {
    return new ActionResult(actionType, Outcome.SKIPPED, message);
  }

  public boolean isSuccess() {
    return outcome == Outcome.SUCCEEDED;
  }
}
