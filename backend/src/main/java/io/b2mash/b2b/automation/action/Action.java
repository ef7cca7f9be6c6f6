package io.b2mash.b2b.automation.action;

/**
 * One step of a rule's action list. Each variant carries exactly the parameters its type needs;
 * string parameters may contain {@code {{placeholders}}} resolved against the trigger context when
 * the action runs.
 */
public sealed interface Action
    permits SendNotificationAction,
        CreateTaskAction,
        UpdateStatusAction,
        GenerateInvoiceAction,
        ApplyLateFeeAction,
        CallWebhookAction,
        UnrecognizedAction {

  /** The catalog type, or null for an {@link UnrecognizedAction}. */
  ActionType type();

  /** Name recorded in an execution's action list. */
  default String typeName() {
    return type().wireName();
  }
}
