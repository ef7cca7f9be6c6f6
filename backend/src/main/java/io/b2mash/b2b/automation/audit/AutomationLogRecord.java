package io.b2mash.b2b.automation.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the automation log, built with {@link AutomationLogBuilder}.
 *
 * @param id row id; null until persisted
 * @param action what happened, following the {@code {subject}_{verb}} convention (e.g.
 *     "invoice_payment_reminder_sent", "automation_rule_created")
 * @param entityId id of the entity the action concerned; may be empty for engine-wide actions
 * @param status "success" or "error"
 * @param details free-form structured details, serialized as JSON text
 * @param timestamp when the action happened
 */
public record AutomationLogRecord(
    String id,
    String action,
    String entityId,
    String status,
    Map<String, Object> details,
    Instant timestamp) {

  public static final String SUCCESS = "success";
  public static final String ERROR = "error";

  public boolean isSuccess() {
    return SUCCESS.equals(status);
  }
}
