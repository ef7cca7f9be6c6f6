package io.b2mash.b2b.automation.audit;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder that constructs an {@link AutomationLogRecord}.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * logService.log(
 *     AutomationLogBuilder.builder()
 *         .action("project_deadline_reminder_sent")
 *         .entityId(projectId)
 *         .detail("days_remaining", 3)
 *         .build(clock));
 * }</pre>
 *
 * Status defaults to success; {@link #error(Throwable)} flips it and records the message.
 */
public class AutomationLogBuilder {

  private String action;
  private String entityId = "";
  private String status = AutomationLogRecord.SUCCESS;
  private final Map<String, Object> details = new LinkedHashMap<>();

  private AutomationLogBuilder() {}

  public static AutomationLogBuilder builder() {
    return new AutomationLogBuilder();
  }

  public AutomationLogBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AutomationLogBuilder entityId(String entityId) {
    this.entityId = entityId != null ? entityId : "";
    return this;
  }

  public AutomationLogBuilder detail(String key, Object value) {
    if (value != null) {
      details.put(key, value);
    }
    return this;
  }

  public AutomationLogBuilder details(Map<String, Object> values) {
    if (values != null) {
      values.forEach(this::detail);
    }
    return this;
  }

  public AutomationLogBuilder error(String message) {
    this.status = AutomationLogRecord.ERROR;
    details.put("error", message != null ? message : "Unknown error");
    return this;
  }

  public AutomationLogBuilder error(Throwable cause) {
    return error(cause.getMessage());
  }

  public AutomationLogRecord build(Clock clock) {
    if (action == null || action.isBlank()) {
      throw new IllegalStateException("Automation log action is required");
    }
    return new AutomationLogRecord(
        null, action, entityId, status, Map.copyOf(details), clock.instant());
  }
}
