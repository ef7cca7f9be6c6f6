package io.b2mash.b2b.automation.reminder;

import io.b2mash.b2b.automation.rule.TriggerType;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** What a reminder is about. Each kind fires one trigger type when it comes due. */
public enum ReminderKind {
  PROJECT_DEADLINE(TriggerType.PROJECT_DEADLINE),
  INVOICE_PAYMENT(TriggerType.INVOICE_DUE),
  TASK_DUE(TriggerType.TASK_DUE),
  CLIENT_FOLLOWUP(TriggerType.PROJECT_MILESTONE);

  private final TriggerType triggerType;

  ReminderKind(TriggerType triggerType) {
    this.triggerType = triggerType;
  }

  public TriggerType triggerType() {
    return triggerType;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<ReminderKind> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(k -> k.name().equals(normalized)).findFirst();
  }
}
