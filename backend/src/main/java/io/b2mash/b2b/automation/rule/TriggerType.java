package io.b2mash.b2b.automation.rule;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Business events a rule can listen to. Stored in lower-case snake form ("task_completed"). */
public enum TriggerType {
  PROJECT_DEADLINE,
  INVOICE_DUE,
  TASK_DUE,
  TASK_COMPLETED,
  PROJECT_MILESTONE,
  PAYMENT_RECEIVED,
  INVOICE_OVERDUE,
  PROPOSAL_ACCEPTED,
  TIME_BASED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parses the stored form. Kebab case and upper case are accepted as well. */
  public static Optional<TriggerType> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
  }
}
