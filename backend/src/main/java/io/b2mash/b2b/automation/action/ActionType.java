package io.b2mash.b2b.automation.action;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of action types a rule may run. Stored and recorded in kebab case ("update-status");
 * snake case and the legacy names are accepted on input.
 */
public enum ActionType {
  SEND_NOTIFICATION("send-notification", "send-email", "send-sms"),
  CREATE_TASK("create-task"),
  UPDATE_STATUS("update-status"),
  GENERATE_INVOICE("generate-invoice"),
  APPLY_LATE_FEE("apply-late-fee", "apply-late-payment-fee"),
  CALL_WEBHOOK("call-webhook", "webhook", "trigger-external-webhook");

  private final String wireName;
  private final List<String> legacyNames;

  ActionType(String wireName, String... legacyNames) {
    this.wireName = wireName;
    this.legacyNames = List.of(legacyNames);
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<ActionType> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return Arrays.stream(values())
        .filter(t -> t.wireName.equals(normalized) || t.legacyNames.contains(normalized))
        .findFirst();
  }
}
