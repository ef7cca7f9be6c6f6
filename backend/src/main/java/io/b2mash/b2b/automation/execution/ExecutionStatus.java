package io.b2mash.b2b.automation.execution;

import java.util.Locale;

public enum ExecutionStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static ExecutionStatus fromWire(String value) {
    if (value == null) {
      return PENDING;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return PENDING;
    }
  }
}
