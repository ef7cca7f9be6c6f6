package io.b2mash.b2b.automation.reminder;

import java.util.Locale;

public enum ReminderStatus {
  PENDING,
  SENT,
  FAILED,
  CANCELLED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Unknown values read as {@link #FAILED} so they are never re-armed. */
  public static ReminderStatus fromWire(String value) {
    if (value == null) {
      return FAILED;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return FAILED;
    }
  }
}
