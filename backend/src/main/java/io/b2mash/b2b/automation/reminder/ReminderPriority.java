package io.b2mash.b2b.automation.reminder;

import java.util.Locale;

public enum ReminderPriority {
  LOW,
  MEDIUM,
  HIGH;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Lenient: task rows carry priorities such as "urgent" that map to {@link #HIGH}. */
  public static ReminderPriority fromWire(String value) {
    if (value == null || value.isBlank()) {
      return MEDIUM;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "low" -> LOW;
      case "high", "urgent" -> HIGH;
      default -> MEDIUM;
    };
  }
}
