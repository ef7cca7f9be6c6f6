package io.b2mash.b2b.automation.recurring;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

public enum RecurrenceFrequency {
  DAILY,
  WEEKLY,
  MONTHLY,
  QUARTERLY,
  YEARLY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Date of the {@code occurrence}-th repetition after {@code start}. Month-based steps are taken
   * from the start date so that a series starting on the 31st stays at month end instead of
   * drifting.
   */
  public LocalDate occurrence(LocalDate start, int interval, int occurrence) {
    long steps = (long) interval * occurrence;
    return switch (this) {
      case DAILY -> start.plusDays(steps);
      case WEEKLY -> start.plusWeeks(steps);
      case MONTHLY -> start.plusMonths(steps);
      case QUARTERLY -> start.plusMonths(3 * steps);
      case YEARLY -> start.plusYears(steps);
    };
  }

  public static Optional<RecurrenceFrequency> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (var frequency : values()) {
      if (frequency.wireName().equalsIgnoreCase(value.trim())) {
        return Optional.of(frequency);
      }
    }
    return Optional.empty();
  }
}
