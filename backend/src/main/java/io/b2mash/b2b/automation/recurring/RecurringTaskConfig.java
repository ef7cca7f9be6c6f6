package io.b2mash.b2b.automation.recurring;

import java.time.LocalDate;

/**
 * How a recurring task repeats.
 *
 * @param frequency unit of repetition
 * @param interval number of units between occurrences, at least 1
 * @param endDate last date an occurrence may fall on, or {@code null} for no end date
 * @param maxOccurrences cap on the number of tasks created; {@code null} means {@value
 *     #DEFAULT_MAX_OCCURRENCES}
 */
public record RecurringTaskConfig(
    RecurrenceFrequency frequency, int interval, LocalDate endDate, Integer maxOccurrences) {

  public static final int DEFAULT_MAX_OCCURRENCES = 12;

  public static RecurringTaskConfig of(RecurrenceFrequency frequency, int interval) {
    return new RecurringTaskConfig(frequency, interval, null, null);
  }

  public int effectiveMaxOccurrences() {
    return maxOccurrences != null ? maxOccurrences : DEFAULT_MAX_OCCURRENCES;
  }
}
