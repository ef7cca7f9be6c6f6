package io.b2mash.b2b.automation.reminder;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes reminder dates for a target: {@code target - daysBefore}, {@code target + daysAfter},
 * then {@code target + offset} for each escalation step in order. Dates not strictly after {@code
 * now} are dropped. Day arithmetic is calendar-based in the target's zone, so a reminder keeps its
 * local time of day across DST changes.
 */
public final class ReminderDateCalculator {

  private ReminderDateCalculator() {}

  public static List<PlannedReminder> calculate(
      ZonedDateTime target, ReminderConfig config, Instant now) {
    var planned = new ArrayList<PlannedReminder>();
    if (config.daysBefore() != null) {
      planned.add(new PlannedReminder(target.minusDays(config.daysBefore()).toInstant(), config));
    }
    if (config.daysAfter() != null) {
      planned.add(new PlannedReminder(target.plusDays(config.daysAfter()).toInstant(), config));
    }
    for (EscalationStep step : config.escalations()) {
      planned.add(
          new PlannedReminder(
              target.plusDays(step.daysOffset()).toInstant(), config.forEscalation(step)));
    }
    planned.removeIf(reminder -> !reminder.scheduledAt().isAfter(now));
    return planned;
  }
}
