package io.b2mash.b2b.automation.reminder;

import java.util.Map;

/**
 * Published after a reminder's delivery attempt, whatever its outcome. The engine turns it into
 * one trigger of the reminder kind's trigger type.
 *
 * @param schedule the reminder as it was before the attempt
 * @param outcome {@link ReminderStatus#SENT} or {@link ReminderStatus#FAILED}
 * @param variables entity values gathered for delivery; empty when the entity could not be read
 */
public record ReminderFiredEvent(
    ReminderSchedule schedule, ReminderStatus outcome, Map<String, Object> variables) {}
