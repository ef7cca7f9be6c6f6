package io.b2mash.b2b.automation.reminder;

/**
 * An extra reminder relative to the target date.
 *
 * @param daysOffset days after the target (negative for before)
 * @param template template for this step; the parent config's template when null
 * @param method delivery method for this step
 * @param priority priority recorded on this step's reminder
 */
public record EscalationStep(
    int daysOffset, String template, DeliveryMethod method, ReminderPriority priority) {}
