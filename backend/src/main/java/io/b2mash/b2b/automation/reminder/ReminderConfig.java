package io.b2mash.b2b.automation.reminder;

import java.util.List;

/**
 * How reminders for one target date are laid out and delivered. A snapshot is stored with each
 * schedule so later edits do not change reminders already planned.
 *
 * @param daysBefore one reminder this many days before the target; none when null
 * @param daysAfter one reminder this many days after the target; none when null
 * @param escalations further reminders at fixed offsets from the target
 * @param template notification template id
 * @param method delivery method, email when null
 * @param priority priority, medium when null
 */
public record ReminderConfig(
    Integer daysBefore,
    Integer daysAfter,
    List<EscalationStep> escalations,
    String template,
    DeliveryMethod method,
    ReminderPriority priority) {

  public ReminderConfig {
    escalations = escalations != null ? List.copyOf(escalations) : List.of();
    method = method != null ? method : DeliveryMethod.EMAIL;
    priority = priority != null ? priority : ReminderPriority.MEDIUM;
  }

  public static ReminderConfig daysBefore(int days, String template) {
    return new ReminderConfig(days, null, List.of(), template, DeliveryMethod.EMAIL, null);
  }

  public ReminderConfig withDaysBefore(Integer days) {
    return new ReminderConfig(days, daysAfter, escalations, template, method, priority);
  }

  public ReminderConfig withPriority(ReminderPriority newPriority) {
    return new ReminderConfig(daysBefore, daysAfter, escalations, template, method, newPriority);
  }

  /** The snapshot stored on an escalation's reminder: that step's delivery settings only. */
  public ReminderConfig forEscalation(EscalationStep step) {
    return new ReminderConfig(
        null,
        null,
        List.of(),
        step.template() != null ? step.template() : template,
        step.method() != null ? step.method() : method,
        step.priority() != null ? step.priority() : priority);
  }
}
