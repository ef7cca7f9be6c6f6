package io.b2mash.b2b.automation.sweep;

import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.exception.InvalidStateException;
import io.b2mash.b2b.automation.exception.ResourceNotFoundException;
import io.b2mash.b2b.automation.reminder.ReminderConfig;
import io.b2mash.b2b.automation.reminder.ReminderKind;
import io.b2mash.b2b.automation.reminder.ReminderPriority;
import io.b2mash.b2b.automation.reminder.ReminderScheduleRepository;
import io.b2mash.b2b.automation.reminder.ReminderService;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Schedules reminders for active projects and open tasks whose deadline falls within the
 * lookahead window. An entity that already has a pending reminder of the relevant kind is skipped,
 * so repeated ticks do not duplicate reminders.
 */
@Component
public class DeadlineSweep {

  private static final Logger log = LoggerFactory.getLogger(DeadlineSweep.class);

  static final Set<String> OPEN_TASK_STATUSES = Set.of("todo", "in_progress", "in-progress");

  static final ReminderConfig PROJECT_DEADLINE_DEFAULT =
      ReminderConfig.daysBefore(1, "project_deadline_approaching")
          .withPriority(ReminderPriority.HIGH);
  static final ReminderConfig TASK_DUE_DEFAULT =
      ReminderConfig.daysBefore(1, "task_due_approaching");

  private final TabularStore store;
  private final ReminderScheduleRepository scheduleRepository;
  private final ReminderService reminderService;
  private final AutomationProperties properties;
  private final Clock clock;

  public DeadlineSweep(
      TabularStore store,
      ReminderScheduleRepository scheduleRepository,
      ReminderService reminderService,
      AutomationProperties properties,
      Clock clock) {
    this.store = store;
    this.scheduleRepository = scheduleRepository;
    this.reminderService = reminderService;
    this.properties = properties;
    this.clock = clock;
  }

  /** Returns the number of reminders created. */
  public int run() {
    LocalDate today = LocalDate.ofInstant(clock.instant(), properties.zoneId());
    LocalDate horizon = today.plusDays(properties.deadlineLookaheadDays());
    int created = 0;

    for (var project : store.readAll(StoreCollections.PROJECTS)) {
      if ("active".equalsIgnoreCase(RowValues.string(project, "status"))
          && within(RowValues.date(project, "end_date"), today, horizon)) {
        created += scheduleIfAbsent(ReminderKind.PROJECT_DEADLINE, RowValues.string(project, "id"));
      }
    }
    for (var task : store.readAll(StoreCollections.TASKS)) {
      String status = RowValues.string(task, "status");
      if (status != null
          && OPEN_TASK_STATUSES.contains(status.toLowerCase(Locale.ROOT))
          && within(RowValues.date(task, "due_date"), today, horizon)) {
        created += scheduleIfAbsent(ReminderKind.TASK_DUE, RowValues.string(task, "id"));
      }
    }
    if (created > 0) {
      log.info("Deadline sweep scheduled {} reminder(s)", created);
    }
    return created;
  }

  private int scheduleIfAbsent(ReminderKind kind, String entityId) {
    try {
      if (scheduleRepository.hasPending(kind, entityId)) {
        return 0;
      }
      var schedules =
          kind == ReminderKind.PROJECT_DEADLINE
              ? reminderService.scheduleProjectDeadlineReminder(entityId, PROJECT_DEADLINE_DEFAULT)
              : reminderService.scheduleTaskDueReminder(entityId, TASK_DUE_DEFAULT);
      return schedules.size();
    } catch (StoreException | ResourceNotFoundException | InvalidStateException e) {
      log.warn(
          "Could not schedule {} reminder for entity={}: {}",
          kind.wireName(),
          entityId,
          e.getMessage());
      return 0;
    }
  }

  private static boolean within(LocalDate date, LocalDate from, LocalDate to) {
    return date != null && !date.isBefore(from) && !date.isAfter(to);
  }
}
