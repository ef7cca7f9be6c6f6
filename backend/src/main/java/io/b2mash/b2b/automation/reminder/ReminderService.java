package io.b2mash.b2b.automation.reminder;

import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.exception.InvalidStateException;
import io.b2mash.b2b.automation.exception.ResourceNotFoundException;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Schedules reminders for a business entity by reading its target date from the store. Entity
 * dates are calendar dates; a reminder fires at the configured reminder time in the configured
 * zone.
 */
@Service
public class ReminderService {

  private final TabularStore store;
  private final ReminderScheduler reminderScheduler;
  private final AutomationProperties properties;

  public ReminderService(
      TabularStore store, ReminderScheduler reminderScheduler, AutomationProperties properties) {
    this.store = store;
    this.reminderScheduler = reminderScheduler;
    this.properties = properties;
  }

  public List<ReminderSchedule> scheduleProjectDeadlineReminder(
      String projectId, ReminderConfig config) {
    var project = require(StoreCollections.PROJECTS, "Project", projectId);
    return reminderScheduler.scheduleReminder(
        ReminderKind.PROJECT_DEADLINE,
        projectId,
        targetInstant(requireDate(project, "end_date", "Project", projectId)),
        config);
  }

  public List<ReminderSchedule> scheduleInvoicePaymentReminder(
      String invoiceId, ReminderConfig config) {
    var invoice = require(StoreCollections.INVOICES, "Invoice", invoiceId);
    return reminderScheduler.scheduleReminder(
        ReminderKind.INVOICE_PAYMENT,
        invoiceId,
        targetInstant(requireDate(invoice, "due_date", "Invoice", invoiceId)),
        config);
  }

  /**
   * The lead time is adjusted by the task's priority: one day less for high priority (never below
   * one), one day more for low. A zero or absent lead time is left as is.
   */
  public List<ReminderSchedule> scheduleTaskDueReminder(String taskId, ReminderConfig config) {
    var task = require(StoreCollections.TASKS, "Task", taskId);
    var priority = ReminderPriority.fromWire(RowValues.string(task, "priority"));
    return reminderScheduler.scheduleReminder(
        ReminderKind.TASK_DUE,
        taskId,
        targetInstant(requireDate(task, "due_date", "Task", taskId)),
        adjustForPriority(config, priority));
  }

  /** Sends a milestone follow-up to the client right away and returns its recorded schedule. */
  public ReminderSchedule scheduleClientFollowup(
      String clientId, String projectId, String milestoneType, ReminderConfig config) {
    require(StoreCollections.CLIENTS, "Client", clientId);
    require(StoreCollections.PROJECTS, "Project", projectId);
    return reminderScheduler.deliverNow(
        ReminderKind.CLIENT_FOLLOWUP, followupEntityId(clientId, projectId, milestoneType), config);
  }

  public static String followupEntityId(String clientId, String projectId, String milestoneType) {
    return clientId + ":" + projectId + ":" + milestoneType;
  }

  static ReminderConfig adjustForPriority(ReminderConfig config, ReminderPriority priority) {
    Integer daysBefore =
        config.daysBefore() != null && config.daysBefore() > 0 ? config.daysBefore() : null;
    if (daysBefore == null) {
      return config.withPriority(priority);
    }
    return switch (priority) {
      case HIGH ->
          config.withDaysBefore(Math.max(1, daysBefore - 1)).withPriority(ReminderPriority.HIGH);
      case LOW ->
          config.withDaysBefore(daysBefore + 1).withPriority(ReminderPriority.LOW);
      case MEDIUM -> config.withPriority(ReminderPriority.MEDIUM);
    };
  }

  public Instant targetInstant(LocalDate date) {
    return date.atTime(properties.reminderTime()).atZone(properties.zoneId()).toInstant();
  }

  private Map<String, Object> require(String collection, String resourceType, String id) {
    return store
        .findById(collection, id)
        .orElseThrow(() -> new ResourceNotFoundException(resourceType, id));
  }

  private static LocalDate requireDate(
      Map<String, Object> row, String column, String resourceType, String id) {
    LocalDate date = RowValues.date(row, column);
    if (date == null) {
      throw new InvalidStateException(
          "Missing " + column, resourceType + " " + id + " has no " + column + " to remind about");
    }
    return date;
  }
}
