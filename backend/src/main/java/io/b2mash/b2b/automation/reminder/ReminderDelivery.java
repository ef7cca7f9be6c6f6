package io.b2mash.b2b.automation.reminder;

import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.notification.NotificationService;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Sends a due reminder. Each kind gathers its own template variables from the entity it concerns
 * and picks its recipient: the client for deadlines, payments and follow-ups, the configured admin
 * address for task reminders.
 */
@Component
public class ReminderDelivery {

  private final TabularStore store;
  private final NotificationService notificationService;
  private final AutomationLogService automationLogService;
  private final AutomationProperties properties;
  private final Clock clock;

  public ReminderDelivery(
      TabularStore store,
      NotificationService notificationService,
      AutomationLogService automationLogService,
      AutomationProperties properties,
      Clock clock) {
    this.store = store;
    this.notificationService = notificationService;
    this.automationLogService = automationLogService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Delivers the reminder on every channel of its method.
   *
   * @return the variables the reminder was rendered with
   * @throws ReminderDeliveryException when the entity is missing, no recipient is known, or no
   *     channel accepted the message
   */
  public Map<String, Object> deliver(ReminderSchedule schedule) {
    String action = schedule.kind().wireName() + "_reminder_sent";
    try {
      var variables = variablesFor(schedule);
      String recipient =
          schedule.kind() == ReminderKind.TASK_DUE
              ? properties.adminEmail()
              : (String) variables.get("client_email");
      if (recipient == null || recipient.isBlank()) {
        throw new ReminderDeliveryException("No recipient for " + describe(schedule));
      }
      var errors = new ArrayList<String>();
      for (String channel : schedule.config().method().channels()) {
        var result =
            notificationService.send(channel, recipient, schedule.config().template(), variables);
        if (!result.success()) {
          errors.add(channel + ": " + result.errorMessage());
        }
      }
      if (errors.size() == schedule.config().method().channels().size()) {
        throw new ReminderDeliveryException(String.join("; ", errors));
      }
      automationLogService.log(
          AutomationLogBuilder.builder()
              .action(action)
              .entityId(schedule.entityId())
              .detail("recipient", recipient)
              .detail("template", schedule.config().template())
              .detail("priority", schedule.config().priority().wireName())
              .build(clock));
      return variables;
    } catch (ReminderDeliveryException e) {
      automationLogService.log(
          AutomationLogBuilder.builder()
              .action(action)
              .entityId(schedule.entityId())
              .error(e)
              .build(clock));
      throw e;
    }
  }

  Map<String, Object> variablesFor(ReminderSchedule schedule) {
    return switch (schedule.kind()) {
      case PROJECT_DEADLINE -> projectDeadlineVariables(schedule.entityId());
      case INVOICE_PAYMENT -> invoicePaymentVariables(schedule.entityId());
      case TASK_DUE -> taskDueVariables(schedule.entityId());
      case CLIENT_FOLLOWUP -> clientFollowupVariables(schedule.entityId());
    };
  }

  private Map<String, Object> projectDeadlineVariables(String projectId) {
    var project = require(StoreCollections.PROJECTS, projectId);
    var variables = new LinkedHashMap<String, Object>();
    variables.put("project_id", projectId);
    putClient(variables, RowValues.string(project, "client_id"));
    variables.put("project_name", RowValues.string(project, "name"));
    LocalDate deadline = RowValues.date(project, "end_date");
    variables.put("deadline", deadline != null ? deadline.toString() : null);
    variables.put("days_remaining", daysFromToday(deadline));
    return variables;
  }

  private Map<String, Object> invoicePaymentVariables(String invoiceId) {
    var invoice = require(StoreCollections.INVOICES, invoiceId);
    var variables = new LinkedHashMap<String, Object>();
    variables.put("invoice_id", invoiceId);
    putClient(variables, RowValues.string(invoice, "client_id"));
    variables.put("invoice_number", RowValues.string(invoice, "invoice_number"));
    variables.put("amount", RowValues.decimal(invoice, "total_amount"));
    LocalDate dueDate = RowValues.date(invoice, "due_date");
    variables.put("due_date", dueDate != null ? dueDate.toString() : null);
    Long daysRemaining = daysFromToday(dueDate);
    variables.put("days_overdue", daysRemaining != null ? Math.max(0, -daysRemaining) : null);
    return variables;
  }

  private Map<String, Object> taskDueVariables(String taskId) {
    var task = require(StoreCollections.TASKS, taskId);
    var variables = new LinkedHashMap<String, Object>();
    variables.put("task_id", taskId);
    variables.put("task_title", RowValues.string(task, "title"));
    String projectId = RowValues.string(task, "project_id");
    variables.put("project_id", projectId);
    var project = store.findById(StoreCollections.PROJECTS, projectId).orElse(Map.of());
    variables.put("project_name", RowValues.string(project, "name"));
    putClient(variables, RowValues.string(project, "client_id"));
    LocalDate dueDate = RowValues.date(task, "due_date");
    variables.put("due_date", dueDate != null ? dueDate.toString() : null);
    variables.put("priority", RowValues.string(task, "priority"));
    variables.put("days_remaining", daysFromToday(dueDate));
    return variables;
  }

  /** Follow-up entity ids have the form {@code clientId:projectId:milestoneType}. */
  private Map<String, Object> clientFollowupVariables(String entityId) {
    List<String> parts = List.of(entityId.split(":", 3));
    if (parts.size() < 3) {
      throw new ReminderDeliveryException("Malformed follow-up reference " + entityId);
    }
    require(StoreCollections.CLIENTS, parts.get(0));
    var project = require(StoreCollections.PROJECTS, parts.get(1));
    var variables = new LinkedHashMap<String, Object>();
    putClient(variables, parts.get(0));
    variables.put("project_id", parts.get(1));
    variables.put("project_name", RowValues.string(project, "name"));
    variables.put("milestone_type", parts.get(2));
    variables.put("project_status", RowValues.string(project, "status"));
    variables.put("completion_percentage", RowValues.integer(project, "progress_percentage", 0));
    return variables;
  }

  private void putClient(Map<String, Object> variables, String clientId) {
    var client = store.findById(StoreCollections.CLIENTS, clientId).orElse(Map.of());
    variables.put("client_id", clientId);
    variables.put("client_name", RowValues.string(client, "name"));
    variables.put("client_email", RowValues.string(client, "email"));
  }

  private Map<String, Object> require(String collection, String id) {
    return store
        .findById(collection, id)
        .orElseThrow(
            () ->
                new ReminderDeliveryException(
                    StoreCollections.singular(collection) + " " + id + " not found"));
  }

  private Long daysFromToday(LocalDate date) {
    if (date == null) {
      return null;
    }
    return ChronoUnit.DAYS.between(LocalDate.ofInstant(clock.instant(), properties.zoneId()), date);
  }

  private static String describe(ReminderSchedule schedule) {
    return schedule.kind().wireName() + " reminder " + schedule.id();
  }
}
