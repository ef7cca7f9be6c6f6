package io.b2mash.b2b.automation.engine;

import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.execution.AutomationAnalytics;
import io.b2mash.b2b.automation.execution.ExecutionAnalyticsService;
import io.b2mash.b2b.automation.execution.ExecutionTracker;
import io.b2mash.b2b.automation.execution.WorkflowExecution;
import io.b2mash.b2b.automation.reminder.ReminderConfig;
import io.b2mash.b2b.automation.reminder.ReminderFiredEvent;
import io.b2mash.b2b.automation.reminder.ReminderKind;
import io.b2mash.b2b.automation.reminder.ReminderSchedule;
import io.b2mash.b2b.automation.reminder.ReminderScheduler;
import io.b2mash.b2b.automation.rule.Rule;
import io.b2mash.b2b.automation.rule.RuleDraft;
import io.b2mash.b2b.automation.rule.RuleMatcher;
import io.b2mash.b2b.automation.rule.RuleService;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.TabularStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Entry point for the host application.
 *
 * <p>{@link #triggerEvent} is the single ingress for business events: it matches the active rules
 * and runs each as a recorded execution. The {@code on*} methods build the context for common
 * events from the store before delegating to it. None of these throw; failures end up in the SLF4J
 * log, the automation log, or a failed execution.
 *
 * <p>The engine is an ordinary bean. Nothing about it is process-global, so tests can build
 * several independent instances over separate stores.
 */
@Service
public class AutomationEngine {

  private static final Logger log = LoggerFactory.getLogger(AutomationEngine.class);

  private static final Set<String> COMPLETED_TASK_STATUSES = Set.of("completed", "done");

  private final RuleMatcher ruleMatcher;
  private final RuleService ruleService;
  private final ExecutionTracker executionTracker;
  private final ExecutionAnalyticsService analyticsService;
  private final ReminderScheduler reminderScheduler;
  private final AutomationLogService automationLogService;
  private final TabularStore store;
  private final AutomationProperties properties;
  private final Clock clock;

  private volatile boolean running;

  public AutomationEngine(
      RuleMatcher ruleMatcher,
      RuleService ruleService,
      ExecutionTracker executionTracker,
      ExecutionAnalyticsService analyticsService,
      ReminderScheduler reminderScheduler,
      AutomationLogService automationLogService,
      TabularStore store,
      AutomationProperties properties,
      Clock clock) {
    this.ruleMatcher = ruleMatcher;
    this.ruleService = ruleService;
    this.executionTracker = executionTracker;
    this.analyticsService = analyticsService;
    this.reminderScheduler = reminderScheduler;
    this.automationLogService = automationLogService;
    this.store = store;
    this.properties = properties;
    this.clock = clock;
  }

  // --- Lifecycle ---

  /**
   * Re-arms pending reminders and enables the periodic sweeps. Idempotent. If recovery fails the
   * reminder scheduler is stopped again, the engine stays stopped and the failure propagates.
   */
  public synchronized void start() {
    if (running) {
      return;
    }
    log.info("Starting automation engine");
    ReminderScheduler.Recovery recovery;
    try {
      recovery = reminderScheduler.recover();
    } catch (RuntimeException e) {
      reminderScheduler.stop();
      throw e;
    }
    running = true;
    log.info(
        "Automation engine started: {} reminder(s) re-armed, {} past due left pending",
        recovery.rearmed(),
        recovery.pastDue());
  }

  /** Cancels all reminder timers and disables the sweeps. Pending rows stay pending. */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    reminderScheduler.stop();
    log.info("Automation engine stopped");
  }

  public boolean isRunning() {
    return running;
  }

  // --- Event ingress ---

  /**
   * Fires every active rule of the trigger type whose conditions hold for the context. The context
   * is copied and given {@code entity_id} and {@code trigger_type} entries unless it already has
   * them.
   *
   * @return the executions produced, in rule order; empty when the trigger type is missing, nothing
   *     matched or matching failed
   */
  public List<WorkflowExecution> triggerEvent(
      TriggerType triggerType, String entityId, Map<String, Object> context) {
    if (triggerType == null) {
      log.warn("Ignoring event without trigger type for entity={}", entityId);
      return List.of();
    }
    var eventContext = new LinkedHashMap<String, Object>();
    if (context != null) {
      eventContext.putAll(context);
    }
    eventContext.putIfAbsent("entity_id", entityId);
    eventContext.putIfAbsent("trigger_type", triggerType.wireName());
    Map<String, Object> snapshot = Collections.unmodifiableMap(eventContext);

    List<Rule> rules;
    try {
      rules = ruleMatcher.match(triggerType, snapshot);
    } catch (RuntimeException e) {
      log.error("Rule matching failed for {} entity={}", triggerType.wireName(), entityId, e);
      return List.of();
    }
    log.debug(
        "Trigger {} entity={} matched {} rule(s)", triggerType.wireName(), entityId, rules.size());

    var executions = new ArrayList<WorkflowExecution>();
    for (Rule rule : rules) {
      try {
        executions.add(executionTracker.fire(rule, triggerType, entityId, snapshot));
      } catch (RuntimeException e) {
        log.error(
            "Rule {} failed for {} entity={}", rule.id(), triggerType.wireName(), entityId, e);
      }
    }
    return executions;
  }

  /**
   * Fires {@code task_completed} for a task, then checks whether the task's project has no open
   * tasks left. If so, and the project was not already completed, the project is marked completed
   * at 100% progress and {@code project_milestone} fires with milestone type {@code
   * project_completed}.
   */
  public List<WorkflowExecution> onTaskCompleted(String taskId) {
    try {
      var task = store.findById(StoreCollections.TASKS, taskId);
      if (task.isEmpty()) {
        log.warn("Task {} not found, ignoring completion", taskId);
        return List.of();
      }
      String projectId = RowValues.string(task.get(), "project_id");
      var projectBefore = store.findById(StoreCollections.PROJECTS, projectId);
      var projectTasks = projectTasks(projectId);
      long openTasks = projectTasks.stream().filter(t -> !isCompleted(t, taskId)).count();

      var context = new LinkedHashMap<String, Object>();
      context.put("task_id", taskId);
      context.put("project_id", projectId);
      context.put("task_title", RowValues.string(task.get(), "title"));
      context.put("completion_date", clock.instant().toString());
      context.put("open_task_count", openTasks);
      var executions = new ArrayList<>(triggerEvent(TriggerType.TASK_COMPLETED, taskId, context));

      boolean alreadyCompleted =
          projectBefore
              .map(project -> "completed".equalsIgnoreCase(RowValues.string(project, "status")))
              .orElse(true);
      if (openTasks == 0 && !alreadyCompleted) {
        executions.addAll(completeProject(projectId, projectTasks.size()));
      }
      logTrigger("task_completed_trigger", taskId, "project_id", projectId);
      return executions;
    } catch (RuntimeException e) {
      log.error("Task completion handling failed for task {}", taskId, e);
      logTriggerError("task_completed_trigger", taskId, e);
      return List.of();
    }
  }

  public List<WorkflowExecution> onProjectMilestone(
      String projectId, String milestoneType, Map<String, Object> milestoneData) {
    var context = new LinkedHashMap<String, Object>();
    context.put("project_id", projectId);
    context.put("milestone_type", milestoneType);
    context.put("milestone_data", milestoneData != null ? milestoneData : Map.of());
    context.put("timestamp", clock.instant().toString());
    var executions = triggerEvent(TriggerType.PROJECT_MILESTONE, projectId, context);
    logTrigger("project_milestone_trigger", projectId, "milestone_type", milestoneType);
    return executions;
  }

  /**
   * Fires {@code payment_received}, then cancels the invoice's pending payment reminders since
   * they no longer apply.
   */
  public List<WorkflowExecution> onPaymentReceived(
      String invoiceId, BigDecimal paymentAmount, Map<String, Object> paymentData) {
    var context = new LinkedHashMap<String, Object>();
    context.put("invoice_id", invoiceId);
    context.put("payment_amount", paymentAmount);
    context.put("payment_data", paymentData != null ? paymentData : Map.of());
    context.put("timestamp", clock.instant().toString());
    try {
      store
          .findById(StoreCollections.INVOICES, invoiceId)
          .ifPresent(invoice -> putInvoiceParties(context, invoice));
    } catch (RuntimeException e) {
      log.warn("Could not read invoice {} for payment context: {}", invoiceId, e.getMessage());
    }
    var executions = triggerEvent(TriggerType.PAYMENT_RECEIVED, invoiceId, context);
    try {
      reminderScheduler.cancelPending(ReminderKind.INVOICE_PAYMENT, invoiceId);
      logTrigger("payment_received_trigger", invoiceId, "payment_amount", paymentAmount);
    } catch (RuntimeException e) {
      log.error("Could not cancel payment reminders for invoice {}", invoiceId, e);
      logTriggerError("payment_received_trigger", invoiceId, e);
    }
    return executions;
  }

  /** Fires {@code invoice_overdue} with the invoice's amounts and days overdue. */
  public List<WorkflowExecution> onInvoiceOverdue(String invoiceId) {
    try {
      var invoice = store.findById(StoreCollections.INVOICES, invoiceId);
      if (invoice.isEmpty()) {
        log.warn("Invoice {} not found, ignoring overdue event", invoiceId);
        return List.of();
      }
      var row = invoice.get();
      LocalDate today = LocalDate.ofInstant(clock.instant(), properties.zoneId());
      LocalDate dueDate = RowValues.date(row, "due_date");
      long daysOverdue = dueDate != null ? Math.max(0, ChronoUnit.DAYS.between(dueDate, today)) : 0;

      var context = new LinkedHashMap<String, Object>();
      context.put("invoice_id", invoiceId);
      putInvoiceParties(context, row);
      context.put("invoice_number", RowValues.string(row, "invoice_number"));
      context.put("amount", RowValues.decimal(row, "amount"));
      context.put("total_amount", RowValues.decimal(row, "total_amount"));
      context.put("due_date", dueDate != null ? dueDate.toString() : null);
      context.put("days_overdue", daysOverdue);
      context.put("late_fee_applied", RowValues.bool(row, "late_fee_applied"));
      context.put("timestamp", clock.instant().toString());
      var executions = triggerEvent(TriggerType.INVOICE_OVERDUE, invoiceId, context);
      logTrigger("invoice_overdue_trigger", invoiceId, "days_overdue", daysOverdue);
      return executions;
    } catch (RuntimeException e) {
      log.error("Overdue handling failed for invoice {}", invoiceId, e);
      logTriggerError("invoice_overdue_trigger", invoiceId, e);
      return List.of();
    }
  }

  /** Turns a fired reminder into one trigger of its kind's trigger type. */
  @EventListener
  public void onReminderFired(ReminderFiredEvent event) {
    var schedule = event.schedule();
    var context = new LinkedHashMap<String, Object>(event.variables());
    context.put("reminder_id", schedule.id());
    context.put("reminder_kind", schedule.kind().wireName());
    context.put("reminder_status", event.outcome().wireName());
    context.put("priority", schedule.config().priority().wireName());
    String entityId = schedule.entityId();
    if (schedule.kind() == ReminderKind.CLIENT_FOLLOWUP && context.get("project_id") != null) {
      entityId = context.get("project_id").toString();
    }
    triggerEvent(schedule.kind().triggerType(), entityId, context);
  }

  // --- Rules ---

  public Rule createRule(RuleDraft draft) {
    return ruleService.createRule(draft);
  }

  public Rule updateRule(String ruleId, RuleDraft draft) {
    return ruleService.updateRule(ruleId, draft);
  }

  public void deleteRule(String ruleId) {
    ruleService.deleteRule(ruleId);
  }

  public Rule getRule(String ruleId) {
    return ruleService.getRule(ruleId);
  }

  public List<Rule> listRules() {
    return ruleService.listRules();
  }

  // --- Reminders ---

  public List<ReminderSchedule> scheduleReminder(
      ReminderKind kind, String entityId, Instant targetDate, ReminderConfig config) {
    return reminderScheduler.scheduleReminder(kind, entityId, targetDate, config);
  }

  public int cancelPending(ReminderKind kind, String entityId) {
    return reminderScheduler.cancelPending(kind, entityId);
  }

  // --- Analytics ---

  public AutomationAnalytics getAnalytics(Instant start, Instant end) {
    return analyticsService.getAnalytics(start, end);
  }

  private List<WorkflowExecution> completeProject(String projectId, int totalTasks) {
    var patch = new LinkedHashMap<String, Object>();
    patch.put("status", "completed");
    patch.put("progress_percentage", 100);
    patch.put("updated_at", clock.instant().toString());
    store.update(StoreCollections.PROJECTS, projectId, patch);
    log.info("Project {} completed: all {} task(s) done", projectId, totalTasks);
    var milestoneData = new LinkedHashMap<String, Object>();
    milestoneData.put("total_tasks", totalTasks);
    milestoneData.put("completion_date", clock.instant().toString());
    return onProjectMilestone(projectId, "project_completed", milestoneData);
  }

  private List<Map<String, Object>> projectTasks(String projectId) {
    if (projectId == null) {
      return List.of();
    }
    return store.query(StoreCollections.TASKS, Map.of("project_id", projectId));
  }

  /** The task that just completed counts as completed even if its row was not yet updated. */
  private static boolean isCompleted(Map<String, Object> task, String completedTaskId) {
    if (completedTaskId.equals(RowValues.string(task, "id"))) {
      return true;
    }
    String status = RowValues.string(task, "status");
    return status != null && COMPLETED_TASK_STATUSES.contains(status.toLowerCase(Locale.ROOT));
  }

  private void putInvoiceParties(Map<String, Object> context, Map<String, Object> invoice) {
    String clientId = RowValues.string(invoice, "client_id");
    context.put("client_id", clientId);
    context.put("invoice_number", RowValues.string(invoice, "invoice_number"));
    if (clientId == null) {
      return;
    }
    store
        .findById(StoreCollections.CLIENTS, clientId)
        .ifPresent(
            client -> {
              context.put("client_name", RowValues.string(client, "name"));
              context.put("client_email", RowValues.string(client, "email"));
            });
  }

  private void logTrigger(String action, String entityId, String detailKey, Object detailValue) {
    automationLogService.log(
        AutomationLogBuilder.builder()
            .action(action)
            .entityId(entityId)
            .detail(detailKey, detailValue)
            .build(clock));
  }

  private void logTriggerError(String action, String entityId, Throwable cause) {
    automationLogService.log(
        AutomationLogBuilder.builder().action(action).entityId(entityId).error(cause).build(clock));
  }
}
