package io.b2mash.b2b.automation.sweep;

import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.execution.WorkflowExecution;
import io.b2mash.b2b.automation.execution.WorkflowExecutionRepository;
import io.b2mash.b2b.automation.reminder.ReminderSchedule;
import io.b2mash.b2b.automation.reminder.ReminderScheduleRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deletes history older than the retention period: finished executions, automation log entries,
 * and reminders that are no longer pending. Pending reminders and running executions are kept
 * regardless of age.
 */
@Component
public class RetentionCleanup {

  private static final Logger log = LoggerFactory.getLogger(RetentionCleanup.class);

  private final WorkflowExecutionRepository executionRepository;
  private final AutomationLogService automationLogService;
  private final ReminderScheduleRepository scheduleRepository;
  private final AutomationProperties properties;
  private final Clock clock;

  public RetentionCleanup(
      WorkflowExecutionRepository executionRepository,
      AutomationLogService automationLogService,
      ReminderScheduleRepository scheduleRepository,
      AutomationProperties properties,
      Clock clock) {
    this.executionRepository = executionRepository;
    this.automationLogService = automationLogService;
    this.scheduleRepository = scheduleRepository;
    this.properties = properties;
    this.clock = clock;
  }

  public record Result(int executions, int logs, int reminders) {}

  public Result run() {
    Instant cutoff = clock.instant().minus(Duration.ofDays(properties.retentionDays()));

    int executions = 0;
    for (WorkflowExecution execution : executionRepository.findAll()) {
      Instant finishedAt =
          execution.completedAt() != null ? execution.completedAt() : execution.startedAt();
      if (execution.status().isTerminal()
          && finishedAt != null
          && finishedAt.isBefore(cutoff)
          && executionRepository.delete(execution.id())) {
        executions++;
      }
    }

    int logs = automationLogService.deleteOlderThan(cutoff);

    int reminders = 0;
    for (ReminderSchedule schedule : scheduleRepository.findAll()) {
      if (!schedule.isPending()
          && schedule.scheduledAt().isBefore(cutoff)
          && scheduleRepository.delete(schedule.id())) {
        reminders++;
      }
    }

    log.info(
        "Retention cleanup removed {} execution(s), {} log entries, {} reminder(s) older than {}",
        executions,
        logs,
        reminders,
        cutoff);
    return new Result(executions, logs, reminders);
  }
}
