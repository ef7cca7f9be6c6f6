package io.b2mash.b2b.automation.execution;

import io.b2mash.b2b.automation.audit.AutomationLogRecord;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.exception.InvalidStateException;
import io.b2mash.b2b.automation.rule.Rule;
import io.b2mash.b2b.automation.rule.RuleRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class ExecutionAnalyticsService {

  static final String UNKNOWN_RULE = "Unknown Rule";

  private final WorkflowExecutionRepository executionRepository;
  private final RuleRepository ruleRepository;
  private final AutomationLogService automationLogService;
  private final AutomationProperties properties;

  public ExecutionAnalyticsService(
      WorkflowExecutionRepository executionRepository,
      RuleRepository ruleRepository,
      AutomationLogService automationLogService,
      AutomationProperties properties) {
    this.executionRepository = executionRepository;
    this.ruleRepository = ruleRepository;
    this.automationLogService = automationLogService;
    this.properties = properties;
  }

  /** Aggregates executions started, and log entries written, within {@code [start, end]}. */
  public AutomationAnalytics getAnalytics(Instant start, Instant end) {
    if (start == null || end == null || end.isBefore(start)) {
      throw new InvalidStateException(
          "Invalid analytics window", "Window end must not be before its start");
    }
    var executions = executionRepository.findStartedBetween(start, end);
    int total = executions.size();
    int successful = count(executions, ExecutionStatus.COMPLETED);
    int failed = count(executions, ExecutionStatus.FAILED);
    BigDecimal rate =
        total == 0
            ? BigDecimal.ZERO.setScale(2)
            : BigDecimal.valueOf(successful * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);

    var logs = automationLogService.findBetween(start, end);
    return new AutomationAnalytics(
        total,
        successful,
        failed,
        rate,
        mostTriggeredRules(executions),
        new AutomationAnalytics.PerformanceMetrics(
            averageExecutionTimeMs(executions),
            countSuccessfulLogs(logs, "notification", "email", "sms"),
            countSuccessfulLogs(logs, "reminder")));
  }

  private List<AutomationAnalytics.RuleFireCount> mostTriggeredRules(
      List<WorkflowExecution> executions) {
    Map<String, String> ruleNames =
        ruleRepository.findAll().stream()
            .filter(rule -> rule.id() != null && rule.name() != null)
            .collect(Collectors.toMap(Rule::id, Rule::name, (a, b) -> a));
    Map<String, Long> counts =
        executions.stream()
            .filter(e -> e.ruleId() != null)
            .collect(Collectors.groupingBy(WorkflowExecution::ruleId, Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(properties.analyticsTopRules())
        .map(
            entry ->
                new AutomationAnalytics.RuleFireCount(
                    entry.getKey(),
                    ruleNames.getOrDefault(entry.getKey(), UNKNOWN_RULE),
                    entry.getValue()))
        .toList();
  }

  private static long averageExecutionTimeMs(List<WorkflowExecution> executions) {
    var average =
        executions.stream()
            .filter(e -> e.status() == ExecutionStatus.COMPLETED && e.completedAt() != null)
            .map(WorkflowExecution::duration)
            .mapToLong(Duration::toMillis)
            .average();
    return average.isPresent() ? Math.round(average.getAsDouble()) : 0;
  }

  private static long countSuccessfulLogs(List<AutomationLogRecord> logs, String... keywords) {
    return logs.stream()
        .filter(AutomationLogRecord::isSuccess)
        .filter(entry -> entry.action() != null)
        .filter(entry -> List.of(keywords).stream().anyMatch(entry.action()::contains))
        .count();
  }

  private static int count(List<WorkflowExecution> executions, ExecutionStatus status) {
    return (int) executions.stream().filter(e -> e.status() == status).count();
  }
}
