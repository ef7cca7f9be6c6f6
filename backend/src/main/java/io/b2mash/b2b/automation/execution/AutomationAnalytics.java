package io.b2mash.b2b.automation.execution;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate view of executions started within a window.
 *
 * @param executionRate successful executions as a percentage of all, two decimals
 */
public record AutomationAnalytics(
    int totalExecutions,
    int successfulExecutions,
    int failedExecutions,
    BigDecimal executionRate,
    List<RuleFireCount> mostTriggeredRules,
    PerformanceMetrics performance) {

  public record RuleFireCount(String ruleId, String ruleName, long count) {}

  /**
   * @param averageExecutionTimeMs mean start-to-completion time of completed executions, rounded
   * @param notificationsSent successful notification, email and sms log entries
   * @param remindersSent successful reminder log entries
   */
  public record PerformanceMetrics(
      long averageExecutionTimeMs, long notificationsSent, long remindersSent) {}
}
