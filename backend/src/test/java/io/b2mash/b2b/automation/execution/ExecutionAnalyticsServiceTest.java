package io.b2mash.b2b.automation.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.automation.action.SendNotificationAction;
import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.exception.InvalidStateException;
import io.b2mash.b2b.automation.rule.RuleDraft;
import io.b2mash.b2b.automation.rule.Trigger;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.testutil.AutomationFixture;
import io.b2mash.b2b.automation.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutionAnalyticsServiceTest {

  private static final Instant WINDOW_START = Instant.parse("2025-03-01T00:00:00Z");
  private static final Instant WINDOW_END = Instant.parse("2025-03-31T23:59:59Z");

  private AutomationFixture fixture;
  private ExecutionAnalyticsService analyticsService;

  @BeforeEach
  void setUp() {
    fixture = new AutomationFixture(MutableClock.at("2025-03-10T10:00:00Z"));
    analyticsService = fixture.analyticsService;
  }

  @Test
  void getAnalytics_computesRateAndAverageDuration() {
    String ruleId = createRule("Payment thanks");
    record(ruleId, ExecutionStatus.COMPLETED, "2025-03-10T10:00:00Z", Duration.ofMillis(200));
    record(ruleId, ExecutionStatus.COMPLETED, "2025-03-11T10:00:00Z", Duration.ofMillis(400));
    record(ruleId, ExecutionStatus.FAILED, "2025-03-12T10:00:00Z", Duration.ofMillis(5000));

    var analytics = analyticsService.getAnalytics(WINDOW_START, WINDOW_END);

    assertThat(analytics.totalExecutions()).isEqualTo(3);
    assertThat(analytics.successfulExecutions()).isEqualTo(2);
    assertThat(analytics.failedExecutions()).isEqualTo(1);
    assertThat(analytics.executionRate()).isEqualByComparingTo("66.67");
    assertThat(analytics.performance().averageExecutionTimeMs()).isEqualTo(300);
    assertThat(analytics.mostTriggeredRules())
        .singleElement()
        .isEqualTo(new AutomationAnalytics.RuleFireCount(ruleId, "Payment thanks", 3));
  }

  @Test
  void getAnalytics_emptyWindow_reportsZeroRate() {
    record("rule-x", ExecutionStatus.COMPLETED, "2025-02-10T10:00:00Z", Duration.ofMillis(10));

    var analytics = analyticsService.getAnalytics(WINDOW_START, WINDOW_END);

    assertThat(analytics.totalExecutions()).isZero();
    assertThat(analytics.executionRate()).isEqualByComparingTo("0.00");
    assertThat(analytics.mostTriggeredRules()).isEmpty();
    assertThat(analytics.performance().averageExecutionTimeMs()).isZero();
  }

  @Test
  void mostTriggeredRules_orderedByCountThenRuleId() {
    record("rule-b", ExecutionStatus.COMPLETED, "2025-03-02T10:00:00Z", Duration.ZERO);
    record("rule-a", ExecutionStatus.COMPLETED, "2025-03-03T10:00:00Z", Duration.ZERO);
    record("rule-c", ExecutionStatus.COMPLETED, "2025-03-04T10:00:00Z", Duration.ZERO);
    record("rule-c", ExecutionStatus.FAILED, "2025-03-05T10:00:00Z", Duration.ZERO);

    var analytics = analyticsService.getAnalytics(WINDOW_START, WINDOW_END);

    assertThat(analytics.mostTriggeredRules())
        .extracting(AutomationAnalytics.RuleFireCount::ruleId)
        .containsExactly("rule-c", "rule-a", "rule-b");
    assertThat(analytics.mostTriggeredRules())
        .extracting(AutomationAnalytics.RuleFireCount::ruleName)
        .containsOnly(ExecutionAnalyticsService.UNKNOWN_RULE);
  }

  @Test
  void getAnalytics_countsSuccessfulNotificationAndReminderLogs() {
    fixture.logService.log(
        AutomationLogBuilder.builder().action("email_notification_sent").build(fixture.clock));
    fixture.logService.log(
        AutomationLogBuilder.builder()
            .action("sms_notification_sent")
            .error("gateway down")
            .build(fixture.clock));
    fixture.logService.log(
        AutomationLogBuilder.builder()
            .action("invoice_payment_reminder_sent")
            .build(fixture.clock));

    var performance = analyticsService.getAnalytics(WINDOW_START, WINDOW_END).performance();

    assertThat(performance.notificationsSent()).isEqualTo(1);
    assertThat(performance.remindersSent()).isEqualTo(1);
  }

  @Test
  void getAnalytics_rejectsInvertedWindow() {
    assertThatThrownBy(() -> analyticsService.getAnalytics(WINDOW_END, WINDOW_START))
        .isInstanceOf(InvalidStateException.class);
  }

  private String createRule(String name) {
    return fixture
        .ruleService
        .createRule(
            new RuleDraft(
                name,
                null,
                Trigger.of(TriggerType.PAYMENT_RECEIVED),
                List.of(),
                List.of(
                    new SendNotificationAction(
                        "email", "{{client_email}}", "payment_received_thank_you")),
                true))
        .id();
  }

  private void record(String ruleId, ExecutionStatus status, String startedAt, Duration took) {
    Instant start = Instant.parse(startedAt);
    var created =
        fixture.executionRepository.create(
            new WorkflowExecution(
                null,
                ruleId,
                TriggerType.PAYMENT_RECEIVED,
                "inv-1",
                Map.of(),
                ExecutionStatus.RUNNING,
                start,
                null,
                null,
                List.of(),
                List.of()));
    fixture.executionRepository.complete(
        created.finish(
            status,
            start.plus(took),
            status == ExecutionStatus.FAILED ? "failed" : null,
            List.of("send-notification"),
            List.of()));
  }
}
