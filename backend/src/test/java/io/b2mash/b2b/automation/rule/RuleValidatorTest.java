package io.b2mash.b2b.automation.rule;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.automation.action.Action;
import io.b2mash.b2b.automation.action.ApplyLateFeeAction;
import io.b2mash.b2b.automation.action.CallWebhookAction;
import io.b2mash.b2b.automation.action.SendNotificationAction;
import io.b2mash.b2b.automation.action.UnrecognizedAction;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RuleValidatorTest {

  private final RuleValidator validator = new RuleValidator();

  @Test
  void validRule_hasNoViolations() {
    var draft =
        draft(
            List.of(Condition.of("days_overdue", ConditionOperator.GREATER_THAN_OR_EQUAL, 15)),
            List.of(new ApplyLateFeeAction(new BigDecimal("1.5"), "{{invoice_id}}")));

    assertThat(validator.validate(draft)).isEmpty();
  }

  @Test
  void missingNameTriggerAndActions_areAllReported() {
    var draft = new RuleDraft(" ", null, null, List.of(), List.of(), true);

    assertThat(validator.validate(draft))
        .containsExactly(
            "Rule name is required",
            "Trigger type is required",
            "At least one action is required");
  }

  @Test
  void relationalOperator_requiresNumericValue() {
    var draft =
        draft(
            List.of(Condition.of("status", ConditionOperator.GREATER_THAN, "sent")),
            List.of(new CallWebhookAction("https://hooks.example.test", Map.of())));

    assertThat(validator.validate(draft))
        .containsExactly("Condition 0: 'greater_than' requires a numeric value");
  }

  @Test
  void inOperator_requiresList() {
    var draft =
        draft(
            List.of(Condition.of("status", ConditionOperator.IN, "sent")),
            List.of(new CallWebhookAction("https://hooks.example.test", Map.of())));

    assertThat(validator.validate(draft))
        .containsExactly("Condition 0: 'in' requires a list value");
  }

  @Test
  void actionProblems_areReportedPerAction() {
    List<Action> actions =
        List.of(
            new SendNotificationAction("pigeon", "{{client_email}}", null),
            new UnrecognizedAction("launch_rocket", Map.of()),
            new ApplyLateFeeAction(BigDecimal.ZERO, null),
            new CallWebhookAction(" ", Map.of()));

    assertThat(validator.validate(draft(List.of(), actions)))
        .containsExactly(
            "Action 0 (send-notification): unsupported channel 'pigeon'",
            "Action 0 (send-notification): template is required",
            "Action 1 (launch_rocket): unknown action type",
            "Action 2 (apply-late-fee): fee percentage must be a positive number",
            "Action 3 (call-webhook): url is required");
  }

  private static RuleDraft draft(List<Condition> conditions, List<Action> actions) {
    return new RuleDraft(
        "Rule", null, Trigger.of(TriggerType.INVOICE_OVERDUE), conditions, actions, true);
  }
}
