package io.b2mash.b2b.automation.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.automation.action.ApplyLateFeeAction;
import io.b2mash.b2b.automation.action.SendNotificationAction;
import io.b2mash.b2b.automation.action.UnrecognizedAction;
import io.b2mash.b2b.automation.action.UpdateStatusAction;
import io.b2mash.b2b.automation.exception.InvalidRuleException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RuleCodecTest {

  @Test
  void parseDefinition_readsStoredShape() {
    var draft =
        RuleCodec.parseDefinition(
            Map.of(
                "name",
                "Close project",
                "trigger",
                Map.of("type", "task_completed", "config", Map.of()),
                "conditions",
                List.of(
                    Map.of(
                        "field",
                        "open_task_count",
                        "operator",
                        "eq",
                        "value",
                        0,
                        "logical_operator",
                        "OR")),
                "actions",
                List.of(
                    Map.of(
                        "type",
                        "update_status",
                        "config",
                        Map.of(
                            "entity_type",
                            "project",
                            "entity_id",
                            "{{project_id}}",
                            "new_status",
                            "completed")))));

    assertThat(draft.name()).isEqualTo("Close project");
    assertThat(draft.active()).isTrue();
    assertThat(draft.trigger().type()).isEqualTo(TriggerType.TASK_COMPLETED);
    assertThat(draft.conditions())
        .containsExactly(
            new Condition("open_task_count", ConditionOperator.EQUALS, 0, LogicalJoin.OR));
    assertThat(draft.actions())
        .containsExactly(new UpdateStatusAction("project", "{{project_id}}", "completed"));
  }

  @Test
  void parseDefinition_collectsEveryViolation() {
    assertThatThrownBy(
            () ->
                RuleCodec.parseDefinition(
                    Map.of(
                        "name",
                        "Broken",
                        "trigger",
                        Map.of("type", "invoice_exploded"),
                        "conditions",
                        List.of(Map.of("field", "x", "operator", "roughly", "value", 1)))))
        .isInstanceOfSatisfying(
            InvalidRuleException.class,
            e ->
                assertThat(e.getViolations())
                    .containsExactly(
                        "Unknown trigger type 'invoice_exploded'",
                        "Condition 0 has unknown operator 'roughly'"));
  }

  @Test
  void decodeActions_mapsLegacyTypes() {
    var actions =
        RuleCodec.decodeActions(
            List.of(
                Map.of(
                    "type",
                    "send_email",
                    "config",
                    Map.of("to", "{{client_email}}", "template", "payment_thank_you")),
                Map.of("type", "apply_late_payment_fee", "percentage", "2")),
            new ArrayList<>());

    assertThat(actions.get(0))
        .isEqualTo(new SendNotificationAction("email", "{{client_email}}", "payment_thank_you"));
    assertThat(actions.get(1)).isInstanceOf(ApplyLateFeeAction.class);
    assertThat(((ApplyLateFeeAction) actions.get(1)).feePercentage()).isEqualByComparingTo("2");
  }

  @Test
  void decodeActions_keepsUnknownTypesAsUnrecognized() {
    var actions =
        RuleCodec.decodeActions(
            List.of(Map.of("type", "launch_rocket", "config", Map.of("target", "moon"))),
            new ArrayList<>());

    assertThat(actions)
        .containsExactly(new UnrecognizedAction("launch_rocket", Map.of("target", "moon")));
  }

  @Test
  void encodedRule_decodesToSameDefinition() {
    var conditions =
        List.of(Condition.of("days_overdue", ConditionOperator.GREATER_THAN_OR_EQUAL, 15).or());
    var encoded = RuleCodec.encodeConditions(conditions);

    var violations = new ArrayList<String>();
    assertThat(RuleCodec.decodeConditions(encoded, violations)).isEqualTo(conditions);
    assertThat(violations).isEmpty();
    assertThat(encoded.get(0)).containsEntry("operator", "greater_than_or_equal");
  }
}
