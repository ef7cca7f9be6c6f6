package io.b2mash.b2b.automation.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.automation.action.SendNotificationAction;
import io.b2mash.b2b.automation.action.UpdateStatusAction;
import io.b2mash.b2b.automation.exception.InvalidRuleException;
import io.b2mash.b2b.automation.exception.ResourceNotFoundException;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.testutil.AutomationFixture;
import io.b2mash.b2b.automation.testutil.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RuleServiceTest {

  private MutableClock clock;
  private AutomationFixture fixture;
  private RuleService ruleService;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-03-01T10:00:00Z");
    fixture = new AutomationFixture(clock);
    ruleService = fixture.ruleService;
  }

  @Test
  void createRule_persistsAndReturnsId() {
    var rule = ruleService.createRule(thankYouRule("Thank you"));

    assertThat(rule.id()).isNotBlank();
    assertThat(rule.createdAt()).isEqualTo(clock.instant());
    assertThat(ruleService.getRule(rule.id())).isEqualTo(rule);
  }

  @Test
  void createRule_rejectsInvalidDefinition() {
    var draft =
        new RuleDraft(
            "", null, Trigger.of(TriggerType.PAYMENT_RECEIVED), List.of(), List.of(), true);

    assertThatThrownBy(() -> ruleService.createRule(draft))
        .isInstanceOf(InvalidRuleException.class)
        .hasMessageContaining("Rule name is required");
    assertThat(ruleService.listRules()).isEmpty();
  }

  @Test
  void createRule_isVisibleToMatcherImmediately() {
    fixture.ruleMatcher.match(TriggerType.PAYMENT_RECEIVED, Map.of());

    ruleService.createRule(thankYouRule("Thank you"));

    assertThat(fixture.ruleMatcher.match(TriggerType.PAYMENT_RECEIVED, Map.of())).hasSize(1);
  }

  @Test
  void updateRule_replacesDefinitionButKeepsCreationTime() {
    var created = ruleService.createRule(thankYouRule("Thank you"));
    clock.advance(Duration.ofHours(1));

    var updated = ruleService.updateRule(created.id(), thankYouRule("Thanks again"));

    assertThat(updated.name()).isEqualTo("Thanks again");
    assertThat(updated.createdAt()).isEqualTo(created.createdAt());
    assertThat(updated.updatedAt()).isEqualTo(clock.instant());
    assertThat(ruleService.getRule(created.id()).name()).isEqualTo("Thanks again");
  }

  @Test
  void deleteRule_deactivatesAndStopsMatching() {
    var created = ruleService.createRule(thankYouRule("Thank you"));

    ruleService.deleteRule(created.id());

    assertThat(ruleService.getRule(created.id()).active()).isFalse();
    assertThat(fixture.ruleMatcher.match(TriggerType.PAYMENT_RECEIVED, Map.of())).isEmpty();
  }

  @Test
  void getRule_unknownId_throwsNotFound() {
    assertThatThrownBy(() -> ruleService.getRule("missing"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void listRules_returnsCreationOrder() {
    var first = ruleService.createRule(thankYouRule("First"));
    clock.advance(Duration.ofMinutes(1));
    var second = ruleService.createRule(thankYouRule("Second"));

    assertThat(ruleService.listRules())
        .extracting(Rule::id)
        .containsExactly(first.id(), second.id());
  }

  @Test
  void listRules_skipsRowsThatNoLongerDecode() {
    ruleService.createRule(thankYouRule("Readable"));
    fixture.store.create(
        StoreCollections.AUTOMATION_RULES,
        Map.of(
            "name", "Broken",
            "trigger", "{\"type\":\"moon_landing\"}",
            "conditions", "[]",
            "actions", "[]",
            "is_active", true));

    assertThat(ruleService.listRules()).extracting(Rule::name).containsExactly("Readable");
  }

  @Test
  void matcher_returnsOnlyRulesWhoseConditionsHold() {
    ruleService.createRule(
        new RuleDraft(
            "Close project",
            null,
            Trigger.of(TriggerType.TASK_COMPLETED),
            List.of(Condition.of("open_task_count", ConditionOperator.EQUALS, 0)),
            List.of(new UpdateStatusAction("project", "{{project_id}}", "completed")),
            true));

    assertThat(fixture.ruleMatcher.match(TriggerType.TASK_COMPLETED, Map.of("open_task_count", 2)))
        .isEmpty();
    assertThat(fixture.ruleMatcher.match(TriggerType.TASK_COMPLETED, Map.of("open_task_count", 0)))
        .hasSize(1);
    assertThat(fixture.ruleMatcher.match(TriggerType.TASK_DUE, Map.of("open_task_count", 0)))
        .isEmpty();
  }

  private static RuleDraft thankYouRule(String name) {
    return new RuleDraft(
        name,
        "Thanks the client",
        Trigger.of(TriggerType.PAYMENT_RECEIVED),
        List.of(),
        List.of(new SendNotificationAction("email", "{{client_email}}", "payment_thank_you")),
        true);
  }
}
