package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.action.ApplyLateFeeAction;
import io.b2mash.b2b.automation.action.SendNotificationAction;
import io.b2mash.b2b.automation.action.UpdateStatusAction;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Creates the built-in rules when the rule collection is empty. */
@Component
public class DefaultRuleSeeder {

  private static final Logger log = LoggerFactory.getLogger(DefaultRuleSeeder.class);

  static final List<RuleDraft> DEFAULT_RULES =
      List.of(
          new RuleDraft(
              "Auto-complete project when all tasks done",
              "Marks the project completed once its last open task is completed",
              Trigger.of(TriggerType.TASK_COMPLETED),
              List.of(Condition.of("open_task_count", ConditionOperator.EQUALS, 0)),
              List.of(new UpdateStatusAction("project", "{{project_id}}", "completed")),
              true),
          new RuleDraft(
              "Payment thank you",
              "Thanks the client when a payment is recorded",
              Trigger.of(TriggerType.PAYMENT_RECEIVED),
              List.of(),
              List.of(
                  new SendNotificationAction("email", "{{client_email}}", "payment_thank_you")),
              true),
          new RuleDraft(
              "Late payment fee",
              "Applies a 1.5% late fee to invoices at least 15 days overdue",
              new Trigger(TriggerType.INVOICE_OVERDUE, Map.of("days_overdue", 15)),
              List.of(Condition.of("days_overdue", ConditionOperator.GREATER_THAN_OR_EQUAL, 15)),
              List.of(new ApplyLateFeeAction(new BigDecimal("1.5"), "{{invoice_id}}")),
              true));

  private final RuleRepository ruleRepository;
  private final RuleService ruleService;

  public DefaultRuleSeeder(RuleRepository ruleRepository, RuleService ruleService) {
    this.ruleRepository = ruleRepository;
    this.ruleService = ruleService;
  }

  /** Returns the number of rules created. */
  public int seedIfEmpty() {
    if (!ruleRepository.isEmpty()) {
      log.debug("Automation rules already present, skipping seed");
      return 0;
    }
    DEFAULT_RULES.forEach(ruleService::createRule);
    log.info("Seeded {} default automation rules", DEFAULT_RULES.size());
    return DEFAULT_RULES.size();
  }
}
