package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.action.Action;
import io.b2mash.b2b.automation.action.ApplyLateFeeAction;
import io.b2mash.b2b.automation.action.CallWebhookAction;
import io.b2mash.b2b.automation.action.CreateTaskAction;
import io.b2mash.b2b.automation.action.GenerateInvoiceAction;
import io.b2mash.b2b.automation.action.SendNotificationAction;
import io.b2mash.b2b.automation.action.UnrecognizedAction;
import io.b2mash.b2b.automation.action.UpdateStatusAction;
import io.b2mash.b2b.automation.store.RowValues;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Authoring-time checks for a rule definition. Everything that would otherwise surface as a skipped
 * or failed action at fire time is reported here, all at once.
 */
@Component
public class RuleValidator {

  static final Set<String> KNOWN_CHANNELS = Set.of("email", "sms", "in-app", "webhook");

  private static final Set<ConditionOperator> RELATIONAL =
      Set.of(
          ConditionOperator.GREATER_THAN,
          ConditionOperator.LESS_THAN,
          ConditionOperator.GREATER_THAN_OR_EQUAL,
          ConditionOperator.LESS_THAN_OR_EQUAL);

  public List<String> validate(RuleDraft draft) {
    var violations = new ArrayList<String>();
    if (draft.name() == null || draft.name().isBlank()) {
      violations.add("Rule name is required");
    }
    if (draft.trigger() == null || draft.trigger().type() == null) {
      violations.add("Trigger type is required");
    }
    for (int i = 0; i < draft.conditions().size(); i++) {
      validateCondition(i, draft.conditions().get(i), violations);
    }
    if (draft.actions().isEmpty()) {
      violations.add("At least one action is required");
    }
    for (int i = 0; i < draft.actions().size(); i++) {
      validateAction(i, draft.actions().get(i), violations);
    }
    return violations;
  }

  private void validateCondition(int index, Condition condition, List<String> violations) {
    String prefix = "Condition " + index + ": ";
    if (condition.field() == null || condition.field().isBlank()) {
      violations.add(prefix + "field is required");
    }
    if (condition.operator() == null) {
      violations.add(prefix + "operator is required");
      return;
    }
    if (condition.operator() == ConditionOperator.IN
        && !(condition.value() instanceof Collection<?>)) {
      violations.add(prefix + "'in' requires a list value");
    }
    if (RELATIONAL.contains(condition.operator())
        && RowValues.toDecimal(condition.value()) == null) {
      violations.add(prefix + "'" + condition.operator().wireName() + "' requires a numeric value");
    }
  }

  private void validateAction(int index, Action action, List<String> violations) {
    String prefix = "Action " + index + " (" + action.typeName() + "): ";
    if (action instanceof UnrecognizedAction) {
      violations.add(prefix + "unknown action type");
    } else if (action instanceof SendNotificationAction a) {
      if (a.channel() == null || !KNOWN_CHANNELS.contains(a.channel())) {
        violations.add(prefix + "unsupported channel '" + a.channel() + "'");
      }
      requireText(prefix, "recipient", a.recipient(), violations);
      requireText(prefix, "template", a.templateId(), violations);
    } else if (action instanceof CreateTaskAction a) {
      Object title = a.fields().get("title");
      if (title == null || title.toString().isBlank()) {
        violations.add(prefix + "task title is required");
      }
    } else if (action instanceof UpdateStatusAction a) {
      requireText(prefix, "entity type", a.entityType(), violations);
      requireText(prefix, "new status", a.newStatus(), violations);
    } else if (action instanceof GenerateInvoiceAction a) {
      requireText(prefix, "client", a.clientId(), violations);
      requireText(prefix, "amount", a.amount(), violations);
    } else if (action instanceof ApplyLateFeeAction a) {
      if (a.feePercentage() == null || a.feePercentage().compareTo(BigDecimal.ZERO) <= 0) {
        violations.add(prefix + "fee percentage must be a positive number");
      }
    } else if (action instanceof CallWebhookAction a) {
      requireText(prefix, "url", a.url(), violations);
    }
  }

  private static void requireText(
      String prefix, String name, String value, List<String> violations) {
    if (value == null || value.isBlank()) {
      violations.add(prefix + name + " is required");
    }
  }
}
