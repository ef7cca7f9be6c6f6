package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.action.Action;
import java.util.List;

/** Authoring input for creating or replacing a rule. Validated by {@link RuleValidator}. */
public record RuleDraft(
    String name,
    String description,
    Trigger trigger,
    List<Condition> conditions,
    List<Action> actions,
    boolean active) {

  public RuleDraft {
    conditions = conditions != null ? List.copyOf(conditions) : List.of();
    actions = actions != null ? List.copyOf(actions) : List.of();
  }
}
