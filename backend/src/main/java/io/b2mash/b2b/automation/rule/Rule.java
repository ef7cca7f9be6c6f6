package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.action.Action;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * An operator-defined automation: when an event of the trigger's type arrives and the conditions
 * hold for its context, the actions run in order.
 */
public record Rule(
    String id,
    String name,
    String description,
    Trigger trigger,
    List<Condition> conditions,
    List<Action> actions,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  /** Oldest first; ties broken by id. Rules missing a creation time sort last. */
  public static final Comparator<Rule> CREATION_ORDER =
      Comparator.comparing(Rule::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(Rule::id, Comparator.nullsLast(Comparator.naturalOrder()));

  public Rule {
    conditions = conditions != null ? List.copyOf(conditions) : List.of();
    actions = actions != null ? List.copyOf(actions) : List.of();
  }

  public TriggerType triggerType() {
    return trigger != null ? trigger.type() : null;
  }

  public Rule withActive(boolean active, Instant updatedAt) {
    return new Rule(
        id, name, description, trigger, conditions, actions, active, createdAt, updatedAt);
  }
}
