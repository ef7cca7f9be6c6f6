package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.action.Action;
import io.b2mash.b2b.automation.action.ActionCodec;
import io.b2mash.b2b.automation.exception.InvalidRuleException;
import io.b2mash.b2b.automation.store.RowValues;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the map form of triggers, conditions and actions (as stored in JSON columns or received
 * from a host API) to typed values.
 *
 * <p>Decoding collects problems into a violation list instead of throwing, so the caller decides:
 * authoring rejects the whole definition with {@link InvalidRuleException}; loading stored rows
 * skips the broken rule and keeps going.
 */
public final class RuleCodec {

  private RuleCodec() {}

  /** Parses a rule definition map, rejecting it when any part is malformed. */
  public static RuleDraft parseDefinition(Map<String, Object> definition) {
    var violations = new ArrayList<String>();
    Trigger trigger = decodeTrigger(definition.get("trigger"), violations);
    List<Condition> conditions = decodeConditions(definition.get("conditions"), violations);
    List<Action> actions = decodeActions(definition.get("actions"), violations);
    if (!violations.isEmpty()) {
      throw new InvalidRuleException(violations);
    }
    Object active = definition.get("is_active");
    return new RuleDraft(
        RowValues.string(definition, "name"),
        RowValues.string(definition, "description"),
        trigger,
        conditions,
        actions,
        active == null || RowValues.bool(definition, "is_active"));
  }

  static Trigger decodeTrigger(Object raw, List<String> violations) {
    if (raw instanceof Map<?, ?> map) {
      Object type = map.get("type");
      var triggerType = TriggerType.fromWire(type != null ? type.toString() : null);
      if (triggerType.isEmpty()) {
        violations.add("Unknown trigger type '" + type + "'");
        return null;
      }
      return new Trigger(triggerType.get(), stringKeys(map.get("config")));
    }
    if (raw instanceof String text) {
      var triggerType = TriggerType.fromWire(text);
      if (triggerType.isPresent()) {
        return Trigger.of(triggerType.get());
      }
      violations.add("Unknown trigger type '" + text + "'");
      return null;
    }
    violations.add("Trigger is required");
    return null;
  }

  static List<Condition> decodeConditions(Object raw, List<String> violations) {
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> list)) {
      violations.add("Conditions must be a list");
      return List.of();
    }
    var conditions = new ArrayList<Condition>();
    for (int i = 0; i < list.size(); i++) {
      if (!(list.get(i) instanceof Map<?, ?> map)) {
        violations.add("Condition " + i + " must be an object");
        continue;
      }
      Object field = map.get("field");
      Object operator = map.get("operator");
      var parsedOperator =
          ConditionOperator.fromWire(operator != null ? operator.toString() : null);
      Object join = map.get("logical_operator");
      var parsedJoin = LogicalJoin.fromWire(join != null ? join.toString() : null);
      if (parsedOperator.isEmpty()) {
        violations.add("Condition " + i + " has unknown operator '" + operator + "'");
      }
      if (parsedJoin.isEmpty()) {
        violations.add("Condition " + i + " has unknown logical operator '" + join + "'");
      }
      if (parsedOperator.isPresent() && parsedJoin.isPresent()) {
        conditions.add(
            new Condition(
                field != null ? field.toString() : null,
                parsedOperator.get(),
                map.get("value"),
                parsedJoin.get()));
      }
    }
    return conditions;
  }

  static List<Action> decodeActions(Object raw, List<String> violations) {
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> list)) {
      violations.add("Actions must be a list");
      return List.of();
    }
    var actions = new ArrayList<Action>();
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) instanceof Map<?, ?> map) {
        actions.add(ActionCodec.decode(stringKeys(map)));
      } else {
        violations.add("Action " + i + " must be an object");
      }
    }
    return actions;
  }

  public static Map<String, Object> encodeTrigger(Trigger trigger) {
    var encoded = new LinkedHashMap<String, Object>();
    encoded.put("type", trigger.type().wireName());
    encoded.put("config", trigger.config());
    return encoded;
  }

  public static List<Map<String, Object>> encodeConditions(List<Condition> conditions) {
    return conditions.stream()
        .map(
            condition -> {
              var encoded = new LinkedHashMap<String, Object>();
              encoded.put("field", condition.field());
              encoded.put("operator", condition.operator().wireName());
              encoded.put("value", condition.value());
              encoded.put("logical_operator", condition.join().name());
              return (Map<String, Object>) encoded;
            })
        .toList();
  }

  public static List<Map<String, Object>> encodeActions(List<Action> actions) {
    return actions.stream().map(ActionCodec::encode).toList();
  }

  private static Map<String, Object> stringKeys(Object raw) {
    var result = new LinkedHashMap<String, Object>();
    if (raw instanceof Map<?, ?> map) {
      map.forEach((k, v) -> result.put(String.valueOf(k), v));
    }
    return result;
  }
}
