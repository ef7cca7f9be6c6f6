package io.b2mash.b2b.automation.action;

import java.util.Map;

/**
 * A stored action whose type is not in the catalog. Kept so the rest of the rule still runs; the
 * dispatcher skips it with a warning.
 */
public record UnrecognizedAction(String rawType, Map<String, Object> parameters)
    implements Action {

  public UnrecognizedAction {
    parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
  }

  @Override
  public ActionType type() {
    return null;
  }

  @Override
  public String typeName() {
    return rawType != null ? rawType : "unknown";
  }
}
