package io.b2mash.b2b.automation.rule;

import java.util.Map;

/**
 * The event a rule listens to.
 *
 * @param type trigger type matched exactly against incoming events
 * @param config free-form trigger configuration (e.g. "days_before" for deadline rules); carried
 *     for the host's authoring UI, not interpreted by matching
 */
public record Trigger(TriggerType type, Map<String, Object> config) {

  public Trigger {
    config = config != null ? Map.copyOf(config) : Map.of();
  }

  public static Trigger of(TriggerType type) {
    return new Trigger(type, Map.of());
  }
}
