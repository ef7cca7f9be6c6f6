package io.b2mash.b2b.automation.rule;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.b2mash.b2b.automation.config.AutomationProperties;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Selects the active rules an event fires. The active-rule set is read once and cached; {@link
 * RuleService} invalidates it on every change, and entries expire so rows edited directly in the
 * store are picked up eventually.
 */
@Component
public class RuleMatcher {

  private static final String ACTIVE_RULES = "active";

  private final ConditionEvaluator conditionEvaluator;
  private final LoadingCache<String, List<Rule>> activeRules;

  public RuleMatcher(
      RuleRepository ruleRepository,
      ConditionEvaluator conditionEvaluator,
      AutomationProperties properties) {
    this.conditionEvaluator = conditionEvaluator;
    this.activeRules =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.ruleCacheTtl())
            .maximumSize(1)
            .build(
                key ->
                    ruleRepository.findActive().stream().sorted(Rule.CREATION_ORDER).toList());
  }

  /**
   * Returns the active rules whose trigger type equals {@code triggerType} and whose conditions
   * hold for the context, oldest rule first.
   */
  public List<Rule> match(TriggerType triggerType, Map<String, ?> context) {
    return activeRules.get(ACTIVE_RULES).stream()
        .filter(rule -> rule.triggerType() == triggerType)
        .filter(rule -> conditionEvaluator.evaluate(rule.conditions(), context))
        .toList();
  }

  public void invalidate() {
    activeRules.invalidateAll();
  }
}
