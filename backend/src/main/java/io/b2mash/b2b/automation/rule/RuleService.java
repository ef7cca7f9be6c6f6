package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.exception.InvalidRuleException;
import io.b2mash.b2b.automation.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Rule authoring. Every change invalidates the matcher's active-rule cache. */
@Service
public class RuleService {

  private static final Logger log = LoggerFactory.getLogger(RuleService.class);

  private final RuleRepository ruleRepository;
  private final RuleValidator ruleValidator;
  private final RuleMatcher ruleMatcher;
  private final AutomationLogService automationLogService;
  private final Clock clock;

  public RuleService(
      RuleRepository ruleRepository,
      RuleValidator ruleValidator,
      RuleMatcher ruleMatcher,
      AutomationLogService automationLogService,
      Clock clock) {
    this.ruleRepository = ruleRepository;
    this.ruleValidator = ruleValidator;
    this.ruleMatcher = ruleMatcher;
    this.automationLogService = automationLogService;
    this.clock = clock;
  }

  public Rule createRule(RuleDraft draft) {
    requireValid(draft);
    Instant now = clock.instant();
    var rule =
        new Rule(
            null,
            draft.name(),
            draft.description(),
            draft.trigger(),
            draft.conditions(),
            draft.actions(),
            draft.active(),
            now,
            now);
    String id = ruleRepository.create(rule);
    ruleMatcher.invalidate();
    log.info(
        "Created automation rule id={} name='{}' trigger={}", id, rule.name(), rule.triggerType());
    automationLogService.log(
        AutomationLogBuilder.builder()
            .action("automation_rule_created")
            .entityId(id)
            .detail("name", rule.name())
            .detail("trigger", rule.triggerType().wireName())
            .build(clock));
    return new Rule(
        id,
        rule.name(),
        rule.description(),
        rule.trigger(),
        rule.conditions(),
        rule.actions(),
        rule.active(),
        now,
        now);
  }

  /** Replaces the definition of an existing rule; its id and creation time are kept. */
  public Rule updateRule(String id, RuleDraft draft) {
    var existing = getRule(id);
    requireValid(draft);
    var updated =
        new Rule(
            id,
            draft.name(),
            draft.description(),
            draft.trigger(),
            draft.conditions(),
            draft.actions(),
            draft.active(),
            existing.createdAt(),
            clock.instant());
    ruleRepository.update(updated);
    ruleMatcher.invalidate();
    log.info("Updated automation rule id={}", id);
    automationLogService.log(
        AutomationLogBuilder.builder()
            .action("automation_rule_updated")
            .entityId(id)
            .detail("name", updated.name())
            .build(clock));
    return updated;
  }

  /** Deactivates the rule. Its row and execution history stay in the store. */
  public void deleteRule(String id) {
    var existing = getRule(id);
    ruleRepository.update(existing.withActive(false, clock.instant()));
    ruleMatcher.invalidate();
    log.info("Deactivated automation rule id={}", id);
    automationLogService.log(
        AutomationLogBuilder.builder()
            .action("automation_rule_deleted")
            .entityId(id)
            .build(clock));
  }

  public Rule getRule(String id) {
    return ruleRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("AutomationRule", id));
  }

  /** All readable rules, active or not, in creation order. */
  public List<Rule> listRules() {
    return ruleRepository.findAll().stream().sorted(Rule.CREATION_ORDER).toList();
  }

  private void requireValid(RuleDraft draft) {
    var violations = ruleValidator.validate(draft);
    if (!violations.isEmpty()) {
      log.debug("Rejected automation rule '{}': {}", draft.name(), violations);
      throw new InvalidRuleException(violations);
    }
  }
}
