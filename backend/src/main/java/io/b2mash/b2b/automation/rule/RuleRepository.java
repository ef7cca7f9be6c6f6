package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.store.JsonColumns;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Maps {@link Rule} to rows of the {@code automation_rules} collection. Trigger, conditions and
 * actions are stored as JSON text columns.
 *
 * <p>Rows that no longer decode (an unknown trigger type or operator written by another tool) are
 * skipped with a warning rather than failing every read.
 */
@Repository
public class RuleRepository {

  private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

  private final TabularStore store;
  private final JsonColumns jsonColumns;

  public RuleRepository(TabularStore store, JsonColumns jsonColumns) {
    this.store = store;
    this.jsonColumns = jsonColumns;
  }

  public List<Rule> findAll() {
    var rules = new ArrayList<Rule>();
    for (var row : store.readAll(StoreCollections.AUTOMATION_RULES)) {
      toRule(row).ifPresent(rules::add);
    }
    return rules;
  }

  public List<Rule> findActive() {
    return findAll().stream().filter(Rule::active).toList();
  }

  public Optional<Rule> findById(String id) {
    return store.findById(StoreCollections.AUTOMATION_RULES, id).flatMap(this::toRule);
  }

  public boolean isEmpty() {
    return store.readAll(StoreCollections.AUTOMATION_RULES).isEmpty();
  }

  /** Inserts a new rule and returns the stored id. */
  public String create(Rule rule) {
    return store.create(StoreCollections.AUTOMATION_RULES, toRow(rule));
  }

  public boolean update(Rule rule) {
    var row = toRow(rule);
    row.remove("id");
    row.remove("created_at");
    return store.update(StoreCollections.AUTOMATION_RULES, rule.id(), row);
  }

  private Map<String, Object> toRow(Rule rule) {
    var row = new LinkedHashMap<String, Object>();
    if (rule.id() != null) {
      row.put("id", rule.id());
    }
    row.put("name", rule.name());
    row.put("description", rule.description());
    row.put("trigger", jsonColumns.write(RuleCodec.encodeTrigger(rule.trigger())));
    row.put("conditions", jsonColumns.write(RuleCodec.encodeConditions(rule.conditions())));
    row.put("actions", jsonColumns.write(RuleCodec.encodeActions(rule.actions())));
    row.put("is_active", rule.active());
    row.put("created_at", rule.createdAt() != null ? rule.createdAt().toString() : null);
    row.put("updated_at", rule.updatedAt() != null ? rule.updatedAt().toString() : null);
    return row;
  }

  private Optional<Rule> toRule(Map<String, Object> row) {
    String id = RowValues.string(row, "id");
    var violations = new ArrayList<String>();
    try {
      var trigger = RuleCodec.decodeTrigger(jsonColumns.readMap(row.get("trigger")), violations);
      var conditions =
          RuleCodec.decodeConditions(jsonColumns.readList(row.get("conditions")), violations);
      var actions = RuleCodec.decodeActions(jsonColumns.readList(row.get("actions")), violations);
      if (!violations.isEmpty()) {
        log.warn("Skipping malformed automation rule id={}: {}", id, violations);
        return Optional.empty();
      }
      return Optional.of(
          new Rule(
              id,
              RowValues.string(row, "name"),
              RowValues.string(row, "description"),
              trigger,
              conditions,
              actions,
              RowValues.bool(row, "is_active"),
              RowValues.instant(row, "created_at"),
              RowValues.instant(row, "updated_at")));
    } catch (StoreException e) {
      log.warn("Skipping unreadable automation rule id={}: {}", id, e.getMessage());
      return Optional.empty();
    }
  }
}
