package io.b2mash.b2b.automation.reminder;

import io.b2mash.b2b.automation.store.JsonColumns;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/** Maps {@link ReminderSchedule} to rows of {@code reminder_schedules}; config is a JSON column. */
@Repository
public class ReminderScheduleRepository {

  private static final Logger log = LoggerFactory.getLogger(ReminderScheduleRepository.class);

  private final TabularStore store;
  private final JsonColumns jsonColumns;

  public ReminderScheduleRepository(TabularStore store, JsonColumns jsonColumns) {
    this.store = store;
    this.jsonColumns = jsonColumns;
  }

  public ReminderSchedule create(ReminderSchedule schedule) {
    var row = new LinkedHashMap<String, Object>();
    row.put("type", schedule.kind().wireName());
    row.put("entity_id", schedule.entityId());
    row.put("scheduled_date", schedule.scheduledAt().toString());
    row.put("config", jsonColumns.write(encodeConfig(schedule.config())));
    row.put("status", schedule.status().wireName());
    row.put("attempts", schedule.attempts());
    row.put("created_at", schedule.createdAt().toString());
    return schedule.withId(store.create(StoreCollections.REMINDER_SCHEDULES, row));
  }

  public Optional<ReminderSchedule> findById(String id) {
    return store.findById(StoreCollections.REMINDER_SCHEDULES, id).flatMap(this::toSchedule);
  }

  public List<ReminderSchedule> findAll() {
    return decodeAll(store.readAll(StoreCollections.REMINDER_SCHEDULES));
  }

  public List<ReminderSchedule> findPending() {
    return decodeAll(
        store.query(
            StoreCollections.REMINDER_SCHEDULES,
            Map.of("status", ReminderStatus.PENDING.wireName())));
  }

  public List<ReminderSchedule> findPending(ReminderKind kind, String entityId) {
    return decodeAll(
        store.query(
            StoreCollections.REMINDER_SCHEDULES,
            Map.of(
                "type", kind.wireName(),
                "entity_id", entityId,
                "status", ReminderStatus.PENDING.wireName())));
  }

  public boolean hasPending(ReminderKind kind, String entityId) {
    return !findPending(kind, entityId).isEmpty();
  }

  public void markCancelled(String id) {
    store.update(
        StoreCollections.REMINDER_SCHEDULES,
        id,
        Map.of("status", ReminderStatus.CANCELLED.wireName()));
  }

  public void recordAttempt(String id, ReminderStatus status, int attempts, Instant attemptedAt) {
    store.update(
        StoreCollections.REMINDER_SCHEDULES,
        id,
        Map.of(
            "status", status.wireName(),
            "attempts", attempts,
            "last_attempt_at", attemptedAt.toString()));
  }

  public boolean delete(String id) {
    return store.delete(StoreCollections.REMINDER_SCHEDULES, id);
  }

  private List<ReminderSchedule> decodeAll(List<Map<String, Object>> rows) {
    var schedules = new ArrayList<ReminderSchedule>();
    rows.forEach(row -> toSchedule(row).ifPresent(schedules::add));
    return schedules;
  }

  private Optional<ReminderSchedule> toSchedule(Map<String, Object> row) {
    String id = RowValues.string(row, "id");
    var kind = ReminderKind.fromWire(RowValues.string(row, "type"));
    Instant scheduledAt = RowValues.instant(row, "scheduled_date");
    if (kind.isEmpty() || scheduledAt == null) {
      log.warn("Skipping malformed reminder schedule id={}", id);
      return Optional.empty();
    }
    return Optional.of(
        new ReminderSchedule(
            id,
            kind.get(),
            RowValues.string(row, "entity_id"),
            scheduledAt,
            decodeConfig(jsonColumns.readMap(row.get("config"))),
            ReminderStatus.fromWire(RowValues.string(row, "status")),
            RowValues.integer(row, "attempts", 0),
            RowValues.instant(row, "last_attempt_at"),
            RowValues.instant(row, "created_at")));
  }

  static Map<String, Object> encodeConfig(ReminderConfig config) {
    var encoded = new LinkedHashMap<String, Object>();
    if (config.daysBefore() != null) {
      encoded.put("days_before", config.daysBefore());
    }
    if (config.daysAfter() != null) {
      encoded.put("days_after", config.daysAfter());
    }
    if (!config.escalations().isEmpty()) {
      encoded.put(
          "escalation_rules",
          config.escalations().stream()
              .map(
                  step -> {
                    var s = new LinkedHashMap<String, Object>();
                    s.put("days_offset", step.daysOffset());
                    s.put("template", step.template());
                    s.put("method", step.method() != null ? step.method().wireName() : null);
                    s.put("priority", step.priority() != null ? step.priority().wireName() : null);
                    return s;
                  })
              .toList());
    }
    encoded.put("template", config.template());
    encoded.put("method", config.method().wireName());
    encoded.put("priority", config.priority().wireName());
    return encoded;
  }

  static ReminderConfig decodeConfig(Map<String, Object> raw) {
    var escalations = new ArrayList<EscalationStep>();
    if (raw.get("escalation_rules") instanceof List<?> steps) {
      for (Object step : steps) {
        if (step instanceof Map<?, ?> map) {
          @SuppressWarnings("unchecked")
          var s = (Map<String, Object>) map;
          escalations.add(
              new EscalationStep(
                  RowValues.integer(s, "days_offset", 0),
                  RowValues.string(s, "template"),
                  DeliveryMethod.fromWire(RowValues.string(s, "method")),
                  ReminderPriority.fromWire(RowValues.string(s, "priority"))));
        }
      }
    }
    return new ReminderConfig(
        optionalInt(raw, "days_before"),
        optionalInt(raw, "days_after"),
        escalations,
        RowValues.string(raw, "template"),
        DeliveryMethod.fromWire(RowValues.string(raw, "method")),
        ReminderPriority.fromWire(RowValues.string(raw, "priority")));
  }

  private static Integer optionalInt(Map<String, Object> raw, String key) {
    var value = RowValues.decimal(raw, key);
    return value != null ? value.intValue() : null;
  }
}
