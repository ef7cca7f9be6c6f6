package io.b2mash.b2b.automation.audit;

import io.b2mash.b2b.automation.store.JsonColumns;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** {@link AutomationLogService} backed by the {@code automation_logs} collection. */
@Service
public class StoreAutomationLogService implements AutomationLogService {

  private static final Logger log = LoggerFactory.getLogger(StoreAutomationLogService.class);

  private final TabularStore store;
  private final JsonColumns jsonColumns;

  public StoreAutomationLogService(TabularStore store, JsonColumns jsonColumns) {
    this.store = store;
    this.jsonColumns = jsonColumns;
  }

  @Override
  public void log(AutomationLogRecord record) {
    try {
      var row = new LinkedHashMap<String, Object>();
      row.put("type", "automation");
      row.put("entity_id", record.entityId());
      row.put("action", record.action());
      row.put("status", record.status());
      row.put("details", jsonColumns.write(record.details()));
      row.put("timestamp", record.timestamp().toString());
      store.create(StoreCollections.AUTOMATION_LOGS, row);
      log.debug(
          "Recorded automation log: action={}, entity={}, status={}",
          record.action(),
          record.entityId(),
          record.status());
    } catch (StoreException e) {
      log.warn("Failed to record automation log action={}: {}", record.action(), e.getMessage());
    }
  }

  @Override
  public List<AutomationLogRecord> findBetween(Instant start, Instant end) {
    var result = new ArrayList<AutomationLogRecord>();
    for (var row : store.readAll(StoreCollections.AUTOMATION_LOGS)) {
      Instant timestamp = RowValues.instant(row, "timestamp");
      if (timestamp != null && !timestamp.isBefore(start) && !timestamp.isAfter(end)) {
        result.add(toRecord(row, timestamp));
      }
    }
    return result;
  }

  @Override
  public int deleteOlderThan(Instant cutoff) {
    int deleted = 0;
    for (var row : store.readAll(StoreCollections.AUTOMATION_LOGS)) {
      Instant timestamp = RowValues.instant(row, "timestamp");
      if (timestamp != null
          && timestamp.isBefore(cutoff)
          && store.delete(StoreCollections.AUTOMATION_LOGS, RowValues.string(row, "id"))) {
        deleted++;
      }
    }
    return deleted;
  }

  private AutomationLogRecord toRecord(Map<String, Object> row, Instant timestamp) {
    Map<String, Object> details;
    try {
      details = jsonColumns.readMap(row.get("details"));
    } catch (StoreException e) {
      details = Map.of();
    }
    return new AutomationLogRecord(
        RowValues.string(row, "id"),
        RowValues.string(row, "action"),
        RowValues.string(row, "entity_id"),
        RowValues.string(row, "status"),
        details,
        timestamp);
  }
}
