package io.b2mash.b2b.automation.audit;

import java.time.Instant;
import java.util.List;

/**
 * Records what the engine did, independent of SLF4J logging. Entries feed analytics (notifications
 * and reminders sent) and are purged by retention cleanup.
 */
public interface AutomationLogService {

  /**
   * Appends an entry. Never throws: a failure to write the log is itself only logged, so it cannot
   * break the firing that produced it.
   */
  void log(AutomationLogRecord record);

  /** Entries with {@code start <= timestamp <= end}, in store order. */
  List<AutomationLogRecord> findBetween(Instant start, Instant end);

  /** Deletes entries older than the cutoff and returns how many were removed. */
  int deleteOlderThan(Instant cutoff);
}
