package io.b2mash.b2b.automation.reminder;

import java.time.Instant;

/**
 * A persisted reminder. Pending until it fires (sent or failed) or is cancelled; removed only by
 * retention cleanup.
 */
public record ReminderSchedule(
    String id,
    ReminderKind kind,
    String entityId,
    Instant scheduledAt,
    ReminderConfig config,
    ReminderStatus status,
    int attempts,
    Instant lastAttemptAt,
    Instant createdAt) {

  public static ReminderSchedule pending(
      ReminderKind kind,
      String entityId,
      Instant scheduledAt,
      ReminderConfig config,
      Instant createdAt) {
    return new ReminderSchedule(
        null, kind, entityId, scheduledAt, config, ReminderStatus.PENDING, 0, null, createdAt);
  }

  public ReminderSchedule withId(String newId) {
    return new ReminderSchedule(
        newId, kind, entityId, scheduledAt, config, status, attempts, lastAttemptAt, createdAt);
  }

  public boolean isPending() {
    return status == ReminderStatus.PENDING;
  }
}
