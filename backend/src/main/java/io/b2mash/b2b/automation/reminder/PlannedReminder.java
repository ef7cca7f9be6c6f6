package io.b2mash.b2b.automation.reminder;

import java.time.Instant;

/** A reminder date computed from a target date, with the config snapshot to store for it. */
public record PlannedReminder(Instant scheduledAt, ReminderConfig config) {}
