package io.b2mash.b2b.automation.reminder;

import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.store.StoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Persists reminders and owns their in-process timers.
 *
 * <p>The armed-timer map is keyed by schedule id. While the scheduler is running, a timer is armed
 * exactly for the rows that are pending with a future {@code scheduledAt}: arming, firing,
 * cancelling and {@link #stop()} each keep the map and the rows in step. The map is guarded by this
 * object's monitor because scheduling calls arrive on host threads while timers fire on the
 * scheduler thread.
 *
 * <p>Firing is a single attempt. The row is reloaded, skipped unless still pending, delivered, and
 * marked sent or failed with {@code attempts + 1}. A {@link ReminderFiredEvent} follows either way.
 */
@Component
public class ReminderScheduler {

  private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

  private final ReminderScheduleRepository repository;
  private final ReminderDelivery delivery;
  private final ReminderTimers timers;
  private final ApplicationEventPublisher eventPublisher;
  private final AutomationProperties properties;
  private final Clock clock;

  private final Map<String, ReminderTimers.TimerHandle> armed = new LinkedHashMap<>();
  private boolean running;

  public ReminderScheduler(
      ReminderScheduleRepository repository,
      ReminderDelivery delivery,
      ReminderTimers timers,
      ApplicationEventPublisher eventPublisher,
      AutomationProperties properties,
      Clock clock) {
    this.repository = repository;
    this.delivery = delivery;
    this.timers = timers;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /** Result of {@link #recover()}. */
  public record Recovery(int rearmed, int pastDue) {}

  /**
   * Persists one pending reminder per future date computed from the target and arms its timer.
   * Returns the created schedules; empty when every candidate date is already past.
   */
  public List<ReminderSchedule> scheduleReminder(
      ReminderKind kind, String entityId, Instant targetDate, ReminderConfig config) {
    Instant now = clock.instant();
    var planned =
        ReminderDateCalculator.calculate(targetDate.atZone(properties.zoneId()), config, now);
    var created = new ArrayList<ReminderSchedule>();
    for (PlannedReminder reminder : planned) {
      var schedule =
          repository.create(
              ReminderSchedule.pending(
                  kind, entityId, reminder.scheduledAt(), reminder.config(), now));
      arm(schedule);
      created.add(schedule);
      log.info(
          "Scheduled {} reminder id={} entity={} at {}",
          kind.wireName(),
          schedule.id(),
          entityId,
          schedule.scheduledAt());
    }
    if (created.isEmpty()) {
      log.debug("No future reminder dates for {} entity={}", kind.wireName(), entityId);
    }
    return created;
  }

  /**
   * Persists a reminder due now and fires it on the calling thread. Used for follow-ups that are
   * sent at the moment they are requested.
   */
  public ReminderSchedule deliverNow(ReminderKind kind, String entityId, ReminderConfig config) {
    Instant now = clock.instant();
    var schedule = repository.create(ReminderSchedule.pending(kind, entityId, now, config, now));
    fire(schedule.id());
    return repository.findById(schedule.id()).orElse(schedule);
  }

  /** Cancels every pending reminder for the pair and its timer. Returns how many were cancelled. */
  public int cancelPending(ReminderKind kind, String entityId) {
    var pending = repository.findPending(kind, entityId);
    for (ReminderSchedule schedule : pending) {
      repository.markCancelled(schedule.id());
      disarm(schedule.id());
    }
    if (!pending.isEmpty()) {
      log.info(
          "Cancelled {} pending {} reminder(s) for entity={}",
          pending.size(),
          kind.wireName(),
          entityId);
    }
    return pending.size();
  }

  /**
   * Starts the scheduler and re-arms every pending reminder whose time is still ahead. Pending rows
   * already past due are left pending and only counted: they are not fired retroactively.
   */
  public Recovery recover() {
    var pending = repository.findPending();
    synchronized (this) {
      running = true;
    }
    Instant now = clock.instant();
    int rearmed = 0;
    var pastDue = new ArrayList<String>();
    for (ReminderSchedule schedule : pending) {
      if (schedule.scheduledAt().isAfter(now)) {
        arm(schedule);
        rearmed++;
      } else {
        pastDue.add(schedule.id());
      }
    }
    if (!pastDue.isEmpty()) {
      log.warn(
          "{} pending reminder(s) were due while the engine was down and will not be sent: {}",
          pastDue.size(),
          pastDue);
    }
    log.info("Reminder scheduler started: {} timer(s) re-armed", rearmed);
    return new Recovery(rearmed, pastDue.size());
  }

  /** Cancels every live timer. Rows stay pending for the next {@link #recover()}. */
  public synchronized void stop() {
    running = false;
    armed.values().forEach(ReminderTimers.TimerHandle::cancel);
    int count = armed.size();
    armed.clear();
    log.info("Reminder scheduler stopped: {} timer(s) cancelled", count);
  }

  public synchronized Set<String> armedScheduleIds() {
    return Set.copyOf(armed.keySet());
  }

  public synchronized boolean isRunning() {
    return running;
  }

  private synchronized void arm(ReminderSchedule schedule) {
    if (!running || !schedule.isPending() || !schedule.scheduledAt().isAfter(clock.instant())) {
      return;
    }
    String id = schedule.id();
    var previous = armed.put(id, timers.arm(schedule.scheduledAt(), () -> fire(id)));
    if (previous != null) {
      previous.cancel();
    }
  }

  private synchronized void disarm(String id) {
    var handle = armed.remove(id);
    if (handle != null) {
      handle.cancel();
    }
  }

  /** Timer callback. Never throws. */
  void fire(String scheduleId) {
    synchronized (this) {
      armed.remove(scheduleId);
    }
    try {
      var loaded = repository.findById(scheduleId);
      if (loaded.isEmpty() || !loaded.get().isPending()) {
        log.debug("Reminder {} is no longer pending, skipping", scheduleId);
        return;
      }
      var schedule = loaded.get();
      Map<String, Object> variables = Map.of();
      ReminderStatus outcome;
      try {
        variables = delivery.deliver(schedule);
        outcome = ReminderStatus.SENT;
      } catch (ReminderDeliveryException | StoreException e) {
        log.warn(
            "Reminder {} ({} entity={}) failed: {}",
            scheduleId,
            schedule.kind().wireName(),
            schedule.entityId(),
            e.getMessage());
        outcome = ReminderStatus.FAILED;
      }
      repository.recordAttempt(scheduleId, outcome, schedule.attempts() + 1, clock.instant());
      eventPublisher.publishEvent(new ReminderFiredEvent(schedule, outcome, variables));
    } catch (RuntimeException e) {
      log.error("Unexpected error firing reminder {}", scheduleId, e);
    }
  }
}
