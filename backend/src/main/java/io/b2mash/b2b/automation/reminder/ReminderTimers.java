package io.b2mash.b2b.automation.reminder;

import java.time.Instant;

/** Arms one-shot callbacks. The production implementation runs them on the scheduler thread. */
public interface ReminderTimers {

  TimerHandle arm(Instant fireAt, Runnable callback);

  /** A live timer. Cancelling a timer that already fired has no effect. */
  interface TimerHandle {
    void cancel();
  }
}
