package io.b2mash.b2b.automation.reminder;

import java.time.Instant;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** {@link ReminderTimers} on the engine's single-threaded {@link TaskScheduler}. */
@Component
public class TaskSchedulerReminderTimers implements ReminderTimers {

  private final TaskScheduler taskScheduler;

  public TaskSchedulerReminderTimers(TaskScheduler taskScheduler) {
    this.taskScheduler = taskScheduler;
  }

  @Override
  public TimerHandle arm(Instant fireAt, Runnable callback) {
    var future = taskScheduler.schedule(callback, fireAt);
    return () -> future.cancel(false);
  }
}
