package io.b2mash.b2b.automation.recurring;

import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.exception.InvalidStateException;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates the task rows of a recurring series up front. The first task is due on the template's
 * {@code due_date} (today when absent); each following one is one interval later. Creation stops
 * at the occurrence cap or at the first date past the end date, whichever comes first.
 */
@Service
public class RecurringTaskService {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskService.class);

  private final TabularStore store;
  private final AutomationLogService automationLogService;
  private final AutomationProperties properties;
  private final Clock clock;

  public RecurringTaskService(
      TabularStore store,
      AutomationLogService automationLogService,
      AutomationProperties properties,
      Clock clock) {
    this.store = store;
    this.automationLogService = automationLogService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates one task per occurrence from {@code taskFields}. Each copy gets its own {@code
   * due_date} and the title suffixed with its 1-based occurrence number, e.g. {@code "Weekly
   * report (3)"}.
   *
   * @return ids of the created tasks, in due-date order
   * @throws InvalidStateException if the template has no title or project, or the configuration is
   *     out of range
   */
  public List<String> scheduleRecurringTask(
      Map<String, Object> taskFields, RecurringTaskConfig config) {
    validate(taskFields, config);
    LocalDate start = RowValues.date(taskFields, "due_date");
    if (start == null) {
      start = LocalDate.ofInstant(clock.instant(), properties.zoneId());
    }
    String title = RowValues.string(taskFields, "title");

    var taskIds = new ArrayList<String>();
    try {
      for (int occurrence = 0; occurrence < config.effectiveMaxOccurrences(); occurrence++) {
        LocalDate dueDate = config.frequency().occurrence(start, config.interval(), occurrence);
        if (config.endDate() != null && dueDate.isAfter(config.endDate())) {
          break;
        }
        var row = new LinkedHashMap<>(taskFields);
        row.remove("id");
        row.put("title", title + " (" + (occurrence + 1) + ")");
        row.put("due_date", dueDate.toString());
        row.putIfAbsent("status", "todo");
        row.put("created_at", clock.instant().toString());
        taskIds.add(store.create(StoreCollections.TASKS, row));
      }
    } catch (StoreException e) {
      log.error("Recurring task creation stopped after {} task(s)", taskIds.size(), e);
      automationLogService.log(
          AutomationLogBuilder.builder()
              .action("recurring_tasks_scheduled")
              .detail("task_ids", List.copyOf(taskIds))
              .error(e)
              .build(clock));
      throw e;
    }

    log.info(
        "Scheduled {} recurring task(s) '{}' {} every {}",
        taskIds.size(),
        title,
        config.frequency().wireName(),
        config.interval());
    automationLogService.log(
        AutomationLogBuilder.builder()
            .action("recurring_tasks_scheduled")
            .detail("task_ids", List.copyOf(taskIds))
            .detail("frequency", config.frequency().wireName())
            .detail("interval", config.interval())
            .build(clock));
    return taskIds;
  }

  private static void validate(Map<String, Object> taskFields, RecurringTaskConfig config) {
    if (taskFields == null || isBlank(RowValues.string(taskFields, "title"))) {
      throw new InvalidStateException("Invalid recurring task", "Task title is required");
    }
    if (isBlank(RowValues.string(taskFields, "project_id"))) {
      throw new InvalidStateException("Invalid recurring task", "Project ID is required");
    }
    if (config == null || config.frequency() == null) {
      throw new InvalidStateException("Invalid recurring task", "Frequency is required");
    }
    if (config.interval() < 1) {
      throw new InvalidStateException(
          "Invalid recurring task", "Interval must be a positive integer");
    }
    if (config.maxOccurrences() != null && config.maxOccurrences() < 1) {
      throw new InvalidStateException(
          "Invalid recurring task", "Max occurrences must be positive");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
