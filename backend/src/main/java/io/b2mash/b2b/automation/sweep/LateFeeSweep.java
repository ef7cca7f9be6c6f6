package io.b2mash.b2b.automation.sweep;

import io.b2mash.b2b.automation.action.ActionDispatcher;
import io.b2mash.b2b.automation.action.ActionResult;
import io.b2mash.b2b.automation.action.ApplyLateFeeAction;
import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Charges the configured late fee on invoices that have been overdue for at least {@code
 * automation.late-fee-threshold-days}. The overdue sweep fires {@code invoice_overdue} only on the
 * day an invoice turns overdue, so invoices that cross the threshold later are picked up here.
 * The {@code late_fee_applied} flag makes repeated passes charge each invoice once.
 */
@Component
public class LateFeeSweep {

  private static final Logger log = LoggerFactory.getLogger(LateFeeSweep.class);

  private final TabularStore store;
  private final ActionDispatcher actionDispatcher;
  private final AutomationLogService automationLogService;
  private final AutomationProperties properties;
  private final Clock clock;

  public LateFeeSweep(
      TabularStore store,
      ActionDispatcher actionDispatcher,
      AutomationLogService automationLogService,
      AutomationProperties properties,
      Clock clock) {
    this.store = store;
    this.actionDispatcher = actionDispatcher;
    this.automationLogService = automationLogService;
    this.properties = properties;
    this.clock = clock;
  }

  /** Returns the number of invoices charged. */
  public int run() {
    LocalDate today = LocalDate.ofInstant(clock.instant(), properties.zoneId());
    var action = new ApplyLateFeeAction(properties.lateFeePercentage(), null);
    int charged = 0;
    for (var invoice : store.query(StoreCollections.INVOICES, Map.of("status", "overdue"))) {
      String invoiceId = RowValues.string(invoice, "id");
      LocalDate dueDate = RowValues.date(invoice, "due_date");
      if (invoiceId == null || dueDate == null || RowValues.bool(invoice, "late_fee_applied")) {
        continue;
      }
      long daysOverdue = ChronoUnit.DAYS.between(dueDate, today);
      if (daysOverdue < properties.lateFeeThresholdDays()) {
        continue;
      }
      ActionResult result =
          actionDispatcher.execute(action, Map.of("invoice_id", invoiceId, "entity_id", invoiceId));
      automationLogService.log(
          AutomationLogBuilder.builder()
              .action("late_fee_sweep")
              .entityId(invoiceId)
              .detail("days_overdue", daysOverdue)
              .detail("outcome", result.outcome().name().toLowerCase(Locale.ROOT))
              .detail("message", result.message())
              .build(clock));
      if (result.isSuccess()) {
        charged++;
      }
    }
    if (charged > 0) {
      log.info("Late fee sweep charged {} invoice(s)", charged);
    }
    return charged;
  }
}
