package io.b2mash.b2b.automation.sweep;

import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.engine.AutomationEngine;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Marks invoices overdue once their due date has passed and fires {@code invoice_overdue} for each.
 * An invoice is picked up only while its status is open (not yet overdue, paid, cancelled or
 * draft), so a repeated sweep never fires twice for the same invoice.
 */
@Component
public class OverdueInvoiceSweep {

  private static final Logger log = LoggerFactory.getLogger(OverdueInvoiceSweep.class);

  static final Set<String> EXCLUDED_STATUSES = Set.of("overdue", "paid", "cancelled", "draft");

  private final TabularStore store;
  private final AutomationEngine engine;
  private final AutomationProperties properties;
  private final Clock clock;

  public OverdueInvoiceSweep(
      TabularStore store, AutomationEngine engine, AutomationProperties properties, Clock clock) {
    this.store = store;
    this.engine = engine;
    this.properties = properties;
    this.clock = clock;
  }

  /** Returns the number of invoices transitioned to overdue. */
  public int run() {
    LocalDate today = LocalDate.ofInstant(clock.instant(), properties.zoneId());
    int transitioned = 0;
    for (var invoice : store.readAll(StoreCollections.INVOICES)) {
      String invoiceId = RowValues.string(invoice, "id");
      LocalDate dueDate = RowValues.date(invoice, "due_date");
      if (dueDate == null || !dueDate.isBefore(today) || !isOpen(invoice)) {
        continue;
      }
      try {
        if (!store.update(
            StoreCollections.INVOICES,
            invoiceId,
            Map.of("status", "overdue", "updated_at", clock.instant().toString()))) {
          continue;
        }
        transitioned++;
        engine.onInvoiceOverdue(invoiceId);
      } catch (StoreException e) {
        log.warn("Could not mark invoice {} overdue: {}", invoiceId, e.getMessage());
      }
    }
    if (transitioned > 0) {
      log.info("Overdue sweep marked {} invoice(s) overdue", transitioned);
    }
    return transitioned;
  }

  private static boolean isOpen(Map<String, Object> invoice) {
    String status = RowValues.string(invoice, "status");
    return status == null || !EXCLUDED_STATUSES.contains(status.toLowerCase(Locale.ROOT));
  }
}
