package io.b2mash.b2b.automation.sweep;

import io.b2mash.b2b.automation.engine.AutomationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polling ticks that stand in for a change feed. Cadences are configurable under {@code
 * automation.sweep.*}; defaults are hourly for overdue invoices, six-hourly for approaching
 * deadlines, and daily for late fees and retention. Ticks do nothing while the engine is stopped,
 * and each catches its own failures so one bad tick never stops the next.
 */
@Component
public class PeriodicSweep {

  private static final Logger log = LoggerFactory.getLogger(PeriodicSweep.class);

  private final AutomationEngine engine;
  private final OverdueInvoiceSweep overdueInvoiceSweep;
  private final DeadlineSweep deadlineSweep;
  private final LateFeeSweep lateFeeSweep;
  private final RetentionCleanup retentionCleanup;

  public PeriodicSweep(
      AutomationEngine engine,
      OverdueInvoiceSweep overdueInvoiceSweep,
      DeadlineSweep deadlineSweep,
      LateFeeSweep lateFeeSweep,
      RetentionCleanup retentionCleanup) {
    this.engine = engine;
    this.overdueInvoiceSweep = overdueInvoiceSweep;
    this.deadlineSweep = deadlineSweep;
    this.lateFeeSweep = lateFeeSweep;
    this.retentionCleanup = retentionCleanup;
  }

  @Scheduled(
      fixedRateString = "${automation.sweep.overdue-interval:PT1H}",
      initialDelayString = "${automation.sweep.initial-delay:PT1M}")
  public void checkOverdueInvoices() {
    if (!engine.isRunning()) {
      return;
    }
    try {
      overdueInvoiceSweep.run();
    } catch (RuntimeException e) {
      log.error("Overdue invoice sweep failed", e);
    }
  }

  @Scheduled(
      fixedRateString = "${automation.sweep.deadline-interval:PT6H}",
      initialDelayString = "${automation.sweep.initial-delay:PT1M}")
  public void checkApproachingDeadlines() {
    if (!engine.isRunning()) {
      return;
    }
    try {
      deadlineSweep.run();
    } catch (RuntimeException e) {
      log.error("Approaching deadline sweep failed", e);
    }
  }

  @Scheduled(
      fixedRateString = "${automation.sweep.late-fee-interval:P1D}",
      initialDelayString = "${automation.sweep.initial-delay:PT1M}")
  public void applyLateFees() {
    if (!engine.isRunning()) {
      return;
    }
    try {
      lateFeeSweep.run();
    } catch (RuntimeException e) {
      log.error("Late fee sweep failed", e);
    }
  }

  @Scheduled(
      fixedRateString = "${automation.sweep.retention-interval:P1D}",
      initialDelayString = "${automation.sweep.initial-delay:PT1M}")
  public void cleanupOldExecutions() {
    if (!engine.isRunning()) {
      return;
    }
    try {
      retentionCleanup.run();
    } catch (RuntimeException e) {
      log.error("Retention cleanup failed", e);
    }
  }
}
