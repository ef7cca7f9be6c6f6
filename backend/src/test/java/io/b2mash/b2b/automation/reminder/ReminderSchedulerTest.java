package io.b2mash.b2b.automation.reminder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.b2mash.b2b.automation.action.CallWebhookAction;
import io.b2mash.b2b.automation.rule.RuleDraft;
import io.b2mash.b2b.automation.rule.Trigger;
import io.b2mash.b2b.automation.rule.TriggerType;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.testutil.AutomationFixture;
import io.b2mash.b2b.automation.testutil.FlakyTabularStore;
import io.b2mash.b2b.automation.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReminderSchedulerTest {

  private static final Instant DUE = Instant.parse("2025-03-10T09:00:00Z");

  private MutableClock clock;
  private AutomationFixture fixture;
  private ReminderScheduler scheduler;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-03-01T10:00:00Z");
    fixture = new AutomationFixture(clock).seedDefaults();
    scheduler = fixture.reminderScheduler;
    fixture.insert(
        StoreCollections.CLIENTS, Map.of("id", "c-1", "name", "Acme", "email", "ap@acme.test"));
    fixture.insert(
        StoreCollections.INVOICES,
        Map.of(
            "id", "inv-1",
            "client_id", "c-1",
            "invoice_number", "INV-1",
            "total_amount", "500.00",
            "due_date", "2025-03-10",
            "status", "sent"));
    fixture.engine.start();
  }

  @Test
  void scheduleReminder_daysBefore_persistsOnePendingRowAndArmsIt() {
    var created = schedulePaymentReminder(3);

    assertThat(created)
        .singleElement()
        .satisfies(
            schedule -> {
              assertThat(schedule.scheduledAt()).isEqualTo(Instant.parse("2025-03-07T09:00:00Z"));
              assertThat(schedule.isPending()).isTrue();
            });
    assertThat(scheduler.armedScheduleIds()).containsExactly(created.get(0).id());
    assertThat(fixture.scheduleRepository.findPending()).hasSize(1);
  }

  @Test
  void scheduleReminder_pastDate_yieldsNothing() {
    assertThat(schedulePaymentReminder(20)).isEmpty();
    assertThat(fixture.scheduleRepository.findAll()).isEmpty();
  }

  @Test
  void firing_deliversMarksSentAndTriggersRules() {
    fixture.ruleService.createRule(
        new RuleDraft(
            "Notify ledger",
            null,
            Trigger.of(TriggerType.INVOICE_DUE),
            List.of(),
            List.of(new CallWebhookAction("https://ledger.example.test", Map.of())),
            true));
    var schedule = schedulePaymentReminder(3).get(0);

    clock.set(schedule.scheduledAt());
    fixture.timers.fireDue(clock.instant());

    var fired = fixture.scheduleRepository.findById(schedule.id()).orElseThrow();
    assertThat(fired.status()).isEqualTo(ReminderStatus.SENT);
    assertThat(fired.attempts()).isEqualTo(1);
    assertThat(fired.lastAttemptAt()).isEqualTo(schedule.scheduledAt());
    assertThat(fixture.email.deliveries())
        .singleElement()
        .satisfies(
            delivery -> {
              assertThat(delivery.recipient()).isEqualTo("ap@acme.test");
              assertThat(delivery.notification().subject())
                  .isEqualTo("Payment Reminder: Invoice INV-1");
            });
    assertThat(scheduler.armedScheduleIds()).isEmpty();
    assertThat(fixture.webhooks.calls())
        .singleElement()
        .satisfies(
            call ->
                assertThat(call.payload())
                    .containsEntry("invoice_id", "inv-1")
                    .containsEntry("reminder_status", "sent")
                    .containsEntry("trigger_type", "invoice_due"));
  }

  @Test
  void firing_failedDelivery_marksFailedOnceAndStillPublishes() {
    fixture.email.setFailing(true);
    var schedule = schedulePaymentReminder(3).get(0);

    clock.set(schedule.scheduledAt());
    fixture.timers.fireDue(clock.instant());
    clock.advance(Duration.ofDays(1));
    fixture.timers.fireDue(clock.instant());

    var fired = fixture.scheduleRepository.findById(schedule.id()).orElseThrow();
    assertThat(fired.status()).isEqualTo(ReminderStatus.FAILED);
    assertThat(fired.attempts()).isEqualTo(1);
    assertThat(fixture.firedReminders)
        .singleElement()
        .satisfies(event -> assertThat(event.outcome()).isEqualTo(ReminderStatus.FAILED));
  }

  @Test
  void cancelPending_leavesNoPendingRowsAndNothingFires() {
    var created =
        scheduler.scheduleReminder(
            ReminderKind.INVOICE_PAYMENT,
            "inv-1",
            DUE,
            new ReminderConfig(3, 2, List.of(), "invoice_payment_reminder", null, null));

    int cancelled = scheduler.cancelPending(ReminderKind.INVOICE_PAYMENT, "inv-1");

    assertThat(cancelled).isEqualTo(2);
    assertThat(fixture.scheduleRepository.findPending(ReminderKind.INVOICE_PAYMENT, "inv-1"))
        .isEmpty();
    assertThat(scheduler.armedScheduleIds()).isEmpty();
    clock.set(DUE.plus(Duration.ofDays(5)));
    assertThat(fixture.timers.fireDue(clock.instant())).isZero();
    assertThat(fixture.email.deliveries()).isEmpty();
    assertThat(fixture.scheduleRepository.findById(created.get(0).id()).orElseThrow().status())
        .isEqualTo(ReminderStatus.CANCELLED);
  }

  @Test
  void stop_cancelsTimersButKeepsRowsPending() {
    schedulePaymentReminder(3);

    fixture.engine.stop();

    assertThat(scheduler.armedScheduleIds()).isEmpty();
    assertThat(fixture.timers.liveCount()).isZero();
    assertThat(fixture.scheduleRepository.findPending()).hasSize(1);
  }

  @Test
  void recover_rearmsFutureRows_andLeavesPastDueRowsPending() {
    var early = schedulePaymentReminder(5).get(0);
    var late = schedulePaymentReminder(1).get(0);
    fixture.engine.stop();

    clock.set(Instant.parse("2025-03-07T00:00:00Z"));
    var recovery = scheduler.recover();

    assertThat(recovery.rearmed()).isEqualTo(1);
    assertThat(recovery.pastDue()).isEqualTo(1);
    assertThat(scheduler.armedScheduleIds()).containsExactly(late.id());
    assertThat(fixture.scheduleRepository.findById(early.id()).orElseThrow().isPending()).isTrue();
    assertThat(fixture.email.deliveries()).isEmpty();
  }

  @Test
  void remindersDueTogether_fireInRegistrationOrder() {
    fixture.insert(
        StoreCollections.INVOICES,
        Map.of(
            "id", "inv-2",
            "client_id", "c-1",
            "invoice_number", "INV-2",
            "total_amount", "80.00",
            "due_date", "2025-03-10",
            "status", "sent"));
    schedulePaymentReminder(3);
    scheduler.scheduleReminder(
        ReminderKind.INVOICE_PAYMENT,
        "inv-2",
        DUE,
        ReminderConfig.daysBefore(3, "invoice_payment_reminder"));

    clock.set(Instant.parse("2025-03-07T09:00:00Z"));
    fixture.timers.fireDue(clock.instant());

    assertThat(fixture.firedReminders)
        .extracting(event -> event.schedule().entityId())
        .containsExactly("inv-1", "inv-2");
  }

  @Test
  void scheduling_whileStopped_persistsWithoutArming() {
    fixture.engine.stop();

    var created = schedulePaymentReminder(3);

    assertThat(created).hasSize(1);
    assertThat(scheduler.armedScheduleIds()).isEmpty();
  }

  @Test
  void firing_whenScheduleStoreFails_neverEscapesTheTimer() {
    var store = new FlakyTabularStore();
    var flaky = new AutomationFixture(clock, store).seedDefaults();
    flaky.insert(
        StoreCollections.CLIENTS, Map.of("id", "c-1", "name", "Acme", "email", "ap@acme.test"));
    flaky.insert(
        StoreCollections.INVOICES,
        Map.of("id", "inv-1", "client_id", "c-1", "due_date", "2025-03-10", "status", "sent"));
    flaky.engine.start();
    var schedule =
        flaky
            .reminderScheduler
            .scheduleReminder(
                ReminderKind.INVOICE_PAYMENT,
                "inv-1",
                DUE,
                ReminderConfig.daysBefore(3, "invoice_payment_reminder"))
            .get(0);
    store.failOn(StoreCollections.REMINDER_SCHEDULES);
    clock.set(schedule.scheduledAt());

    assertThatCode(() -> flaky.timers.fireDue(clock.instant())).doesNotThrowAnyException();

    store.recover();
    assertThat(flaky.scheduleRepository.findById(schedule.id()).orElseThrow().isPending()).isTrue();
    assertThat(flaky.email.deliveries()).isEmpty();
    assertThat(flaky.firedReminders).isEmpty();
  }

  @Test
  void firing_whenEntityStoreFails_marksFailed() {
    var store = new FlakyTabularStore();
    var flaky = new AutomationFixture(clock, store).seedDefaults();
    flaky.insert(
        StoreCollections.INVOICES,
        Map.of("id", "inv-1", "client_id", "c-1", "due_date", "2025-03-10", "status", "sent"));
    flaky.engine.start();
    var schedule =
        flaky
            .reminderScheduler
            .scheduleReminder(
                ReminderKind.INVOICE_PAYMENT,
                "inv-1",
                DUE,
                ReminderConfig.daysBefore(3, "invoice_payment_reminder"))
            .get(0);
    store.failOn(StoreCollections.INVOICES);
    clock.set(schedule.scheduledAt());

    assertThatCode(() -> flaky.timers.fireDue(clock.instant())).doesNotThrowAnyException();

    var fired = flaky.scheduleRepository.findById(schedule.id()).orElseThrow();
    assertThat(fired.status()).isEqualTo(ReminderStatus.FAILED);
    assertThat(fired.attempts()).isEqualTo(1);
  }

  private List<ReminderSchedule> schedulePaymentReminder(int daysBefore) {
    return scheduler.scheduleReminder(
        ReminderKind.INVOICE_PAYMENT,
        "inv-1",
        DUE,
        ReminderConfig.daysBefore(daysBefore, "invoice_payment_reminder"));
  }
}
