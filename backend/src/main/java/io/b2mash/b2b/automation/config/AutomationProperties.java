package io.b2mash.b2b.automation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the automation engine.
 *
 * @param autoStart whether the engine recovers reminders and enables sweeps once the application
 *     is ready
 * @param zone time zone used to turn entity dates (due dates, deadlines) into instants and to
 *     decide what "today" is
 * @param reminderTime local time of day at which date-based reminders fire
 * @param adminEmail recipient of internal (task due) reminders
 * @param defaultCurrency currency for invoices generated by the generate-invoice action
 * @param deadlineLookaheadDays how far ahead the deadline sweep looks for unscheduled deadlines
 * @param retentionDays age after which executions, logs and finished reminders are deleted
 * @param analyticsTopRules number of rules listed in the most-triggered ranking
 * @param ruleCacheTtl maximum age of the cached active-rule set
 * @param lateFeeThresholdDays days overdue after which the late fee sweep charges an invoice
 * @param lateFeePercentage late fee as a percentage of the invoice total
 */
@Validated
@ConfigurationProperties(prefix = "automation")
public record AutomationProperties(
    @DefaultValue("true") boolean autoStart,
    @DefaultValue("UTC") @NotBlank String zone,
    @DefaultValue("09:00") @NotNull LocalTime reminderTime,
    @DefaultValue("admin@example.com") @NotBlank String adminEmail,
    @DefaultValue("INR") @NotBlank String defaultCurrency,
    @DefaultValue("3") @Min(1) int deadlineLookaheadDays,
    @DefaultValue("30") @Min(1) int retentionDays,
    @DefaultValue("10") @Min(1) int analyticsTopRules,
    @DefaultValue("5m") @NotNull Duration ruleCacheTtl,
    @DefaultValue("15") @Min(1) int lateFeeThresholdDays,
    @DefaultValue("1.5") @NotNull BigDecimal lateFeePercentage) {

  /** Defaults matching {@code application.yml}, for code that runs outside a Spring context. */
  public static AutomationProperties defaults() {
    return new AutomationProperties(
        true,
        "UTC",
        LocalTime.of(9, 0),
        "admin@example.com",
        "INR",
        3,
        30,
        10,
        Duration.ofMinutes(5),
        15,
        new BigDecimal("1.5"));
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
