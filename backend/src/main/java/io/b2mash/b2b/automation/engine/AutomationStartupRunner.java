package io.b2mash.b2b.automation.engine;

import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.rule.DefaultRuleSeeder;
import io.b2mash.b2b.automation.template.NotificationTemplateSeeder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds the default templates and rules into empty collections, then starts the engine unless
 * {@code automation.auto-start} is off. Both seeders only write when their collection is empty, so
 * running on every boot is safe. Seeding and start failures are logged and do not stop startup.
 */
@Component
@Order(100)
public class AutomationStartupRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(AutomationStartupRunner.class);

  private final NotificationTemplateSeeder templateSeeder;
  private final DefaultRuleSeeder ruleSeeder;
  private final AutomationEngine engine;
  private final AutomationProperties properties;

  public AutomationStartupRunner(
      NotificationTemplateSeeder templateSeeder,
      DefaultRuleSeeder ruleSeeder,
      AutomationEngine engine,
      AutomationProperties properties) {
    this.templateSeeder = templateSeeder;
    this.ruleSeeder = ruleSeeder;
    this.engine = engine;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    try {
      int templates = templateSeeder.seedIfEmpty();
      int rules = ruleSeeder.seedIfEmpty();
      log.info("Automation seeding completed: {} template(s), {} rule(s)", templates, rules);
    } catch (Exception e) {
      log.error("Automation seeding failed", e);
    }

    if (!properties.autoStart()) {
      log.info("automation.auto-start is off, engine left stopped");
      return;
    }
    try {
      engine.start();
    } catch (RuntimeException e) {
      log.error("Automation engine failed to start, leaving it stopped", e);
    }
  }

  @EventListener
  public void onContextClosed(ContextClosedEvent event) {
    engine.stop();
  }
}
