package io.b2mash.b2b.automation.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduling infrastructure. A single scheduler thread runs every reminder timer and sweep tick, so
 * engine work stays on one cooperative control flow: a slow handler delays whatever is due next
 * instead of running concurrently with it.
 */
@Configuration
@EnableConfigurationProperties(AutomationProperties.class)
public class SchedulingConfig {

  private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

  @Bean
  public TaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("automation-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.setErrorHandler(t -> log.error("Unhandled error on automation scheduler thread", t));
    return scheduler;
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
