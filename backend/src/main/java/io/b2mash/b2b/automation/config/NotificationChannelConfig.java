package io.b2mash.b2b.automation.config;

import io.b2mash.b2b.automation.notification.channel.LoggingNotificationChannel;
import io.b2mash.b2b.automation.notification.channel.NotificationChannel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Logging stand-ins for the email and sms transports. A host application replaces either by
 * defining a bean with the same name.
 */
@Configuration
public class NotificationChannelConfig {

  @Bean
  @ConditionalOnMissingBean(name = "emailNotificationChannel")
  public NotificationChannel emailNotificationChannel() {
    return new LoggingNotificationChannel("email");
  }

  @Bean
  @ConditionalOnMissingBean(name = "smsNotificationChannel")
  public NotificationChannel smsNotificationChannel() {
    return new LoggingNotificationChannel("sms");
  }
}
