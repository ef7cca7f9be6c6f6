package io.b2mash.b2b.automation.notification.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-in transport that only logs. Registered for "email" and "sms" until the host application
 * provides real channel beans with those ids.
 */
public class LoggingNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

  private final String channelId;

  public LoggingNotificationChannel(String channelId) {
    this.channelId = channelId;
  }

  @Override
  public String channelId() {
    return channelId;
  }

  @Override
  public void deliver(RenderedNotification notification, String recipient) {
    log.info(
        "[{}] to={} template={} subject='{}'",
        channelId,
        recipient,
        notification.templateId(),
        notification.subject());
    log.debug("[{}] body: {}", channelId, notification.body());
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
