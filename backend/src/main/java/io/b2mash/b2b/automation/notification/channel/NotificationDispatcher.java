package io.b2mash.b2b.automation.notification.channel;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes rendered notifications to a channel by id. Channels self-register via constructor
 * injection (Spring collects all NotificationChannel beans); disabled channels are left out.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final Map<String, NotificationChannel> channels;

  public NotificationDispatcher(List<NotificationChannel> channelBeans) {
    this.channels =
        channelBeans.stream()
            .filter(NotificationChannel::isEnabled)
            .collect(Collectors.toMap(NotificationChannel::channelId, Function.identity()));
  }

  /** "in_app" and "IN-APP" both address the in-app channel. */
  public static String normalizeChannelId(String channelId) {
    return channelId == null ? null : channelId.trim().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  public DeliveryResult dispatch(
      String channelId, RenderedNotification notification, String recipient) {
    var channel = channels.get(normalizeChannelId(channelId));
    if (channel == null) {
      log.warn(
          "No enabled notification channel '{}' for template={}",
          channelId,
          notification.templateId());
      return DeliveryResult.failed("Unsupported notification channel: " + channelId);
    }
    if (recipient == null || recipient.isBlank()) {
      return DeliveryResult.failed("No recipient for channel " + channel.channelId());
    }
    try {
      channel.deliver(notification, recipient);
      return DeliveryResult.delivered();
    } catch (RuntimeException e) {
      log.warn(
          "Failed to deliver notification via channel={} template={}",
          channel.channelId(),
          notification.templateId(),
          e);
      return DeliveryResult.failed(e.getMessage());
    }
  }
}
