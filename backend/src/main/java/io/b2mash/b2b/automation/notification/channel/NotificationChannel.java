package io.b2mash.b2b.automation.notification.channel;

/**
 * Abstraction for notification delivery channels. Each channel handles one delivery mechanism
 * (in-app, email, sms, webhook).
 */
public interface NotificationChannel {

  /** Unique identifier for this channel (e.g., "in-app", "email"). */
  String channelId();

  /**
   * Delivers a rendered notification via this channel.
   *
   * @param notification the rendered subject and body
   * @param recipient channel-specific address (email address, phone number, member id, URL)
   * @throws NotificationDeliveryException when the transport rejects the message
   */
  void deliver(RenderedNotification notification, String recipient);

  /** Whether this channel is currently enabled/available. */
  boolean isEnabled();
}
