package io.b2mash.b2b.automation.notification.channel;

public class NotificationDeliveryException extends RuntimeException {

  public NotificationDeliveryException(String message) {
    super(message);
  }

  public NotificationDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
