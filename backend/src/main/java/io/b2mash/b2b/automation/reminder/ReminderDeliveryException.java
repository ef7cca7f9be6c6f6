package io.b2mash.b2b.automation.reminder;

/** A reminder could not be delivered: its entity is gone or every channel failed. */
public class ReminderDeliveryException extends RuntimeException {

  public ReminderDeliveryException(String message) {
    super(message);
  }
}
