package io.b2mash.b2b.automation.notification.channel;

public record DeliveryResult(boolean success, String errorMessage) {

  public static DeliveryResult delivered() {
    return new DeliveryResult(true, null);
  }

  public static DeliveryResult failed(String errorMessage) {
    return new DeliveryResult(false, errorMessage);
  }
}
