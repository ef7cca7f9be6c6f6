package io.b2mash.b2b.automation.reminder;

import java.util.List;
import java.util.Locale;

/** Channels a reminder goes out on. */
public enum DeliveryMethod {
  EMAIL(List.of("email")),
  SMS(List.of("sms")),
  BOTH(List.of("email", "sms"));

  private final List<String> channels;

  DeliveryMethod(List<String> channels) {
    this.channels = channels;
  }

  public List<String> channels() {
    return channels;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Blank or unrecognized methods fall back to {@link #EMAIL}. */
  public static DeliveryMethod fromWire(String value) {
    if (value == null || value.isBlank()) {
      return EMAIL;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "sms" -> SMS;
      case "both" -> BOTH;
      default -> EMAIL;
    };
  }
}
