package io.b2mash.b2b.automation.rule;

import java.util.Locale;
import java.util.Optional;

/** How a condition's result combines with the next condition's result. */
public enum LogicalJoin {
  AND {
    @Override
    public boolean apply(boolean left, boolean right) {
      return left && right;
    }
  },
  OR {
    @Override
    public boolean apply(boolean left, boolean right) {
      return left || right;
    }
  };

  public abstract boolean apply(boolean left, boolean right);

  public static Optional<LogicalJoin> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.of(AND);
    }
    return switch (value.trim().toUpperCase(Locale.ROOT)) {
      case "AND" -> Optional.of(AND);
      case "OR" -> Optional.of(OR);
      default -> Optional.empty();
    };
  }
}
