package io.b2mash.b2b.automation.rule;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum ConditionOperator {
  EQUALS("equals", "eq"),
  NOT_EQUALS("not_equals", "ne"),
  GREATER_THAN("greater_than", "gt"),
  LESS_THAN("less_than", "lt"),
  GREATER_THAN_OR_EQUAL("greater_than_or_equal", "gte"),
  LESS_THAN_OR_EQUAL("less_than_or_equal", "lte"),
  CONTAINS("contains"),
  NOT_CONTAINS("not_contains"),
  IS_EMPTY("is_empty"),
  IS_NOT_EMPTY("is_not_empty"),
  IN("in");

  private final String wireName;
  private final List<String> aliases;

  ConditionOperator(String wireName, String... aliases) {
    this.wireName = wireName;
    this.aliases = List.of(aliases);
  }

  public String wireName() {
    return wireName;
  }

  /** Accepts the wire name in snake or kebab case, or one of the short aliases. */
  public static Optional<ConditionOperator> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return Arrays.stream(values())
        .filter(op -> op.wireName.equals(normalized) || op.aliases.contains(normalized))
        .findFirst();
  }
}
