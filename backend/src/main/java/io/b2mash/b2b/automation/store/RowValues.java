package io.b2mash.b2b.automation.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Typed reads from loosely-typed store rows. Stores hand back whatever the last writer put in a
 * cell (numbers as strings, booleans as "TRUE"), so every accessor tolerates both forms and returns
 * null for blanks or unparseable text.
 */
public final class RowValues {

  private RowValues() {}

  public static String string(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isBlank() ? null : text;
  }

  public static BigDecimal decimal(Map<String, Object> row, String column) {
    return toDecimal(row.get(column));
  }

  public static int integer(Map<String, Object> row, String column, int fallback) {
    BigDecimal value = decimal(row, column);
    return value != null ? value.intValue() : fallback;
  }

  public static boolean bool(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value instanceof Boolean b) {
      return b;
    }
    return value != null && "true".equalsIgnoreCase(value.toString().trim());
  }

  public static Instant instant(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value instanceof Instant i) {
      return i;
    }
    String text = string(row, column);
    if (text == null) {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /** Reads an ISO date column; a full timestamp is truncated to its date part. */
  public static LocalDate date(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value instanceof LocalDate d) {
      return d;
    }
    String text = string(row, column);
    if (text == null) {
      return null;
    }
    try {
      return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /**
   * Coerces numbers and numeric strings to {@link BigDecimal}; anything else, including NaN and
   * infinite doubles, yields null.
   */
  public static BigDecimal toDecimal(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal d) {
      return d;
    }
    if (value instanceof Double || value instanceof Float) {
      double number = ((Number) value).doubleValue();
      return Double.isFinite(number) ? BigDecimal.valueOf(number) : null;
    }
    if (value instanceof Number n) {
      return new BigDecimal(n.toString());
    }
    if (value instanceof Boolean) {
      return null;
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
