package io.b2mash.b2b.automation.rule;

import java.util.List;
import java.util.Map;

/**
 * Resolves dotted field paths ("invoice.client.email", "line_items.0.amount") against a trigger
 * context. A key containing dots is matched literally before the path is split.
 */
public final class ContextPaths {

  /** Sentinel for a path that does not resolve. Distinct from a present-but-null value. */
  public static final Object UNDEFINED =
      new Object() {
        @Override
        public String toString() {
          return "undefined";
        }
      };

  private ContextPaths() {}

  public static Object resolve(Map<String, ?> context, String path) {
    if (context == null || path == null || path.isEmpty()) {
      return UNDEFINED;
    }
    if (context.containsKey(path)) {
      return context.get(path);
    }
    Object current = context;
    for (String segment : path.split("\\.")) {
      if (current instanceof Map<?, ?> map) {
        if (!map.containsKey(segment)) {
          return UNDEFINED;
        }
        current = map.get(segment);
      } else if (current instanceof List<?> list) {
        int index = parseIndex(segment);
        if (index < 0 || index >= list.size()) {
          return UNDEFINED;
        }
        current = list.get(index);
      } else {
        return UNDEFINED;
      }
    }
    return current;
  }

  public static boolean isDefined(Object value) {
    return value != UNDEFINED;
  }

  private static int parseIndex(String segment) {
    try {
      return Integer.parseInt(segment);
    } catch (NumberFormatException e) {
      return -1;
    }
  }
}
