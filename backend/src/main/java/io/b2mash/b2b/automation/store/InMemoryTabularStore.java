package io.b2mash.b2b.automation.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Insertion-ordered, thread-safe {@link TabularStore} held in memory. Used when the host
 * application does not bind its own store, and by tests. Rows are copied on the way in and out so
 * callers never share mutable state with the store.
 */
public class InMemoryTabularStore implements TabularStore {

  private final Map<String, Map<String, Map<String, Object>>> collections = new LinkedHashMap<>();

  @Override
  public synchronized List<Map<String, Object>> readAll(String collection) {
    var rows = collections.get(collection);
    if (rows == null) {
      return List.of();
    }
    var result = new ArrayList<Map<String, Object>>(rows.size());
    rows.values().forEach(row -> result.add(new LinkedHashMap<>(row)));
    return result;
  }

  @Override
  public synchronized List<Map<String, Object>> query(
      String collection, Map<String, Object> filter) {
    var rows = collections.get(collection);
    if (rows == null) {
      return List.of();
    }
    var result = new ArrayList<Map<String, Object>>();
    for (var row : rows.values()) {
      if (matches(row, filter)) {
        result.add(new LinkedHashMap<>(row));
      }
    }
    return result;
  }

  @Override
  public synchronized String create(String collection, Map<String, Object> row) {
    var copy = new LinkedHashMap<>(row);
    Object suppliedId = copy.get("id");
    String id =
        suppliedId != null && !suppliedId.toString().isBlank()
            ? suppliedId.toString()
            : UUID.randomUUID().toString();
    copy.put("id", id);
    var rows = collections.computeIfAbsent(collection, k -> new LinkedHashMap<>());
    if (rows.containsKey(id)) {
      throw new StoreException("Duplicate id " + id + " in collection " + collection);
    }
    rows.put(id, copy);
    return id;
  }

  @Override
  public synchronized boolean update(String collection, String id, Map<String, Object> patch) {
    var rows = collections.get(collection);
    if (rows == null || !rows.containsKey(id)) {
      return false;
    }
    var row = rows.get(id);
    patch.forEach(
        (key, value) -> {
          if (!"id".equals(key)) {
            row.put(key, value);
          }
        });
    return true;
  }

  @Override
  public synchronized boolean delete(String collection, String id) {
    var rows = collections.get(collection);
    return rows != null && rows.remove(id) != null;
  }

  private static boolean matches(Map<String, Object> row, Map<String, Object> filter) {
    for (var entry : filter.entrySet()) {
      Object actual = row.get(entry.getKey());
      Object expected = entry.getValue();
      if (expected instanceof Collection<?> options) {
        if (options.stream().noneMatch(option -> sameValue(actual, option))) {
          return false;
        }
      } else if (!sameValue(actual, expected)) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameValue(Object actual, Object expected) {
    if (actual == null || expected == null) {
      return actual == expected;
    }
    return Objects.equals(actual.toString(), expected.toString());
  }
}
