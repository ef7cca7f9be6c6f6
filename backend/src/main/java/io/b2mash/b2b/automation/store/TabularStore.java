package io.b2mash.b2b.automation.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port to the application's flat tabular store. Each collection holds rows keyed by a string
 * {@code id} column; nested structures are stored as JSON text in single columns by the
 * repositories that own them.
 *
 * <p>Every method may fail transiently with {@link StoreException}. Callers that run on a timer or
 * sweep tick catch it at their own boundary so a single failure degrades one firing, not the
 * process.
 */
public interface TabularStore {

  /** Returns every row of the collection in store order. Unknown collections are empty. */
  List<Map<String, Object>> readAll(String collection);

  /**
   * Returns rows whose columns match every entry of the filter. A filter value that is a {@link
   * java.util.Collection} matches any of its elements; scalar values match by string form.
   */
  List<Map<String, Object>> query(String collection, Map<String, Object> filter);

  /**
   * Inserts a row and returns its id. A non-blank {@code id} supplied in the row is kept, otherwise
   * a new one is generated.
   */
  String create(String collection, Map<String, Object> row);

  /** Merges the patch into the row with the given id. Returns false when no such row exists. */
  boolean update(String collection, String id, Map<String, Object> patch);

  /** Removes the row with the given id. Returns false when no such row exists. */
  boolean delete(String collection, String id);

  default Optional<Map<String, Object>> findById(String collection, String id) {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    return query(collection, Map.of("id", id)).stream().findFirst();
  }
}
