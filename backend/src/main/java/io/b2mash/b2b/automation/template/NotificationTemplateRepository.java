package io.b2mash.b2b.automation.template;

import io.b2mash.b2b.automation.store.JsonColumns;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.TabularStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/** Maps {@link NotificationTemplate} to rows of the {@code notification_templates} collection. */
@Repository
public class NotificationTemplateRepository {

  private final TabularStore store;
  private final JsonColumns jsonColumns;

  public NotificationTemplateRepository(TabularStore store, JsonColumns jsonColumns) {
    this.store = store;
    this.jsonColumns = jsonColumns;
  }

  public Optional<NotificationTemplate> findActiveById(String id) {
    return store
        .findById(StoreCollections.NOTIFICATION_TEMPLATES, id)
        .map(this::toTemplate)
        .filter(NotificationTemplate::active);
  }

  public List<NotificationTemplate> findAll() {
    return store.readAll(StoreCollections.NOTIFICATION_TEMPLATES).stream()
        .map(this::toTemplate)
        .toList();
  }

  public boolean isEmpty() {
    return store.readAll(StoreCollections.NOTIFICATION_TEMPLATES).isEmpty();
  }

  public String save(NotificationTemplate template) {
    var row = new LinkedHashMap<String, Object>();
    row.put("id", template.id());
    row.put("name", template.name());
    row.put("type", template.channel());
    row.put("subject", template.subject());
    row.put("body", template.body());
    row.put("variables", jsonColumns.write(template.variables()));
    row.put("is_active", template.active());
    return store.create(StoreCollections.NOTIFICATION_TEMPLATES, row);
  }

  private NotificationTemplate toTemplate(Map<String, Object> row) {
    List<String> variables =
        jsonColumns.readList(row.get("variables")).stream().map(String::valueOf).toList();
    return new NotificationTemplate(
        RowValues.string(row, "id"),
        RowValues.string(row, "name"),
        RowValues.string(row, "type"),
        RowValues.string(row, "subject"),
        RowValues.string(row, "body"),
        variables,
        RowValues.bool(row, "is_active"));
  }
}
