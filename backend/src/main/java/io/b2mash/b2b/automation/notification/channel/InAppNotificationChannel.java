package io.b2mash.b2b.automation.notification.channel;

import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import java.time.Clock;
import java.util.LinkedHashMap;
import org.springframework.stereotype.Component;

/** In-app notification channel. Appends a row to {@code in_app_notifications}. */
@Component
public class InAppNotificationChannel implements NotificationChannel {

  private final TabularStore store;
  private final Clock clock;

  public InAppNotificationChannel(TabularStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public String channelId() {
    return "in-app";
  }

  @Override
  public void deliver(RenderedNotification notification, String recipient) {
    var row = new LinkedHashMap<String, Object>();
    row.put("recipient", recipient);
    row.put("template_id", notification.templateId());
    row.put("title", notification.subject() != null ? notification.subject() : "Notification");
    row.put("message", notification.body());
    row.put("is_read", false);
    row.put("created_at", clock.instant().toString());
    try {
      store.create(StoreCollections.IN_APP_NOTIFICATIONS, row);
    } catch (StoreException e) {
      throw new NotificationDeliveryException("Could not store in-app notification", e);
    }
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
