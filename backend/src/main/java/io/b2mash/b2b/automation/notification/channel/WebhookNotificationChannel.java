package io.b2mash.b2b.automation.notification.channel;

import io.b2mash.b2b.automation.webhook.WebhookDeliveryException;
import io.b2mash.b2b.automation.webhook.WebhookTransport;
import java.util.LinkedHashMap;
import org.springframework.stereotype.Component;

/** Posts the rendered notification as JSON. The recipient is the target URL. */
@Component
public class WebhookNotificationChannel implements NotificationChannel {

  private final WebhookTransport webhookTransport;

  public WebhookNotificationChannel(WebhookTransport webhookTransport) {
    this.webhookTransport = webhookTransport;
  }

  @Override
  public String channelId() {
    return "webhook";
  }

  @Override
  public void deliver(RenderedNotification notification, String recipient) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("subject", notification.subject());
    payload.put("content", notification.body());
    payload.put("variables", notification.variables());
    try {
      webhookTransport.post(recipient, payload);
    } catch (WebhookDeliveryException e) {
      throw new NotificationDeliveryException(e.getMessage(), e);
    }
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
