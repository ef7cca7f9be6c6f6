package io.b2mash.b2b.automation.webhook;

import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** {@link WebhookTransport} over Spring's {@link RestClient}. Only http and https are allowed. */
@Component
public class RestClientWebhookTransport implements WebhookTransport {

  private static final Logger log = LoggerFactory.getLogger(RestClientWebhookTransport.class);

  private final RestClient restClient;

  public RestClientWebhookTransport() {
    this.restClient = RestClient.create();
  }

  @Override
  public void post(String url, Map<String, Object> payload) {
    URI uri = validate(url);
    try {
      restClient
          .post()
          .uri(uri)
          .contentType(MediaType.APPLICATION_JSON)
          .body(payload)
          .retrieve()
          .toBodilessEntity();
      log.debug("Delivered webhook to {}", uri.getHost());
    } catch (RestClientException e) {
      throw new WebhookDeliveryException(
          "Webhook to " + uri.getHost() + " failed: " + e.getMessage(), e);
    }
  }

  private static URI validate(String url) {
    if (url == null || url.isBlank()) {
      throw new WebhookDeliveryException("Webhook URL is blank");
    }
    try {
      URI uri = URI.create(url.trim());
      String scheme = uri.getScheme();
      if (uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        throw new WebhookDeliveryException("Webhook URL must be an absolute http(s) URL: " + url);
      }
      return uri;
    } catch (IllegalArgumentException e) {
      throw new WebhookDeliveryException("Malformed webhook URL: " + url, e);
    }
  }
}
