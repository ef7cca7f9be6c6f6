package io.b2mash.b2b.automation.webhook;

import java.util.Map;

/** Outbound webhook delivery. One attempt per call; callers never retry. */
public interface WebhookTransport {

  /**
   * Posts the payload as JSON to the URL.
   *
   * @throws WebhookDeliveryException when the URL is invalid, the request fails, or the endpoint
   *     answers with a non-2xx status
   */
  void post(String url, Map<String, Object> payload);
}
