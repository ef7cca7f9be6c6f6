package io.b2mash.b2b.automation.action;

import java.util.Map;

/**
 * Posts to an external URL. The payload defaults to the trigger context when empty.
 *
 * @param url target URL, may contain placeholders
 * @param payload body fields; string values are template-resolved
 */
public record CallWebhookAction(String url, Map<String, Object> payload) implements Action {

  public CallWebhookAction {
    payload = payload != null ? Map.copyOf(payload) : Map.of();
  }

  @Override
  public ActionType type() {
    return ActionType.CALL_WEBHOOK;
  }
}
