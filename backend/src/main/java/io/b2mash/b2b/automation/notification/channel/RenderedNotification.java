package io.b2mash.b2b.automation.notification.channel;

import java.util.Map;

/**
 * A template rendered against its variables, ready for a channel.
 *
 * @param templateId template the content came from
 * @param subject rendered subject; null when the template has none
 * @param body rendered body
 * @param variables variables used for rendering, passed on to structured channels (webhook)
 */
public record RenderedNotification(
    String templateId, String subject, String body, Map<String, Object> variables) {

  public RenderedNotification {
    variables = variables != null ? variables : Map.of();
  }
}
