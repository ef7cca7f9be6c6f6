package io.b2mash.b2b.automation.template;

import java.util.List;

/**
 * A message template with {@code {{placeholder}}} variables. Read-only at fire time.
 *
 * @param id template id referenced by actions and reminder configs
 * @param name human-readable name
 * @param channel channel the template is written for ("email", "sms", "in-app")
 * @param subject optional subject line, may contain placeholders
 * @param body message body with placeholders
 * @param variables variables the body is documented to use
 * @param active inactive templates are never rendered
 */
public record NotificationTemplate(
    String id,
    String name,
    String channel,
    String subject,
    String body,
    List<String> variables,
    boolean active) {

  public NotificationTemplate {
    variables = variables != null ? List.copyOf(variables) : List.of();
  }
}
