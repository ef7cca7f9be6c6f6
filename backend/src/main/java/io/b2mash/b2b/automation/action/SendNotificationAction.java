package io.b2mash.b2b.automation.action;

/**
 * @param channel notification channel id ("email", "sms", "in-app", "webhook")
 * @param recipient recipient address, usually a placeholder such as {@code {{client_email}}}
 * @param templateId notification template to render
 */
public record SendNotificationAction(String channel, String recipient, String templateId)
    implements Action {

  @Override
  public ActionType type() {
    return ActionType.SEND_NOTIFICATION;
  }
}
