package io.b2mash.b2b.automation.notification;

import io.b2mash.b2b.automation.audit.AutomationLogBuilder;
import io.b2mash.b2b.automation.audit.AutomationLogService;
import io.b2mash.b2b.automation.notification.channel.DeliveryResult;
import io.b2mash.b2b.automation.notification.channel.NotificationDispatcher;
import io.b2mash.b2b.automation.notification.channel.RenderedNotification;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.template.NotificationTemplateRepository;
import io.b2mash.b2b.automation.template.TemplateRenderer;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Renders a notification template and hands it to a channel. Every attempt, delivered or not, is
 * recorded in the automation log as {@code notification_sent}.
 */
@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationTemplateRepository templateRepository;
  private final TemplateRenderer templateRenderer;
  private final NotificationDispatcher dispatcher;
  private final AutomationLogService automationLogService;
  private final Clock clock;

  public NotificationService(
      NotificationTemplateRepository templateRepository,
      TemplateRenderer templateRenderer,
      NotificationDispatcher dispatcher,
      AutomationLogService automationLogService,
      Clock clock) {
    this.templateRepository = templateRepository;
    this.templateRenderer = templateRenderer;
    this.dispatcher = dispatcher;
    this.automationLogService = automationLogService;
    this.clock = clock;
  }

  /**
   * Sends one notification. Never throws for delivery problems: a missing template, unknown
   * channel, or transport failure comes back as a failed {@link DeliveryResult}.
   */
  public DeliveryResult send(
      String channelId, String recipient, String templateId, Map<String, Object> variables) {
    DeliveryResult result;
    try {
      var template = templateRepository.findActiveById(templateId);
      if (template.isEmpty()) {
        log.warn("Notification template not found or inactive: {}", templateId);
        result = DeliveryResult.failed("Template not found: " + templateId);
      } else {
        var rendered =
            new RenderedNotification(
                templateId,
                templateRenderer.render(template.get().subject(), variables),
                templateRenderer.render(template.get().body(), variables),
                variables);
        result = dispatcher.dispatch(channelId, rendered, recipient);
      }
    } catch (StoreException e) {
      log.warn("Could not load notification template {}: {}", templateId, e.getMessage());
      result = DeliveryResult.failed(e.getMessage());
    }
    record(channelId, recipient, templateId, result);
    return result;
  }

  private void record(
      String channelId, String recipient, String templateId, DeliveryResult result) {
    var entry =
        AutomationLogBuilder.builder()
            .action("notification_sent")
            .entityId(recipient)
            .detail("channel", NotificationDispatcher.normalizeChannelId(channelId))
            .detail("template_id", templateId);
    if (!result.success()) {
      entry.error(result.errorMessage());
    }
    automationLogService.log(entry.build(clock));
  }
}
