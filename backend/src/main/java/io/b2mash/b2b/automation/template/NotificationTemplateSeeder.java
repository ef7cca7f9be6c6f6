package io.b2mash.b2b.automation.template;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Seeds the built-in notification templates when the template collection is empty. Template ids
 * are stable so default rules and sweep-created reminders can reference them.
 */
@Component
public class NotificationTemplateSeeder {

  private static final Logger log = LoggerFactory.getLogger(NotificationTemplateSeeder.class);

  static final List<NotificationTemplate> DEFAULT_TEMPLATES =
      List.of(
          new NotificationTemplate(
              "project_deadline_approaching",
              "Project Deadline Approaching",
              "email",
              "Project Deadline Reminder: {{project_name}}",
              """
              Dear {{client_name}},

              This is a reminder that your project "{{project_name}}" has a deadline approaching \
              on {{deadline}}. You have {{days_remaining}} days remaining.

              Please let us know if you have any questions.

              Best regards,
              Your Project Team""",
              List.of("project_name", "client_name", "deadline", "days_remaining"),
              true),
          new NotificationTemplate(
              "invoice_payment_reminder",
              "Invoice Payment Reminder",
              "email",
              "Payment Reminder: Invoice {{invoice_number}}",
              """
              Dear {{client_name}},

              This is a reminder that invoice {{invoice_number}} for {{amount}} is due on \
              {{due_date}}.

              Please process the payment at your earliest convenience.

              Thank you,
              Accounts Team""",
              List.of("client_name", "invoice_number", "amount", "due_date"),
              true),
          new NotificationTemplate(
              "task_due_approaching",
              "Task Due Reminder",
              "email",
              "Task Due Reminder: {{task_title}}",
              """
              Task "{{task_title}}" in project "{{project_name}}" is due on {{due_date}}.

              Priority: {{priority}}
              Days remaining: {{days_remaining}}""",
              List.of("task_title", "project_name", "due_date", "priority", "days_remaining"),
              true),
          new NotificationTemplate(
              "payment_thank_you",
              "Payment Thank You",
              "email",
              "Thank you for your payment",
              """
              Dear {{client_name}},

              We have received your payment of {{payment_amount}} for invoice \
              {{invoice_number}}. Thank you for your business.

              Accounts Team""",
              List.of("client_name", "payment_amount", "invoice_number"),
              true),
          new NotificationTemplate(
              "client_followup",
              "Client Follow-up",
              "email",
              "Update on {{project_name}}",
              """
              Dear {{client_name}},

              Your project "{{project_name}}" has reached a milestone: {{milestone_type}}.
              Current status: {{project_status}} ({{completion_percentage}}% complete).

              Best regards,
              Your Project Team""",
              List.of(
                  "client_name",
                  "project_name",
                  "milestone_type",
                  "project_status",
                  "completion_percentage"),
              true));

  private final NotificationTemplateRepository templateRepository;

  public NotificationTemplateSeeder(NotificationTemplateRepository templateRepository) {
    this.templateRepository = templateRepository;
  }

  /** Returns the number of templates created. */
  public int seedIfEmpty() {
    if (!templateRepository.isEmpty()) {
      log.debug("Notification templates already present, skipping seed");
      return 0;
    }
    DEFAULT_TEMPLATES.forEach(templateRepository::save);
    log.info("Seeded {} default notification templates", DEFAULT_TEMPLATES.size());
    return DEFAULT_TEMPLATES.size();
  }
}
