package io.b2mash.b2b.automation.action;

import io.b2mash.b2b.automation.config.AutomationProperties;
import io.b2mash.b2b.automation.exception.ResourceNotFoundException;
import io.b2mash.b2b.automation.notification.NotificationService;
import io.b2mash.b2b.automation.store.RowValues;
import io.b2mash.b2b.automation.store.StoreCollections;
import io.b2mash.b2b.automation.store.StoreException;
import io.b2mash.b2b.automation.store.TabularStore;
import io.b2mash.b2b.automation.template.TemplateRenderer;
import io.b2mash.b2b.automation.webhook.WebhookDeliveryException;
import io.b2mash.b2b.automation.webhook.WebhookTransport;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one action against the trigger context through its collaborator (store, notification
 * service, webhook transport).
 *
 * <p>String parameters are template-resolved against the context first. A parameter that is blank,
 * or still holds a placeholder after resolution, counts as absent and falls back to the documented
 * context key.
 *
 * <p>Collaborator failures (store errors, missing entities, webhook errors) are caught here and
 * returned as failed results so the remaining actions of the rule still run. Anything else
 * propagates to the caller.
 */
@Component
public class ActionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

  private static final Pattern PAYMENT_TERM_DAYS = Pattern.compile("(\\d+)");
  private static final int DEFAULT_PAYMENT_DAYS = 30;
  private static final int MAX_PAYMENT_DAYS = 3650;

  private final TabularStore store;
  private final NotificationService notificationService;
  private final WebhookTransport webhookTransport;
  private final TemplateRenderer templateRenderer;
  private final AutomationProperties properties;
  private final Clock clock;

  public ActionDispatcher(
      TabularStore store,
      NotificationService notificationService,
      WebhookTransport webhookTransport,
      TemplateRenderer templateRenderer,
      AutomationProperties properties,
      Clock clock) {
    this.store = store;
    this.notificationService = notificationService;
    this.webhookTransport = webhookTransport;
    this.templateRenderer = templateRenderer;
    this.properties = properties;
    this.clock = clock;
  }

  public ActionResult execute(Action action, Map<String, Object> context) {
    if (action.type() == null) {
      log.warn(
          "Skipping action of unknown type '{}' for entity={}",
          action.typeName(),
          context.get("entity_id"));
      return ActionResult.skipped(action.typeName(), "Unknown action type: " + action.typeName());
    }
    try {
      return switch (action.type()) {
        case SEND_NOTIFICATION -> sendNotification((SendNotificationAction) action, context);
        case CREATE_TASK -> createTask((CreateTaskAction) action, context);
        case UPDATE_STATUS -> updateStatus((UpdateStatusAction) action, context);
        case GENERATE_INVOICE -> generateInvoice((GenerateInvoiceAction) action, context);
        case APPLY_LATE_FEE -> applyLateFee((ApplyLateFeeAction) action, context);
        case CALL_WEBHOOK -> callWebhook((CallWebhookAction) action, context);
      };
    } catch (StoreException | ResourceNotFoundException | WebhookDeliveryException e) {
      log.warn("Action {} failed: {}", action.typeName(), e.getMessage());
      return ActionResult.failed(action.typeName(), e.getMessage());
    }
  }

  private ActionResult sendNotification(
      SendNotificationAction action, Map<String, Object> context) {
    String recipient = resolve(action.recipient(), context);
    if (recipient == null) {
      return ActionResult.failed(action.typeName(), "Recipient did not resolve");
    }
    var delivery =
        notificationService.send(
            action.channel(), recipient, resolve(action.templateId(), context), context);
    return delivery.success()
        ? ActionResult.succeeded(action.typeName())
        : ActionResult.failed(action.typeName(), delivery.errorMessage());
  }

  private ActionResult createTask(CreateTaskAction action, Map<String, Object> context) {
    var row = new LinkedHashMap<String, Object>();
    action.fields().forEach((key, value) -> row.put(key, resolveValue(value, context)));
    String projectId =
        firstPresent(
            resolve(action.projectId(), context),
            text(context, "project_id"),
            text(context, "entity_id"));
    row.put("project_id", projectId);
    row.putIfAbsent("status", "todo");
    row.put("created_at", clock.instant().toString());
    String taskId = store.create(StoreCollections.TASKS, row);
    log.info("Automation created task id={} in project={}", taskId, projectId);
    return ActionResult.succeeded(action.typeName(), "Created task " + taskId);
  }

  private ActionResult updateStatus(UpdateStatusAction action, Map<String, Object> context) {
    String collection = StoreCollections.forEntityType(action.entityType());
    String entityId =
        firstPresent(
            resolve(action.entityId(), context),
            text(context, StoreCollections.singular(collection) + "_id"),
            text(context, "entity_id"));
    if (entityId == null) {
      return ActionResult.failed(action.typeName(), "No " + action.entityType() + " id in context");
    }
    String status = resolve(action.newStatus(), context);
    var patch = new LinkedHashMap<String, Object>();
    patch.put("status", status);
    patch.put("updated_at", clock.instant().toString());
    if (!store.update(collection, entityId, patch)) {
      throw new ResourceNotFoundException(action.entityType(), entityId);
    }
    log.info("Automation set {} {} status to '{}'", action.entityType(), entityId, status);
    return ActionResult.succeeded(action.typeName());
  }

  private ActionResult generateInvoice(GenerateInvoiceAction action, Map<String, Object> context) {
    String clientId = firstPresent(resolve(action.clientId(), context), text(context, "client_id"));
    BigDecimal amount = RowValues.toDecimal(resolve(action.amount(), context));
    if (clientId == null || amount == null) {
      return ActionResult.failed(action.typeName(), "Client and numeric amount are required");
    }
    String terms = firstPresent(resolve(action.paymentTerms(), context), "Net 30");
    LocalDate today = LocalDate.ofInstant(clock.instant(), properties.zoneId());
    var row = new LinkedHashMap<String, Object>();
    row.put(
        "invoice_number",
        "INV-"
            + today.format(DateTimeFormatter.BASIC_ISO_DATE)
            + "-"
            + (store.readAll(StoreCollections.INVOICES).size() + 1));
    row.put("client_id", clientId);
    row.put(
        "project_id",
        firstPresent(resolve(action.projectId(), context), text(context, "project_id")));
    row.put("amount", amount);
    row.put("total_amount", amount);
    row.put(
        "currency",
        firstPresent(resolve(action.currency(), context), properties.defaultCurrency()));
    row.put("status", "draft");
    row.put("issue_date", today.toString());
    row.put("due_date", today.plusDays(paymentTermDays(terms)).toString());
    row.put("payment_terms", terms);
    row.put("paid_amount", BigDecimal.ZERO);
    row.put("created_at", clock.instant().toString());
    String invoiceId = store.create(StoreCollections.INVOICES, row);
    log.info("Automation generated draft invoice id={} for client={}", invoiceId, clientId);
    return ActionResult.succeeded(action.typeName(), "Generated invoice " + invoiceId);
  }

  private ActionResult applyLateFee(ApplyLateFeeAction action, Map<String, Object> context) {
    String invoiceId =
        firstPresent(
            resolve(action.invoiceId(), context),
            text(context, "invoice_id"),
            text(context, "entity_id"));
    var invoice =
        store
            .findById(StoreCollections.INVOICES, invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    if (RowValues.bool(invoice, "late_fee_applied")) {
      log.debug("Late fee already applied to invoice {}", invoiceId);
      return ActionResult.skipped(action.typeName(), "Late fee already applied");
    }
    BigDecimal total = RowValues.decimal(invoice, "total_amount");
    if (total == null) {
      total = RowValues.decimal(invoice, "amount");
    }
    if (total == null || action.feePercentage() == null) {
      return ActionResult.failed(action.typeName(), "Invoice " + invoiceId + " has no total");
    }
    BigDecimal fee = LateFeeCalculator.fee(total, action.feePercentage());
    var patch = new LinkedHashMap<String, Object>();
    patch.put("late_fee", fee);
    patch.put("total_amount", total.add(fee));
    patch.put("late_fee_applied", true);
    patch.put("updated_at", clock.instant().toString());
    if (!store.update(StoreCollections.INVOICES, invoiceId, patch)) {
      throw new ResourceNotFoundException("Invoice", invoiceId);
    }
    String shown = LateFeeCalculator.display(fee);
    log.info("Applied late fee {} to invoice {}", shown, invoiceId);
    return ActionResult.succeeded(action.typeName(), "Late fee " + shown);
  }

  private ActionResult callWebhook(CallWebhookAction action, Map<String, Object> context) {
    String url = resolve(action.url(), context);
    Map<String, Object> payload = new LinkedHashMap<>();
    if (action.payload().isEmpty()) {
      payload.putAll(context);
    } else {
      action.payload().forEach((key, value) -> payload.put(key, resolveValue(value, context)));
    }
    webhookTransport.post(url, payload);
    return ActionResult.succeeded(action.typeName());
  }

  /** Days in the first number of the terms text; 30 when there is none or it is out of range. */
  static int paymentTermDays(String terms) {
    Matcher matcher = PAYMENT_TERM_DAYS.matcher(terms != null ? terms : "");
    if (!matcher.find()) {
      return DEFAULT_PAYMENT_DAYS;
    }
    try {
      int days = Integer.parseInt(matcher.group(1));
      return days <= MAX_PAYMENT_DAYS ? days : DEFAULT_PAYMENT_DAYS;
    } catch (NumberFormatException e) {
      log.warn("Ignoring unusable payment terms '{}'", terms);
      return DEFAULT_PAYMENT_DAYS;
    }
  }

  /** Resolves placeholders; blank or still-unresolved results count as absent. */
  private String resolve(String parameter, Map<String, Object> context) {
    if (parameter == null || parameter.isBlank()) {
      return null;
    }
    String resolved = templateRenderer.render(parameter, context);
    return resolved.contains("{{") ? null : resolved;
  }

  private Object resolveValue(Object value, Map<String, Object> context) {
    return value instanceof String text ? templateRenderer.render(text, context) : value;
  }

  private static String text(Map<String, Object> context, String key) {
    Object value = context.get(key);
    return value != null && !value.toString().isBlank() ? value.toString() : null;
  }

  private static String firstPresent(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null) {
        return candidate;
      }
    }
    return null;
  }
}
