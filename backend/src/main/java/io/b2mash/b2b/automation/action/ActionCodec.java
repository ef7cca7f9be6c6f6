package io.b2mash.b2b.automation.action;

import io.b2mash.b2b.automation.store.RowValues;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts actions to and from their stored shape {@code {"type": "...", "config": {...}}}. Config
 * keys are snake case. Legacy type names decode to their catalog equivalent ({@code send_email}
 * becomes an email {@link SendNotificationAction}); unknown names decode to {@link
 * UnrecognizedAction}. Decoding never rejects missing parameters, that is the validator's job.
 */
public final class ActionCodec {

  private ActionCodec() {}

  public static Action decode(Map<String, Object> raw) {
    String rawType = raw.get("type") != null ? raw.get("type").toString() : null;
    Map<String, Object> config = configOf(raw);
    var type = ActionType.fromWire(rawType);
    if (type.isEmpty()) {
      return new UnrecognizedAction(rawType, config);
    }
    return switch (type.get()) {
      case SEND_NOTIFICATION ->
          new SendNotificationAction(
              channelFor(rawType, text(config, "channel")),
              text(config, "recipient", "to"),
              text(config, "template_id", "template"));
      case CREATE_TASK -> decodeCreateTask(config);
      case UPDATE_STATUS ->
          new UpdateStatusAction(
              text(config, "entity_type"),
              text(config, "entity_id"),
              text(config, "new_status", "status"));
      case GENERATE_INVOICE ->
          new GenerateInvoiceAction(
              text(config, "client_id"),
              text(config, "project_id"),
              text(config, "amount"),
              text(config, "currency"),
              text(config, "payment_terms"));
      case APPLY_LATE_FEE ->
          new ApplyLateFeeAction(
              RowValues.toDecimal(
                  config.containsKey("fee_percentage")
                      ? config.get("fee_percentage")
                      : config.get("percentage")),
              text(config, "invoice_id"));
      case CALL_WEBHOOK -> new CallWebhookAction(text(config, "url"), mapOf(config, "payload"));
    };
  }

  public static Map<String, Object> encode(Action action) {
    var config = new LinkedHashMap<String, Object>();
    if (action instanceof SendNotificationAction a) {
      put(config, "channel", a.channel());
      put(config, "recipient", a.recipient());
      put(config, "template_id", a.templateId());
    } else if (action instanceof CreateTaskAction a) {
      put(config, "task_data", a.fields());
      put(config, "project_id", a.projectId());
    } else if (action instanceof UpdateStatusAction a) {
      put(config, "entity_type", a.entityType());
      put(config, "entity_id", a.entityId());
      put(config, "new_status", a.newStatus());
    } else if (action instanceof GenerateInvoiceAction a) {
      put(config, "client_id", a.clientId());
      put(config, "project_id", a.projectId());
      put(config, "amount", a.amount());
      put(config, "currency", a.currency());
      put(config, "payment_terms", a.paymentTerms());
    } else if (action instanceof ApplyLateFeeAction a) {
      put(config, "fee_percentage", a.feePercentage());
      put(config, "invoice_id", a.invoiceId());
    } else if (action instanceof CallWebhookAction a) {
      put(config, "url", a.url());
      put(config, "payload", a.payload());
    } else if (action instanceof UnrecognizedAction a) {
      config.putAll(a.parameters());
    }
    var encoded = new LinkedHashMap<String, Object>();
    encoded.put("type", action.typeName());
    encoded.put("config", config);
    return encoded;
  }

  private static CreateTaskAction decodeCreateTask(Map<String, Object> config) {
    var fields = new LinkedHashMap<String, Object>();
    Object taskData = config.get("task_data");
    if (taskData instanceof Map<?, ?> data) {
      data.forEach((k, v) -> fields.put(String.valueOf(k), v));
    } else {
      config.forEach(
          (k, v) -> {
            if (!"project_id".equals(k)) {
              fields.put(k, v);
            }
          });
    }
    return new CreateTaskAction(fields, text(config, "project_id"));
  }

  private static String channelFor(String rawType, String configured) {
    if (configured != null) {
      return configured.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }
    String type = rawType.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return switch (type) {
      case "send-email" -> "email";
      case "send-sms" -> "sms";
      default -> "in-app";
    };
  }

  private static Map<String, Object> configOf(Map<String, Object> raw) {
    Object config = raw.get("config");
    if (config instanceof Map<?, ?>) {
      return mapOf(raw, "config");
    }
    // Flat form: parameters alongside the type
    var flat = new LinkedHashMap<String, Object>(raw);
    flat.remove("type");
    return flat;
  }

  private static Map<String, Object> mapOf(Map<String, Object> source, String key) {
    var result = new LinkedHashMap<String, Object>();
    if (source.get(key) instanceof Map<?, ?> map) {
      map.forEach((k, v) -> result.put(String.valueOf(k), v));
    }
    return result;
  }

  private static String text(Map<String, Object> config, String... keys) {
    for (String key : keys) {
      Object value = config.get(key);
      if (value != null && !value.toString().isBlank()) {
        return value.toString();
      }
    }
    return null;
  }

  private static void put(Map<String, Object> config, String key, Object value) {
    if (value != null) {
      config.put(key, value);
    }
  }
}
