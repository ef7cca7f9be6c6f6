package io.b2mash.b2b.automation.store;

/** Collection names used in the tabular store. */
public final class StoreCollections {

  // Owned by the engine
  public static final String AUTOMATION_RULES = "automation_rules";
  public static final String REMINDER_SCHEDULES = "reminder_schedules";
  public static final String NOTIFICATION_TEMPLATES = "notification_templates";
  public static final String WORKFLOW_EXECUTIONS = "workflow_executions";
  public static final String AUTOMATION_LOGS = "automation_logs";
  public static final String IN_APP_NOTIFICATIONS = "in_app_notifications";

  // Borrowed business entities (read, and patched by actions)
  public static final String PROJECTS = "projects";
  public static final String TASKS = "tasks";
  public static final String INVOICES = "invoices";
  public static final String CLIENTS = "clients";

  private StoreCollections() {}

  /**
   * Maps an entity type as written in rule configuration ("project", "Projects", "invoice") to its
   * collection name. Unknown types are lower-cased and passed through.
   */
  public static String forEntityType(String entityType) {
    if (entityType == null) {
      return null;
    }
    String normalized = entityType.trim().toLowerCase();
    return switch (normalized) {
      case "project", "projects" -> PROJECTS;
      case "task", "tasks" -> TASKS;
      case "invoice", "invoices" -> INVOICES;
      case "client", "clients" -> CLIENTS;
      default -> normalized;
    };
  }

  /** Singular entity name for a collection, used to derive {@code <entity>_id} context keys. */
  public static String singular(String collection) {
    if (collection != null && collection.endsWith("s")) {
      return collection.substring(0, collection.length() - 1);
    }
    return collection;
  }
}
