package io.b2mash.b2b.automation.action;

/**
 * Creates a draft invoice row.
 *
 * @param clientId client billed; may be a placeholder
 * @param projectId optional project reference
 * @param amount invoice amount, a number or a placeholder such as {@code {{total_amount}}}
 * @param currency currency code; the configured default when blank
 * @param paymentTerms terms text such as "Net 15"; the due date is derived from it
 */
public record GenerateInvoiceAction(
    String clientId, String projectId, String amount, String currency, String paymentTerms)
    implements Action {

  @Override
  public ActionType type() {
    return ActionType.GENERATE_INVOICE;
  }
}
