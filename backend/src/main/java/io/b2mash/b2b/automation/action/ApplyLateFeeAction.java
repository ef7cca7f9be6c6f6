package io.b2mash.b2b.automation.action;

import java.math.BigDecimal;

/**
 * @param feePercentage fee as a percentage of the invoice total (1.5 means 1.5%)
 * @param invoiceId explicit invoice; the context's {@code invoice_id} when blank
 */
public record ApplyLateFeeAction(BigDecimal feePercentage, String invoiceId) implements Action {

  @Override
  public ActionType type() {
    return ActionType.APPLY_LATE_FEE;
  }
}
