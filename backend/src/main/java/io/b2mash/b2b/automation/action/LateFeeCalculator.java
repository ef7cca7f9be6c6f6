package io.b2mash.b2b.automation.action;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Late fee arithmetic. The fee is kept at full precision so the invoice total grows by exactly
 * {@code total * percentage / 100}; only display text is rounded.
 */
public final class LateFeeCalculator {

  private LateFeeCalculator() {}

  /** Fee for {@code percentage} percent of {@code total}; 1.5% of 333.33 is 4.99995. */
  public static BigDecimal fee(BigDecimal total, BigDecimal percentage) {
    return total.multiply(percentage.movePointLeft(2));
  }

  /** Two-decimal rendering for logs and messages. */
  public static String display(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
