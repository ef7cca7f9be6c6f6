package io.b2mash.b2b.automation.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RowValuesTest {

  @Test
  void decimal_readsNumbersAndNumericText() {
    var row = Map.<String, Object>of("a", 12, "b", "12.50", "c", "n/a");

    assertThat(RowValues.decimal(row, "a")).isEqualByComparingTo("12");
    assertThat(RowValues.decimal(row, "b")).isEqualByComparingTo(new BigDecimal("12.5"));
    assertThat(RowValues.decimal(row, "c")).isNull();
    assertThat(RowValues.decimal(row, "missing")).isNull();
  }

  @Test
  void toDecimal_nonFiniteDoubles_areNull() {
    assertThat(RowValues.toDecimal(Double.NaN)).isNull();
    assertThat(RowValues.toDecimal(Double.NEGATIVE_INFINITY)).isNull();
    assertThat(RowValues.toDecimal(Float.POSITIVE_INFINITY)).isNull();
    assertThat(RowValues.toDecimal(2.5d)).isEqualByComparingTo("2.5");
  }

  @Test
  void bool_acceptsTextualTrue() {
    var row = Map.<String, Object>of("a", "TRUE", "b", true, "c", "no");

    assertThat(RowValues.bool(row, "a")).isTrue();
    assertThat(RowValues.bool(row, "b")).isTrue();
    assertThat(RowValues.bool(row, "c")).isFalse();
    assertThat(RowValues.bool(row, "missing")).isFalse();
  }

  @Test
  void date_truncatesTimestamps() {
    var row = Map.<String, Object>of("due", "2025-03-10T15:00:00Z", "bad", "tomorrow");

    assertThat(RowValues.date(row, "due")).isEqualTo(LocalDate.of(2025, 3, 10));
    assertThat(RowValues.date(row, "bad")).isNull();
  }

  @Test
  void instant_parsesIsoText() {
    var row = Map.<String, Object>of("at", "2025-03-10T15:00:00Z");

    assertThat(RowValues.instant(row, "at")).isEqualTo(Instant.parse("2025-03-10T15:00:00Z"));
  }

  @Test
  void integer_fallsBackWhenUnreadable() {
    var row = Map.<String, Object>of("n", "3", "bad", "three");

    assertThat(RowValues.integer(row, "n", 0)).isEqualTo(3);
    assertThat(RowValues.integer(row, "bad", 7)).isEqualTo(7);
  }
}
