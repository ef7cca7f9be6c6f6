package io.b2mash.b2b.automation.rule;

/**
 * One predicate over the trigger context.
 *
 * @param field dotted path into the context
 * @param operator comparison to apply
 * @param value right-hand operand; a list for {@link ConditionOperator#IN}, ignored by the
 *     emptiness operators
 * @param join how this condition's result combines with the next one; ignored on the last
 */
public record Condition(String field, ConditionOperator operator, Object value, LogicalJoin join) {

  public Condition {
    join = join != null ? join : LogicalJoin.AND;
  }

  public static Condition of(String field, ConditionOperator operator, Object value) {
    return new Condition(field, operator, value, LogicalJoin.AND);
  }

  public Condition or() {
    return new Condition(field, operator, value, LogicalJoin.OR);
  }
}
