package io.b2mash.b2b.automation.rule;

import io.b2mash.b2b.automation.store.RowValues;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import org.springframework.stereotype.Component;

/**
 * Evaluates a rule's ordered condition list against a trigger context.
 *
 * <p>Results are folded left to right: the join of condition {@code i-1} decides how its running
 * result combines with condition {@code i}. There is no operator precedence, so {@code a AND b OR
 * c} evaluates as {@code (a AND b) OR c}. An empty list is vacuously true.
 *
 * <p>Evaluation never throws. Values that cannot be compared (a relational operator on text, an
 * {@code in} whose operand is not a list) make the condition false.
 */
@Component
public class ConditionEvaluator {

  public boolean evaluate(List<Condition> conditions, Map<String, ?> context) {
    if (conditions == null || conditions.isEmpty()) {
      return true;
    }
    boolean result = test(conditions.get(0), context);
    for (int i = 1; i < conditions.size(); i++) {
      LogicalJoin join = conditions.get(i - 1).join();
      // AND with a false accumulator, or OR with a true one, cannot change the result
      if (join == LogicalJoin.AND && !result || join == LogicalJoin.OR && result) {
        continue;
      }
      result = join.apply(result, test(conditions.get(i), context));
    }
    return result;
  }

  public boolean test(Condition condition, Map<String, ?> context) {
    Object actual = ContextPaths.resolve(context, condition.field());
    Object expected = condition.value();
    return switch (condition.operator()) {
      case EQUALS -> valuesEqual(actual, expected);
      case NOT_EQUALS -> !valuesEqual(actual, expected);
      case GREATER_THAN -> compares(actual, expected, c -> c > 0);
      case LESS_THAN -> compares(actual, expected, c -> c < 0);
      case GREATER_THAN_OR_EQUAL -> compares(actual, expected, c -> c >= 0);
      case LESS_THAN_OR_EQUAL -> compares(actual, expected, c -> c <= 0);
      case CONTAINS -> contains(actual, expected);
      case NOT_CONTAINS ->
          ContextPaths.isDefined(actual) && actual != null && !contains(actual, expected);
      case IS_EMPTY -> isEmpty(actual);
      case IS_NOT_EMPTY -> !isEmpty(actual);
      case IN ->
          expected instanceof Collection<?> candidates
              && candidates.stream().anyMatch(candidate -> valuesEqual(actual, candidate));
    };
  }

  private static boolean compares(Object actual, Object expected, IntPredicate outcome) {
    if (!ContextPaths.isDefined(actual)) {
      return false;
    }
    BigDecimal left = RowValues.toDecimal(actual);
    BigDecimal right = RowValues.toDecimal(expected);
    return left != null && right != null && outcome.test(left.compareTo(right));
  }

  static boolean valuesEqual(Object actual, Object expected) {
    Object left = ContextPaths.isDefined(actual) ? actual : null;
    if (left == null || expected == null) {
      return left == expected;
    }
    if (left instanceof Number || expected instanceof Number) {
      BigDecimal l = RowValues.toDecimal(left);
      BigDecimal r = RowValues.toDecimal(expected);
      if (l != null && r != null) {
        return l.compareTo(r) == 0;
      }
    }
    if (left instanceof Boolean || expected instanceof Boolean) {
      return String.valueOf(left).equalsIgnoreCase(String.valueOf(expected));
    }
    return Objects.equals(String.valueOf(left), String.valueOf(expected));
  }

  private static boolean contains(Object actual, Object expected) {
    if (actual instanceof Collection<?> collection) {
      return collection.stream().anyMatch(element -> valuesEqual(element, expected));
    }
    if (actual instanceof CharSequence text && expected != null) {
      return text.toString().contains(String.valueOf(expected));
    }
    return false;
  }

  private static boolean isEmpty(Object value) {
    if (!ContextPaths.isDefined(value) || value == null) {
      return true;
    }
    if (value instanceof CharSequence text) {
      return text.toString().isEmpty();
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    return false;
  }
}
