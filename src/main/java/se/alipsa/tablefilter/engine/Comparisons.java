package se.alipsa.tablefilter.engine;

import java.time.Instant;
import java.util.Locale;

/**
 * Boolean semantics of the operators, on values already coerced to the
 * comparison domain of their field type. Text comparisons fold case.
 */
public final class Comparisons {

  private Comparisons() {
  }

  /**
   * Evaluate a condition against a stored value.
   *
   * @param condition
   *          the validated condition
   * @param stored
   *          the stored value, coerced to the same domain as the condition
   *          operand
   * @return true if the stored value satisfies the condition
   */
  public static boolean test(Condition condition, Comparable<?> stored) {
    Operator op = condition.operator();
    if (op == Operator.BETWEEN) {
      return compare(Operator.GT_EQ, stored, condition.value()) && compare(Operator.LT_EQ, stored,
          condition.upperBound());
    }
    if (stored instanceof String text) {
      return textMatches(op, fold(text), fold((String) condition.value()));
    }
    return compare(op, stored, condition.value());
  }

  /**
   * Evaluate a text operator on case folded operands.
   *
   * @param op
   *          a text operator
   * @param foldedStored
   *          the folded stored value
   * @param foldedOperand
   *          the folded operand
   * @return true on match
   */
  public static boolean textMatches(Operator op, String foldedStored, String foldedOperand) {
    return switch (op) {
      case EQ -> foldedStored.equals(foldedOperand);
      case NOT_EQ -> !foldedStored.equals(foldedOperand);
      case CONTAINS -> foldedStored.contains(foldedOperand);
      case NOT_CONTAINS -> !foldedStored.contains(foldedOperand);
      case STARTS_WITH -> foldedStored.startsWith(foldedOperand);
      case ENDS_WITH -> foldedStored.endsWith(foldedOperand);
      default -> throw new IllegalArgumentException("Operator " + op + " is not defined for text");
    };
  }

  /**
   * Fold text for case-insensitive comparison.
   *
   * @param text
   *          the text
   * @return the folded text
   */
  public static String fold(String text) {
    return text.toLowerCase(Locale.ROOT);
  }

  private static boolean compare(Operator op, Comparable<?> stored, Comparable<?> operand) {
    if (stored instanceof Double d && operand instanceof Double o) {
      return compareDoubles(op, d, o);
    }
    int cmp;
    if (stored instanceof Long l && operand instanceof Long o) {
      cmp = Long.compare(l, o);
    } else if (stored instanceof Instant i && operand instanceof Instant o) {
      cmp = i.compareTo(o);
    } else if (stored instanceof Boolean b && operand instanceof Boolean o) {
      cmp = Boolean.compare(b, o);
    } else {
      throw new IllegalArgumentException("Cannot compare " + stored + " with " + operand);
    }
    return switch (op) {
      case EQ -> cmp == 0;
      case NOT_EQ -> cmp != 0;
      case GT -> cmp > 0;
      case GT_EQ -> cmp >= 0;
      case LT -> cmp < 0;
      case LT_EQ -> cmp <= 0;
      default -> throw new IllegalArgumentException("Operator " + op + " is not a comparison");
    };
  }

  private static boolean compareDoubles(Operator op, double stored, double operand) {
    return switch (op) {
      case EQ -> stored == operand;
      case NOT_EQ -> stored != operand;
      case GT -> stored > operand;
      case GT_EQ -> stored >= operand;
      case LT -> stored < operand;
      case LT_EQ -> stored <= operand;
      default -> throw new IllegalArgumentException("Operator " + op + " is not a comparison");
    };
  }
}
