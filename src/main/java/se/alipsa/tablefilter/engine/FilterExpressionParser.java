package se.alipsa.tablefilter.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.FilterException.Kind;

/**
 * Recursive descent over the nested array filter grammar:
 *
 * <ul>
 * <li>{@code []} matches everything;</li>
 * <li>{@code ["!", expression]} negates a nested expression;</li>
 * <li>{@code [field, operator, value]} is a leaf condition, unless
 * {@code field} is one of the reserved tokens {@code and}, {@code or},
 * {@code !};</li>
 * <li>{@code [expression, "and"|"or", expression, ...]} is a chain, combined
 * strictly left to right with no precedence between AND and OR.</li>
 * </ul>
 *
 * <p>
 * The parser commits to no evaluation strategy: each construct is handed to
 * a {@link FilterBackend}. Instances are immutable and thread safe.
 * </p>
 */
public final class FilterExpressionParser {

  /** Default maximum nesting depth of an expression. */
  public static final int DEFAULT_MAX_DEPTH = 64;

  private static final String NOT = "!";
  private static final String AND = "and";
  private static final String OR = "or";

  private static final FilterExpressionParser DEFAULT = new FilterExpressionParser(DEFAULT_MAX_DEPTH);

  private final int maxDepth;

  /**
   * Create a parser.
   *
   * @param maxDepth
   *          the maximum nesting depth accepted, at least 1
   */
  public FilterExpressionParser(int maxDepth) {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
    }
    this.maxDepth = maxDepth;
  }

  /**
   * A parser with {@link #DEFAULT_MAX_DEPTH}.
   *
   * @return the shared default parser
   */
  public static FilterExpressionParser defaultParser() {
    return DEFAULT;
  }

  /**
   * The maximum nesting depth this parser accepts.
   *
   * @return the maximum depth
   */
  public int maxDepth() {
    return maxDepth;
  }

  /**
   * Walk an expression, delegating every construct to the backend.
   *
   * @param <T>
   *          the backend result type
   * @param expression
   *          the expression: a {@link List} (or array) as produced by a JSON
   *          parser; {@code null} means no filter was supplied and matches
   *          everything
   * @param backend
   *          the evaluation strategy
   * @return the backend result for the whole expression
   * @throws FilterException
   *           if the expression is malformed or a leaf is invalid; nested
   *           failures propagate unchanged
   */
  public <T> T walk(Object expression, FilterBackend<T> backend) throws FilterException {
    if (expression == null) {
      return backend.matchAll();
    }
    return walk(expression, backend, 1);
  }

  private <T> T walk(Object expression, FilterBackend<T> backend, int depth) throws FilterException {
    if (depth > maxDepth) {
      throw new FilterException(Kind.EXPRESSION_TOO_DEEP,
          "filter expression is nested deeper than the maximum of " + maxDepth + " levels");
    }
    List<?> items = asSequence(expression);
    if (items == null) {
      throw new FilterException(Kind.INVALID_EXPRESSION_SHAPE,
          "filter expression is not an array, got " + describe(expression));
    }
    if (items.isEmpty()) {
      return backend.matchAll();
    }

    Object first = items.get(0);
    if (NOT.equals(first)) {
      if (items.size() != 2) {
        throw new FilterException(Kind.MALFORMED_NOT,
            "malformed NOT filter: expected 2 elements, got " + items.size() + ". Filter: " + items);
      }
      if (asSequence(items.get(1)) == null) {
        throw new FilterException(Kind.MALFORMED_NOT,
            "NOT filter operand must be an array, got " + describe(items.get(1)));
      }
      return backend.not(walk(items.get(1), backend, depth + 1));
    }

    if (first instanceof String field && items.size() == 3 && !isReserved(field)) {
      if (!(items.get(1) instanceof String operator)) {
        throw new FilterException(Kind.INVALID_OPERATOR,
            "operator in simple condition must be a string, got " + describe(items.get(1)));
      }
      return backend.leaf(field, operator, items.get(2));
    }

    return chain(items, backend, depth);
  }

  private <T> T chain(List<?> items, FilterBackend<T> backend, int depth) throws FilterException {
    int operators = items.size() / 2;
    String[] ops = new String[operators];
    for (int i = 1; i < items.size(); i += 2) {
      Object token = items.get(i);
      String op = token instanceof String s ? s.toLowerCase(Locale.ROOT) : null;
      if (!AND.equals(op) && !OR.equals(op)) {
        throw new FilterException(Kind.INVALID_LOGICAL_OPERATOR,
            "invalid logical operator in group: " + describe(token));
      }
      ops[i / 2] = op;
    }
    if (items.size() % 2 == 0) {
      throw new FilterException(Kind.MALFORMED_GROUP, "mismatched number of conditions and operators in group. "
          + "Conditions: " + (items.size() - operators) + ", Ops: " + operators + ". Filter: " + items);
    }

    T result = walk(items.get(0), backend, depth + 1);
    for (int i = 0; i < operators; i++) {
      T next = walk(items.get(2 * i + 2), backend, depth + 1);
      result = AND.equals(ops[i]) ? backend.and(result, next) : backend.or(result, next);
    }
    return result;
  }

  private static boolean isReserved(String token) {
    String lower = token.toLowerCase(Locale.ROOT);
    return AND.equals(lower) || OR.equals(lower) || NOT.equals(lower);
  }

  private static List<?> asSequence(Object value) {
    if (value instanceof List<?> list) {
      return list;
    }
    if (value instanceof Object[] array) {
      return Arrays.asList(array);
    }
    return null;
  }

  private static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String s) {
      return "string '" + s + "'";
    }
    return value.getClass().getSimpleName() + " " + value;
  }
}
