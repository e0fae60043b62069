package se.alipsa.tablefilter.engine;

import se.alipsa.tablefilter.FilterException;

/**
 * The capabilities a filter evaluation strategy provides to
 * {@link FilterExpressionParser}. The parser owns the grammar and its edge
 * cases; a backend only decides what a leaf condition and the logical
 * combinators produce.
 *
 * @param <T>
 *          the result of evaluating an expression, e.g. a record matcher or a
 *          storage engine predicate
 */
public interface FilterBackend<T> {

  /**
   * The result for the universal filter (an absent or empty expression).
   *
   * @return the "match everything" result
   */
  T matchAll();

  /**
   * Translate a leaf condition {@code [field, operator, value]}.
   *
   * @param field
   *          the field name as written
   * @param operator
   *          the operator token as written
   * @param value
   *          the operand as deserialized
   * @return the leaf result
   * @throws FilterException
   *           if the condition is not valid for the schema
   */
  T leaf(String field, String operator, Object value) throws FilterException;

  /**
   * Negate a result.
   *
   * @param operand
   *          the result to negate
   * @return the negation
   */
  T not(T operand);

  /**
   * Combine two results with logical AND.
   *
   * @param left
   *          the accumulated result so far
   * @param right
   *          the next result in the chain
   * @return the conjunction
   */
  T and(T left, T right);

  /**
   * Combine two results with logical OR.
   *
   * @param left
   *          the accumulated result so far
   * @param right
   *          the next result in the chain
   * @return the disjunction
   */
  T or(T left, T right);
}
