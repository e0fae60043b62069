package se.alipsa.tablefilter.adapter;

import java.util.List;
import java.util.Optional;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * Translates filter conditions on one entity into predicates understood by a
 * storage or query engine, and composes those predicates.
 *
 * <p>
 * Implementations validate leaf conditions with
 * {@link se.alipsa.tablefilter.engine.OperatorTable#resolve} so that every
 * adapter rejects exactly the expressions the in-memory evaluator rejects,
 * and emit predicates that match exactly the records it matches: a record
 * whose value for the field is missing or null never satisfies a leaf.
 * </p>
 *
 * @param <P>
 *          the engine predicate type
 */
public interface EntityAdapter<P> {

  /**
   * The schema this adapter translates conditions for.
   *
   * @return the table schema
   */
  TableSchema schema();

  /**
   * The entity name, by default the schema's entity name.
   *
   * @return the entity name
   */
  default String entityName() {
    return schema().entityName();
  }

  /**
   * Translate one leaf condition.
   *
   * @param field
   *          the field name as written
   * @param operator
   *          the operator token
   * @param value
   *          the operand as deserialized
   * @return the predicate
   * @throws FilterException
   *           if the field, operator or operand is invalid for the schema
   */
  P predicateForField(String field, String operator, Object value) throws FilterException;

  /**
   * Conjunction of two predicates.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @return the conjunction
   */
  P and(P left, P right);

  /**
   * Disjunction of two predicates.
   *
   * @param left
   *          left operand
   * @param right
   *          right operand
   * @return the disjunction
   */
  P or(P left, P right);

  /**
   * Negation of a predicate.
   *
   * @param predicate
   *          the predicate to negate
   * @return the negation
   */
  P not(P predicate);

  /**
   * A predicate no record satisfies, the negation of "no filtering".
   *
   * @return the predicate
   */
  P matchNone();

  /**
   * Conjunction of any number of predicates. Zero predicates mean no
   * filtering, a single predicate is returned unchanged.
   *
   * @param predicates
   *          the predicates
   * @return the conjunction, empty when there is nothing to filter on
   */
  default Optional<P> and(List<P> predicates) {
    return fold(predicates, true);
  }

  /**
   * Disjunction of any number of predicates. Zero predicates mean no
   * filtering, a single predicate is returned unchanged.
   *
   * @param predicates
   *          the predicates
   * @return the disjunction, empty when there is nothing to filter on
   */
  default Optional<P> or(List<P> predicates) {
    return fold(predicates, false);
  }

  private Optional<P> fold(List<P> predicates, boolean conjunction) {
    if (predicates == null || predicates.isEmpty()) {
      return Optional.empty();
    }
    P result = predicates.get(0);
    for (int i = 1; i < predicates.size(); i++) {
      result = conjunction ? and(result, predicates.get(i)) : or(result, predicates.get(i));
    }
    return Optional.of(result);
  }
}
