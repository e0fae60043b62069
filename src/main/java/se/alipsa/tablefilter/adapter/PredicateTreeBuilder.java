package se.alipsa.tablefilter.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.engine.FilterBackend;
import se.alipsa.tablefilter.engine.FilterExpressionParser;

/**
 * Lowers a filter expression into an engine predicate through an
 * {@link EntityAdapter}. An empty result means "no filtering": it is what the
 * empty expression produces, it is dropped from an AND and it absorbs an OR.
 *
 * @param <P>
 *          the engine predicate type
 */
public final class PredicateTreeBuilder<P> implements FilterBackend<Optional<P>> {

  private static final Logger log = LoggerFactory.getLogger(PredicateTreeBuilder.class);

  private final EntityAdapter<P> adapter;

  /**
   * Create a builder for one adapter.
   *
   * @param adapter
   *          the adapter leaf conditions and combinators are delegated to
   */
  public PredicateTreeBuilder(EntityAdapter<P> adapter) {
    this.adapter = Objects.requireNonNull(adapter, "adapter");
  }

  /**
   * Build the predicate for an expression using the default parser.
   *
   * @param <P>
   *          the engine predicate type
   * @param adapter
   *          the entity adapter
   * @param expression
   *          the filter expression, {@code null} for none
   * @return the predicate, or empty when the expression does not filter
   * @throws FilterException
   *           if the expression is invalid
   */
  public static <P> Optional<P> build(EntityAdapter<P> adapter, Object expression) throws FilterException {
    return build(FilterExpressionParser.defaultParser(), adapter, expression);
  }

  /**
   * Build the predicate for an expression.
   *
   * @param <P>
   *          the engine predicate type
   * @param parser
   *          the parser to use
   * @param adapter
   *          the entity adapter
   * @param expression
   *          the filter expression, {@code null} for none
   * @return the predicate, or empty when the expression does not filter
   * @throws FilterException
   *           if the expression is invalid
   */
  public static <P> Optional<P> build(FilterExpressionParser parser, EntityAdapter<P> adapter, Object expression)
      throws FilterException {
    Optional<P> predicate = parser.walk(expression, new PredicateTreeBuilder<>(adapter));
    if (log.isDebugEnabled()) {
      log.debug("Filter on {} lowered to {}", adapter.entityName(), predicate.map(String::valueOf).orElse("<none>"));
    }
    return predicate;
  }

  @Override
  public Optional<P> matchAll() {
    return Optional.empty();
  }

  @Override
  public Optional<P> leaf(String field, String operator, Object value) throws FilterException {
    return Optional.of(adapter.predicateForField(field, operator, value));
  }

  @Override
  public Optional<P> not(Optional<P> operand) {
    return Optional.of(operand.map(adapter::not).orElseGet(adapter::matchNone));
  }

  @Override
  public Optional<P> and(Optional<P> left, Optional<P> right) {
    List<P> operands = new ArrayList<>(2);
    left.ifPresent(operands::add);
    right.ifPresent(operands::add);
    return adapter.and(operands);
  }

  @Override
  public Optional<P> or(Optional<P> left, Optional<P> right) {
    if (left.isEmpty() || right.isEmpty()) {
      return Optional.empty();
    }
    return adapter.or(List.of(left.get(), right.get()));
  }
}
