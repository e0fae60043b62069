package se.alipsa.tablefilter.engine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.schema.TableSchema;
import se.alipsa.tablefilter.value.CoercionException;
import se.alipsa.tablefilter.value.Coercions;
import se.alipsa.tablefilter.value.FilterValue;

/**
 * Evaluates filter expressions directly against field name to value records.
 *
 * <p>
 * An expression is compiled once into a {@link RecordMatcher}; all grammar,
 * schema and operand errors surface during compilation. Matching itself never
 * fails: a record that lacks a referenced field, holds {@code null} for it or
 * holds a value that cannot be coerced to the declared type simply does not
 * match that leaf.
 * </p>
 *
 * <p>
 * Record values are looked up by the field name exactly as written in the
 * expression, not by the canonical name from the schema.
 * </p>
 */
public final class InMemoryEvaluator implements FilterBackend<RecordMatcher> {

  private final TableSchema schema;

  /**
   * Create an evaluator for the given schema.
   *
   * @param schema
   *          the schema leaf conditions are validated against
   */
  public InMemoryEvaluator(TableSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /**
   * Compile an expression with the default parser.
   *
   * @param schema
   *          the table schema
   * @param expression
   *          the filter expression, {@code null} for none
   * @return the matcher
   * @throws FilterException
   *           if the expression is invalid
   */
  public static RecordMatcher compile(TableSchema schema, Object expression) throws FilterException {
    return compile(FilterExpressionParser.defaultParser(), schema, expression);
  }

  /**
   * Compile an expression.
   *
   * @param parser
   *          the parser to use
   * @param schema
   *          the table schema
   * @param expression
   *          the filter expression, {@code null} for none
   * @return the matcher
   * @throws FilterException
   *           if the expression is invalid
   */
  public static RecordMatcher compile(FilterExpressionParser parser, TableSchema schema, Object expression)
      throws FilterException {
    return parser.walk(expression, new InMemoryEvaluator(schema));
  }

  /**
   * Evaluate an expression against one record.
   *
   * @param schema
   *          the table schema
   * @param expression
   *          the filter expression, {@code null} for none
   * @param record
   *          the record
   * @return true if the record matches
   * @throws FilterException
   *           if the expression is invalid
   */
  public static boolean evaluate(TableSchema schema, Object expression, Map<String, ?> record)
      throws FilterException {
    return compile(schema, expression).matches(record);
  }

  /**
   * Keep the records that match an expression, in their original order.
   *
   * @param <R>
   *          the record type
   * @param schema
   *          the table schema
   * @param expression
   *          the filter expression, {@code null} for none
   * @param records
   *          the records to filter
   * @return the matching records
   * @throws FilterException
   *           if the expression is invalid
   */
  public static <R extends Map<String, ?>> List<R> filter(TableSchema schema, Object expression, List<R> records)
      throws FilterException {
    return filter(compile(schema, expression), records);
  }

  /**
   * Keep the records accepted by a matcher, in their original order.
   *
   * @param <R>
   *          the record type
   * @param matcher
   *          the compiled filter
   * @param records
   *          the records to filter
   * @return the matching records
   */
  public static <R extends Map<String, ?>> List<R> filter(RecordMatcher matcher, List<R> records) {
    List<R> result = new ArrayList<>();
    for (R record : records) {
      if (matcher.matches(record)) {
        result.add(record);
      }
    }
    return result;
  }

  /**
   * Keep the records from a reader that match, in read order. The reader is
   * consumed but not closed.
   *
   * @param matcher
   *          the compiled filter
   * @param reader
   *          the record source
   * @return the matching records
   * @throws IOException
   *           if reading fails
   */
  public static List<Map<String, Object>> filter(RecordMatcher matcher, RecordReader reader) throws IOException {
    List<Map<String, Object>> result = new ArrayList<>();
    Map<String, Object> record;
    while ((record = reader.read()) != null) {
      if (matcher.matches(record)) {
        result.add(record);
      }
    }
    return result;
  }

  @Override
  public RecordMatcher matchAll() {
    return RecordMatcher.ALL;
  }

  @Override
  public RecordMatcher leaf(String field, String operator, Object value) throws FilterException {
    Condition condition = OperatorTable.resolve(schema, field, operator, value);
    return record -> matches(condition, record);
  }

  @Override
  public RecordMatcher not(RecordMatcher operand) {
    if (operand == RecordMatcher.ALL) {
      return RecordMatcher.NONE;
    }
    return record -> !operand.matches(record);
  }

  @Override
  public RecordMatcher and(RecordMatcher left, RecordMatcher right) {
    return record -> left.matches(record) && right.matches(record);
  }

  @Override
  public RecordMatcher or(RecordMatcher left, RecordMatcher right) {
    return record -> left.matches(record) || right.matches(record);
  }

  static boolean matches(Condition condition, Map<String, ?> record) {
    if (record == null || !record.containsKey(condition.fieldName())) {
      return false;
    }
    Object raw = record.get(condition.fieldName());
    if (raw == null) {
      return false;
    }
    Comparable<?> stored;
    try {
      stored = Coercions.coerce(FilterValue.of(raw), condition.field().type());
    } catch (CoercionException | IllegalArgumentException e) {
      return false;
    }
    return Comparisons.test(condition, stored);
  }
}
