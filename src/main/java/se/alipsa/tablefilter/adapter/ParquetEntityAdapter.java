package se.alipsa.tablefilter.adapter;

import java.time.Instant;
import java.util.Objects;
import org.apache.avro.Schema;
import org.apache.parquet.filter2.predicate.FilterApi;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.apache.parquet.filter2.predicate.Operators;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.engine.AvroValues;
import se.alipsa.tablefilter.engine.Condition;
import se.alipsa.tablefilter.engine.Operator;
import se.alipsa.tablefilter.engine.OperatorTable;
import se.alipsa.tablefilter.schema.AvroSchemas;
import se.alipsa.tablefilter.schema.FieldDefinition;
import se.alipsa.tablefilter.schema.FieldType;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * Lowers filter conditions into Parquet {@link FilterPredicate}s for a table
 * stored with a given Avro schema.
 *
 * <p>
 * Comparisons use the typed column matching the Avro storage type of the
 * field; text operators are {@link FoldedTextPredicate}s. Parquet treats a
 * missing column as all nulls, and no leaf produced here accepts a null, so
 * a record lacking a value never matches a leaf. Parquet rewrites {@code not}
 * by inverting comparisons, and an inverted comparison still rejects nulls,
 * so every leaf except equality carries an explicit {@code notEq(col, null)}
 * whose inverse lets the nulls back in.
 * </p>
 */
public final class ParquetEntityAdapter implements EntityAdapter<FilterPredicate> {

  private final TableSchema schema;
  private final Schema avroSchema;

  /**
   * Create an adapter for a table stored with the given Avro schema.
   *
   * @param schema
   *          the table schema conditions are validated against
   * @param avroSchema
   *          the Avro record schema of the Parquet data
   * @throws IllegalArgumentException
   *           if a table field is missing from the Avro schema or is stored as
   *           a type that does not match its declared type
   */
  public ParquetEntityAdapter(TableSchema schema, Schema avroSchema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.avroSchema = Objects.requireNonNull(avroSchema, "avroSchema");
    for (FieldDefinition field : schema.fields()) {
      Schema.Field column = avroSchema.getField(field.name());
      if (column == null) {
        throw new IllegalArgumentException(
            "Field '" + field.name() + "' of " + schema.entityName() + " is not a column of " + avroSchema.getName());
      }
      FieldType stored = AvroSchemas.fieldTypeOf(column.name(), column.schema());
      if (stored != field.type() && !(stored.isTextual() && field.type().isTextual())) {
        throw new IllegalArgumentException("Field '" + field.name() + "' is declared " + field.type()
            + " but stored as " + AvroSchemas.effectiveSchema(column.schema()).getType());
      }
    }
  }

  /**
   * Adapter for a table schema stored as {@link AvroSchemas#toAvro(TableSchema)}
   * lays it out.
   *
   * @param schema
   *          the table schema, e.g. loaded from a schema file at runtime
   * @return the adapter
   */
  public static ParquetEntityAdapter forSchema(TableSchema schema) {
    return new ParquetEntityAdapter(schema, AvroSchemas.toAvro(schema));
  }

  /**
   * Adapter for existing Parquet data, the table schema introspected from the
   * file's Avro schema.
   *
   * @param entityName
   *          the entity name
   * @param avroSchema
   *          the Avro record schema of the file
   * @return the adapter
   */
  public static ParquetEntityAdapter forAvroSchema(String entityName, Schema avroSchema) {
    return new ParquetEntityAdapter(AvroSchemas.fromAvro(entityName, avroSchema), avroSchema);
  }

  @Override
  public TableSchema schema() {
    return schema;
  }

  /**
   * The Avro storage schema.
   *
   * @return the Avro record schema
   */
  public Schema avroSchema() {
    return avroSchema;
  }

  @Override
  public FilterPredicate predicateForField(String field, String operator, Object value) throws FilterException {
    return toPredicate(OperatorTable.resolve(schema, field, operator, value));
  }

  @Override
  public FilterPredicate and(FilterPredicate left, FilterPredicate right) {
    return FilterApi.and(left, right);
  }

  @Override
  public FilterPredicate or(FilterPredicate left, FilterPredicate right) {
    return FilterApi.or(left, right);
  }

  @Override
  public FilterPredicate not(FilterPredicate predicate) {
    return FilterApi.not(predicate);
  }

  @Override
  public FilterPredicate matchNone() {
    if (schema.fields().isEmpty()) {
      throw new IllegalStateException("Entity " + schema.entityName() + " has no columns to filter on");
    }
    Schema.Field column = avroSchema.getField(schema.fields().get(0).name());
    return FilterApi.and(nullTest(column, true), nullTest(column, false));
  }

  private FilterPredicate toPredicate(Condition c) {
    Schema.Field column = avroSchema.getField(c.column());
    Schema s = AvroSchemas.effectiveSchema(column.schema());
    String name = column.name();
    Operator op = c.operator();
    switch (s.getType()) {
      case STRING, ENUM:
        return FilterApi.userDefined(FilterApi.binaryColumn(name), new FoldedTextPredicate(op, (String) c.value()));
      case BOOLEAN: {
        Operators.BooleanColumn col = FilterApi.booleanColumn(name);
        Boolean v = (Boolean) c.value();
        return op == Operator.EQ ? FilterApi.eq(col, v)
            : FilterApi.and(FilterApi.notEq(col, v), FilterApi.notEq(col, null));
      }
      case INT:
        return compare(FilterApi.intColumn(name), op, intBounds(c.value()),
            c.upperBound() == null ? null : intBounds(c.upperBound()));
      case LONG:
        if (AvroSchemas.isTimestamp(s)) {
          return compare(FilterApi.longColumn(name), op, epochBounds((Instant) c.value(), s),
              c.upperBound() == null ? null : epochBounds((Instant) c.upperBound(), s));
        }
        return compare(FilterApi.longColumn(name), op, Bounds.of(((Number) c.value()).longValue()),
            c.upperBound() == null ? null : Bounds.of(((Number) c.upperBound()).longValue()));
      case FLOAT:
        return compare(FilterApi.floatColumn(name), op, floatBounds(((Number) c.value()).doubleValue()),
            c.upperBound() == null ? null : floatBounds(((Number) c.upperBound()).doubleValue()));
      case DOUBLE:
        return compare(FilterApi.doubleColumn(name), op, Bounds.of(((Number) c.value()).doubleValue()),
            c.upperBound() == null ? null : Bounds.of(((Number) c.upperBound()).doubleValue()));
      default:
        throw new IllegalStateException("Column " + name + " has unsupported type " + s.getType());
    }
  }

  /**
   * The stored values closest to an operand: {@code floor} is the largest not
   * above it, {@code ceil} the smallest not below it. A null bound means the
   * operand lies beyond the range of the column on that side.
   */
  private record Bounds<T extends Comparable<T>>(T floor, T ceil) {

    static <T extends Comparable<T>> Bounds<T> of(T value) {
      return new Bounds<>(value, value);
    }

    boolean exact() {
      return floor != null && floor.equals(ceil);
    }
  }

  private static <T extends Comparable<T>, C extends Operators.Column<T> & Operators.SupportsLtGt>
      FilterPredicate compare(C column, Operator op, Bounds<T> value, Bounds<T> upper) {
    // inverted comparisons reject nulls too, the guard turns into "or is null"
    FilterPredicate notNull = FilterApi.notEq(column, null);
    FilterPredicate none = FilterApi.and(FilterApi.eq(column, null), notNull);
    switch (op) {
      case EQ:
        return value.exact() ? FilterApi.eq(column, value.floor()) : none;
      case NOT_EQ:
        return value.exact() ? FilterApi.and(FilterApi.notEq(column, value.floor()), notNull) : notNull;
      case GT:
        return value.floor() == null ? notNull : FilterApi.and(FilterApi.gt(column, value.floor()), notNull);
      case GT_EQ:
        return value.ceil() == null ? none : FilterApi.and(FilterApi.gtEq(column, value.ceil()), notNull);
      case LT:
        return value.ceil() == null ? notNull : FilterApi.and(FilterApi.lt(column, value.ceil()), notNull);
      case LT_EQ:
        return value.floor() == null ? none : FilterApi.and(FilterApi.ltEq(column, value.floor()), notNull);
      case BETWEEN:
        return FilterApi.and(compare(column, Operator.GT_EQ, value, null),
            compare(column, Operator.LT_EQ, upper, null));
      default:
        throw new IllegalArgumentException("Operator " + op + " is not a comparison");
    }
  }

  private static Bounds<Integer> intBounds(Comparable<?> value) {
    long v = ((Number) value).longValue();
    if (v > Integer.MAX_VALUE) {
      return new Bounds<>(Integer.MAX_VALUE, null);
    }
    if (v < Integer.MIN_VALUE) {
      return new Bounds<>(null, Integer.MIN_VALUE);
    }
    return Bounds.of((int) v);
  }

  // floats are compared as their widened decimal rendering, see AvroValues.widen
  private static Bounds<Float> floatBounds(double d) {
    float f = (float) d;
    while (AvroValues.widen(f) > d) {
      f = Math.nextDown(f);
    }
    while (AvroValues.widen(Math.nextUp(f)) <= d) {
      f = Math.nextUp(f);
    }
    float ceil = AvroValues.widen(f) == d ? f : Math.nextUp(f);
    return new Bounds<>(Float.isInfinite(f) ? null : f, Float.isInfinite(ceil) ? null : ceil);
  }

  private static Bounds<Long> epochBounds(Instant instant, Schema s) {
    try {
      long floor = AvroValues.toEpoch(instant, s);
      if (AvroValues.unwrap(floor, s).equals(instant)) {
        return Bounds.of(floor);
      }
      return new Bounds<>(floor, Math.addExact(floor, 1));
    } catch (ArithmeticException e) {
      return instant.isBefore(Instant.EPOCH) ? new Bounds<>(null, Long.MIN_VALUE)
          : new Bounds<>(Long.MAX_VALUE, null);
    }
  }

  private static FilterPredicate nullTest(Schema.Field column, boolean isNull) {
    String name = column.name();
    Schema s = AvroSchemas.effectiveSchema(column.schema());
    switch (s.getType()) {
      case STRING, ENUM: {
        Operators.BinaryColumn col = FilterApi.binaryColumn(name);
        return isNull ? FilterApi.eq(col, null) : FilterApi.notEq(col, null);
      }
      case BOOLEAN: {
        Operators.BooleanColumn col = FilterApi.booleanColumn(name);
        return isNull ? FilterApi.eq(col, null) : FilterApi.notEq(col, null);
      }
      case INT: {
        Operators.IntColumn col = FilterApi.intColumn(name);
        return isNull ? FilterApi.eq(col, null) : FilterApi.notEq(col, null);
      }
      case LONG: {
        Operators.LongColumn col = FilterApi.longColumn(name);
        return isNull ? FilterApi.eq(col, null) : FilterApi.notEq(col, null);
      }
      case FLOAT: {
        Operators.FloatColumn col = FilterApi.floatColumn(name);
        return isNull ? FilterApi.eq(col, null) : FilterApi.notEq(col, null);
      }
      case DOUBLE: {
        Operators.DoubleColumn col = FilterApi.doubleColumn(name);
        return isNull ? FilterApi.eq(col, null) : FilterApi.notEq(col, null);
      }
      default:
        throw new IllegalStateException("Column " + name + " has unsupported type " + s.getType());
    }
  }
}
