package se.alipsa.tablefilter.engine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.FilterException.Kind;
import se.alipsa.tablefilter.schema.FieldDefinition;
import se.alipsa.tablefilter.schema.FieldType;
import se.alipsa.tablefilter.schema.TableSchema;
import se.alipsa.tablefilter.value.CoercionException;
import se.alipsa.tablefilter.value.Coercions;
import se.alipsa.tablefilter.value.FilterValue;

/**
 * The operators each field type supports, and the validation that turns a raw
 * {@code [field, operator, value]} triple into a {@link Condition}. Shared by
 * every evaluation backend; holds no mutable state.
 */
public final class OperatorTable {

  private static final Map<FieldType, Set<Operator>> OPERATORS;

  static {
    Map<FieldType, Set<Operator>> ops = new EnumMap<>(FieldType.class);
    Set<Operator> text = Collections.unmodifiableSet(EnumSet.of(Operator.EQ, Operator.NOT_EQ, Operator.CONTAINS,
        Operator.NOT_CONTAINS, Operator.STARTS_WITH, Operator.ENDS_WITH));
    Set<Operator> ordered = Collections.unmodifiableSet(EnumSet.of(Operator.EQ, Operator.NOT_EQ, Operator.GT,
        Operator.GT_EQ, Operator.LT, Operator.LT_EQ, Operator.BETWEEN));
    ops.put(FieldType.STRING, text);
    ops.put(FieldType.TEXT, text);
    ops.put(FieldType.INT, ordered);
    ops.put(FieldType.FLOAT, ordered);
    ops.put(FieldType.TIMESTAMP, ordered);
    ops.put(FieldType.BOOL, Collections.unmodifiableSet(EnumSet.of(Operator.EQ, Operator.NOT_EQ)));
    OPERATORS = Collections.unmodifiableMap(ops);
  }

  private OperatorTable() {
  }

  /**
   * The operators defined for a field type.
   *
   * @param type
   *          the field type
   * @return the supported operators
   */
  public static Set<Operator> operatorsFor(FieldType type) {
    return OPERATORS.get(type);
  }

  /**
   * Whether an operator is defined for a field type.
   *
   * @param type
   *          the field type
   * @param operator
   *          the operator
   * @return true if supported
   */
  public static boolean supports(FieldType type, Operator operator) {
    return OPERATORS.get(type).contains(operator);
  }

  /**
   * Validate a leaf condition against a schema.
   *
   * @param schema
   *          the table schema
   * @param fieldName
   *          the field name as written, resolved case-insensitively
   * @param operatorToken
   *          the operator token, compared case-insensitively
   * @param rawValue
   *          the operand as deserialized from the expression
   * @return the validated condition
   * @throws FilterException
   *           {@link Kind#UNKNOWN_FIELD} if the schema has no such field,
   *           {@link Kind#UNSUPPORTED_OPERATOR} if the operator is not defined
   *           for the field type, {@link Kind#INVALID_OPERAND_TYPE} if the
   *           operand cannot be coerced
   */
  public static Condition resolve(TableSchema schema, String fieldName, String operatorToken, Object rawValue)
      throws FilterException {
    Optional<FieldDefinition> found = schema.findField(fieldName);
    if (found.isEmpty()) {
      throw new FilterException(Kind.UNKNOWN_FIELD,
          "field '" + fieldName + "' not found in schema for entity '" + schema.entityName() + "'");
    }
    FieldDefinition field = found.get();
    Optional<Operator> operator = Operator.fromToken(operatorToken);
    if (operator.isEmpty() || !supports(field.type(), operator.get())) {
      throw new FilterException(Kind.UNSUPPORTED_OPERATOR, "unsupported operator '" + operatorToken
          + "' for field type " + field.type() + " of field " + fieldName);
    }
    Operator op = operator.get();
    FilterValue operand = operand(rawValue, fieldName);
    if (op == Operator.BETWEEN) {
      if (!(operand instanceof FilterValue.Sequence seq) || seq.elements().size() != 2) {
        throw new FilterException(Kind.INVALID_OPERAND_TYPE,
            "operator 'between' requires an array of two values, got " + operand.kind() + " for field " + fieldName);
      }
      List<FilterValue> bounds = seq.elements();
      Comparable<?> lower = coerce(bounds.get(0), field, "invalid lower bound for 'between' on");
      Comparable<?> upper = coerce(bounds.get(1), field, "invalid upper bound for 'between' on");
      return new Condition(fieldName, field, op, lower, upper);
    }
    return new Condition(fieldName, field, op, coerce(operand, field, "invalid value for"), null);
  }

  private static FilterValue operand(Object rawValue, String fieldName) throws FilterException {
    try {
      return FilterValue.of(rawValue);
    } catch (IllegalArgumentException e) {
      throw new FilterException(Kind.INVALID_OPERAND_TYPE,
          "invalid value for field " + fieldName + ": " + e.getMessage(), e);
    }
  }

  private static Comparable<?> coerce(FilterValue value, FieldDefinition field, String context)
      throws FilterException {
    try {
      return Coercions.coerce(value, field.type());
    } catch (CoercionException e) {
      throw new FilterException(Kind.INVALID_OPERAND_TYPE,
          context + " " + field.type() + " field " + field.name() + ": " + e.getMessage(), e);
    }
  }
}
