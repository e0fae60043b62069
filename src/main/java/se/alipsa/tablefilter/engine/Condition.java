package se.alipsa.tablefilter.engine;

import java.util.Objects;
import se.alipsa.tablefilter.schema.FieldDefinition;

/**
 * A validated leaf condition: the field resolved against the schema, the
 * operator checked against the field type and the operand coerced to the
 * comparison domain of the field (see
 * {@link se.alipsa.tablefilter.value.Coercions}).
 *
 * @param fieldName
 *          the field name exactly as written in the expression
 * @param field
 *          the schema definition the name resolved to
 * @param operator
 *          the operator
 * @param value
 *          the coerced operand; the lower bound for {@link Operator#BETWEEN}
 * @param upperBound
 *          the coerced upper bound for {@link Operator#BETWEEN}, otherwise
 *          {@code null}
 */
public record Condition(String fieldName, FieldDefinition field, Operator operator, Comparable<?> value,
    Comparable<?> upperBound) {

  /**
   * Validates the components.
   *
   * @param fieldName
   *          the field name as written
   * @param field
   *          the resolved field
   * @param operator
   *          the operator
   * @param value
   *          the operand or lower bound
   * @param upperBound
   *          the upper bound, only for between
   */
  public Condition {
    Objects.requireNonNull(fieldName, "fieldName");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
    if ((operator == Operator.BETWEEN) != (upperBound != null)) {
      throw new IllegalArgumentException("An upper bound is required for, and only for, between");
    }
  }

  /**
   * The canonical column name as declared in the schema.
   *
   * @return the schema field name
   */
  public String column() {
    return field.name();
  }

  @Override
  public String toString() {
    if (operator == Operator.BETWEEN) {
      return fieldName + " between [" + value + ", " + upperBound + "]";
    }
    return fieldName + " " + operator.token() + " " + value;
  }
}
