package se.alipsa.tablefilter.schema;

import java.util.Objects;

/**
 * A named, typed field of a table.
 *
 * @param name
 *          the field name as declared
 * @param type
 *          the declared scalar type
 */
public record FieldDefinition(String name, FieldType type) {

  /**
   * Validates the components.
   *
   * @param name
   *          the field name, must not be blank
   * @param type
   *          the declared type, must not be null
   */
  public FieldDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Field name must not be blank");
    }
  }

  /**
   * Create a field definition from a type name found in a schema document.
   *
   * @param name
   *          the field name
   * @param typeName
   *          the type name, see {@link FieldType#fromName(String)}
   * @return the field definition
   */
  public static FieldDefinition of(String name, String typeName) {
    return new FieldDefinition(name, FieldType.fromName(typeName));
  }
}
