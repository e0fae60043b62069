package se.alipsa.tablefilter.schema;

import java.util.Locale;

/** The scalar kinds a table field can be declared as. */
public enum FieldType {
  STRING("string"),
  INT("int"),
  FLOAT("float"),
  BOOL("bool"),
  TIMESTAMP("timestamp"),
  TEXT("text");

  private final String typeName;

  FieldType(String typeName) {
    this.typeName = typeName;
  }

  /**
   * The name used for this type in schema documents.
   *
   * @return the lower case type name
   */
  public String typeName() {
    return typeName;
  }

  /**
   * Whether values of this type are compared as text.
   *
   * @return true for {@link #STRING} and {@link #TEXT}
   */
  public boolean isTextual() {
    return this == STRING || this == TEXT;
  }

  /**
   * Whether values of this type have a natural order.
   *
   * @return true for {@link #INT}, {@link #FLOAT} and {@link #TIMESTAMP}
   */
  public boolean isOrdered() {
    return this == INT || this == FLOAT || this == TIMESTAMP;
  }

  /**
   * Resolve a type name as it appears in a schema document. Besides the
   * canonical names, the aliases written by older schema files are accepted
   * ({@code float64}, {@code time.Time}, {@code double}, {@code long},
   * {@code boolean}, {@code datetime}).
   *
   * @param name
   *          the type name, case-insensitive
   * @return the matching type
   * @throws IllegalArgumentException
   *           if the name is not a known type
   */
  public static FieldType fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Field type must not be blank");
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "string" -> STRING;
      case "text" -> TEXT;
      case "int", "integer", "long", "int64" -> INT;
      case "float", "float64", "double" -> FLOAT;
      case "bool", "boolean" -> BOOL;
      case "timestamp", "time.time", "datetime", "time" -> TIMESTAMP;
      default -> throw new IllegalArgumentException("Unknown field type: " + name);
    };
  }

  @Override
  public String toString() {
    return typeName;
  }
}
