package se.alipsa.tablefilter.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The ordered field definitions of one table together with a
 * case-insensitive name index. Instances are immutable and may be shared
 * between threads.
 */
public final class TableSchema {

  private final String entityName;
  private final List<FieldDefinition> fields;
  /** lower(field name) -> definition */
  private final Map<String, FieldDefinition> fieldIndex;

  /**
   * Create a schema.
   *
   * @param entityName
   *          the table or entity name
   * @param fields
   *          the field definitions in declaration order
   * @throws IllegalArgumentException
   *           if two fields share a name (compared case-insensitively)
   */
  public TableSchema(String entityName, List<FieldDefinition> fields) {
    this.entityName = Objects.requireNonNull(entityName, "entityName");
    Objects.requireNonNull(fields, "fields");
    Map<String, FieldDefinition> index = new LinkedHashMap<>();
    for (FieldDefinition field : fields) {
      Objects.requireNonNull(field, "field");
      FieldDefinition previous = index.putIfAbsent(normalizeKey(field.name()), field);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in schema for entity '"
            + entityName + "' (conflicts with '" + previous.name() + "')");
      }
    }
    this.fields = List.copyOf(fields);
    this.fieldIndex = Collections.unmodifiableMap(index);
  }

  /**
   * Start building a schema.
   *
   * @param entityName
   *          the table or entity name
   * @return a new builder
   */
  public static Builder builder(String entityName) {
    return new Builder(entityName);
  }

  /**
   * The table or entity name.
   *
   * @return the entity name
   */
  public String entityName() {
    return entityName;
  }

  /**
   * The field definitions in declaration order.
   *
   * @return an immutable list of fields
   */
  public List<FieldDefinition> fields() {
    return fields;
  }

  /**
   * Look up a field by name, ignoring case.
   *
   * @param name
   *          the field name (may be {@code null})
   * @return the definition, or empty when the schema has no such field
   */
  public Optional<FieldDefinition> findField(String name) {
    return Optional.ofNullable(fieldIndex.get(normalizeKey(name)));
  }

  /**
   * Whether the schema declares a field with the given name, ignoring case.
   *
   * @param name
   *          the field name
   * @return true if the field exists
   */
  public boolean hasField(String name) {
    return fieldIndex.containsKey(normalizeKey(name));
  }

  /**
   * Normalize a field name for case-insensitive lookups.
   *
   * @param name
   *          the field name to normalize (may be {@code null})
   * @return the normalized key, or an empty string when {@code name} is
   *         {@code null} or blank
   */
  static String normalizeKey(String name) {
    if (name == null) {
      return "";
    }
    String trimmed = name.trim();
    if (trimmed.isEmpty()) {
      return "";
    }
    return trimmed.toLowerCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableSchema other)) {
      return false;
    }
    return entityName.equals(other.entityName) && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityName, fields);
  }

  @Override
  public String toString() {
    return "TableSchema{" + entityName + ", fields=" + fields + '}';
  }

  /** Incremental construction of a {@link TableSchema}. */
  public static final class Builder {

    private final String entityName;
    private final List<FieldDefinition> fields = new ArrayList<>();

    private Builder(String entityName) {
      this.entityName = entityName;
    }

    /**
     * Append a field.
     *
     * @param name
     *          the field name
     * @param type
     *          the declared type
     * @return this builder
     */
    public Builder field(String name, FieldType type) {
      fields.add(new FieldDefinition(name, type));
      return this;
    }

    /**
     * Build the schema.
     *
     * @return the immutable schema
     */
    public TableSchema build() {
      return new TableSchema(entityName, fields);
    }
  }
}
