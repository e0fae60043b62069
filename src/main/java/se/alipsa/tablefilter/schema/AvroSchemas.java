package se.alipsa.tablefilter.schema;

import java.util.ArrayList;
import java.util.List;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

/**
 * Conversions between {@link TableSchema} and the Avro record schemas used to
 * store tables in Parquet files.
 */
public final class AvroSchemas {

  private AvroSchemas() {
  }

  /**
   * Collapse nullable unions to their non-null branch, else return input.
   *
   * @param s
   *          the schema
   * @return effective schema
   */
  public static Schema effectiveSchema(Schema s) {
    if (s.getType() == Schema.Type.UNION) {
      for (Schema t : s.getTypes()) {
        if (t.getType() != Schema.Type.NULL) {
          return t;
        }
      }
    }
    return s;
  }

  /**
   * Build the Avro record schema used to store a table. Every field is
   * nullable so that records lacking a value can be written.
   *
   * @param schema
   *          the table schema
   * @return an Avro record schema with one field per table field
   */
  public static Schema toAvro(TableSchema schema) {
    SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(recordName(schema.entityName()))
        .namespace("se.alipsa.tablefilter.generated").fields();
    for (FieldDefinition field : schema.fields()) {
      Schema nullable = Schema.createUnion(Schema.create(Schema.Type.NULL), storageType(field.type()));
      fields = fields.name(field.name()).type(nullable).withDefault(null);
    }
    return fields.endRecord();
  }

  /**
   * Derive a table schema from an Avro record schema, e.g. the schema found in
   * the footer of a Parquet file.
   *
   * @param entityName
   *          the entity name to give the table
   * @param avroSchema
   *          an Avro record schema
   * @return the table schema
   * @throws IllegalArgumentException
   *           if a field has a type that cannot be filtered on
   */
  public static TableSchema fromAvro(String entityName, Schema avroSchema) {
    if (avroSchema.getType() != Schema.Type.RECORD) {
      throw new IllegalArgumentException("Expected an Avro record schema, got " + avroSchema.getType());
    }
    List<FieldDefinition> fields = new ArrayList<>();
    for (Schema.Field f : avroSchema.getFields()) {
      fields.add(new FieldDefinition(f.name(), fieldTypeOf(f.name(), f.schema())));
    }
    return new TableSchema(entityName, fields);
  }

  /**
   * Whether an Avro long schema carries a timestamp logical type.
   *
   * @param s
   *          the (effective) schema
   * @return true for timestamp-millis and timestamp-micros
   */
  public static boolean isTimestamp(Schema s) {
    LogicalType lt = s.getLogicalType();
    return lt instanceof LogicalTypes.TimestampMillis || lt instanceof LogicalTypes.TimestampMicros;
  }

  private static Schema storageType(FieldType type) {
    return switch (type) {
      case STRING, TEXT -> Schema.create(Schema.Type.STRING);
      case INT -> Schema.create(Schema.Type.LONG);
      case FLOAT -> Schema.create(Schema.Type.DOUBLE);
      case BOOL -> Schema.create(Schema.Type.BOOLEAN);
      case TIMESTAMP -> LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
    };
  }

  /**
   * The field type an Avro column is filtered as.
   *
   * @param fieldName
   *          the column name, for the error message
   * @param schema
   *          the column schema, nullable unions are collapsed
   * @return the field type
   * @throws IllegalArgumentException
   *           if the column type cannot be filtered on
   */
  public static FieldType fieldTypeOf(String fieldName, Schema schema) {
    Schema s = effectiveSchema(schema);
    return switch (s.getType()) {
      case STRING, ENUM -> FieldType.STRING;
      case INT -> FieldType.INT;
      case LONG -> isTimestamp(s) ? FieldType.TIMESTAMP : FieldType.INT;
      case FLOAT, DOUBLE -> FieldType.FLOAT;
      case BOOLEAN -> FieldType.BOOL;
      default -> throw new IllegalArgumentException(
          "Field '" + fieldName + "' has Avro type " + s.getType() + " which cannot be filtered on");
    };
  }

  private static String recordName(String entityName) {
    StringBuilder sb = new StringBuilder(entityName.length());
    for (int i = 0; i < entityName.length(); i++) {
      char c = entityName.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0 || !Character.isLetter(sb.charAt(0)) && sb.charAt(0) != '_') {
      sb.insert(0, '_');
    }
    return sb.toString();
  }
}
