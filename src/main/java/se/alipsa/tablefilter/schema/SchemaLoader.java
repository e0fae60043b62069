package se.alipsa.tablefilter.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import se.alipsa.tablefilter.helper.JsonSupport;

/**
 * Reads table schemas from JSON documents of the form
 *
 * <pre>
 * {"entityName": "transaction",
 *  "fields": [{"name": "amount", "type": "float"}, {"name": "name", "type": "string"}]}
 * </pre>
 */
public final class SchemaLoader {

  private SchemaLoader() {
  }

  /**
   * Load a schema file.
   *
   * @param file
   *          the schema document
   * @param defaultEntityName
   *          entity name to use when the document does not declare one
   * @return the schema
   * @throws IOException
   *           if the file cannot be read or does not describe a valid schema
   */
  public static TableSchema load(Path file, String defaultEntityName) throws IOException {
    JsonNode root = JsonSupport.readTree(file);
    try {
      return fromJson(root, defaultEntityName);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid schema file " + file + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parse a schema from JSON text.
   *
   * @param json
   *          the schema document
   * @param defaultEntityName
   *          entity name to use when the document does not declare one
   * @return the schema
   * @throws IOException
   *           if the text is not valid JSON
   * @throws IllegalArgumentException
   *           if the document does not describe a valid schema
   */
  public static TableSchema parse(String json, String defaultEntityName) throws IOException {
    return fromJson(JsonSupport.mapper().readTree(json), defaultEntityName);
  }

  static TableSchema fromJson(JsonNode root, String defaultEntityName) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Schema document must be a JSON object");
    }
    String entityName = root.path("entityName").asText(null);
    if (entityName == null || entityName.isBlank()) {
      entityName = defaultEntityName;
    }
    if (entityName == null || entityName.isBlank()) {
      throw new IllegalArgumentException("Schema document has no entityName");
    }
    JsonNode fieldsNode = root.path("fields");
    if (!fieldsNode.isArray()) {
      throw new IllegalArgumentException("Schema for '" + entityName + "' has no fields array");
    }
    List<FieldDefinition> fields = new ArrayList<>(fieldsNode.size());
    for (JsonNode fieldNode : fieldsNode) {
      String name = fieldNode.path("name").asText(null);
      String type = fieldNode.path("type").asText(null);
      if (name == null || type == null) {
        throw new IllegalArgumentException("Field definitions need a name and a type, got " + fieldNode);
      }
      fields.add(FieldDefinition.of(name, type));
    }
    return new TableSchema(entityName, fields);
  }
}
