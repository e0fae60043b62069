package se.alipsa.tablefilter.schema;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link TableSchema}. */
class TableSchemaTest {

  private final TableSchema schema = TableSchema.builder("transaction").field("Amount", FieldType.FLOAT)
      .field("name", FieldType.STRING).build();

  @Test
  void looksUpFieldsIgnoringCase() {
    assertEquals(FieldType.FLOAT, schema.findField("amount").orElseThrow().type());
    assertEquals("Amount", schema.findField("AMOUNT").orElseThrow().name());
    assertTrue(schema.hasField("NAME"));
    assertTrue(schema.findField("nope").isEmpty());
    assertTrue(schema.findField(null).isEmpty());
  }

  @Test
  void keepsDeclarationOrder() {
    assertEquals(List.of("Amount", "name"), schema.fields().stream().map(FieldDefinition::name).toList());
    assertThrows(UnsupportedOperationException.class,
        () -> schema.fields().add(new FieldDefinition("x", FieldType.INT)));
  }

  @Test
  void rejectsDuplicateNamesIgnoringCase() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> TableSchema.builder("t").field("name", FieldType.STRING).field("NAME", FieldType.TEXT).build());
    assertTrue(e.getMessage().contains("Duplicate field"), e.getMessage());
  }

  @Test
  void rejectsBlankFieldNames() {
    assertThrows(IllegalArgumentException.class, () -> new FieldDefinition(" ", FieldType.INT));
  }

  @Test
  void equalityIsStructural() {
    TableSchema same = new TableSchema("transaction",
        List.of(new FieldDefinition("Amount", FieldType.FLOAT), FieldDefinition.of("name", "string")));
    assertEquals(schema, same);
    assertEquals(schema.hashCode(), same.hashCode());
  }
}
