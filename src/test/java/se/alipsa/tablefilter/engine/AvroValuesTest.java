package se.alipsa.tablefilter.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.util.Utf8;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link AvroValues}. */
class AvroValuesTest {

  @Test
  void unwrapsTimestamps() {
    Schema micros = LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
    Schema millis = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
    Instant instant = Instant.parse("2024-02-03T10:11:12.123456Z");

    assertEquals(instant, AvroValues.unwrap(AvroValues.toEpoch(instant, micros), micros));
    assertEquals(Instant.parse("2024-02-03T10:11:12.123Z"), AvroValues.unwrap(AvroValues.toEpoch(instant, millis),
        millis));
  }

  @Test
  void epochValuesRoundDown() {
    Schema micros = LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
    Schema millis = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));

    assertEquals(1L, AvroValues.toEpoch(Instant.parse("1970-01-01T00:00:00.0000019Z"), micros));
    assertEquals(-1L, AvroValues.toEpoch(Instant.parse("1969-12-31T23:59:59.9999995Z"), micros));
    assertEquals(-1L, AvroValues.toEpoch(Instant.parse("1969-12-31T23:59:59.9995Z"), millis));
    assertThrows(ArithmeticException.class, () -> AvroValues.toEpoch(Instant.MAX, micros));
  }

  @Test
  void unwrapsTextAndNumbers() {
    Schema string = Schema.create(Schema.Type.STRING);
    assertEquals("hello", AvroValues.unwrap(new Utf8("hello"), string));
    assertEquals("hi", AvroValues.unwrap(ByteBuffer.wrap("hi".getBytes(StandardCharsets.UTF_8)), string));
    assertEquals(42L, AvroValues.unwrap(42, Schema.create(Schema.Type.INT)));
    assertEquals(0.1, AvroValues.unwrap(0.1f, Schema.create(Schema.Type.FLOAT)));
    assertEquals(Boolean.TRUE, AvroValues.unwrap(true, Schema.create(Schema.Type.BOOLEAN)));
  }

  @Test
  void collapsesNullableUnions() {
    Schema nullableInt = Schema.createUnion(Schema.create(Schema.Type.NULL), Schema.create(Schema.Type.INT));
    assertEquals(7L, AvroValues.unwrap(7, nullableInt));
    assertNull(AvroValues.unwrap(null, nullableInt));
  }

  @Test
  void copiesRecordsInFieldOrder() {
    Schema schema = SchemaBuilder.record("R").fields().requiredString("name").optionalLong("count").endRecord();
    GenericRecord record = new GenericData.Record(schema);
    record.put("name", new Utf8("a"));
    record.put("count", null);

    Map<String, Object> values = AvroValues.toMap(record);
    assertEquals(List.of("name", "count"), List.copyOf(values.keySet()));
    assertEquals("a", values.get("name"));
    assertTrue(values.containsKey("count"));
    assertNull(values.get("count"));
  }
}
