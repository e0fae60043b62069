package se.alipsa.tablefilter.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.FilterException.Kind;
import se.alipsa.tablefilter.helper.JsonSupport;
import se.alipsa.tablefilter.schema.FieldType;
import se.alipsa.tablefilter.schema.TableSchema;

/** Unit tests for {@link InMemoryEvaluator}. */
class InMemoryEvaluatorTest {

  private static final TableSchema TRANSACTIONS = TableSchema.builder("transaction")
      .field("amount", FieldType.FLOAT).field("name", FieldType.STRING).build();

  private static final TableSchema ITEMS = TableSchema.builder("item").field("quantity", FieldType.INT)
      .field("active", FieldType.BOOL).field("created_at", FieldType.TIMESTAMP).field("notes", FieldType.TEXT)
      .build();

  private static boolean matches(TableSchema schema, String json, Map<String, ?> record) throws Exception {
    return InMemoryEvaluator.evaluate(schema, JsonSupport.parse(json), record);
  }

  @Test
  void emptyFilterMatchesEverything() throws Exception {
    assertTrue(matches(TRANSACTIONS, "[]", Map.of()));
    assertTrue(InMemoryEvaluator.evaluate(TRANSACTIONS, null, Map.of("amount", 1.0)));
  }

  @Test
  void negationIsTheComplementOfALeaf() throws Exception {
    String leaf = "[\"amount\", \">\", 150]";
    for (Map<String, Object> record : List.<Map<String, Object>>of(Map.of("amount", 100.0),
        Map.of("amount", 200.0), Map.of("name", "no amount"))) {
      assertEquals(!matches(TRANSACTIONS, leaf, record), matches(TRANSACTIONS, "[\"!\", " + leaf + "]", record),
          record.toString());
    }
  }

  @Test
  void chainsEvaluateLeftToRight() throws Exception {
    String expression = "[[\"amount\", \"=\", 1], \"or\", [\"amount\", \"=\", 2], \"and\", [\"name\", \"=\", \"x\"]]";
    // A or (B and C) would match this record, (A or B) and C does not
    assertFalse(matches(TRANSACTIONS, expression, Map.of("amount", 1.0, "name", "y")));
    assertTrue(matches(TRANSACTIONS, expression, Map.of("amount", 2.0, "name", "X")));
  }

  @Test
  void betweenIsInclusiveAndKeepsBoundsAsGiven() throws Exception {
    String between = "[\"amount\", \"between\", [100, 200]]";
    assertTrue(matches(TRANSACTIONS, between, Map.of("amount", 100.0)));
    assertTrue(matches(TRANSACTIONS, between, Map.of("amount", 200)));
    assertFalse(matches(TRANSACTIONS, between, Map.of("amount", 200.5)));
    assertFalse(matches(TRANSACTIONS, "[\"amount\", \"between\", [200, 100]]", Map.of("amount", 150.0)));
  }

  @Test
  void missingOrNullFieldNeverMatches() throws Exception {
    Map<String, Object> withNull = new HashMap<>();
    withNull.put("name", null);
    assertFalse(matches(TRANSACTIONS, "[\"name\", \"<>\", \"x\"]", withNull));
    assertFalse(matches(TRANSACTIONS, "[\"name\", \"notcontains\", \"x\"]", Map.of("amount", 1.0)));
    assertTrue(matches(TRANSACTIONS, "[\"!\", [\"name\", \"=\", \"x\"]]", Map.of("amount", 1.0)));
  }

  @Test
  void recordKeysAreMatchedExactly() throws Exception {
    assertTrue(matches(TRANSACTIONS, "[\"Name\", \"=\", \"a\"]", Map.of("Name", "A")));
    assertFalse(matches(TRANSACTIONS, "[\"Name\", \"=\", \"a\"]", Map.of("name", "A")));
  }

  @Test
  void stringOperatorsIgnoreCase() throws Exception {
    assertTrue(matches(TRANSACTIONS, "[\"name\", \"=\", \"foo\"]", Map.of("name", "Foo")));
    assertTrue(matches(TRANSACTIONS, "[\"name\", \"StartsWith\", \"TR\"]", Map.of("name", "trans")));
    assertTrue(matches(ITEMS, "[\"notes\", \"endswith\", \"END\"]", Map.of("notes", "the end")));
  }

  @Test
  void recordValuesAreCoercedToTheDeclaredType() throws Exception {
    Map<String, Object> record = Map.of("quantity", 10.0, "active", "TRUE", "created_at", "2024-05-01T12:00:00Z");
    assertTrue(matches(ITEMS, "[\"quantity\", \"=\", \"10\"]", record));
    assertTrue(matches(ITEMS, "[\"active\", \"=\", true]", record));
    assertTrue(matches(ITEMS, "[\"created_at\", \">\", \"2024-05-01\"]", record));
    assertTrue(matches(ITEMS, "[\"created_at\", \"between\", [\"2024-05-01\", \"2024-05-02T00:00:00\"]]", record));
  }

  @Test
  void uncoercibleRecordValuesDoNotMatch() throws Exception {
    assertFalse(matches(ITEMS, "[\"quantity\", \">\", 1]", Map.of("quantity", "many")));
    assertFalse(matches(ITEMS, "[\"quantity\", \">\", 1]", Map.of("quantity", 2.5)));
    assertFalse(matches(ITEMS, "[\"created_at\", \">\", \"2024-01-01\"]", Map.of("created_at", "soon")));
    assertFalse(matches(ITEMS, "[\"active\", \"=\", true]", Map.of("active", List.of(true))));
  }

  @Test
  void errorsAreRaisedBeforeAnyRecordIsSeen() {
    FilterException e = assertThrows(FilterException.class,
        () -> InMemoryEvaluator.compile(TRANSACTIONS, JsonSupport.parse("[\"nope\", \"=\", 1]")));
    assertEquals(Kind.UNKNOWN_FIELD, e.getKind());
    assertEquals(Kind.MALFORMED_GROUP, assertThrows(FilterException.class,
        () -> InMemoryEvaluator.filter(TRANSACTIONS, JsonSupport.parse("[[\"amount\", \"=\", 100], \"and\"]"),
            List.<Map<String, Object>>of())).getKind());
  }

  @Test
  void negatedEmptyFilterMatchesNothing() throws Exception {
    assertFalse(matches(TRANSACTIONS, "[\"!\", []]", Map.of("amount", 1.0)));
    assertTrue(matches(TRANSACTIONS, "[[\"amount\", \"=\", 2], \"or\", []]", Map.of("amount", 1.0)));
    assertFalse(matches(TRANSACTIONS, "[[\"amount\", \"=\", 2], \"and\", []]", Map.of("amount", 1.0)));
  }

  @Test
  void filtersTransactionsEndToEnd() throws Exception {
    List<Map<String, Object>> records = JsonSupport.readRecords(new ByteArrayInputStream(
        "[{\"amount\": 100, \"name\": \"Trans 1\"}, {\"amount\": 200, \"name\": \"Trans 0\"}]".getBytes(
            StandardCharsets.UTF_8)));
    Object expression = JsonSupport.parse("[[[\"name\", \"contains\", \"Trans 0\"], \"or\", "
        + "[\"name\", \"contains\", \"Trans 1\"]], \"and\", [\"amount\", \"=\", 100]]");

    List<Map<String, Object>> result = InMemoryEvaluator.filter(TRANSACTIONS, expression, records);
    assertEquals(1, result.size());
    assertEquals("Trans 1", result.get(0).get("name"));
    assertEquals(100, ((Number) result.get(0).get("amount")).intValue());
  }

  @Test
  void filtersReaderPreservingOrder() throws IOException, FilterException {
    List<Map<String, Object>> records = List.of(Map.of("amount", 3.0), Map.of("amount", 1.0), Map.of("amount", 2.0));
    RecordMatcher matcher = InMemoryEvaluator.compile(TRANSACTIONS, List.of("amount", ">=", 2));
    try (RecordReader reader = new InMemoryRecordReader(records)) {
      assertEquals(List.of(Map.of("amount", 3.0), Map.of("amount", 2.0)), InMemoryEvaluator.filter(matcher, reader));
    }
  }
}
