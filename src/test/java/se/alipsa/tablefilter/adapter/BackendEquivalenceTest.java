package se.alipsa.tablefilter.adapter;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.ParquetTestFiles;
import se.alipsa.tablefilter.TableFilter;
import se.alipsa.tablefilter.engine.InMemoryEvaluator;
import se.alipsa.tablefilter.engine.ParquetTableReader;
import se.alipsa.tablefilter.schema.AvroSchemas;
import se.alipsa.tablefilter.schema.FieldType;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * Filters the same Parquet data with a pushed down predicate and with the
 * in-memory evaluator and expects the same records, nulls and missing values
 * included.
 */
class BackendEquivalenceTest {

  private static final TableSchema ITEMS = TableSchema.builder("items")
      .field("id", FieldType.INT)
      .field("name", FieldType.STRING)
      .field("note", FieldType.TEXT)
      .field("qty", FieldType.INT)
      .field("price", FieldType.FLOAT)
      .field("active", FieldType.BOOL)
      .field("seen", FieldType.TIMESTAMP)
      .build();

  @TempDir
  static Path dir;

  private static Path itemsFile;
  private static Path narrowFile;

  @BeforeAll
  static void writeFiles() throws IOException {
    List<Map<String, Object>> items = new ArrayList<>();
    items.add(item(1, "Transaction A", "first 100% sale", 5, 9.5, true, "2024-01-01T00:00:00Z"));
    items.add(item(2, "transaction b", "Second_item", 10, 100.0, false, "2024-06-01T12:30:00Z"));
    items.add(item(3, "Other", null, null, 150.25, null, null));
    items.add(item(4, null, "TRANS notes", 0, null, true, "2023-12-31T23:59:59Z"));
    items.add(item(5, "Zed", "", -3, 0.0, false, "2024-01-01T00:00:00.000001Z"));
    Map<String, Object> sparse = new HashMap<>();
    sparse.put("id", 6L);
    items.add(sparse);
    itemsFile = ParquetTestFiles.write(dir.resolve("items.parquet"), AvroSchemas.toAvro(ITEMS), items);

    Schema narrow = SchemaBuilder.record("Narrow").fields()
        .requiredInt("id").optionalInt("count").optionalFloat("weight").endRecord();
    List<Map<String, Object>> rows = new ArrayList<>();
    rows.add(Map.of("id", 1, "count", 3, "weight", 0.1f));
    rows.add(Map.of("id", 2, "count", -7, "weight", 2.25f));
    rows.add(Map.of("id", 3, "weight", 1.5f));
    rows.add(Map.of("id", 4, "count", 12));
    narrowFile = ParquetTestFiles.write(dir.resolve("narrow.parquet"), narrow, rows);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "[]",
      "[\"name\", \"=\", \"TRANSACTION A\"]",
      "[\"name\", \"<>\", \"Other\"]",
      "[\"name\", \"contains\", \"trans\"]",
      "[\"name\", \"notcontains\", \"trans\"]",
      "[\"name\", \"startswith\", \"tr\"]",
      "[\"name\", \"endswith\", \"B\"]",
      "[\"note\", \"contains\", \"%\"]",
      "[\"note\", \"contains\", \"_\"]",
      "[\"note\", \"=\", \"\"]",
      "[\"qty\", \">\", 0]",
      "[\"qty\", \"<=\", 5]",
      "[\"qty\", \"<>\", 5]",
      "[\"qty\", \"between\", [0, 10]]",
      "[\"qty\", \"between\", [10, 0]]",
      "[\"price\", \">=\", \"100\"]",
      "[\"price\", \"<\", 100]",
      "[\"price\", \"=\", 0]",
      "[\"active\", \"=\", true]",
      "[\"active\", \"<>\", \"true\"]",
      "[\"seen\", \">\", \"2024-01-01T00:00:00Z\"]",
      "[\"seen\", \"=\", \"2024-01-01T00:00:00Z\"]",
      "[\"seen\", \"between\", [\"2023-01-01T00:00:00Z\", \"2024-01-01T00:00:00Z\"]]",
      "[\"seen\", \"=\", \"2024-01-01T00:00:00.0000005Z\"]",
      "[\"seen\", \"<>\", \"2024-01-01T00:00:00.0000005Z\"]",
      "[\"seen\", \">\", \"2024-01-01T00:00:00.0000005Z\"]",
      "[\"seen\", \">=\", \"2024-01-01T00:00:00.0000005Z\"]",
      "[\"seen\", \"<\", \"2024-01-01T00:00:00.0000005Z\"]",
      "[\"seen\", \"<=\", \"2024-01-01T00:00:00.0000005Z\"]",
      "[\"seen\", \"between\", [\"2024-01-01T00:00:00.0000001Z\", \"2024-01-01T00:00:00.0000019Z\"]]",
      "[\"!\", [\"seen\", \"=\", \"2024-01-01T00:00:00.0000005Z\"]]",
      "[\"!\", [\"seen\", \">=\", \"2024-01-01T00:00:00.0000005Z\"]]",
      "[\"!\", [\"qty\", \">\", 0]]",
      "[\"!\", [\"price\", \"between\", [1, 100]]]",
      "[\"!\", [\"name\", \"contains\", \"trans\"]]",
      "[\"!\", [\"active\", \"=\", true]]",
      "[\"!\", [\"seen\", \"<\", \"2024-01-01T00:00:00Z\"]]",
      "[\"!\", [\"!\", [\"qty\", \">=\", 5]]]",
      "[\"!\", []]",
      "[[\"name\", \"contains\", \"trans\"], \"and\", [\"price\", \">\", 50]]",
      "[[\"qty\", \">\", 5], \"or\", [\"active\", \"=\", false]]",
      "[[\"qty\", \">\", 5], \"or\", [\"!\", [\"price\", \">\", 1]], \"and\", [\"id\", \"<\", 6]]",
      "[\"!\", [[\"qty\", \">\", 5], \"or\", [\"note\", \"startswith\", \"first\"]]]",
      "[[], \"and\", [\"qty\", \"<\", 100]]",
      "[[], \"or\", [\"qty\", \"<\", 100]]",
      "[[\"!\", []], \"or\", [\"id\", \"=\", 6]]"
  })
  void pushedDownFilterMatchesInMemoryFilter(String json) throws IOException, FilterException {
    assertSameRecords(ITEMS, ParquetEntityAdapter.forSchema(ITEMS), itemsFile, json);
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "[\"count\", \">\", 0]",
      "[\"count\", \"<>\", 3]",
      "[\"!\", [\"count\", \"<\", 5]]",
      "[\"weight\", \"=\", 0.1]",
      "[\"weight\", \"between\", [0.1, 1.5]]",
      "[\"!\", [\"weight\", \">\", 0.1]]",
      "[[\"count\", \">=\", -7], \"and\", [\"weight\", \"<\", 2]]",
      "[\"weight\", \"=\", 0.1000000001]",
      "[\"weight\", \"<>\", 0.1000000001]",
      "[\"weight\", \">\", 0.1000000001]",
      "[\"weight\", \">=\", 0.1000000001]",
      "[\"weight\", \"<\", 0.1000000001]",
      "[\"weight\", \"<=\", 0.1000000001]",
      "[\"weight\", \"<=\", 1e300]",
      "[\"!\", [\"weight\", \"=\", 0.1000000001]]",
      "[\"!\", [\"weight\", \"<\", 0.1000000001]]",
      "[\"count\", \"<\", 5000000000]",
      "[\"count\", \"<=\", 5000000000]",
      "[\"count\", \">\", 5000000000]",
      "[\"count\", \"=\", 5000000000]",
      "[\"count\", \"<>\", 5000000000]",
      "[\"count\", \">\", -5000000000]",
      "[\"count\", \"<=\", -5000000000]",
      "[\"count\", \"between\", [-5000000000, 5000000000]]",
      "[\"!\", [\"count\", \"<\", 5000000000]]",
      "[\"!\", [\"count\", \"=\", 5000000000]]"
  })
  void narrowColumnsMatchInMemoryFilter(String json) throws IOException, FilterException {
    Schema avro = ParquetTableReader.readAvroSchema(narrowFile);
    ParquetEntityAdapter adapter = ParquetEntityAdapter.forAvroSchema("narrow", avro);
    assertSameRecords(adapter.schema(), adapter, narrowFile, json);
  }

  private static void assertSameRecords(TableSchema schema, ParquetEntityAdapter adapter, Path file, String json)
      throws IOException, FilterException {
    Object expression = TableFilter.parseExpression(json);
    List<Map<String, Object>> all = ParquetTableReader.read(file, Optional.empty());
    List<Object> expected = ids(InMemoryEvaluator.filter(schema, expression, all));

    Optional<FilterPredicate> predicate = PredicateTreeBuilder.build(adapter, expression);
    List<Object> actual = ids(ParquetTableReader.read(file, predicate));
    assertEquals(expected, actual, json + " -> " + predicate);
  }

  private static List<Object> ids(List<Map<String, Object>> records) {
    List<Object> ids = new ArrayList<>();
    for (Map<String, Object> record : records) {
      ids.add(record.get("id"));
    }
    return ids;
  }

  private static Map<String, Object> item(long id, String name, String note, Integer qty, Double price,
      Boolean active, String seen) {
    Map<String, Object> item = new HashMap<>();
    item.put("id", id);
    item.put("name", name);
    item.put("note", note);
    item.put("qty", qty);
    item.put("price", price);
    item.put("active", active);
    item.put("seen", seen == null ? null : Instant.parse(seen));
    return item;
  }
}
