package se.alipsa.tablefilter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.avro.Schema;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.tablefilter.adapter.ParquetEntityAdapter;
import se.alipsa.tablefilter.adapter.PredicateTreeBuilder;
import se.alipsa.tablefilter.engine.FilterExpressionParser;
import se.alipsa.tablefilter.engine.InMemoryEvaluator;
import se.alipsa.tablefilter.engine.InMemoryRecordReader;
import se.alipsa.tablefilter.engine.ParquetTableReader;
import se.alipsa.tablefilter.engine.RecordMatcher;
import se.alipsa.tablefilter.engine.RecordReader;
import se.alipsa.tablefilter.helper.JsonSupport;
import se.alipsa.tablefilter.helper.TableFilterUtil;
import se.alipsa.tablefilter.schema.SchemaLoader;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * A directory of file-based tables. Each table is a sub directory holding a
 * {@value #SCHEMA_FILE} and its records, either as a JSON array of objects in
 * {@value #JSON_DATA} or as a Parquet file {@value #PARQUET_DATA}. Parquet
 * data takes precedence when both exist.
 */
public final class TableDirectory {

  private static final Logger log = LoggerFactory.getLogger(TableDirectory.class);

  /** Schema document of a table. */
  public static final String SCHEMA_FILE = "schema.json";
  /** JSON records of a table. */
  public static final String JSON_DATA = "data.json";
  /** Parquet records of a table. */
  public static final String PARQUET_DATA = "data.parquet";

  private final Path baseDir;
  private final FilterExpressionParser parser;

  /**
   * Create a table directory with the default parser.
   *
   * @param baseDir
   *          the base directory, it need not exist
   */
  public TableDirectory(Path baseDir) {
    this(baseDir, FilterExpressionParser.defaultParser());
  }

  /**
   * Create a table directory.
   *
   * @param baseDir
   *          the base directory, it need not exist
   * @param parser
   *          the parser used for filter expressions
   */
  public TableDirectory(Path baseDir, FilterExpressionParser parser) {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  /**
   * The base directory.
   *
   * @return the base directory
   */
  public Path baseDir() {
    return baseDir;
  }

  /**
   * The tables in this directory: sub directories that contain a
   * {@value #SCHEMA_FILE}, sorted by name. A missing base directory has no
   * tables.
   *
   * @return the table names
   * @throws IOException
   *           if the base directory cannot be listed
   */
  public List<String> listTables() throws IOException {
    if (!Files.isDirectory(baseDir)) {
      log.debug("Tables directory {} does not exist", baseDir);
      return List.of();
    }
    List<String> tables = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
      for (Path dir : entries) {
        if (Files.isRegularFile(dir.resolve(SCHEMA_FILE))) {
          tables.add(dir.getFileName().toString());
        } else {
          log.warn("Skipping {}: no {}", dir, SCHEMA_FILE);
        }
      }
    }
    Collections.sort(tables);
    return tables;
  }

  /**
   * Load the schema of a table. A schema document without an entity name
   * takes the table name.
   *
   * @param table
   *          the table name
   * @return the schema
   * @throws IOException
   *           if the schema file is missing, unreadable or invalid
   */
  public TableSchema loadSchema(String table) throws IOException {
    return SchemaLoader.load(tableDir(table).resolve(SCHEMA_FILE), table);
  }

  /**
   * Whether a table stores its records in Parquet.
   *
   * @param table
   *          the table name
   * @return true if {@value #PARQUET_DATA} exists
   */
  public boolean hasParquetData(String table) {
    return Files.isRegularFile(tableDir(table).resolve(PARQUET_DATA));
  }

  /**
   * Load every record of a table.
   *
   * @param table
   *          the table name
   * @return the records in stored order
   * @throws IOException
   *           if the data file is missing or unreadable
   */
  public List<Map<String, Object>> loadRecords(String table) throws IOException {
    try (RecordReader reader = open(table, Optional.empty())) {
      return InMemoryEvaluator.filter(RecordMatcher.ALL, reader);
    }
  }

  /**
   * Filter the records of a table. Parquet tables get the expression pushed
   * down to the reader as a predicate; JSON tables are filtered in memory.
   * Either way the matching records are returned in stored order.
   *
   * @param table
   *          the table name
   * @param expression
   *          the filter expression, {@code null} for none
   * @return the matching records
   * @throws IOException
   *           if the table cannot be read
   * @throws FilterException
   *           if the expression is invalid for the table schema
   */
  public List<Map<String, Object>> filter(String table, Object expression) throws IOException, FilterException {
    TableSchema schema = loadSchema(table);
    if (hasParquetData(table)) {
      Path file = tableDir(table).resolve(PARQUET_DATA);
      Schema avroSchema = ParquetTableReader.readAvroSchema(file);
      Optional<FilterPredicate> predicate = PredicateTreeBuilder.build(parser,
          new ParquetEntityAdapter(schema, avroSchema), expression);
      return ParquetTableReader.read(file, predicate);
    }
    RecordMatcher matcher = InMemoryEvaluator.compile(parser, schema, expression);
    List<Map<String, Object>> matches;
    try (RecordReader reader = open(table, Optional.empty())) {
      matches = InMemoryEvaluator.filter(matcher, reader);
    }
    log.debug("{} records of {} matched {}", matches.size(), table, expression);
    return matches;
  }

  private RecordReader open(String table, Optional<FilterPredicate> predicate) throws IOException {
    Path dir = tableDir(table);
    Path parquet = dir.resolve(PARQUET_DATA);
    if (Files.isRegularFile(parquet)) {
      return ParquetTableReader.open(parquet, predicate);
    }
    Path json = dir.resolve(JSON_DATA);
    if (!Files.isRegularFile(json)) {
      throw new IOException("No " + JSON_DATA + " or " + PARQUET_DATA + " for table " + table + " in " + dir);
    }
    try (InputStream in = Files.newInputStream(json)) {
      return new InMemoryRecordReader(JsonSupport.readRecords(in));
    }
  }

  private Path tableDir(String table) {
    if (!TableFilterUtil.isPlainName(table)) {
      throw new IllegalArgumentException("Invalid table name '" + table + "'");
    }
    return baseDir.resolve(table);
  }
}
