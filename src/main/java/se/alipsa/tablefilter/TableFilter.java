package se.alipsa.tablefilter;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import net.sf.jsqlparser.expression.Expression;
import se.alipsa.tablefilter.FilterException.Kind;
import se.alipsa.tablefilter.adapter.PredicateTreeBuilder;
import se.alipsa.tablefilter.adapter.SqlEntityAdapter;
import se.alipsa.tablefilter.helper.JsonSupport;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * Entry point for filtering the tables of a directory. Example usage:
 *
 * <pre>
 * <code>
 *   TableFilter tableFilter = TableFilter.fromLocation("/data/tables?maxDepth=32");
 *   List&lt;Map&lt;String, Object&gt;&gt; rows = tableFilter.filterJson("transaction",
 *       "[[\"name\", \"contains\", \"trans\"], \"and\", [\"amount\", \"&gt;\", 100]]");
 * </code>
 * </pre>
 */
public class TableFilter {

  private final FilterSettings settings;
  private final TableDirectory directory;

  /**
   * Create a table filter.
   *
   * @param settings
   *          where the tables are and how expressions are parsed
   */
  public TableFilter(FilterSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.directory = new TableDirectory(settings.tablesPath(), settings.parser());
  }

  /**
   * Create a table filter from a location string.
   *
   * @param location
   *          the tables path, optionally followed by a query string, e.g.
   *          {@code /data/tables?maxDepth=32}
   * @return the table filter
   */
  public static TableFilter fromLocation(String location) {
    return new TableFilter(FilterSettings.fromLocation(location, null));
  }

  /**
   * The settings in use.
   *
   * @return the settings
   */
  public FilterSettings settings() {
    return settings;
  }

  /**
   * The tables available.
   *
   * @return the sorted table names
   * @throws IOException
   *           if the tables directory cannot be listed
   */
  public List<String> listTables() throws IOException {
    return directory.listTables();
  }

  /**
   * The schema of a table.
   *
   * @param table
   *          the table name
   * @return the schema
   * @throws IOException
   *           if the schema cannot be loaded
   */
  public TableSchema schema(String table) throws IOException {
    return directory.loadSchema(table);
  }

  /**
   * Filter a table.
   *
   * @param table
   *          the table name
   * @param expression
   *          the deserialized filter expression, {@code null} for none
   * @return the matching records in stored order
   * @throws IOException
   *           if the table cannot be read
   * @throws FilterException
   *           if the expression is invalid
   */
  public List<Map<String, Object>> filter(String table, Object expression) throws IOException, FilterException {
    return directory.filter(table, expression);
  }

  /**
   * Filter a table with an expression given as JSON text.
   *
   * @param table
   *          the table name
   * @param expressionJson
   *          the filter expression as JSON, blank for none
   * @return the matching records in stored order
   * @throws IOException
   *           if the table cannot be read
   * @throws FilterException
   *           if the expression is not valid JSON or is invalid
   */
  public List<Map<String, Object>> filterJson(String table, String expressionJson)
      throws IOException, FilterException {
    return filter(table, parseExpression(expressionJson));
  }

  /**
   * Lower a filter on a table into a SQL {@code WHERE} expression.
   *
   * @param table
   *          the table name
   * @param expression
   *          the deserialized filter expression, {@code null} for none
   * @return the where expression, empty when nothing is filtered
   * @throws IOException
   *           if the schema cannot be loaded
   * @throws FilterException
   *           if the expression is invalid
   */
  public Optional<Expression> sqlWhere(String table, Object expression) throws IOException, FilterException {
    return PredicateTreeBuilder.build(settings.parser(), new SqlEntityAdapter(schema(table)), expression);
  }

  /**
   * Parse a filter expression from JSON text.
   *
   * @param json
   *          the JSON text, blank for no filter
   * @return the deserialized expression, {@code null} for no filter
   * @throws FilterException
   *           if the text is not valid JSON
   */
  public static Object parseExpression(String json) throws FilterException {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return JsonSupport.parse(json);
    } catch (JsonProcessingException e) {
      throw new FilterException(Kind.INVALID_EXPRESSION_SHAPE,
          "filter expression is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }
}
