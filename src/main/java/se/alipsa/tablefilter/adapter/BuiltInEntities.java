package se.alipsa.tablefilter.adapter;

import java.util.List;
import net.sf.jsqlparser.expression.Expression;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import se.alipsa.tablefilter.schema.FieldType;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * Schema snapshots of the entities that ship with the application, and the
 * fixed Parquet adapters built from them.
 */
public final class BuiltInEntities {

  /** Bank transactions. */
  public static final TableSchema TRANSACTION = TableSchema.builder("transaction")
      .field("date", FieldType.TIMESTAMP)
      .field("amount", FieldType.FLOAT)
      .field("name", FieldType.STRING)
      .field("location", FieldType.STRING)
      .field("category", FieldType.STRING)
      .field("type", FieldType.STRING)
      .build();

  /** One field of each type. */
  public static final TableSchema TEST1 = TableSchema.builder("test1schema")
      .field("field_string", FieldType.STRING)
      .field("field_int", FieldType.INT)
      .field("field_float", FieldType.FLOAT)
      .field("field_bool", FieldType.BOOL)
      .field("field_time", FieldType.TIMESTAMP)
      .field("field_text", FieldType.TEXT)
      .build();

  public static final TableSchema TEST2 = TableSchema.builder("test2schema")
      .field("name", FieldType.STRING)
      .field("description", FieldType.TEXT)
      .field("quantity", FieldType.INT)
      .field("price", FieldType.FLOAT)
      .field("active", FieldType.BOOL)
      .field("created_at", FieldType.TIMESTAMP)
      .field("updated_at", FieldType.TIMESTAMP)
      .field("item_type", FieldType.STRING)
      .build();

  public static final TableSchema TEST3 = TableSchema.builder("test3schema")
      .field("sku", FieldType.STRING)
      .field("product_name", FieldType.STRING)
      .field("short_description", FieldType.STRING)
      .field("full_description", FieldType.TEXT)
      .field("cost_price", FieldType.FLOAT)
      .field("retail_price", FieldType.FLOAT)
      .field("stock_count", FieldType.INT)
      .field("is_active", FieldType.BOOL)
      .field("published_at", FieldType.TIMESTAMP)
      .field("last_ordered_at", FieldType.TIMESTAMP)
      .field("tags", FieldType.STRING)
      .build();

  private BuiltInEntities() {
  }

  /**
   * All built-in schemas.
   *
   * @return the schemas
   */
  public static List<TableSchema> schemas() {
    return List.of(TRANSACTION, TEST1, TEST2, TEST3);
  }

  /**
   * A registry holding a Parquet adapter for every built-in entity.
   *
   * @return a new registry
   */
  public static AdapterRegistry<FilterPredicate> parquetAdapters() {
    AdapterRegistry<FilterPredicate> registry = new AdapterRegistry<>();
    for (TableSchema schema : schemas()) {
      registry.register(ParquetEntityAdapter.forSchema(schema));
    }
    return registry;
  }

  /**
   * A registry holding a SQL adapter for every built-in entity.
   *
   * @return a new registry
   */
  public static AdapterRegistry<Expression> sqlAdapters() {
    AdapterRegistry<Expression> registry = new AdapterRegistry<>();
    for (TableSchema schema : schemas()) {
      registry.register(new SqlEntityAdapter(schema));
    }
    return registry;
  }
}
