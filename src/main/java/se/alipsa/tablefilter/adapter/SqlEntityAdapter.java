package se.alipsa.tablefilter.adapter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.BooleanValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimestampValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.expression.operators.relational.NotEqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.schema.Column;
import se.alipsa.tablefilter.FilterException;
import se.alipsa.tablefilter.engine.Comparisons;
import se.alipsa.tablefilter.engine.Condition;
import se.alipsa.tablefilter.engine.Operator;
import se.alipsa.tablefilter.engine.OperatorTable;
import se.alipsa.tablefilter.schema.TableSchema;

/**
 * Lowers filter conditions into a SQL {@code WHERE} expression tree.
 *
 * <p>
 * Every leaf is guarded by {@code col IS NOT NULL} so that it is either TRUE
 * or FALSE, never UNKNOWN; a negated leaf therefore matches rows where the
 * column is null, just like the in-memory evaluator. Text operators compare
 * {@code LOWER(col)} with a lower-cased literal; {@code LIKE} patterns escape
 * their wildcards with {@code !}. Timestamps are rendered in UTC.
 * </p>
 */
public final class SqlEntityAdapter implements EntityAdapter<Expression> {

  private static final char LIKE_ESCAPE = '!';
  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
      .ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT);

  private final TableSchema schema;

  /**
   * Create an adapter for a table schema.
   *
   * @param schema
   *          the table schema
   */
  public SqlEntityAdapter(TableSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  public TableSchema schema() {
    return schema;
  }

  @Override
  public Expression predicateForField(String field, String operator, Object value) throws FilterException {
    Condition c = OperatorTable.resolve(schema, field, operator, value);
    Column column = new Column(c.column());
    IsNullExpression notNull = new IsNullExpression();
    notNull.setLeftExpression(column);
    notNull.setNot(true);
    return new AndExpression(notNull, comparison(c, column));
  }

  @Override
  public Expression and(Expression left, Expression right) {
    return new AndExpression(group(left), group(right));
  }

  @Override
  public Expression or(Expression left, Expression right) {
    return new OrExpression(left, right);
  }

  @Override
  public Expression not(Expression predicate) {
    return new NotExpression(predicate instanceof ParenthesedExpressionList ? predicate
        : new ParenthesedExpressionList<>(predicate));
  }

  @Override
  public Expression matchNone() {
    return new EqualsTo(new LongValue(1), new LongValue(0));
  }

  private static Expression comparison(Condition c, Column column) {
    Operator op = c.operator();
    if (c.value() instanceof String text) {
      Expression lowered = lower(column);
      String folded = Comparisons.fold(text);
      return switch (op) {
        case EQ -> binary(new EqualsTo(), lowered, string(folded));
        case NOT_EQ -> binary(new NotEqualsTo(), lowered, string(folded));
        case CONTAINS -> like(lowered, "%" + escapeLike(folded) + "%", false);
        case NOT_CONTAINS -> like(lowered, "%" + escapeLike(folded) + "%", true);
        case STARTS_WITH -> like(lowered, escapeLike(folded) + "%", false);
        case ENDS_WITH -> like(lowered, "%" + escapeLike(folded), false);
        default -> throw new IllegalArgumentException("Operator " + op + " is not defined for text");
      };
    }
    Expression value = literal(c.value());
    return switch (op) {
      case EQ -> binary(new EqualsTo(), column, value);
      case NOT_EQ -> binary(new NotEqualsTo(), column, value);
      case GT -> binary(new GreaterThan(), column, value);
      case GT_EQ -> binary(new GreaterThanEquals(), column, value);
      case LT -> binary(new MinorThan(), column, value);
      case LT_EQ -> binary(new MinorThanEquals(), column, value);
      case BETWEEN -> new AndExpression(binary(new GreaterThanEquals(), column, value),
          binary(new MinorThanEquals(), column, literal(c.upperBound())));
      default -> throw new IllegalArgumentException("Operator " + op + " is not a comparison");
    };
  }

  private static Expression binary(BinaryExpression expression, Expression left, Expression right) {
    expression.setLeftExpression(left);
    expression.setRightExpression(right);
    return expression;
  }

  private static Expression like(Expression left, String pattern, boolean not) {
    LikeExpression like = new LikeExpression();
    like.setLeftExpression(left);
    like.setRightExpression(string(pattern));
    like.setNot(not);
    like.setEscape(string(String.valueOf(LIKE_ESCAPE)));
    return like;
  }

  private static Expression lower(Column column) {
    Function lower = new Function();
    lower.setName("LOWER");
    lower.setParameters(new ExpressionList<>(column));
    return lower;
  }

  private static Expression literal(Comparable<?> value) {
    if (value instanceof Long l) {
      return new LongValue(l);
    }
    if (value instanceof Double d) {
      return new DoubleValue(Double.toString(d));
    }
    if (value instanceof Boolean b) {
      return new BooleanValue(b.toString());
    }
    if (value instanceof Instant i) {
      return new TimestampValue(LocalDateTime.ofInstant(i, ZoneOffset.UTC).format(TIMESTAMP_FORMAT));
    }
    if (value instanceof String s) {
      return string(s);
    }
    throw new IllegalArgumentException("No SQL literal for " + value.getClass().getName());
  }

  private static StringValue string(String value) {
    StringValue literal = new StringValue("");
    literal.setValue(value.replace("'", "''"));
    return literal;
  }

  static String escapeLike(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (ch == '%' || ch == '_' || ch == LIKE_ESCAPE) {
        sb.append(LIKE_ESCAPE);
      }
      sb.append(ch);
    }
    return sb.toString();
  }

  private static Expression group(Expression expression) {
    return expression instanceof OrExpression ? new ParenthesedExpressionList<>(expression) : expression;
  }
}
