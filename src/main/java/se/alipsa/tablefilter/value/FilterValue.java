package se.alipsa.tablefilter.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * The loosely typed values found in filter expressions and records, as a
 * closed set of variants. Numbers keep their exact decimal value regardless
 * of whether JSON delivered them as integers or floating point.
 */
public sealed interface FilterValue
    permits FilterValue.Number, FilterValue.Text, FilterValue.Bool, FilterValue.Time, FilterValue.Sequence,
    FilterValue.Null {

  /** The singleton null value. */
  Null NULL = new Null();

  /**
   * Convert a deserialized value into its variant.
   *
   * @param raw
   *          a value produced by a JSON parser, an Avro reader or application
   *          code (may be {@code null})
   * @return the corresponding variant, never {@code null}
   * @throws IllegalArgumentException
   *           if the value has a shape that cannot appear in a filter or record
   *           (e.g. a nested object)
   */
  static FilterValue of(Object raw) {
    if (raw == null) {
      return NULL;
    }
    if (raw instanceof FilterValue fv) {
      return fv;
    }
    if (raw instanceof CharSequence cs) {
      return new Text(cs.toString());
    }
    if (raw instanceof Boolean b) {
      return new Bool(b);
    }
    if (raw instanceof java.lang.Number n) {
      return Number.of(n);
    }
    if (raw instanceof Instant i) {
      return new Time(i);
    }
    if (raw instanceof java.sql.Timestamp ts) {
      return new Time(ts.toInstant());
    }
    if (raw instanceof java.sql.Date d) {
      return new Time(d.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    if (raw instanceof java.util.Date d) {
      return new Time(d.toInstant());
    }
    if (raw instanceof OffsetDateTime odt) {
      return new Time(odt.toInstant());
    }
    if (raw instanceof ZonedDateTime zdt) {
      return new Time(zdt.toInstant());
    }
    if (raw instanceof LocalDateTime ldt) {
      return new Time(ldt.toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof LocalDate ld) {
      return new Time(ld.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
    if (raw instanceof ByteBuffer bb) {
      ByteBuffer duplicate = bb.duplicate();
      byte[] bytes = new byte[duplicate.remaining()];
      duplicate.get(bytes);
      return new Text(new String(bytes, StandardCharsets.UTF_8));
    }
    if (raw instanceof Collection<?> c) {
      List<FilterValue> elements = new ArrayList<>(c.size());
      for (Object element : c) {
        elements.add(of(element));
      }
      return new Sequence(elements);
    }
    if (raw instanceof Object[] array) {
      return of(Arrays.asList(array));
    }
    throw new IllegalArgumentException("Unsupported value type " + raw.getClass().getName() + ": " + raw);
  }

  /**
   * A short description of the variant, used in error messages.
   *
   * @return the variant name
   */
  String kind();

  /**
   * A numeric value.
   *
   * @param value
   *          the exact decimal value
   */
  record Number(BigDecimal value) implements FilterValue {

    public Number {
      Objects.requireNonNull(value, "value");
    }

    static Number of(java.lang.Number n) {
      if (n instanceof BigDecimal bd) {
        return new Number(bd);
      }
      if (n instanceof BigInteger bi) {
        return new Number(new BigDecimal(bi));
      }
      if (n instanceof Double || n instanceof Float) {
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          throw new IllegalArgumentException("Non-finite number " + d);
        }
        return new Number(BigDecimal.valueOf(d));
      }
      return new Number(BigDecimal.valueOf(n.longValue()));
    }

    @Override
    public String kind() {
      return "number";
    }
  }

  /**
   * A string value.
   *
   * @param value
   *          the text
   */
  record Text(String value) implements FilterValue {

    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String kind() {
      return "string";
    }
  }

  /**
   * A boolean value.
   *
   * @param value
   *          the truth value
   */
  record Bool(boolean value) implements FilterValue {

    @Override
    public String kind() {
      return "boolean";
    }
  }

  /**
   * A point in time, as delivered by storage engines that keep typed
   * timestamps.
   *
   * @param value
   *          the instant
   */
  record Time(Instant value) implements FilterValue {

    public Time {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String kind() {
      return "timestamp";
    }
  }

  /**
   * An ordered sequence of values.
   *
   * @param elements
   *          the elements
   */
  record Sequence(List<FilterValue> elements) implements FilterValue {

    public Sequence {
      elements = List.copyOf(elements);
    }

    @Override
    public String kind() {
      return "array";
    }
  }

  /** The absence of a value. */
  final class Null implements FilterValue {

    private Null() {
    }

    @Override
    public String kind() {
      return "null";
    }

    @Override
    public String toString() {
      return "null";
    }
  }
}
