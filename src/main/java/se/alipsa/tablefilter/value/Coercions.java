package se.alipsa.tablefilter.value;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import se.alipsa.tablefilter.schema.FieldType;

/**
 * Converts {@link FilterValue}s into the comparison domain of a
 * {@link FieldType}:
 *
 * <ul>
 * <li>{@code string}/{@code text} &rarr; {@link String}</li>
 * <li>{@code int} &rarr; {@link Long}</li>
 * <li>{@code float} &rarr; {@link Double}</li>
 * <li>{@code bool} &rarr; {@link Boolean}</li>
 * <li>{@code timestamp} &rarr; {@link Instant}</li>
 * </ul>
 */
public final class Coercions {

  /** RFC3339 with fractional seconds. */
  private static final DateTimeFormatter RFC3339_FRACTION = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd'T'HH:mm:ss").appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .appendOffset("+HH:MM", "Z").toFormatter(Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd'T'HH:mm:ss").appendOffset("+HH:MM", "Z").toFormatter(Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss",
      Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT)
      .withResolverStyle(ResolverStyle.STRICT);

  /** Beyond this many zeros a number is rendered in scientific notation. */
  private static final int PLAIN_SCALE_LIMIT = 1_000;

  private Coercions() {
  }

  /**
   * Coerce a value into the comparison domain of a field type.
   *
   * @param value
   *          the value
   * @param type
   *          the declared field type
   * @return a {@link String}, {@link Long}, {@link Double}, {@link Boolean} or
   *         {@link Instant} depending on {@code type}
   * @throws CoercionException
   *           if the value cannot be converted
   */
  public static Comparable<?> coerce(FilterValue value, FieldType type) throws CoercionException {
    return switch (type) {
      case STRING, TEXT -> toText(value);
      case INT -> toLong(value);
      case FLOAT -> toDouble(value);
      case BOOL -> toBoolean(value);
      case TIMESTAMP -> toInstant(value);
    };
  }

  /**
   * Convert a value to text. Numbers are rendered in plain decimal notation
   * without trailing zeros, or in scientific notation when the exponent is
   * extreme, booleans as {@code true}/{@code false}.
   *
   * @param value
   *          the value
   * @return the text
   * @throws CoercionException
   *           for sequences and null
   */
  public static String toText(FilterValue value) throws CoercionException {
    if (value instanceof FilterValue.Text t) {
      return t.value();
    }
    if (value instanceof FilterValue.Number n) {
      BigDecimal stripped = n.value().stripTrailingZeros();
      return Math.abs((long) stripped.scale()) > PLAIN_SCALE_LIMIT ? stripped.toString() : stripped.toPlainString();
    }
    if (value instanceof FilterValue.Bool b) {
      return Boolean.toString(b.value());
    }
    if (value instanceof FilterValue.Time t) {
      return t.value().toString();
    }
    throw mismatch(value, FieldType.STRING);
  }

  /**
   * Convert a value to a whole number.
   *
   * @param value
   *          a number or a numeric string
   * @return the value as a long
   * @throws CoercionException
   *           if the value is not numeric, has a non-zero fractional part or
   *           is out of the 64 bit range
   */
  public static long toLong(FilterValue value) throws CoercionException {
    BigDecimal decimal = decimal(value, FieldType.INT);
    BigDecimal stripped = decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
    if (stripped.scale() > 0) {
      throw new CoercionException("cannot convert " + decimal + " to int as it has a fractional part");
    }
    // more than 19 integer digits never fits
    if ((long) stripped.precision() - stripped.scale() > 19) {
      throw new CoercionException("value " + decimal + " is out of range for int");
    }
    try {
      return stripped.longValueExact();
    } catch (ArithmeticException e) {
      throw new CoercionException("value " + decimal + " is out of range for int", e);
    }
  }

  /**
   * Convert a value to a floating point number.
   *
   * @param value
   *          a number or a numeric string
   * @return the value as a double
   * @throws CoercionException
   *           if the value is not numeric or beyond the range of a double
   */
  public static double toDouble(FilterValue value) throws CoercionException {
    BigDecimal decimal = decimal(value, FieldType.FLOAT);
    double d = decimal.doubleValue();
    if (Double.isInfinite(d)) {
      throw new CoercionException("value " + decimal + " is out of range for float");
    }
    return d;
  }

  /**
   * Convert a value to a boolean.
   *
   * @param value
   *          a boolean or the case-insensitive strings {@code "true"} and
   *          {@code "false"}
   * @return the truth value
   * @throws CoercionException
   *           for any other value
   */
  public static boolean toBoolean(FilterValue value) throws CoercionException {
    if (value instanceof FilterValue.Bool b) {
      return b.value();
    }
    if (value instanceof FilterValue.Text t) {
      String s = t.value().trim().toLowerCase(Locale.ROOT);
      if ("true".equals(s)) {
        return true;
      }
      if ("false".equals(s)) {
        return false;
      }
      throw new CoercionException("expected 'true' or 'false', got '" + t.value() + "'");
    }
    throw mismatch(value, FieldType.BOOL);
  }

  /**
   * Convert a value to an instant.
   *
   * @param value
   *          a timestamp or a string accepted by {@link #parseTimestamp(String)}
   * @return the instant
   * @throws CoercionException
   *           if the value is not a timestamp or cannot be parsed
   */
  public static Instant toInstant(FilterValue value) throws CoercionException {
    if (value instanceof FilterValue.Time t) {
      return t.value();
    }
    if (value instanceof FilterValue.Text t) {
      return parseTimestamp(t.value());
    }
    throw mismatch(value, FieldType.TIMESTAMP);
  }

  /**
   * Parse a timestamp by trying, in order, RFC3339 with fractional seconds,
   * RFC3339, date and time without zone (taken as UTC) and date only (UTC
   * midnight). The first format that parses wins.
   *
   * @param text
   *          the text to parse
   * @return the instant
   * @throws CoercionException
   *           if no format matches
   */
  public static Instant parseTimestamp(String text) throws CoercionException {
    String s = text.trim();
    DateTimeException failure = null;
    for (DateTimeFormatter zoned : List.of(RFC3339_FRACTION, RFC3339)) {
      try {
        return OffsetDateTime.parse(s, zoned).toInstant();
      } catch (DateTimeException e) {
        failure = e;
      }
    }
    try {
      return LocalDateTime.parse(s, LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
    } catch (DateTimeException e) {
      failure = e;
    }
    try {
      return LocalDate.parse(s, LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeException e) {
      if (failure != null) {
        e.addSuppressed(failure);
      }
      throw new CoercionException("unable to parse date string '" + text + "' with known layouts", e);
    }
  }

  private static BigDecimal decimal(FilterValue value, FieldType target) throws CoercionException {
    if (value instanceof FilterValue.Number n) {
      return n.value();
    }
    if (value instanceof FilterValue.Text t) {
      try {
        return new BigDecimal(t.value().trim());
      } catch (NumberFormatException e) {
        throw new CoercionException("cannot convert string '" + t.value() + "' to " + target);
      }
    }
    throw mismatch(value, target);
  }

  private static CoercionException mismatch(FilterValue value, FieldType target) {
    return new CoercionException("cannot convert " + value.kind() + " " + value + " to " + target);
  }
}
