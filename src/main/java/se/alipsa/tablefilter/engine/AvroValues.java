package se.alipsa.tablefilter.engine;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.tablefilter.schema.AvroSchemas;

/**
 * Turns Avro values read from Parquet into the plain Java values records carry
 * in memory.
 */
public final class AvroValues {

  private AvroValues() {
  }

  /**
   * Copy a record into a field name to value map, in schema field order.
   *
   * @param record
   *          the Avro record
   * @return a mutable map; null field values are kept as {@code null} entries
   */
  public static Map<String, Object> toMap(GenericRecord record) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Schema.Field field : record.getSchema().getFields()) {
      values.put(field.name(), unwrap(record.get(field.pos()), field.schema()));
    }
    return values;
  }

  /**
   * Unwraps an Avro value to a corresponding Java type: strings for
   * string/enum, {@link Long} for int/long, {@link Double} for float/double,
   * {@link Instant} for timestamp-millis/micros.
   *
   * @param v
   *          the Avro value
   * @param s
   *          the Avro schema for the value
   * @return the unwrapped Java object
   */
  public static Object unwrap(Object v, Schema s) {
    if (v == null) {
      return null;
    }
    Schema effective = AvroSchemas.effectiveSchema(s);
    switch (effective.getType()) {
      case STRING, ENUM:
        if (v instanceof ByteBuffer byteBuffer) {
          ByteBuffer duplicate = byteBuffer.duplicate();
          byte[] bytes = new byte[duplicate.remaining()];
          duplicate.get(bytes);
          return new String(bytes, StandardCharsets.UTF_8);
        }
        if (v instanceof byte[] byteArray) {
          return new String(byteArray, StandardCharsets.UTF_8);
        }
        return v.toString();
      case INT:
        return ((Number) v).longValue();
      case LONG: {
        LogicalType lt = effective.getLogicalType();
        if (v instanceof Instant instant) {
          return instant;
        }
        long epoch = ((Number) v).longValue();
        if (lt instanceof LogicalTypes.TimestampMicros) {
          return Instant.EPOCH.plus(epoch, ChronoUnit.MICROS);
        }
        if (lt instanceof LogicalTypes.TimestampMillis) {
          return Instant.ofEpochMilli(epoch);
        }
        return epoch;
      }
      case FLOAT:
        return widen(((Number) v).floatValue());
      case DOUBLE:
        return ((Number) v).doubleValue();
      default:
        return v;
    }
  }

  /**
   * Widen a float through its decimal rendering so that {@code 0.1f} reads
   * back as {@code 0.1}. Order preserving.
   *
   * @param f
   *          the stored float
   * @return the double the float compares as
   */
  public static double widen(float f) {
    return Double.parseDouble(Float.toString(f));
  }

  /**
   * The epoch value an {@link Instant} is stored as in a timestamp column,
   * rounded down to the precision of the column.
   *
   * @param instant
   *          the instant
   * @param s
   *          the column schema, timestamp-millis or timestamp-micros
   * @return epoch millis or micros, the largest not after {@code instant}
   * @throws ArithmeticException
   *           if the instant is outside the range of the column
   */
  public static long toEpoch(Instant instant, Schema s) {
    if (AvroSchemas.effectiveSchema(s).getLogicalType() instanceof LogicalTypes.TimestampMillis) {
      return instant.toEpochMilli();
    }
    return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
  }
}
