package se.alipsa.tablefilter.value;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import se.alipsa.tablefilter.schema.FieldType;

/** Unit tests for {@link Coercions}. */
class CoercionsTest {

  @Test
  void coercesIntegers() throws CoercionException {
    assertEquals(10L, Coercions.coerce(FilterValue.of(10.0), FieldType.INT));
    assertEquals(10L, Coercions.coerce(FilterValue.of("10"), FieldType.INT));
    assertEquals(-3L, Coercions.coerce(FilterValue.of(" -3.00 "), FieldType.INT));
  }

  @Test
  void rejectsFractionalAndOutOfRangeIntegers() {
    CoercionException e = assertThrows(CoercionException.class,
        () -> Coercions.coerce(FilterValue.of(10.5), FieldType.INT));
    assertTrue(e.getMessage().contains("fractional part"), e.getMessage());
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of("1e30"), FieldType.INT));
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of("ten"), FieldType.INT));
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of(true), FieldType.INT));
  }

  @Test
  void extremeExponentsFailWithoutExpansion() {
    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
      CoercionException tiny = assertThrows(CoercionException.class,
          () -> Coercions.coerce(FilterValue.of("1e-999999999"), FieldType.INT));
      assertTrue(tiny.getMessage().contains("1E-999999999"), tiny.getMessage());
      CoercionException huge = assertThrows(CoercionException.class,
          () -> Coercions.coerce(FilterValue.of("1e999999999"), FieldType.INT));
      assertTrue(huge.getMessage().contains("out of range"), huge.getMessage());
      assertThrows(CoercionException.class,
          () -> Coercions.coerce(FilterValue.of("-1e999999999"), FieldType.INT));
      assertEquals("1E+999999999",
          Coercions.coerce(FilterValue.of(new BigDecimal("1e999999999")), FieldType.STRING));
    });
  }

  @Test
  void rejectsFloatsBeyondDoubleRange() throws CoercionException {
    CoercionException e = assertThrows(CoercionException.class,
        () -> Coercions.coerce(FilterValue.of("1e400"), FieldType.FLOAT));
    assertTrue(e.getMessage().contains("out of range"), e.getMessage());
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of("-1e400"), FieldType.FLOAT));
    assertEquals(0.0, Coercions.coerce(FilterValue.of("1e-999999999"), FieldType.FLOAT));
  }

  @Test
  void coercesFloats() throws CoercionException {
    assertEquals(0.1, Coercions.coerce(FilterValue.of("0.1"), FieldType.FLOAT));
    assertEquals(100.0, Coercions.coerce(FilterValue.of(100), FieldType.FLOAT));
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.NULL, FieldType.FLOAT));
  }

  @Test
  void coercesBooleans() throws CoercionException {
    assertEquals(Boolean.TRUE, Coercions.coerce(FilterValue.of("TRUE"), FieldType.BOOL));
    assertEquals(Boolean.FALSE, Coercions.coerce(FilterValue.of(false), FieldType.BOOL));
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of("yes"), FieldType.BOOL));
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of(1), FieldType.BOOL));
  }

  @Test
  void coercesText() throws CoercionException {
    assertEquals("100", Coercions.coerce(FilterValue.of(100.0), FieldType.STRING));
    assertEquals("0.5", Coercions.coerce(FilterValue.of(0.5), FieldType.TEXT));
    assertEquals("true", Coercions.coerce(FilterValue.of(true), FieldType.STRING));
    assertThrows(CoercionException.class,
        () -> Coercions.coerce(FilterValue.of(java.util.List.of("a")), FieldType.STRING));
  }

  @Test
  void parsesTimestampLayoutsInOrder() throws CoercionException {
    assertEquals(Instant.parse("2024-01-15T10:30:00.250Z"), Coercions.parseTimestamp("2024-01-15T10:30:00.25Z"));
    assertEquals(Instant.parse("2024-01-15T08:30:00Z"), Coercions.parseTimestamp("2024-01-15T10:30:00+02:00"));
    assertEquals(Instant.parse("2024-01-15T10:30:00Z"), Coercions.parseTimestamp("2024-01-15T10:30:00"));
    assertEquals(Instant.parse("2024-01-15T00:00:00Z"), Coercions.parseTimestamp("2024-01-15"));
  }

  @Test
  void rejectsMalformedTimestamps() {
    assertThrows(CoercionException.class, () -> Coercions.parseTimestamp("15/01/2024"));
    assertThrows(CoercionException.class, () -> Coercions.parseTimestamp("2024-02-30"));
    assertThrows(CoercionException.class, () -> Coercions.coerce(FilterValue.of(5), FieldType.TIMESTAMP));
  }
}
