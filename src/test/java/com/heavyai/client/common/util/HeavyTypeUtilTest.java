package com.heavyai.client.common.util;

import static org.junit.jupiter.api.Assertions.*;

import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for HeavyTypeUtil. */
public class HeavyTypeUtilTest {

  private static final LocalDateTime MOMENT = LocalDateTime.of(2024, 3, 1, 12, 30, 15, 123_456_789);

  @Test
  void testInferType() {
    assertEquals(ColumnType.BOOL, HeavyTypeUtil.inferType(true));
    assertEquals(ColumnType.TINYINT, HeavyTypeUtil.inferType((byte) 1));
    assertEquals(ColumnType.INT, HeavyTypeUtil.inferType(1));
    assertEquals(ColumnType.BIGINT, HeavyTypeUtil.inferType(BigInteger.TEN));
    assertEquals(ColumnType.DOUBLE, HeavyTypeUtil.inferType(1.0));
    assertEquals(ColumnType.DECIMAL, HeavyTypeUtil.inferType(BigDecimal.ONE));
    assertEquals(ColumnType.STR, HeavyTypeUtil.inferType("x"));
    assertEquals(ColumnType.DATE, HeavyTypeUtil.inferType(LocalDate.EPOCH));
    assertEquals(ColumnType.DATE, HeavyTypeUtil.inferType(java.sql.Date.valueOf("2024-01-01")));
    assertEquals(ColumnType.TIME, HeavyTypeUtil.inferType(LocalTime.NOON));
    assertEquals(ColumnType.TIMESTAMP, HeavyTypeUtil.inferType(MOMENT));
    assertEquals(ColumnType.TIMESTAMP, HeavyTypeUtil.inferType(Instant.EPOCH));
    assertNull(HeavyTypeUtil.inferType(null));
    assertNull(HeavyTypeUtil.inferType(new Object()));
  }

  @Test
  void testInferColumnTypeSkipsMissingValues() {
    assertEquals(
        ColumnType.DOUBLE, HeavyTypeUtil.inferColumnType(Arrays.asList(null, Double.NaN, 2.5)));
    assertNull(HeavyTypeUtil.inferColumnType(Arrays.asList(null, null)));
  }

  @ParameterizedTest
  @CsvSource({
    "INT, BIGINT, true",
    "DOUBLE, INT, true",
    "DECIMAL, FLOAT, true",
    "INT, BOOL, true",
    "DOUBLE, BOOL, false",
    "STR, INT, false",
    "INT, STR, false",
    "TIMESTAMP, DATE, true",
    "DATE, TIMESTAMP, true",
    "TIME, TIMESTAMP, false",
    "STR, STR, true"
  })
  void testIsCoercible(ColumnType source, ColumnType target, boolean expected) {
    assertEquals(expected, HeavyTypeUtil.isCoercible(source, target));
  }

  @Test
  void testNullSourceIsCoercibleToAnything() {
    assertTrue(HeavyTypeUtil.isCoercible(null, ColumnType.TIME));
  }

  @Test
  void testToLongChecksRange() throws TypeMismatchException {
    ColumnSpec tinyint = spec(ColumnType.TINYINT);

    assertEquals(127, HeavyTypeUtil.toLong(tinyint, 127));
    assertEquals(-128, HeavyTypeUtil.toLong(tinyint, (short) -128));
    assertThrows(TypeMismatchException.class, () -> HeavyTypeUtil.toLong(tinyint, 128));
    assertThrows(TypeMismatchException.class, () -> HeavyTypeUtil.toLong(tinyint, 1.5));
    assertThrows(TypeMismatchException.class, () -> HeavyTypeUtil.toLong(tinyint, "1"));
    assertEquals(3, HeavyTypeUtil.toLong(spec(ColumnType.BIGINT), 3.0));
  }

  @Test
  void testToDecimalRoundsToColumnScale() throws TypeMismatchException {
    ColumnSpec decimal =
        ColumnSpec.builder("d", ColumnType.DECIMAL).withPrecision(6).withScale(2).build();

    assertEquals(
        new BigDecimal("12.35"), HeavyTypeUtil.toDecimal(decimal, new BigDecimal("12.345")));
    assertEquals(new BigDecimal("7.00"), HeavyTypeUtil.toDecimal(decimal, 7));
    assertThrows(
        TypeMismatchException.class,
        () -> HeavyTypeUtil.toDecimal(decimal, new BigDecimal("12345.6")));
  }

  @Test
  void testTemporalCoercion() throws TypeMismatchException {
    ColumnSpec date = spec(ColumnType.DATE);
    ColumnSpec time = spec(ColumnType.TIME);

    assertEquals(86_400, HeavyTypeUtil.toEpochDateSeconds(date, LocalDate.of(1970, 1, 2)));
    assertEquals(-1, HeavyTypeUtil.toEpochDay(date, LocalDate.of(1969, 12, 31)));
    assertEquals(19_783, HeavyTypeUtil.toEpochDay(date, MOMENT));
    assertEquals(3_661, HeavyTypeUtil.toSecondOfDay(time, LocalTime.of(1, 1, 1)));
    assertThrows(TypeMismatchException.class, () -> HeavyTypeUtil.toSecondOfDay(time, MOMENT));
  }

  @Test
  void testNumericDateIsEpochDaysOnBothPaths() throws TypeMismatchException {
    ColumnSpec date = spec(ColumnType.DATE);

    assertEquals(1, HeavyTypeUtil.toEpochDay(date, 1));
    assertEquals(86_400, HeavyTypeUtil.toEpochDateSeconds(date, 1));
    assertEquals(
        HeavyTypeUtil.toEpochDay(date, 19_783L) * 86_400,
        HeavyTypeUtil.toEpochDateSeconds(date, 19_783L));
    assertThrows(
        TypeMismatchException.class,
        () -> HeavyTypeUtil.toEpochDateSeconds(date, Long.MAX_VALUE));
  }

  @ParameterizedTest
  @CsvSource({"0, 1709296215", "3, 1709296215123", "6, 1709296215123456", "9, 1709296215123456789"})
  void testToEpochTimestampAtPrecision(int precision, long expected) throws TypeMismatchException {
    ColumnSpec timestamp =
        ColumnSpec.builder("ts", ColumnType.TIMESTAMP).withPrecision(precision).build();

    assertEquals(expected, HeavyTypeUtil.toEpochTimestamp(timestamp, MOMENT));
    assertEquals(
        expected,
        HeavyTypeUtil.toEpochTimestamp(timestamp, MOMENT.atOffset(ZoneOffset.UTC).toInstant()));
  }

  @Test
  void testToEpochTimestampHonorsOffset() throws TypeMismatchException {
    ColumnSpec timestamp = spec(ColumnType.TIMESTAMP);
    OffsetDateTime plusOne = OffsetDateTime.of(1970, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1));

    assertEquals(0, HeavyTypeUtil.toEpochTimestamp(timestamp, plusOne));
  }

  @Test
  void testTimestampPrecisionMustBeSupported() {
    ColumnSpec timestamp = ColumnSpec.builder("ts", ColumnType.TIMESTAMP).withPrecision(4).build();

    assertThrows(
        TypeMismatchException.class, () -> HeavyTypeUtil.toEpochTimestamp(timestamp, MOMENT));
  }

  @Test
  void testFromEpochTimestamp() {
    assertEquals(
        LocalDateTime.of(1969, 12, 31, 23, 59, 59, 999_000_000),
        HeavyTypeUtil.fromEpochTimestamp(-1, 3));
    assertEquals(MOMENT, HeavyTypeUtil.fromEpochTimestamp(1709296215123456789L, 9));
  }

  @Test
  void testToLiteral() {
    assertEquals("1", HeavyTypeUtil.toLiteral(1));
    assertEquals("a", HeavyTypeUtil.toLiteral("a"));
    assertEquals("{1,2,3}", HeavyTypeUtil.toLiteral(Arrays.asList(1, 2, 3)));
    assertEquals("{a,b}", HeavyTypeUtil.toLiteral(new String[] {"a", "b"}));
    assertEquals("2024-03-01 12:30:15.123456789", HeavyTypeUtil.toLiteral(MOMENT));
    assertEquals("2024-03-01", HeavyTypeUtil.toLiteral(LocalDate.of(2024, 3, 1)));
    assertEquals("0.0000001", HeavyTypeUtil.toLiteral(new BigDecimal("1E-7")));
  }

  @Test
  void testIsNullValue() {
    assertTrue(HeavyTypeUtil.isNullValue(null));
    assertTrue(HeavyTypeUtil.isNullValue(Float.NaN));
    assertFalse(HeavyTypeUtil.isNullValue(0.0));
    assertFalse(HeavyTypeUtil.isNullValue(""));
  }

  // ==================== Helper Methods ====================

  private static ColumnSpec spec(ColumnType type) {
    return ColumnSpec.builder("c", type).build();
  }
}
