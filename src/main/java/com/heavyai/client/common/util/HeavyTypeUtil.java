package com.heavyai.client.common.util;

import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;

/**
 * Type inference and value coercion shared by the columnar encoder, the Arrow serializer and the
 * row-wise loader.
 *
 * <p>Temporal values without a zone are interpreted as UTC. Timestamps are expressed as an epoch
 * count at the column precision: 0 (seconds), 3 (milliseconds), 6 (microseconds) or 9
 * (nanoseconds). Numbers supplied for temporal columns are taken to be already at the wire unit.
 */
public final class HeavyTypeUtil {

  private static final long SECONDS_PER_DAY = 86_400L;
  private static final long[] POWERS_OF_TEN = {
    1L, 10L, 100L, 1_000L, 10_000L, 100_000L, 1_000_000L, 10_000_000L, 100_000_000L, 1_000_000_000L
  };
  public static final int MAX_DECIMAL_PRECISION = 18;

  private HeavyTypeUtil() {
    // Utility class - prevent instantiation
  }

  // ==================== Inference ====================

  /**
   * Infers the logical type of a single value.
   *
   * @return the type, or null for null values and unsupported Java types
   */
  public static ColumnType inferType(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean) {
      return ColumnType.BOOL;
    }
    if (value instanceof Byte) {
      return ColumnType.TINYINT;
    }
    if (value instanceof Short) {
      return ColumnType.SMALLINT;
    }
    if (value instanceof Integer) {
      return ColumnType.INT;
    }
    if (value instanceof Long || value instanceof BigInteger) {
      return ColumnType.BIGINT;
    }
    if (value instanceof Float) {
      return ColumnType.FLOAT;
    }
    if (value instanceof Double) {
      return ColumnType.DOUBLE;
    }
    if (value instanceof BigDecimal) {
      return ColumnType.DECIMAL;
    }
    if (value instanceof CharSequence || value instanceof Character) {
      return ColumnType.STR;
    }
    if (value instanceof java.sql.Date || value instanceof LocalDate) {
      return ColumnType.DATE;
    }
    if (value instanceof java.sql.Time || value instanceof LocalTime) {
      return ColumnType.TIME;
    }
    if (value instanceof java.util.Date
        || value instanceof LocalDateTime
        || value instanceof Instant
        || value instanceof OffsetDateTime
        || value instanceof ZonedDateTime) {
      return ColumnType.TIMESTAMP;
    }
    return null;
  }

  /** Infers a column type from the first non-null value, or null if every value is null. */
  public static ColumnType inferColumnType(Iterable<?> values) {
    for (Object value : values) {
      if (!isNullValue(value)) {
        return inferType(value);
      }
    }
    return null;
  }

  /**
   * Whether a column whose values have the {@code source} type may be loaded into a {@code target}
   * column. A null source (all values missing) is compatible with everything.
   */
  public static boolean isCoercible(ColumnType source, ColumnType target) {
    if (source == null || source == target) {
      return true;
    }
    switch (target) {
      case BOOL:
        return source.isInteger();
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
      case FLOAT:
      case DOUBLE:
      case DECIMAL:
        return source.isNumeric();
      case DATE:
      case TIMESTAMP:
        return source == ColumnType.DATE || source == ColumnType.TIMESTAMP;
      default:
        return false;
    }
  }

  /** Null, or a floating point NaN, which marks a missing numeric value. */
  public static boolean isNullValue(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Double) {
      return ((Double) value).isNaN();
    }
    if (value instanceof Float) {
      return ((Float) value).isNaN();
    }
    return false;
  }

  // ==================== Coercion ====================

  /** Coerces a value for an integer or boolean column, checking the target range. */
  public static long toLong(ColumnSpec spec, Object value) throws TypeMismatchException {
    long result;
    if (value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long) {
      result = ((Number) value).longValue();
    } else if (value instanceof BigInteger) {
      try {
        result = ((BigInteger) value).longValueExact();
      } catch (ArithmeticException e) {
        throw mismatch(spec, value, e);
      }
    } else if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
      try {
        result = new BigDecimal(value.toString()).longValueExact();
      } catch (ArithmeticException | NumberFormatException e) {
        throw mismatch(spec, value, e);
      }
    } else if (value instanceof Boolean && spec.getType() == ColumnType.BOOL) {
      result = (Boolean) value ? 1 : 0;
    } else {
      throw mismatch(spec, value, null);
    }
    if (result < minValue(spec.getType()) || result > maxValue(spec.getType())) {
      throw new TypeMismatchException(
          String.format(
              "Value %s is out of range for column %s of type %s",
              value, spec.getName(), spec.getType()));
    }
    return result;
  }

  public static boolean toBoolean(ColumnSpec spec, Object value) throws TypeMismatchException {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return toLong(spec, value) != 0;
  }

  public static double toDouble(ColumnSpec spec, Object value) throws TypeMismatchException {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    throw mismatch(spec, value, null);
  }

  /** Coerces a value to a decimal at the column scale, rounding half up. */
  public static BigDecimal toDecimal(ColumnSpec spec, Object value) throws TypeMismatchException {
    BigDecimal decimal;
    if (value instanceof BigDecimal) {
      decimal = (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      decimal = new BigDecimal((BigInteger) value);
    } else if (value instanceof Number) {
      try {
        decimal = new BigDecimal(value.toString());
      } catch (NumberFormatException e) {
        throw mismatch(spec, value, e);
      }
    } else {
      throw mismatch(spec, value, null);
    }
    BigDecimal scaled = decimal.setScale(spec.getScale(), RoundingMode.HALF_UP);
    int precision = spec.getPrecision() > 0 ? spec.getPrecision() : MAX_DECIMAL_PRECISION;
    if (scaled.precision() > Math.min(precision, MAX_DECIMAL_PRECISION)) {
      throw new TypeMismatchException(
          String.format(
              "Value %s does not fit DECIMAL(%d,%d) column %s",
              value, spec.getPrecision(), spec.getScale(), spec.getName()));
    }
    return scaled;
  }

  public static String toStringValue(ColumnSpec spec, Object value) throws TypeMismatchException {
    if (value instanceof CharSequence || value instanceof Character) {
      return value.toString();
    }
    throw mismatch(spec, value, null);
  }

  /** Coerces a value to days since the epoch. Numbers are taken as a day count. */
  public static long toEpochDay(ColumnSpec spec, Object value) throws TypeMismatchException {
    if (value instanceof Number) {
      return toLongExact(spec, value);
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().toEpochDay();
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).toEpochDay();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toLocalDate().toEpochDay();
    }
    Instant instant = toInstantOrNull(value);
    if (instant == null) {
      throw mismatch(spec, value, null);
    }
    return Math.floorDiv(instant.getEpochSecond(), SECONDS_PER_DAY);
  }

  /**
   * Coerces a value for a DATE column: seconds since the epoch at midnight UTC. Numbers are epoch
   * days, as in {@link #toEpochDay}.
   */
  public static long toEpochDateSeconds(ColumnSpec spec, Object value)
      throws TypeMismatchException {
    long epochDay = toEpochDay(spec, value);
    try {
      return Math.multiplyExact(epochDay, SECONDS_PER_DAY);
    } catch (ArithmeticException e) {
      throw mismatch(spec, value, e);
    }
  }

  /** Coerces a value for a TIME column: seconds since midnight. */
  public static long toSecondOfDay(ColumnSpec spec, Object value) throws TypeMismatchException {
    if (value instanceof Number) {
      return toLongExact(spec, value);
    }
    if (value instanceof java.sql.Time) {
      return ((java.sql.Time) value).toLocalTime().toSecondOfDay();
    }
    if (value instanceof LocalTime) {
      return ((LocalTime) value).toSecondOfDay();
    }
    throw mismatch(spec, value, null);
  }

  /** Coerces a value for a TIMESTAMP column: epoch count at the column precision. */
  public static long toEpochTimestamp(ColumnSpec spec, Object value) throws TypeMismatchException {
    int precision = timestampPrecision(spec);
    if (value instanceof Number) {
      return toLongExact(spec, value);
    }
    Instant instant;
    if (value instanceof LocalDate || value instanceof java.sql.Date) {
      instant = Instant.ofEpochSecond(toEpochDay(spec, value) * SECONDS_PER_DAY);
    } else {
      instant = toInstantOrNull(value);
    }
    if (instant == null) {
      throw mismatch(spec, value, null);
    }
    try {
      long whole = Math.multiplyExact(instant.getEpochSecond(), POWERS_OF_TEN[precision]);
      return Math.addExact(whole, instant.getNano() / POWERS_OF_TEN[9 - precision]);
    } catch (ArithmeticException e) {
      throw mismatch(spec, value, e);
    }
  }

  /** Converts an epoch count at {@code precision} back to a UTC date-time. */
  public static LocalDateTime fromEpochTimestamp(long epochValue, int precision) {
    long unitsPerSecond = POWERS_OF_TEN[precision];
    long seconds = Math.floorDiv(epochValue, unitsPerSecond);
    long fraction = Math.floorMod(epochValue, unitsPerSecond);
    return LocalDateTime.ofEpochSecond(
        seconds, (int) (fraction * POWERS_OF_TEN[9 - precision]), ZoneOffset.UTC);
  }

  public static int timestampPrecision(ColumnSpec spec) throws TypeMismatchException {
    int precision = spec.getPrecision();
    if (precision != 0 && precision != 3 && precision != 6 && precision != 9) {
      throw new TypeMismatchException(
          "Unsupported timestamp precision " + precision + " for column " + spec.getName());
    }
    return precision;
  }

  // ==================== Row rendering ====================

  /**
   * Renders a value as the text the server parses in a row-wise load. Collections and arrays
   * become {@code {a,b,c}}; date-times use a space between date and time.
   */
  public static String toLiteral(Object value) {
    if (value instanceof Collection) {
      StringBuilder builder = new StringBuilder("{");
      boolean first = true;
      for (Object element : (Collection<?>) value) {
        if (!first) {
          builder.append(',');
        }
        builder.append(toLiteral(element));
        first = false;
      }
      return builder.append('}').toString();
    }
    if (value instanceof Object[]) {
      return toLiteral(java.util.Arrays.asList((Object[]) value));
    }
    if (value instanceof java.sql.Timestamp) {
      return toLiteral(((java.sql.Timestamp) value).toLocalDateTime());
    }
    if (value instanceof LocalDateTime) {
      return value.toString().replace('T', ' ');
    }
    if (value instanceof Instant) {
      return toLiteral(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
    }
    if (value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
      return toLiteral(toInstantOrNull(value));
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    return String.valueOf(value);
  }

  // ==================== Helpers ====================

  private static Instant toInstantOrNull(Object value) {
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof java.sql.Timestamp) {
      return ((java.sql.Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof java.util.Date
        && !(value instanceof java.sql.Date)
        && !(value instanceof java.sql.Time)) {
      return ((java.util.Date) value).toInstant();
    }
    return null;
  }

  private static long toLongExact(ColumnSpec spec, Object value) throws TypeMismatchException {
    try {
      return new BigDecimal(value.toString()).longValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw mismatch(spec, value, e);
    }
  }

  private static long minValue(ColumnType type) {
    switch (type) {
      case BOOL:
        return 0;
      case TINYINT:
        return Byte.MIN_VALUE;
      case SMALLINT:
        return Short.MIN_VALUE;
      case INT:
        return Integer.MIN_VALUE;
      default:
        return Long.MIN_VALUE;
    }
  }

  private static long maxValue(ColumnType type) {
    switch (type) {
      case BOOL:
        return 1;
      case TINYINT:
        return Byte.MAX_VALUE;
      case SMALLINT:
        return Short.MAX_VALUE;
      case INT:
        return Integer.MAX_VALUE;
      default:
        return Long.MAX_VALUE;
    }
  }

  private static TypeMismatchException mismatch(ColumnSpec spec, Object value, Throwable cause) {
    return new TypeMismatchException(
        String.format(
            "Cannot convert %s value '%s' for column %s of type %s",
            value.getClass().getSimpleName(), value, spec.getName(), spec.getType()),
        cause);
  }
}
