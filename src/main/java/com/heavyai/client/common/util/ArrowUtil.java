package com.heavyai.client.common.util;

import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ColumnEncoding;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.TimeMicroVector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeNanoVector;
import org.apache.arrow.vector.TimeSecVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Utility class for Arrow operations.
 *
 * <p>Provides methods for:
 *
 * <ul>
 *   <li>Mapping between server column metadata and Arrow schemas
 *   <li>Reading single values out of Arrow vectors as plain Java objects
 *   <li>Writing a table as an Arrow IPC stream (schema message plus one record batch)
 * </ul>
 */
public final class ArrowUtil {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(ArrowUtil.class);

  private ArrowUtil() {
    // Utility class - prevent instantiation
  }

  // ==================== Schema Operations ====================

  /**
   * Builds the Arrow schema matching a list of server column specs, in order.
   *
   * @param specs the column specs
   * @return the equivalent Arrow schema
   */
  public static Schema toArrowSchema(List<ColumnSpec> specs) {
    List<Field> fields = new ArrayList<>(specs.size());
    for (ColumnSpec spec : specs) {
      fields.add(toArrowField(spec));
    }
    return new Schema(fields);
  }

  public static Field toArrowField(ColumnSpec spec) {
    FieldType fieldType = new FieldType(spec.isNullable(), toArrowType(spec), null);
    return new Field(spec.getName(), fieldType, null);
  }

  public static ArrowType toArrowType(ColumnSpec spec) {
    switch (spec.getType()) {
      case BOOL:
        return ArrowType.Bool.INSTANCE;
      case TINYINT:
        return new ArrowType.Int(8, true);
      case SMALLINT:
        return new ArrowType.Int(16, true);
      case INT:
        return new ArrowType.Int(32, true);
      case BIGINT:
        return new ArrowType.Int(64, true);
      case FLOAT:
        return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
      case DOUBLE:
        return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
      case DECIMAL:
        int precision =
            spec.getPrecision() > 0 ? spec.getPrecision() : HeavyTypeUtil.MAX_DECIMAL_PRECISION;
        return ArrowType.Decimal.createDecimal(precision, spec.getScale(), 128);
      case STR:
        return ArrowType.Utf8.INSTANCE;
      case DATE:
        return new ArrowType.Date(DateUnit.DAY);
      case TIME:
        return new ArrowType.Time(TimeUnit.SECOND, 32);
      case TIMESTAMP:
        return new ArrowType.Timestamp(timeUnitForPrecision(spec.getPrecision()), null);
      default:
        throw new IllegalArgumentException("Unmapped column type " + spec.getType());
    }
  }

  /**
   * Derives the server column spec for an Arrow field. Strings become dictionary encoded with
   * 32-bit codes, the server's default for text columns.
   *
   * @throws TypeMismatchException if the Arrow type has no server counterpart
   */
  public static ColumnSpec toColumnSpec(Field field) throws TypeMismatchException {
    ArrowType type = field.getType();
    if (field.getDictionary() != null) {
      return stringSpec(field.getName(), field.isNullable());
    }
    ColumnSpec.Builder builder;
    switch (type.getTypeID()) {
      case Bool:
        builder = ColumnSpec.builder(field.getName(), ColumnType.BOOL);
        break;
      case Int:
        builder = ColumnSpec.builder(field.getName(), intType((ArrowType.Int) type));
        break;
      case FloatingPoint:
        builder =
            ColumnSpec.builder(
                field.getName(),
                ((ArrowType.FloatingPoint) type).getPrecision() == FloatingPointPrecision.DOUBLE
                    ? ColumnType.DOUBLE
                    : ColumnType.FLOAT);
        break;
      case Decimal:
        ArrowType.Decimal decimal = (ArrowType.Decimal) type;
        builder =
            ColumnSpec.builder(field.getName(), ColumnType.DECIMAL)
                .withPrecision(decimal.getPrecision())
                .withScale(decimal.getScale());
        break;
      case Utf8:
      case LargeUtf8:
        return stringSpec(field.getName(), field.isNullable());
      case Date:
        builder =
            ColumnSpec.builder(field.getName(), ColumnType.DATE)
                .withEncoding(ColumnEncoding.DAYS)
                .withCompParam(32);
        break;
      case Time:
        builder = ColumnSpec.builder(field.getName(), ColumnType.TIME);
        break;
      case Timestamp:
        builder =
            ColumnSpec.builder(field.getName(), ColumnType.TIMESTAMP)
                .withPrecision(precisionForTimeUnit(((ArrowType.Timestamp) type).getUnit()));
        break;
      default:
        throw new TypeMismatchException(
            "Arrow type " + type + " of column " + field.getName() + " is not supported");
    }
    return builder.withNullable(field.isNullable()).build();
  }

  private static ColumnSpec stringSpec(String name, boolean nullable) {
    return ColumnSpec.builder(name, ColumnType.STR)
        .withNullable(nullable)
        .withEncoding(ColumnEncoding.DICT)
        .withCompParam(ColumnSpec.DEFAULT_DICT_BITS)
        .build();
  }

  private static ColumnType intType(ArrowType.Int type) throws TypeMismatchException {
    switch (type.getBitWidth()) {
      case 8:
        return ColumnType.TINYINT;
      case 16:
        return ColumnType.SMALLINT;
      case 32:
        return ColumnType.INT;
      case 64:
        return ColumnType.BIGINT;
      default:
        throw new TypeMismatchException("Unsupported integer width " + type.getBitWidth());
    }
  }

  public static TimeUnit timeUnitForPrecision(int precision) {
    switch (precision) {
      case 3:
        return TimeUnit.MILLISECOND;
      case 6:
        return TimeUnit.MICROSECOND;
      case 9:
        return TimeUnit.NANOSECOND;
      default:
        return TimeUnit.SECOND;
    }
  }

  public static int precisionForTimeUnit(TimeUnit unit) {
    switch (unit) {
      case MILLISECOND:
        return 3;
      case MICROSECOND:
        return 6;
      case NANOSECOND:
        return 9;
      default:
        return 0;
    }
  }

  // ==================== Value Operations ====================

  /**
   * Reads one value out of a vector as a plain Java object: strings as {@link String}, dates as
   * {@link LocalDate}, times as {@link LocalTime}, timestamps as UTC {@link
   * java.time.LocalDateTime}, everything else as Arrow's own boxed value.
   *
   * @param vector the vector to read from
   * @param index the row index
   * @return the value, or null when the slot is null
   */
  public static Object readValue(FieldVector vector, int index) {
    if (vector.isNull(index)) {
      return null;
    }
    if (vector instanceof VarCharVector) {
      return new String(((VarCharVector) vector).get(index), StandardCharsets.UTF_8);
    }
    if (vector instanceof LargeVarCharVector) {
      return new String(((LargeVarCharVector) vector).get(index), StandardCharsets.UTF_8);
    }
    if (vector instanceof DateDayVector) {
      return LocalDate.ofEpochDay(((DateDayVector) vector).get(index));
    }
    if (vector instanceof DateMilliVector) {
      long millis = ((DateMilliVector) vector).get(index);
      return LocalDate.ofEpochDay(Math.floorDiv(millis, 86_400_000L));
    }
    if (vector instanceof TimeSecVector) {
      return LocalTime.ofSecondOfDay(((TimeSecVector) vector).get(index));
    }
    if (vector instanceof TimeMilliVector) {
      return LocalTime.ofNanoOfDay(((TimeMilliVector) vector).get(index) * 1_000_000L);
    }
    if (vector instanceof TimeMicroVector) {
      return LocalTime.ofNanoOfDay(((TimeMicroVector) vector).get(index) * 1_000L);
    }
    if (vector instanceof TimeNanoVector) {
      return LocalTime.ofNanoOfDay(((TimeNanoVector) vector).get(index));
    }
    if (vector instanceof TimeStampVector) {
      TimeUnit unit = ((ArrowType.Timestamp) vector.getField().getType()).getUnit();
      return HeavyTypeUtil.fromEpochTimestamp(
          ((TimeStampVector) vector).get(index), precisionForTimeUnit(unit));
    }
    return vector.getObject(index);
  }

  // ==================== Arrow Stream Operations ====================

  /**
   * Writes a table as a self-describing Arrow IPC stream: the schema message followed by one
   * record batch and the end-of-stream marker.
   *
   * @param root the table to serialize
   * @return the stream bytes
   * @throws HeavyClientException if the stream cannot be written
   */
  public static byte[] writeStream(VectorSchemaRoot root) throws HeavyClientException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ArrowStreamWriter writer = new ArrowStreamWriter(root, null, out)) {
      writer.start();
      writer.writeBatch();
      writer.end();
    } catch (IOException e) {
      LOGGER.error("Failed to write Arrow stream: {}", e.getMessage(), e);
      throw new HeavyClientException(
          "Failed to write Arrow stream: " + e.getMessage(),
          e,
          HeavyClientErrorCode.ARROW_PARSING_ERROR);
    }
    LOGGER.debug(
        "Serialized {} rows x {} columns into {} Arrow stream bytes",
        root.getRowCount(),
        root.getFieldVectors().size(),
        out.size());
    return out.toByteArray();
  }
}
