package com.heavyai.client.api.impl.load;

import static com.heavyai.client.model.core.EncodedColumn.bitmapLength;
import static com.heavyai.client.model.core.EncodedColumn.writeLittleEndian;

import com.heavyai.client.common.util.HeavyTypeUtil;
import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import com.heavyai.client.model.core.ColumnarFrame;
import com.heavyai.client.model.core.EncodedColumn;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts one source column into the binary columnar wire layout described by {@link
 * EncodedColumn}, following the server's column metadata:
 *
 * <ul>
 *   <li>integers, floats and booleans use the type's fixed width
 *   <li>decimals are 8-byte unscaled values at the column scale
 *   <li>dates are 8-byte epoch seconds, times 8-byte seconds since midnight, timestamps 8-byte
 *       epoch counts at the column precision
 *   <li>dictionary strings are signed codes of the dictionary width into a column dictionary
 *   <li>other strings are UTF-8 bytes with offsets
 * </ul>
 *
 * <p>The encoder is stateless.
 */
public class ColumnEncoder {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(ColumnEncoder.class);

  /**
   * Encodes a frame column against the target column spec.
   *
   * @throws TypeMismatchException if the column type cannot be loaded into the target type, or a
   *     value cannot be coerced
   */
  public EncodedColumn encode(ColumnarFrame.Column column, ColumnSpec spec)
      throws TypeMismatchException {
    if (!HeavyTypeUtil.isCoercible(column.getType(), spec.getType())) {
      String message =
          String.format(
              "Source column %s of type %s cannot be loaded into column %s of type %s",
              column.getName(), column.getType(), spec.getName(), spec.getType());
      LOGGER.error(message);
      throw new TypeMismatchException(message);
    }
    return encode(column.getValues(), spec);
  }

  /** Encodes raw values against the target column spec. */
  public EncodedColumn encode(List<?> values, ColumnSpec spec) throws TypeMismatchException {
    int rowCount = values.size();
    byte[] nullBitmap = new byte[bitmapLength(rowCount)];
    for (int row = 0; row < rowCount; row++) {
      if (HeavyTypeUtil.isNullValue(values.get(row))) {
        if (!spec.isNullable()) {
          throw new TypeMismatchException(
              "Column " + spec.getName() + " is NOT NULL but row " + row + " is null");
        }
        nullBitmap[row >>> 3] |= (byte) (1 << (row & 7));
      }
    }

    EncodedColumn encoded;
    if (spec.getType() != ColumnType.STR) {
      encoded =
          EncodedColumn.fixedWidth(
              spec, rowCount, nullBitmap, encodeFixedWidth(values, spec, nullBitmap));
    } else if (spec.isDictionaryEncoded()) {
      encoded = encodeDictionary(values, spec, nullBitmap);
    } else {
      encoded = encodePlainStrings(values, spec, nullBitmap);
    }
    LOGGER.debug(
        "Encoded column {} ({}): {} rows, {} bytes",
        spec.getName(),
        spec.getType(),
        rowCount,
        encoded.getSerializedSize());
    return encoded;
  }

  private byte[] encodeFixedWidth(List<?> values, ColumnSpec spec, byte[] nullBitmap)
      throws TypeMismatchException {
    int width = spec.getWireWidth();
    byte[] buffer = new byte[values.size() * width];
    for (int row = 0; row < values.size(); row++) {
      if (isNull(nullBitmap, row)) {
        continue;
      }
      writeLittleEndian(buffer, row, width, toWireBits(spec, values.get(row)));
    }
    return buffer;
  }

  private long toWireBits(ColumnSpec spec, Object value) throws TypeMismatchException {
    switch (spec.getType()) {
      case BOOL:
        return HeavyTypeUtil.toBoolean(spec, value) ? 1 : 0;
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
        return HeavyTypeUtil.toLong(spec, value);
      case FLOAT:
        return Float.floatToIntBits((float) HeavyTypeUtil.toDouble(spec, value));
      case DOUBLE:
        return Double.doubleToLongBits(HeavyTypeUtil.toDouble(spec, value));
      case DECIMAL:
        return HeavyTypeUtil.toDecimal(spec, value).unscaledValue().longValueExact();
      case DATE:
        return HeavyTypeUtil.toEpochDateSeconds(spec, value);
      case TIME:
        return HeavyTypeUtil.toSecondOfDay(spec, value);
      case TIMESTAMP:
        return HeavyTypeUtil.toEpochTimestamp(spec, value);
      default:
        throw new TypeMismatchException("Column type " + spec.getType() + " is not fixed width");
    }
  }

  private EncodedColumn encodeDictionary(List<?> values, ColumnSpec spec, byte[] nullBitmap)
      throws TypeMismatchException {
    int width = spec.getWireWidth();
    long capacity = (1L << (width * Byte.SIZE - 1)) - 1;
    Map<String, Integer> codes = new LinkedHashMap<>();
    byte[] buffer = new byte[values.size() * width];
    for (int row = 0; row < values.size(); row++) {
      if (isNull(nullBitmap, row)) {
        continue;
      }
      String value = HeavyTypeUtil.toStringValue(spec, values.get(row));
      Integer code = codes.get(value);
      if (code == null) {
        if (codes.size() >= capacity) {
          throw new TypeMismatchException(
              String.format(
                  "Column %s holds more than %d distinct strings, the limit of a %d-bit dictionary",
                  spec.getName(), capacity, width * Byte.SIZE));
        }
        code = codes.size();
        codes.put(value, code);
      }
      writeLittleEndian(buffer, row, width, code);
    }
    return EncodedColumn.dictionary(
        spec, values.size(), nullBitmap, buffer, new ArrayList<>(codes.keySet()));
  }

  private EncodedColumn encodePlainStrings(List<?> values, ColumnSpec spec, byte[] nullBitmap)
      throws TypeMismatchException {
    int[] offsets = new int[values.size() + 1];
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    for (int row = 0; row < values.size(); row++) {
      if (!isNull(nullBitmap, row)) {
        bytes.writeBytes(
            HeavyTypeUtil.toStringValue(spec, values.get(row)).getBytes(StandardCharsets.UTF_8));
      }
      offsets[row + 1] = bytes.size();
    }
    return EncodedColumn.plainStrings(
        spec, values.size(), nullBitmap, offsets, bytes.toByteArray());
  }

  private static boolean isNull(byte[] nullBitmap, int row) {
    return (nullBitmap[row >>> 3] & (1 << (row & 7))) != 0;
  }
}
