package com.heavyai.client.api.impl.load;

import static org.junit.jupiter.api.Assertions.*;

import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.model.core.ColumnEncoding;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import com.heavyai.client.model.core.ColumnarFrame;
import com.heavyai.client.model.core.EncodedColumn;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for ColumnEncoder. */
public class ColumnEncoderTest {

  private final ColumnEncoder encoder = new ColumnEncoder();

  @Test
  void testEncodeIntegersWithNulls() throws TypeMismatchException {
    EncodedColumn encoded = encoder.encode(column(1, null, -3), spec(ColumnType.INT));

    assertEquals(3, encoded.getRowCount());
    assertEquals(12, encoded.getValues().length);
    assertEquals(1, encoded.getLong(0));
    assertTrue(encoded.isNull(1));
    assertFalse(encoded.isNull(2));
    assertEquals(-3, encoded.getLong(2));
    assertEquals(0b010, encoded.getNullBitmap()[0]);
  }

  @Test
  void testEncodeWidensIntegers() throws TypeMismatchException {
    EncodedColumn encoded = encoder.encode(column(1, 2), spec(ColumnType.BIGINT));

    assertEquals(16, encoded.getValues().length);
    assertEquals(2, encoded.getLong(1));
  }

  @Test
  void testEncodeRejectsIncompatibleColumnType() {
    TypeMismatchException thrown =
        assertThrows(
            TypeMismatchException.class,
            () -> encoder.encode(column("a", "b"), spec(ColumnType.INT)));
    assertTrue(thrown.getMessage().contains("STR"));
  }

  @Test
  void testEncodeRejectsOutOfRangeValue() {
    assertThrows(
        TypeMismatchException.class,
        () -> encoder.encode(column(1, 300), spec(ColumnType.TINYINT)));
  }

  @Test
  void testEncodeRejectsNullInNotNullColumn() {
    ColumnSpec notNull = ColumnSpec.builder("c", ColumnType.INT).withNullable(false).build();

    assertThrows(TypeMismatchException.class, () -> encoder.encode(column(1, null), notNull));
  }

  @Test
  void testEncodeFloatingPointTreatsNaNAsNull() throws TypeMismatchException {
    EncodedColumn floats = encoder.encode(column(1.5f, Float.NaN), spec(ColumnType.FLOAT));
    EncodedColumn doubles = encoder.encode(column(2.25, null), spec(ColumnType.DOUBLE));

    assertEquals(1.5, floats.getDouble(0));
    assertTrue(floats.isNull(1));
    assertEquals(8, floats.getValues().length);
    assertEquals(2.25, doubles.getDouble(0));
  }

  @Test
  void testEncodeBooleans() throws TypeMismatchException {
    EncodedColumn encoded = encoder.encode(column(true, false, null), spec(ColumnType.BOOL));

    assertEquals(1, encoded.getLong(0));
    assertEquals(0, encoded.getLong(1));
    assertTrue(encoded.isNull(2));
  }

  @Test
  void testEncodeDecimalAtColumnScale() throws TypeMismatchException {
    ColumnSpec decimal =
        ColumnSpec.builder("d", ColumnType.DECIMAL).withPrecision(10).withScale(2).build();

    EncodedColumn encoded = encoder.encode(column(new BigDecimal("12.345"), 3), decimal);

    assertEquals(1235, encoded.getLong(0));
    assertEquals(300, encoded.getLong(1));
  }

  @Test
  void testEncodeInfiniteDecimalFails() {
    ColumnSpec decimal =
        ColumnSpec.builder("d", ColumnType.DECIMAL).withPrecision(10).withScale(2).build();

    assertThrows(
        TypeMismatchException.class,
        () -> encoder.encode(Arrays.asList(1.5, Double.POSITIVE_INFINITY), decimal));
    assertThrows(
        TypeMismatchException.class,
        () -> encoder.encode(column(Float.NEGATIVE_INFINITY), decimal));
  }

  @Test
  void testEncodeNumericDateAsEpochDays() throws TypeMismatchException {
    EncodedColumn dates = encoder.encode(Arrays.asList(1, -1L), spec(ColumnType.DATE));

    assertEquals(86_400, dates.getLong(0));
    assertEquals(-86_400, dates.getLong(1));
  }

  @Test
  void testEncodeTemporalValues() throws TypeMismatchException {
    ColumnSpec timestamp =
        ColumnSpec.builder("ts", ColumnType.TIMESTAMP).withPrecision(3).build();

    EncodedColumn dates = encoder.encode(column(LocalDate.of(1970, 1, 2)), spec(ColumnType.DATE));
    EncodedColumn times = encoder.encode(column(LocalTime.of(1, 0)), spec(ColumnType.TIME));
    EncodedColumn timestamps =
        encoder.encode(column(LocalDateTime.of(1970, 1, 1, 0, 0, 1, 500_000_000)), timestamp);

    assertEquals(86_400, dates.getLong(0));
    assertEquals(3_600, times.getLong(0));
    assertEquals(1_500, timestamps.getLong(0));
  }

  @Test
  void testEncodeDictionaryStrings() throws TypeMismatchException {
    EncodedColumn encoded = encoder.encode(column("a", "b", "a", null), dictSpec(32));

    assertEquals(Arrays.asList("a", "b"), encoded.getDictionary());
    assertEquals(16, encoded.getValues().length);
    assertEquals(0, encoded.getLong(2));
    assertEquals("a", encoded.getString(2));
    assertNull(encoded.getString(3));
  }

  @Test
  void testEncodeDictionaryUsesCodeWidth() throws TypeMismatchException {
    EncodedColumn encoded = encoder.encode(column("x", "y"), dictSpec(16));

    assertEquals(4, encoded.getValues().length);
    assertEquals("y", encoded.getString(1));
  }

  @Test
  void testEncodeDictionaryOverflow() throws TypeMismatchException {
    List<Object> fits = new ArrayList<>();
    for (int i = 0; i < 127; i++) {
      fits.add("v" + i);
    }
    List<Object> overflows = new ArrayList<>(fits);
    overflows.add("one too many");

    assertEquals(127, encoder.encode(fits, dictSpec(8)).getDictionary().size());
    assertThrows(TypeMismatchException.class, () -> encoder.encode(overflows, dictSpec(8)));
  }

  @Test
  void testEncodePlainStrings() throws TypeMismatchException {
    ColumnSpec plain =
        ColumnSpec.builder("s", ColumnType.STR).withEncoding(ColumnEncoding.NONE).build();

    EncodedColumn encoded = encoder.encode(column("héllo", null, ""), plain);

    assertArrayEquals(new int[] {0, 6, 6, 6}, encoded.getOffsets());
    assertEquals("héllo", encoded.getString(0));
    assertNull(encoded.getString(1));
    assertEquals("", encoded.getString(2));
  }

  @Test
  void testEncodeAllNullColumnIntoAnyType() throws TypeMismatchException {
    EncodedColumn encoded = encoder.encode(column(null, null), spec(ColumnType.TIMESTAMP));

    assertTrue(encoded.isNull(0));
    assertTrue(encoded.isNull(1));
  }

  // ==================== Helper Methods ====================

  private static ColumnarFrame.Column column(Object... values) {
    return ColumnarFrame.builder().addColumn("src", Arrays.asList(values)).build().getColumn(0);
  }

  private static ColumnSpec spec(ColumnType type) {
    return ColumnSpec.builder("c", type).build();
  }

  private static ColumnSpec dictSpec(int bits) {
    return ColumnSpec.builder("s", ColumnType.STR)
        .withEncoding(ColumnEncoding.DICT)
        .withCompParam(bits)
        .build();
  }
}
