package com.heavyai.client.model.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One column in the binary columnar wire layout.
 *
 * <p>Every column carries a null bitmap with one bit per row, least significant bit first, where a
 * set bit marks a null. Values follow in one of three layouts:
 *
 * <ul>
 *   <li>fixed width: little-endian values of {@link ColumnSpec#getWireWidth()} bytes each
 *   <li>plain strings: UTF-8 bytes of all rows back to back plus {@code rowCount + 1} offsets
 *   <li>dictionary strings: little-endian codes of 1, 2 or 4 bytes indexing {@link
 *       #getDictionary()}
 * </ul>
 *
 * <p>Null rows still occupy a slot in the value buffer, filled with zeros.
 */
public final class EncodedColumn {

  private final ColumnSpec spec;
  private final int rowCount;
  private final byte[] nullBitmap;
  private final byte[] values;
  private final int[] offsets;
  private final List<String> dictionary;

  private EncodedColumn(
      ColumnSpec spec,
      int rowCount,
      byte[] nullBitmap,
      byte[] values,
      int[] offsets,
      List<String> dictionary) {
    if (nullBitmap.length != bitmapLength(rowCount)) {
      throw new IllegalArgumentException(
          "Null bitmap of " + nullBitmap.length + " bytes does not cover " + rowCount + " rows");
    }
    this.spec = spec;
    this.rowCount = rowCount;
    this.nullBitmap = nullBitmap;
    this.values = values;
    this.offsets = offsets;
    this.dictionary = dictionary;
  }

  public static EncodedColumn fixedWidth(
      ColumnSpec spec, int rowCount, byte[] nullBitmap, byte[] values) {
    if (values.length != rowCount * spec.getWireWidth()) {
      throw new IllegalArgumentException(
          "Value buffer of " + values.length + " bytes does not hold " + rowCount + " values");
    }
    return new EncodedColumn(spec, rowCount, nullBitmap, values, null, null);
  }

  public static EncodedColumn plainStrings(
      ColumnSpec spec, int rowCount, byte[] nullBitmap, int[] offsets, byte[] utf8Bytes) {
    if (offsets.length != rowCount + 1) {
      throw new IllegalArgumentException("Expected " + (rowCount + 1) + " string offsets");
    }
    return new EncodedColumn(spec, rowCount, nullBitmap, utf8Bytes, offsets, null);
  }

  public static EncodedColumn dictionary(
      ColumnSpec spec, int rowCount, byte[] nullBitmap, byte[] codes, List<String> dictionary) {
    if (codes.length != rowCount * spec.getWireWidth()) {
      throw new IllegalArgumentException(
          "Code buffer of " + codes.length + " bytes does not hold " + rowCount + " codes");
    }
    return new EncodedColumn(
        spec, rowCount, nullBitmap, codes, null, Collections.unmodifiableList(dictionary));
  }

  public static int bitmapLength(int rowCount) {
    return (rowCount + 7) / 8;
  }

  public ColumnSpec getSpec() {
    return spec;
  }

  public int getRowCount() {
    return rowCount;
  }

  /** Copy of the null bitmap. */
  public byte[] getNullBitmap() {
    return nullBitmap.clone();
  }

  /** Copy of the packed value bytes. */
  public byte[] getValues() {
    return values.clone();
  }

  /** Copy of the string offsets, or null when the column is not a plain string column. */
  public int[] getOffsets() {
    return offsets == null ? null : offsets.clone();
  }

  /** Dictionary for the codes of this column, or null when the column is not dictionary coded. */
  public List<String> getDictionary() {
    return dictionary;
  }

  public boolean isNull(int row) {
    return (nullBitmap[row >>> 3] & (1 << (row & 7))) != 0;
  }

  /** Bytes this column occupies on the wire. */
  public long getSerializedSize() {
    long size = (long) nullBitmap.length + values.length;
    if (offsets != null) {
      size += (long) offsets.length * Integer.BYTES;
    }
    if (dictionary != null) {
      for (String entry : dictionary) {
        size += Integer.BYTES + entry.getBytes(StandardCharsets.UTF_8).length;
      }
    }
    return size;
  }

  /** Reads an integral fixed-width value (also dates, times, timestamps and decimals). */
  public long getLong(int row) {
    return readLittleEndian(values, row, spec.getWireWidth());
  }

  public double getDouble(int row) {
    ByteBuffer buffer = ByteBuffer.wrap(values).order(ByteOrder.LITTLE_ENDIAN);
    return spec.getType() == ColumnType.FLOAT
        ? buffer.getFloat(row * Float.BYTES)
        : buffer.getDouble(row * Double.BYTES);
  }

  /** Reads a string row, or null when the row is null. */
  public String getString(int row) {
    if (isNull(row)) {
      return null;
    }
    if (dictionary != null) {
      return dictionary.get((int) readLittleEndian(values, row, spec.getWireWidth()));
    }
    int length = offsets[row + 1] - offsets[row];
    return new String(values, offsets[row], length, StandardCharsets.UTF_8);
  }

  /**
   * Copies rows {@code [offset, offset + length)} into a new column. Dictionary columns get a
   * dictionary holding only the entries the slice references, in first-use order.
   */
  public EncodedColumn slice(int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > rowCount) {
      throw new IndexOutOfBoundsException(
          "Slice [" + offset + ", " + (offset + length) + ") outside of " + rowCount + " rows");
    }
    byte[] bitmap = new byte[bitmapLength(length)];
    for (int i = 0; i < length; i++) {
      if (isNull(offset + i)) {
        bitmap[i >>> 3] |= (byte) (1 << (i & 7));
      }
    }
    if (offsets != null) {
      int start = offsets[offset];
      int[] sliceOffsets = new int[length + 1];
      for (int i = 0; i <= length; i++) {
        sliceOffsets[i] = offsets[offset + i] - start;
      }
      byte[] bytes = Arrays.copyOfRange(values, start, offsets[offset + length]);
      return plainStrings(spec, length, bitmap, sliceOffsets, bytes);
    }
    int width = spec.getWireWidth();
    if (dictionary == null) {
      byte[] sliceValues = Arrays.copyOfRange(values, offset * width, (offset + length) * width);
      return fixedWidth(spec, length, bitmap, sliceValues);
    }
    byte[] codes = new byte[length * width];
    Map<Integer, Integer> remap = new HashMap<>();
    List<String> sliceDictionary = new ArrayList<>();
    for (int i = 0; i < length; i++) {
      if (isNull(offset + i)) {
        continue;
      }
      int code = (int) readLittleEndian(values, offset + i, width);
      Integer newCode = remap.get(code);
      if (newCode == null) {
        newCode = sliceDictionary.size();
        remap.put(code, newCode);
        sliceDictionary.add(dictionary.get(code));
      }
      writeLittleEndian(codes, i, width, newCode);
    }
    return dictionary(spec, length, bitmap, codes, sliceDictionary);
  }

  /** Reads the {@code index}-th little-endian value of {@code width} bytes, sign-extended. */
  public static long readLittleEndian(byte[] buffer, int index, int width) {
    int base = index * width;
    long value = 0;
    for (int b = width - 1; b >= 0; b--) {
      value = (value << 8) | (buffer[base + b] & 0xFFL);
    }
    int unusedBits = Long.SIZE - width * Byte.SIZE;
    return unusedBits == 0 ? value : (value << unusedBits) >> unusedBits;
  }

  /** Writes the low {@code width} bytes of {@code value} little-endian at slot {@code index}. */
  public static void writeLittleEndian(byte[] buffer, int index, int width, long value) {
    int base = index * width;
    for (int b = 0; b < width; b++) {
      buffer[base + b] = (byte) (value >>> (b * Byte.SIZE));
    }
  }

  @Override
  public String toString() {
    return "EncodedColumn(" + spec.getName() + ", rows=" + rowCount + ")";
  }
}
