package com.heavyai.client.common.util;

import static org.junit.jupiter.api.Assertions.*;

import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.model.core.ColumnEncoding;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampMicroVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for ArrowUtil. */
public class ArrowUtilTest {

  private BufferAllocator allocator;

  @BeforeEach
  void setUp() {
    allocator = new RootAllocator();
  }

  @AfterEach
  void tearDown() {
    allocator.close();
  }

  @Test
  void testToArrowSchema() {
    Schema schema =
        ArrowUtil.toArrowSchema(
            Arrays.asList(
                ColumnSpec.builder("id", ColumnType.INT).withNullable(false).build(),
                ColumnSpec.builder("name", ColumnType.STR).build(),
                ColumnSpec.builder("ts", ColumnType.TIMESTAMP).withPrecision(6).build(),
                ColumnSpec.builder("amount", ColumnType.DECIMAL).withScale(2).build()));

    assertEquals(4, schema.getFields().size());
    Field id = schema.getFields().get(0);
    assertEquals("id", id.getName());
    assertFalse(id.isNullable());
    assertEquals(new ArrowType.Int(32, true), id.getType());
    assertEquals(ArrowType.Utf8.INSTANCE, schema.getFields().get(1).getType());
    assertEquals(
        new ArrowType.Timestamp(TimeUnit.MICROSECOND, null), schema.getFields().get(2).getType());
    assertEquals(new ArrowType.Decimal(18, 2, 128), schema.getFields().get(3).getType());
  }

  @Test
  void testToColumnSpec() throws TypeMismatchException {
    ColumnSpec text = ArrowUtil.toColumnSpec(field("s", ArrowType.Utf8.INSTANCE));
    ColumnSpec date = ArrowUtil.toColumnSpec(field("d", new ArrowType.Date(DateUnit.DAY)));
    ColumnSpec timestamp =
        ArrowUtil.toColumnSpec(field("t", new ArrowType.Timestamp(TimeUnit.NANOSECOND, "UTC")));
    ColumnSpec bigint = ArrowUtil.toColumnSpec(field("b", new ArrowType.Int(64, true)));

    assertEquals(ColumnType.STR, text.getType());
    assertEquals(ColumnEncoding.DICT, text.getEncoding());
    assertEquals(32, text.getCompParam());
    assertEquals(ColumnType.DATE, date.getType());
    assertEquals(ColumnEncoding.DAYS, date.getEncoding());
    assertEquals(9, timestamp.getPrecision());
    assertEquals(ColumnType.BIGINT, bigint.getType());
  }

  @Test
  void testToColumnSpecTreatsDictionaryFieldsAsText() throws TypeMismatchException {
    Field field =
        new Field(
            "city",
            new FieldType(
                true, new ArrowType.Int(32, true), new DictionaryEncoding(1L, false, null)),
            null);

    ColumnSpec spec = ArrowUtil.toColumnSpec(field);

    assertEquals(ColumnType.STR, spec.getType());
    assertTrue(spec.isDictionaryEncoded());
  }

  @Test
  void testToColumnSpecRejectsUnsupportedType() {
    Field field = field("blob", ArrowType.Binary.INSTANCE);

    assertThrows(TypeMismatchException.class, () -> ArrowUtil.toColumnSpec(field));
  }

  @Test
  void testReadValue() {
    try (DateDayVector days = new DateDayVector("d", allocator);
        TimeStampMicroVector micros = new TimeStampMicroVector("t", allocator);
        VarCharVector text = new VarCharVector("s", allocator)) {
      days.allocateNew(2);
      days.set(0, 19_783);
      days.setNull(1);
      days.setValueCount(2);
      micros.allocateNew(1);
      micros.set(0, 1_500_000L);
      micros.setValueCount(1);
      text.allocateNew(1);
      text.set(0, "héllo".getBytes(java.nio.charset.StandardCharsets.UTF_8));
      text.setValueCount(1);

      assertEquals(LocalDate.of(2024, 3, 1), ArrowUtil.readValue(days, 0));
      assertNull(ArrowUtil.readValue(days, 1));
      assertEquals(
          LocalDateTime.of(1970, 1, 1, 0, 0, 1, 500_000_000), ArrowUtil.readValue(micros, 0));
      assertEquals("héllo", ArrowUtil.readValue(text, 0));
    }
  }

  @Test
  void testWriteStreamIsReadable() throws SQLException, IOException {
    byte[] stream;
    try (IntVector ids = new IntVector("id", allocator)) {
      ids.allocateNew(3);
      ids.set(0, 1);
      ids.setNull(1);
      ids.set(2, 3);
      ids.setValueCount(3);
      VectorSchemaRoot root = VectorSchemaRoot.of(ids);
      stream = ArrowUtil.writeStream(root);
    }

    try (ArrowStreamReader reader =
        new ArrowStreamReader(new ByteArrayInputStream(stream), allocator)) {
      assertTrue(reader.loadNextBatch());
      VectorSchemaRoot read = reader.getVectorSchemaRoot();
      assertEquals(3, read.getRowCount());
      assertEquals(1, ArrowUtil.readValue(read.getVector("id"), 0));
      assertNull(ArrowUtil.readValue(read.getVector("id"), 1));
      assertFalse(reader.loadNextBatch());
    }
  }

  // ==================== Helper Methods ====================

  private static Field field(String name, ArrowType type) {
    return new Field(name, FieldType.nullable(type), null);
  }
}
