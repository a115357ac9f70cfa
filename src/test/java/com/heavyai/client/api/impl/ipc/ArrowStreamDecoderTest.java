package com.heavyai.client.api.impl.ipc;

import static org.junit.jupiter.api.Assertions.*;

import com.heavyai.client.common.util.ArrowUtil;
import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for ArrowStreamDecoder. */
public class ArrowStreamDecoderTest {

  private BufferAllocator allocator;
  private ArrowStreamDecoder decoder;

  @BeforeEach
  void setUp() {
    allocator = new RootAllocator();
    decoder = new ArrowStreamDecoder(allocator);
  }

  @AfterEach
  void tearDown() {
    allocator.close();
  }

  @Test
  void testDecodeSingleBatch() throws Exception {
    byte[] stream = ArrowStreams.intStream(allocator, "n", new int[] {7, 8, 9});

    try (VectorSchemaRoot root = decoder.decode(stream)) {
      assertEquals(3, root.getRowCount());
      assertEquals(9, ArrowUtil.readValue(root.getVector("n"), 2));
    }
  }

  @Test
  void testDecodeConcatenatesBatchesInOrder() throws Exception {
    byte[] stream =
        ArrowStreams.intStream(allocator, "n", new int[] {1, 2}, new int[] {3}, new int[] {4, 5});

    try (VectorSchemaRoot root = decoder.decode(stream)) {
      assertEquals(5, root.getRowCount());
      for (int i = 0; i < 5; i++) {
        assertEquals(i + 1, ArrowUtil.readValue(root.getVector("n"), i));
      }
    }
    assertEquals(0, allocator.getAllocatedMemory());
  }

  @Test
  void testDecodeReplacesDictionaryColumns() throws Exception {
    byte[] stream = ArrowStreams.dictionaryStream(allocator, "city", "Oslo", "Lima", "Oslo");

    try (VectorSchemaRoot root = decoder.decode(stream)) {
      assertEquals(3, root.getRowCount());
      assertTrue(root.getVector("city") instanceof VarCharVector);
      assertNull(root.getSchema().getFields().get(0).getDictionary());
      assertEquals("Oslo", ArrowUtil.readValue(root.getVector("city"), 0));
      assertEquals("Lima", ArrowUtil.readValue(root.getVector("city"), 1));
      assertEquals("Oslo", ArrowUtil.readValue(root.getVector("city"), 2));
    }
  }

  @Test
  void testDecodeStreamWithoutBatches() throws Exception {
    byte[] stream = ArrowStreams.intStream(allocator, "n");

    try (VectorSchemaRoot root = decoder.decode(stream)) {
      assertEquals(0, root.getRowCount());
      assertEquals("n", root.getSchema().getFields().get(0).getName());
    }
  }

  @Test
  void testDecodeEmptyInputFails() {
    HeavyClientException e =
        assertThrows(HeavyClientException.class, () -> decoder.decode(new byte[0]));
    assertEquals(HeavyClientErrorCode.ARROW_PARSING_ERROR, e.getClientErrorCode());
  }
}
