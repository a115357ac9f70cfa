package com.heavyai.client.api.impl.ipc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.UnsupportedTransportException;
import com.heavyai.client.model.core.DeviceType;
import com.heavyai.client.model.core.ResultDescriptor;
import com.heavyai.client.model.core.TransportMode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Unit tests for TransportResolver. */
@ExtendWith(MockitoExtension.class)
public class TransportResolverTest {

  @TempDir Path shmDirectory;
  @Mock private ISegmentAttacher gpuAttacher;

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
  void testResolveInlineResult() throws Exception {
    ResultDescriptor descriptor =
        ResultDescriptor.builder()
            .withResultId("r1")
            .withInlinePayload(ArrowStreams.intStream(allocator, "n", new int[] {1, 2, 3}))
            .withTimings(12, 3)
            .build();

    try (RetrievedTable table = resolver().resolve(descriptor, TransportMode.WIRE)) {
      assertEquals(3, table.getRowCount());
      assertEquals(Collections.singletonList("n"), table.getColumnNames());
      assertEquals(TransportMode.WIRE, table.getTransportMode());
      assertEquals(12, table.getExecutionTimeMs());
      assertSame(descriptor, table.getDescriptor());
    }
  }

  @Test
  void testResolveInlineResultWithoutPayload() {
    ResultDescriptor descriptor =
        ResultDescriptor.builder().withResultId("r1").withInlinePayload(null).build();

    HeavyClientException e =
        assertThrows(
            HeavyClientException.class, () -> resolver().resolve(descriptor, TransportMode.WIRE));
    assertEquals(HeavyClientErrorCode.ARROW_PARSING_ERROR, e.getClientErrorCode());
  }

  @Test
  void testResolveSharedMemoryResult() throws Exception {
    byte[] stream = ArrowStreams.intStream(allocator, "n", new int[] {4, 5});
    byte[] padded = Arrays.copyOf(stream, stream.length + 64);
    Files.write(shmDirectory.resolve("heavy_result_7"), padded);
    ResultDescriptor descriptor =
        ResultDescriptor.builder()
            .withResultId("r7")
            .withSegment("/heavy_result_7".getBytes(StandardCharsets.UTF_8), stream.length)
            .build();

    try (RetrievedTable table = resolver().resolve(descriptor, TransportMode.SHARED_MEMORY)) {
      assertEquals(2, table.getRowCount());
      assertEquals(5, table.getObject(1, "n"));
      assertEquals(TransportMode.SHARED_MEMORY, table.getTransportMode());
    }
  }

  @Test
  void testResolveGpuResultThroughRegisteredAttacher() throws Exception {
    byte[] stream = ArrowStreams.intStream(allocator, "n", new int[] {42});
    TrackingAttachment attachment = new TrackingAttachment(stream, false);
    ResultDescriptor descriptor = gpuDescriptor(stream.length);
    when(gpuAttacher.attach(descriptor)).thenReturn(attachment);
    Map<DeviceType, ISegmentAttacher> attachers = new EnumMap<>(DeviceType.class);
    attachers.put(DeviceType.GPU, gpuAttacher);

    TransportResolver resolver = new TransportResolver(decoder, attachers);

    try (RetrievedTable table = resolver.resolve(descriptor, TransportMode.SHARED_MEMORY)) {
      assertEquals(42, table.getObject(0, 0));
    }
    assertEquals(1, attachment.closeCount);
  }

  @Test
  void testDecodeFailureStillDetaches() throws Exception {
    TrackingAttachment attachment = new TrackingAttachment(new byte[0], false);
    ResultDescriptor descriptor = gpuDescriptor(0);
    when(gpuAttacher.attach(descriptor)).thenReturn(attachment);

    assertThrows(
        HeavyClientException.class,
        () ->
            new TransportResolver(decoder, Collections.singletonMap(DeviceType.GPU, gpuAttacher))
                .resolve(descriptor, TransportMode.SHARED_MEMORY));
    assertEquals(1, attachment.closeCount);
  }

  @Test
  void testDetachFailureIsOnlyLogged() throws Exception {
    byte[] stream = ArrowStreams.intStream(allocator, "n", new int[] {1});
    TrackingAttachment attachment = new TrackingAttachment(stream, true);
    ResultDescriptor descriptor = gpuDescriptor(stream.length);
    when(gpuAttacher.attach(descriptor)).thenReturn(attachment);

    try (RetrievedTable table =
        new TransportResolver(decoder, Collections.singletonMap(DeviceType.GPU, gpuAttacher))
            .resolve(descriptor, TransportMode.SHARED_MEMORY)) {
      assertEquals(1, table.getRowCount());
    }
    assertEquals(1, attachment.closeCount);
  }

  @Test
  void testMissingAttacherIsUnsupported() {
    ResultDescriptor descriptor = gpuDescriptor(16);

    assertThrows(
        UnsupportedTransportException.class,
        () -> resolver().resolve(descriptor, TransportMode.SHARED_MEMORY));
  }

  @Test
  void testRequestedModeMustMatchDescriptor() throws Exception {
    ResultDescriptor descriptor =
        ResultDescriptor.builder()
            .withResultId("r1")
            .withInlinePayload(ArrowStreams.intStream(allocator, "n", new int[] {1}))
            .build();

    assertThrows(
        UnsupportedTransportException.class,
        () -> resolver().resolve(descriptor, TransportMode.SHARED_MEMORY));
    assertThrows(UnsupportedTransportException.class, () -> resolver().resolve(descriptor, null));
  }

  // ==================== Helper Methods ====================

  private TransportResolver resolver() {
    return new TransportResolver(
        decoder,
        Collections.singletonMap(DeviceType.CPU, new SharedMemorySegmentAttacher(shmDirectory)));
  }

  private static ResultDescriptor gpuDescriptor(long size) {
    return ResultDescriptor.builder()
        .withResultId("gpu-1")
        .withDevice(DeviceType.GPU, 1)
        .withSegment(new byte[] {1, 2, 3, 4}, size)
        .build();
  }

  private static final class TrackingAttachment implements SegmentAttachment {
    private final ReadableByteChannel channel;
    private final long size;
    private final boolean failOnClose;
    private int closeCount;

    private TrackingAttachment(byte[] bytes, boolean failOnClose) {
      this.channel = Channels.newChannel(new ByteArrayInputStream(bytes));
      this.size = bytes.length;
      this.failOnClose = failOnClose;
    }

    @Override
    public ReadableByteChannel channel() {
      return channel;
    }

    @Override
    public long size() {
      return size;
    }

    @Override
    public void close() throws IOException {
      closeCount++;
      if (failOnClose) {
        throw new IOException("segment busy");
      }
    }
  }
}
