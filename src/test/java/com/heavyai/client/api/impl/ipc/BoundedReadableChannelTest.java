package com.heavyai.client.api.impl.ipc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;
import org.junit.jupiter.api.Test;

/** Unit tests for BoundedReadableChannel. */
public class BoundedReadableChannelTest {

  @Test
  void testStopsAtLimit() throws Exception {
    BoundedReadableChannel channel = new BoundedReadableChannel(source(10), 6);
    ByteBuffer buffer = ByteBuffer.allocate(4);

    assertEquals(4, channel.read(buffer));
    buffer.clear();
    assertEquals(2, channel.read(buffer));
    assertEquals(2, buffer.position());
    assertEquals(-1, channel.read(buffer));
  }

  @Test
  void testCloseLeavesDelegateOpen() throws Exception {
    ReadableByteChannel delegate = source(4);
    BoundedReadableChannel channel = new BoundedReadableChannel(delegate, 4);

    channel.close();

    assertFalse(channel.isOpen());
    assertTrue(delegate.isOpen());
    assertThrows(ClosedChannelException.class, () -> channel.read(ByteBuffer.allocate(1)));
  }

  // ==================== Helper Methods ====================

  private static ReadableByteChannel source(int length) {
    return Channels.newChannel(new ByteArrayInputStream(new byte[length]));
  }
}
