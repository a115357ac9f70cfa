package com.heavyai.client.api.impl.ipc;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;

/**
 * Reads at most {@code limit} bytes from a delegate channel, then reports end of stream. Closing
 * this channel leaves the delegate open; its owner closes it.
 */
class BoundedReadableChannel implements ReadableByteChannel {

  private final ReadableByteChannel delegate;
  private long remaining;
  private boolean closed;

  BoundedReadableChannel(ReadableByteChannel delegate, long limit) {
    this.delegate = delegate;
    this.remaining = limit;
  }

  @Override
  public int read(ByteBuffer dst) throws IOException {
    if (closed) {
      throw new ClosedChannelException();
    }
    if (remaining <= 0) {
      return -1;
    }
    int read;
    if (dst.remaining() > remaining) {
      ByteBuffer slice = dst.slice();
      slice.limit((int) remaining);
      read = delegate.read(slice);
      if (read > 0) {
        dst.position(dst.position() + read);
      }
    } else {
      read = delegate.read(dst);
    }
    if (read > 0) {
      remaining -= read;
    }
    return read;
  }

  @Override
  public boolean isOpen() {
    return !closed && delegate.isOpen();
  }

  @Override
  public void close() {
    closed = true;
  }
}
