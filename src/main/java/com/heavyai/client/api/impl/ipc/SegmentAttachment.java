package com.heavyai.client.api.impl.ipc;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.ReadableByteChannel;

/** A locally attached memory segment. Closing it detaches the segment. */
public interface SegmentAttachment extends Closeable {

  /** Channel over the segment's bytes, from its base address up to {@link #size()}. */
  ReadableByteChannel channel();

  long size();

  /** Detaches the segment. Calling it more than once has no further effect. */
  @Override
  void close() throws IOException;
}
