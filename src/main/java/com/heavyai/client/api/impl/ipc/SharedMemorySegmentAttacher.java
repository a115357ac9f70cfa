package com.heavyai.client.api.impl.ipc;

import com.heavyai.client.exception.TransportFailureException;
import com.heavyai.client.exception.TransportFailureException.Phase;
import com.heavyai.client.exception.UnsupportedTransportException;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ResultDescriptor;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Attaches CPU shared-memory segments through the file system view of POSIX shared memory. The
 * descriptor's segment handle is the object name given to {@code shm_open}, which Linux exposes as
 * a file of the same name under {@code /dev/shm}.
 */
public class SharedMemorySegmentAttacher implements ISegmentAttacher {

  private static final HeavyLogger LOGGER =
      HeavyLoggerFactory.getLogger(SharedMemorySegmentAttacher.class);

  private final Path shmDirectory;

  public SharedMemorySegmentAttacher(Path shmDirectory) {
    this.shmDirectory = shmDirectory;
  }

  @Override
  public SegmentAttachment attach(ResultDescriptor descriptor)
      throws UnsupportedTransportException, TransportFailureException {
    Path path = shmDirectory.resolve(segmentName(descriptor));
    long size = descriptor.getSegmentSize();
    FileChannel channel;
    try {
      channel = FileChannel.open(path, StandardOpenOption.READ);
    } catch (IOException e) {
      LOGGER.error("Failed to attach shared memory segment {}: {}", path, e.getMessage(), e);
      throw new TransportFailureException(Phase.FETCH, e);
    }
    try {
      long available = channel.size();
      if (available < size) {
        throw new IOException(
            String.format(
                "Shared memory segment %s holds %d bytes, the result needs %d",
                path, available, size));
      }
    } catch (IOException e) {
      closeQuietly(channel, path);
      LOGGER.error(e.getMessage(), e);
      throw new TransportFailureException(Phase.FETCH, e);
    }
    LOGGER.debug("Attached shared memory segment {} ({} bytes)", path, size);
    return new FileSegmentAttachment(path, channel, size);
  }

  static String segmentName(ResultDescriptor descriptor) throws UnsupportedTransportException {
    byte[] handle = descriptor.getSegmentHandle();
    String name = handle == null ? "" : new String(handle, StandardCharsets.UTF_8).trim();
    while (name.startsWith("/")) {
      name = name.substring(1);
    }
    if (name.isEmpty() || name.contains("/") || name.indexOf('\0') >= 0) {
      throw new UnsupportedTransportException(
          "Result " + descriptor.getResultId() + " does not name a valid shared memory segment");
    }
    return name;
  }

  private static void closeQuietly(FileChannel channel, Path path) {
    try {
      channel.close();
    } catch (IOException e) {
      LOGGER.warn("Failed to close shared memory segment {}: {}", path, e.getMessage());
    }
  }

  private static final class FileSegmentAttachment implements SegmentAttachment {
    private final Path path;
    private final FileChannel fileChannel;
    private final ReadableByteChannel channel;
    private final long size;

    private FileSegmentAttachment(Path path, FileChannel fileChannel, long size) {
      this.path = path;
      this.fileChannel = fileChannel;
      this.channel = new BoundedReadableChannel(fileChannel, size);
      this.size = size;
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
      if (fileChannel.isOpen()) {
        fileChannel.close();
        LOGGER.debug("Detached shared memory segment {}", path);
      }
    }
  }
}
