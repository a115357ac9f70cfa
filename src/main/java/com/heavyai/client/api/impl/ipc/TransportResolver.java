package com.heavyai.client.api.impl.ipc;

import com.google.common.annotations.VisibleForTesting;
import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.UnsupportedTransportException;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.DeviceType;
import com.heavyai.client.model.core.ResultDescriptor;
import com.heavyai.client.model.core.TransportMode;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Turns a result descriptor into a decoded table.
 *
 * <p>Inline results are decoded from the descriptor's payload. Segment results are attached with
 * the attacher registered for the descriptor's device type, decoded, and detached before {@link
 * #resolve} returns, on success and on failure. A failed detach is logged and does not affect the
 * outcome of the call.
 */
public class TransportResolver {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(TransportResolver.class);

  private final ArrowStreamDecoder decoder;
  private final Map<DeviceType, ISegmentAttacher> attachers;

  public TransportResolver(
      ArrowStreamDecoder decoder, Map<DeviceType, ISegmentAttacher> attachers) {
    this.decoder = decoder;
    this.attachers = new EnumMap<>(DeviceType.class);
    this.attachers.putAll(attachers);
  }

  /**
   * Retrieves the result a descriptor stands for.
   *
   * @param descriptor the descriptor returned by the query call
   * @param transportMode the transport the caller requested
   * @return the decoded table, tagged with {@code descriptor}
   * @throws UnsupportedTransportException if the mode is missing, differs from the descriptor's,
   *     or names a segment on a device with no registered attacher
   */
  public RetrievedTable resolve(ResultDescriptor descriptor, TransportMode transportMode)
      throws HeavyClientException {
    if (transportMode == null) {
      throw unsupported(
          "A transport mode is required to retrieve result " + descriptor.getResultId());
    }
    if (descriptor.getTransportMode() != transportMode) {
      throw unsupported(
          String.format(
              "Requested %s transport but result %s was returned over %s",
              transportMode, descriptor.getResultId(), descriptor.getTransportMode()));
    }
    VectorSchemaRoot root;
    switch (transportMode) {
      case WIRE:
        root = decodeInline(descriptor);
        break;
      case SHARED_MEMORY:
        root = decodeSegment(descriptor);
        break;
      default:
        throw unsupported("Unsupported transport " + transportMode);
    }
    LOGGER.debug("Retrieved result {}: {} rows", descriptor.getResultId(), root.getRowCount());
    return new RetrievedTable(root, descriptor);
  }

  private VectorSchemaRoot decodeInline(ResultDescriptor descriptor) throws HeavyClientException {
    byte[] payload = descriptor.getInlinePayload();
    if (payload == null) {
      throw new HeavyClientException(
          "Result " + descriptor.getResultId() + " carries no inline Arrow stream",
          HeavyClientErrorCode.ARROW_PARSING_ERROR);
    }
    return decoder.decode(payload);
  }

  private VectorSchemaRoot decodeSegment(ResultDescriptor descriptor) throws HeavyClientException {
    ISegmentAttacher attacher = attachers.get(descriptor.getDeviceType());
    if (attacher == null) {
      throw unsupported(
          "No memory segment attacher is registered for "
              + descriptor.getDeviceType()
              + " results");
    }
    SegmentAttachment attachment = attacher.attach(descriptor);
    try {
      return decoder.decode(attachment.channel());
    } finally {
      detach(descriptor, attachment);
    }
  }

  @VisibleForTesting
  static void detach(ResultDescriptor descriptor, SegmentAttachment attachment) {
    try {
      attachment.close();
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Failed to detach memory segment of result {}: {}",
          descriptor.getResultId(),
          e.getMessage(),
          e);
    }
  }

  private static UnsupportedTransportException unsupported(String message) {
    LOGGER.error(message);
    return new UnsupportedTransportException(message);
  }
}
