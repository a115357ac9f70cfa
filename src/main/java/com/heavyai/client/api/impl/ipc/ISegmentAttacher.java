package com.heavyai.client.api.impl.ipc;

import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.model.core.ResultDescriptor;

/**
 * Attaches the memory segment a result descriptor names. One attacher serves one device type; the
 * resolver detaches every attachment before returning.
 */
public interface ISegmentAttacher {

  /**
   * Attaches the descriptor's segment for reading.
   *
   * @throws HeavyClientException if the segment cannot be attached
   */
  SegmentAttachment attach(ResultDescriptor descriptor) throws HeavyClientException;
}
