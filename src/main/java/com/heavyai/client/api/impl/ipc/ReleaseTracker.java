package com.heavyai.client.api.impl.ipc;

import com.heavyai.client.dbclient.HeavyRpcException;
import com.heavyai.client.dbclient.IHeavyClient;
import com.heavyai.client.exception.AlreadyReleasedException;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.NoDescriptorException;
import com.heavyai.client.exception.TransportFailureException;
import com.heavyai.client.exception.TransportFailureException.Phase;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ResultDescriptor;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Releases server results exactly once.
 *
 * <p>The tracker remembers the id of every result it has released. Releasing a result a second
 * time, for CPU and GPU results alike, fails with {@link AlreadyReleasedException} without
 * contacting the server. A release whose RPC call fails is not recorded, so it may be retried.
 *
 * <p>Release is never implicit: closing or discarding a table leaves its server result allocated
 * until it is released or the session ends.
 */
public class ReleaseTracker {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(ReleaseTracker.class);

  private final IHeavyClient client;
  private final Set<String> releasedResultIds = ConcurrentHashMap.newKeySet();

  public ReleaseTracker(IHeavyClient client) {
    this.client = client;
  }

  /** Releases the table's server result on the device it was produced on. */
  public void release(RetrievedTable table) throws HeavyClientException {
    release(table, null);
  }

  /**
   * Releases the table's server result.
   *
   * @param deviceId device to release on, or null for the descriptor's own device
   * @throws NoDescriptorException if the table was not produced by a fetch
   * @throws AlreadyReleasedException if the result was released before
   */
  public void release(RetrievedTable table, Integer deviceId) throws HeavyClientException {
    ResultDescriptor descriptor = table.getDescriptor();
    if (descriptor == null) {
      String message = "Table was not produced by a fetch and has no server result to release";
      LOGGER.error(message);
      throw new NoDescriptorException(message);
    }
    String resultId = descriptor.getResultId();
    if (!releasedResultIds.add(resultId)) {
      LOGGER.warn("Result {} was already released", resultId);
      throw new AlreadyReleasedException(resultId);
    }
    int targetDevice = deviceId != null ? deviceId : descriptor.getDeviceId();
    try {
      client.deallocateResult(descriptor, descriptor.getDeviceType(), targetDevice);
    } catch (HeavyRpcException e) {
      releasedResultIds.remove(resultId);
      LOGGER.error("Failed to release result {}: {}", resultId, e.getMessage(), e);
      throw new TransportFailureException(Phase.RELEASE, e);
    }
    LOGGER.debug(
        "Released result {} on {} device {}", resultId, descriptor.getDeviceType(), targetDevice);
  }

  public boolean isReleased(RetrievedTable table) {
    ResultDescriptor descriptor = table.getDescriptor();
    return descriptor != null && releasedResultIds.contains(descriptor.getResultId());
  }
}
