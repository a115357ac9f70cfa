package com.heavyai.client.api;

import com.google.common.annotations.VisibleForTesting;
import com.heavyai.client.api.impl.ipc.ArrowStreamDecoder;
import com.heavyai.client.api.impl.ipc.ISegmentAttacher;
import com.heavyai.client.api.impl.ipc.ReleaseTracker;
import com.heavyai.client.api.impl.ipc.RetrievedTable;
import com.heavyai.client.api.impl.ipc.SharedMemorySegmentAttacher;
import com.heavyai.client.api.impl.ipc.TransportResolver;
import com.heavyai.client.api.impl.load.LoadPipeline;
import com.heavyai.client.api.internal.IHeavyConnectionContext;
import com.heavyai.client.dbclient.HeavyRpcException;
import com.heavyai.client.dbclient.IHeavyClient;
import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.TransportFailureException;
import com.heavyai.client.exception.TransportFailureException.Phase;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.DeviceType;
import com.heavyai.client.model.core.LoadOptions;
import com.heavyai.client.model.core.ResultDescriptor;
import com.heavyai.client.model.core.TabularData;
import com.heavyai.client.model.core.TransportMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;

/** Default {@link IHeavyConnection}, bound to one RPC session. */
public class HeavyConnection implements IHeavyConnection {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(HeavyConnection.class);

  private final IHeavyConnectionContext connectionContext;
  private final IHeavyClient client;
  private final BufferAllocator allocator;
  private final LoadPipeline loadPipeline;
  private final TransportResolver transportResolver;
  private final ReleaseTracker releaseTracker;
  private volatile boolean closed;

  public HeavyConnection(IHeavyConnectionContext connectionContext, IHeavyClient client) {
    this(connectionContext, client, Collections.emptyMap());
  }

  /**
   * Creates a connection with extra memory segment attachers, e.g. one for {@link DeviceType#GPU}.
   * CPU segments are attached through {@link IHeavyConnectionContext#getShmDirectory()} unless
   * {@code segmentAttachers} registers another CPU attacher.
   */
  public HeavyConnection(
      IHeavyConnectionContext connectionContext,
      IHeavyClient client,
      Map<DeviceType, ISegmentAttacher> segmentAttachers) {
    this(connectionContext, client, new RootAllocator(), segmentAttachers);
  }

  @VisibleForTesting
  HeavyConnection(
      IHeavyConnectionContext connectionContext,
      IHeavyClient client,
      BufferAllocator allocator,
      Map<DeviceType, ISegmentAttacher> segmentAttachers) {
    this.connectionContext = connectionContext;
    this.client = client;
    this.allocator = allocator;
    this.loadPipeline =
        new LoadPipeline(
            client,
            allocator,
            connectionContext.getChunkSizeBytes(),
            connectionContext.isArrowLoadEnabled());
    Map<DeviceType, ISegmentAttacher> attachers = new EnumMap<>(DeviceType.class);
    attachers.put(
        DeviceType.CPU, new SharedMemorySegmentAttacher(connectionContext.getShmDirectory()));
    attachers.putAll(segmentAttachers);
    this.transportResolver = new TransportResolver(new ArrowStreamDecoder(allocator), attachers);
    this.releaseTracker = new ReleaseTracker(client);
    LOGGER.debug("Opened connection {}", connectionContext);
  }

  // ==================== Load ====================

  @Override
  public void createTable(String tableName, TabularData data) throws HeavyClientException {
    ensureOpen();
    loadPipeline.createTable(tableName, data);
  }

  @Override
  public void loadTable(String tableName, TabularData data) throws HeavyClientException {
    loadTable(tableName, data, LoadOptions.defaults());
  }

  @Override
  public void loadTable(String tableName, TabularData data, LoadOptions options)
      throws HeavyClientException {
    ensureOpen();
    loadPipeline.load(tableName, data, options);
  }

  @Override
  public void loadTableRowwise(String tableName, TabularData data) throws HeavyClientException {
    loadTableRowwise(tableName, data, Collections.emptyList());
  }

  @Override
  public void loadTableRowwise(String tableName, TabularData data, List<String> columnNames)
      throws HeavyClientException {
    ensureOpen();
    loadPipeline.loadRowWise(tableName, data, columnNames);
  }

  @Override
  public void loadTableColumnar(String tableName, TabularData data) throws HeavyClientException {
    loadTableColumnar(tableName, data, LoadOptions.defaults());
  }

  @Override
  public void loadTableColumnar(String tableName, TabularData data, LoadOptions options)
      throws HeavyClientException {
    ensureOpen();
    loadPipeline.loadColumnar(tableName, data, options);
  }

  @Override
  public void loadTableArrow(String tableName, TabularData data) throws HeavyClientException {
    loadTableArrow(tableName, data, Collections.emptyList());
  }

  @Override
  public void loadTableArrow(String tableName, TabularData data, List<String> loadColumnNames)
      throws HeavyClientException {
    ensureOpen();
    loadPipeline.loadArrow(tableName, data, loadColumnNames);
  }

  // ==================== Fetch ====================

  @Override
  public RetrievedTable selectIpc(String sql) throws HeavyClientException {
    return selectIpc(
        sql,
        connectionContext.getFirstN(),
        connectionContext.isReleaseMemory(),
        connectionContext.getTransportMode());
  }

  @Override
  public RetrievedTable selectIpc(
      String sql, int firstN, boolean releaseMemory, TransportMode transport)
      throws HeavyClientException {
    return fetch(sql, DeviceType.CPU, 0, firstN, releaseMemory, transport);
  }

  @Override
  public RetrievedTable selectIpcGpu(String sql) throws HeavyClientException {
    return selectIpcGpu(
        sql,
        connectionContext.getDeviceId(),
        connectionContext.getFirstN(),
        connectionContext.isReleaseMemory());
  }

  @Override
  public RetrievedTable selectIpcGpu(String sql, int deviceId, int firstN, boolean releaseMemory)
      throws HeavyClientException {
    return fetch(sql, DeviceType.GPU, deviceId, firstN, releaseMemory, TransportMode.SHARED_MEMORY);
  }

  private RetrievedTable fetch(
      String sql,
      DeviceType deviceType,
      int deviceId,
      int firstN,
      boolean releaseMemory,
      TransportMode transport)
      throws HeavyClientException {
    ensureOpen();
    String query = sql.strip();
    ResultDescriptor descriptor;
    try {
      descriptor = client.executeQueryForResult(query, deviceType, deviceId, firstN, transport);
    } catch (HeavyRpcException e) {
      LOGGER.error("Query execution failed: {}", e.getMessage(), e);
      throw new TransportFailureException(Phase.FETCH, e);
    }
    LOGGER.debug(
        "Query executed in {} ms, Arrow conversion took {} ms: {}",
        descriptor.getExecutionTimeMs(),
        descriptor.getArrowConversionTimeMs(),
        descriptor);

    RetrievedTable table;
    try {
      table = transportResolver.resolve(descriptor, transport);
    } catch (HeavyClientException e) {
      deallocateAfterFailedFetch(descriptor);
      throw e;
    }
    if (releaseMemory && descriptor.getTransportMode() == TransportMode.SHARED_MEMORY) {
      try {
        releaseTracker.release(table);
      } catch (HeavyClientException e) {
        table.close();
        throw e;
      }
    }
    return table;
  }

  /** Frees the server result of a fetch whose table was never handed out. */
  private void deallocateAfterFailedFetch(ResultDescriptor descriptor) {
    try {
      client.deallocateResult(descriptor, descriptor.getDeviceType(), descriptor.getDeviceId());
    } catch (HeavyRpcException e) {
      LOGGER.warn(
          "Failed to release result {} after a failed fetch: {}",
          descriptor.getResultId(),
          e.getMessage(),
          e);
    }
  }

  // ==================== Release ====================

  @Override
  public void deallocate(RetrievedTable table) throws HeavyClientException {
    ensureOpen();
    releaseTracker.release(table);
  }

  @Override
  public void deallocate(RetrievedTable table, int deviceId) throws HeavyClientException {
    ensureOpen();
    releaseTracker.release(table, deviceId);
  }

  // ==================== Metadata ====================

  @Override
  public List<String> getTables() throws HeavyClientException {
    ensureOpen();
    try {
      return client.getTableList();
    } catch (HeavyRpcException e) {
      LOGGER.error("Metadata request failed: {}", e.getMessage(), e);
      throw new TransportFailureException(Phase.METADATA, e);
    }
  }

  @Override
  public List<ColumnSpec> getTableDetails(String tableName) throws HeavyClientException {
    ensureOpen();
    try {
      return client.getColumnSpecs(tableName);
    } catch (HeavyRpcException e) {
      LOGGER.error("Metadata request failed: {}", e.getMessage(), e);
      throw new TransportFailureException(Phase.METADATA, e);
    }
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() throws HeavyClientException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      allocator.close();
    } catch (IllegalStateException e) {
      LOGGER.error("Connection closed with retrieved tables still open: {}", e.getMessage(), e);
      throw new HeavyClientException(
          "Connection closed with retrieved tables still open; close them first",
          e,
          HeavyClientErrorCode.TABLES_STILL_OPEN);
    }
    LOGGER.debug("Closed connection {}", connectionContext);
  }

  private void ensureOpen() throws HeavyClientException {
    if (closed) {
      throw new HeavyClientException(
          "Connection is closed", HeavyClientErrorCode.CONNECTION_CLOSED);
    }
  }
}
