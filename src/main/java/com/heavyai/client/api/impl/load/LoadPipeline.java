package com.heavyai.client.api.impl.load;

import com.google.common.annotations.VisibleForTesting;
import com.heavyai.client.dbclient.HeavyRpcException;
import com.heavyai.client.dbclient.IHeavyClient;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.PartialLoadException;
import com.heavyai.client.exception.SchemaMismatchException;
import com.heavyai.client.exception.TableExistsException;
import com.heavyai.client.exception.TransportFailureException;
import com.heavyai.client.exception.TransportFailureException.Phase;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ColumnBatch;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnarFrame;
import com.heavyai.client.model.core.CreateOptions;
import com.heavyai.client.model.core.CreatePolicy;
import com.heavyai.client.model.core.EncodedColumn;
import com.heavyai.client.model.core.LoadOptions;
import com.heavyai.client.model.core.StringRow;
import com.heavyai.client.model.core.TabularData;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.arrow.memory.BufferAllocator;

/**
 * Moves a load source into a server table.
 *
 * <p>A load runs in three steps: strategy selection, which happens before any RPC call; the
 * create policy; and dispatch to one of the Arrow, binary columnar or row-wise strategies.
 * Columnar batches are sent one after the other in row order. Nothing is retried or rolled back:
 * a failure after the first accepted batch surfaces as {@link PartialLoadException} and leaves the
 * table partially loaded.
 *
 * <p>Instances are bound to one session and are not thread-safe.
 */
public class LoadPipeline {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(LoadPipeline.class);
  private static final String ALREADY_EXISTS = "already exists";

  private final IHeavyClient client;
  private final long defaultChunkSizeBytes;
  private final boolean arrowLoadEnabled;
  private final ColumnEncoder encoder;
  private final ChunkPlanner planner;
  private final RowBuilder rowBuilder;
  private final SchemaInference schemaInference;
  private final ArrowPayloadSerializer arrowSerializer;

  public LoadPipeline(
      IHeavyClient client,
      BufferAllocator allocator,
      long defaultChunkSizeBytes,
      boolean arrowLoadEnabled) {
    this(
        client,
        defaultChunkSizeBytes,
        arrowLoadEnabled,
        new ColumnEncoder(),
        new ChunkPlanner(),
        new RowBuilder(),
        new SchemaInference(),
        new ArrowPayloadSerializer(allocator));
  }

  @VisibleForTesting
  LoadPipeline(
      IHeavyClient client,
      long defaultChunkSizeBytes,
      boolean arrowLoadEnabled,
      ColumnEncoder encoder,
      ChunkPlanner planner,
      RowBuilder rowBuilder,
      SchemaInference schemaInference,
      ArrowPayloadSerializer arrowSerializer) {
    this.client = client;
    this.defaultChunkSizeBytes = defaultChunkSizeBytes;
    this.arrowLoadEnabled = arrowLoadEnabled;
    this.encoder = encoder;
    this.planner = planner;
    this.rowBuilder = rowBuilder;
    this.schemaInference = schemaInference;
    this.arrowSerializer = arrowSerializer;
  }

  /**
   * Loads a source into a table, choosing the transfer strategy from the options and the shape of
   * the source.
   */
  public void load(String tableName, TabularData data, LoadOptions options)
      throws HeavyClientException {
    LoadStrategy strategy =
        LoadStrategy.select(options.getMethod(), data.getKind(), arrowLoadEnabled);
    LOGGER.info(
        "Loading {} rows into table {} using the {} strategy",
        data.getRowCount(),
        tableName,
        strategy);

    if (shouldCreate(tableName, options.getCreatePolicy())) {
      createTable(tableName, data);
    }

    switch (strategy) {
      case ARROW:
        loadArrow(tableName, data, options.getTargetColumnNames());
        break;
      case COLUMNAR:
        loadColumnar(tableName, data, options);
        break;
      case ROW_WISE:
      default:
        loadRowWise(tableName, data, options.getTargetColumnNames());
        break;
    }
  }

  /** Creates a table whose columns follow the source's names and types. */
  public void createTable(String tableName, TabularData data) throws HeavyClientException {
    List<ColumnSpec> specs = schemaInference.inferColumnSpecs(data);
    LOGGER.debug("Creating table {} with columns {}", tableName, specs);
    try {
      client.createTable(tableName, specs, CreateOptions.DEFAULT);
    } catch (HeavyRpcException e) {
      String message = e.getMessage() == null ? "" : e.getMessage();
      if (message.toLowerCase(Locale.ROOT).contains(ALREADY_EXISTS)) {
        LOGGER.error("Table {} already exists: {}", tableName, message);
        throw new TableExistsException(message, e);
      }
      throw failure(Phase.CREATE, e);
    }
  }

  /**
   * Loads a source through the binary columnar path: encode against the table's column specs,
   * split into batches within the byte budget and send each batch in order.
   *
   * @throws SchemaMismatchException if the source and the table differ in column count, or a
   *     table column is missing from the source when matching by name
   * @throws PartialLoadException if a batch fails after earlier batches were loaded
   */
  public void loadColumnar(String tableName, TabularData data, LoadOptions options)
      throws HeavyClientException {
    List<ColumnSpec> specs = getColumnSpecs(tableName);
    ColumnarFrame frame = data.toColumnarFrame();
    checkColumnCount(tableName, specs, frame.getColumnCount());

    List<EncodedColumn> encoded = new ArrayList<>(specs.size());
    for (int i = 0; i < specs.size(); i++) {
      ColumnSpec spec = specs.get(i);
      ColumnarFrame.Column column;
      if (options.isColumnNamesFromSchema()) {
        column = frame.findColumn(spec.getName());
        if (column == null) {
          String message =
              "Column " + spec.getName() + " of table " + tableName + " is missing from the source";
          LOGGER.error(message);
          throw new SchemaMismatchException(message);
        }
      } else {
        column = frame.getColumn(i);
      }
      encoded.add(encoder.encode(column, spec));
    }

    long budget =
        options.getChunkSizeBytes() != null ? options.getChunkSizeBytes() : defaultChunkSizeBytes;
    List<ColumnBatch> batches = planner.plan(encoded, budget);
    List<String> targetColumnNames = options.getTargetColumnNames();

    int sent = 0;
    for (ColumnBatch batch : batches) {
      LOGGER.debug(
          "Sending batch {} of {} to {}: rows {} to {}, {} bytes",
          batch.getBatchIndex() + 1,
          batches.size(),
          tableName,
          batch.getRowOffset(),
          batch.getRowOffset() + batch.getRowCount() - 1,
          batch.getSerializedSize());
      try {
        client.loadColumnarBinary(tableName, batch.getColumns(), targetColumnNames);
      } catch (HeavyRpcException e) {
        if (sent == 0) {
          throw failure(Phase.LOAD, e);
        }
        LOGGER.error(
            "Columnar load into {} failed after {} of {} batches; the table is partially loaded",
            tableName,
            sent,
            batches.size(),
            e);
        throw new PartialLoadException(sent, batches.size(), e);
      }
      sent++;
    }
  }

  /** Loads a source as a single Arrow stream. */
  public void loadArrow(String tableName, TabularData data, List<String> targetColumnNames)
      throws HeavyClientException {
    List<ColumnSpec> specs = getColumnSpecs(tableName);
    checkColumnCount(tableName, specs, data.getColumnCount());
    byte[] payload = arrowSerializer.serialize(data, specs);
    LOGGER.debug("Sending {} Arrow stream bytes to {}", payload.length, tableName);
    try {
      client.loadArrowBinary(tableName, payload, targetColumnNames);
    } catch (HeavyRpcException e) {
      throw failure(Phase.LOAD, e);
    }
  }

  /** Loads a source as string rows in one call. */
  public void loadRowWise(String tableName, TabularData data, List<String> targetColumnNames)
      throws HeavyClientException {
    List<StringRow> rows = rowBuilder.buildRows(data.toRows());
    LOGGER.debug("Sending {} rows to {}", rows.size(), tableName);
    try {
      client.loadRowWise(tableName, rows, targetColumnNames);
    } catch (HeavyRpcException e) {
      throw failure(Phase.LOAD, e);
    }
  }

  private boolean shouldCreate(String tableName, CreatePolicy policy) throws HeavyClientException {
    switch (policy) {
      case ALWAYS:
        return true;
      case NEVER:
        return false;
      case INFER:
      default:
        List<String> tables;
        try {
          tables = client.getTableList();
        } catch (HeavyRpcException e) {
          throw failure(Phase.METADATA, e);
        }
        boolean exists = tables.contains(tableName);
        LOGGER.debug("Table {} {}", tableName, exists ? "exists" : "does not exist, creating it");
        return !exists;
    }
  }

  private List<ColumnSpec> getColumnSpecs(String tableName) throws TransportFailureException {
    try {
      return client.getColumnSpecs(tableName);
    } catch (HeavyRpcException e) {
      throw failure(Phase.METADATA, e);
    }
  }

  private static void checkColumnCount(String tableName, List<ColumnSpec> specs, int sourceCount)
      throws SchemaMismatchException {
    if (specs.size() != sourceCount) {
      String message =
          String.format(
              "Number of columns in the source (%d) does not match table %s (%d)",
              sourceCount, tableName, specs.size());
      LOGGER.error(message);
      throw new SchemaMismatchException(message);
    }
  }

  private static TransportFailureException failure(Phase phase, HeavyRpcException e) {
    LOGGER.error("RPC call failed during {}: {}", phase, e.getMessage(), e);
    return new TransportFailureException(phase, e);
  }
}
