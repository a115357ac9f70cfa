package com.heavyai.client.dbclient;

import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.CreateOptions;
import com.heavyai.client.model.core.DeviceType;
import com.heavyai.client.model.core.EncodedColumn;
import com.heavyai.client.model.core.ResultDescriptor;
import com.heavyai.client.model.core.StringRow;
import com.heavyai.client.model.core.TransportMode;
import java.util.List;

/**
 * RPC calls the data-exchange layer needs from an authenticated server session.
 *
 * <p>Implementations are bound to one session and own its transport, authentication, timeouts and
 * retries. Calls are blocking. A session is not safe for concurrent use unless the implementation
 * serializes calls itself; the data-exchange layer never issues two calls at once on its own.
 */
public interface IHeavyClient {

  /** Names of all tables visible to the session. */
  List<String> getTableList() throws HeavyRpcException;

  /** Column metadata of a table, in table order. */
  List<ColumnSpec> getColumnSpecs(String tableName) throws HeavyRpcException;

  void createTable(String tableName, List<ColumnSpec> columns, CreateOptions options)
      throws HeavyRpcException;

  /**
   * Loads one batch of encoded columns.
   *
   * @param targetColumnNames columns the batch maps to; empty means every column in table order
   */
  void loadColumnarBinary(
      String tableName, List<EncodedColumn> columns, List<String> targetColumnNames)
      throws HeavyRpcException;

  /** Loads a whole table given as an Arrow IPC stream. */
  void loadArrowBinary(String tableName, byte[] arrowStream, List<String> targetColumnNames)
      throws HeavyRpcException;

  void loadRowWise(String tableName, List<StringRow> rows, List<String> targetColumnNames)
      throws HeavyRpcException;

  /**
   * Executes a query and leaves its result as an Arrow stream on the given device.
   *
   * @param firstN maximum number of rows to return, or -1 for no limit
   * @return a descriptor carrying the stream inline for {@link TransportMode#WIRE}, or naming the
   *     memory segment holding it for {@link TransportMode#SHARED_MEMORY}
   */
  ResultDescriptor executeQueryForResult(
      String sql, DeviceType deviceType, int deviceId, int firstN, TransportMode transportMode)
      throws HeavyRpcException;

  /** Frees the server-side resources of a result. */
  void deallocateResult(ResultDescriptor descriptor, DeviceType deviceType, int deviceId)
      throws HeavyRpcException;
}
