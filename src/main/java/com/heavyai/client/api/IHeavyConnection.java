package com.heavyai.client.api;

import com.heavyai.client.api.impl.ipc.RetrievedTable;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.LoadOptions;
import com.heavyai.client.model.core.TabularData;
import com.heavyai.client.model.core.TransportMode;
import java.sql.SQLException;
import java.util.List;

/**
 * Bulk data exchange with a HeavyDB server over one session.
 *
 * <p>Loads move client tables into server tables through an Arrow stream, binary columnar batches
 * or string rows. Fetches execute a query and return its result as an Arrow table, either inline
 * or through a shared or GPU memory segment.
 *
 * <p>Server results fetched through a memory segment hold server memory until released, either
 * automatically right after decoding ({@code releaseMemory}) or through {@link
 * #deallocate(RetrievedTable)}. Every result can be released once.
 *
 * <p>A connection is meant for one caller at a time.
 */
public interface IHeavyConnection extends AutoCloseable {

  /** Creates a table whose columns follow the names and types of {@code data}. */
  void createTable(String tableName, TabularData data) throws SQLException;

  /** Loads {@code data} with default options: inferred method, table created if missing. */
  void loadTable(String tableName, TabularData data) throws SQLException;

  /**
   * Loads {@code data} into a table.
   *
   * <p>A failed multi-batch columnar load is not rolled back: the table may hold some of the
   * rows. Check the row count before retrying.
   */
  void loadTable(String tableName, TabularData data, LoadOptions options) throws SQLException;

  void loadTableRowwise(String tableName, TabularData data) throws SQLException;

  /** Loads {@code data} as string rows into the given columns, or all columns when empty. */
  void loadTableRowwise(String tableName, TabularData data, List<String> columnNames)
      throws SQLException;

  void loadTableColumnar(String tableName, TabularData data) throws SQLException;

  /**
   * Loads {@code data} as binary columnar batches. Honors the chunk size, target column names and
   * column-matching settings of {@code options}; its method and create policy are ignored.
   */
  void loadTableColumnar(String tableName, TabularData data, LoadOptions options)
      throws SQLException;

  void loadTableArrow(String tableName, TabularData data) throws SQLException;

  void loadTableArrow(String tableName, TabularData data, List<String> loadColumnNames)
      throws SQLException;

  /** Executes a query on the CPU using the connection's default limit, release and transport. */
  RetrievedTable selectIpc(String sql) throws SQLException;

  /**
   * Executes a query on the CPU and retrieves its result as an Arrow table.
   *
   * @param firstN row limit, or -1 for none
   * @param releaseMemory release a shared-memory result as soon as it is decoded
   * @param transport inline stream or shared memory
   */
  RetrievedTable selectIpc(String sql, int firstN, boolean releaseMemory, TransportMode transport)
      throws SQLException;

  /** Executes a query on the connection's default GPU. */
  RetrievedTable selectIpcGpu(String sql) throws SQLException;

  /**
   * Executes a query on a GPU and retrieves its result through GPU memory.
   *
   * @param releaseMemory release the GPU result as soon as it is decoded
   */
  RetrievedTable selectIpcGpu(String sql, int deviceId, int firstN, boolean releaseMemory)
      throws SQLException;

  /** Releases the server result behind a fetched table on its own device. */
  void deallocate(RetrievedTable table) throws SQLException;

  void deallocate(RetrievedTable table, int deviceId) throws SQLException;

  List<String> getTables() throws SQLException;

  List<ColumnSpec> getTableDetails(String tableName) throws SQLException;

  boolean isClosed();

  /** Frees the connection's Arrow memory. Close every retrieved table first. */
  @Override
  void close() throws SQLException;
}
