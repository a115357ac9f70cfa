package com.heavyai.client.model.core;

import java.util.Collections;
import java.util.List;

/**
 * A row-bounded slice of encoded columns sent in one columnar load request. All columns of a batch
 * have the same row count.
 */
public final class ColumnBatch {

  private final int batchIndex;
  private final long rowOffset;
  private final int rowCount;
  private final List<EncodedColumn> columns;

  public ColumnBatch(int batchIndex, long rowOffset, List<EncodedColumn> columns) {
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("A batch needs at least one column");
    }
    int rows = columns.get(0).getRowCount();
    for (EncodedColumn column : columns) {
      if (column.getRowCount() != rows) {
        throw new IllegalArgumentException(
            String.format(
                "Column %s has %d rows, expected %d",
                column.getSpec().getName(), column.getRowCount(), rows));
      }
    }
    this.batchIndex = batchIndex;
    this.rowOffset = rowOffset;
    this.rowCount = rows;
    this.columns = Collections.unmodifiableList(columns);
  }

  public int getBatchIndex() {
    return batchIndex;
  }

  /** Index of the first row of this batch within the whole load. */
  public long getRowOffset() {
    return rowOffset;
  }

  public int getRowCount() {
    return rowCount;
  }

  public List<EncodedColumn> getColumns() {
    return columns;
  }

  public long getSerializedSize() {
    long size = 0;
    for (EncodedColumn column : columns) {
      size += column.getSerializedSize();
    }
    return size;
  }
}
