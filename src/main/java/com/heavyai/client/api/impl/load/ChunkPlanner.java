package com.heavyai.client.api.impl.load;

import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ColumnBatch;
import com.heavyai.client.model.core.EncodedColumn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits encoded columns into row-bounded batches that each fit a byte budget.
 *
 * <p>The first guess of rows per batch comes from the average row cost of the whole column set.
 * Each candidate batch is then measured exactly and shrunk until it fits. A single row larger than
 * the budget still forms its own batch. Batches keep source row order and never overlap.
 */
public class ChunkPlanner {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(ChunkPlanner.class);

  /**
   * Plans batches for a set of columns of equal row count.
   *
   * @param columns encoded columns, all with the same row count
   * @param budgetBytes maximum serialized size of a batch; 0 disables splitting
   * @return batches in row order; empty only if there are no columns
   */
  public List<ColumnBatch> plan(List<EncodedColumn> columns, long budgetBytes) {
    if (budgetBytes < 0) {
      throw new IllegalArgumentException("Byte budget must not be negative: " + budgetBytes);
    }
    if (columns.isEmpty()) {
      return Collections.emptyList();
    }
    int rowCount = columns.get(0).getRowCount();
    if (budgetBytes == 0 || rowCount == 0) {
      return Collections.singletonList(new ColumnBatch(0, 0, columns));
    }

    int rowsPerBatch = estimateRowsPerBatch(columns, rowCount, budgetBytes);
    LOGGER.debug(
        "Planning batches for {} rows with budget {} bytes, initial estimate {} rows per batch",
        rowCount,
        budgetBytes,
        rowsPerBatch);

    List<ColumnBatch> batches = new ArrayList<>();
    int start = 0;
    while (start < rowCount) {
      int count = Math.min(rowsPerBatch, rowCount - start);
      List<EncodedColumn> slice = slice(columns, start, count);
      long size = sizeOf(slice);
      while (size > budgetBytes && count > 1) {
        count = (int) Math.max(1, Math.min(count - 1, (long) count * budgetBytes / size));
        slice = slice(columns, start, count);
        size = sizeOf(slice);
      }
      if (size > budgetBytes) {
        LOGGER.warn(
            "Row {} alone needs {} bytes, over the {} byte budget; sending it as its own batch",
            start,
            size,
            budgetBytes);
      }
      batches.add(new ColumnBatch(batches.size(), start, slice));
      start += count;
    }
    LOGGER.debug("Planned {} batches for {} rows", batches.size(), rowCount);
    return batches;
  }

  static int estimateRowsPerBatch(List<EncodedColumn> columns, int rowCount, long budgetBytes) {
    double perRowCost = (double) sizeOf(columns) / rowCount;
    if (perRowCost <= 0) {
      return rowCount;
    }
    return (int) Math.max(1, Math.min(rowCount, Math.floor(budgetBytes / perRowCost)));
  }

  private static List<EncodedColumn> slice(List<EncodedColumn> columns, int start, int count) {
    List<EncodedColumn> slice = new ArrayList<>(columns.size());
    for (EncodedColumn column : columns) {
      slice.add(column.slice(start, count));
    }
    return slice;
  }

  private static long sizeOf(List<EncodedColumn> columns) {
    long size = 0;
    for (EncodedColumn column : columns) {
      size += column.getSerializedSize();
    }
    return size;
  }
}
