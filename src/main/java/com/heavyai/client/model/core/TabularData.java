package com.heavyai.client.model.core;

import com.heavyai.client.common.util.ArrowUtil;
import com.heavyai.client.exception.TypeMismatchException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Source of a table load. Exactly one of three shapes:
 *
 * <ul>
 *   <li>{@link Kind#ARROW_TABLE}: an Arrow {@link VectorSchemaRoot}, owned by the caller
 *   <li>{@link Kind#COLUMNAR_FRAME}: a {@link ColumnarFrame}
 *   <li>{@link Kind#ROW_SEQUENCE}: a list of tuples, optionally with column names
 * </ul>
 *
 * <p>The kind is fixed at construction; load strategy selection only looks at it once.
 */
public final class TabularData {

  /** Shape of the source. */
  public enum Kind {
    ARROW_TABLE,
    COLUMNAR_FRAME,
    ROW_SEQUENCE
  }

  private static final String DEFAULT_COLUMN_PREFIX = "col_";

  private final Kind kind;
  private final VectorSchemaRoot arrowTable;
  private final ColumnarFrame frame;
  private final List<List<Object>> rows;
  private final List<String> rowColumnNames;

  private TabularData(
      Kind kind,
      VectorSchemaRoot arrowTable,
      ColumnarFrame frame,
      List<List<Object>> rows,
      List<String> rowColumnNames) {
    this.kind = kind;
    this.arrowTable = arrowTable;
    this.frame = frame;
    this.rows = rows;
    this.rowColumnNames = rowColumnNames;
  }

  public static TabularData ofArrow(VectorSchemaRoot arrowTable) {
    return new TabularData(
        Kind.ARROW_TABLE, Objects.requireNonNull(arrowTable, "arrowTable"), null, null, null);
  }

  public static TabularData ofFrame(ColumnarFrame frame) {
    return new TabularData(Kind.COLUMNAR_FRAME, null, Objects.requireNonNull(frame), null, null);
  }

  /**
   * Wraps a sequence of tuples. Each element must be an {@code Object[]} or a {@link List}; all
   * tuples must have the same width. Columns are named {@code col_0, col_1, ...}.
   */
  public static TabularData ofRows(Iterable<?> rows) {
    return ofRows(null, rows);
  }

  public static TabularData ofRows(List<String> columnNames, Iterable<?> rows) {
    List<List<Object>> materialized = new ArrayList<>();
    Integer width = columnNames == null ? null : columnNames.size();
    for (Object row : rows) {
      List<Object> tuple;
      if (row instanceof Object[]) {
        tuple = Arrays.asList((Object[]) row);
      } else if (row instanceof List) {
        tuple = new ArrayList<>((List<?>) row);
      } else {
        throw new IllegalArgumentException(
            "Rows must be Object[] or List, got " + (row == null ? "null" : row.getClass()));
      }
      if (width == null) {
        width = tuple.size();
      } else if (tuple.size() != width) {
        throw new IllegalArgumentException(
            "Row " + materialized.size() + " has " + tuple.size() + " values, expected " + width);
      }
      materialized.add(Collections.unmodifiableList(tuple));
    }
    List<String> names = columnNames;
    if (names == null) {
      names = new ArrayList<>();
      for (int i = 0; i < (width == null ? 0 : width); i++) {
        names.add(DEFAULT_COLUMN_PREFIX + i);
      }
    }
    return new TabularData(
        Kind.ROW_SEQUENCE,
        null,
        null,
        Collections.unmodifiableList(materialized),
        Collections.unmodifiableList(new ArrayList<>(names)));
  }

  public Kind getKind() {
    return kind;
  }

  public VectorSchemaRoot getArrowTable() {
    return arrowTable;
  }

  public ColumnarFrame getFrame() {
    return frame;
  }

  public List<List<Object>> getRows() {
    return rows;
  }

  public int getColumnCount() {
    switch (kind) {
      case ARROW_TABLE:
        return arrowTable.getFieldVectors().size();
      case COLUMNAR_FRAME:
        return frame.getColumnCount();
      default:
        return rowColumnNames.size();
    }
  }

  public long getRowCount() {
    switch (kind) {
      case ARROW_TABLE:
        return arrowTable.getRowCount();
      case COLUMNAR_FRAME:
        return frame.getRowCount();
      default:
        return rows.size();
    }
  }

  public List<String> getColumnNames() {
    switch (kind) {
      case ARROW_TABLE:
        List<String> names = new ArrayList<>();
        for (FieldVector vector : arrowTable.getFieldVectors()) {
          names.add(vector.getName());
        }
        return names;
      case COLUMNAR_FRAME:
        return frame.getColumnNames();
      default:
        return rowColumnNames;
    }
  }

  /**
   * Returns the source as a frame. Arrow columns keep their mapped types; tuple columns get types
   * inferred from their first non-null value.
   *
   * @throws TypeMismatchException if an Arrow column has a type the server does not support
   */
  public ColumnarFrame toColumnarFrame() throws TypeMismatchException {
    if (kind == Kind.COLUMNAR_FRAME) {
      return frame;
    }
    ColumnarFrame.Builder builder = ColumnarFrame.builder();
    if (kind == Kind.ARROW_TABLE) {
      int rowCount = arrowTable.getRowCount();
      for (FieldVector vector : arrowTable.getFieldVectors()) {
        List<Object> values = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
          values.add(ArrowUtil.readValue(vector, row));
        }
        ColumnType type = ArrowUtil.toColumnSpec(vector.getField()).getType();
        builder.addColumn(vector.getName(), type, values);
      }
      return builder.build();
    }
    for (int column = 0; column < rowColumnNames.size(); column++) {
      List<Object> values = new ArrayList<>(rows.size());
      for (List<Object> row : rows) {
        values.add(row.get(column));
      }
      builder.addColumn(rowColumnNames.get(column), values);
    }
    return builder.build();
  }

  /** Returns the source as a list of tuples in row order. */
  public List<List<Object>> toRows() {
    if (kind == Kind.ROW_SEQUENCE) {
      return rows;
    }
    int rowCount = (int) getRowCount();
    List<List<Object>> result = new ArrayList<>(rowCount);
    for (int row = 0; row < rowCount; row++) {
      if (kind == Kind.COLUMNAR_FRAME) {
        result.add(frame.getRow(row));
      } else {
        List<Object> tuple = new ArrayList<>();
        for (FieldVector vector : arrowTable.getFieldVectors()) {
          tuple.add(ArrowUtil.readValue(vector, row));
        }
        result.add(tuple);
      }
    }
    return result;
  }
}
