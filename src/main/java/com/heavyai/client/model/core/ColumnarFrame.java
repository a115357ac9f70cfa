package com.heavyai.client.model.core;

import com.heavyai.client.common.util.HeavyTypeUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An in-memory, column-oriented table of plain Java values: ordered named columns of equal length,
 * each with the logical type its values were declared or inferred to have.
 */
public final class ColumnarFrame {

  /** One named column of a frame. */
  public static final class Column {
    private final String name;
    private final ColumnType type;
    private final List<Object> values;

    private Column(String name, ColumnType type, List<Object> values) {
      this.name = name;
      this.type = type;
      this.values = values;
    }

    public String getName() {
      return name;
    }

    /** Declared or inferred type, or null when every value is null. */
    public ColumnType getType() {
      return type;
    }

    public List<Object> getValues() {
      return values;
    }
  }

  private final List<Column> columns;
  private final int rowCount;

  private ColumnarFrame(List<Column> columns, int rowCount) {
    this.columns = Collections.unmodifiableList(columns);
    this.rowCount = rowCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Column> getColumns() {
    return columns;
  }

  public Column getColumn(int index) {
    return columns.get(index);
  }

  /** Finds a column by name, or returns null. */
  public Column findColumn(String name) {
    for (Column column : columns) {
      if (column.getName().equals(name)) {
        return column;
      }
    }
    return null;
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (Column column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public int getRowCount() {
    return rowCount;
  }

  public Object getValue(int row, int column) {
    return columns.get(column).getValues().get(row);
  }

  public List<Object> getRow(int row) {
    List<Object> values = new ArrayList<>(columns.size());
    for (Column column : columns) {
      values.add(column.getValues().get(row));
    }
    return values;
  }

  public static class Builder {
    private final List<Column> columns = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    /** Adds a column whose type is inferred from its first non-null value. */
    public Builder addColumn(String name, List<?> values) {
      return addColumn(name, HeavyTypeUtil.inferColumnType(values), values);
    }

    public Builder addColumn(String name, ColumnType type, List<?> values) {
      if (!names.add(name)) {
        throw new IllegalArgumentException("Duplicate column name " + name);
      }
      columns.add(new Column(name, type, Collections.unmodifiableList(new ArrayList<>(values))));
      return this;
    }

    public ColumnarFrame build() {
      int rowCount = columns.isEmpty() ? 0 : columns.get(0).getValues().size();
      for (Column column : columns) {
        if (column.getValues().size() != rowCount) {
          throw new IllegalArgumentException(
              String.format(
                  "Column %s has %d values, expected %d",
                  column.getName(), column.getValues().size(), rowCount));
        }
      }
      return new ColumnarFrame(new ArrayList<>(columns), rowCount);
    }
  }
}
