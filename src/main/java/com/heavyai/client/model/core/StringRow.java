package com.heavyai.client.model.core;

import java.util.Collections;
import java.util.List;

/** One row of a row-wise load. */
public final class StringRow {

  private final List<StringValue> columns;

  public StringRow(List<StringValue> columns) {
    this.columns = Collections.unmodifiableList(columns);
  }

  public List<StringValue> getColumns() {
    return columns;
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
