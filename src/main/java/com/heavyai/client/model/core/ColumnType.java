package com.heavyai.client.model.core;

/** Logical column types understood by the load and fetch paths. */
public enum ColumnType {
  BOOL(1),
  TINYINT(1),
  SMALLINT(2),
  INT(4),
  BIGINT(8),
  FLOAT(4),
  DOUBLE(8),
  DECIMAL(8),
  STR(-1),
  DATE(8),
  TIME(8),
  TIMESTAMP(8);

  private final int fixedWidth;

  ColumnType(int fixedWidth) {
    this.fixedWidth = fixedWidth;
  }

  /**
   * Width in bytes of one value in the binary columnar layout, or -1 for strings whose width
   * depends on the column encoding.
   */
  public int getFixedWidth() {
    return fixedWidth;
  }

  public boolean isInteger() {
    return this == TINYINT || this == SMALLINT || this == INT || this == BIGINT;
  }

  public boolean isFloatingPoint() {
    return this == FLOAT || this == DOUBLE;
  }

  public boolean isNumeric() {
    return isInteger() || isFloatingPoint() || this == DECIMAL;
  }

  public boolean isTemporal() {
    return this == DATE || this == TIME || this == TIMESTAMP;
  }
}
