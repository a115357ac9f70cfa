package com.heavyai.client.model.core;

/** Server-side storage encodings reported with a column. */
public enum ColumnEncoding {
  NONE,
  FIXED,
  DICT,
  DAYS
}
