package com.heavyai.client.api.impl.load;

import com.heavyai.client.model.core.LoadMethod;
import com.heavyai.client.model.core.TabularData;

/** Transfer strategy for one load call, chosen once before any network call is made. */
public enum LoadStrategy {
  ARROW,
  COLUMNAR,
  ROW_WISE;

  /**
   * Picks the strategy for a requested method and source shape.
   *
   * <p>{@link LoadMethod#INFER} prefers the Arrow stream for columnar sources (Arrow tables and
   * frames) when Arrow loading is enabled, falls back to the binary columnar load when it is not,
   * and uses the row-wise load for bare tuple sequences.
   */
  public static LoadStrategy select(
      LoadMethod method, TabularData.Kind sourceKind, boolean arrowLoadEnabled) {
    switch (method) {
      case ARROW:
        return ARROW;
      case COLUMNAR:
        return COLUMNAR;
      case ROWS:
        return ROW_WISE;
      case INFER:
      default:
        if (sourceKind == TabularData.Kind.ROW_SEQUENCE) {
          return ROW_WISE;
        }
        return arrowLoadEnabled ? ARROW : COLUMNAR;
    }
  }
}
