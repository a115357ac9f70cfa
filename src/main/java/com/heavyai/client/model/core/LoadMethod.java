package com.heavyai.client.model.core;

import com.heavyai.client.exception.InvalidMethodException;
import java.util.Locale;

/** Load method requested by the caller. */
public enum LoadMethod {
  /** Pick the strategy from the shape of the source. */
  INFER,
  ARROW,
  COLUMNAR,
  ROWS;

  public static LoadMethod fromString(String value) throws InvalidMethodException {
    if (value != null) {
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw invalid(value, e);
      }
    }
    throw invalid(null, null);
  }

  private static InvalidMethodException invalid(String value, Throwable cause) {
    return new InvalidMethodException(
        "Method must be one of {'infer', 'arrow', 'columnar', 'rows'}. Got " + value + " instead",
        cause);
  }
}
