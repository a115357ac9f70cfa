package com.heavyai.client.model.core;

import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import java.util.Locale;

/** Whether a load issues a CREATE TABLE before inserting data. */
public enum CreatePolicy {
  /** Ask the server for its table list and create the table only if it is absent. */
  INFER,
  /** Always attempt creation; the load fails if the table already exists. */
  ALWAYS,
  /** Never create. */
  NEVER;

  public static CreatePolicy fromBoolean(boolean create) {
    return create ? ALWAYS : NEVER;
  }

  /** Parses {@code infer}, {@code true} or {@code false}. */
  public static CreatePolicy fromString(String value) throws HeavyClientException {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "infer":
        return INFER;
      case "true":
        return ALWAYS;
      case "false":
        return NEVER;
      default:
        throw new HeavyClientException(
            "Unexpected value for create: '" + value + "'. Expected one of {'infer', true, false}",
            HeavyClientErrorCode.INVALID_CREATE_OPTION);
    }
  }
}
