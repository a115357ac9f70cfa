package com.heavyai.client.exception;

/** Error codes attached to every {@link HeavyClientException}. */
public enum HeavyClientErrorCode {
  TYPE_MISMATCH("22018"),
  SCHEMA_MISMATCH("42S22"),
  INVALID_METHOD("HY024"),
  INVALID_CREATE_OPTION("HY024"),
  INVALID_CONFIGURATION("08001"),
  TABLE_EXISTS("42S01"),
  UNSUPPORTED_TRANSPORT("0A000"),
  NO_DESCRIPTOR("HY010"),
  ALREADY_RELEASED("HY010"),
  TRANSPORT_FAILURE("08S01"),
  PARTIAL_LOAD("08S01"),
  ARROW_PARSING_ERROR("22000"),
  CONNECTION_CLOSED("08003"),
  TABLES_STILL_OPEN("HY000");

  private final String sqlState;

  HeavyClientErrorCode(String sqlState) {
    this.sqlState = sqlState;
  }

  public String getSqlState() {
    return sqlState;
  }
}
