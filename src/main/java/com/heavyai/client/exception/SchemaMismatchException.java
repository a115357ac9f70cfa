package com.heavyai.client.exception;

/** Thrown when the source columns do not line up with the target table's columns. */
public class SchemaMismatchException extends HeavyClientException {

  public SchemaMismatchException(String reason) {
    super(reason, HeavyClientErrorCode.SCHEMA_MISMATCH);
  }

  public SchemaMismatchException(String reason, Throwable cause) {
    super(reason, cause, HeavyClientErrorCode.SCHEMA_MISMATCH);
  }
}
