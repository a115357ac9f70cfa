package com.heavyai.client.exception;

/** Thrown when a source column or value cannot be coerced to the target column type. */
public class TypeMismatchException extends HeavyClientException {

  public TypeMismatchException(String reason) {
    super(reason, HeavyClientErrorCode.TYPE_MISMATCH);
  }

  public TypeMismatchException(String reason, Throwable cause) {
    super(reason, cause, HeavyClientErrorCode.TYPE_MISMATCH);
  }
}
