package com.heavyai.client.exception;

/** Thrown when an unknown load method literal is supplied. */
public class InvalidMethodException extends HeavyClientException {

  public InvalidMethodException(String reason) {
    super(reason, HeavyClientErrorCode.INVALID_METHOD);
  }

  public InvalidMethodException(String reason, Throwable cause) {
    super(reason, cause, HeavyClientErrorCode.INVALID_METHOD);
  }
}
