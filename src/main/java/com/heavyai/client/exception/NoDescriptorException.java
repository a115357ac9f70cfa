package com.heavyai.client.exception;

/** Thrown when a table that was not produced by a result fetch is released. */
public class NoDescriptorException extends HeavyClientException {

  public NoDescriptorException(String reason) {
    super(reason, HeavyClientErrorCode.NO_DESCRIPTOR);
  }

  public NoDescriptorException(String reason, Throwable cause) {
    super(reason, cause, HeavyClientErrorCode.NO_DESCRIPTOR);
  }
}
