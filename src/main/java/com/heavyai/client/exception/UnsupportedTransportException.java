package com.heavyai.client.exception;

/** Thrown when a result cannot be retrieved with the requested transport. */
public class UnsupportedTransportException extends HeavyClientException {

  public UnsupportedTransportException(String reason) {
    super(reason, HeavyClientErrorCode.UNSUPPORTED_TRANSPORT);
  }

  public UnsupportedTransportException(String reason, Throwable cause) {
    super(reason, cause, HeavyClientErrorCode.UNSUPPORTED_TRANSPORT);
  }
}
