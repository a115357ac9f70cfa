package com.heavyai.client.exception;

import java.sql.SQLException;

/** Base exception for all failures raised by the client. */
public class HeavyClientException extends SQLException {

  private final HeavyClientErrorCode errorCode;

  public HeavyClientException(String reason, HeavyClientErrorCode errorCode) {
    super(reason, errorCode.getSqlState(), errorCode.ordinal());
    this.errorCode = errorCode;
  }

  public HeavyClientException(String reason, Throwable cause, HeavyClientErrorCode errorCode) {
    super(reason, errorCode.getSqlState(), errorCode.ordinal(), cause);
    this.errorCode = errorCode;
  }

  public HeavyClientErrorCode getClientErrorCode() {
    return errorCode;
  }
}
