package com.heavyai.client.exception;

/** Thrown when an explicit table creation is rejected because the table already exists. */
public class TableExistsException extends HeavyClientException {

  public TableExistsException(String reason) {
    super(reason, HeavyClientErrorCode.TABLE_EXISTS);
  }

  public TableExistsException(String reason, Throwable cause) {
    super(reason, cause, HeavyClientErrorCode.TABLE_EXISTS);
  }
}
