package com.heavyai.client.exception;

/**
 * Thrown when a result is released a second time. Releasing is not idempotent: the second call
 * always fails, whatever device the result lives on.
 */
public class AlreadyReleasedException extends HeavyClientException {

  private final String resultId;

  public AlreadyReleasedException(String resultId) {
    super(
        "Result " + resultId + " has already been released",
        HeavyClientErrorCode.ALREADY_RELEASED);
    this.resultId = resultId;
  }

  public String getResultId() {
    return resultId;
  }
}
