package com.heavyai.client.exception;

/**
 * Wraps a failure reported by the RPC layer. The server message is kept verbatim; only the phase
 * of the client operation that hit it is added.
 */
public class TransportFailureException extends HeavyClientException {

  /** Client operation phase during which the RPC failure happened. */
  public enum Phase {
    METADATA,
    CREATE,
    LOAD,
    FETCH,
    RELEASE
  }

  private final Phase phase;

  public TransportFailureException(Phase phase, Throwable cause) {
    this(phase, cause.getMessage(), cause, HeavyClientErrorCode.TRANSPORT_FAILURE);
  }

  protected TransportFailureException(
      Phase phase, String reason, Throwable cause, HeavyClientErrorCode errorCode) {
    super(reason, cause, errorCode);
    this.phase = phase;
  }

  public Phase getPhase() {
    return phase;
  }
}
