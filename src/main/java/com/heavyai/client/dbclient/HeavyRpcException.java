package com.heavyai.client.dbclient;

/**
 * Failure reported by the RPC layer: either the server rejected a call or the transport broke.
 * The message is the server's, unchanged.
 */
public class HeavyRpcException extends Exception {

  public HeavyRpcException(String message) {
    super(message);
  }

  public HeavyRpcException(String message, Throwable cause) {
    super(message, cause);
  }
}
