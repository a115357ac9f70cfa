package com.heavyai.client.model.core;

import com.heavyai.client.exception.UnsupportedTransportException;
import java.util.Locale;

/** How the bytes of a query result reach the client. */
public enum TransportMode {
  /** The Arrow stream travels inline in the RPC response. */
  WIRE,
  /** The Arrow stream is left in a shared (CPU) or IPC (GPU) memory segment. */
  SHARED_MEMORY;

  public static TransportMode fromString(String value) throws UnsupportedTransportException {
    if (value != null) {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "wire":
          return WIRE;
        case "shared_memory":
        case "shared-memory":
          return SHARED_MEMORY;
        default:
          break;
      }
    }
    throw new UnsupportedTransportException(
        "The specified transport type " + value + " is not supported."
            + " Only SHARED_MEMORY and WIRE are supported.");
  }
}
