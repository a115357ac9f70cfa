package com.heavyai.client.api.internal;

import com.heavyai.client.model.core.TransportMode;
import java.nio.file.Path;

/** Settings of one server connection, resolved from the connection URL and properties. */
public interface IHeavyConnectionContext {

  /** The URL the context was parsed from. */
  String getConnectionUrl();

  String getHost();

  int getPort();

  /** RPC protocol: {@code binary}, {@code http} or {@code https}. */
  String getProtocol();

  String getDatabase();

  String getUser();

  String getPassword();

  /** An existing session to reuse instead of logging in, or null. */
  String getSessionId();

  /** Default byte budget per columnar load batch; 0 sends each load as one batch. */
  long getChunkSizeBytes();

  /** Whether inferred loads of columnar sources go through the Arrow stream path. */
  boolean isArrowLoadEnabled();

  /** Directory under which the operating system exposes POSIX shared-memory objects. */
  Path getShmDirectory();

  /** GPU device used when a call does not name one. */
  int getDeviceId();

  /** Whether fetches release segment-backed results right after decoding them. */
  boolean isReleaseMemory();

  /** Default row limit of fetches, or -1 for none. */
  int getFirstN();

  /** Default transport of CPU fetches. */
  TransportMode getTransportMode();
}
