package com.heavyai.client.api.impl;

/** Connection parameters accepted in the URL query string or as properties, with defaults. */
public enum HeavyConnectionParams {
  PROTOCOL("protocol", "binary"),
  PORT("port", "6274"),
  DBNAME("dbname", "heavyai"),
  USER("user", null),
  PASSWORD("password", null),
  SESSION_ID("sessionId", null),
  CHUNK_SIZE_BYTES("chunkSizeBytes", "0"),
  ARROW_LOAD_ENABLED("arrowLoadEnabled", "true"),
  SHM_DIRECTORY("shmDirectory", "/dev/shm"),
  DEVICE_ID("deviceId", "0"),
  RELEASE_MEMORY("releaseMemory", "true"),
  FIRST_N("firstN", "-1"),
  TRANSPORT("transport", "WIRE");

  private final String paramName;
  private final String defaultValue;

  HeavyConnectionParams(String paramName, String defaultValue) {
    this.paramName = paramName;
    this.defaultValue = defaultValue;
  }

  public String getParamName() {
    return paramName;
  }

  public String getDefaultValue() {
    return defaultValue;
  }
}
