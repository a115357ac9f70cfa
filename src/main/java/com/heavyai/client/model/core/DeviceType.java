package com.heavyai.client.model.core;

/** Device holding a query result on the server. */
public enum DeviceType {
  CPU,
  GPU
}
