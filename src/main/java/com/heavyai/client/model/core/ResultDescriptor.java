package com.heavyai.client.model.core;

import java.util.Objects;

/**
 * Opaque server handle for the result of one query execution.
 *
 * <p>A descriptor either carries the result's Arrow stream inline ({@link TransportMode#WIRE}) or
 * names a memory segment of {@link #getSegmentSize()} bytes holding it ({@link
 * TransportMode#SHARED_MEMORY}). Server-side resources stay allocated until the descriptor is
 * released or the session ends.
 */
public final class ResultDescriptor {

  private final String resultId;
  private final DeviceType deviceType;
  private final int deviceId;
  private final TransportMode transportMode;
  private final byte[] inlinePayload;
  private final byte[] segmentHandle;
  private final long segmentSize;
  private final long rowCount;
  private final int columnCount;
  private final long executionTimeMs;
  private final long arrowConversionTimeMs;

  private ResultDescriptor(Builder builder) {
    this.resultId = Objects.requireNonNull(builder.resultId, "resultId");
    this.deviceType = Objects.requireNonNull(builder.deviceType, "deviceType");
    this.deviceId = builder.deviceId;
    this.transportMode = Objects.requireNonNull(builder.transportMode, "transportMode");
    this.inlinePayload = builder.inlinePayload;
    this.segmentHandle = builder.segmentHandle;
    this.segmentSize = builder.segmentSize;
    this.rowCount = builder.rowCount;
    this.columnCount = builder.columnCount;
    this.executionTimeMs = builder.executionTimeMs;
    this.arrowConversionTimeMs = builder.arrowConversionTimeMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getResultId() {
    return resultId;
  }

  public DeviceType getDeviceType() {
    return deviceType;
  }

  public int getDeviceId() {
    return deviceId;
  }

  public TransportMode getTransportMode() {
    return transportMode;
  }

  /** Inline Arrow stream, present only for {@link TransportMode#WIRE}. */
  public byte[] getInlinePayload() {
    return inlinePayload;
  }

  /** Segment identifier, present only for {@link TransportMode#SHARED_MEMORY}. */
  public byte[] getSegmentHandle() {
    return segmentHandle;
  }

  public long getSegmentSize() {
    return segmentSize;
  }

  /** Row count reported by the server, or -1 when unknown. */
  public long getRowCount() {
    return rowCount;
  }

  /** Column count reported by the server, or -1 when unknown. */
  public int getColumnCount() {
    return columnCount;
  }

  public long getExecutionTimeMs() {
    return executionTimeMs;
  }

  public long getArrowConversionTimeMs() {
    return arrowConversionTimeMs;
  }

  @Override
  public String toString() {
    return String.format(
        "ResultDescriptor(id=%s, device=%s:%d, transport=%s, size=%d)",
        resultId,
        deviceType,
        deviceId,
        transportMode,
        transportMode == TransportMode.WIRE
            ? (inlinePayload == null ? 0 : inlinePayload.length)
            : segmentSize);
  }

  public static class Builder {
    private String resultId;
    private DeviceType deviceType = DeviceType.CPU;
    private int deviceId;
    private TransportMode transportMode = TransportMode.WIRE;
    private byte[] inlinePayload;
    private byte[] segmentHandle;
    private long segmentSize;
    private long rowCount = -1;
    private int columnCount = -1;
    private long executionTimeMs;
    private long arrowConversionTimeMs;

    public Builder withResultId(String resultId) {
      this.resultId = resultId;
      return this;
    }

    public Builder withDevice(DeviceType deviceType, int deviceId) {
      this.deviceType = deviceType;
      this.deviceId = deviceId;
      return this;
    }

    public Builder withInlinePayload(byte[] inlinePayload) {
      this.transportMode = TransportMode.WIRE;
      this.inlinePayload = inlinePayload;
      return this;
    }

    public Builder withSegment(byte[] segmentHandle, long segmentSize) {
      this.transportMode = TransportMode.SHARED_MEMORY;
      this.segmentHandle = segmentHandle;
      this.segmentSize = segmentSize;
      return this;
    }

    public Builder withShape(long rowCount, int columnCount) {
      this.rowCount = rowCount;
      this.columnCount = columnCount;
      return this;
    }

    public Builder withTimings(long executionTimeMs, long arrowConversionTimeMs) {
      this.executionTimeMs = executionTimeMs;
      this.arrowConversionTimeMs = arrowConversionTimeMs;
      return this;
    }

    public ResultDescriptor build() {
      return new ResultDescriptor(this);
    }
  }
}
