package com.heavyai.client.model.core;

import java.util.Collections;
import java.util.List;

/** Per-call options of a table load. */
public final class LoadOptions {

  private final LoadMethod method;
  private final CreatePolicy createPolicy;
  private final Long chunkSizeBytes;
  private final boolean columnNamesFromSchema;
  private final List<String> targetColumnNames;

  private LoadOptions(Builder builder) {
    this.method = builder.method;
    this.createPolicy = builder.createPolicy;
    this.chunkSizeBytes = builder.chunkSizeBytes;
    this.columnNamesFromSchema = builder.columnNamesFromSchema;
    this.targetColumnNames = Collections.unmodifiableList(builder.targetColumnNames);
  }

  public static LoadOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public LoadMethod getMethod() {
    return method;
  }

  public CreatePolicy getCreatePolicy() {
    return createPolicy;
  }

  /** Byte budget per columnar batch, or null to use the connection's setting. */
  public Long getChunkSizeBytes() {
    return chunkSizeBytes;
  }

  public boolean isColumnNamesFromSchema() {
    return columnNamesFromSchema;
  }

  /** Target columns forwarded to the server; empty means all columns in table order. */
  public List<String> getTargetColumnNames() {
    return targetColumnNames;
  }

  public static class Builder {
    private LoadMethod method = LoadMethod.INFER;
    private CreatePolicy createPolicy = CreatePolicy.INFER;
    private Long chunkSizeBytes;
    private boolean columnNamesFromSchema;
    private List<String> targetColumnNames = Collections.emptyList();

    public Builder withMethod(LoadMethod method) {
      this.method = method;
      return this;
    }

    public Builder withCreatePolicy(CreatePolicy createPolicy) {
      this.createPolicy = createPolicy;
      return this;
    }

    public Builder withChunkSizeBytes(long chunkSizeBytes) {
      if (chunkSizeBytes < 0) {
        throw new IllegalArgumentException("chunkSizeBytes must not be negative");
      }
      this.chunkSizeBytes = chunkSizeBytes;
      return this;
    }

    public Builder withColumnNamesFromSchema(boolean columnNamesFromSchema) {
      this.columnNamesFromSchema = columnNamesFromSchema;
      return this;
    }

    public Builder withTargetColumnNames(List<String> targetColumnNames) {
      this.targetColumnNames = targetColumnNames;
      return this;
    }

    public LoadOptions build() {
      return new LoadOptions(this);
    }
  }
}
