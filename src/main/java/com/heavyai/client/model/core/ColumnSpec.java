package com.heavyai.client.model.core;

import java.util.Objects;

/**
 * Type and encoding metadata of one table column, as reported by the server's table details or
 * inferred from a source when a table is created.
 */
public final class ColumnSpec {

  public static final int DEFAULT_DICT_BITS = 32;

  private final String name;
  private final ColumnType type;
  private final boolean nullable;
  private final int precision;
  private final int scale;
  private final int compParam;
  private final ColumnEncoding encoding;

  private ColumnSpec(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.type = Objects.requireNonNull(builder.type, "type");
    this.nullable = builder.nullable;
    this.precision = builder.precision;
    this.scale = builder.scale;
    this.compParam = builder.compParam;
    this.encoding = builder.encoding;
  }

  public static Builder builder(String name, ColumnType type) {
    return new Builder(name, type);
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isNullable() {
    return nullable;
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  public int getCompParam() {
    return compParam;
  }

  public ColumnEncoding getEncoding() {
    return encoding;
  }

  public boolean isDictionaryEncoded() {
    return type == ColumnType.STR && encoding == ColumnEncoding.DICT;
  }

  /**
   * Width in bytes of one value in the binary columnar layout. Dictionary strings use the code
   * width given by the compression parameter (8, 16 or 32 bits); plain strings are variable width
   * and return -1.
   */
  public int getWireWidth() {
    if (type != ColumnType.STR) {
      return type.getFixedWidth();
    }
    if (!isDictionaryEncoded()) {
      return -1;
    }
    switch (compParam) {
      case 8:
        return 1;
      case 16:
        return 2;
      default:
        return 4;
    }
  }

  public Builder toBuilder() {
    return new Builder(name, type)
        .withNullable(nullable)
        .withPrecision(precision)
        .withScale(scale)
        .withCompParam(compParam)
        .withEncoding(encoding);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnSpec)) {
      return false;
    }
    ColumnSpec that = (ColumnSpec) o;
    return nullable == that.nullable
        && precision == that.precision
        && scale == that.scale
        && compParam == that.compParam
        && name.equals(that.name)
        && type == that.type
        && encoding == that.encoding;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, nullable, precision, scale, compParam, encoding);
  }

  @Override
  public String toString() {
    return String.format(
        "ColumnSpec(name=%s, type=%s, nullable=%s, precision=%d, scale=%d, comp_param=%d,"
            + " encoding=%s)",
        name, type, nullable, precision, scale, compParam, encoding);
  }

  public static class Builder {
    private final String name;
    private final ColumnType type;
    private boolean nullable = true;
    private int precision;
    private int scale;
    private int compParam;
    private ColumnEncoding encoding = ColumnEncoding.NONE;

    private Builder(String name, ColumnType type) {
      this.name = name;
      this.type = type;
    }

    public Builder withNullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public Builder withPrecision(int precision) {
      this.precision = precision;
      return this;
    }

    public Builder withScale(int scale) {
      this.scale = scale;
      return this;
    }

    public Builder withCompParam(int compParam) {
      this.compParam = compParam;
      return this;
    }

    public Builder withEncoding(ColumnEncoding encoding) {
      this.encoding = encoding;
      return this;
    }

    public ColumnSpec build() {
      return new ColumnSpec(this);
    }
  }
}
