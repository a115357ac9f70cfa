package com.heavyai.client.model.core;

import java.util.Objects;

/** One value of a row-wise load, rendered as text the way the server parses it. */
public final class StringValue {

  private static final StringValue NULL = new StringValue("", true);

  private final String value;
  private final boolean isNull;

  private StringValue(String value, boolean isNull) {
    this.value = value;
    this.isNull = isNull;
  }

  public static StringValue of(String value) {
    return value == null ? NULL : new StringValue(value, false);
  }

  public static StringValue ofNull() {
    return NULL;
  }

  public String getValue() {
    return value;
  }

  public boolean isNull() {
    return isNull;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StringValue)) {
      return false;
    }
    StringValue that = (StringValue) o;
    return isNull == that.isNull && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, isNull);
  }

  @Override
  public String toString() {
    return isNull ? "NULL" : value;
  }
}
