package com.heavyai.client.api.impl.ipc;

import com.heavyai.client.common.util.ArrowUtil;
import com.heavyai.client.model.core.ResultDescriptor;
import com.heavyai.client.model.core.TransportMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * A decoded query result held in client memory.
 *
 * <p>A table produced by a fetch carries the descriptor of the server result it came from, fixed
 * at construction and used only to release that result. Releasing the server result does not
 * invalidate the decoded data; closing the table frees the client-side Arrow buffers and does not
 * release the server result.
 */
public final class RetrievedTable implements AutoCloseable {

  private final VectorSchemaRoot root;
  private final ResultDescriptor descriptor;

  RetrievedTable(VectorSchemaRoot root, ResultDescriptor descriptor) {
    this.root = Objects.requireNonNull(root, "root");
    this.descriptor = descriptor;
  }

  /** Wraps a table built by the caller. It has no server result to release. */
  public static RetrievedTable wrap(VectorSchemaRoot root) {
    return new RetrievedTable(root, null);
  }

  public VectorSchemaRoot getRoot() {
    return root;
  }

  public int getRowCount() {
    return root.getRowCount();
  }

  public int getColumnCount() {
    return root.getFieldVectors().size();
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(getColumnCount());
    for (FieldVector vector : root.getFieldVectors()) {
      names.add(vector.getName());
    }
    return names;
  }

  /** Value at a row and column index, converted as {@link ArrowUtil#readValue} does. */
  public Object getObject(int row, int column) {
    return ArrowUtil.readValue(root.getVector(column), row);
  }

  public Object getObject(int row, String columnName) {
    FieldVector vector = root.getVector(columnName);
    if (vector == null) {
      throw new IllegalArgumentException("No column named " + columnName);
    }
    return ArrowUtil.readValue(vector, row);
  }

  /** How the result reached the client, or null for a table the caller built. */
  public TransportMode getTransportMode() {
    return descriptor == null ? null : descriptor.getTransportMode();
  }

  /** Server-side execution time in milliseconds, or 0 if unknown. */
  public long getExecutionTimeMs() {
    return descriptor == null ? 0 : descriptor.getExecutionTimeMs();
  }

  /** Server-side Arrow conversion time in milliseconds, or 0 if unknown. */
  public long getArrowConversionTimeMs() {
    return descriptor == null ? 0 : descriptor.getArrowConversionTimeMs();
  }

  ResultDescriptor getDescriptor() {
    return descriptor;
  }

  @Override
  public void close() {
    root.close();
  }

  @Override
  public String toString() {
    return String.format(
        "RetrievedTable{rows=%d, columns=%s, result=%s}",
        getRowCount(), getColumnNames(), descriptor == null ? null : descriptor.getResultId());
  }
}
