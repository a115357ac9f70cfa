package com.heavyai.client.api.impl.load;

import com.google.common.annotations.VisibleForTesting;
import com.heavyai.client.common.util.ArrowUtil;
import com.heavyai.client.common.util.HeavyTypeUtil;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnarFrame;
import com.heavyai.client.model.core.TabularData;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeSecVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Produces the Arrow stream payload of an Arrow load.
 *
 * <p>Arrow sources are written as they are. Frames and tuple sequences are first copied into an
 * Arrow table whose schema follows the target table's column specs, matched by position.
 */
public class ArrowPayloadSerializer {

  private static final HeavyLogger LOGGER =
      HeavyLoggerFactory.getLogger(ArrowPayloadSerializer.class);

  private final BufferAllocator allocator;

  public ArrowPayloadSerializer(BufferAllocator allocator) {
    this.allocator = allocator;
  }

  /**
   * Serializes a load source into one Arrow stream.
   *
   * @param data the source
   * @param specs column specs of the target table, one per source column
   * @return the stream bytes: schema message, one record batch, end of stream
   */
  public byte[] serialize(TabularData data, List<ColumnSpec> specs) throws HeavyClientException {
    if (data.getKind() == TabularData.Kind.ARROW_TABLE) {
      return ArrowUtil.writeStream(data.getArrowTable());
    }
    try (VectorSchemaRoot root = toArrowTable(data.toColumnarFrame(), specs)) {
      return ArrowUtil.writeStream(root);
    }
  }

  /** Copies a frame into a new Arrow table typed by the given specs. The caller closes it. */
  @VisibleForTesting
  VectorSchemaRoot toArrowTable(ColumnarFrame frame, List<ColumnSpec> specs)
      throws TypeMismatchException {
    int rowCount = frame.getRowCount();
    VectorSchemaRoot root = VectorSchemaRoot.create(ArrowUtil.toArrowSchema(specs), allocator);
    try {
      for (int i = 0; i < specs.size(); i++) {
        ColumnSpec spec = specs.get(i);
        ColumnarFrame.Column column = frame.getColumn(i);
        if (!HeavyTypeUtil.isCoercible(column.getType(), spec.getType())) {
          throw new TypeMismatchException(
              String.format(
                  "Source column %s of type %s cannot be loaded into column %s of type %s",
                  column.getName(), column.getType(), spec.getName(), spec.getType()));
        }
        FieldVector vector = root.getVector(i);
        vector.setInitialCapacity(rowCount);
        vector.allocateNew();
        for (int row = 0; row < rowCount; row++) {
          Object value = column.getValues().get(row);
          if (HeavyTypeUtil.isNullValue(value)) {
            setNull(vector, row);
          } else {
            setValue(vector, spec, row, value);
          }
        }
        vector.setValueCount(rowCount);
      }
      root.setRowCount(rowCount);
    } catch (TypeMismatchException | RuntimeException e) {
      root.close();
      throw e;
    }
    LOGGER.debug("Built Arrow table with {} rows x {} columns", rowCount, specs.size());
    return root;
  }

  private static void setValue(FieldVector vector, ColumnSpec spec, int row, Object value)
      throws TypeMismatchException {
    switch (spec.getType()) {
      case BOOL:
        ((BitVector) vector).setSafe(row, HeavyTypeUtil.toBoolean(spec, value) ? 1 : 0);
        break;
      case TINYINT:
        ((TinyIntVector) vector).setSafe(row, (int) HeavyTypeUtil.toLong(spec, value));
        break;
      case SMALLINT:
        ((SmallIntVector) vector).setSafe(row, (int) HeavyTypeUtil.toLong(spec, value));
        break;
      case INT:
        ((IntVector) vector).setSafe(row, (int) HeavyTypeUtil.toLong(spec, value));
        break;
      case BIGINT:
        ((BigIntVector) vector).setSafe(row, HeavyTypeUtil.toLong(spec, value));
        break;
      case FLOAT:
        ((Float4Vector) vector).setSafe(row, (float) HeavyTypeUtil.toDouble(spec, value));
        break;
      case DOUBLE:
        ((Float8Vector) vector).setSafe(row, HeavyTypeUtil.toDouble(spec, value));
        break;
      case DECIMAL:
        ((DecimalVector) vector).setSafe(row, HeavyTypeUtil.toDecimal(spec, value));
        break;
      case STR:
        ((VarCharVector) vector)
            .setSafe(
                row, HeavyTypeUtil.toStringValue(spec, value).getBytes(StandardCharsets.UTF_8));
        break;
      case DATE:
        ((DateDayVector) vector).setSafe(row, (int) HeavyTypeUtil.toEpochDay(spec, value));
        break;
      case TIME:
        ((TimeSecVector) vector).setSafe(row, (int) HeavyTypeUtil.toSecondOfDay(spec, value));
        break;
      case TIMESTAMP:
        ((TimeStampVector) vector).setSafe(row, HeavyTypeUtil.toEpochTimestamp(spec, value));
        break;
      default:
        throw new TypeMismatchException("Unsupported column type " + spec.getType());
    }
  }

  private static void setNull(FieldVector vector, int row) {
    if (vector instanceof BaseFixedWidthVector) {
      ((BaseFixedWidthVector) vector).setNull(row);
    } else if (vector instanceof BaseVariableWidthVector) {
      ((BaseVariableWidthVector) vector).setNull(row);
    } else {
      throw new IllegalStateException("Cannot set null in vector " + vector.getField());
    }
  }
}
