package com.heavyai.client.api.impl.load;

import com.heavyai.client.common.util.ArrowUtil;
import com.heavyai.client.common.util.HeavyTypeUtil;
import com.heavyai.client.exception.TypeMismatchException;
import com.heavyai.client.model.core.ColumnEncoding;
import com.heavyai.client.model.core.ColumnSpec;
import com.heavyai.client.model.core.ColumnType;
import com.heavyai.client.model.core.ColumnarFrame;
import com.heavyai.client.model.core.TabularData;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.vector.FieldVector;

/**
 * Derives the column specs of a new table from a load source.
 *
 * <p>Arrow tables keep their field types. Other sources use each column's declared or inferred
 * type; a column with no non-null value becomes a string column. Strings are dictionary encoded
 * with 32-bit codes, decimals get the widest supported precision and the largest scale seen, and
 * timestamps get the finest precision any value needs.
 */
public class SchemaInference {

  public List<ColumnSpec> inferColumnSpecs(TabularData data) throws TypeMismatchException {
    List<ColumnSpec> specs = new ArrayList<>(data.getColumnCount());
    if (data.getKind() == TabularData.Kind.ARROW_TABLE) {
      for (FieldVector vector : data.getArrowTable().getFieldVectors()) {
        specs.add(ArrowUtil.toColumnSpec(vector.getField()));
      }
      return specs;
    }
    for (ColumnarFrame.Column column : data.toColumnarFrame().getColumns()) {
      specs.add(inferColumnSpec(column));
    }
    return specs;
  }

  ColumnSpec inferColumnSpec(ColumnarFrame.Column column) {
    ColumnType type = column.getType() == null ? ColumnType.STR : column.getType();
    ColumnSpec.Builder builder = ColumnSpec.builder(column.getName(), type);
    switch (type) {
      case STR:
        builder.withEncoding(ColumnEncoding.DICT).withCompParam(ColumnSpec.DEFAULT_DICT_BITS);
        break;
      case DATE:
        builder.withEncoding(ColumnEncoding.DAYS).withCompParam(32);
        break;
      case DECIMAL:
        builder.withPrecision(HeavyTypeUtil.MAX_DECIMAL_PRECISION).withScale(maxScale(column));
        break;
      case TIMESTAMP:
        builder.withPrecision(timestampPrecision(column));
        break;
      default:
        break;
    }
    return builder.build();
  }

  private static int maxScale(ColumnarFrame.Column column) {
    int scale = 0;
    for (Object value : column.getValues()) {
      if (value instanceof BigDecimal) {
        scale = Math.max(scale, ((BigDecimal) value).scale());
      }
    }
    return Math.min(scale, HeavyTypeUtil.MAX_DECIMAL_PRECISION);
  }

  private static int timestampPrecision(ColumnarFrame.Column column) {
    int precision = 0;
    for (Object value : column.getValues()) {
      int nanos = nanosOf(value);
      if (nanos % 1_000 != 0) {
        return 9;
      } else if (nanos % 1_000_000 != 0) {
        precision = Math.max(precision, 6);
      } else if (nanos != 0) {
        precision = Math.max(precision, 3);
      }
    }
    return precision;
  }

  private static int nanosOf(Object value) {
    if (value instanceof java.sql.Timestamp) {
      return ((java.sql.Timestamp) value).getNanos();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).getNano();
    }
    if (value instanceof Instant) {
      return ((Instant) value).getNano();
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).getNano();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).getNano();
    }
    if (value instanceof java.util.Date) {
      return (int) Math.floorMod(((java.util.Date) value).getTime(), 1_000L) * 1_000_000;
    }
    return 0;
  }
}
