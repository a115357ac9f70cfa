package com.heavyai.client.api.impl.load;

import com.heavyai.client.common.util.HeavyTypeUtil;
import com.heavyai.client.model.core.StringRow;
import com.heavyai.client.model.core.StringValue;
import java.util.ArrayList;
import java.util.List;

/** Renders source tuples into the server's string-row representation for row-wise loads. */
public class RowBuilder {

  public List<StringRow> buildRows(List<List<Object>> rows) {
    List<StringRow> result = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      result.add(buildRow(row));
    }
    return result;
  }

  StringRow buildRow(List<Object> row) {
    List<StringValue> values = new ArrayList<>(row.size());
    for (Object value : row) {
      if (HeavyTypeUtil.isNullValue(value)) {
        values.add(StringValue.ofNull());
      } else {
        values.add(StringValue.of(HeavyTypeUtil.toLiteral(value)));
      }
    }
    return new StringRow(values);
  }
}
