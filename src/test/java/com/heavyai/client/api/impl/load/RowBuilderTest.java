package com.heavyai.client.api.impl.load;

import static org.junit.jupiter.api.Assertions.*;

import com.heavyai.client.model.core.StringRow;
import com.heavyai.client.model.core.StringValue;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for RowBuilder. */
public class RowBuilderTest {

  private final RowBuilder rowBuilder = new RowBuilder();

  @Test
  void testBuildRowsKeepsOrder() {
    List<StringRow> rows =
        rowBuilder.buildRows(
            Arrays.asList(Arrays.asList(1, "a"), Arrays.asList(2, "b"), Arrays.asList(3, "c")));

    assertEquals(3, rows.size());
    assertEquals(
        Arrays.asList(StringValue.of("2"), StringValue.of("b")), rows.get(1).getColumns());
  }

  @Test
  void testBuildRowRendersNullsAndLiterals() {
    StringRow row =
        rowBuilder.buildRow(
            Arrays.asList(
                null,
                Double.NaN,
                new BigDecimal("1.50"),
                Arrays.asList("x", "y"),
                LocalDateTime.of(2024, 1, 2, 3, 4, 5)));

    List<StringValue> values = row.getColumns();
    assertTrue(values.get(0).isNull());
    assertTrue(values.get(1).isNull());
    assertEquals("1.50", values.get(2).getValue());
    assertEquals("{x,y}", values.get(3).getValue());
    assertEquals("2024-01-02 03:04:05", values.get(4).getValue());
  }
}
