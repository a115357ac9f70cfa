package com.heavyai.client.api.impl.load;

import static org.junit.jupiter.api.Assertions.*;

import com.heavyai.client.model.core.LoadMethod;
import com.heavyai.client.model.core.TabularData.Kind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for LoadStrategy selection. */
public class LoadStrategyTest {

  @ParameterizedTest
  @CsvSource({
    "INFER, ARROW_TABLE, true, ARROW",
    "INFER, COLUMNAR_FRAME, true, ARROW",
    "INFER, ROW_SEQUENCE, true, ROW_WISE",
    "INFER, ARROW_TABLE, false, COLUMNAR",
    "INFER, COLUMNAR_FRAME, false, COLUMNAR",
    "INFER, ROW_SEQUENCE, false, ROW_WISE",
    "ARROW, ROW_SEQUENCE, false, ARROW",
    "COLUMNAR, ROW_SEQUENCE, true, COLUMNAR",
    "ROWS, ARROW_TABLE, true, ROW_WISE"
  })
  void testSelect(LoadMethod method, Kind kind, boolean arrowEnabled, LoadStrategy expected) {
    assertEquals(expected, LoadStrategy.select(method, kind, arrowEnabled));
  }
}
