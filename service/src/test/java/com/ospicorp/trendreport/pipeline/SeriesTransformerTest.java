package com.ospicorp.trendreport.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesTransformerTest {

  @Test
  void asIsCopiesTheInput() {
    List<Double> input = new ArrayList<>(Arrays.asList(1d, null, 2d));
    List<Double> out = SeriesTransformer.apply(input, Transform.AS_IS);
    assertEquals(input, out);
    assertNotSame(input, out);
    out.set(0, 99d);
    assertEquals(1d, input.get(0));
  }

  @Test
  void emptyInputGivesAnEmptyResultForEveryTransform() {
    for (Transform t : Transform.values()) {
      assertTrue(SeriesTransformer.apply(List.of(), t).isEmpty());
    }
  }

  @Test
  void diffHandlesNullsAndFirstValue() {
    var output = SeriesTransformer.apply(Arrays.asList(10d, 15d, null, 20d), Transform.DIFF);

    assertNull(output.get(0));
    assertEquals(5d, output.get(1));
    assertNull(output.get(2));
    assertNull(output.get(3));
  }

  @Test
  void pctChangeHandlesZerosAndMissing() {
    var output = SeriesTransformer.apply(Arrays.asList(10d, 12d, 0d, null, 9d),
        Transform.PCT_CHANGE);

    assertNull(output.get(0));
    assertEquals(20d, output.get(1));
    assertEquals(-100d, output.get(2));
    assertNull(output.get(3));
    assertNull(output.get(4));
  }

  @Test
  void valuesAreRoundedToSixDecimals() {
    var output = SeriesTransformer.apply(List.of(3d, 4d), Transform.PCT_CHANGE);
    assertEquals(33.333333d, output.get(1));
  }

  @Test
  void emptyInputStaysEmpty() {
    assertTrue(SeriesTransformer.apply(List.of(), Transform.DIFF).isEmpty());
  }
}
