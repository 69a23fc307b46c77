package com.ospicorp.trendreport.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.trendreport.pipeline.model.TrendModel;
import com.ospicorp.trendreport.pipeline.model.XYPoint;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrendFitterTest {

  private static List<XYPoint> points(double... xy) {
    List<XYPoint> points = new ArrayList<>();
    for (int i = 0; i < xy.length; i += 2) {
      points.add(new XYPoint(xy[i], xy[i + 1]));
    }
    return points;
  }

  @Test
  void exactLineHasUnitRSquared() {
    TrendModel model = TrendFitter.fit(points(1, 2, 2, 4, 3, 6));

    assertEquals(2d, model.slope(), 1e-12);
    assertEquals(0d, model.intercept(), 1e-12);
    assertEquals(1d, model.rSquared(), 1e-12);
    assertEquals(3, model.points());
    assertEquals(0d, model.residualStandardError(), 1e-12);
    assertEquals(0d, model.slopePValue(), 1e-12);
  }

  @Test
  void noisyFitMatchesReferenceStatistics() {
    TrendModel model = TrendFitter.fit(points(1, 1, 2, 3, 3, 2, 4, 5));

    assertEquals(1.1d, model.slope(), 1e-12);
    assertEquals(0d, model.intercept(), 1e-12);
    assertEquals(0.691428571d, model.rSquared(), 1e-9);
    assertEquals(Math.sqrt(1.35d), model.residualStandardError(), 1e-12);
    assertEquals(Math.sqrt(0.27d), model.slopeStandardError(), 1e-12);
    assertEquals(1.1d / Math.sqrt(0.27d), model.tStatistic(), 1e-12);
    // two degrees of freedom: p = 1 - t / sqrt(2 + t^2)
    assertEquals(1d - Math.sqrt(1.21d / 1.75d), model.slopePValue(), 1e-9);
    assertEquals(2, model.degreesOfFreedom());
  }

  @Test
  void twoPointsFitWithoutInferenceStatistics() {
    TrendModel model = TrendFitter.fit(points(0, 1, 2, 5));
    assertEquals(2d, model.slope(), 1e-12);
    assertEquals(1d, model.intercept(), 1e-12);
    assertNull(model.residualStandardError());
    assertNull(model.slopeStandardError());
    assertNull(model.tStatistic());
    assertNull(model.slopePValue());
  }

  @Test
  void constantYIsAPerfectFlatFit() {
    TrendModel model = TrendFitter.fit(points(1, 3, 2, 3, 3, 3));
    assertEquals(0d, model.slope(), 1e-12);
    assertEquals(3d, model.intercept(), 1e-12);
    assertEquals(1d, model.rSquared());
    assertEquals(0d, model.tStatistic());
    assertEquals(1d, model.slopePValue(), 1e-12);
  }

  @Test
  void constantXIsDegenerate() {
    var ex = assertThrows(DegenerateInputException.class,
        () -> TrendFitter.fit(points(2, 1, 2, 3, 2, 5)));
    assertEquals(3, ex.points());
  }

  @Test
  void repeatedDecimalXIsDegenerate() {
    // the mean of 0.1, 0.1, 0.1 is not exactly 0.1
    var ex = assertThrows(DegenerateInputException.class,
        () -> TrendFitter.fit(points(0.1, 5, 0.1, 7, 0.1, 10)));
    assertTrue(ex.getMessage().contains("zero variance"));
  }

  @Test
  void pValueMatchesClosedFormsAtOneAndTwoDegrees() {
    // df 1: 1 - 2 atan(t) / pi; df 2: 1 - t / sqrt(2 + t^2)
    assertEquals(0.5d, TrendFitter.twoSidedPValue(1d, 1), 1e-10);
    assertEquals(1d - 2d * Math.atan(3d) / Math.PI, TrendFitter.twoSidedPValue(-3d, 1), 1e-10);
    assertEquals(1d - Math.sqrt(2d) / 2d, TrendFitter.twoSidedPValue(Math.sqrt(2d), 2), 1e-10);
    assertEquals(1d, TrendFitter.twoSidedPValue(0d, 5), 1e-12);
    assertEquals(0d, TrendFitter.twoSidedPValue(Double.NEGATIVE_INFINITY, 5));
  }

  @Test
  void fewerThanTwoPointsIsDegenerate() {
    assertThrows(DegenerateInputException.class, () -> TrendFitter.fit(List.of()));
    assertThrows(DegenerateInputException.class, () -> TrendFitter.fit(points(1, 1)));
  }

  @Test
  void nonFiniteInputIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TrendFitter.fit(points(1, 1, 2, Double.NaN, 3, 3)));
    assertThrows(IllegalArgumentException.class,
        () -> TrendFitter.fit(points(1, 1, Double.POSITIVE_INFINITY, 2)));
  }

  @Test
  void largeOffsetsDoNotLosePrecision() {
    TrendModel model = TrendFitter.fit(points(1e9, 5e9 + 1, 1e9 + 1, 5e9 + 4, 1e9 + 2, 5e9 + 7));
    assertEquals(3d, model.slope(), 1e-6);
    assertEquals(1d, model.rSquared(), 1e-9);
  }
}
