package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.TrendModel;
import com.ospicorp.trendreport.pipeline.model.XYPoint;
import java.util.List;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Closed-form ordinary least squares for {@code y = intercept + slope * x}. Sums of squares are
 * taken around the means (two passes) to keep large coordinates such as cumulative counts from
 * cancelling.
 */
public final class TrendFitter {
  private TrendFitter() {
  }

  public static TrendModel fit(List<XYPoint> points) {
    int n = points.size();
    if (n < 2) {
      throw new DegenerateInputException("At least two points are needed to fit a trend, got " + n,
          n);
    }
    double sumX = 0d;
    double sumY = 0d;
    boolean distinctX = false;
    double firstX = points.get(0).x();
    for (XYPoint p : points) {
      if (!Double.isFinite(p.x()) || !Double.isFinite(p.y())) {
        throw new IllegalArgumentException("Trend input must be finite, got " + p);
      }
      distinctX |= p.x() != firstX;
      sumX += p.x();
      sumY += p.y();
    }
    if (!distinctX) {
      throw new DegenerateInputException(
          "Independent variable has zero variance (a single distinct value); "
              + "the slope is undefined", n);
    }
    double meanX = sumX / n;
    double meanY = sumY / n;

    double sxx = 0d;
    double sxy = 0d;
    double syy = 0d;
    for (XYPoint p : points) {
      double dx = p.x() - meanX;
      double dy = p.y() - meanY;
      sxx += dx * dx;
      sxy += dx * dy;
      syy += dy * dy;
    }
    if (sxx == 0d) {
      throw new DegenerateInputException(
          "Independent variable has zero variance; the slope is undefined", n);
    }

    double slope = sxy / sxx;
    double intercept = meanY - slope * meanX;

    double ssRes = 0d;
    for (XYPoint p : points) {
      double residual = p.y() - (intercept + slope * p.x());
      ssRes += residual * residual;
    }
    double rSquared = syy == 0d ? (ssRes == 0d ? 1d : 0d) : 1d - ssRes / syy;

    int df = n - 2;
    if (df == 0) {
      return new TrendModel(intercept, slope, n, rSquared, null, null, null, null);
    }
    double residualVariance = ssRes / df;
    double slopeStandardError = Math.sqrt(residualVariance / sxx);
    double tStatistic = slopeStandardError == 0d
        ? (slope == 0d ? 0d : Math.copySign(Double.POSITIVE_INFINITY, slope))
        : slope / slopeStandardError;
    double pValue = twoSidedPValue(tStatistic, df);
    return new TrendModel(intercept, slope, n, rSquared, Math.sqrt(residualVariance),
        slopeStandardError, tStatistic, pValue);
  }

  static double twoSidedPValue(double t, int degreesOfFreedom) {
    if (Double.isInfinite(t)) {
      return 0d;
    }
    TDistribution distribution = new TDistribution(degreesOfFreedom);
    return Math.min(1d, 2d * distribution.cumulativeProbability(-Math.abs(t)));
  }
}
