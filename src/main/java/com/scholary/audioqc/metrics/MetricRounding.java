package com.scholary.audioqc.metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Rounding used for every value that leaves the service with a fixed number of decimals. */
public final class MetricRounding {

  public static final int REPORTED_DECIMALS = 4;

  private MetricRounding() {}

  /**
   * Round half-up to {@link #REPORTED_DECIMALS} decimals.
   *
   * <p>Goes through the shortest decimal representation of the double so the same input always
   * yields the same output.
   */
  public static double round4(double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Cannot round non-finite metric value: " + value);
    }
    return BigDecimal.valueOf(value).setScale(REPORTED_DECIMALS, RoundingMode.HALF_UP).doubleValue();
  }

  public static double clamp01(double value) {
    if (value < 0.0) {
      return 0.0;
    }
    if (value > 1.0) {
      return 1.0;
    }
    return value;
  }
}
