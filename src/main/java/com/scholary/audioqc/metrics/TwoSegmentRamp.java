package com.scholary.audioqc.metrics;

/**
 * Piecewise-linear score with a rising ramp, a plateau at 1 and a falling ramp.
 *
 * <pre>
 *   1 |        ________
 *     |       /        \
 *   0 |______/          \______
 *       riseStart  fallStart
 *            riseEnd        fallEnd
 * </pre>
 */
public record TwoSegmentRamp(double riseStart, double riseEnd, double fallStart, double fallEnd) {

  public TwoSegmentRamp {
    if (!(riseStart < riseEnd && riseEnd <= fallStart && fallStart < fallEnd)) {
      throw new IllegalArgumentException(
          String.format(
              "Ramp breakpoints must satisfy riseStart < riseEnd <= fallStart < fallEnd, got %s, %s, %s, %s",
              riseStart, riseEnd, fallStart, fallEnd));
    }
  }

  public double score(double x) {
    if (x <= riseStart) {
      return 0.0;
    }
    if (x < riseEnd) {
      return (x - riseStart) / (riseEnd - riseStart);
    }
    if (x <= fallStart) {
      return 1.0;
    }
    if (x < fallEnd) {
      return 1.0 - (x - fallStart) / (fallEnd - fallStart);
    }
    return 0.0;
  }
}
