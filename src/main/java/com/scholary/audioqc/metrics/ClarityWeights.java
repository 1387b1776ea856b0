package com.scholary.audioqc.metrics;

/** Relative weights of the clarity sub-scores. Only their ratios matter. */
public record ClarityWeights(double snr, double hf, double flat) {

  public ClarityWeights {
    if (snr < 0 || hf < 0 || flat < 0) {
      throw new IllegalArgumentException("Clarity weights cannot be negative");
    }
    if (snr + hf + flat <= 0) {
      throw new IllegalArgumentException("Clarity weights must have a positive sum");
    }
  }

  /**
   * Weighted mean of the three sub-scores scaled to [0, 100].
   *
   * <p>Weights are normalised to sum to 1 before they are applied.
   */
  public double composite(double snrScore, double hfScore, double flatScore) {
    double sum = snr + hf + flat;
    return 100.0 * ((snr / sum) * snrScore + (hf / sum) * hfScore + (flat / sum) * flatScore);
  }
}
