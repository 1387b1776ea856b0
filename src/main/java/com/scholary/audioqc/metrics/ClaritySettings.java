package com.scholary.audioqc.metrics;

/**
 * Tuning for the rule-based clarity score.
 *
 * @param winMs STFT window length
 * @param hopMs STFT hop length
 * @param hfLoHz lower edge of the high-frequency band
 * @param hfHiHz upper edge of the high-frequency band, capped at Nyquist
 * @param snrRamp maps the SNR estimate (dB) to a sub-score
 * @param hfRamp maps the high-frequency energy ratio to a sub-score
 * @param flatRef spectral flatness at which the flatness sub-score reaches 0
 * @param weights relative sub-score weights
 * @param noiseFrameFraction share of the quietest frames that estimates the noise floor
 * @param signalFrameFraction share of the loudest frames that estimates the signal level
 */
public record ClaritySettings(
    int winMs,
    int hopMs,
    double hfLoHz,
    double hfHiHz,
    TwoSegmentRamp snrRamp,
    TwoSegmentRamp hfRamp,
    double flatRef,
    ClarityWeights weights,
    double noiseFrameFraction,
    double signalFrameFraction) {

  public ClaritySettings {
    if (winMs <= 0 || hopMs <= 0) {
      throw new IllegalArgumentException("STFT window and hop must be positive");
    }
    if (hfLoHz < 0 || hfHiHz <= hfLoHz) {
      throw new IllegalArgumentException("High-frequency band must satisfy 0 <= lo < hi");
    }
    if (flatRef <= 0) {
      throw new IllegalArgumentException("flatRef must be positive");
    }
    if (noiseFrameFraction <= 0 || noiseFrameFraction > 1
        || signalFrameFraction <= 0 || signalFrameFraction > 1) {
      throw new IllegalArgumentException("Frame fractions must be in (0, 1]");
    }
  }
}
