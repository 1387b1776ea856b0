package com.scholary.audioqc.decode;

/**
 * Mono PCM samples normalised to [-1, 1].
 *
 * <p>The buffer belongs to a single request and is never shared across requests.
 *
 * @param samples sample values
 * @param sampleRate samples per second
 * @param durationMs {@code round(samples.length * 1000 / sampleRate)}
 */
public record DecodedAudio(float[] samples, int sampleRate, long durationMs) {

  public static DecodedAudio of(float[] samples, int sampleRate) {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
    }
    long durationMs = Math.round(samples.length * 1000.0 / sampleRate);
    return new DecodedAudio(samples, sampleRate, durationMs);
  }

  public int length() {
    return samples.length;
  }

  /** True when the buffer is non-empty and every sample is finite. */
  public boolean isWellFormed() {
    if (samples.length == 0) {
      return false;
    }
    for (float sample : samples) {
      if (!Float.isFinite(sample)) {
        return false;
      }
    }
    return true;
  }
}
