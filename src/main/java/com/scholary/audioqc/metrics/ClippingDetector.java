package com.scholary.audioqc.metrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds digital clipping: runs where {@code |sample| >= clipThreshold} lasting at least {@code
 * minEventSamples} samples. Shorter runs are ignored.
 */
public class ClippingDetector {

  private final double clipThreshold;
  private final int minEventSamples;

  public ClippingDetector(double clipThreshold, int minEventSamples) {
    if (clipThreshold <= 0.0 || clipThreshold >= 1.0) {
      throw new IllegalArgumentException("clipThreshold must be in (0, 1): " + clipThreshold);
    }
    if (minEventSamples < 1) {
      throw new IllegalArgumentException("minEventSamples must be >= 1: " + minEventSamples);
    }
    this.clipThreshold = clipThreshold;
    this.minEventSamples = minEventSamples;
  }

  /**
   * Scan the samples once and return qualifying events in start order.
   *
   * @param samples mono samples normalised to [-1, 1]
   * @param sampleRate samples per second, used to convert start samples to milliseconds
   */
  public List<ClipEvent> detect(float[] samples, int sampleRate) {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
    }

    List<ClipEvent> events = new ArrayList<>();
    int runStart = -1;
    for (int i = 0; i <= samples.length; i++) {
      boolean clipped = i < samples.length && Math.abs(samples[i]) >= clipThreshold;
      if (clipped && runStart < 0) {
        runStart = i;
      } else if (!clipped && runStart >= 0) {
        int length = i - runStart;
        if (length >= minEventSamples) {
          events.add(new ClipEvent(runStart, toMillis(runStart, sampleRate), length));
        }
        runStart = -1;
      }
    }
    return events;
  }

  private static double toMillis(long sample, int sampleRate) {
    return MetricRounding.round4(sample * 1000.0 / sampleRate);
  }
}
