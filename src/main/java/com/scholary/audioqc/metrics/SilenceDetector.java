package com.scholary.audioqc.metrics;

/**
 * Decides whether decoded audio is silent.
 *
 * <p>Samples are expected normalised to [-1, 1], so 0 dBFS is a full-scale square wave. In
 * {@link SilenceMode#RMS} mode the audio is silent when its overall level is at or below the
 * threshold. In {@link SilenceMode#FRAMES} mode each frame is classified separately and the
 * audio is silent when fewer than {@code activeRatio} of the frames are above the threshold.
 */
public class SilenceDetector {

  private static final double EPS = 1e-12;

  private final double thresholdDbfs;
  private final SilenceMode mode;
  private final int frameMs;
  private final int hopMs;
  private final double activeRatio;

  public SilenceDetector(
      double thresholdDbfs, SilenceMode mode, int frameMs, int hopMs, double activeRatio) {
    this.thresholdDbfs = thresholdDbfs;
    this.mode = mode;
    this.frameMs = frameMs;
    this.hopMs = hopMs;
    this.activeRatio = activeRatio;
  }

  /** RMS-only detector. */
  public SilenceDetector(double thresholdDbfs) {
    this(thresholdDbfs, SilenceMode.RMS, 20, 10, 0.05);
  }

  public SilenceResult detect(float[] samples, int sampleRate) {
    if (samples.length == 0 || sampleRate <= 0) {
      throw new IllegalArgumentException("Silence detection needs non-empty samples and a sample rate");
    }

    double level = rmsDbfs(samples, 0, samples.length);
    boolean silent =
        mode == SilenceMode.FRAMES
            ? isSilentByFrames(samples, sampleRate, level)
            : level <= thresholdDbfs;
    return new SilenceResult(level, silent);
  }

  private boolean isSilentByFrames(float[] samples, int sampleRate, double overallLevel) {
    int frameLen = (int) ((long) sampleRate * frameMs / 1000);
    int hop = (int) ((long) sampleRate * hopMs / 1000);
    if (frameLen <= 0 || hop <= 0 || samples.length < frameLen) {
      return overallLevel <= thresholdDbfs;
    }

    int frames = 1 + (samples.length - frameLen) / hop;
    int active = 0;
    for (int i = 0; i < frames; i++) {
      if (rmsDbfs(samples, i * hop, frameLen) > thresholdDbfs) {
        active++;
      }
    }
    return (double) active / frames < activeRatio;
  }

  /** RMS level of {@code samples[from, from + length)} in dBFS. */
  static double rmsDbfs(float[] samples, int from, int length) {
    double sumSquares = 0.0;
    for (int i = from; i < from + length; i++) {
      double x = samples[i];
      sumSquares += x * x;
    }
    double rms = Math.sqrt(sumSquares / length + EPS);
    return 20.0 * Math.log10(Math.max(rms, EPS));
  }
}
