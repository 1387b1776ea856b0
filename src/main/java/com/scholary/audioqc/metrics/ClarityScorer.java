package com.scholary.audioqc.metrics;

import java.util.Arrays;

/**
 * Rule-based clarity score (v1).
 *
 * <p>The signal is cut into Hann-windowed frames and a power spectrum is computed per frame.
 * Three raw measurements come out of that pass:
 *
 * <ul>
 *   <li>SNR estimate: mean energy of the loudest frames over mean energy of the quietest frames,
 *       in dB
 *   <li>high-frequency ratio: spectral energy inside {@code [hfLoHz, hfHiHz]} over all spectral
 *       energy
 *   <li>spectral flatness: geometric over arithmetic mean of each frame's power spectrum,
 *       averaged over frames (1 is white noise, near 0 is tonal)
 * </ul>
 *
 * <p>Each measurement is mapped to a [0, 1] sub-score and the sub-scores are combined with
 * normalised weights. Everything is computed in double precision in a fixed order, so the same
 * samples always give the same numbers.
 */
public class ClarityScorer {

  private static final double EPS = 1e-12;

  private final ClaritySettings settings;

  public ClarityScorer(ClaritySettings settings) {
    this.settings = settings;
  }

  public ClarityResult score(float[] samples, int sampleRate) {
    if (samples.length == 0 || sampleRate <= 0) {
      throw new IllegalArgumentException("Clarity needs non-empty samples and a sample rate");
    }

    int win = Math.max(1, (int) Math.round(sampleRate * settings.winMs() / 1000.0));
    int hop = Math.max(1, (int) Math.round(sampleRate * settings.hopMs() / 1000.0));
    int nfft = Fft.nextPowerOfTwo(win);
    double[] window = hann(win);

    int frames = samples.length < win ? 1 : 1 + (samples.length - win) / hop;
    double binHz = (double) sampleRate / nfft;
    double hfHi = Math.min(settings.hfHiHz(), sampleRate / 2.0);

    double[] frameEnergy = new double[frames];
    double totalSpectral = 0.0;
    double hfSpectral = 0.0;
    double flatnessSum = 0.0;

    double[] frame = new double[win];
    for (int f = 0; f < frames; f++) {
      int offset = f * hop;
      double energy = 0.0;
      for (int i = 0; i < win; i++) {
        int idx = offset + i;
        double x = idx < samples.length ? samples[idx] : 0.0;
        energy += x * x;
        frame[i] = x * window[i];
      }
      frameEnergy[f] = energy / win;

      double[] power = Fft.powerSpectrum(frame, nfft);
      double logSum = 0.0;
      double linSum = 0.0;
      for (int k = 0; k < power.length; k++) {
        double p = power[k];
        double freq = k * binHz;
        totalSpectral += p;
        if (freq >= settings.hfLoHz() && freq <= hfHi) {
          hfSpectral += p;
        }
        double floored = Math.max(p, EPS);
        logSum += Math.log(floored);
        linSum += floored;
      }
      double geometric = Math.exp(logSum / power.length);
      double arithmetic = linSum / power.length;
      flatnessSum += geometric / Math.max(arithmetic, EPS);
    }

    double snrDb = estimateSnrDb(frameEnergy);
    double hfRatio = hfSpectral / (totalSpectral + EPS);
    double flatness = flatnessSum / frames;

    double snrScore = settings.snrRamp().score(snrDb);
    double hfScore = settings.hfRamp().score(hfRatio);
    double flatScore = MetricRounding.clamp01(1.0 - flatness / settings.flatRef());
    double clarity = settings.weights().composite(snrScore, hfScore, flatScore);

    ClarityDetail detail =
        new ClarityDetail(
            MetricRounding.round4(snrDb),
            MetricRounding.round4(hfRatio),
            MetricRounding.round4(flatness),
            snrScore,
            hfScore,
            flatScore);
    return new ClarityResult(MetricRounding.round4(clarity), detail);
  }

  private double estimateSnrDb(double[] frameEnergy) {
    double[] sorted = frameEnergy.clone();
    Arrays.sort(sorted);
    int n = sorted.length;

    int noiseCount = Math.max(1, (int) Math.floor(n * settings.noiseFrameFraction()));
    int signalCount = Math.max(1, (int) Math.floor(n * settings.signalFrameFraction()));

    double noise = 0.0;
    for (int i = 0; i < noiseCount; i++) {
      noise += sorted[i];
    }
    noise /= noiseCount;

    double signal = 0.0;
    for (int i = n - signalCount; i < n; i++) {
      signal += sorted[i];
    }
    signal /= signalCount;

    return 10.0 * Math.log10((signal + EPS) / (noise + EPS));
  }

  /** Periodic Hann window. */
  private static double[] hann(int length) {
    double[] w = new double[length];
    for (int i = 0; i < length; i++) {
      w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / length);
    }
    return w;
  }
}
