package com.scholary.audioqc.metrics;

/** In-place iterative radix-2 FFT, enough for short-time power spectra. */
final class Fft {

  private Fft() {}

  static int nextPowerOfTwo(int n) {
    int size = 1;
    while (size < n) {
      size <<= 1;
    }
    return size;
  }

  /**
   * Power spectrum {@code |X[k]|^2} for {@code k = 0 .. nfft/2}.
   *
   * @param frame real input, zero-padded to {@code nfft}
   * @param nfft transform size, a power of two
   */
  static double[] powerSpectrum(double[] frame, int nfft) {
    if (Integer.bitCount(nfft) != 1) {
      throw new IllegalArgumentException("FFT size must be a power of two: " + nfft);
    }
    double[] re = new double[nfft];
    double[] im = new double[nfft];
    System.arraycopy(frame, 0, re, 0, Math.min(frame.length, nfft));

    transform(re, im);

    double[] power = new double[nfft / 2 + 1];
    for (int k = 0; k < power.length; k++) {
      power[k] = re[k] * re[k] + im[k] * im[k];
    }
    return power;
  }

  private static void transform(double[] re, double[] im) {
    int n = re.length;

    // bit reversal
    for (int i = 1, j = 0; i < n; i++) {
      int bit = n >> 1;
      for (; (j & bit) != 0; bit >>= 1) {
        j ^= bit;
      }
      j ^= bit;
      if (i < j) {
        double t = re[i];
        re[i] = re[j];
        re[j] = t;
        t = im[i];
        im[i] = im[j];
        im[j] = t;
      }
    }

    for (int len = 2; len <= n; len <<= 1) {
      double angle = -2.0 * Math.PI / len;
      double wRe = Math.cos(angle);
      double wIm = Math.sin(angle);
      for (int start = 0; start < n; start += len) {
        double curRe = 1.0;
        double curIm = 0.0;
        for (int k = 0; k < len / 2; k++) {
          int a = start + k;
          int b = a + len / 2;
          double tRe = re[b] * curRe - im[b] * curIm;
          double tIm = re[b] * curIm + im[b] * curRe;
          re[b] = re[a] - tRe;
          im[b] = im[a] - tIm;
          re[a] += tRe;
          im[a] += tIm;
          double nextRe = curRe * wRe - curIm * wIm;
          curIm = curRe * wIm + curIm * wRe;
          curRe = nextRe;
        }
      }
    }
  }
}
