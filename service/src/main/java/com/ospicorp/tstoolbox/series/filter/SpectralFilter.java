package com.ospicorp.tstoolbox.series.filter;

import com.ospicorp.tstoolbox.series.ValidationException;
import edu.emory.mathcs.jtransforms.fft.DoubleFFT_1D;
import java.util.Arrays;

/**
 * Frequency-domain low-pass and high-pass filtering of an evenly sampled signal.
 *
 * <p>The spectrum is multiplied by a 0/1 mask over the rfft bins whose edge has been smoothed with
 * a {@code windowLen}-sample running average, then transformed back. Both {@code cutoffPeriod}
 * (in sample units) and {@code windowLen} are mandatory.
 */
public final class SpectralFilter {
  private SpectralFilter() {
  }

  public static double[] lowpass(double[] vector, Double cutoffPeriod, Integer windowLen) {
    return transform(vector, cutoffPeriod, windowLen, true);
  }

  public static double[] highpass(double[] vector, Double cutoffPeriod, Integer windowLen) {
    return transform(vector, cutoffPeriod, windowLen, false);
  }

  private static double[] transform(double[] vector, Double cutoffPeriod, Integer windowLen,
      boolean lowpass) {
    if (cutoffPeriod == null) {
      throw new ValidationException("The cutoff_period must be set.", 2001);
    }
    if (windowLen == null) {
      throw new ValidationException("The window_len must be set.", 2002);
    }
    if (windowLen < 1) {
      throw new ValidationException("The window_len must be at least 1, got " + windowLen + ".",
          2003);
    }
    if (!(cutoffPeriod > 0)) {
      throw new ValidationException("The cutoff_period must be positive, got " + cutoffPeriod
          + ".", 2004);
    }
    int n = vector.length;
    if (n == 0) {
      return new double[0];
    }

    double[] mask = mask(n, 1.0 / cutoffPeriod, windowLen, lowpass);

    // interleaved re/im, element(2k) = real part (k), element(2k+1) = imaginary part (k)
    double[] data = new double[2 * n];
    for (int i = 0; i < n; i++) {
      data[2 * i] = vector[i];
    }
    DoubleFFT_1D fft = new DoubleFFT_1D(n);
    fft.complexForward(data);
    for (int k = 0; k < n; k++) {
      // bins above n/2 mirror the positive frequencies of a real signal
      double factor = mask[k <= n / 2 ? k : n - k];
      data[2 * k] *= factor;
      data[2 * k + 1] *= factor;
    }
    fft.complexInverse(data, true);

    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      out[i] = data[2 * i];
    }
    return out;
  }

  /** Frequencies of the {@code n/2 + 1} rfft bins for unit sample spacing. */
  static double[] frequencies(int n) {
    double[] freq = new double[n / 2 + 1];
    for (int k = 0; k < freq.length; k++) {
      freq[k] = (double) k / n;
    }
    return freq;
  }

  static double[] mask(int n, double cutoffFrequency, int windowLen, boolean lowpass) {
    double[] freq = frequencies(n);
    int pad = windowLen + 1;
    double[] padded = new double[freq.length + 2 * pad];
    double retainedLow = lowpass ? 1.0 : 0.0;
    Arrays.fill(padded, 0, pad, retainedLow);
    Arrays.fill(padded, pad + freq.length, padded.length, 1.0 - retainedLow);
    for (int k = 0; k < freq.length; k++) {
      boolean suppressed = lowpass ? freq[k] > cutoffFrequency : freq[k] < cutoffFrequency;
      padded[pad + k] = suppressed ? 0.0 : 1.0;
    }
    double[] smoothed = movingAverageSame(padded, windowLen);
    return Arrays.copyOfRange(smoothed, pad, pad + freq.length);
  }

  /**
   * Convolution with a {@code 1/windowLen} box kernel, "same" length output. The kernel covers
   * {@code [k - windowLen/2, k + windowLen - 1 - windowLen/2]}; samples outside the input count
   * as zero.
   */
  static double[] movingAverageSame(double[] a, int windowLen) {
    int left = windowLen / 2;
    double[] out = new double[a.length];
    for (int k = 0; k < a.length; k++) {
      double sum = 0;
      for (int j = k - left; j < k - left + windowLen; j++) {
        if (j >= 0 && j < a.length) {
          sum += a[j];
        }
      }
      out[k] = sum / windowLen;
    }
    return out;
  }
}
