package com.ospicorp.tstoolbox.series.filter;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.model.enums.FilterType;

/**
 * Time-domain smoothing by convolution with a normalised window. The signal is reflected by half
 * a window at both ends so the output keeps the input length.
 */
public final class WindowFilter {
  private WindowFilter() {
  }

  public static double[] apply(double[] vector, FilterType type, int windowLen) {
    if (type.isSpectral()) {
      throw new ValidationException("Filter type " + type + " is not a windowed filter.", 2008);
    }
    if (windowLen < 3) {
      return vector.clone();
    }
    if (windowLen % 2 == 0) {
      throw new ValidationException("The window_len must be odd for windowed filters, got "
          + windowLen + ".", 2006);
    }
    int n = vector.length;
    int half = windowLen / 2;
    if (n <= half) {
      throw new ValidationException("Input vector (length=" + n
          + ") needs to be bigger than half the window size (" + half + ").", 2005);
    }

    double[] w = window(type, windowLen);
    double sum = 0;
    for (double v : w) {
      sum += v;
    }

    double[] out = new double[n];
    for (int k = 0; k < n; k++) {
      double acc = 0;
      for (int j = 0; j < windowLen; j++) {
        acc += w[j] * vector[reflect(k + j - half, n)];
      }
      out[k] = acc / sum;
    }
    return out;
  }

  static double[] window(FilterType type, int m) {
    double[] w = new double[m];
    for (int i = 0; i < m; i++) {
      double phase = 2.0 * Math.PI * i / (m - 1);
      w[i] = switch (type) {
        case FLAT -> 1.0;
        case HANNING -> 0.5 - 0.5 * Math.cos(phase);
        case HAMMING -> 0.54 - 0.46 * Math.cos(phase);
        case BARTLETT -> 2.0 / (m - 1) * ((m - 1) / 2.0 - Math.abs(i - (m - 1) / 2.0));
        case BLACKMAN -> 0.42 - 0.5 * Math.cos(phase) + 0.08 * Math.cos(2.0 * phase);
        case FFT_LOWPASS, FFT_HIGHPASS -> throw new IllegalStateException("not a window: " + type);
      };
    }
    return w;
  }

  // mirror without repeating the edge sample: [3 2 | 1 2 3 4 | 3 2]
  private static int reflect(int i, int n) {
    if (i < 0) {
      return -i;
    }
    if (i >= n) {
      return 2 * (n - 1) - i;
    }
    return i;
  }
}
