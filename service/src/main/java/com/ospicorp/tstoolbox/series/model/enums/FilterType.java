package com.ospicorp.tstoolbox.series.model.enums;

public enum FilterType {
  FFT_LOWPASS,
  FFT_HIGHPASS,
  FLAT,
  HANNING,
  HAMMING,
  BARTLETT,
  BLACKMAN;

  public boolean isSpectral() {
    return this == FFT_LOWPASS || this == FFT_HIGHPASS;
  }
}
