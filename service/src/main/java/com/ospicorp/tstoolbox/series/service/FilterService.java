package com.ospicorp.tstoolbox.series.service;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.filter.SpectralFilter;
import com.ospicorp.tstoolbox.series.filter.WindowFilter;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import com.ospicorp.tstoolbox.series.model.enums.FilterType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class FilterService {
  static final String SUFFIX = "_filter";

  private static final Logger log = LoggerFactory.getLogger(FilterService.class);

  private final int defaultWindowLen;

  public FilterService(@Value("${tstoolbox.filter.window-len:5}") int defaultWindowLen) {
    this.defaultWindowLen = defaultWindowLen;
  }

  /**
   * Filters every column of {@code series} independently.
   *
   * @param windowLen smoothing window; windowed filters fall back to the configured default when
   *     null, FFT filters require it
   * @param cutoffPeriod cutoff in samples, FFT filters only
   */
  public TimeSeries filter(TimeSeries series, FilterType type, Double cutoffPeriod,
      Integer windowLen, boolean printInput) {
    Integer effectiveWindow = windowLen == null && !type.isSpectral() ? defaultWindowLen : windowLen;
    if (effectiveWindow != null && series.size() <= effectiveWindow) {
      throw new ValidationException("Input vector (length=" + series.size()
          + ") needs to be bigger than window size (" + effectiveWindow + ").", 2005);
    }

    Map<String, double[]> filtered = new LinkedHashMap<>();
    for (String name : series.columnNames()) {
      double[] values = series.values(name);
      filtered.put(name, switch (type) {
        case FFT_LOWPASS -> SpectralFilter.lowpass(requireComplete(name, values), cutoffPeriod,
            effectiveWindow);
        case FFT_HIGHPASS -> SpectralFilter.highpass(requireComplete(name, values), cutoffPeriod,
            effectiveWindow);
        default -> WindowFilter.apply(values, type, effectiveWindow);
      });
    }
    log.debug("Applied {} filter (window_len={}, cutoff_period={}) to {} column(s) of {} rows",
        type, effectiveWindow, cutoffPeriod, filtered.size(), series.size());

    TimeSeries result = series.withColumns(filtered);
    return printInput ? series.join(result, SUFFIX) : result;
  }

  private static double[] requireComplete(String column, double[] values) {
    for (double v : values) {
      if (Double.isNaN(v)) {
        throw new ValidationException("Column " + column + " contains missing values; FFT "
            + "filters need a complete, evenly sampled series.", 2007);
      }
    }
    return values;
  }
}
