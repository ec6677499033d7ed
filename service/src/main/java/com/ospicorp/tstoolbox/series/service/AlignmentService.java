package com.ospicorp.tstoolbox.series.service;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.alignment.SequenceAligner;
import com.ospicorp.tstoolbox.series.model.AlignmentResult;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import com.ospicorp.tstoolbox.series.model.enums.PointwiseDistance;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class AlignmentService {
  private static final Logger log = LoggerFactory.getLogger(AlignmentService.class);

  private final int defaultWindow;

  public AlignmentService(@Value("${tstoolbox.dtw.window:10000}") int defaultWindow) {
    this.defaultWindow = defaultWindow;
  }

  /** DTW distance of every unordered pair of distinct columns, in column order. */
  public List<AlignmentResult> pairwise(TimeSeries series, Integer window,
      PointwiseDistance distance) {
    int w = window == null ? defaultWindow : window;
    List<String> names = series.columnNames();
    List<double[]> cleaned = new ArrayList<>(names.size());
    for (String name : names) {
      cleaned.add(dropMissing(series.values(name)));
    }
    List<AlignmentResult> results = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      for (int j = i + 1; j < names.size(); j++) {
        results.add(new AlignmentResult(names.get(i), names.get(j),
            SequenceAligner.distance(cleaned.get(i), cleaned.get(j), distance, w)));
      }
    }
    log.debug("Aligned {} column pair(s) with window {} and {} distance", results.size(), w,
        distance);
    return results;
  }

  public AlignmentResult distance(TimeSeries series, String columnA, String columnB,
      Integer window, PointwiseDistance distance) {
    int w = window == null ? defaultWindow : window;
    double[] a = dropMissing(column(series, columnA));
    double[] b = dropMissing(column(series, columnB));
    return new AlignmentResult(columnA, columnB, SequenceAligner.distance(a, b, distance, w));
  }

  private static double[] column(TimeSeries series, String name) {
    if (name == null || !series.hasColumn(name)) {
      throw new ValidationException("Unknown column " + name + " to align. Available: "
          + series.columnNames() + ".", 4004);
    }
    return series.values(name);
  }

  private static double[] dropMissing(double[] values) {
    return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
  }
}
