package com.ospicorp.tstoolbox.series.alignment;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.model.enums.PointwiseDistance;
import java.util.function.DoubleBinaryOperator;

/**
 * Banded Dynamic Time Warping distance between two numeric sequences.
 *
 * <p>The first row and column of the cost matrix are always filled. Interior cells are computed
 * only inside the inclusive band {@code |i - j| <= window}; cells outside the band are never
 * written and never take part in a minimum. With {@code window >= |M - N|} every cell of an
 * optimal path lies inside the band.
 *
 * <p>Only two rows of costs are held at a time, so memory grows with the length of {@code b}.
 */
public final class SequenceAligner {
  private SequenceAligner() {
  }

  public static double distance(double[] a, double[] b, int window) {
    return distance(a, b, PointwiseDistance.ABSOLUTE, window);
  }

  public static double distance(double[] a, double[] b, DoubleBinaryOperator d, int window) {
    if (a == null || b == null || a.length == 0 || b.length == 0) {
      throw new ValidationException("Sequences to align must not be empty.", 4001);
    }
    if (window < 1) {
      throw new ValidationException("The window must be at least 1, got " + window + ".", 4002);
    }
    int m = a.length;
    int n = b.length;
    CostMatrix cost = new CostMatrix(n);

    cost.put(0, d.applyAsDouble(a[0], b[0]));
    for (int j = 1; j < n; j++) {
      cost.put(j, cost.current(j - 1) + d.applyAsDouble(a[0], b[j]));
    }

    for (int i = 1; i < m; i++) {
      cost.advance();
      cost.put(0, cost.previous(0) + d.applyAsDouble(a[i], b[0]));
      int from = bandStart(i, window);
      int to = bandEnd(i, n, window);
      for (int j = from; j <= to; j++) {
        boolean found = false;
        double best = 0;
        if (cost.hasPrevious(j - 1)) {
          best = cost.previous(j - 1);
          found = true;
        }
        if (cost.hasCurrent(j - 1) && (!found || cost.current(j - 1) < best)) {
          best = cost.current(j - 1);
          found = true;
        }
        if (cost.hasPrevious(j) && (!found || cost.previous(j) < best)) {
          best = cost.previous(j);
          found = true;
        }
        if (found) {
          cost.put(j, best + d.applyAsDouble(a[i], b[j]));
        }
      }
    }

    if (!cost.hasCurrent(n - 1)) {
      throw new ValidationException("The window " + window
          + " is too narrow to align sequences of length " + m + " and " + n
          + "; it must be at least " + Math.abs(m - n) + ".", 4003);
    }
    return cost.current(n - 1);
  }

  /** First interior column computed in row {@code i >= 1}. */
  static int bandStart(int i, int window) {
    return Math.max(1, i - window);
  }

  /** Last interior column computed in row {@code i >= 1}, inclusive. */
  static int bandEnd(int i, int n, int window) {
    return (int) Math.min(n - 1L, (long) i + window);
  }
}
