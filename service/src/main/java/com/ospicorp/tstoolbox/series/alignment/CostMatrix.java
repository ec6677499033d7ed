package com.ospicorp.tstoolbox.series.alignment;

import java.util.Arrays;

/**
 * Accumulated alignment costs, keeping only the row being filled and the one before it. Cells that
 * were never written are unreachable.
 *
 * <p>Column 0 and the band of columns {@code >= 1} written in a row are tracked separately, so
 * recycling a row only clears what was written into it.
 */
final class CostMatrix {
  private double[] previous;
  private double[] current;
  private boolean[] previousSet;
  private boolean[] currentSet;
  private int previousLow = Integer.MAX_VALUE;
  private int previousHigh = -1;
  private int currentLow = Integer.MAX_VALUE;
  private int currentHigh = -1;
  private int row;

  CostMatrix(int cols) {
    this.previous = new double[cols];
    this.current = new double[cols];
    this.previousSet = new boolean[cols];
    this.currentSet = new boolean[cols];
  }

  /** Moves to the next row; the current row becomes the previous one. */
  void advance() {
    double[] values = previous;
    previous = current;
    current = values;
    boolean[] set = previousSet;
    previousSet = currentSet;
    currentSet = set;

    currentSet[0] = false;
    if (previousLow <= previousHigh) {
      Arrays.fill(currentSet, previousLow, previousHigh + 1, false);
    }
    previousLow = currentLow;
    previousHigh = currentHigh;
    currentLow = Integer.MAX_VALUE;
    currentHigh = -1;
    row++;
  }

  void put(int col, double value) {
    current[col] = value;
    currentSet[col] = true;
    if (col > 0) {
      currentLow = Math.min(currentLow, col);
      currentHigh = Math.max(currentHigh, col);
    }
  }

  boolean hasCurrent(int col) {
    return currentSet[col];
  }

  double current(int col) {
    return current[col];
  }

  boolean hasPrevious(int col) {
    return row > 0 && previousSet[col];
  }

  double previous(int col) {
    return previous[col];
  }
}
