package com.ospicorp.tstoolbox.series.expression;

public enum ExpressionShape {
  /** Uses {@code x[...t...]} lag/lead references; evaluated row by row with row-local faults. */
  TIME_INDEXED,
  /** Uses numbered columns {@code x1, x2, ...} only; one derived column. */
  COLUMN_INDEXED,
  /** Plain element-wise formula over every input column. */
  VECTORIZED
}
