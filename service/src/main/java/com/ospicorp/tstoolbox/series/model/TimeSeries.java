package com.ospicorp.tstoolbox.series.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.io.Timestamps;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered table of numeric columns keyed by strictly ascending timestamps. Missing cells hold
 * {@link Double#NaN}.
 *
 * <p>Instances are immutable: value accessors hand out copies and every derivation returns a new
 * series, so a series can be shared by concurrently running kernels.
 */
@Schema(implementation = SeriesPayload.class)
public final class TimeSeries {
  public static final String DEFAULT_INDEX_NAME = "Datetime";

  private final String indexName;
  private final List<LocalDateTime> index;
  private final Map<String, double[]> columns;
  private final List<String> names;

  public TimeSeries(String indexName, List<LocalDateTime> index, Map<String, double[]> columns) {
    if (index == null || columns == null) {
      throw new ValidationException("Series index and columns must be provided.", 1101);
    }
    if (columns.isEmpty()) {
      throw new ValidationException("Series must contain at least one column.", 1102);
    }
    for (int i = 1; i < index.size(); i++) {
      if (!index.get(i).isAfter(index.get(i - 1))) {
        throw new ValidationException("Timestamps must be strictly ascending; found "
            + index.get(i) + " after " + index.get(i - 1) + ".", 1103);
      }
    }
    Map<String, double[]> copy = new LinkedHashMap<>();
    for (var e : columns.entrySet()) {
      String name = e.getKey();
      double[] values = e.getValue();
      if (name == null || name.isBlank()) {
        throw new ValidationException("Column names must not be blank.", 1104);
      }
      if (values == null || values.length != index.size()) {
        throw new ValidationException("Column " + name + " has "
            + (values == null ? 0 : values.length) + " values for " + index.size()
            + " timestamps.", 1105);
      }
      copy.put(name, values.clone());
    }
    this.indexName = (indexName == null || indexName.isBlank()) ? DEFAULT_INDEX_NAME : indexName;
    this.index = List.copyOf(index);
    this.columns = Collections.unmodifiableMap(copy);
    this.names = List.copyOf(copy.keySet());
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static TimeSeries fromPayload(SeriesPayload payload) {
    if (payload == null || payload.index() == null || payload.columns() == null) {
      throw new ValidationException("Series payload requires 'index' and 'columns'.", 1101);
    }
    List<LocalDateTime> index = new ArrayList<>(payload.index().size());
    for (String s : payload.index()) {
      index.add(Timestamps.parse(s));
    }
    Map<String, double[]> columns = new LinkedHashMap<>();
    for (var e : payload.columns().entrySet()) {
      List<Double> raw = e.getValue() == null ? List.of() : e.getValue();
      double[] values = new double[raw.size()];
      for (int i = 0; i < values.length; i++) {
        Double v = raw.get(i);
        values[i] = v == null ? Double.NaN : v;
      }
      columns.put(e.getKey(), values);
    }
    return new TimeSeries(payload.indexName(), index, columns);
  }

  @JsonValue
  public SeriesPayload toPayload() {
    List<String> formatted = Timestamps.formatAll(index);
    Map<String, List<Double>> out = new LinkedHashMap<>();
    for (var e : columns.entrySet()) {
      double[] values = e.getValue();
      List<Double> list = new ArrayList<>(values.length);
      for (double v : values) {
        list.add(Double.isNaN(v) ? null : v);
      }
      out.put(e.getKey(), list);
    }
    return new SeriesPayload(indexName, formatted, out);
  }

  public String indexName() {
    return indexName;
  }

  public List<LocalDateTime> index() {
    return index;
  }

  public int size() {
    return index.size();
  }

  public int columnCount() {
    return columns.size();
  }

  public List<String> columnNames() {
    return names;
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  public double[] values(String name) {
    double[] values = columns.get(name);
    if (values == null) {
      throw new ValidationException("Unknown column " + name + ". Available: "
          + columns.keySet() + ".", 1106);
    }
    return values.clone();
  }

  /** Values of the column at the zero-based {@code position}. */
  public double[] values(int position) {
    if (position < 0 || position >= columns.size()) {
      throw new ValidationException("Column position " + (position + 1)
          + " outside of 1-" + columns.size() + ".", 1106);
    }
    return values(names.get(position));
  }

  /** Single cell read without copying the column. */
  public double value(int row, int position) {
    return columns.get(names.get(position))[row];
  }

  public TimeSeries withColumns(Map<String, double[]> newColumns) {
    return new TimeSeries(indexName, index, newColumns);
  }

  /**
   * Appends {@code other}'s columns, each renamed with {@code suffix}. Indexes must match and a
   * renamed column may not collide with an existing one.
   */
  public TimeSeries join(TimeSeries other, String suffix) {
    if (!index.equals(other.index)) {
      throw new ValidationException("Cannot join series with different indexes.", 1107);
    }
    Map<String, double[]> joined = new LinkedHashMap<>(columns);
    for (var e : other.columns.entrySet()) {
      String name = e.getKey() + suffix;
      if (joined.containsKey(name)) {
        throw new ValidationException("Column '" + name + "' already exists.", 1104);
      }
      joined.put(name, e.getValue());
    }
    return withColumns(joined);
  }

  /** Rows with {@code start <= timestamp <= end}; a null bound is open. */
  public TimeSeries slice(LocalDateTime start, LocalDateTime end) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new ValidationException("start_date must be before or equal to end_date.", 1005);
    }
    int from = 0;
    while (from < index.size() && start != null && index.get(from).isBefore(start)) {
      from++;
    }
    int to = index.size();
    while (to > from && end != null && index.get(to - 1).isAfter(end)) {
      to--;
    }
    if (from == 0 && to == index.size()) {
      return this;
    }
    Map<String, double[]> sliced = new LinkedHashMap<>();
    for (var e : columns.entrySet()) {
      sliced.put(e.getKey(), Arrays.copyOfRange(e.getValue(), from, to));
    }
    return new TimeSeries(indexName, index.subList(from, to), sliced);
  }

  /**
   * Picks columns by name or by 1-based position, in the requested order.
   */
  public TimeSeries select(List<String> selectors) {
    if (selectors == null || selectors.isEmpty()) {
      return this;
    }
    Map<String, double[]> picked = new LinkedHashMap<>();
    for (String selector : selectors) {
      String name;
      if (columns.containsKey(selector)) {
        name = selector;
      } else {
        int position;
        try {
          position = Integer.parseInt(selector);
        } catch (NumberFormatException ex) {
          throw new ValidationException("The name " + selector
              + " isn't in the list of column names " + names + ".", 1004);
        }
        if (position < 1 || position > names.size()) {
          throw new ValidationException("The requested column index " + position
              + " must be between 1 and " + names.size() + ".", 1004);
        }
        name = names.get(position - 1);
      }
      picked.put(name, columns.get(name));
    }
    return withColumns(picked);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeries other)) {
      return false;
    }
    if (!indexName.equals(other.indexName) || !index.equals(other.index)
        || !columns.keySet().equals(other.columns.keySet())) {
      return false;
    }
    for (var e : columns.entrySet()) {
      if (!Arrays.equals(e.getValue(), other.columns.get(e.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = indexName.hashCode() * 31 + index.hashCode();
    for (var e : columns.entrySet()) {
      result = 31 * result + e.getKey().hashCode();
      result = 31 * result + Arrays.hashCode(e.getValue());
    }
    return result;
  }

  @Override
  public String toString() {
    return "TimeSeries[" + indexName + ", rows=" + index.size() + ", columns=" + columns.keySet()
        + "]";
  }
}
