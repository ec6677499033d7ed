package com.ospicorp.tstoolbox.series.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes a {@link TimeSeries} as a delimited table: an ISO-8601 timestamp column
 * followed by named numeric columns. Rows are sorted by timestamp on read.
 */
public class TimeSeriesCsvCodec {
  private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "na", "null", "none");

  private final CsvMapper mapper = new CsvMapper();

  public TimeSeriesCsvCodec() {
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
  }

  public TimeSeries read(InputStream in) throws IOException {
    List<String[]> lines;
    try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(in)) {
      lines = it.readAll();
    }
    if (lines.isEmpty()) {
      throw new ValidationException("CSV input is empty.", 1109);
    }
    String[] header = lines.get(0);
    if (header.length < 2) {
      throw new ValidationException(
          "CSV input needs a timestamp column followed by at least one value column.", 1109);
    }

    List<Row> rows = new ArrayList<>(lines.size() - 1);
    for (int r = 1; r < lines.size(); r++) {
      String[] line = lines.get(r);
      if (line.length != header.length) {
        throw new ValidationException("CSV line " + (r + 1) + " has " + line.length
            + " fields, expected " + header.length + ".", 1109);
      }
      double[] values = new double[header.length - 1];
      for (int c = 1; c < line.length; c++) {
        values[c - 1] = parseValue(line[c], r + 1, header[c]);
      }
      rows.add(new Row(Timestamps.parse(line[0]), values));
    }
    rows.sort(Comparator.comparing(Row::timestamp));

    List<LocalDateTime> index = new ArrayList<>(rows.size());
    for (Row row : rows) {
      if (!index.isEmpty() && index.get(index.size() - 1).equals(row.timestamp())) {
        throw new ValidationException("Duplicate timestamp " + row.timestamp() + ".", 1103);
      }
      index.add(row.timestamp());
    }
    Map<String, double[]> columns = new LinkedHashMap<>();
    for (int c = 1; c < header.length; c++) {
      if (columns.containsKey(header[c])) {
        throw new ValidationException("Duplicate column name " + header[c] + ".", 1104);
      }
      double[] values = new double[rows.size()];
      for (int r = 0; r < rows.size(); r++) {
        values[r] = rows.get(r).values()[c - 1];
      }
      columns.put(header[c], values);
    }
    return new TimeSeries(header[0], index, columns);
  }

  public void write(TimeSeries series, OutputStream out) throws IOException {
    CsvSchema.Builder builder = CsvSchema.builder();
    builder.addColumn(series.indexName());
    series.columnNames().forEach(builder::addColumn);
    CsvSchema schema = builder.setUseHeader(true).build();

    List<String> timestamps = Timestamps.formatAll(series.index());
    List<double[]> columns = new ArrayList<>(series.columnCount());
    for (String name : series.columnNames()) {
      columns.add(series.values(name));
    }

    SequenceWriter writer = mapper.writer(schema).writeValues(out);
    for (int r = 0; r < series.size(); r++) {
      String[] line = new String[columns.size() + 1];
      line[0] = timestamps.get(r);
      for (int c = 0; c < columns.size(); c++) {
        double v = columns.get(c)[r];
        line[c + 1] = Double.isNaN(v) ? "" : Double.toString(v);
      }
      writer.write(line);
    }
    writer.flush();
  }

  private static double parseValue(String raw, int line, String column) {
    String value = raw == null ? "" : raw.trim();
    if (MISSING_TOKENS.contains(value.toLowerCase(Locale.ROOT))) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException ex) {
      throw new ValidationException("Non-numeric value '" + raw + "' in column " + column
          + " at line " + line + ".", 1109);
    }
  }

  private record Row(LocalDateTime timestamp, double[] values) {}
}
