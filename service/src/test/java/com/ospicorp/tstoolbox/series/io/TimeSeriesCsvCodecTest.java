package com.ospicorp.tstoolbox.series.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class TimeSeriesCsvCodecTest {

  private final TimeSeriesCsvCodec codec = new TimeSeriesCsvCodec();

  private TimeSeries read(String csv) throws IOException {
    return codec.read(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void readsSortsAndMarksMissingValues() throws IOException {
    TimeSeries series = read("""
        Datetime,flow,stage
        2020-01-03,3.5,
        2020-01-01,1.5,NaN
        2020-01-02,2.5,0.25
        """);

    assertThat(series.indexName()).isEqualTo("Datetime");
    assertThat(series.columnNames()).containsExactly("flow", "stage");
    assertThat(series.index()).first().isEqualTo(LocalDateTime.of(2020, 1, 1, 0, 0));
    assertThat(series.values("flow")).containsExactly(1.5, 2.5, 3.5);
    assertThat(series.values("stage")[0]).isNaN();
    assertThat(series.values("stage")[1]).isEqualTo(0.25);
    assertThat(series.values("stage")[2]).isNaN();
  }

  @Test
  void writesDatesAndEmptyCells() throws IOException {
    TimeSeries series = read("""
        Date,a
        2020-01-01,1
        2020-01-02,
        """);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(series, out);

    String csv = out.toString(StandardCharsets.UTF_8);
    assertThat(csv.lines()).containsExactly("Date,a", "2020-01-01,1.0", "2020-01-02,");
  }

  @Test
  void writesTimesWhenNotAllAtMidnight() throws IOException {
    TimeSeries series = read("""
        Datetime,a
        2020-01-01 06:30:00,1
        2020-01-01T12:00:00Z,2
        """);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(series, out);

    assertThat(out.toString(StandardCharsets.UTF_8))
        .contains("2020-01-01T06:30:00,1.0")
        .contains("2020-01-01T12:00:00,2.0");
  }

  @Test
  void rejectsDuplicateTimestamps() {
    assertThatThrownBy(() -> read("""
        Datetime,a
        2020-01-01,1
        2020-01-01,2
        """))
        .isInstanceOf(ValidationException.class)
        .extracting("errorCode").isEqualTo(1103);
  }

  @Test
  void rejectsNonNumericValues() {
    assertThatThrownBy(() -> read("""
        Datetime,a
        2020-01-01,abc
        """))
        .isInstanceOf(ValidationException.class)
        .extracting("errorCode").isEqualTo(1109);
  }

  @Test
  void rejectsBadTimestamps() {
    assertThatThrownBy(() -> read("""
        Datetime,a
        yesterday,1
        """))
        .isInstanceOf(ValidationException.class)
        .extracting("errorCode").isEqualTo(1108);
  }
}
