package com.ospicorp.tstoolbox.series.io;

import com.ospicorp.tstoolbox.series.ValidationException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * ISO-8601 timestamp parsing and formatting for the series index. Offsets are normalised to UTC.
 */
public final class Timestamps {
  private Timestamps() {
  }

  public static LocalDateTime parse(String text) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Timestamp must not be blank.", 1108);
    }
    String value = text.trim().replace(' ', 'T');
    try {
      if (value.length() == 10) {
        return LocalDate.parse(value).atStartOfDay();
      }
      try {
        return LocalDateTime.parse(value);
      } catch (DateTimeParseException ex) {
        return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      }
    } catch (DateTimeParseException ex) {
      throw new ValidationException("Invalid ISO-8601 timestamp: " + text + ".", 1108);
    }
  }

  /**
   * Formats an index, as dates when every timestamp falls on midnight.
   */
  public static List<String> formatAll(List<LocalDateTime> index) {
    boolean dateOnly = index.stream().allMatch(ts -> ts.toLocalTime().equals(LocalTime.MIDNIGHT));
    List<String> out = new ArrayList<>(index.size());
    for (LocalDateTime ts : index) {
      out.add(dateOnly ? ts.toLocalDate().toString() : DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(ts));
    }
    return out;
  }
}
