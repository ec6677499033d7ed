package com.ospicorp.tstoolbox.series.controller;

import com.ospicorp.tstoolbox.series.ValidationException;
import com.ospicorp.tstoolbox.series.io.CsvHttpMessageConverter;
import com.ospicorp.tstoolbox.series.io.Timestamps;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import com.ospicorp.tstoolbox.series.model.enums.FilterType;
import com.ospicorp.tstoolbox.series.model.enums.PointwiseDistance;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.http.MediaType;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/**
 * Request parameter handling shared by the series endpoints.
 */
final class SeriesRequests {
  private SeriesRequests() {
  }

  /** Applies the {@code start_date}/{@code end_date} window, then the {@code columns} pick. */
  static TimeSeries narrow(TimeSeries series, String startDate, String endDate, String columns) {
    if (series == null) {
      throw new ValidationException("A series must be sent in the request body.", 1101);
    }
    LocalDateTime start = StringUtils.hasText(startDate) ? Timestamps.parse(startDate) : null;
    LocalDateTime end = StringUtils.hasText(endDate) ? Timestamps.parse(endDate) : null;
    return series.slice(start, end).select(parseColumns(columns));
  }

  static List<String> parseColumns(String columns) {
    if (!StringUtils.hasText(columns)) {
      return List.of();
    }
    return Arrays.stream(columns.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  static FilterType parseFilterType(String value) {
    try {
      return FilterType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("Invalid filter type. Supported values: fft_lowpass,"
          + "fft_highpass,flat,hanning,hamming,bartlett,blackman.", 1001);
    }
  }

  static PointwiseDistance parseDistance(String value) {
    if (!StringUtils.hasText(value)) {
      return PointwiseDistance.ABSOLUTE;
    }
    try {
      return PointwiseDistance.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("Invalid distance. Supported values: absolute,squared.", 1002);
    }
  }

  /** {@code format} wins over {@code Accept}; JSON unless CSV is preferred. */
  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new ValidationException("Invalid format value. Supported values: json,csv.", 1003);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes;
    try {
      mediaTypes = MediaType.parseMediaTypes(accept);
    } catch (IllegalArgumentException ex) {
      return MediaType.APPLICATION_JSON;
    }
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  static boolean isCsv(MediaType mediaType) {
    return mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV);
  }
}
