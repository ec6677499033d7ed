package com.ospicorp.tstoolbox.series.controller;

import com.ospicorp.tstoolbox.series.model.SeriesPayload;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import com.ospicorp.tstoolbox.series.service.FilterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/filter")
@Tag(name = "Filter")
public class FilterController {
  private final FilterService filterService;

  public FilterController(FilterService filterService) {
    this.filterService = filterService;
  }

  @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "Filter a time series",
      description = "Applies an FFT low/high-pass filter or a windowed smoothing filter to every "
          + "column of the posted series.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Filtered series",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = SeriesPayload.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<TimeSeries> filter(
      @RequestBody TimeSeries series,
      @RequestParam(defaultValue = "fft_lowpass")
          @Parameter(description = "fft_lowpass, fft_highpass, flat, hanning, hamming, bartlett "
              + "or blackman") String type,
      @RequestParam(name = "cutoff_period", required = false)
          @Parameter(description = "Cutoff period in samples (FFT filters)", example = "12")
          Double cutoffPeriod,
      @RequestParam(name = "window_len", required = false)
          @Parameter(description = "Smoothing window length", example = "5") Integer windowLen,
      @RequestParam(name = "print_input", defaultValue = "false")
          @Parameter(description = "Prepend the input columns") boolean printInput,
      @RequestParam(name = "start_date", required = false) String startDate,
      @RequestParam(name = "end_date", required = false) String endDate,
      @RequestParam(required = false)
          @Parameter(description = "Comma separated column names or 1-based positions")
          String columns,
      @RequestParam(required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = SeriesRequests.selectMediaType(format, accept);
    TimeSeries input = SeriesRequests.narrow(series, startDate, endDate, columns);
    TimeSeries result = filterService.filter(input, SeriesRequests.parseFilterType(type),
        cutoffPeriod, windowLen, printInput);
    return ResponseEntity.ok().contentType(contentType).body(result);
  }
}
