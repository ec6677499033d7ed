package com.ospicorp.tstoolbox.series.controller;

import com.ospicorp.tstoolbox.series.model.AlignmentResult;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import com.ospicorp.tstoolbox.series.service.AlignmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
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
@RequestMapping("/v1/dtw")
@Tag(name = "Alignment")
public class AlignmentController {
  private final AlignmentService alignmentService;

  public AlignmentController(AlignmentService alignmentService) {
    this.alignmentService = alignmentService;
  }

  @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "Pairwise DTW distances",
      description = "Dynamic Time Warping distance between every pair of columns. Missing values "
          + "are dropped before aligning.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "One row per column pair",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = AlignmentResult.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<AlignmentResult>> pairwise(
      @RequestBody TimeSeries series,
      @RequestParam(required = false)
          @Parameter(description = "Band half-width, |i - j| <= window", example = "10")
          Integer window,
      @RequestParam(required = false)
          @Parameter(description = "absolute (default) or squared") String distance,
      @RequestParam(name = "start_date", required = false) String startDate,
      @RequestParam(name = "end_date", required = false) String endDate,
      @RequestParam(required = false)
          @Parameter(description = "Comma separated column names or 1-based positions")
          String columns,
      @RequestParam(required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = SeriesRequests.selectMediaType(format, accept);
    TimeSeries input = SeriesRequests.narrow(series, startDate, endDate, columns);
    List<AlignmentResult> results = alignmentService.pairwise(input, window,
        SeriesRequests.parseDistance(distance));
    return ResponseEntity.ok().contentType(contentType).body(results);
  }

  @PostMapping(path = "/distance", consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "DTW distance between two columns")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Distance of the requested pair",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = AlignmentResult.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> distance(
      @RequestBody TimeSeries series,
      @RequestParam @Parameter(description = "First column") String a,
      @RequestParam @Parameter(description = "Second column") String b,
      @RequestParam(required = false) Integer window,
      @RequestParam(required = false) String distance,
      @RequestParam(name = "start_date", required = false) String startDate,
      @RequestParam(name = "end_date", required = false) String endDate,
      @RequestParam(required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = SeriesRequests.selectMediaType(format, accept);
    TimeSeries input = SeriesRequests.narrow(series, startDate, endDate, null);
    AlignmentResult result = alignmentService.distance(input, a, b, window,
        SeriesRequests.parseDistance(distance));
    Object body = SeriesRequests.isCsv(contentType) ? List.of(result) : result;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }
}
