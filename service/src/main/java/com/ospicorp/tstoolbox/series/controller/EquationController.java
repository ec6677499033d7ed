package com.ospicorp.tstoolbox.series.controller;

import com.ospicorp.tstoolbox.series.model.SeriesPayload;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import com.ospicorp.tstoolbox.series.service.EquationService;
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
@RequestMapping("/v1/equation")
@Tag(name = "Equation")
public class EquationController {
  private final EquationService equationService;

  public EquationController(EquationService equationService) {
    this.equationService = equationService;
  }

  @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "Evaluate an equation",
      description = "Evaluates a row formula over the posted series. 'x' is the current column, "
          + "'x1', 'x2', ... are columns by position and 'x[t-1]' refers to another row.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Computed series",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = SeriesPayload.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<TimeSeries> evaluate(
      @RequestBody TimeSeries series,
      @RequestParam @Parameter(description = "Formula", example = "x[t] - x[t-1]") String equation,
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
    TimeSeries result = equationService.evaluate(input, equation, printInput);
    return ResponseEntity.ok().contentType(contentType).body(result);
  }
}
