package com.ospicorp.tstoolbox.series.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class EquationControllerTest {

  private static final String JSON = """
      {
        "index": ["2021-06-01", "2021-06-02", "2021-06-03", "2021-06-04"],
        "columns": {"a": [1, 2, null, 4], "b": [10, 20, 30, 40]}
      }
      """;

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<Map> post(String query, String body) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    return rest.postForEntity("/v1/equation?" + query, new HttpEntity<>(body, headers), Map.class);
  }

  @Test
  @SuppressWarnings("unchecked")
  void laggedDifferencePerColumn() {
    ResponseEntity<Map> response = post("equation=x[t]-x[t-1]", JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, List<Object>> columns = (Map<String, List<Object>>) response.getBody()
        .get("columns");
    assertThat(columns.get("a")).containsExactly(null, 1.0, null, null);
    assertThat(columns.get("b")).containsExactly(null, 10.0, 10.0, 10.0);
  }

  @Test
  @SuppressWarnings("unchecked")
  void numberedColumnsYieldDerivedColumn() {
    ResponseEntity<Map> response = post("equation=x2/x1&print_input=true", JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, List<Object>> columns = (Map<String, List<Object>>) response.getBody()
        .get("columns");
    assertThat(columns).containsOnlyKeys("a", "b", "__equation");
    assertThat(columns.get("__equation")).containsExactly(10.0, 10.0, null, 10.0);
  }

  @Test
  void malformedEquationIsRejectedWithCode() {
    ResponseEntity<Map> response = post("equation=sqrt(x", JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 3001);
  }

  @Test
  void invalidSeriesBodyIsRejectedWithCode() {
    String unordered = """
        {"index": ["2021-06-02", "2021-06-01"], "columns": {"a": [1, 2]}}
        """;

    ResponseEntity<Map> response = post("equation=x", unordered);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1103);
  }

  @Test
  void missingEquationIsProblemDetail() {
    ResponseEntity<Map> response = post("print_input=true", JSON);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
  }
}
