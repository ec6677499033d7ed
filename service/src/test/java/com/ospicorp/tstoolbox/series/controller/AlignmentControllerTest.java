package com.ospicorp.tstoolbox.series.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AlignmentControllerTest {

  private static final String CSV = """
      Datetime,a,b,c
      2020-01-01,1,1,0
      2020-01-02,2,,0
      2020-01-03,3,2,0
      2020-01-04,4,3,0
      """;

  @Autowired
  private TestRestTemplate rest;

  private static HttpEntity<String> csvRequest(MediaType accept) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.valueOf("text/csv"));
    headers.setAccept(List.of(accept));
    return new HttpEntity<>(CSV, headers);
  }

  @Test
  void pairwiseDistancesAsJson() {
    ResponseEntity<List<Map<String, Object>>> response = rest.exchange("/v1/dtw",
        HttpMethod.POST, csvRequest(MediaType.APPLICATION_JSON),
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> rows = response.getBody();
    assertThat(rows).hasSize(3);
    assertThat(rows.get(0)).containsEntry("column_a", "a")
        .containsEntry("column_b", "b")
        .containsEntry("distance", 1.0);
    assertThat(rows.get(1)).containsEntry("distance", 10.0);
    assertThat(rows.get(2)).containsEntry("column_a", "b").containsEntry("column_b", "c");
  }

  @Test
  void pairwiseDistancesAsCsv() {
    ResponseEntity<String> response = rest.postForEntity("/v1/dtw?distance=squared&columns=a,c",
        csvRequest(MediaType.valueOf("text/csv")), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().lines()).containsExactly("column_a,column_b,distance",
        "a,c,30.0");
  }

  @Test
  void singlePairDistance() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/dtw/distance?a=a&b=b&window=1",
        csvRequest(MediaType.APPLICATION_JSON), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("distance", 1.0);
  }

  @Test
  void unknownColumnIsRejected() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/dtw/distance?a=a&b=z",
        csvRequest(MediaType.APPLICATION_JSON), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 4004);
  }

  @Test
  void unknownDistanceIsRejected() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/dtw?distance=cosine",
        csvRequest(MediaType.APPLICATION_JSON), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1002);
  }

  @Test
  void windowTooNarrowIsRejected() {
    String lopsided = """
        Datetime,a,b
        2020-01-01,1,1
        2020-01-02,2,2
        2020-01-03,3,
        2020-01-04,4,
        """;
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.valueOf("text/csv"));
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));

    ResponseEntity<Map> response = rest.postForEntity("/v1/dtw?window=1",
        new HttpEntity<>(lopsided, headers), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 4003);
  }
}
