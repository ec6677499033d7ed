package com.ospicorp.tstoolbox.series.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

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
class FilterControllerTest {

  private static final String CSV = """
      Datetime,flow,stage
      2020-01-01,1,10
      2020-01-02,2,10
      2020-01-03,3,10
      2020-01-04,4,10
      2020-01-05,5,10
      2020-01-06,6,10
      """;

  @Autowired
  private TestRestTemplate rest;

  private static HttpEntity<String> csvRequest(String body, MediaType accept) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.valueOf("text/csv"));
    headers.setAccept(List.of(accept));
    return new HttpEntity<>(body, headers);
  }

  @Test
  @SuppressWarnings("unchecked")
  void flatFilterReturnsJsonSeries() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/filter?type=flat&window_len=3",
        csvRequest(CSV, MediaType.APPLICATION_JSON), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).containsEntry("index_name", "Datetime");
    assertThat((List<String>) body.get("index")).hasSize(6).startsWith("2020-01-01");
    Map<String, List<Number>> columns = (Map<String, List<Number>>) body.get("columns");
    assertThat(columns).containsOnlyKeys("flow", "stage");
    assertThat(columns.get("flow").get(0).doubleValue()).isCloseTo(5.0 / 3, within(1e-12));
    assertThat(columns.get("flow").get(2).doubleValue()).isCloseTo(3.0, within(1e-12));
    assertThat(columns.get("stage").get(5).doubleValue()).isCloseTo(10.0, within(1e-12));
  }

  @Test
  void csvOutputHonoursColumnAndDateSelection() {
    ResponseEntity<String> response = rest.postForEntity(
        "/v1/filter?type=hanning&window_len=3&columns=1&start_date=2020-01-03&print_input=true",
        csvRequest(CSV, MediaType.valueOf("text/csv")), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.valueOf("text/csv")))
        .isTrue();
    assertThat(response.getBody().lines()).containsExactly(
        "Datetime,flow,flow_filter",
        "2020-01-03,3.0,3.0",
        "2020-01-04,4.0,4.0",
        "2020-01-05,5.0,5.0",
        "2020-01-06,6.0,6.0");
  }

  @Test
  void formatParameterOverridesAcceptHeader() {
    ResponseEntity<String> response = rest.postForEntity(
        "/v1/filter?type=fft_lowpass&cutoff_period=2&window_len=2&format=csv",
        csvRequest(CSV, MediaType.APPLICATION_JSON), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).startsWith("Datetime,flow,stage");
  }

  @Test
  @SuppressWarnings("unchecked")
  void unknownFilterTypeIsInvalidParameter() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/filter?type=median",
        csvRequest(CSV, MediaType.APPLICATION_JSON), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .containsEntry("errorCode", 1001)
        .containsEntry("path", "/v1/filter")
        .containsEntry("moreInfo", "https://developers.company.com/docs/errors/1001")
        .containsKey("error");
  }

  @Test
  @SuppressWarnings("unchecked")
  void fftWithoutCutoffIsRejected() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/filter?type=fft_highpass&window_len=2",
        csvRequest(CSV, MediaType.APPLICATION_JSON), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2001);
  }
}
