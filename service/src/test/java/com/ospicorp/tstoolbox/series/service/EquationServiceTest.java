package com.ospicorp.tstoolbox.series.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.tstoolbox.series.model.TimeSeries;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EquationServiceTest {

  private static final TimeSeries INPUT = new TimeSeries("Datetime",
      List.of(LocalDateTime.of(2020, 1, 1, 0, 0), LocalDateTime.of(2020, 1, 1, 1, 0),
          LocalDateTime.of(2020, 1, 1, 2, 0)),
      Map.of("q", new double[] {2, 4, 8}));

  @Test
  void printInputAddsSuffixedResultColumns() {
    EquationService service = new EquationService("x", "t");

    TimeSeries out = service.evaluate(INPUT, "x / 2", true);

    assertThat(out.columnNames()).containsExactly("q", "q_equation");
    assertThat(out.values("q_equation")).containsExactly(1, 2, 4);
  }

  @Test
  void configuredPlaceholdersAreHonoured() {
    EquationService service = new EquationService("v", "i");

    TimeSeries out = service.evaluate(INPUT, "v[i] / v[i-1]", false);

    assertThat(out.values("q")[0]).isNaN();
    assertThat(out.values("q")[2]).isEqualTo(2.0);
  }
}
