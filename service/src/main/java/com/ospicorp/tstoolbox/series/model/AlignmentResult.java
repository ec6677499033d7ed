package com.ospicorp.tstoolbox.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"column_a", "column_b", "distance"})
public record AlignmentResult(
    @JsonProperty("column_a") String columnA,
    @JsonProperty("column_b") String columnB,
    double distance
) {}
