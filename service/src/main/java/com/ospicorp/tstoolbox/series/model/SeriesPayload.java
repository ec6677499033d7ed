package com.ospicorp.tstoolbox.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

// JSON shape of a TimeSeries; null entries are missing values
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesPayload(
    @JsonProperty("index_name") String indexName,
    List<String> index,
    Map<String, List<Double>> columns
) {}
