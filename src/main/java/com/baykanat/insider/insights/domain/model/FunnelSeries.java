package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Tek breakdown bucket'ı için step listesi; breakdown yoksa breakdownValue null. */
@Value
@Builder
public class FunnelSeries {

    @JsonProperty("breakdown_value")
    List<String> breakdownValue;

    List<FunnelStep> steps;
}
