package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FunnelTrendsSeries {

    @JsonProperty("breakdown_value")
    List<String> breakdownValue;

    List<FunnelTrendPoint> points;
}
