package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Funnel çıktısında tek step; count kümülatiftir (bu step'e veya ötesine ulaşan actor sayısı). */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FunnelStep {

    int order;
    String name;

    @JsonProperty("custom_name")
    String customName;

    @JsonProperty("action_id")
    String actionId;

    long count;

    /** Step 0 için ve hiç actor ulaşmadıysa null. */
    @JsonProperty("average_conversion_time")
    Double averageConversionTime;

    @JsonProperty("median_conversion_time")
    Double medianConversionTime;

    @JsonProperty("breakdown_value")
    List<String> breakdownValue;
}
