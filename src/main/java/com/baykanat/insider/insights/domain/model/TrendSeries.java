package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Entity (veya formula) başına trend serisi; aggregate display'de tek değer. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendSeries {

    String label;

    /** Formula serisinde null. */
    @JsonProperty("entity_index")
    Integer entityIndex;

    @JsonProperty("entity_id")
    String entityId;

    MathType math;

    @JsonProperty("breakdown_value")
    List<String> breakdownValue;

    List<String> labels;
    List<String> days;
    List<Double> values;

    /** Zaman serisinde değerlerin toplamı, aggregate display'de tek değer. */
    double total;
}
