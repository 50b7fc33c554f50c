package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** Breakdown tanımı; birden fazla key multi-property breakdown'dır, cohort için key'ler cohort id veya "all". */
@Value
@Builder
@Jacksonized
public class Breakdown {

    public static final String ALL_USERS_KEY = "all";

    @Builder.Default
    BreakdownType type = BreakdownType.EVENT;

    @Builder.Default
    List<String> keys = List.of();

    @Builder.Default
    BreakdownAttribution attribution = BreakdownAttribution.FIRST_TOUCH;

    @JsonProperty("attribution_step")
    Integer attributionStep;

    Integer limit;

    @JsonProperty("group_type_index")
    Integer groupTypeIndex;

    public boolean isCohort() {
        return type == BreakdownType.COHORT;
    }
}
