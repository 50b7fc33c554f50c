package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** [fromStep, toStep] aralığında gerçekleşirse funnel run'ını geçersiz kılan entity. */
@Value
@Builder
@Jacksonized
public class ExclusionEntity {

    InsightEntity entity;

    @JsonProperty("funnel_from_step")
    Integer fromStep;

    @JsonProperty("funnel_to_step")
    Integer toStep;
}
