package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/** Giriş periyodu başına funnel dönüşümü; conversionRate yüzde cinsinden, iki ondalık. */
@Value
@Builder
public class FunnelTrendPoint {

    String timestamp;
    String label;
    String day;

    @JsonProperty("reached_from_step_count")
    long reachedFromStepCount;

    @JsonProperty("reached_to_step_count")
    long reachedToStepCount;

    @JsonProperty("conversion_rate")
    double conversionRate;

    /** period start + conversion window şimdiden önceyse sonuç artık değişmez. */
    @JsonProperty("is_period_final")
    boolean periodFinal;
}
