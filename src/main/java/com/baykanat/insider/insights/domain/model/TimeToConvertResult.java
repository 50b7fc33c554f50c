package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** from_step → to_step dönüşüm sürelerinin histogramı; boş bin'ler de yer alır. */
@Value
@Builder
public class TimeToConvertResult {

    List<Bin> bins;

    @JsonProperty("bin_width_seconds")
    long binWidthSeconds;

    @JsonProperty("average_conversion_time")
    Double averageConversionTime;

    @Value
    public static class Bin {
        @JsonProperty("start_seconds")
        long startSeconds;
        long count;
    }
}
