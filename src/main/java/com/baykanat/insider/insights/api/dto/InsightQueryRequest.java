package com.baykanat.insider.insights.api.dto;

import com.baykanat.insider.insights.domain.model.AggregationTarget;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.ConversionWindow;
import com.baykanat.insider.insights.domain.model.DisplayMode;
import com.baykanat.insider.insights.domain.model.ExclusionEntity;
import com.baykanat.insider.insights.domain.model.FunnelOrderType;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.Interval;
import com.baykanat.insider.insights.domain.model.PropertyGroup;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Funnel, trends ve stickiness endpoint'lerinin ortak payload'ı. Yapısal kontroller burada, semantik kontroller
 * InsightQueryValidator'da yapılır. funnel_step ve sonrası yalnızca actors endpoint'inde okunur.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Insight query payload")
public class InsightQueryRequest {

    @JsonProperty("date_from")
    @Schema(description = "Range start: ISO date, relative offset or 'all'", example = "-7d")
    private String dateFrom;

    @JsonProperty("date_to")
    @Schema(description = "Range end: ISO date or relative offset. Defaults to now", example = "2026-10-19")
    private String dateTo;

    @JsonProperty("timezone")
    @Schema(description = "IANA timezone used for bucketing and relative dates", example = "Europe/Istanbul")
    private String timezone;

    @JsonProperty("interval")
    @Schema(description = "Bucket size: hour, day, week or month", example = "day")
    private Interval interval;

    @NotEmpty(message = "series must contain at least one entity")
    @JsonProperty("series")
    @Schema(description = "Funnel steps or trend series, in order")
    private List<InsightEntity> entities;

    @JsonProperty("exclusions")
    @Schema(description = "Funnel exclusion steps")
    private List<ExclusionEntity> exclusions;

    @JsonProperty("breakdown")
    @Schema(description = "Optional breakdown definition")
    private Breakdown breakdown;

    @JsonProperty("funnel_order_type")
    @Schema(description = "ordered, strict or unordered", example = "ordered")
    private FunnelOrderType funnelOrderType;

    @JsonProperty("funnel_window")
    @Schema(description = "Conversion window, defaults to 14 days")
    private ConversionWindow conversionWindow;

    @JsonProperty("aggregation")
    @Schema(description = "Actor to count: person, distinct_id or group")
    private AggregationTarget aggregation;

    @JsonProperty("display")
    @Schema(description = "time_series, cumulative or aggregate", example = "time_series")
    private DisplayMode display;

    @DecimalMin(value = "0.0", inclusive = false, message = "sampling_factor must be greater than 0")
    @DecimalMax(value = "1.0", message = "sampling_factor must be at most 1")
    @JsonProperty("sampling_factor")
    @Schema(description = "Fraction of actors to read, in (0, 1]", example = "0.1")
    private Double samplingFactor;

    @JsonProperty("properties")
    @Schema(description = "Global filter applied to every entity")
    private PropertyGroup properties;

    @JsonProperty("formula")
    @Schema(description = "Arithmetic over series letters", example = "A / B * 100")
    private String formula;

    @JsonProperty("funnel_from_step")
    @Schema(description = "Start step for funnel trends and time to convert", example = "0")
    private Integer funnelFromStep;

    @JsonProperty("funnel_to_step")
    @Schema(description = "End step for funnel trends and time to convert", example = "1")
    private Integer funnelToStep;

    @Positive(message = "bin_count must be positive")
    @JsonProperty("bin_count")
    @Schema(description = "Histogram bin count for time to convert", example = "10")
    private Integer binCount;

    @JsonProperty("funnel_step")
    @Schema(description = "1-based step; negative values list actors who dropped off before that step", example = "2")
    private Integer funnelStep;

    @JsonProperty("funnel_step_breakdown")
    @Schema(description = "Breakdown value to restrict the actor list to", example = "[\"Chrome\"]")
    private List<String> breakdownValue;

    @PositiveOrZero(message = "offset must not be negative")
    @JsonProperty("offset")
    @Schema(description = "Actor page offset", example = "0")
    private Integer offset;

    @Positive(message = "limit must be positive")
    @JsonProperty("limit")
    @Schema(description = "Actor page size", example = "100")
    private Integer limit;
}
