package com.baykanat.insider.insights.api.dto;

import com.baykanat.insider.insights.domain.model.ExperimentMetricType;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Experiment sonuç isteği: control key ve variant başına hazır sayılar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Experiment statistics payload")
public class ExperimentRequest {

    @JsonProperty("metric_type")
    @Schema(description = "funnel (success/failure) or trend (count/exposure)", example = "funnel")
    private ExperimentMetricType metricType;

    @NotBlank(message = "control_key is required")
    @JsonProperty("control_key")
    @Schema(description = "Key of the control variant", example = "control")
    private String controlKey;

    @NotEmpty(message = "variants must not be empty")
    @Valid
    @JsonProperty("variants")
    @Schema(description = "Control and test variants")
    private List<Variant> variants;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Observed counts of one variant")
    public static class Variant {

        @NotBlank(message = "variant key is required")
        @JsonProperty("key")
        @Schema(description = "Variant key", example = "test")
        private String key;

        @PositiveOrZero(message = "success_count must not be negative")
        @JsonProperty("success_count")
        @Schema(description = "Converted actors (funnel metrics)", example = "100")
        private Long successCount;

        @PositiveOrZero(message = "failure_count must not be negative")
        @JsonProperty("failure_count")
        @Schema(description = "Actors that did not convert (funnel metrics)", example = "10")
        private Long failureCount;

        @PositiveOrZero(message = "count must not be negative")
        @JsonProperty("count")
        @Schema(description = "Event count (trend metrics)", example = "250")
        private Long count;

        @PositiveOrZero(message = "exposure must not be negative")
        @JsonProperty("exposure")
        @Schema(description = "Relative exposure (trend metrics)", example = "1.0")
        private Double exposure;
    }
}
