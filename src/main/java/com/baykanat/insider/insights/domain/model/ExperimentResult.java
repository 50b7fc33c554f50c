package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** Variant key → kazanma olasılığı, beklenen kayıp ve credible interval; karar kodu ile birlikte. */
@Value
@Builder
public class ExperimentResult {

    @JsonProperty("metric_type")
    ExperimentMetricType metricType;

    Map<String, Double> probabilities;

    @JsonProperty("expected_losses")
    Map<String, Double> expectedLosses;

    @JsonProperty("credible_intervals")
    Map<String, CredibleInterval> credibleIntervals;

    @JsonProperty("leading_variant")
    String leadingVariant;

    /** Önde olan variant'ı seçmenin beklenen kaybı. */
    @JsonProperty("expected_loss")
    double expectedLoss;

    @JsonProperty("significance_code")
    SignificanceCode significanceCode;

    boolean significant;

    /** Olasılıkların kapalı formdan mı yoksa simülasyondan mı geldiği. */
    @JsonProperty("exact")
    boolean exact;
}
