package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Variant sayıları hazır experiment değerlendirme isteği; control variants içinde yer alır. */
@Value
@Builder
public class ExperimentQuery {

    @Builder.Default
    ExperimentMetricType metricType = ExperimentMetricType.FUNNEL;

    String controlKey;

    @Builder.Default
    List<VariantCounts> variants = List.of();
}
