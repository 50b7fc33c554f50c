package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;

/** Experiment variant'ı; funnel için success/failure, trend için count/exposure kullanılır. */
@Value
@Builder
public class VariantCounts {

    String key;
    long successCount;
    long failureCount;
    long count;
    double exposure;

    public long sampleSize() {
        return successCount + failureCount;
    }
}
