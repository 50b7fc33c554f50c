package com.baykanat.insider.insights.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Step ve exclusion eşleşmeleri bitmask olarak tutulan event; bir event birden fazla step'i sağlayabilir. */
@Value
public class MatchedEvent {

    Instant timestamp;
    long stepMask;
    long exclusionMask;
    List<String> breakdownValue;
    RawEvent raw;

    public boolean matchesStep(int step) {
        return (stepMask & (1L << step)) != 0;
    }

    public boolean matchesAnyStep() {
        return stepMask != 0;
    }

    public boolean matchesExclusion(int exclusion) {
        return (exclusionMask & (1L << exclusion)) != 0;
    }

    public MatchedEvent withBreakdownValue(List<String> value) {
        return new MatchedEvent(timestamp, stepMask, exclusionMask, value, raw);
    }
}
