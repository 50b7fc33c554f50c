package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/** Classifier'ın ihtiyaç duyduğu funnel parametreleri; ResolvedQuery'den bir kez türetilir. */
@Value
@Builder
public class FunnelDefinition {

    int stepCount;
    FunnelOrderType orderType;
    ConversionWindow window;
    ZoneId zone;

    /** strictlyAfterPrevious[i]: i. step bir öncekiyle aynı (veya superset) entity, timestamp kesin büyük olmalı. */
    boolean[] strictlyAfterPrevious;

    List<IndexedExclusion> exclusions;

    public int lastStep() {
        return stepCount - 1;
    }

    public Instant windowEnd(Instant anchor) {
        return window.end(anchor, zone);
    }
}
