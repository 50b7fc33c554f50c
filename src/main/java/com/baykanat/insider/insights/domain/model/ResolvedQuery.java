package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/** Tarihleri çözümlenmiş, entity'leri indekslenmiş ve action'ları yüklenmiş sorgu. */
@Value
@Builder
public class ResolvedQuery {

    InsightQuery query;
    ZonedDateTime from;
    ZonedDateTime to;
    ZoneId zone;
    List<IndexedEntity> entities;
    List<IndexedExclusion> exclusions;
    Map<String, ActionDefinition> actions;
    ConversionWindow conversionWindow;

    public long teamId() {
        return query.getTeamId();
    }

    public Breakdown breakdown() {
        return query.getBreakdown();
    }

    public boolean hasBreakdown() {
        Breakdown breakdown = query.getBreakdown();
        return breakdown != null && !breakdown.getKeys().isEmpty();
    }

    public AggregationTarget aggregation() {
        return query.getAggregation() != null ? query.getAggregation() : AggregationTarget.PERSON;
    }

    public int stepCount() {
        return entities.size();
    }

    /** 1.0 ve null eşdeğerdir. */
    public double samplingFactor() {
        Double factor = query.getSamplingFactor();
        return factor == null ? 1.0 : factor;
    }
}
