package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable insight sorgusu. Tarihler ham string olarak tutulur (ISO tarih, "-7d" gibi göreli ifade
 * veya "all"); çözümleme InsightQueryResolver'da yapılır.
 */
@Value
@Builder(toBuilder = true)
public class InsightQuery {

    long teamId;
    String dateFrom;
    String dateTo;
    String timezone;

    @Builder.Default
    Interval interval = Interval.DAY;

    @Builder.Default
    List<InsightEntity> entities = List.of();

    @Builder.Default
    List<ExclusionEntity> exclusions = List.of();

    Breakdown breakdown;

    @Builder.Default
    FunnelOrderType funnelOrderType = FunnelOrderType.ORDERED;

    ConversionWindow conversionWindow;

    @Builder.Default
    AggregationTarget aggregation = AggregationTarget.PERSON;

    @Builder.Default
    DisplayMode display = DisplayMode.TIME_SERIES;

    Double samplingFactor;

    /** Tüm entity'lere uygulanan global filtre. */
    PropertyGroup properties;

    String formula;

    Integer funnelFromStep;
    Integer funnelToStep;
    Integer binCount;
}
