package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.FunnelResult;
import com.baykanat.insider.insights.domain.model.FunnelSeries;
import com.baykanat.insider.insights.domain.model.FunnelStep;
import com.baykanat.insider.insights.domain.model.FunnelTrendPoint;
import com.baykanat.insider.insights.domain.model.FunnelTrendsSeries;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.EntityType;
import com.baykanat.insider.insights.domain.model.Period;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.model.Statistic;
import com.baykanat.insider.insights.domain.model.TimeToConvertResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Birleştirilmiş FunnelTally'den step sonuçlarını, funnel trend noktalarını ve time-to-convert histogramını üretir. */
@Component
@RequiredArgsConstructor
public class FunnelAggregator {

    private final BreakdownAttributor breakdownAttributor;

    public FunnelResult toResult(FunnelTally tally, ResolvedQuery query, long skippedActors) {
        Map<List<String>, FunnelAccumulator> buckets = foldBuckets(tally.getBuckets(), query);
        List<FunnelSeries> series = new ArrayList<>();

        if (!query.hasBreakdown()) {
            FunnelAccumulator accumulator = buckets.getOrDefault(FunnelTally.NO_BREAKDOWN,
                    new FunnelAccumulator(query.stepCount()));
            series.add(FunnelSeries.builder().steps(steps(accumulator, query, null)).build());
        } else {
            sortedBuckets(buckets).forEach(entry -> series.add(FunnelSeries.builder()
                    .breakdownValue(entry.getKey())
                    .steps(steps(entry.getValue(), query, entry.getKey()))
                    .build()));
        }
        return FunnelResult.builder()
                .breakdown(query.hasBreakdown())
                .series(series)
                .skippedActors(skippedActors)
                .build();
    }

    /** Cohort dışındaki breakdown'larda limit aşılırsa küçük bucket'lar "Other" altında birleştirilir. */
    public Map<List<String>, FunnelAccumulator> foldBuckets(Map<List<String>, FunnelAccumulator> buckets,
                                                            ResolvedQuery query) {
        if (!query.hasBreakdown() || query.breakdown().isCohort()) {
            return buckets;
        }
        Map<List<String>, Long> actorCounts = new LinkedHashMap<>();
        buckets.forEach((value, accumulator) -> actorCounts.put(value, accumulator.count(0)));
        Map<List<String>, List<String>> mapping = breakdownAttributor.foldOther(
                actorCounts, query.breakdown().getLimit(), query.breakdown().getKeys().size());

        Map<List<String>, FunnelAccumulator> folded = new LinkedHashMap<>();
        buckets.forEach((value, accumulator) -> folded.merge(mapping.get(value), accumulator, FunnelAccumulator::merge));
        return folded;
    }

    private List<FunnelStep> steps(FunnelAccumulator accumulator, ResolvedQuery query, List<String> breakdownValue) {
        double samplingFactor = query.samplingFactor();
        List<FunnelStep> steps = new ArrayList<>(query.stepCount());
        for (int step = 0; step < query.stepCount(); step++) {
            InsightEntity entity = query.getEntities().get(step).getEntity();
            double[] times = toArray(accumulator.conversionTimes(step));
            boolean hasTimes = step > 0 && times.length > 0;
            steps.add(FunnelStep.builder()
                    .order(step)
                    .name(entity.displayName())
                    .customName(entity.getCustomName())
                    .actionId(entity.getType() == EntityType.ACTIONS ? entity.getId() : null)
                    .count(SamplingCorrection.correct(accumulator.count(step), samplingFactor))
                    .averageConversionTime(hasTimes ? Statistic.AVG.apply(times) : null)
                    .medianConversionTime(hasTimes ? Statistic.MEDIAN.apply(times) : null)
                    .breakdownValue(breakdownValue)
                    .build());
        }
        return steps;
    }

    /** Her giriş periyodu için bir nokta; girişi olmayan periyotlar sıfırla doldurulur. */
    public List<FunnelTrendsSeries> toTrends(FunnelTally tally, List<Period> periods, ResolvedQuery query, Instant now) {
        Map<List<String>, long[][]> periodCounts = foldPeriodCounts(tally.getPeriodCounts(), query);
        List<FunnelTrendsSeries> series = new ArrayList<>();
        if (!query.hasBreakdown()) {
            long[][] counts = periodCounts.getOrDefault(FunnelTally.NO_BREAKDOWN, new long[2][periods.size()]);
            series.add(FunnelTrendsSeries.builder().points(points(counts, periods, query, now)).build());
            return series;
        }
        List<List<String>> values = new ArrayList<>(periodCounts.keySet());
        values.sort(Comparator.<List<String>>comparingLong(value -> -sum(periodCounts.get(value)[0]))
                .thenComparing(BreakdownAttributor.valueOrder()));
        for (List<String> value : values) {
            series.add(FunnelTrendsSeries.builder()
                    .breakdownValue(value)
                    .points(points(periodCounts.get(value), periods, query, now))
                    .build());
        }
        return series;
    }

    private Map<List<String>, long[][]> foldPeriodCounts(Map<List<String>, long[][]> periodCounts, ResolvedQuery query) {
        if (!query.hasBreakdown() || query.breakdown().isCohort()) {
            return periodCounts;
        }
        Map<List<String>, Long> entrants = new LinkedHashMap<>();
        periodCounts.forEach((value, counts) -> entrants.put(value, sum(counts[0])));
        Map<List<String>, List<String>> mapping = breakdownAttributor.foldOther(
                entrants, query.breakdown().getLimit(), query.breakdown().getKeys().size());

        Map<List<String>, long[][]> folded = new LinkedHashMap<>();
        periodCounts.forEach((value, counts) -> folded.merge(mapping.get(value), counts, (left, right) -> {
            long[][] combined = new long[2][left[0].length];
            for (int row = 0; row < 2; row++) {
                for (int i = 0; i < left[row].length; i++) {
                    combined[row][i] = left[row][i] + right[row][i];
                }
            }
            return combined;
        }));
        return folded;
    }

    private List<FunnelTrendPoint> points(long[][] counts, List<Period> periods, ResolvedQuery query, Instant now) {
        double samplingFactor = query.samplingFactor();
        List<FunnelTrendPoint> points = new ArrayList<>(periods.size());
        for (int i = 0; i < periods.size(); i++) {
            Period period = periods.get(i);
            long reachedFrom = counts[0][i];
            long reachedTo = counts[1][i];
            Instant windowEnd = query.getConversionWindow().end(period.getStart().toInstant(), query.getZone());
            points.add(FunnelTrendPoint.builder()
                    .timestamp(period.getStart().toOffsetDateTime().toString())
                    .label(period.getLabel())
                    .day(period.getDay())
                    .reachedFromStepCount(SamplingCorrection.correct(reachedFrom, samplingFactor))
                    .reachedToStepCount(SamplingCorrection.correct(reachedTo, samplingFactor))
                    .conversionRate(conversionRate(reachedFrom, reachedTo))
                    .periodFinal(windowEnd.isBefore(now))
                    .build());
        }
        return points;
    }

    /** Yüzde, iki ondalık; girişi olmayan periyotta 0. */
    static double conversionRate(long reachedFrom, long reachedTo) {
        if (reachedFrom == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(reachedTo * 100.0 / reachedFrom).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Süre histogramı. Bin sayısı verilmişse [1, 90] aralığına sıkıştırılır, verilmemişse
     * clamp(ceil(cbrt(n)), 1, 60). Genişlik en az 60 saniyedir.
     */
    public TimeToConvertResult timeToConvert(List<Double> durations, Integer requestedBins) {
        if (durations.isEmpty()) {
            return TimeToConvertResult.builder().bins(List.of()).binWidthSeconds(0).build();
        }
        double[] samples = toArray(durations);
        int binCount = requestedBins != null
                ? clamp(requestedBins, 1, 90)
                : clamp((int) Math.ceil(Math.cbrt(samples.length)), 1, 60);
        long min = (long) Math.floor(Statistic.MIN.apply(samples));
        long max = (long) Math.ceil(Statistic.MAX.apply(samples));
        long width = Math.max((long) Math.ceil((max - min) / (double) binCount), 60L);

        long[] counts = new long[binCount];
        for (double sample : samples) {
            int index = (int) Math.min((long) ((sample - min) / width), binCount - 1L);
            counts[index]++;
        }
        List<TimeToConvertResult.Bin> bins = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            bins.add(new TimeToConvertResult.Bin(min + i * width, counts[i]));
        }
        return TimeToConvertResult.builder()
                .bins(bins)
                .binWidthSeconds(width)
                .averageConversionTime(Statistic.AVG.apply(samples))
                .build();
    }

    private static List<Map.Entry<List<String>, FunnelAccumulator>> sortedBuckets(Map<List<String>, FunnelAccumulator> buckets) {
        List<Map.Entry<List<String>, FunnelAccumulator>> entries = new ArrayList<>(buckets.entrySet());
        entries.sort(Comparator.<Map.Entry<List<String>, FunnelAccumulator>>comparingLong(entry -> -entry.getValue().count(0))
                .thenComparing(Map.Entry::getKey, BreakdownAttributor.valueOrder()));
        return entries;
    }

    private static long sum(long[] values) {
        long total = 0;
        for (long value : values) {
            total += value;
        }
        return total;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
