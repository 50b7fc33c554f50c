package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.StepRun;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Worker başına kısmi funnel sonucu: bucket → FunnelAccumulator, funnel trends için bucket → periyot sayaçları
 * ve time-to-convert süreleri. Breakdown yoksa tek bucket anahtarı null yerine boş listedir.
 */
public class FunnelTally {

    public static final List<String> NO_BREAKDOWN = List.of();

    private final int stepCount;
    private final int periodCount;
    private final Map<List<String>, FunnelAccumulator> buckets = new HashMap<>();
    private final Map<List<String>, long[][]> periodCounts = new HashMap<>();
    private final List<Double> conversionDurations = new ArrayList<>();

    public FunnelTally(int stepCount, int periodCount) {
        this.stepCount = stepCount;
        this.periodCount = periodCount;
    }

    public void add(List<String> bucket, String actorId, StepRun run) {
        buckets.computeIfAbsent(bucket, key -> new FunnelAccumulator(stepCount)).add(actorId, run);
    }

    /** Funnel trends: giriş periyodunda from/to step'e ulaşma sayaçları. */
    public void addPeriod(List<String> bucket, int periodIndex, boolean reachedFrom, boolean reachedTo) {
        long[][] counts = periodCounts.computeIfAbsent(bucket, key -> new long[2][periodCount]);
        if (reachedFrom) {
            counts[0][periodIndex]++;
        }
        if (reachedTo) {
            counts[1][periodIndex]++;
        }
    }

    public void addDuration(double seconds) {
        conversionDurations.add(seconds);
    }

    public FunnelTally merge(FunnelTally other) {
        other.buckets.forEach((bucket, accumulator) -> buckets.merge(bucket, accumulator, FunnelAccumulator::merge));
        other.periodCounts.forEach((bucket, counts) -> periodCounts.merge(bucket, counts, (left, right) -> {
            for (int row = 0; row < left.length; row++) {
                for (int i = 0; i < left[row].length; i++) {
                    left[row][i] += right[row][i];
                }
            }
            return left;
        }));
        conversionDurations.addAll(other.conversionDurations);
        return this;
    }

    public Map<List<String>, FunnelAccumulator> getBuckets() {
        return buckets;
    }

    public Map<List<String>, long[][]> getPeriodCounts() {
        return periodCounts;
    }

    public List<Double> getConversionDurations() {
        return conversionDurations;
    }
}
