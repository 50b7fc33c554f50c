package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.StepRun;

import java.util.ArrayList;
import java.util.List;

/** Tek breakdown bucket'ı için step sayıları, dönüşüm süreleri ve actor id'leri; worker'lar arası birleştirilebilir. */
public class FunnelAccumulator {

    private final long[] counts;
    private final List<List<Double>> conversionTimes;
    private final List<List<String>> actors;

    public FunnelAccumulator(int stepCount) {
        this.counts = new long[stepCount];
        this.conversionTimes = new ArrayList<>(stepCount);
        this.actors = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            conversionTimes.add(new ArrayList<>());
            actors.add(new ArrayList<>());
        }
    }

    /** Actor'ün en iyi run'ı; maxStepIndex'e kadar tüm step'lere kümülatif sayılır. */
    public void add(String actorId, StepRun run) {
        for (int step = 0; step <= run.getMaxStepIndex() && step < counts.length; step++) {
            counts[step]++;
            actors.get(step).add(actorId);
            if (step > 0) {
                conversionTimes.get(step).add(run.conversionSeconds(step));
            }
        }
    }

    public FunnelAccumulator merge(FunnelAccumulator other) {
        for (int step = 0; step < counts.length; step++) {
            counts[step] += other.counts[step];
            conversionTimes.get(step).addAll(other.conversionTimes.get(step));
            actors.get(step).addAll(other.actors.get(step));
        }
        return this;
    }

    public long count(int step) {
        return counts[step];
    }

    public List<Double> conversionTimes(int step) {
        return conversionTimes.get(step);
    }

    public List<String> actors(int step) {
        return actors.get(step);
    }

    public int stepCount() {
        return counts.length;
    }
}
