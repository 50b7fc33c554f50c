package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.ActorEventStream;
import com.baykanat.insider.insights.domain.model.FunnelDefinition;
import com.baykanat.insider.insights.domain.model.IndexedExclusion;
import com.baykanat.insider.insights.domain.model.MatchedEvent;
import com.baykanat.insider.insights.domain.model.StepRun;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Actor'ün sıralı event stream'inden funnel run'larını çıkarır. Her aday anchor bağımsız bir run üretir;
 * exclusion'a takılan run tamamen atılır. Sıralama semantiği tek bir switch ile seçilir.
 */
@Component
public class FunnelStepClassifier {

    /** En yüksek step, eşitlikte en kısa süre, sonra en erken anchor. */
    private static final Comparator<StepRun> BEST_RUN = Comparator
            .comparingInt(StepRun::getMaxStepIndex).reversed()
            .thenComparing(StepRun::duration)
            .thenComparing(StepRun::getAnchor);

    /** Tüm aday run'lar, anchor sırasıyla. */
    public List<StepRun> classify(ActorEventStream stream, FunnelDefinition funnel) {
        List<MatchedEvent> events = stream.getEvents();
        List<StepRun> runs = new ArrayList<>();
        for (int position = 0; position < events.size(); position++) {
            MatchedEvent candidate = events.get(position);
            Optional<StepRun> run = switch (funnel.getOrderType()) {
                case ORDERED -> candidate.matchesStep(0)
                        ? walkSequential(events, position, funnel, false)
                        : Optional.empty();
                case STRICT -> candidate.matchesStep(0)
                        ? walkSequential(events, position, funnel, true)
                        : Optional.empty();
                case UNORDERED -> candidate.matchesAnyStep()
                        ? walkUnordered(events, position, funnel)
                        : Optional.empty();
            };
            run.ifPresent(runs::add);
        }
        return runs;
    }

    public Optional<StepRun> best(List<StepRun> runs) {
        return runs.stream().min(BEST_RUN);
    }

    public Optional<StepRun> classifyBest(ActorEventStream stream, FunnelDefinition funnel) {
        return best(classify(stream, funnel));
    }

    /** ORDERED ve STRICT; strict modda sıradaki step veya exclusion olmayan ilk event run'ı bitirir. */
    private Optional<StepRun> walkSequential(List<MatchedEvent> events, int anchorPosition,
                                             FunnelDefinition funnel, boolean strict) {
        MatchedEvent anchor = events.get(anchorPosition);
        Instant windowEnd = funnel.windowEnd(anchor.getTimestamp());
        List<Instant> timestamps = new ArrayList<>();
        List<MatchedEvent> stepEvents = new ArrayList<>();
        timestamps.add(anchor.getTimestamp());
        stepEvents.add(anchor);
        int current = 0;

        for (int position = anchorPosition + 1; position < events.size() && current < funnel.lastStep(); position++) {
            MatchedEvent event = events.get(position);
            if (event.getTimestamp().isAfter(windowEnd)) {
                break;
            }
            if (hitsLiveExclusion(event, current, timestamps, funnel)) {
                return Optional.empty();
            }
            int next = current + 1;
            if (event.matchesStep(next) && respectsOrdering(event, next, timestamps.get(current), funnel)) {
                current = next;
                timestamps.add(event.getTimestamp());
                stepEvents.add(event);
            } else if (strict && event.getExclusionMask() == 0L) {
                break;
            }
        }
        return Optional.of(new StepRun(anchor.getTimestamp(), current, List.copyOf(timestamps), List.copyOf(stepEvents)));
    }

    /** Window içindeki event'ler sağlamadıkları en düşük step'e atanır. */
    private Optional<StepRun> walkUnordered(List<MatchedEvent> events, int anchorPosition, FunnelDefinition funnel) {
        MatchedEvent anchor = events.get(anchorPosition);
        Instant windowEnd = funnel.windowEnd(anchor.getTimestamp());
        List<Instant> timestamps = new ArrayList<>();
        List<MatchedEvent> stepEvents = new ArrayList<>();
        List<Integer> declaredSteps = new ArrayList<>();
        long satisfied = 0L;

        for (int position = anchorPosition; position < events.size() && timestamps.size() < funnel.getStepCount(); position++) {
            MatchedEvent event = events.get(position);
            if (event.getTimestamp().isAfter(windowEnd)) {
                break;
            }
            if (!timestamps.isEmpty() && hitsLiveExclusion(event, timestamps.size() - 1, timestamps, funnel)) {
                return Optional.empty();
            }
            int step = lowestUnsatisfiedStep(event, satisfied, funnel.getStepCount());
            if (step >= 0) {
                satisfied |= 1L << step;
                timestamps.add(event.getTimestamp());
                stepEvents.add(event);
                declaredSteps.add(step);
            }
        }
        return Optional.of(new StepRun(anchor.getTimestamp(), timestamps.size() - 1,
                List.copyOf(timestamps), List.copyOf(stepEvents), List.copyOf(declaredSteps)));
    }

    private static int lowestUnsatisfiedStep(MatchedEvent event, long satisfied, int stepCount) {
        for (int step = 0; step < stepCount; step++) {
            if (event.matchesStep(step) && (satisfied & (1L << step)) == 0) {
                return step;
            }
        }
        return -1;
    }

    /** Aynı (veya superset) entity'ye sahip ardışık step'lerde timestamp kesin olarak büyük olmalı. */
    private static boolean respectsOrdering(MatchedEvent event, int step, Instant previous, FunnelDefinition funnel) {
        boolean[] strictlyAfter = funnel.getStrictlyAfterPrevious();
        if (strictlyAfter != null && step < strictlyAfter.length && strictlyAfter[step]) {
            return event.getTimestamp().isAfter(previous);
        }
        return !event.getTimestamp().isBefore(previous);
    }

    /** Exclusion [from, to] ulaşılan step from ile to arasındayken canlıdır; from step'inden sonra olmalıdır. */
    private static boolean hitsLiveExclusion(MatchedEvent event, int current, List<Instant> timestamps,
                                             FunnelDefinition funnel) {
        if (event.getExclusionMask() == 0L || funnel.getExclusions() == null) {
            return false;
        }
        for (IndexedExclusion exclusion : funnel.getExclusions()) {
            if (!event.matchesExclusion(exclusion.getIndex())) {
                continue;
            }
            int from = exclusion.getFromStep();
            if (from <= current && current < exclusion.getToStep()
                    && event.getTimestamp().isAfter(timestamps.get(from))) {
                return true;
            }
        }
        return false;
    }
}
