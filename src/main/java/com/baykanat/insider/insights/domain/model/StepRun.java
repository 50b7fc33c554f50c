package com.baykanat.insider.insights.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Bir anchor'dan başlayan funnel denemesi; stepTimestamps[i] i. step'in sağlandığı an.
 * declaredSteps[i] o anda sağlanan tanımlı step index'idir; sıralı funnel'larda i'nin kendisi,
 * unordered funnel'larda sağlanma sırasına göre farklı olabilir.
 */
@Value
public class StepRun {

    Instant anchor;
    int maxStepIndex;
    List<Instant> stepTimestamps;
    List<MatchedEvent> stepEvents;
    List<Integer> declaredSteps;

    public StepRun(Instant anchor, int maxStepIndex, List<Instant> stepTimestamps, List<MatchedEvent> stepEvents) {
        this(anchor, maxStepIndex, stepTimestamps, stepEvents,
                IntStream.range(0, stepEvents.size()).boxed().collect(Collectors.toUnmodifiableList()));
    }

    public StepRun(Instant anchor, int maxStepIndex, List<Instant> stepTimestamps, List<MatchedEvent> stepEvents,
                   List<Integer> declaredSteps) {
        this.anchor = anchor;
        this.maxStepIndex = maxStepIndex;
        this.stepTimestamps = stepTimestamps;
        this.stepEvents = stepEvents;
        this.declaredSteps = declaredSteps;
    }

    public boolean reached(int step) {
        return maxStepIndex >= step;
    }

    /** Anchor'dan ulaşılan son step'e kadar geçen süre. */
    public Duration duration() {
        return Duration.between(anchor, stepTimestamps.get(maxStepIndex));
    }

    /** step-1 → step geçiş süresi (saniye). */
    public double conversionSeconds(int step) {
        return secondsBetween(step - 1, step);
    }

    public double secondsBetween(int fromStep, int toStep) {
        Duration between = Duration.between(stepTimestamps.get(fromStep), stepTimestamps.get(toStep));
        return between.toNanos() / 1_000_000_000.0;
    }

    /** Tanımlı step'i sağlayan event; run o step'i sağlamadıysa boş. */
    public Optional<MatchedEvent> eventForDeclaredStep(int declaredStep) {
        int position = declaredSteps.indexOf(declaredStep);
        return position >= 0 ? Optional.of(stepEvents.get(position)) : Optional.empty();
    }
}
