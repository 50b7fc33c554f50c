package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.ActorEventStream;
import com.baykanat.insider.insights.domain.model.AggregationTarget;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.IndexedEntity;
import com.baykanat.insider.insights.domain.model.IndexedExclusion;
import com.baykanat.insider.insights.domain.model.MatchedEvent;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/** Ham event'leri actor'e göre gruplar ve her actor için step/exclusion maskeli, sıralı stream üretir. */
@Component
@RequiredArgsConstructor
public class ActorStreamBuilder {

    private static final Comparator<RawEvent> CHRONOLOGICAL = Comparator.comparing(RawEvent::getTimestamp);

    private final EntityMatcher entityMatcher;
    private final BreakdownAttributor breakdownAttributor;

    /** Actor anahtarı olmayan event'ler (ör. group tipi eksik) atlanır. Actor'ler ilk görülme sırasını korur. */
    public Map<String, List<RawEvent>> groupByActor(Stream<RawEvent> events, AggregationTarget aggregation) {
        Map<String, List<RawEvent>> byActor = new LinkedHashMap<>();
        events.forEach(event -> {
            String actorKey = aggregation.actorKey(event);
            if (actorKey != null && event.getTimestamp() != null) {
                byActor.computeIfAbsent(actorKey, key -> new ArrayList<>()).add(event);
            }
        });
        return byActor;
    }

    /**
     * Actor stream'i. keepNoise true ise (strict funnel) hiçbir step'e uymayan event'ler de stream'de kalır.
     * Kaynak sıralamayı yalnızca actor içinde garanti ettiği için burada yeniden sıralanır (stable).
     */
    public ActorEventStream build(String actorId, List<RawEvent> rawEvents, ResolvedQuery query,
                                  PropertyLookup lookup, boolean keepNoise) {
        List<RawEvent> sorted = new ArrayList<>(rawEvents);
        sorted.sort(CHRONOLOGICAL);

        Breakdown breakdown = query.breakdown();
        boolean eventBreakdown = query.hasBreakdown() && !breakdown.isCohort();
        List<MatchedEvent> matched = new ArrayList<>(sorted.size());
        String personId = null;

        for (RawEvent event : sorted) {
            if (personId == null) {
                personId = event.getPersonId();
            }
            long stepMask = 0L;
            for (IndexedEntity step : query.getEntities()) {
                if (entityMatcher.matches(event, step.getEntity(), query, lookup)) {
                    stepMask |= 1L << step.getIndex();
                }
            }
            long exclusionMask = 0L;
            for (IndexedExclusion exclusion : query.getExclusions()) {
                if (entityMatcher.matches(event, exclusion.getEntity(), query, lookup)) {
                    exclusionMask |= 1L << exclusion.getIndex();
                }
            }
            if (stepMask == 0L && exclusionMask == 0L && !keepNoise) {
                continue;
            }
            List<String> value = eventBreakdown && stepMask != 0L
                    ? breakdownAttributor.valueOf(event, breakdown, lookup)
                    : null;
            matched.add(new MatchedEvent(event.getTimestamp(), stepMask, exclusionMask, value, event));
        }
        return new ActorEventStream(actorId, personId, matched);
    }
}
