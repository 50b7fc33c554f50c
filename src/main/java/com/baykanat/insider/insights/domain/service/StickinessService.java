package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.AggregationTarget;
import com.baykanat.insider.insights.domain.model.IndexedEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.Interval;
import com.baykanat.insider.insights.domain.model.Period;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.model.StickinessSeries;
import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import com.baykanat.insider.insights.domain.source.EventQuery;
import com.baykanat.insider.insights.domain.source.EventSource;
import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;

/** Actor başına aktif periyot sayısının dağılımı: values[k-1] tam olarak k periyotta aktif olan actor sayısı. */
@Slf4j
@Service
@RequiredArgsConstructor
public class StickinessService {

    private final InsightQueryValidator validator;
    private final InsightQueryResolver resolver;
    private final EventQueryPlanner planner;
    private final EventSource eventSource;
    private final CohortMembershipSource cohortSource;
    private final GroupPropertiesSource groupSource;
    private final EntityMatcher entityMatcher;
    private final ParallelActorExecutor executor;
    private final TimeBucketer timeBucketer;
    private final AppProperties appProperties;

    public List<StickinessSeries> evaluateStickiness(InsightQuery query) {
        long started = System.nanoTime();
        validator.validateStickiness(query);
        ResolvedQuery resolved = resolver.resolve(query);
        QueryContext context = QueryContext.withTimeout(
                Duration.ofSeconds(appProperties.getEngine().getQueryTimeoutSeconds()));
        List<Period> periods = timeBucketer.periods(resolved.getFrom(), resolved.getTo(),
                query.getInterval(), resolved.getZone());
        PropertyLookup lookup = new PropertyLookup(query.getTeamId(), cohortSource, groupSource);

        List<Supplier<StickinessSeries>> tasks = new ArrayList<>();
        for (IndexedEntity entity : resolved.getEntities()) {
            tasks.add(() -> entitySeries(resolved, entity, periods, lookup, context));
        }
        List<StickinessSeries> series = executor.invokeAll(tasks, context);
        log.info("Stickiness evaluated: team={}, entities={}, periods={}, elapsedMs={}",
                query.getTeamId(), series.size(), periods.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return series;
    }

    private StickinessSeries entitySeries(ResolvedQuery query, IndexedEntity indexed, List<Period> periods,
                                          PropertyLookup lookup, QueryContext context) {
        EventQuery eventQuery = planner.plan(query, List.of(indexed.getEntity()),
                query.getFrom().toInstant(), query.getTo().toInstant(), false);
        AggregationTarget aggregation = query.aggregation();

        Map<String, BitSet> activePeriods = new HashMap<>();
        try (Stream<RawEvent> events = eventSource.query(eventQuery)) {
            events.forEach(event -> {
                String actorId = aggregation.actorKey(event);
                if (actorId == null || event.getTimestamp() == null) {
                    return;
                }
                int periodIndex = TimeBucketer.indexOf(periods, event.getTimestamp());
                if (periodIndex < 0) {
                    return;
                }
                try {
                    if (entityMatcher.matches(event, indexed.getEntity(), query, lookup)) {
                        activePeriods.computeIfAbsent(actorId, key -> new BitSet(periods.size())).set(periodIndex);
                    }
                } catch (IllegalArgumentException | ClassCastException e) {
                    context.recordSkippedActor();
                    log.warn("Skipping event {} of actor {}: {}", event.getUuid(), actorId, e.getMessage());
                }
            });
        }
        context.checkCancelled();

        long[] counts = new long[periods.size()];
        activePeriods.values().forEach(active -> counts[active.cardinality() - 1]++);

        Interval interval = query.getQuery().getInterval();
        double samplingFactor = query.samplingFactor();
        List<String> labels = new ArrayList<>(counts.length);
        List<Integer> days = new ArrayList<>(counts.length);
        List<Long> values = new ArrayList<>(counts.length);
        for (int k = 1; k <= counts.length; k++) {
            labels.add(interval.unitLabel(k));
            days.add(k);
            values.add(SamplingCorrection.correct(counts[k - 1], samplingFactor));
        }
        log.debug("Stickiness entity {}: actors={}", indexed.getEntity().displayName(), activePeriods.size());
        return StickinessSeries.builder()
                .label(indexed.getEntity().displayName())
                .entityIndex(indexed.getIndex())
                .labels(labels)
                .days(days)
                .values(values)
                .build();
    }
}
