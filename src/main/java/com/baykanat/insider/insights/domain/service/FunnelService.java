package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.model.ActorEventStream;
import com.baykanat.insider.insights.domain.model.ActorPage;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.BreakdownAttribution;
import com.baykanat.insider.insights.domain.model.FunnelDefinition;
import com.baykanat.insider.insights.domain.model.FunnelOrderType;
import com.baykanat.insider.insights.domain.model.FunnelResult;
import com.baykanat.insider.insights.domain.model.FunnelTrendsSeries;
import com.baykanat.insider.insights.domain.model.IndexedEntity;
import com.baykanat.insider.insights.domain.model.IndexedExclusion;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.MatchedEvent;
import com.baykanat.insider.insights.domain.model.Period;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.model.StepRun;
import com.baykanat.insider.insights.domain.model.TimeToConvertResult;
import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import com.baykanat.insider.insights.domain.source.EventQuery;
import com.baykanat.insider.insights.domain.source.EventSource;
import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Funnel sorgularının giriş noktası: step sayıları, funnel trends, time-to-convert ve step bazında actor listesi.
 * Event'ler actor'e göre gruplanır, actor'ler partition'lar halinde paralel sınıflandırılır, kısmi sonuçlar birleştirilir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelService {

    private final InsightQueryValidator validator;
    private final InsightQueryResolver resolver;
    private final EventQueryPlanner planner;
    private final EventSource eventSource;
    private final CohortMembershipSource cohortSource;
    private final GroupPropertiesSource groupSource;
    private final ActorStreamBuilder streamBuilder;
    private final FunnelStepClassifier classifier;
    private final BreakdownAttributor attributor;
    private final FunnelAggregator aggregator;
    private final ParallelActorExecutor executor;
    private final TimeBucketer timeBucketer;
    private final Clock clock;
    private final AppProperties appProperties;

    /** Actor'ün bir breakdown bucket'ı için stream'i ve aday run'ları. bucket null ise run'a göre attribution yapılır. */
    @Value
    private static class Partition {
        List<String> bucket;
        ActorEventStream stream;
        List<StepRun> runs;
    }

    @FunctionalInterface
    private interface PartitionConsumer {
        void accept(FunnelTally tally, String actorId, Partition partition);
    }

    public FunnelResult evaluateFunnel(InsightQuery query) {
        long started = System.nanoTime();
        validator.validateFunnel(query);
        ResolvedQuery resolved = resolver.resolve(query);
        QueryContext context = newContext();

        FunnelTally tally = tally(resolved, context, 0, (partial, actorId, partition) ->
                classifier.best(partition.getRuns()).ifPresent(best ->
                        bucketOf(partition, best, resolved).ifPresent(bucket -> partial.add(bucket, actorId, best))));

        FunnelResult result = aggregator.toResult(tally, resolved, context.getSkippedActors());
        log.info("Funnel evaluated: team={}, steps={}, series={}, skippedActors={}, elapsedMs={}",
                query.getTeamId(), resolved.stepCount(), result.getSeries().size(),
                context.getSkippedActors(), elapsedMs(started));
        return result;
    }

    /** Her anchor'ın run'ı anchor'ın düştüğü periyoda yazılır; actor ve periyot başına en iyi run sayılır. */
    public List<FunnelTrendsSeries> evaluateFunnelTrends(InsightQuery query) {
        long started = System.nanoTime();
        validator.validateFunnel(query);
        ResolvedQuery resolved = resolver.resolve(query);
        QueryContext context = newContext();
        int fromStep = fromStep(resolved);
        int toStep = toStep(resolved);
        List<Period> periods = timeBucketer.periods(resolved.getFrom(), resolved.getTo(),
                query.getInterval(), resolved.getZone());

        FunnelTally tally = tally(resolved, context, periods.size(), (partial, actorId, partition) -> {
            Map<Integer, StepRun> bestPerPeriod = new HashMap<>();
            for (StepRun run : partition.getRuns()) {
                int periodIndex = TimeBucketer.indexOf(periods, run.getAnchor());
                if (periodIndex >= 0) {
                    bestPerPeriod.merge(periodIndex, run,
                            (left, right) -> classifier.best(List.of(left, right)).orElse(left));
                }
            }
            bestPerPeriod.forEach((periodIndex, run) -> bucketOf(partition, run, resolved).ifPresent(bucket ->
                    partial.addPeriod(bucket, periodIndex, run.reached(fromStep), run.reached(toStep))));
        });

        List<FunnelTrendsSeries> series = aggregator.toTrends(tally, periods, resolved, clock.instant());
        log.info("Funnel trends evaluated: team={}, periods={}, series={}, skippedActors={}, elapsedMs={}",
                query.getTeamId(), periods.size(), series.size(), context.getSkippedActors(), elapsedMs(started));
        return series;
    }

    /** fromStep → toStep süre histogramı; breakdown dikkate alınmaz. */
    public TimeToConvertResult timeToConvert(InsightQuery query) {
        long started = System.nanoTime();
        validator.validateFunnel(query);
        ResolvedQuery resolved = resolver.resolve(query.toBuilder().breakdown(null).build());
        QueryContext context = newContext();
        int fromStep = fromStep(resolved);
        int toStep = toStep(resolved);

        FunnelTally tally = tally(resolved, context, 0, (partial, actorId, partition) ->
                classifier.best(partition.getRuns())
                        .filter(best -> best.reached(toStep))
                        .ifPresent(best -> partial.addDuration(best.secondsBetween(fromStep, toStep))));

        TimeToConvertResult result = aggregator.timeToConvert(tally.getConversionDurations(), query.getBinCount());
        log.info("Time to convert evaluated: team={}, samples={}, bins={}, elapsedMs={}",
                query.getTeamId(), tally.getConversionDurations().size(), result.getBins().size(), elapsedMs(started));
        return result;
    }

    /**
     * funnelStep 1 tabanlıdır. Pozitif N: N. step'e ulaşan actor'ler. Negatif N: |N|-1. step'e ulaşıp |N|. step'e
     * ulaşamayan actor'ler. breakdownValue null ise tüm bucket'lar birleştirilir.
     */
    public ActorPage listActorsAtStep(InsightQuery query, int funnelStep, List<String> breakdownValue,
                                      Integer offset, Integer limit) {
        validator.validateFunnel(query);
        int stepCount = query.getEntities().size();
        if (funnelStep == 0 || funnelStep == -1 || Math.abs(funnelStep) > stepCount) {
            throw new InsightValidationException("funnel_step " + funnelStep + " is out of range for a "
                    + stepCount + "-step funnel");
        }
        int pageOffset = offset == null ? 0 : offset;
        if (pageOffset < 0) {
            throw new InsightValidationException("offset must not be negative");
        }
        int pageLimit = pageLimit(limit);

        ResolvedQuery resolved = resolver.resolve(query);
        QueryContext context = newContext();
        FunnelTally tally = tally(resolved, context, 0, (partial, actorId, partition) ->
                classifier.best(partition.getRuns()).ifPresent(best ->
                        bucketOf(partition, best, resolved).ifPresent(bucket -> partial.add(bucket, actorId, best))));

        Map<List<String>, FunnelAccumulator> buckets = aggregator.foldBuckets(tally.getBuckets(), resolved);
        Set<String> reached = new TreeSet<>();
        Set<String> reachedNext = new TreeSet<>();
        int step = Math.abs(funnelStep) - 1;
        buckets.forEach((value, accumulator) -> {
            if (breakdownValue != null && resolved.hasBreakdown() && !breakdownValue.equals(value)) {
                return;
            }
            if (funnelStep > 0) {
                reached.addAll(accumulator.actors(step));
            } else {
                reached.addAll(accumulator.actors(step - 1));
                reachedNext.addAll(accumulator.actors(step));
            }
        });
        reached.removeAll(reachedNext);

        List<String> actorIds = new ArrayList<>(reached);
        int fromIndex = Math.min(pageOffset, actorIds.size());
        int toIndex = Math.min(actorIds.size(), fromIndex + pageLimit);
        log.debug("Listed actors at step {}: total={}, offset={}, limit={}", funnelStep, actorIds.size(), pageOffset, pageLimit);
        return ActorPage.builder()
                .actorIds(List.copyOf(actorIds.subList(fromIndex, toIndex)))
                .offset(pageOffset)
                .limit(pageLimit)
                .total(actorIds.size())
                .hasMore(toIndex < actorIds.size())
                .build();
    }

    private FunnelTally tally(ResolvedQuery query, QueryContext context, int periodCount, PartitionConsumer consumer) {
        FunnelDefinition funnel = resolver.funnelDefinition(query);
        boolean strict = funnel.getOrderType() == FunnelOrderType.STRICT;

        List<InsightEntity> entities = new ArrayList<>();
        query.getEntities().stream().map(IndexedEntity::getEntity).forEach(entities::add);
        query.getExclusions().stream().map(IndexedExclusion::getEntity).forEach(entities::add);
        EventQuery eventQuery = planner.plan(query, entities, query.getFrom().toInstant(), query.getTo().toInstant(), strict);
        PropertyLookup lookup = new PropertyLookup(query.teamId(), cohortSource, groupSource);

        List<Map.Entry<String, List<RawEvent>>> actors;
        try (Stream<RawEvent> events = eventSource.query(eventQuery)) {
            actors = new ArrayList<>(streamBuilder.groupByActor(events, query.aggregation()).entrySet());
        }
        log.debug("Funnel query: team={}, steps={}, exclusions={}, actors={}, order={}",
                query.teamId(), query.stepCount(), query.getExclusions().size(), actors.size(), funnel.getOrderType());

        return executor.execute(actors, context,
                () -> new FunnelTally(query.stepCount(), periodCount),
                (partial, actor) -> {
                    ActorEventStream stream = streamBuilder.build(actor.getKey(), actor.getValue(), query, lookup, strict);
                    for (Partition partition : partitions(stream, query, funnel, lookup)) {
                        consumer.accept(partial, actor.getKey(), partition);
                    }
                },
                FunnelTally::merge);
    }

    private List<Partition> partitions(ActorEventStream stream, ResolvedQuery query, FunnelDefinition funnel,
                                       PropertyLookup lookup) {
        if (!query.hasBreakdown()) {
            return List.of(new Partition(FunnelTally.NO_BREAKDOWN, stream, classifier.classify(stream, funnel)));
        }
        Breakdown breakdown = query.breakdown();
        if (breakdown.isCohort()) {
            List<StepRun> runs = classifier.classify(stream, funnel);
            if (runs.isEmpty()) {
                return List.of();
            }
            List<Partition> partitions = new ArrayList<>();
            for (List<String> bucket : attributor.cohortBuckets(stream.getPersonId(), breakdown, lookup)) {
                partitions.add(new Partition(bucket, stream, runs));
            }
            return partitions;
        }
        if (breakdown.getAttribution() == BreakdownAttribution.ALL_EVENTS) {
            return allEventsPartitions(stream, funnel);
        }
        return List.of(new Partition(null, stream, classifier.classify(stream, funnel)));
    }

    /**
     * Her farklı breakdown değeri için stream ayrı sınıflandırılır. Başka değerli step event'leri step maskesi
     * silinerek gürültüye dönüşür; strict funnel'da run'ı yine bitirirler.
     */
    private List<Partition> allEventsPartitions(ActorEventStream stream, FunnelDefinition funnel) {
        Set<List<String>> values = new LinkedHashSet<>();
        for (MatchedEvent event : stream.getEvents()) {
            if (event.matchesAnyStep()) {
                values.add(event.getBreakdownValue());
            }
        }
        List<Partition> partitions = new ArrayList<>(values.size());
        for (List<String> value : values) {
            List<MatchedEvent> events = new ArrayList<>(stream.getEvents().size());
            for (MatchedEvent event : stream.getEvents()) {
                if (!event.matchesAnyStep() || value.equals(event.getBreakdownValue())) {
                    events.add(event);
                } else {
                    events.add(new MatchedEvent(event.getTimestamp(), 0L, event.getExclusionMask(), null, event.getRaw()));
                }
            }
            ActorEventStream partitionStream = new ActorEventStream(stream.getActorId(), stream.getPersonId(), events);
            partitions.add(new Partition(value, partitionStream, classifier.classify(partitionStream, funnel)));
        }
        return partitions;
    }

    private Optional<List<String>> bucketOf(Partition partition, StepRun run, ResolvedQuery query) {
        if (partition.getBucket() != null) {
            return Optional.of(partition.getBucket());
        }
        return attributor.attribute(partition.getStream(), run, query.breakdown());
    }

    private static int fromStep(ResolvedQuery query) {
        Integer from = query.getQuery().getFunnelFromStep();
        return from != null ? from : 0;
    }

    private static int toStep(ResolvedQuery query) {
        Integer to = query.getQuery().getFunnelToStep();
        return to != null ? to : query.stepCount() - 1;
    }

    private int pageLimit(Integer limit) {
        int maxPageSize = appProperties.getActors().getMaxPageSize();
        if (limit == null) {
            return appProperties.getActors().getDefaultPageSize();
        }
        if (limit < 1 || limit > maxPageSize) {
            throw new InsightValidationException("limit must be between 1 and " + maxPageSize);
        }
        return limit;
    }

    private QueryContext newContext() {
        return QueryContext.withTimeout(Duration.ofSeconds(appProperties.getEngine().getQueryTimeoutSeconds()));
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
