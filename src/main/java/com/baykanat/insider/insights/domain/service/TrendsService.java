package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.AggregationTarget;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.DisplayMode;
import com.baykanat.insider.insights.domain.model.IndexedEntity;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.MathType;
import com.baykanat.insider.insights.domain.model.Period;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.model.TrendSeries;
import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import com.baykanat.insider.insights.domain.source.EventQuery;
import com.baykanat.insider.insights.domain.source.EventSource;
import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Trend sorgularının giriş noktası. Her entity bağımsız bir task olarak paralel hesaplanır; breakdown, "Other"
 * katlaması, formula ve display dönüşümleri entity değerleri hazır olduktan sonra uygulanır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendsService {

    private static final Comparator<Map.Entry<List<String>, double[]>> BY_TOTAL_DESC =
            Comparator.<Map.Entry<List<String>, double[]>>comparingDouble(entry -> -Arrays.stream(entry.getValue()).sum())
                    .thenComparing(Map.Entry::getKey, BreakdownAttributor.valueOrder());

    private final InsightQueryValidator validator;
    private final InsightQueryResolver resolver;
    private final EventQueryPlanner planner;
    private final EventSource eventSource;
    private final CohortMembershipSource cohortSource;
    private final GroupPropertiesSource groupSource;
    private final EntityMatcher entityMatcher;
    private final BreakdownAttributor attributor;
    private final TrendsAggregator aggregator;
    private final ParallelActorExecutor executor;
    private final TimeBucketer timeBucketer;
    private final AppProperties appProperties;

    public List<TrendSeries> evaluateTrends(InsightQuery query) {
        long started = System.nanoTime();
        validator.validateTrends(query);
        ResolvedQuery resolved = resolver.resolve(query);
        QueryContext context = QueryContext.withTimeout(
                Duration.ofSeconds(appProperties.getEngine().getQueryTimeoutSeconds()));
        List<Period> periods = query.getDisplay().isTimeSeries()
                ? timeBucketer.periods(resolved.getFrom(), resolved.getTo(), query.getInterval(), resolved.getZone())
                : List.of(timeBucketer.aggregatePeriod(resolved.getFrom(), resolved.getTo()));
        PropertyLookup lookup = new PropertyLookup(query.getTeamId(), cohortSource, groupSource);

        List<Supplier<Map<List<String>, double[]>>> tasks = new ArrayList<>();
        for (IndexedEntity entity : resolved.getEntities()) {
            tasks.add(() -> entityValues(resolved, entity.getEntity(), periods, lookup, context));
        }
        List<Map<List<String>, double[]>> perEntity = executor.invokeAll(tasks, context);

        List<TrendSeries> series = query.getFormula() == null || query.getFormula().isBlank()
                ? entitySeries(resolved, perEntity, periods)
                : formulaSeries(resolved, perEntity, periods);
        log.info("Trends evaluated: team={}, entities={}, periods={}, series={}, elapsedMs={}",
                query.getTeamId(), resolved.getEntities().size(), periods.size(), series.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return series;
    }

    /** Breakdown değeri → periyot değerleri. Breakdown yoksa tek anahtar FunnelTally.NO_BREAKDOWN. */
    private Map<List<String>, double[]> entityValues(ResolvedQuery query, InsightEntity entity, List<Period> periods,
                                                     PropertyLookup lookup, QueryContext context) {
        MathType math = entity.getMath() != null ? entity.getMath() : MathType.TOTAL;
        Instant fetchFrom = math.isActiveUsers()
                ? timeBucketer.activeWindowStart(periods.get(0), math, query.getQuery().getDisplay(), query.getTo())
                : query.getFrom().toInstant();
        EventQuery eventQuery = planner.plan(query, List.of(entity), fetchFrom, query.getTo().toInstant(), false);
        AggregationTarget aggregation = query.aggregation();

        Map<List<String>, List<TrendsAggregator.Hit>> buckets = new LinkedHashMap<>();
        try (Stream<RawEvent> events = eventSource.query(eventQuery)) {
            events.forEach(event -> {
                String actorId = aggregation.actorKey(event);
                if (actorId == null || event.getTimestamp() == null) {
                    return;
                }
                try {
                    if (entityMatcher.matches(event, entity, query, lookup)) {
                        TrendsAggregator.Hit hit = new TrendsAggregator.Hit(event.getTimestamp(), actorId, event);
                        for (List<String> bucket : bucketsOf(event, query, lookup)) {
                            buckets.computeIfAbsent(bucket, key -> new ArrayList<>()).add(hit);
                        }
                    }
                } catch (IllegalArgumentException | ClassCastException e) {
                    context.recordSkippedActor();
                    log.warn("Skipping event {} of actor {}: {}", event.getUuid(), actorId, e.getMessage());
                }
            });
        }
        context.checkCancelled();
        log.debug("Trend entity {} matched {} buckets", entity.displayName(), buckets.size());

        Map<List<String>, double[]> values = new LinkedHashMap<>();
        if (!query.hasBreakdown()) {
            List<TrendsAggregator.Hit> hits = buckets.getOrDefault(FunnelTally.NO_BREAKDOWN, new ArrayList<>());
            hits.sort(Comparator.comparing(TrendsAggregator.Hit::getTimestamp));
            values.put(FunnelTally.NO_BREAKDOWN, aggregator.compute(entity, hits, periods, query));
            return values;
        }
        fold(buckets, query).forEach((bucket, hits) -> {
            hits.sort(Comparator.comparing(TrendsAggregator.Hit::getTimestamp));
            values.put(bucket, aggregator.compute(entity, hits, periods, query));
        });
        return values;
    }

    private List<List<String>> bucketsOf(RawEvent event, ResolvedQuery query, PropertyLookup lookup) {
        if (!query.hasBreakdown()) {
            return List.of(FunnelTally.NO_BREAKDOWN);
        }
        Breakdown breakdown = query.breakdown();
        if (breakdown.isCohort()) {
            return attributor.cohortBuckets(event.getPersonId(), breakdown, lookup);
        }
        return List.of(attributor.valueOf(event, breakdown, lookup));
    }

    /** Limit aşılırsa en çok farklı actor'e sahip değerler kalır, diğer event'ler "Other" olarak yeniden etiketlenir. */
    private Map<List<String>, List<TrendsAggregator.Hit>> fold(Map<List<String>, List<TrendsAggregator.Hit>> buckets,
                                                              ResolvedQuery query) {
        Breakdown breakdown = query.breakdown();
        if (breakdown.isCohort() || breakdown.getLimit() == null) {
            return buckets;
        }
        Map<List<String>, Long> actorCounts = new LinkedHashMap<>();
        buckets.forEach((value, hits) -> {
            Set<String> actors = new HashSet<>();
            hits.forEach(hit -> actors.add(hit.getActorId()));
            actorCounts.put(value, (long) actors.size());
        });
        Map<List<String>, List<String>> mapping = attributor.foldOther(actorCounts, breakdown.getLimit(),
                breakdown.getKeys().size());
        Map<List<String>, List<TrendsAggregator.Hit>> folded = new LinkedHashMap<>();
        buckets.forEach((value, hits) ->
                folded.computeIfAbsent(mapping.get(value), key -> new ArrayList<>()).addAll(hits));
        return folded;
    }

    private List<TrendSeries> entitySeries(ResolvedQuery query, List<Map<List<String>, double[]>> perEntity,
                                           List<Period> periods) {
        List<TrendSeries> series = new ArrayList<>();
        for (IndexedEntity indexed : query.getEntities()) {
            InsightEntity entity = indexed.getEntity();
            List<Map.Entry<List<String>, double[]>> entries = new ArrayList<>(perEntity.get(indexed.getIndex()).entrySet());
            entries.sort(BY_TOTAL_DESC);
            for (Map.Entry<List<String>, double[]> entry : entries) {
                series.add(build(query, periods, entry.getValue(), entry.getKey())
                        .label(entity.displayName())
                        .entityIndex(indexed.getIndex())
                        .entityId(entity.getId())
                        .math(entity.getMath())
                        .build());
            }
        }
        return series;
    }

    /** Breakdown değerleri tüm entity'ler üzerinde outer join edilir; değeri olmayan entity 0 katkı yapar. */
    private List<TrendSeries> formulaSeries(ResolvedQuery query, List<Map<List<String>, double[]>> perEntity,
                                            List<Period> periods) {
        String formula = query.getQuery().getFormula();
        Set<List<String>> keys = new LinkedHashSet<>();
        perEntity.forEach(values -> keys.addAll(values.keySet()));

        Map<List<String>, double[]> combined = new LinkedHashMap<>();
        for (List<String> key : keys) {
            List<double[]> byLetter = new ArrayList<>(perEntity.size());
            perEntity.forEach(values -> byLetter.add(values.get(key)));
            combined.put(key, aggregator.applyFormula(formula, byLetter, periods.size()));
        }
        List<Map.Entry<List<String>, double[]>> entries = new ArrayList<>(combined.entrySet());
        entries.sort(BY_TOTAL_DESC);

        List<TrendSeries> series = new ArrayList<>(entries.size());
        for (Map.Entry<List<String>, double[]> entry : entries) {
            series.add(build(query, periods, entry.getValue(), entry.getKey()).label(formula).build());
        }
        return series;
    }

    private static TrendSeries.TrendSeriesBuilder build(ResolvedQuery query, List<Period> periods, double[] raw,
                                                        List<String> breakdownValue) {
        DisplayMode display = query.getQuery().getDisplay();
        double[] shown = display == DisplayMode.CUMULATIVE ? TrendsAggregator.cumulative(raw) : raw;
        double total = display == DisplayMode.AGGREGATE ? shown[0] : Arrays.stream(raw).sum();
        List<String> labels = new ArrayList<>(periods.size());
        List<String> days = new ArrayList<>(periods.size());
        for (Period period : periods) {
            labels.add(period.getLabel());
            days.add(period.getDay());
        }
        return TrendSeries.builder()
                .breakdownValue(query.hasBreakdown() ? breakdownValue : null)
                .labels(labels)
                .days(days)
                .values(Arrays.stream(shown).boxed().toList())
                .total(total);
    }
}
