package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.DisplayMode;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.MathType;
import com.baykanat.insider.insights.domain.model.Period;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.model.Statistic;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Eşleşmiş event'lerden periyot başına trend değerlerini hesaplar; formula ve cumulative dönüşümleri burada. */
@Component
@RequiredArgsConstructor
public class TrendsAggregator {

    private final ExpressionEvaluator expressionEvaluator;
    private final TimeBucketer timeBucketer;

    /** Entity'ye uyan tek event ve actor anahtarı. */
    @Value
    public static class Hit {
        Instant timestamp;
        String actorId;
        RawEvent raw;
    }

    /** hits kronolojik sıralı olmalı. Sonuç sampling düzeltmesi uygulanmış ham periyot değerleridir. */
    public double[] compute(InsightEntity entity, List<Hit> hits, List<Period> periods, ResolvedQuery query) {
        MathType math = entity.getMath() != null ? entity.getMath() : MathType.TOTAL;
        double[] values = new double[periods.size()];
        if (math.isActiveUsers()) {
            DisplayMode display = query.getQuery().getDisplay();
            for (int i = 0; i < periods.size(); i++) {
                Period period = periods.get(i);
                Instant windowStart = timeBucketer.activeWindowStart(period, math, display, query.getTo());
                Instant windowEnd = display.isTimeSeries()
                        ? period.upperBound()
                        : Period.exclusiveAfter(query.getTo().toInstant());
                values[i] = distinctActors(hits, windowStart, windowEnd);
            }
        } else {
            List<List<Hit>> perPeriod = byPeriod(hits, periods);
            for (int i = 0; i < periods.size(); i++) {
                values[i] = value(math, entity, perPeriod.get(i));
            }
        }
        if (math.isSamplingCorrected()) {
            double samplingFactor = query.samplingFactor();
            for (int i = 0; i < values.length; i++) {
                values[i] = SamplingCorrection.correct(values[i], samplingFactor);
            }
        }
        return values;
    }

    /**
     * A..Z harfleri entity serilerine bağlanır; eksik seri (breakdown outer join) 0 sayılır.
     * NaN, sonsuz ve sıfıra bölme sonuçları 0.0 olur.
     */
    public double[] applyFormula(String formula, List<double[]> seriesByLetter, int periodCount) {
        ExpressionEvaluator.ParsedExpression parsed = expressionEvaluator.parse(formula);
        double[] result = new double[periodCount];
        for (int i = 0; i < periodCount; i++) {
            int period = i;
            Function<String, Object> resolver = name -> {
                int index = InsightQueryValidator.formulaIndex(name);
                if (index < 0 || index >= seriesByLetter.size() || seriesByLetter.get(index) == null) {
                    return 0.0;
                }
                return seriesByLetter.get(index)[period];
            };
            double value = parsed.evaluateNumber(resolver);
            result[i] = Double.isFinite(value) ? value : 0.0;
        }
        return result;
    }

    public static double[] cumulative(double[] values) {
        double[] running = new double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            running[i] = sum;
        }
        return running;
    }

    private double value(MathType math, InsightEntity entity, List<Hit> hits) {
        return switch (math.getCategory()) {
            case COUNT -> count(math, entity, hits);
            case PROPERTY -> math.getStatistic().apply(numericValues(hits, entity.getMathProperty()));
            case COUNT_PER_ACTOR -> math.getStatistic().apply(countsPerActor(hits));
            case EXPRESSION -> expression(entity.getMathHogql(), hits);
        };
    }

    private static double count(MathType math, InsightEntity entity, List<Hit> hits) {
        return switch (math) {
            case TOTAL -> hits.size();
            case DAU -> distinct(hits, Hit::getActorId);
            case UNIQUE_SESSION -> distinct(hits, hit -> hit.getRaw().sessionId());
            case UNIQUE_GROUP -> distinct(hits, hit -> hit.getRaw().getGroupKeys().get(entity.getMathGroupTypeIndex()));
            default -> throw new IllegalArgumentException("Unsupported count math: " + math);
        };
    }

    private double expression(String source, List<Hit> hits) {
        ExpressionEvaluator.AggregateExpression aggregate = expressionEvaluator.parseAggregate(source);
        if (aggregate.getArgument() == null) {
            return hits.size();
        }
        List<Double> samples = new ArrayList<>(hits.size());
        for (Hit hit : hits) {
            double value = aggregate.getArgument().evaluateNumber(ExpressionEvaluator.eventResolver(hit.getRaw()));
            if (!Double.isNaN(value)) {
                samples.add(value);
            }
        }
        double[] values = samples.stream().mapToDouble(Double::doubleValue).toArray();
        return switch (aggregate.getFunction()) {
            case "sum" -> Statistic.SUM.apply(values);
            case "avg" -> Statistic.AVG.apply(values);
            case "min" -> Statistic.MIN.apply(values);
            case "max" -> Statistic.MAX.apply(values);
            default -> values.length;
        };
    }

    private static double[] numericValues(List<Hit> hits, String property) {
        List<Double> samples = new ArrayList<>(hits.size());
        for (Hit hit : hits) {
            double value = ExpressionEvaluator.toDouble(hit.getRaw().getProperties().get(property));
            if (Double.isFinite(value)) {
                samples.add(value);
            }
        }
        return samples.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double[] countsPerActor(List<Hit> hits) {
        Map<String, Long> counts = new HashMap<>();
        hits.forEach(hit -> counts.merge(hit.getActorId(), 1L, Long::sum));
        return counts.values().stream().mapToDouble(Long::doubleValue).toArray();
    }

    private static int distinct(List<Hit> hits, Function<Hit, String> key) {
        Set<String> seen = new HashSet<>();
        for (Hit hit : hits) {
            String value = key.apply(hit);
            if (value != null) {
                seen.add(value);
            }
        }
        return seen.size();
    }

    /** [start, end] aralığındaki farklı actor sayısı; başlangıç ikili arama ile bulunur. */
    private static int distinctActors(List<Hit> hits, Instant start, Instant endExclusive) {
        Set<String> actors = new HashSet<>();
        for (int i = lowerBound(hits, start); i < hits.size(); i++) {
            Hit hit = hits.get(i);
            if (!hit.getTimestamp().isBefore(endExclusive)) {
                break;
            }
            actors.add(hit.getActorId());
        }
        return actors.size();
    }

    private static int lowerBound(List<Hit> hits, Instant start) {
        int low = 0;
        int high = hits.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (hits.get(mid).getTimestamp().isBefore(start)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static List<List<Hit>> byPeriod(List<Hit> hits, List<Period> periods) {
        List<List<Hit>> perPeriod = new ArrayList<>(periods.size());
        for (int i = 0; i < periods.size(); i++) {
            perPeriod.add(new ArrayList<>());
        }
        for (Hit hit : hits) {
            int index = TimeBucketer.indexOf(periods, hit.getTimestamp());
            if (index >= 0) {
                perPeriod.get(index).add(hit);
            }
        }
        return perPeriod;
    }
}
