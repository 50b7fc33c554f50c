package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.CredibleInterval;
import com.baykanat.insider.insights.domain.model.ExperimentMetricType;
import com.baykanat.insider.insights.domain.model.ExperimentQuery;
import com.baykanat.insider.insights.domain.model.ExperimentResult;
import com.baykanat.insider.insights.domain.model.SignificanceCode;
import com.baykanat.insider.insights.domain.model.VariantCounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/** Variant sayılarından kazanma olasılıkları, beklenen kayıplar, credible interval'lar ve karar kodunu üretir. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExperimentService {

    private final ExperimentStatistics statistics;
    private final InsightQueryValidator validator;

    public ExperimentResult evaluateExperiment(ExperimentQuery query) {
        long started = System.nanoTime();
        List<VariantCounts> variants = query.getVariants();
        validator.validateVariants(query.getControlKey(), variants.stream().map(VariantCounts::getKey).toList());
        boolean trend = query.getMetricType() == ExperimentMetricType.TREND;

        double[] probabilities = trend
                ? statistics.calculateTrendProbabilities(variants)
                : statistics.calculateProbabilities(variants);
        List<CredibleInterval> intervals = trend
                ? statistics.calculateTrendCredibleIntervals(variants)
                : statistics.calculateCredibleIntervals(variants);

        Map<String, Double> probabilityByKey = new LinkedHashMap<>();
        Map<String, Double> lossByKey = new LinkedHashMap<>();
        Map<String, CredibleInterval> intervalByKey = new LinkedHashMap<>();
        int leading = 0;
        for (int i = 0; i < variants.size(); i++) {
            VariantCounts variant = variants.get(i);
            List<VariantCounts> others = new ArrayList<>(variants);
            others.remove(i);
            double loss = trend
                    ? statistics.calculateTrendExpectedLoss(variant, others)
                    : statistics.calculateExpectedLoss(variant, others);
            probabilityByKey.put(variant.getKey(), probabilities[i]);
            lossByKey.put(variant.getKey(), loss);
            intervalByKey.put(variant.getKey(), intervals.get(i));
            if (probabilities[i] > probabilities[leading]) {
                leading = i;
            }
        }

        String leadingKey = variants.get(leading).getKey();
        double leadingLoss = lossByKey.get(leadingKey);
        SignificanceCode code = statistics.significance(query.getMetricType(), variants, probabilities, leadingLoss);
        log.info("Experiment evaluated: type={}, variants={}, leading={}, code={}, elapsedMs={}",
                query.getMetricType(), variants.size(), leadingKey, code,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

        return ExperimentResult.builder()
                .metricType(query.getMetricType())
                .probabilities(probabilityByKey)
                .expectedLosses(lossByKey)
                .credibleIntervals(intervalByKey)
                .leadingVariant(leadingKey)
                .expectedLoss(leadingLoss)
                .significanceCode(code)
                .significant(code == SignificanceCode.SIGNIFICANT)
                .exact(!trend && statistics.isExact(variants))
                .build();
    }
}
