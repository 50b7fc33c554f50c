package com.baykanat.insider.insights.domain.model;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/** Sayısal değer listesi üzerinde özet istatistik; boş girdi 0 verir. Percentile'lar R-7 (lineer interpolasyon). */
public enum Statistic {
    SUM,
    AVG,
    MIN,
    MAX,
    MEDIAN,
    P75,
    P90,
    P95,
    P99;

    public double apply(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        return switch (this) {
            case SUM -> StatUtils.sum(values);
            case AVG -> StatUtils.mean(values);
            case MIN -> StatUtils.min(values);
            case MAX -> StatUtils.max(values);
            case MEDIAN -> percentile(values, 50);
            case P75 -> percentile(values, 75);
            case P90 -> percentile(values, 90);
            case P95 -> percentile(values, 95);
            case P99 -> percentile(values, 99);
        };
    }

    private static double percentile(double[] values, double quantile) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, quantile);
    }
}
