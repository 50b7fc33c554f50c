package com.baykanat.insider.insights.domain.model;

/** FUNNEL: success/failure sayıları (Beta posterior); TREND: count/exposure (Gamma posterior). */
public enum ExperimentMetricType {
    FUNNEL,
    TREND
}
