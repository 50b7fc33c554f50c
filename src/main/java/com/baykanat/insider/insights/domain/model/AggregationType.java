package com.baykanat.insider.insights.domain.model;

public enum AggregationType {
    PERSON,
    DISTINCT_ID,
    GROUP
}
