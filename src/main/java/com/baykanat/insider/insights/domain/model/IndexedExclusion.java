package com.baykanat.insider.insights.domain.model;

import lombok.Value;

@Value
public class IndexedExclusion {
    int index;
    InsightEntity entity;
    int fromStep;
    int toStep;
}
