package com.baykanat.insider.insights.domain.model;

public enum EntityType {
    EVENTS,
    ACTIONS,
    DATA_WAREHOUSE
}
