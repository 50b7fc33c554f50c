package com.baykanat.insider.insights.domain.model;

public enum BreakdownType {
    EVENT,
    PERSON,
    GROUP,
    COHORT,
    HOGQL
}
