package com.baykanat.insider.insights.domain.model;

public enum FilterLogic {
    AND,
    OR
}
