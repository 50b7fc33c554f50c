package com.baykanat.insider.insights.domain.model;

/** Funnel'da actor'ün hangi breakdown bucket'ına düşeceğini belirler. */
public enum BreakdownAttribution {
    FIRST_TOUCH,
    LAST_TOUCH,
    STEP,
    ALL_EVENTS
}
