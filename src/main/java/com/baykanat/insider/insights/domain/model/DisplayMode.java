package com.baykanat.insider.insights.domain.model;

/** Trend çıktısının periyot serisi mi yoksa tek bir aggregate değer mi olacağını belirler. */
public enum DisplayMode {
    TIME_SERIES,
    CUMULATIVE,
    AGGREGATE;

    public boolean isTimeSeries() {
        return this != AGGREGATE;
    }
}
