package com.baykanat.insider.insights.domain.model;

import java.time.temporal.ChronoUnit;

/** Conversion window birimi; takvim aritmetiği için ChronoUnit karşılığı. */
public enum WindowUnit {
    SECOND(ChronoUnit.SECONDS),
    MINUTE(ChronoUnit.MINUTES),
    HOUR(ChronoUnit.HOURS),
    DAY(ChronoUnit.DAYS),
    WEEK(ChronoUnit.WEEKS),
    MONTH(ChronoUnit.MONTHS);

    private final ChronoUnit chronoUnit;

    WindowUnit(ChronoUnit chronoUnit) {
        this.chronoUnit = chronoUnit;
    }

    public ChronoUnit getChronoUnit() {
        return chronoUnit;
    }
}
