package com.baykanat.insider.insights.domain.model;

import java.util.Locale;

/** Zaman serisi periyot genişliği. */
public enum Interval {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    /** Stickiness etiketleri için tekil/çoğul isim: "1 day", "3 days". */
    public String unitLabel(long count) {
        String unit = name().toLowerCase(Locale.ROOT);
        return count + " " + (count == 1 ? unit : unit + "s");
    }
}
