package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.ZoneId;

/** Funnel conversion window; takvim aritmetiği sorgunun timezone'unda yapılır (ay ve DST doğru). */
@Value
@Builder
@Jacksonized
public class ConversionWindow {

    int value;
    @Builder.Default
    WindowUnit unit = WindowUnit.DAY;

    public static ConversionWindow ofDays(int days) {
        return ConversionWindow.builder().value(days).unit(WindowUnit.DAY).build();
    }

    /** start + window; bu anı aşan event'ler run'a dahil olamaz (sınır dahil). */
    public Instant end(Instant start, ZoneId zone) {
        return start.atZone(zone).plus(value, unit.getChronoUnit()).toInstant();
    }

    public boolean contains(Instant start, Instant candidate, ZoneId zone) {
        return !candidate.isAfter(end(start, zone));
    }
}
