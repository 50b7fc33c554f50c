package com.baykanat.insider.insights.domain.model;

import lombok.Value;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Gösterimde [start, end] kapalı aralığı; end bir sonraki periyodun başlangıcından 1 mikrosaniye öncesi.
 * Üyelik testleri [start, upperBound) yarı açık aralığıyla yapılır, son mikrosaniyedeki nanosaniyeler de dahil.
 */
@Value
public class Period {

    ZonedDateTime start;
    ZonedDateTime end;
    String label;
    String day;

    /** Hariç üst sınır: bir sonraki periyodun başlangıcı. */
    public Instant upperBound() {
        return exclusiveAfter(end.toInstant());
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start.toInstant()) && instant.isBefore(upperBound());
    }

    /** Mikrosaniye hassasiyetli kapalı bir sonu hariç sınıra çevirir. */
    public static Instant exclusiveAfter(Instant closedEnd) {
        return closedEnd.truncatedTo(ChronoUnit.MICROS).plus(1, ChronoUnit.MICROS);
    }
}
