package com.baykanat.insider.insights.domain.source;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/** Event kaynağına gönderilen okuma isteği; eventNames boşsa tüm event'ler. */
@Value
@Builder
public class EventQuery {

    long teamId;
    Instant from;
    Instant to;

    @Builder.Default
    Set<String> eventNames = Set.of();

    /** Okunacak warehouse tabloları; boşsa yalnızca events. */
    @Builder.Default
    Set<String> warehouseTables = Set.of();

    /** Events tablosu da okunmalı mı (yalnızca warehouse entity'si olan sorgularda false). */
    @Builder.Default
    boolean includeEvents = true;

    /** (0, 1]; 1.0 örnekleme yok demektir. */
    @Builder.Default
    double samplingFactor = 1.0;

    public boolean allEvents() {
        return eventNames.isEmpty();
    }
}
