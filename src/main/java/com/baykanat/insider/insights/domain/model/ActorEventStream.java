package com.baykanat.insider.insights.domain.model;

import lombok.Value;

import java.util.List;

/** Tek actor'ün kronolojik sıralı eşleşmiş event'leri. */
@Value
public class ActorEventStream {
    String actorId;
    String personId;
    List<MatchedEvent> events;
}
