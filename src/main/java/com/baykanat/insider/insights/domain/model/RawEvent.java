package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Event kaynağından okunan tek satır; source null ise events tablosu, değilse warehouse tablo adı. */
@Value
@Builder
public class RawEvent {

    String uuid;
    String event;
    String distinctId;
    String personId;
    Instant timestamp;

    @Builder.Default
    Map<String, Object> properties = Map.of();

    @Builder.Default
    Map<String, Object> personProperties = Map.of();

    @Builder.Default
    Map<String, Object> sessionProperties = Map.of();

    /** group type index → group key. */
    @Builder.Default
    Map<Integer, String> groupKeys = Map.of();

    String source;

    public String sessionId() {
        Object value = properties.get("$session_id");
        return value != null ? value.toString() : null;
    }
}
