package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Funnel step'i veya trend serisi: event adı, action id ya da warehouse tablosu; null id her event'le eşleşir. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InsightEntity {

    String id;

    @Builder.Default
    EntityType type = EntityType.EVENTS;

    String name;

    @JsonProperty("custom_name")
    String customName;

    @Builder.Default
    MathType math = MathType.TOTAL;

    @JsonProperty("math_property")
    String mathProperty;

    @JsonProperty("math_hogql")
    String mathHogql;

    @JsonProperty("math_group_type_index")
    Integer mathGroupTypeIndex;

    PropertyGroup properties;

    public static InsightEntity event(String eventName) {
        return InsightEntity.builder().id(eventName).name(eventName).build();
    }

    /** Çıktıda görünen isim: custom name > name > id > "All events". */
    public String displayName() {
        if (customName != null && !customName.isBlank()) {
            return customName;
        }
        if (name != null && !name.isBlank()) {
            return name;
        }
        return id != null ? id : "All events";
    }

    public boolean isAnyEvent() {
        return id == null && type == EntityType.EVENTS;
    }
}
