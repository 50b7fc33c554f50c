package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Sayımın hangi aktör üzerinden yapılacağı: person, distinct id veya group. */
@Value
@Builder
@Jacksonized
public class AggregationTarget {

    public static final AggregationTarget PERSON = AggregationTarget.builder().type(AggregationType.PERSON).build();

    @Builder.Default
    AggregationType type = AggregationType.PERSON;

    @JsonProperty("group_type_index")
    Integer groupTypeIndex;

    /** Event'in actor anahtarı; group aggregation'da event o group tipine bağlı değilse null. */
    public String actorKey(RawEvent event) {
        return switch (type) {
            case PERSON -> event.getPersonId() != null ? event.getPersonId() : event.getDistinctId();
            case DISTINCT_ID -> event.getDistinctId();
            case GROUP -> event.getGroupKeys().get(groupTypeIndex);
        };
    }
}
