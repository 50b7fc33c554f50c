package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Tek bir property karşılaştırması; value tekil değer veya liste olabilir. */
@Value
@Builder
@Jacksonized
public class PropertyFilter {

    String key;

    @Builder.Default
    PropertyOperator operator = PropertyOperator.EXACT;

    Object value;

    @Builder.Default
    PropertyScope scope = PropertyScope.EVENT;

    @JsonProperty("group_type_index")
    Integer groupTypeIndex;
}
