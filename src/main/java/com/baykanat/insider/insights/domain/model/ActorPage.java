package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Actor id'ye göre sıralı sayfa. */
@Value
@Builder
public class ActorPage {

    @JsonProperty("actor_ids")
    List<String> actorIds;

    int offset;
    int limit;
    long total;

    @JsonProperty("has_more")
    boolean hasMore;
}
