package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FunnelResult {

    @JsonProperty("is_breakdown")
    boolean breakdown;

    List<FunnelSeries> series;

    /** Bozuk veri nedeniyle atlanan actor sayısı. */
    @JsonProperty("skipped_actors")
    long skippedActors;

    /** Breakdown'sız funnel için tek serinin step'leri. */
    public List<FunnelStep> steps() {
        return series.isEmpty() ? List.of() : series.get(0).getSteps();
    }
}
