package com.baykanat.insider.insights.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** values[k-1]: tam olarak k periyotta aktif olan actor sayısı. */
@Value
@Builder
public class StickinessSeries {

    String label;

    @JsonProperty("entity_index")
    int entityIndex;

    List<String> labels;
    List<Integer> days;
    List<Long> values;
}
