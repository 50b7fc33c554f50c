package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** Kayıtlı action; step'lerden herhangi biri eşleşirse event action'a uyar. */
@Value
@Builder
public class ActionDefinition {

    String id;
    String name;

    @Builder.Default
    List<ActionStep> steps = List.of();

    /** event null ise her event adı kabul edilir. */
    @Value
    @Builder
    @Jacksonized
    public static class ActionStep {
        String event;
        PropertyGroup properties;
    }
}
