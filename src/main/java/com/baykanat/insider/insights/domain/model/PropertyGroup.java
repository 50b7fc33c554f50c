package com.baykanat.insider.insights.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * AND/OR filtre ağacı düğümü. Bir seviyede ya leaf filtreler ya da alt gruplar bulunur;
 * ikisinin birlikte dolu olması validasyonda MalformedFilterException'dır.
 */
@Value
@Builder
@Jacksonized
public class PropertyGroup {

    @Builder.Default
    FilterLogic operator = FilterLogic.AND;

    @Builder.Default
    List<PropertyFilter> properties = List.of();

    @Builder.Default
    List<PropertyGroup> groups = List.of();

    public static PropertyGroup and(PropertyFilter... filters) {
        return PropertyGroup.builder().operator(FilterLogic.AND).properties(List.of(filters)).build();
    }

    public static PropertyGroup or(PropertyFilter... filters) {
        return PropertyGroup.builder().operator(FilterLogic.OR).properties(List.of(filters)).build();
    }

    public boolean isEmpty() {
        return (properties == null || properties.isEmpty()) && (groups == null || groups.isEmpty());
    }

    public static boolean isEmpty(PropertyGroup group) {
        return group == null || group.isEmpty();
    }
}
