package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.ActionDefinition;
import com.baykanat.insider.insights.domain.model.EntityType;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.source.EventQuery;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/** Entity listesinden EventSource okuma isteğini çıkarır: event adı filtresi, warehouse tabloları, sampling. */
@Component
public class EventQueryPlanner {

    /** keepAllEvents true ise (strict funnel) isim filtresi uygulanmaz. */
    public EventQuery plan(ResolvedQuery query, Collection<InsightEntity> entities, Instant from, Instant to,
                           boolean keepAllEvents) {
        Set<String> eventNames = new LinkedHashSet<>();
        Set<String> warehouseTables = new LinkedHashSet<>();
        boolean includeEvents = keepAllEvents;
        boolean anyEvent = keepAllEvents;

        for (InsightEntity entity : entities) {
            EntityType type = entity.getType() != null ? entity.getType() : EntityType.EVENTS;
            switch (type) {
                case DATA_WAREHOUSE -> warehouseTables.add(entity.getId());
                case EVENTS -> {
                    includeEvents = true;
                    if (entity.getId() == null) {
                        anyEvent = true;
                    } else {
                        eventNames.add(entity.getId());
                    }
                }
                case ACTIONS -> {
                    includeEvents = true;
                    ActionDefinition action = query.getActions().get(entity.getId());
                    if (action != null) {
                        for (ActionDefinition.ActionStep step : action.getSteps()) {
                            if (step.getEvent() == null) {
                                anyEvent = true;
                            } else {
                                eventNames.add(step.getEvent());
                            }
                        }
                    }
                }
            }
        }
        return EventQuery.builder()
                .teamId(query.teamId())
                .from(from)
                .to(to)
                .eventNames(anyEvent ? Set.of() : Set.copyOf(eventNames))
                .warehouseTables(Set.copyOf(warehouseTables))
                .includeEvents(includeEvents)
                .samplingFactor(query.samplingFactor())
                .build();
    }
}
