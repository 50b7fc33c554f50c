package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.ActionDefinition;
import com.baykanat.insider.insights.domain.model.EntityType;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.PropertyGroup;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** Bir event'in entity'ye (event, action veya warehouse tablosu) uyup uymadığını belirler. */
@Component
@RequiredArgsConstructor
public class EntityMatcher {

    private final PropertyFilterEvaluator filterEvaluator;

    /** İsim/kaynak kontrolü, ardından entity filtreleri ve sorgunun global filtresi. */
    public boolean matches(RawEvent event, InsightEntity entity, ResolvedQuery query, PropertyLookup lookup) {
        if (!matchesIdentity(event, entity, query, lookup)) {
            return false;
        }
        if (!filterEvaluator.evaluate(entity.getProperties(), event, lookup)) {
            return false;
        }
        return filterEvaluator.evaluate(query.getQuery().getProperties(), event, lookup);
    }

    private boolean matchesIdentity(RawEvent event, InsightEntity entity, ResolvedQuery query, PropertyLookup lookup) {
        EntityType type = entity.getType() != null ? entity.getType() : EntityType.EVENTS;
        return switch (type) {
            case EVENTS -> event.getSource() == null
                    && (entity.getId() == null || entity.getId().equals(event.getEvent()));
            case DATA_WAREHOUSE -> event.getSource() != null && event.getSource().equals(entity.getId());
            case ACTIONS -> event.getSource() == null && matchesAction(event, query.getActions().get(entity.getId()), lookup);
        };
    }

    private boolean matchesAction(RawEvent event, ActionDefinition action, PropertyLookup lookup) {
        if (action == null) {
            return false;
        }
        for (ActionDefinition.ActionStep step : action.getSteps()) {
            boolean nameMatches = step.getEvent() == null || step.getEvent().equals(event.getEvent());
            if (nameMatches && filterEvaluator.evaluate(step.getProperties(), event, lookup)) {
                return true;
            }
        }
        return false;
    }

    /**
     * candidate'in eşleştiği her event'i reference de eşleştiriyorsa true. Aynı entity, filtresiz
     * aynı isimli entity ve filtresiz "any event" superset sayılır.
     */
    public boolean isSuperset(InsightEntity candidate, InsightEntity reference) {
        if (isEqual(candidate, reference)) {
            return true;
        }
        if (!PropertyGroup.isEmpty(candidate.getProperties())) {
            return false;
        }
        if (candidate.isAnyEvent()) {
            return reference.getType() == EntityType.EVENTS || reference.getType() == EntityType.ACTIONS;
        }
        return candidate.getType() == reference.getType() && Objects.equals(candidate.getId(), reference.getId());
    }

    /** Tip, id ve filtreler aynı. */
    public boolean isEqual(InsightEntity left, InsightEntity right) {
        return left.getType() == right.getType()
                && Objects.equals(left.getId(), right.getId())
                && Objects.equals(normalized(left.getProperties()), normalized(right.getProperties()));
    }

    private static PropertyGroup normalized(PropertyGroup group) {
        return PropertyGroup.isEmpty(group) ? null : group;
    }
}
