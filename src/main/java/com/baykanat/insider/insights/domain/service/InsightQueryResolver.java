package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.exception.InsufficientDataException;
import com.baykanat.insider.insights.domain.model.ActionDefinition;
import com.baykanat.insider.insights.domain.model.ConversionWindow;
import com.baykanat.insider.insights.domain.model.EntityType;
import com.baykanat.insider.insights.domain.model.ExclusionEntity;
import com.baykanat.insider.insights.domain.model.FunnelDefinition;
import com.baykanat.insider.insights.domain.model.IndexedEntity;
import com.baykanat.insider.insights.domain.model.IndexedExclusion;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.ResolvedQuery;
import com.baykanat.insider.insights.domain.source.ActionSource;
import com.baykanat.insider.insights.domain.source.EarliestTimestampSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Doğrulanmış sorguyu normalize eder: timezone ve tarih aralığı, varsayılan conversion window,
 * indekslenmiş step ve exclusion'lar, action tanımları.
 */
@Component
@RequiredArgsConstructor
public class InsightQueryResolver {

    private final RelativeDateParser dateParser;
    private final EarliestTimestampSource earliestTimestampSource;
    private final ActionSource actionSource;
    private final EntityMatcher entityMatcher;
    private final AppProperties appProperties;

    public ResolvedQuery resolve(InsightQuery query) {
        ZoneId zone = zone(query.getTimezone());
        ZonedDateTime to = query.getDateTo() == null
                ? dateParser.now(zone)
                : dateParser.parse(query.getDateTo(), zone, true);
        ZonedDateTime from = resolveFrom(query, zone);
        if (from.isAfter(to)) {
            throw new InsightValidationException("date_from must not be after date_to");
        }

        List<IndexedEntity> entities = new ArrayList<>(query.getEntities().size());
        for (int i = 0; i < query.getEntities().size(); i++) {
            entities.add(new IndexedEntity(i, query.getEntities().get(i)));
        }
        List<IndexedExclusion> exclusions = new ArrayList<>();
        List<ExclusionEntity> declared = query.getExclusions() == null ? List.of() : query.getExclusions();
        for (int i = 0; i < declared.size(); i++) {
            ExclusionEntity exclusion = declared.get(i);
            exclusions.add(new IndexedExclusion(i, exclusion.getEntity(), exclusion.getFromStep(), exclusion.getToStep()));
        }

        ConversionWindow window = query.getConversionWindow() != null
                ? query.getConversionWindow()
                : ConversionWindow.ofDays(appProperties.getFunnel().getDefaultConversionWindowDays());

        return ResolvedQuery.builder()
                .query(query)
                .from(from)
                .to(to)
                .zone(zone)
                .entities(List.copyOf(entities))
                .exclusions(List.copyOf(exclusions))
                .actions(loadActions(query.getTeamId(), entities, exclusions))
                .conversionWindow(window)
                .build();
    }

    /** Ardışık step'lerde sonraki step öncekinin superset'i ise aynı event iki step'i birden ilerletemez. */
    public FunnelDefinition funnelDefinition(ResolvedQuery query) {
        List<IndexedEntity> steps = query.getEntities();
        boolean[] strictlyAfterPrevious = new boolean[steps.size()];
        for (int i = 1; i < steps.size(); i++) {
            strictlyAfterPrevious[i] = entityMatcher.isSuperset(steps.get(i - 1).getEntity(), steps.get(i).getEntity());
        }
        return FunnelDefinition.builder()
                .stepCount(steps.size())
                .orderType(query.getQuery().getFunnelOrderType())
                .window(query.getConversionWindow())
                .zone(query.getZone())
                .strictlyAfterPrevious(strictlyAfterPrevious)
                .exclusions(query.getExclusions())
                .build();
    }

    private ZonedDateTime resolveFrom(InsightQuery query, ZoneId zone) {
        String dateFrom = query.getDateFrom() != null
                ? query.getDateFrom()
                : appProperties.getFunnel().getDefaultDateFrom();
        if (!RelativeDateParser.ALL_TIME.equalsIgnoreCase(dateFrom.trim())) {
            return dateParser.parse(dateFrom, zone, false);
        }
        Instant earliest = earliestTimestampSource.earliestTimestamp(query.getTeamId())
                .orElseThrow(() -> new InsufficientDataException(
                        "No events have been ingested yet for team " + query.getTeamId()));
        return earliest.atZone(zone).toLocalDate().atStartOfDay(zone);
    }

    private ZoneId zone(String timezone) {
        String id = timezone != null && !timezone.isBlank() ? timezone : appProperties.getTime().getDefaultTimezone();
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new InsightValidationException("Unknown timezone: " + id, e);
        }
    }

    private Map<String, ActionDefinition> loadActions(long teamId, List<IndexedEntity> entities,
                                                      List<IndexedExclusion> exclusions) {
        Map<String, ActionDefinition> actions = new LinkedHashMap<>();
        List<InsightEntity> referenced = new ArrayList<>();
        entities.forEach(entity -> referenced.add(entity.getEntity()));
        exclusions.forEach(exclusion -> referenced.add(exclusion.getEntity()));
        for (InsightEntity entity : referenced) {
            if (entity.getType() != EntityType.ACTIONS || actions.containsKey(entity.getId())) {
                continue;
            }
            ActionDefinition action = actionSource.findAction(teamId, entity.getId())
                    .orElseThrow(() -> new InsightValidationException("Unknown action: " + entity.getId()));
            actions.put(entity.getId(), action);
        }
        return Map.copyOf(actions);
    }
}
