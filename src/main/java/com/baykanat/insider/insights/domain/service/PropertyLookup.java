package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Sorgu süresince group property ve cohort üyeliği sorgularını memoize eder; worker'lar arasında thread-safe. */
public class PropertyLookup {

    private final long teamId;
    private final CohortMembershipSource cohortSource;
    private final GroupPropertiesSource groupSource;
    private final Map<String, Set<String>> cohortMembers = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> groupProperties = new ConcurrentHashMap<>();

    public PropertyLookup(long teamId, CohortMembershipSource cohortSource, GroupPropertiesSource groupSource) {
        this.teamId = teamId;
        this.cohortSource = cohortSource;
        this.groupSource = groupSource;
    }

    public boolean isCohortMember(String cohortId, String personId) {
        if (personId == null) {
            return false;
        }
        return cohortMembers.computeIfAbsent(cohortId, id -> Set.copyOf(cohortSource.members(teamId, id)))
                .contains(personId);
    }

    public Map<String, Object> groupProperties(int groupTypeIndex, String groupKey) {
        if (groupKey == null) {
            return Map.of();
        }
        String cacheKey = groupTypeIndex + ":" + groupKey;
        return groupProperties.computeIfAbsent(cacheKey,
                key -> Objects.requireNonNullElse(groupSource.groupProperties(teamId, groupTypeIndex, groupKey), Map.of()));
    }

    public String cohortName(String cohortId) {
        return cohortSource.cohortName(teamId, cohortId).orElse(cohortId);
    }

    public long getTeamId() {
        return teamId;
    }
}
