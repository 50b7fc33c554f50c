package com.baykanat.insider.insights.infrastructure.persistence;

import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** cohort_people ve cohorts tablolarından statik cohort üyeliği. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CohortJdbcRepository implements CohortMembershipSource {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Set<String> members(long teamId, String cohortId) {
        List<String> members = jdbcTemplate.queryForList(
                "SELECT person_id FROM cohort_people WHERE team_id = ? AND cohort_id = ?",
                String.class, teamId, cohortId);
        log.debug("Loaded {} members of cohort {} for team={}", members.size(), cohortId, teamId);
        return new HashSet<>(members);
    }

    @Override
    public Optional<String> cohortName(long teamId, String cohortId) {
        return jdbcTemplate.queryForList(
                        "SELECT name FROM cohorts WHERE team_id = ? AND id = ?", String.class, teamId, cohortId)
                .stream()
                .findFirst();
    }
}
