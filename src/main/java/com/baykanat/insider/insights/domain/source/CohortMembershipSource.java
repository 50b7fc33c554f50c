package com.baykanat.insider.insights.domain.source;

import java.util.Optional;
import java.util.Set;

/** Cohort üyeliği; person id kümesi döner. */
public interface CohortMembershipSource {

    Set<String> members(long teamId, String cohortId);

    Optional<String> cohortName(long teamId, String cohortId);
}
