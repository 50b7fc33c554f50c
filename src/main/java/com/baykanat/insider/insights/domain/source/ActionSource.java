package com.baykanat.insider.insights.domain.source;

import com.baykanat.insider.insights.domain.model.ActionDefinition;

import java.util.Optional;

public interface ActionSource {

    Optional<ActionDefinition> findAction(long teamId, String actionId);
}
