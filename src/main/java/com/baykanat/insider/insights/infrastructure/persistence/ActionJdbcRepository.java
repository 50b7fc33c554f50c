package com.baykanat.insider.insights.infrastructure.persistence;

import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.model.ActionDefinition;
import com.baykanat.insider.insights.domain.source.ActionSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/** actions tablosu; steps kolonu ActionStep listesi olarak JSONB tutulur. */
@Repository
@RequiredArgsConstructor
public class ActionJdbcRepository implements ActionSource {

    private static final TypeReference<List<ActionDefinition.ActionStep>> STEPS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<ActionDefinition> findAction(long teamId, String actionId) {
        return jdbcTemplate.query(
                        "SELECT id, name, steps FROM actions WHERE team_id = ? AND id = ?",
                        (rs, rowNum) -> ActionDefinition.builder()
                                .id(rs.getString("id"))
                                .name(rs.getString("name"))
                                .steps(readSteps(rs.getString("steps"), actionId))
                                .build(),
                        teamId, actionId)
                .stream()
                .findFirst();
    }

    /** Bozuk action tanımı sorgunun tamamını geçersiz kılar. */
    private List<ActionDefinition.ActionStep> readSteps(String json, String actionId) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STEPS_TYPE);
        } catch (JsonProcessingException e) {
            throw new InsightValidationException("Action " + actionId + " has a malformed step definition", e);
        }
    }
}
