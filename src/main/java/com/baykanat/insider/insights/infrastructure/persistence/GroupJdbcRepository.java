package com.baykanat.insider.insights.infrastructure.persistence;

import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/** groups tablosundan group property'leri; JSONB Jackson ile çözülür. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class GroupJdbcRepository implements GroupPropertiesSource {

    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Map<String, Object> groupProperties(long teamId, int groupTypeIndex, String groupKey) {
        List<String> rows = jdbcTemplate.queryForList("""
                        SELECT group_properties
                        FROM groups
                        WHERE team_id = ? AND group_type_index = ? AND group_key = ?
                        """, String.class, teamId, groupTypeIndex, groupKey);
        if (rows.isEmpty() || rows.get(0) == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(rows.get(0), PROPERTIES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed properties of group {}:{}: {}", groupTypeIndex, groupKey, e.getOriginalMessage());
            return Map.of();
        }
    }
}
