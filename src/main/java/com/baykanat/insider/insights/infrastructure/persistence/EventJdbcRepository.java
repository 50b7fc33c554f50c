package com.baykanat.insider.insights.infrastructure.persistence;

import com.baykanat.insider.insights.domain.exception.ConcurrencyLimitExceededException;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.source.EarliestTimestampSource;
import com.baykanat.insider.insights.domain.source.EventQuery;
import com.baykanat.insider.insights.domain.source.EventSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * events tablosundan actor ve zamana göre sıralı event okur. Session property'leri sessions tablosundan join edilir,
 * JSONB kolonları Jackson ile çözülür. Sampling actor id hash'i üzerinden yapılır.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventJdbcRepository implements EventSource, EarliestTimestampSource {

    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<Integer, String>> GROUP_KEYS_TYPE = new TypeReference<>() {
    };
    private static final int SAMPLING_BUCKETS = 10_000;
    private static final int RETRY_AFTER_SECONDS = 5;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /** Dönen stream açık bir bağlantı tutar; çağıran kapatmalıdır. */
    @Override
    @Bulkhead(name = "eventSource", fallbackMethod = "rejectQuery")
    @CircuitBreaker(name = "eventSource", fallbackMethod = "rejectQuery")
    public Stream<RawEvent> query(EventQuery query) {
        StringBuilder sql = new StringBuilder("""
                SELECT e.uuid, e.event, e.distinct_id, e.person_id, e.timestamp, e.properties,
                       e.person_properties, e.group_keys, e.source, s.properties AS session_properties
                FROM events e
                LEFT JOIN sessions s ON s.team_id = e.team_id AND s.session_id = e.session_id
                WHERE e.team_id = ?
                  AND e.timestamp >= ?
                  AND e.timestamp <= ?
                """);

        List<Object> params = new ArrayList<>();
        params.add(query.getTeamId());
        params.add(Timestamp.from(query.getFrom()));
        params.add(Timestamp.from(query.getTo()));

        List<String> sources = new ArrayList<>();
        if (query.isIncludeEvents()) {
            if (query.allEvents()) {
                sources.add("e.source IS NULL");
            } else {
                sources.add("(e.source IS NULL AND e.event IN (" + placeholders(query.getEventNames()) + "))");
                params.addAll(query.getEventNames());
            }
        }
        if (!query.getWarehouseTables().isEmpty()) {
            sources.add("e.source IN (" + placeholders(query.getWarehouseTables()) + ")");
            params.addAll(query.getWarehouseTables());
        }
        if (sources.isEmpty()) {
            return Stream.empty();
        }
        sql.append(" AND (").append(String.join(" OR ", sources)).append(")");

        if (query.getSamplingFactor() < 1.0) {
            sql.append(" AND abs(hashtext(coalesce(e.person_id, e.distinct_id))) % ").append(SAMPLING_BUCKETS).append(" < ?");
            params.add(Math.round(query.getSamplingFactor() * SAMPLING_BUCKETS));
        }
        sql.append(" ORDER BY coalesce(e.person_id, e.distinct_id), e.timestamp");

        log.debug("Streaming events: team={}, from={}, to={}, events={}, tables={}, sampling={}",
                query.getTeamId(), query.getFrom(), query.getTo(), query.getEventNames(),
                query.getWarehouseTables(), query.getSamplingFactor());
        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.queryForStream(sqlStr, (rs, rowNum) -> toRawEvent(rs), params.toArray());
    }

    @Override
    public Optional<Instant> earliestTimestamp(long teamId) {
        Timestamp earliest = jdbcTemplate.queryForObject(
                "SELECT MIN(timestamp) FROM events WHERE team_id = ?", Timestamp.class, teamId);
        return Optional.ofNullable(earliest).map(Timestamp::toInstant);
    }

    /** Bulkhead dolu; GlobalExceptionHandler 503 + Retry-After döner. */
    @SuppressWarnings("unused")
    private Stream<RawEvent> rejectQuery(EventQuery query, BulkheadFullException ex) {
        log.warn("Event source bulkhead is full, rejecting query for team={}", query.getTeamId());
        throw new ConcurrencyLimitExceededException(
                "Too many concurrent insight queries. Please retry shortly.", RETRY_AFTER_SECONDS);
    }

    /** Circuit breaker açık; veritabanı toparlanana kadar sorgular reddedilir. */
    @SuppressWarnings("unused")
    private Stream<RawEvent> rejectQuery(EventQuery query, CallNotPermittedException ex) {
        log.error("Event source circuit breaker is OPEN, rejecting query for team={}", query.getTeamId());
        throw new ConcurrencyLimitExceededException(
                "Event storage is temporarily unavailable. Circuit breaker is open.", RETRY_AFTER_SECONDS * 6);
    }

    private RawEvent toRawEvent(ResultSet rs) throws SQLException {
        String uuid = rs.getString("uuid");
        Timestamp timestamp = rs.getTimestamp("timestamp");
        return RawEvent.builder()
                .uuid(uuid)
                .event(rs.getString("event"))
                .distinctId(rs.getString("distinct_id"))
                .personId(rs.getString("person_id"))
                .timestamp(timestamp != null ? timestamp.toInstant() : null)
                .properties(readJson(rs.getString("properties"), PROPERTIES_TYPE, uuid))
                .personProperties(readJson(rs.getString("person_properties"), PROPERTIES_TYPE, uuid))
                .sessionProperties(readJson(rs.getString("session_properties"), PROPERTIES_TYPE, uuid))
                .groupKeys(readJson(rs.getString("group_keys"), GROUP_KEYS_TYPE, uuid))
                .source(rs.getString("source"))
                .build();
    }

    /** Bozuk JSONB yalnızca o satırın property'lerini boşaltır; sorgu devam eder. */
    private <K, V> Map<K, V> readJson(String json, TypeReference<Map<K, V>> type, String uuid) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<K, V> value = objectMapper.readValue(json, type);
            return value != null ? value : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed JSON column on event {}: {}", uuid, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private static String placeholders(Collection<?> values) {
        return String.join(", ", Collections.nCopies(values.size(), "?"));
    }
}
