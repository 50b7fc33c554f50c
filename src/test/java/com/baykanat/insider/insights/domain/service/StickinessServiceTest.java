package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.AggregationTarget;
import com.baykanat.insider.insights.domain.model.AggregationType;
import com.baykanat.insider.insights.domain.model.Interval;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.StickinessSeries;
import com.baykanat.insider.insights.support.InsightEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.baykanat.insider.insights.support.TestEvents.event;
import static com.baykanat.insider.insights.support.TestEvents.query;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Engine-level tests for StickinessService.
 *
 * <p>values[k-1] must hold the number of actors active in exactly k periods, so every actor with at
 * least one matching event is counted exactly once.
 */
class StickinessServiceTest {

    private InsightEngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new InsightEngineFixture();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Daily stickiness - actors are counted by the number of distinct active days")
    void dailyStickiness() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-01T09:00:00Z"),
                event("bob", "$pageview", "2024-01-01T09:00:00Z"),
                event("bob", "$pageview", "2024-01-02T09:00:00Z"),
                event("bob", "$pageview", "2024-01-02T18:00:00Z"),
                event("carol", "$pageview", "2024-01-01T09:00:00Z"),
                event("carol", "$pageview", "2024-01-03T09:00:00Z"),
                event("carol", "$pageview", "2024-01-05T09:00:00Z"),
                event("dave", "signup", "2024-01-04T09:00:00Z"));

        List<StickinessSeries> result = engine.stickiness().evaluateStickiness(query("$pageview")
                .dateFrom("2024-01-01").dateTo("2024-01-08").build());

        assertThat(result).hasSize(1);
        StickinessSeries series = result.get(0);
        assertThat(series.getLabel()).isEqualTo("$pageview");
        assertThat(series.getValues()).containsExactly(1L, 1L, 1L, 0L, 0L, 0L, 0L, 0L);
        assertThat(series.getDays()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(series.getLabels().get(0)).isEqualTo("1 day");
        assertThat(series.getLabels().get(2)).isEqualTo("3 days");
        assertThat(series.getValues().stream().mapToLong(Long::longValue).sum()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Weekly stickiness - weeks start on Sunday")
    void weeklyStickiness() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-01T09:00:00Z"),
                event("alice", "$pageview", "2024-01-06T09:00:00Z"),
                event("alice", "$pageview", "2024-01-08T09:00:00Z"),
                event("bob", "$pageview", "2024-01-07T09:00:00Z"));

        StickinessSeries series = engine.stickiness().evaluateStickiness(query("$pageview")
                .interval(Interval.WEEK)
                .dateFrom("2024-01-01").dateTo("2024-01-14").build()).get(0);

        // Dec 31 - Jan 6, Jan 7 - Jan 13, Jan 14 - Jan 20
        assertThat(series.getValues()).containsExactly(1L, 1L, 0L);
        assertThat(series.getLabels()).containsExactly("1 week", "2 weeks", "3 weeks");
    }

    @Test
    @DisplayName("One series per entity, in entity order")
    void seriesPerEntity() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-01T09:00:00Z"),
                event("alice", "signup", "2024-01-01T09:00:00Z"),
                event("alice", "signup", "2024-01-02T09:00:00Z"));

        List<StickinessSeries> result = engine.stickiness().evaluateStickiness(query("$pageview", "signup")
                .dateFrom("2024-01-01").dateTo("2024-01-03").build());

        assertThat(result).extracting(StickinessSeries::getEntityIndex).containsExactly(0, 1);
        assertThat(result.get(0).getValues()).containsExactly(1L, 0L, 0L);
        assertThat(result.get(1).getValues()).containsExactly(0L, 1L, 0L);
    }

    @Test
    @DisplayName("Group aggregation - actors are group keys and events without one are skipped")
    void groupAggregation() {
        RawEvent withCompany = RawEvent.builder()
                .uuid("e-1")
                .event("$pageview")
                .distinctId("alice")
                .personId("alice")
                .timestamp(Instant.parse("2024-01-01T09:00:00Z"))
                .groupKeys(Map.of(0, "acme"))
                .build();
        RawEvent sameCompanyNextDay = RawEvent.builder()
                .uuid("e-2")
                .event("$pageview")
                .distinctId("bob")
                .personId("bob")
                .timestamp(Instant.parse("2024-01-02T09:00:00Z"))
                .groupKeys(Map.of(0, "acme"))
                .build();
        engine.events().add(withCompany, sameCompanyNextDay, event("carol", "$pageview", "2024-01-01T09:00:00Z"));

        StickinessSeries series = engine.stickiness().evaluateStickiness(query("$pageview")
                .aggregation(AggregationTarget.builder().type(AggregationType.GROUP).groupTypeIndex(0).build())
                .dateFrom("2024-01-01").dateTo("2024-01-02").build()).get(0);

        assertThat(series.getValues()).containsExactly(0L, 1L);
    }
}
