package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.ActorEventStream;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.BreakdownAttribution;
import com.baykanat.insider.insights.domain.model.BreakdownType;
import com.baykanat.insider.insights.domain.model.MatchedEvent;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.StepRun;
import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.baykanat.insider.insights.support.TestEvents.TEAM_ID;
import static com.baykanat.insider.insights.support.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BreakdownAttributor.
 *
 * <p>Covers:
 * <ul>
 *   <li>reading single and multi-key breakdown values from events</li>
 *   <li>cohort bucket membership including the "all users" bucket</li>
 *   <li>first touch, last touch and step attribution for a funnel run</li>
 *   <li>folding low-ranked buckets into "Other"</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class BreakdownAttributorTest {

    private static final Instant BASE = Instant.parse("2024-01-10T10:00:00Z");

    @Mock
    private CohortMembershipSource cohortSource;

    @Mock
    private GroupPropertiesSource groupSource;

    private BreakdownAttributor attributor;
    private PropertyLookup lookup;

    @BeforeEach
    void setUp() {
        attributor = new BreakdownAttributor(new PropertyFilterEvaluator(new ExpressionEvaluator()), new AppProperties());
        lookup = new PropertyLookup(TEAM_ID, cohortSource, groupSource);
    }

    private static MatchedEvent stepEvent(long seconds, long stepMask, String... value) {
        return new MatchedEvent(BASE.plusSeconds(seconds), stepMask, 0L, List.of(value), null);
    }

    private static Breakdown breakdown(BreakdownAttribution attribution, Integer attributionStep) {
        return Breakdown.builder()
                .keys(List.of("$browser"))
                .attribution(attribution)
                .attributionStep(attributionStep)
                .build();
    }

    private static StepRun run(MatchedEvent... stepEvents) {
        List<MatchedEvent> events = List.of(stepEvents);
        return new StepRun(events.get(0).getTimestamp(), events.size() - 1,
                events.stream().map(MatchedEvent::getTimestamp).toList(), events);
    }

    @Test
    @DisplayName("Multi-key breakdown - components formatted, missing keys become empty strings")
    void multiKeyValue() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("$browser", "Chrome");
        properties.put("seats", 5.0);
        RawEvent pageview = event("alice", "$pageview", "2024-01-10T10:00:00Z", properties);
        Breakdown breakdown = Breakdown.builder().keys(List.of("$browser", "seats", "plan")).build();

        assertThat(attributor.valueOf(pageview, breakdown, lookup)).containsExactly("Chrome", "5", "");
    }

    @Test
    @DisplayName("Cohort breakdown values never come from event properties")
    void cohortValueRejected() {
        RawEvent pageview = event("alice", "$pageview", "2024-01-10T10:00:00Z");
        Breakdown cohorts = Breakdown.builder().type(BreakdownType.COHORT).keys(List.of("42")).build();

        assertThatThrownBy(() -> attributor.valueOf(pageview, cohorts, lookup))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Cohort buckets - everyone lands in 'all users', members in their cohort")
    void cohortBuckets() {
        when(cohortSource.members(TEAM_ID, "42")).thenReturn(Set.of("alice"));
        when(cohortSource.members(TEAM_ID, "43")).thenReturn(Set.of("bob"));
        Breakdown cohorts = Breakdown.builder().type(BreakdownType.COHORT).keys(List.of("all", "42", "43")).build();

        assertThat(attributor.cohortBuckets("alice", cohorts, lookup))
                .containsExactly(List.of("all users"), List.of("42"));
    }

    @Test
    @DisplayName("First touch - earliest step event with a non-empty value wins")
    void firstTouch() {
        MatchedEvent noise = stepEvent(0, 0L, "Safari");
        MatchedEvent anchor = stepEvent(10, 1L, "");
        MatchedEvent second = stepEvent(20, 2L, "Chrome");
        ActorEventStream stream = new ActorEventStream("alice", "alice", List.of(noise, anchor, second));

        Optional<List<String>> value = attributor.attribute(stream, run(anchor, second),
                breakdown(BreakdownAttribution.FIRST_TOUCH, null));

        assertThat(value).contains(List.of("Chrome"));
    }

    @Test
    @DisplayName("Last touch - latest step event up to the deepest reached step wins")
    void lastTouch() {
        MatchedEvent anchor = stepEvent(0, 1L, "Chrome");
        MatchedEvent second = stepEvent(20, 2L, "Firefox");
        MatchedEvent later = stepEvent(30, 1L, "Safari");
        ActorEventStream stream = new ActorEventStream("alice", "alice", List.of(anchor, second, later));

        Optional<List<String>> value = attributor.attribute(stream, run(anchor, second),
                breakdown(BreakdownAttribution.LAST_TOUCH, null));

        assertThat(value).contains(List.of("Firefox"));
    }

    @Test
    @DisplayName("Actors without any value fall into the empty bucket")
    void emptyBucket() {
        MatchedEvent anchor = stepEvent(0, 1L, "");
        ActorEventStream stream = new ActorEventStream("alice", "alice", List.of(anchor));

        Optional<List<String>> value = attributor.attribute(stream, run(anchor),
                breakdown(BreakdownAttribution.FIRST_TOUCH, null));

        assertThat(value).contains(List.of(""));
    }

    @Test
    @DisplayName("Step attribution - value of the event that satisfied the step, absent if never reached")
    void stepAttribution() {
        MatchedEvent anchor = stepEvent(0, 1L, "Chrome");
        MatchedEvent second = stepEvent(20, 2L, "Firefox");
        ActorEventStream stream = new ActorEventStream("alice", "alice", List.of(anchor, second));
        StepRun reachedSecond = run(anchor, second);

        assertThat(attributor.attribute(stream, reachedSecond, breakdown(BreakdownAttribution.STEP, 1)))
                .contains(List.of("Firefox"));
        assertThat(attributor.attribute(stream, reachedSecond, breakdown(BreakdownAttribution.STEP, 2)))
                .isEmpty();
    }

    @Test
    @DisplayName("Step attribution - unordered runs read the event of the declared step, not the n-th satisfied one")
    void unorderedStepAttribution() {
        MatchedEvent checkout = stepEvent(0, 4L, "Safari");
        MatchedEvent landing = stepEvent(10, 1L, "Chrome");
        MatchedEvent signup = stepEvent(20, 2L, "Firefox");
        ActorEventStream stream = new ActorEventStream("alice", "alice", List.of(checkout, landing, signup));
        List<MatchedEvent> satisfied = List.of(checkout, landing, signup);
        StepRun unordered = new StepRun(checkout.getTimestamp(), 2,
                satisfied.stream().map(MatchedEvent::getTimestamp).toList(), satisfied, List.of(2, 0, 1));

        assertThat(attributor.attribute(stream, unordered, breakdown(BreakdownAttribution.STEP, 0)))
                .contains(List.of("Chrome"));
        assertThat(attributor.attribute(stream, unordered, breakdown(BreakdownAttribution.STEP, 1)))
                .contains(List.of("Firefox"));
        assertThat(attributor.attribute(stream, unordered, breakdown(BreakdownAttribution.STEP, 2)))
                .contains(List.of("Safari"));
    }

    @Test
    @DisplayName("All-events attribution is handled by partitioning, not per run")
    void allEventsNotAttributed() {
        MatchedEvent anchor = stepEvent(0, 1L, "Chrome");
        ActorEventStream stream = new ActorEventStream("alice", "alice", List.of(anchor));

        assertThatThrownBy(() -> attributor.attribute(stream, run(anchor),
                breakdown(BreakdownAttribution.ALL_EVENTS, null)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Fold - top buckets by count kept, ties broken by value, rest mapped to Other")
    void foldOther() {
        Map<List<String>, Long> counts = new LinkedHashMap<>();
        counts.put(List.of("a"), 3L);
        counts.put(List.of("b"), 5L);
        counts.put(List.of("c"), 3L);
        counts.put(List.of("d"), 1L);

        Map<List<String>, List<String>> mapping = attributor.foldOther(counts, 2, 1);

        assertThat(mapping.get(List.of("b"))).containsExactly("b");
        assertThat(mapping.get(List.of("a"))).containsExactly("a");
        assertThat(mapping.get(List.of("c"))).containsExactly("Other");
        assertThat(mapping.get(List.of("d"))).containsExactly("Other");
    }

    @Test
    @DisplayName("Fold - without a limit, or within it, every bucket maps to itself")
    void foldIdentity() {
        Map<List<String>, Long> counts = Map.of(List.of("a", "x"), 1L, List.of("b", "y"), 2L);

        assertThat(attributor.foldOther(counts, null, 2)).containsEntry(List.of("a", "x"), List.of("a", "x"));
        assertThat(attributor.foldOther(counts, 2, 2)).containsEntry(List.of("b", "y"), List.of("b", "y"));
        assertThat(attributor.foldOther(counts, 1, 2)).containsEntry(List.of("a", "x"), List.of("Other", "Other"));
    }

    @Test
    @DisplayName("Format - whole doubles lose their fraction, null and NaN are empty")
    void format() {
        assertThat(BreakdownAttributor.format(5.0)).isEqualTo("5");
        assertThat(BreakdownAttributor.format(2.50)).isEqualTo("2.5");
        assertThat(BreakdownAttributor.format(Double.NaN)).isEmpty();
        assertThat(BreakdownAttributor.format(null)).isEmpty();
        assertThat(BreakdownAttributor.format(7)).isEqualTo("7");
        assertThat(BreakdownAttributor.format(true)).isEqualTo("true");
    }
}
