package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.model.ActorPage;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.BreakdownAttribution;
import com.baykanat.insider.insights.domain.model.BreakdownType;
import com.baykanat.insider.insights.domain.model.ConversionWindow;
import com.baykanat.insider.insights.domain.model.ExclusionEntity;
import com.baykanat.insider.insights.domain.model.FunnelOrderType;
import com.baykanat.insider.insights.domain.model.FunnelResult;
import com.baykanat.insider.insights.domain.model.FunnelSeries;
import com.baykanat.insider.insights.domain.model.FunnelStep;
import com.baykanat.insider.insights.domain.model.FunnelTrendPoint;
import com.baykanat.insider.insights.domain.model.FunnelTrendsSeries;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.Interval;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.TimeToConvertResult;
import com.baykanat.insider.insights.domain.model.WindowUnit;
import com.baykanat.insider.insights.support.InsightEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.baykanat.insider.insights.support.TestEvents.event;
import static com.baykanat.insider.insights.support.TestEvents.query;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Engine-level tests for FunnelService over an in-memory event source.
 *
 * <p>Covers:
 * <ul>
 *   <li>Ordered, strict and unordered step counting with conversion times</li>
 *   <li>Exclusions discarding the interrupted run</li>
 *   <li>Breakdowns with every attribution rule and the "Other" bucket</li>
 *   <li>Funnel trends, time to convert and actor listing</li>
 *   <li>Monotonicity and sampling properties</li>
 * </ul>
 */
class FunnelServiceTest {

    private InsightEngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new InsightEngineFixture();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private FunnelService service() {
        return engine.funnel();
    }

    private static List<Long> counts(FunnelSeries series) {
        return series.getSteps().stream().map(FunnelStep::getCount).toList();
    }

    private void twoConvertingActors() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z"),
                event("alice", "signup", "2024-01-10T11:00:00Z"),
                event("alice", "purchase", "2024-01-10T12:00:00Z"),
                event("bob", "$pageview", "2024-01-10T10:00:00Z"),
                event("bob", "signup", "2024-01-10T11:00:00Z"));
    }

    @Test
    @DisplayName("Ordered funnel - counts are cumulative and conversion time is averaged per step")
    void orderedFunnelCountsSteps() {
        twoConvertingActors();

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup", "purchase")
                .conversionWindow(ConversionWindow.ofDays(7))
                .build());

        assertThat(result.isBreakdown()).isFalse();
        assertThat(result.getSeries()).hasSize(1);
        List<FunnelStep> steps = result.steps();
        assertThat(steps).extracting(FunnelStep::getCount).containsExactly(2L, 2L, 1L);
        assertThat(steps.get(0).getAverageConversionTime()).isNull();
        assertThat(steps.get(1).getAverageConversionTime()).isEqualTo(3600.0);
        assertThat(steps.get(1).getMedianConversionTime()).isEqualTo(3600.0);
        assertThat(steps.get(2).getAverageConversionTime()).isEqualTo(3600.0);
        assertThat(steps).extracting(FunnelStep::getName).containsExactly("$pageview", "signup", "purchase");
    }

    @Test
    @DisplayName("Ordered funnel - events outside the conversion window do not advance the run")
    void conversionWindowBoundsTheRun() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z"),
                event("alice", "signup", "2024-01-10T10:30:00Z"),
                event("bob", "$pageview", "2024-01-10T10:00:00Z"),
                event("bob", "signup", "2024-01-10T11:00:01Z"));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup")
                .conversionWindow(ConversionWindow.builder().value(1).unit(WindowUnit.HOUR).build())
                .build());

        assertThat(counts(result.getSeries().get(0))).containsExactly(2L, 1L);
    }

    @Test
    @DisplayName("Exclusion between steps discards the whole run")
    void exclusionDiscardsRun() {
        engine.events().add(
                event("carol", "$pageview", "2024-01-10T10:00:00Z"),
                event("carol", "cancel", "2024-01-10T10:00:01Z"),
                event("carol", "signup", "2024-01-10T10:00:30Z"),
                event("dave", "$pageview", "2024-01-10T10:00:00Z"),
                event("dave", "signup", "2024-01-10T10:00:30Z"));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup")
                .exclusions(List.of(ExclusionEntity.builder()
                        .entity(InsightEntity.event("cancel"))
                        .fromStep(0)
                        .toStep(1)
                        .build()))
                .build());

        assertThat(counts(result.getSeries().get(0))).containsExactly(1L, 1L);
    }

    @Test
    @DisplayName("Exclusion only cancels the run it interrupts; a later clean run still counts")
    void exclusionKeepsLaterRun() {
        engine.events().add(
                event("carol", "$pageview", "2024-01-10T10:00:00Z"),
                event("carol", "cancel", "2024-01-10T10:00:01Z"),
                event("carol", "$pageview", "2024-01-11T10:00:00Z"),
                event("carol", "signup", "2024-01-11T10:05:00Z"));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup")
                .exclusions(List.of(ExclusionEntity.builder()
                        .entity(InsightEntity.event("cancel"))
                        .fromStep(0)
                        .toStep(1)
                        .build()))
                .build());

        assertThat(counts(result.getSeries().get(0))).containsExactly(1L, 1L);
        assertThat(result.steps().get(1).getAverageConversionTime()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("Strict funnel - an unrelated event between steps breaks the run")
    void strictFunnelBreaksOnNoise() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z"),
                event("alice", "$autocapture", "2024-01-10T10:01:00Z"),
                event("alice", "signup", "2024-01-10T10:02:00Z"));

        InsightQuery.InsightQueryBuilder builder = query("$pageview", "signup");
        FunnelResult ordered = service().evaluateFunnel(builder.funnelOrderType(FunnelOrderType.ORDERED).build());
        FunnelResult strict = service().evaluateFunnel(builder.funnelOrderType(FunnelOrderType.STRICT).build());

        assertThat(counts(ordered.getSeries().get(0))).containsExactly(1L, 1L);
        assertThat(counts(strict.getSeries().get(0))).containsExactly(1L, 0L);
    }

    @Test
    @DisplayName("Unordered funnel - steps may arrive in any order within the window")
    void unorderedFunnelAcceptsAnyOrder() {
        engine.events().add(
                event("erin", "purchase", "2024-01-10T10:00:00Z"),
                event("erin", "$pageview", "2024-01-10T10:00:01Z"),
                event("erin", "signup", "2024-01-10T10:00:02Z"));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup", "purchase")
                .funnelOrderType(FunnelOrderType.UNORDERED)
                .conversionWindow(ConversionWindow.ofDays(1))
                .build());

        assertThat(counts(result.getSeries().get(0))).containsExactly(1L, 1L, 1L);
    }

    @Test
    @DisplayName("Repeated step event - the same event cannot satisfy two consecutive identical steps")
    void repeatedStepNeedsTwoEvents() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z"),
                event("alice", "$pageview", "2024-01-10T10:05:00Z"),
                event("bob", "$pageview", "2024-01-10T10:00:00Z"));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "$pageview").build());

        assertThat(counts(result.getSeries().get(0))).containsExactly(2L, 1L);
    }

    @ParameterizedTest
    @EnumSource(FunnelOrderType.class)
    @DisplayName("Step counts never increase along the funnel")
    void stepCountsAreMonotonic(FunnelOrderType orderType) {
        Random random = new Random(7);
        String[] names = {"$pageview", "signup", "purchase", "$autocapture"};
        List<RawEvent> events = new ArrayList<>();
        for (int actor = 0; actor < 40; actor++) {
            Instant cursor = Instant.parse("2024-01-05T00:00:00Z").plusSeconds(random.nextInt(86_400));
            int eventCount = 1 + random.nextInt(8);
            for (int i = 0; i < eventCount; i++) {
                cursor = cursor.plusSeconds(60L + random.nextInt(7_200));
                events.add(event("actor-" + actor, names[random.nextInt(names.length)], cursor.toString()));
            }
        }
        engine.events().addAll(events);

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup", "purchase")
                .funnelOrderType(orderType)
                .build());

        List<Long> counts = counts(result.getSeries().get(0));
        for (int i = 1; i < counts.size(); i++) {
            assertThat(counts.get(i)).isLessThanOrEqualTo(counts.get(i - 1));
        }
        assertThat(counts.get(0)).isPositive();
    }

    @Test
    @DisplayName("Running the same funnel twice yields identical output")
    void funnelIsIdempotent() {
        twoConvertingActors();
        InsightQuery funnel = query("$pageview", "signup", "purchase").build();

        assertThat(service().evaluateFunnel(funnel)).isEqualTo(service().evaluateFunnel(funnel));
    }

    @Test
    @DisplayName("Sampling factor 1.0 gives the same result as no sampling factor")
    void samplingFactorOneIsIdentity() {
        twoConvertingActors();

        FunnelResult unset = service().evaluateFunnel(query("$pageview", "signup").build());
        FunnelResult one = service().evaluateFunnel(query("$pageview", "signup").samplingFactor(1.0).build());

        assertThat(one).isEqualTo(unset);
    }

    @Test
    @DisplayName("First touch breakdown - actors are bucketed by their first step event value, largest bucket first")
    void firstTouchBreakdown() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Chrome")),
                event("alice", "signup", "2024-01-10T10:10:00Z", Map.of("$browser", "Safari")),
                event("bob", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Chrome")),
                event("carol", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Firefox")),
                event("carol", "signup", "2024-01-10T10:20:00Z", Map.of("$browser", "Firefox")));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup")
                .breakdown(Breakdown.builder().type(BreakdownType.EVENT).keys(List.of("$browser")).build())
                .build());

        assertThat(result.isBreakdown()).isTrue();
        assertThat(result.getSeries()).extracting(FunnelSeries::getBreakdownValue)
                .containsExactly(List.of("Chrome"), List.of("Firefox"));
        assertThat(counts(result.getSeries().get(0))).containsExactly(2L, 1L);
        assertThat(counts(result.getSeries().get(1))).containsExactly(1L, 1L);
    }

    @Test
    @DisplayName("Step attribution - actors who never reach the attribution step fall out of every bucket")
    void stepAttributionDropsActorsShortOfTheStep() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z", Map.of("plan", "free")),
                event("alice", "signup", "2024-01-10T10:10:00Z", Map.of("plan", "pro")),
                event("bob", "$pageview", "2024-01-10T10:00:00Z", Map.of("plan", "free")));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup")
                .breakdown(Breakdown.builder()
                        .keys(List.of("plan"))
                        .attribution(BreakdownAttribution.STEP)
                        .attributionStep(1)
                        .build())
                .build());

        assertThat(result.getSeries()).hasSize(1);
        assertThat(result.getSeries().get(0).getBreakdownValue()).containsExactly("pro");
        assertThat(counts(result.getSeries().get(0))).containsExactly(1L, 1L);
    }

    @Test
    @DisplayName("All-events attribution - bucket counts add up to at least the unbroken-down actor count")
    void allEventsBreakdownIsComplete() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Chrome")),
                event("alice", "signup", "2024-01-10T10:10:00Z", Map.of("$browser", "Chrome")),
                event("alice", "$pageview", "2024-01-12T10:00:00Z", Map.of("$browser", "Safari")),
                event("bob", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Firefox")));

        FunnelResult plain = service().evaluateFunnel(query("$pageview", "signup").build());
        FunnelResult broken = service().evaluateFunnel(query("$pageview", "signup")
                .breakdown(Breakdown.builder()
                        .keys(List.of("$browser"))
                        .attribution(BreakdownAttribution.ALL_EVENTS)
                        .build())
                .build());

        long bucketTotal = broken.getSeries().stream().mapToLong(series -> series.getSteps().get(0).getCount()).sum();
        assertThat(bucketTotal).isGreaterThanOrEqualTo(plain.steps().get(0).getCount());
        assertThat(broken.getSeries()).extracting(FunnelSeries::getBreakdownValue)
                .containsExactlyInAnyOrder(List.of("Chrome"), List.of("Safari"), List.of("Firefox"));
    }

    @Test
    @DisplayName("Breakdown limit - smaller buckets fold into Other")
    void breakdownLimitFoldsIntoOther() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Chrome")),
                event("bob", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Chrome")),
                event("carol", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Safari")),
                event("dave", "$pageview", "2024-01-10T10:00:00Z", Map.of("$browser", "Firefox")));

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup")
                .breakdown(Breakdown.builder().keys(List.of("$browser")).limit(1).build())
                .build());

        assertThat(result.getSeries()).extracting(FunnelSeries::getBreakdownValue)
                .containsExactly(List.of("Chrome"), List.of("Other"));
        assertThat(counts(result.getSeries().get(1))).containsExactly(2L, 0L);
    }

    @Test
    @DisplayName("Cohort breakdown - members are counted in their cohort and everyone in 'all users'")
    void cohortBreakdown() {
        twoConvertingActors();
        engine.cohort("42", "alice");

        FunnelResult result = service().evaluateFunnel(query("$pageview", "signup", "purchase")
                .breakdown(Breakdown.builder().type(BreakdownType.COHORT).keys(List.of("42", "all")).build())
                .build());

        assertThat(result.getSeries()).extracting(FunnelSeries::getBreakdownValue)
                .containsExactly(List.of("all users"), List.of("42"));
        assertThat(counts(result.getSeries().get(0))).containsExactly(2L, 2L, 1L);
        assertThat(counts(result.getSeries().get(1))).containsExactly(1L, 1L, 1L);
    }

    @Test
    @DisplayName("Funnel trends - each entry day reports its own conversion rate")
    void funnelTrendsPerEntryPeriod() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z"),
                event("alice", "signup", "2024-01-10T12:00:00Z"),
                event("bob", "$pageview", "2024-01-11T09:00:00Z"),
                event("carol", "$pageview", "2024-01-11T09:00:00Z"),
                event("carol", "signup", "2024-01-11T09:30:00Z"));

        List<FunnelTrendsSeries> series = service().evaluateFunnelTrends(query("$pageview", "signup")
                .dateFrom("2024-01-10")
                .dateTo("2024-01-12")
                .interval(Interval.DAY)
                .build());

        assertThat(series).hasSize(1);
        List<FunnelTrendPoint> points = series.get(0).getPoints();
        assertThat(points).extracting(FunnelTrendPoint::getDay)
                .containsExactly("2024-01-10", "2024-01-11", "2024-01-12");
        assertThat(points).extracting(FunnelTrendPoint::getReachedFromStepCount).containsExactly(1L, 2L, 0L);
        assertThat(points).extracting(FunnelTrendPoint::getReachedToStepCount).containsExactly(1L, 1L, 0L);
        assertThat(points).extracting(FunnelTrendPoint::getConversionRate).containsExactly(100.0, 50.0, 0.0);
        assertThat(points).allMatch(FunnelTrendPoint::isPeriodFinal);
    }

    @Test
    @DisplayName("Time to convert - durations are histogrammed between the requested steps")
    void timeToConvertHistogram() {
        engine.events().add(
                event("alice", "$pageview", "2024-01-10T10:00:00Z"),
                event("alice", "signup", "2024-01-10T11:00:00Z"),
                event("bob", "$pageview", "2024-01-10T10:00:00Z"),
                event("bob", "signup", "2024-01-10T12:00:00Z"),
                event("carol", "$pageview", "2024-01-10T10:00:00Z"));

        TimeToConvertResult result = service().timeToConvert(query("$pageview", "signup").binCount(2).build());

        assertThat(result.getBinWidthSeconds()).isEqualTo(1800L);
        assertThat(result.getBins()).extracting(TimeToConvertResult.Bin::getStartSeconds).containsExactly(3600L, 5400L);
        assertThat(result.getBins()).extracting(TimeToConvertResult.Bin::getCount).containsExactly(1L, 1L);
        assertThat(result.getAverageConversionTime()).isEqualTo(5400.0);
    }

    @Test
    @DisplayName("Time to convert - no conversions yields an empty histogram")
    void timeToConvertWithoutConversions() {
        engine.events().add(event("carol", "$pageview", "2024-01-10T10:00:00Z"));

        TimeToConvertResult result = service().timeToConvert(query("$pageview", "signup").build());

        assertThat(result.getBins()).isEmpty();
        assertThat(result.getAverageConversionTime()).isNull();
    }

    @Test
    @DisplayName("Actors at step - positive steps list converters, negative steps list drop-offs")
    void listActorsAtStep() {
        twoConvertingActors();
        InsightQuery funnel = query("$pageview", "signup", "purchase").build();

        ActorPage reachedSignup = service().listActorsAtStep(funnel, 2, null, null, null);
        ActorPage droppedBeforePurchase = service().listActorsAtStep(funnel, -3, null, null, null);
        ActorPage firstPage = service().listActorsAtStep(funnel, 1, null, 0, 1);

        assertThat(reachedSignup.getActorIds()).containsExactly("alice", "bob");
        assertThat(droppedBeforePurchase.getActorIds()).containsExactly("bob");
        assertThat(firstPage.getActorIds()).containsExactly("alice");
        assertThat(firstPage.getTotal()).isEqualTo(2L);
        assertThat(firstPage.isHasMore()).isTrue();
    }

    @Test
    @DisplayName("Actors at step - step 0, -1 and out-of-range steps are rejected")
    void listActorsRejectsInvalidSteps() {
        InsightQuery funnel = query("$pageview", "signup").build();

        assertThatThrownBy(() -> service().listActorsAtStep(funnel, 0, null, null, null))
                .isInstanceOf(InsightValidationException.class);
        assertThatThrownBy(() -> service().listActorsAtStep(funnel, -1, null, null, null))
                .isInstanceOf(InsightValidationException.class);
        assertThatThrownBy(() -> service().listActorsAtStep(funnel, 3, null, null, null))
                .isInstanceOf(InsightValidationException.class);
        assertThatThrownBy(() -> service().listActorsAtStep(funnel, 1, null, null, 5000))
                .isInstanceOf(InsightValidationException.class);
    }

    @Test
    @DisplayName("A single-step funnel fails validation before any events are read")
    void singleStepFunnelIsRejected() {
        assertThatThrownBy(() -> service().evaluateFunnel(query("$pageview").build()))
                .isInstanceOf(InsightValidationException.class)
                .hasMessageContaining("Invalid insight query");
        assertThat(engine.events().getQueries()).isEmpty();
    }

    @Test
    @DisplayName("Strict funnels read every event so that noise can break runs")
    void strictFunnelReadsAllEvents() {
        service().evaluateFunnel(query("$pageview", "signup").funnelOrderType(FunnelOrderType.STRICT).build());
        service().evaluateFunnel(query("$pageview", "signup").build());

        assertThat(engine.events().getQueries().get(0).allEvents()).isTrue();
        assertThat(engine.events().getQueries().get(1).getEventNames()).containsExactlyInAnyOrder("$pageview", "signup");
    }
}
