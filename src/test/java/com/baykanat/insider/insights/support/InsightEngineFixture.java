package com.baykanat.insider.insights.support;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.ActionDefinition;
import com.baykanat.insider.insights.domain.service.ActorStreamBuilder;
import com.baykanat.insider.insights.domain.service.BreakdownAttributor;
import com.baykanat.insider.insights.domain.service.EntityMatcher;
import com.baykanat.insider.insights.domain.service.EventQueryPlanner;
import com.baykanat.insider.insights.domain.service.ExperimentService;
import com.baykanat.insider.insights.domain.service.ExperimentStatistics;
import com.baykanat.insider.insights.domain.service.ExpressionEvaluator;
import com.baykanat.insider.insights.domain.service.FunnelAggregator;
import com.baykanat.insider.insights.domain.service.FunnelService;
import com.baykanat.insider.insights.domain.service.FunnelStepClassifier;
import com.baykanat.insider.insights.domain.service.InsightQueryResolver;
import com.baykanat.insider.insights.domain.service.InsightQueryValidator;
import com.baykanat.insider.insights.domain.service.ParallelActorExecutor;
import com.baykanat.insider.insights.domain.service.PropertyFilterEvaluator;
import com.baykanat.insider.insights.domain.service.RelativeDateParser;
import com.baykanat.insider.insights.domain.service.StickinessService;
import com.baykanat.insider.insights.domain.service.TimeBucketer;
import com.baykanat.insider.insights.domain.service.TrendsAggregator;
import com.baykanat.insider.insights.domain.service.TrendsService;
import com.baykanat.insider.insights.domain.source.CohortMembershipSource;
import com.baykanat.insider.insights.domain.source.GroupPropertiesSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the engine by hand, without a Spring context, over in-memory collaborators.
 *
 * <p>The partition size is deliberately tiny so that even small fixtures are split across several
 * worker tasks and exercise the merge path. The clock is fixed at {@link #NOW}.
 */
public class InsightEngineFixture implements AutoCloseable {

    public static final Instant NOW = Instant.parse("2024-02-01T12:00:00Z");

    private final AppProperties appProperties = new AppProperties();
    private final InMemoryEventSource eventSource = new InMemoryEventSource();
    private final Map<String, Set<String>> cohorts = new HashMap<>();
    private final Map<String, ActionDefinition> actions = new HashMap<>();
    private final Map<String, Map<String, Object>> groups = new HashMap<>();
    private final ExecutorService pool = Executors.newFixedThreadPool(3);

    private final FunnelService funnelService;
    private final TrendsService trendsService;
    private final StickinessService stickinessService;
    private final ExperimentService experimentService;
    private final ExperimentStatistics experimentStatistics;
    private final InsightQueryValidator validator;

    public InsightEngineFixture() {
        appProperties.getEngine().setActorPartitionSize(2);
        appProperties.getEngine().setQueryTimeoutSeconds(30);
        appProperties.getExperiment().setSeed(42L);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CohortMembershipSource cohortSource = new CohortMembershipSource() {
            @Override
            public Set<String> members(long teamId, String cohortId) {
                return cohorts.getOrDefault(cohortId, Set.of());
            }

            @Override
            public Optional<String> cohortName(long teamId, String cohortId) {
                return cohorts.containsKey(cohortId) ? Optional.of("Cohort " + cohortId) : Optional.empty();
            }
        };
        GroupPropertiesSource groupSource = (teamId, groupTypeIndex, groupKey) ->
                groups.getOrDefault(groupTypeIndex + ":" + groupKey, Map.of());

        ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();
        PropertyFilterEvaluator filterEvaluator = new PropertyFilterEvaluator(expressionEvaluator);
        EntityMatcher entityMatcher = new EntityMatcher(filterEvaluator);
        BreakdownAttributor attributor = new BreakdownAttributor(filterEvaluator, appProperties);
        TimeBucketer timeBucketer = new TimeBucketer(appProperties);
        EventQueryPlanner planner = new EventQueryPlanner();
        ParallelActorExecutor executor = new ParallelActorExecutor(pool, appProperties);

        validator = new InsightQueryValidator(filterEvaluator, expressionEvaluator, entityMatcher, appProperties);
        InsightQueryResolver resolver = new InsightQueryResolver(new RelativeDateParser(clock), eventSource,
                (teamId, actionId) -> Optional.ofNullable(actions.get(actionId)), entityMatcher, appProperties);

        funnelService = new FunnelService(validator, resolver, planner, eventSource, cohortSource, groupSource,
                new ActorStreamBuilder(entityMatcher, attributor), new FunnelStepClassifier(), attributor,
                new FunnelAggregator(attributor), executor, timeBucketer, clock, appProperties);
        trendsService = new TrendsService(validator, resolver, planner, eventSource, cohortSource, groupSource,
                entityMatcher, attributor, new TrendsAggregator(expressionEvaluator, timeBucketer), executor,
                timeBucketer, appProperties);
        stickinessService = new StickinessService(validator, resolver, planner, eventSource, cohortSource,
                groupSource, entityMatcher, executor, timeBucketer, appProperties);
        experimentStatistics = new ExperimentStatistics(appProperties);
        experimentService = new ExperimentService(experimentStatistics, validator);
    }

    public InMemoryEventSource events() {
        return eventSource;
    }

    public InsightEngineFixture cohort(String cohortId, String... personIds) {
        cohorts.put(cohortId, Set.of(personIds));
        return this;
    }

    public InsightEngineFixture action(ActionDefinition action) {
        actions.put(action.getId(), action);
        return this;
    }

    public InsightEngineFixture group(int groupTypeIndex, String groupKey, Map<String, Object> properties) {
        groups.put(groupTypeIndex + ":" + groupKey, properties);
        return this;
    }

    public AppProperties properties() {
        return appProperties;
    }

    public FunnelService funnel() {
        return funnelService;
    }

    public TrendsService trends() {
        return trendsService;
    }

    public StickinessService stickiness() {
        return stickinessService;
    }

    public ExperimentService experiments() {
        return experimentService;
    }

    public ExperimentStatistics experimentStatistics() {
        return experimentStatistics;
    }

    public InsightQueryValidator validator() {
        return validator;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
