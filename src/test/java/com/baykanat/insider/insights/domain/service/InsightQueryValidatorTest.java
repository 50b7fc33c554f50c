package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.exception.MalformedFilterException;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.BreakdownAttribution;
import com.baykanat.insider.insights.domain.model.ConversionWindow;
import com.baykanat.insider.insights.domain.model.ExclusionEntity;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.MathType;
import com.baykanat.insider.insights.domain.model.PropertyFilter;
import com.baykanat.insider.insights.domain.model.PropertyGroup;
import com.baykanat.insider.insights.domain.model.PropertyOperator;
import com.baykanat.insider.insights.domain.model.PropertyScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.baykanat.insider.insights.support.TestEvents.query;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for InsightQueryValidator.
 *
 * <p>Structural problems are collected into one InsightValidationException whose details list every
 * violation; malformed property filters fail fast with MalformedFilterException.
 */
class InsightQueryValidatorTest {

    private InsightQueryValidator validator;

    @BeforeEach
    void setUp() {
        ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();
        PropertyFilterEvaluator filterEvaluator = new PropertyFilterEvaluator(expressionEvaluator);
        validator = new InsightQueryValidator(filterEvaluator, expressionEvaluator,
                new EntityMatcher(filterEvaluator), new AppProperties());
    }

    private static List<String> detailsOf(Runnable validation) {
        try {
            validation.run();
        } catch (InsightValidationException e) {
            return e.getDetails();
        }
        throw new AssertionError("Expected an InsightValidationException");
    }

    private static ExclusionEntity exclusion(String event, int from, int to) {
        return ExclusionEntity.builder().entity(InsightEntity.event(event)).fromStep(from).toStep(to).build();
    }

    @Test
    @DisplayName("A well-formed three-step funnel passes")
    void validFunnel() {
        InsightQuery funnel = query("$pageview", "signup", "purchase")
                .exclusions(List.of(exclusion("cancel", 0, 2)))
                .conversionWindow(ConversionWindow.ofDays(7))
                .build();

        assertThatCode(() -> validator.validateFunnel(funnel)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Funnel - single step and missing entities rejected")
    void stepCount() {
        assertThat(detailsOf(() -> validator.validateFunnel(query("$pageview").build())))
                .containsExactly("A funnel requires at least 2 steps");
        assertThat(detailsOf(() -> validator.validateFunnel(query().build())))
                .containsExactly("At least one entity is required");
    }

    @Test
    @DisplayName("Funnel - all structural violations reported together")
    void collectsAllErrors() {
        InsightQuery broken = query("$pageview", "signup")
                .samplingFactor(0.0)
                .conversionWindow(ConversionWindow.ofDays(0))
                .breakdown(Breakdown.builder().keys(List.of("$browser")).limit(0).build())
                .build();

        assertThat(detailsOf(() -> validator.validateFunnel(broken))).containsExactlyInAnyOrder(
                "sampling_factor must be in (0, 1]",
                "Breakdown limit must be at least 1",
                "Conversion window must be positive");
    }

    @Test
    @DisplayName("Exclusion - range must lie inside the funnel and must not shadow a step")
    void exclusionRules() {
        InsightQuery outOfRange = query("$pageview", "signup")
                .exclusions(List.of(exclusion("cancel", 1, 2)))
                .build();
        InsightQuery shadowsStep = query("$pageview", "signup", "purchase")
                .exclusions(List.of(exclusion("signup", 0, 2)))
                .build();

        assertThat(detailsOf(() -> validator.validateFunnel(outOfRange)))
                .containsExactly("Exclusion step range [1, 2] is invalid for a 2-step funnel");
        assertThat(detailsOf(() -> validator.validateFunnel(shadowsStep)))
                .containsExactly("Exclusion signup cannot match funnel step 1");
    }

    @Test
    @DisplayName("Step attribution needs a step inside the funnel")
    void attributionStep() {
        Breakdown missingStep = Breakdown.builder().keys(List.of("plan"))
                .attribution(BreakdownAttribution.STEP).build();
        Breakdown outOfRange = Breakdown.builder().keys(List.of("plan"))
                .attribution(BreakdownAttribution.STEP).attributionStep(2).build();

        assertThat(detailsOf(() -> validator.validateFunnel(query("a", "b").breakdown(missingStep).build())))
                .containsExactly("STEP attribution requires attribution_step");
        assertThat(detailsOf(() -> validator.validateFunnel(query("a", "b").breakdown(outOfRange).build())))
                .containsExactly("attribution_step 2 is out of range");
    }

    @Test
    @DisplayName("Time to convert step range must be ordered and inside the funnel")
    void stepRange() {
        assertThat(detailsOf(() -> validator.validateFunnel(
                query("a", "b", "c").funnelFromStep(2).funnelToStep(1).build())))
                .containsExactly("funnel_from_step must be before funnel_to_step");
        assertThat(detailsOf(() -> validator.validateFunnel(
                query("a", "b", "c").funnelFromStep(0).funnelToStep(3).build())))
                .containsExactly("funnel_to_step 3 is out of range");
    }

    @Test
    @DisplayName("Entity math - property math and unique group need their parameters")
    void entityMath() {
        InsightEntity sum = InsightEntity.event("purchase").toBuilder().math(MathType.SUM).build();
        InsightEntity groups = InsightEntity.event("purchase").toBuilder().math(MathType.UNIQUE_GROUP).build();

        assertThat(detailsOf(() -> validator.validateTrends(query().entities(List.of(sum, groups)).build())))
                .containsExactly(
                        "Entity 0 (purchase): math SUM requires math_property",
                        "Entity 1 (purchase): math UNIQUE_GROUP requires math_group_type_index");
    }

    @Test
    @DisplayName("Formula - unknown series and syntax errors rejected, valid references accepted")
    void formula() {
        assertThatCode(() -> validator.validateTrends(query("a", "b").formula("A / B * 100").build()))
                .doesNotThrowAnyException();
        assertThat(detailsOf(() -> validator.validateTrends(query("a", "b").formula("A + C").build())))
                .containsExactly("Formula references unknown series 'C'");
        assertThat(detailsOf(() -> validator.validateTrends(query("a", "b").formula("A +").build())))
                .singleElement().asString().startsWith("Invalid formula: ");
    }

    @Test
    @DisplayName("Malformed global filters fail fast with MalformedFilterException")
    void malformedFilter() {
        PropertyFilter cohortGt = PropertyFilter.builder()
                .scope(PropertyScope.COHORT).operator(PropertyOperator.GT).value("42").build();

        assertThatThrownBy(() -> validator.validateStickiness(
                query("$pageview").properties(PropertyGroup.and(cohortGt)).build()))
                .isInstanceOf(MalformedFilterException.class)
                .hasMessage("Cohort filters only support the IN and NOT_IN operators");
    }

    @Test
    @DisplayName("Variants - control required, test count bounded, keys unique")
    void variants() {
        assertThatCode(() -> validator.validateVariants("control", List.of("control", "test")))
                .doesNotThrowAnyException();
        assertThat(detailsOf(() -> validator.validateVariants("control", List.of("test"))))
                .contains("Experiment requires exactly one control variant");
        assertThat(detailsOf(() -> validator.validateVariants("control", List.of("control"))))
                .containsExactly("Experiment requires between 1 and 7 test variants, got 0");
        assertThat(detailsOf(() -> validator.validateVariants("control", List.of("control", "a", "a"))))
                .containsExactly("Variant keys must be unique");
    }

    @Test
    @DisplayName("formulaIndex maps single letters to series positions")
    void formulaIndex() {
        assertThat(InsightQueryValidator.formulaIndex("A")).isZero();
        assertThat(InsightQueryValidator.formulaIndex("c")).isEqualTo(2);
        assertThat(InsightQueryValidator.formulaIndex("AB")).isEqualTo(-1);
    }
}
