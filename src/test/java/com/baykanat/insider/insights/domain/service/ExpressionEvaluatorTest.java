package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.model.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ExpressionEvaluator: formula arithmetic, boolean filters and aggregate parsing.
 */
class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
    }

    private static Function<String, Object> series(double a, double b) {
        return name -> switch (name) {
            case "A" -> a;
            case "B" -> b;
            default -> null;
        };
    }

    @ParameterizedTest(name = "{0} = {1}")
    @CsvSource({
            "A + B * 2,     7.0",
            "(A + B) * 2,   10.0",
            "A / B,         0.5",
            "-A + 11 % 4,   1.0",
            "abs(A - B),    1.0",
            "round(B / A),  2.0",
            "A > B or B > A, 1.0",
            "not A = 2,     0.0"
    })
    @DisplayName("Arithmetic and boolean operators follow the usual precedence")
    void evaluatesFormulas(String formula, double expected) {
        assertThat(evaluator.parse(formula).evaluateNumber(series(2, 4))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Division by zero follows floating point semantics; callers decide how to present it")
    void divisionByZero() {
        assertThat(evaluator.parse("A / B").evaluateNumber(series(1, 0))).isInfinite();
        assertThat(evaluator.parse("B / B").evaluateNumber(series(1, 0))).isNaN();
    }

    @Test
    @DisplayName("References are collected for formula validation")
    void collectsReferences() {
        assertThat(evaluator.parse("A / (B + C) * 100").getReferences()).containsExactlyInAnyOrder("A", "B", "C");
    }

    @Test
    @DisplayName("Event resolver binds event fields and property paths")
    void eventResolver() {
        RawEvent event = RawEvent.builder()
                .event("purchase")
                .distinctId("alice")
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .properties(Map.of("price", "19.5", "currency", "EUR"))
                .personProperties(Map.of("plan", "Pro"))
                .build();
        Function<String, Object> resolver = ExpressionEvaluator.eventResolver(event);

        assertThat(evaluator.parse("properties.price * 2").evaluateNumber(resolver)).isEqualTo(39.0);
        assertThat(evaluator.parse("lower(person.properties.plan) = 'pro'").evaluateNumber(resolver)).isEqualTo(1.0);
        assertThat(evaluator.parse("event = 'purchase' and properties.currency != 'USD'").evaluateNumber(resolver))
                .isEqualTo(1.0);
        assertThat(evaluator.parse("timestamp").evaluateNumber(resolver)).isEqualTo(1704067200.0);
    }

    @Test
    @DisplayName("Aggregate expressions accept sum/avg/min/max and an argument-less count")
    void parsesAggregates() {
        ExpressionEvaluator.AggregateExpression sum = evaluator.parseAggregate("SUM(properties.price)");
        ExpressionEvaluator.AggregateExpression count = evaluator.parseAggregate("count()");

        assertThat(sum.getFunction()).isEqualTo("sum");
        assertThat(sum.getArgument().getReferences()).containsExactly("properties.price");
        assertThat(count.getArgument()).isNull();
        assertThatThrownBy(() -> evaluator.parseAggregate("avg()")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> evaluator.parseAggregate("median(x)")).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"A +", "(A", "A $ B", "'open", "sqrt(A)", "abs(A, B)", ""})
    @DisplayName("Malformed expressions are rejected")
    void rejectsMalformed(String source) {
        assertThatThrownBy(() -> evaluator.parse(source)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Parsed expressions are reused and the parse cache stays bounded")
    void parseCacheIsBounded() {
        ExpressionEvaluator.ParsedExpression first = evaluator.parse("A + B");
        assertThat(evaluator.parse("A + B")).isSameAs(first);

        for (int i = 0; i < ExpressionEvaluator.CACHE_CAPACITY * 3; i++) {
            assertThat(evaluator.parse("A + " + i).evaluateNumber(series(1, 0))).isEqualTo(1.0 + i);
        }

        assertThat(evaluator.cachedExpressionCount()).isLessThanOrEqualTo(ExpressionEvaluator.CACHE_CAPACITY);
        assertThatThrownBy(() -> evaluator.parse("A +")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> evaluator.parse("A +")).isInstanceOf(IllegalArgumentException.class);
    }
}
