package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.BreakdownAttribution;
import com.baykanat.insider.insights.domain.model.EntityType;
import com.baykanat.insider.insights.domain.model.ExclusionEntity;
import com.baykanat.insider.insights.domain.model.InsightEntity;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.MathType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Sorguyu herhangi bir event okunmadan önce doğrular. Yapısal hatalar tek bir InsightValidationException
 * içinde toplanır; filtre hataları MalformedFilterException olarak hemen fırlatılır.
 */
@Component
@RequiredArgsConstructor
public class InsightQueryValidator {

    private static final int MAX_FORMULA_ENTITIES = 26;

    private final PropertyFilterEvaluator filterEvaluator;
    private final ExpressionEvaluator expressionEvaluator;
    private final EntityMatcher entityMatcher;
    private final AppProperties appProperties;

    public void validateFunnel(InsightQuery query) {
        List<String> errors = new ArrayList<>();
        validateCommon(query, errors);

        int stepCount = query.getEntities() == null ? 0 : query.getEntities().size();
        if (stepCount > 0 && stepCount < 2) {
            errors.add("A funnel requires at least 2 steps");
        }
        int maxSteps = Math.min(appProperties.getFunnel().getMaxSteps(), Long.SIZE - 1);
        if (stepCount > maxSteps) {
            errors.add("A funnel supports at most " + maxSteps + " steps");
        }
        validateExclusions(query, stepCount, errors);
        validateAttribution(query.getBreakdown(), stepCount, errors);
        validateStepRange(query, stepCount, errors);
        throwIfInvalid(errors);
    }

    public void validateTrends(InsightQuery query) {
        List<String> errors = new ArrayList<>();
        validateCommon(query, errors);
        validateFormula(query, errors);
        throwIfInvalid(errors);
    }

    public void validateStickiness(InsightQuery query) {
        List<String> errors = new ArrayList<>();
        validateCommon(query, errors);
        throwIfInvalid(errors);
    }

    /** 1 control ve 1..maxTestVariants test variant'ı; anahtarlar tekil olmalı. */
    public void validateVariants(String controlKey, List<String> variantKeys) {
        List<String> errors = new ArrayList<>();
        int maxTests = appProperties.getExperiment().getMaxTestVariants();
        if (controlKey == null || !variantKeys.contains(controlKey)) {
            errors.add("Experiment requires exactly one control variant");
        }
        long tests = variantKeys.stream().filter(key -> !key.equals(controlKey)).count();
        if (tests < 1 || tests > maxTests) {
            errors.add("Experiment requires between 1 and " + maxTests + " test variants, got " + tests);
        }
        if (Set.copyOf(variantKeys).size() != variantKeys.size()) {
            errors.add("Variant keys must be unique");
        }
        throwIfInvalid(errors);
    }

    private void validateCommon(InsightQuery query, List<String> errors) {
        if (query.getEntities() == null || query.getEntities().isEmpty()) {
            errors.add("At least one entity is required");
            return;
        }
        Double samplingFactor = query.getSamplingFactor();
        if (samplingFactor != null && !(samplingFactor > 0.0 && samplingFactor <= 1.0)) {
            errors.add("sampling_factor must be in (0, 1]");
        }
        Breakdown breakdown = query.getBreakdown();
        if (breakdown != null && breakdown.getLimit() != null && breakdown.getLimit() < 1) {
            errors.add("Breakdown limit must be at least 1");
        }
        if (query.getConversionWindow() != null && query.getConversionWindow().getValue() <= 0) {
            errors.add("Conversion window must be positive");
        }
        for (int i = 0; i < query.getEntities().size(); i++) {
            validateEntity(query.getEntities().get(i), i, errors);
        }
        filterEvaluator.validate(query.getProperties());
    }

    private void validateEntity(InsightEntity entity, int index, List<String> errors) {
        MathType math = entity.getMath() != null ? entity.getMath() : MathType.TOTAL;
        String prefix = "Entity " + index + " (" + entity.displayName() + "): ";
        if (math.isPropertyMath() && (entity.getMathProperty() == null || entity.getMathProperty().isBlank())) {
            errors.add(prefix + "math " + math + " requires math_property");
        }
        if (math == MathType.UNIQUE_GROUP && entity.getMathGroupTypeIndex() == null) {
            errors.add(prefix + "math UNIQUE_GROUP requires math_group_type_index");
        }
        if (math == MathType.HOGQL) {
            try {
                expressionEvaluator.parseAggregate(entity.getMathHogql());
            } catch (IllegalArgumentException e) {
                errors.add(prefix + "invalid math_hogql: " + e.getMessage());
            }
        }
        if (entity.getId() == null && entity.getType() != null && entity.getType() != EntityType.EVENTS) {
            errors.add(prefix + entity.getType() + " entities require an id");
        }
        filterEvaluator.validate(entity.getProperties());
    }

    private void validateExclusions(InsightQuery query, int stepCount, List<String> errors) {
        if (query.getExclusions() == null) {
            return;
        }
        if (query.getExclusions().size() > Long.SIZE) {
            errors.add("A funnel supports at most " + Long.SIZE + " exclusions");
            return;
        }
        for (ExclusionEntity exclusion : query.getExclusions()) {
            Integer from = exclusion.getFromStep();
            Integer to = exclusion.getToStep();
            if (exclusion.getEntity() == null || from == null || to == null) {
                errors.add("Exclusion requires an entity, funnel_from_step and funnel_to_step");
                continue;
            }
            if (from < 0 || from >= to || from >= stepCount - 1 || to > stepCount - 1) {
                errors.add("Exclusion step range [" + from + ", " + to + "] is invalid for a " + stepCount + "-step funnel");
                continue;
            }
            for (int step = from; step <= to; step++) {
                if (entityMatcher.isSuperset(query.getEntities().get(step), exclusion.getEntity())) {
                    errors.add("Exclusion " + exclusion.getEntity().displayName() + " cannot match funnel step " + step);
                    break;
                }
            }
            filterEvaluator.validate(exclusion.getEntity().getProperties());
        }
    }

    private static void validateAttribution(Breakdown breakdown, int stepCount, List<String> errors) {
        if (breakdown == null || breakdown.getAttribution() != BreakdownAttribution.STEP) {
            return;
        }
        Integer step = breakdown.getAttributionStep();
        if (step == null) {
            errors.add("STEP attribution requires attribution_step");
        } else if (step < 0 || step >= stepCount) {
            errors.add("attribution_step " + step + " is out of range");
        }
    }

    private static void validateStepRange(InsightQuery query, int stepCount, List<String> errors) {
        Integer from = query.getFunnelFromStep();
        Integer to = query.getFunnelToStep();
        if (from != null && (from < 0 || from >= stepCount)) {
            errors.add("funnel_from_step " + from + " is out of range");
        }
        if (to != null && (to < 0 || to >= stepCount)) {
            errors.add("funnel_to_step " + to + " is out of range");
        }
        if (from != null && to != null && from >= to) {
            errors.add("funnel_from_step must be before funnel_to_step");
        }
    }

    private void validateFormula(InsightQuery query, List<String> errors) {
        String formula = query.getFormula();
        if (formula == null || formula.isBlank()) {
            return;
        }
        int entityCount = query.getEntities() == null ? 0 : query.getEntities().size();
        if (entityCount > MAX_FORMULA_ENTITIES) {
            errors.add("Formula mode supports at most " + MAX_FORMULA_ENTITIES + " entities");
            return;
        }
        try {
            for (String reference : expressionEvaluator.parse(formula).getReferences()) {
                if (formulaIndex(reference) < 0 || formulaIndex(reference) >= entityCount) {
                    errors.add("Formula references unknown series '" + reference + "'");
                }
            }
        } catch (IllegalArgumentException e) {
            errors.add("Invalid formula: " + e.getMessage());
        }
    }

    /** "A" → 0, "B" → 1; harf olmayan referans -1. */
    static int formulaIndex(String reference) {
        if (reference.length() != 1) {
            return -1;
        }
        char letter = Character.toUpperCase(reference.charAt(0));
        return letter >= 'A' && letter <= 'Z' ? letter - 'A' : -1;
    }

    private static void throwIfInvalid(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new InsightValidationException("Invalid insight query", errors);
        }
    }
}
