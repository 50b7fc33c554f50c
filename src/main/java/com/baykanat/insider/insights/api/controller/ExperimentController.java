package com.baykanat.insider.insights.api.controller;

import com.baykanat.insider.insights.api.dto.ExperimentRequest;
import com.baykanat.insider.insights.domain.mapper.InsightQueryMapper;
import com.baykanat.insider.insights.domain.model.ExperimentResult;
import com.baykanat.insider.insights.domain.service.ExperimentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /api/experiments/results: hazır variant sayılarından Bayesian karar. */
@Slf4j
@RestController
@RequestMapping("/api/experiments")
@RequiredArgsConstructor
@Tag(name = "Experiments", description = "Bayesian A/B test statistics")
public class ExperimentController {

    private final ExperimentService experimentService;
    private final InsightQueryMapper queryMapper;

    @PostMapping("/results")
    @Operation(summary = "Evaluate experiment results",
            description = "Win probabilities, expected loss, credible intervals and a significance code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics computed"),
            @ApiResponse(responseCode = "400", description = "Invalid variants")
    })
    public ResponseEntity<ExperimentResult> results(@Valid @RequestBody ExperimentRequest request) {
        log.debug("Experiment request: metric={}, variants={}", request.getMetricType(), request.getVariants().size());
        return ResponseEntity.ok(experimentService.evaluateExperiment(queryMapper.toExperimentQuery(request)));
    }
}
