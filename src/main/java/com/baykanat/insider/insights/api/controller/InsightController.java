package com.baykanat.insider.insights.api.controller;

import com.baykanat.insider.insights.api.dto.InsightQueryRequest;
import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import com.baykanat.insider.insights.domain.mapper.InsightQueryMapper;
import com.baykanat.insider.insights.domain.model.ActorPage;
import com.baykanat.insider.insights.domain.model.FunnelResult;
import com.baykanat.insider.insights.domain.model.FunnelTrendsSeries;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.StickinessSeries;
import com.baykanat.insider.insights.domain.model.TimeToConvertResult;
import com.baykanat.insider.insights.domain.model.TrendSeries;
import com.baykanat.insider.insights.domain.service.FunnelService;
import com.baykanat.insider.insights.domain.service.StickinessService;
import com.baykanat.insider.insights.domain.service.TrendsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Takım başına funnel, trends ve stickiness sorguları. Hesaplama senkron; tüm iş domain servislerinde. */
@Slf4j
@RestController
@RequestMapping("/api/projects/{teamId}/insights")
@RequiredArgsConstructor
@Tag(name = "Insights", description = "Funnel, trends and stickiness queries over raw events")
public class InsightController {

    private final FunnelService funnelService;
    private final TrendsService trendsService;
    private final StickinessService stickinessService;
    private final InsightQueryMapper queryMapper;

    @PostMapping("/funnel")
    @Operation(summary = "Evaluate a funnel", description = "Counts actors reaching each step, optionally broken down")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Funnel evaluated"),
            @ApiResponse(responseCode = "400", description = "Invalid query"),
            @ApiResponse(responseCode = "503", description = "Too many concurrent queries"),
            @ApiResponse(responseCode = "504", description = "Query exceeded its deadline")
    })
    public ResponseEntity<FunnelResult> funnel(
            @Parameter(description = "Team id", example = "1") @PathVariable Long teamId,
            @Valid @RequestBody InsightQueryRequest request) {
        log.debug("Funnel request: team={}, steps={}", teamId, request.getEntities().size());
        return ResponseEntity.ok(funnelService.evaluateFunnel(toQuery(request, teamId)));
    }

    @PostMapping("/funnel/trends")
    @Operation(summary = "Funnel conversion over time",
            description = "Conversion between funnel_from_step and funnel_to_step per entry period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Funnel trends evaluated"),
            @ApiResponse(responseCode = "400", description = "Invalid query")
    })
    public ResponseEntity<List<FunnelTrendsSeries>> funnelTrends(
            @Parameter(description = "Team id", example = "1") @PathVariable Long teamId,
            @Valid @RequestBody InsightQueryRequest request) {
        return ResponseEntity.ok(funnelService.evaluateFunnelTrends(toQuery(request, teamId)));
    }

    @PostMapping("/funnel/time-to-convert")
    @Operation(summary = "Time to convert histogram",
            description = "Histogram of seconds between funnel_from_step and funnel_to_step")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Histogram computed"),
            @ApiResponse(responseCode = "400", description = "Invalid query")
    })
    public ResponseEntity<TimeToConvertResult> timeToConvert(
            @Parameter(description = "Team id", example = "1") @PathVariable Long teamId,
            @Valid @RequestBody InsightQueryRequest request) {
        return ResponseEntity.ok(funnelService.timeToConvert(toQuery(request, teamId)));
    }

    /** funnel_step zorunlu; negatif değer drop-off listesidir. */
    @PostMapping("/funnel/actors")
    @Operation(summary = "List actors at a funnel step",
            description = "Actors who reached (or dropped off before) a step, ordered by id and paged")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Actor page returned"),
            @ApiResponse(responseCode = "400", description = "Invalid query or step")
    })
    public ResponseEntity<ActorPage> funnelActors(
            @Parameter(description = "Team id", example = "1") @PathVariable Long teamId,
            @Valid @RequestBody InsightQueryRequest request) {
        if (request.getFunnelStep() == null) {
            throw new InsightValidationException("funnel_step is required");
        }
        ActorPage page = funnelService.listActorsAtStep(toQuery(request, teamId), request.getFunnelStep(),
                request.getBreakdownValue(), request.getOffset(), request.getLimit());
        return ResponseEntity.ok(page);
    }

    @PostMapping("/trends")
    @Operation(summary = "Evaluate trends", description = "Per-period series with math, breakdowns and formulas")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trends evaluated"),
            @ApiResponse(responseCode = "400", description = "Invalid query")
    })
    public ResponseEntity<List<TrendSeries>> trends(
            @Parameter(description = "Team id", example = "1") @PathVariable Long teamId,
            @Valid @RequestBody InsightQueryRequest request) {
        return ResponseEntity.ok(trendsService.evaluateTrends(toQuery(request, teamId)));
    }

    @PostMapping("/stickiness")
    @Operation(summary = "Evaluate stickiness", description = "Actors by number of distinct active periods")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Stickiness evaluated"),
            @ApiResponse(responseCode = "400", description = "Invalid query")
    })
    public ResponseEntity<List<StickinessSeries>> stickiness(
            @Parameter(description = "Team id", example = "1") @PathVariable Long teamId,
            @Valid @RequestBody InsightQueryRequest request) {
        return ResponseEntity.ok(stickinessService.evaluateStickiness(toQuery(request, teamId)));
    }

    private InsightQuery toQuery(InsightQueryRequest request, Long teamId) {
        return queryMapper.toQuery(request, teamId);
    }
}
