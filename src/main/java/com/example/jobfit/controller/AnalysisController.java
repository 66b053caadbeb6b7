package com.example.jobfit.controller;

import com.example.jobfit.model.AnalysisRequest;
import com.example.jobfit.model.AnalysisResult;
import com.example.jobfit.model.UsageStatistics;
import com.example.jobfit.orchestrator.InvalidInputException;
import com.example.jobfit.orchestrator.MatchingEngine;
import com.example.jobfit.service.AnalysisWarnings;
import com.example.jobfit.service.CoverLetterPromptBuilder;
import com.example.jobfit.service.ResultCache;
import com.example.jobfit.service.UsageStatisticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for candidate / job posting fit analysis.
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    static final String WARNINGS_COUNT_HEADER = "X-Analysis-Warnings-Count";
    static final String WARNINGS_HEADER = "X-Analysis-Warnings";
    private static final int MAX_WARNINGS_HEADER_CHARS = 1800;

    private final MatchingEngine engine;
    private final CoverLetterPromptBuilder promptBuilder;
    private final UsageStatisticsService statisticsService;
    private final ResultCache resultCache;

    public AnalysisController(MatchingEngine engine,
                              CoverLetterPromptBuilder promptBuilder,
                              UsageStatisticsService statisticsService,
                              ResultCache resultCache) {
        this.engine = engine;
        this.promptBuilder = promptBuilder;
        this.statisticsService = statisticsService;
        this.resultCache = resultCache;
    }

    /**
     * Analyzes a profile against a job posting and returns the full result as JSON.
     * Performance warnings raised while processing are exposed as response headers.
     *
     * <p>Endpoint: POST /api/analyze
     * <p>Content-Type: application/json ({"profile": {...}, "jobPostingText": "..."})
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        log.info("Received analysis request ({} posting characters)", postingLength(request));

        AnalysisWarnings warnings = AnalysisWarnings.start();
        try {
            AnalysisResult result = engine.runAnalysis(request.profile(), request.jobPostingText());
            return ResponseEntity.ok()
                    .headers(warningHeaders(warnings))
                    .body(result);

        } catch (InvalidInputException e) {
            log.warn("Rejected analysis request: {}", e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during analysis", e);
            return internalError(e);
        } finally {
            AnalysisWarnings.clear();
        }
    }

    /**
     * Runs the analysis and returns a copy-ready cover letter prompt built from it.
     *
     * <p>Endpoint: POST /api/analyze/prompt
     */
    @PostMapping(value = "/analyze/prompt", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> coverLetterPrompt(@RequestBody AnalysisRequest request) {
        log.info("Received cover letter prompt request ({} posting characters)", postingLength(request));

        AnalysisWarnings warnings = AnalysisWarnings.start();
        try {
            AnalysisResult result = engine.runAnalysis(request.profile(), request.jobPostingText());
            String prompt = promptBuilder.build(result, request.jobPostingText());
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .headers(warningHeaders(warnings))
                    .body(prompt);

        } catch (InvalidInputException e) {
            log.warn("Rejected prompt request: {}", e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during prompt generation", e);
            return internalError(e);
        } finally {
            AnalysisWarnings.clear();
        }
    }

    /**
     * Anonymous usage counters.
     *
     * <p>Endpoint: GET /api/statistics
     */
    @GetMapping("/statistics")
    public ResponseEntity<UsageStatistics> statistics() {
        return ResponseEntity.ok(statisticsService.getStatistics());
    }

    /**
     * Resets all usage counters to zero.
     *
     * <p>Endpoint: DELETE /api/statistics
     */
    @DeleteMapping("/statistics")
    public ResponseEntity<?> resetStatistics() {
        try {
            statisticsService.resetStatistics();
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            log.error("Error resetting statistics", e);
            return internalError(e);
        }
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "jobfit",
                "statistics", statisticsService.isEnabled() ? "enabled" : "disabled",
                "cachedResults", resultCache.size()
        ));
    }

    private static HttpHeaders warningHeaders(AnalysisWarnings warnings) {
        HttpHeaders h = new HttpHeaders();
        h.set(WARNINGS_COUNT_HEADER, String.valueOf(warnings.count()));
        if (warnings.count() > 0) {
            h.set(WARNINGS_HEADER, warnings.asHeaderValue(MAX_WARNINGS_HEADER_CHARS));
        }
        return h;
    }

    private static int postingLength(AnalysisRequest request) {
        return request.jobPostingText() != null ? request.jobPostingText().length() : 0;
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Invalid input",
                "message", message
        ));
    }

    private ResponseEntity<Map<String, String>> internalError(Exception e) {
        return ResponseEntity.internalServerError().body(Map.of(
                "error", "Error during analysis",
                "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
        ));
    }
}
