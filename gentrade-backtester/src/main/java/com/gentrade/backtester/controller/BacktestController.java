package com.gentrade.backtester.controller;

import com.gentrade.backtester.controller.dto.BacktestCreatedResponse;
import com.gentrade.backtester.controller.dto.BacktestStartRequest;
import com.gentrade.backtester.controller.dto.BacktestView;
import com.gentrade.backtester.service.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for backtest job operations.
 * The caller's identity is set by the upstream auth layer in {@value #PRINCIPAL_HEADER}.
 */
@RestController
@RequestMapping("/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {

    public static final String PRINCIPAL_HEADER = "X-Principal-Id";

    private final BacktestService backtestService;

    /**
     * Start a backtest of one of the caller's strategies.
     *
     * @param principalId the authenticated principal
     * @param request     strategy and date range
     * @return the new job ID
     */
    @PostMapping
    public ResponseEntity<BacktestCreatedResponse> startBacktest(
            @RequestHeader(PRINCIPAL_HEADER) String principalId,
            @Valid @RequestBody BacktestStartRequest request) {

        log.info("POST /backtests - Strategy: {}, Range: {}", request.getStrategyId(), request.getDateRange());

        BacktestCreatedResponse response = backtestService.create(
                principalId, request.getStrategyId(), request.getDateRange());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Get the status of a backtest job.
     *
     * @param principalId the authenticated principal
     * @param jobId       the job ID
     * @return the job's status, artifact path or error message
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<BacktestView> getBacktest(
            @RequestHeader(PRINCIPAL_HEADER) String principalId,
            @PathVariable Long jobId) {

        log.debug("GET /backtests/{}", jobId);

        return ResponseEntity.ok(backtestService.get(principalId, jobId));
    }
}
