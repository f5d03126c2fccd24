package com.gentrade.backtester.service;

import com.gentrade.backtester.controller.dto.BacktestCreatedResponse;
import com.gentrade.backtester.controller.dto.BacktestView;

/**
 * Service interface for backtest job submission and lookup.
 */
public interface BacktestService {

    /**
     * Create a backtest job for a strategy the principal owns and hand it to the broker.
     * Every call creates a new job.
     *
     * @param principalId the authenticated principal
     * @param strategyId  the strategy to backtest
     * @param dateRange   {@code YYYYMMDD-YYYYMMDD}
     * @return the id of the new job
     */
    BacktestCreatedResponse create(String principalId, Long strategyId, String dateRange);

    /**
     * Get a backtest job owned by the principal.
     *
     * @param principalId the authenticated principal
     * @param jobId       the job ID
     * @return the job's current state
     */
    BacktestView get(String principalId, Long jobId);
}
