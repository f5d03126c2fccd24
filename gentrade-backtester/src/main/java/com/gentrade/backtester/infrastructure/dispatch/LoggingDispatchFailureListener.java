package com.gentrade.backtester.infrastructure.dispatch;

import com.gentrade.backtester.service.BacktestMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs dispatch failures and counts them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingDispatchFailureListener implements DispatchFailureListener {

    private final BacktestMetricsService metricsService;

    @Override
    public void onJobFailure(String workerName, String payload, Throwable error) {
        log.error("{} job failed: {} - payload: {}", workerName, error.getMessage(), payload, error);
        metricsService.recordDispatchFailure(error);
    }
}
