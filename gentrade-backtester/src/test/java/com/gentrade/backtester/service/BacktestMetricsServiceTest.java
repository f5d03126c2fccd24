package com.gentrade.backtester.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the backtest counters and timer.
 */
class BacktestMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private BacktestMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new BacktestMetricsService(registry);
    }

    @Test
    void testRecordJobFinished_CountsAndTimes() {
        metricsService.recordJobFinished(1500);
        metricsService.recordJobFinished(500);

        assertEquals(2.0, registry.get("backtest.jobs.finished").counter().count());
        assertEquals(2, registry.get("backtest.execution.time").timer().count());
        assertEquals(2000.0, registry.get("backtest.execution.time").timer().totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    void testRecordJobFailed_TaggedByStage() {
        metricsService.recordJobFailed("execution");
        metricsService.recordJobFailed("execution");
        metricsService.recordJobFailed("data_preparation");

        assertEquals(2.0, registry.get("backtest.jobs.failed").tag("stage", "execution").counter().count());
        assertEquals(1.0, registry.get("backtest.jobs.failed").tag("stage", "data_preparation").counter().count());
    }

    @Test
    void testRecordDispatchFailure_TaggedByException() {
        metricsService.recordDispatchFailure(new IllegalStateException("boom"));

        assertEquals(1.0, registry.get("backtest.dispatch.failures")
                .tag("exception", "IllegalStateException").counter().count());
    }

    @Test
    void testSubmissionCounters() {
        metricsService.recordJobSubmitted();
        metricsService.recordBrokerRejected();
        metricsService.recordBrokerRejected();

        assertEquals(1.0, registry.get("backtest.jobs.submitted").counter().count());
        assertEquals(2.0, registry.get("backtest.broker.rejected").counter().count());
    }
}
