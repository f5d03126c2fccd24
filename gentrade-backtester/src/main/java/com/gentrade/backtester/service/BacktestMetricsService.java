package com.gentrade.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest submission and execution metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter jobsSubmittedCounter;
    private final Counter jobsFinishedCounter;
    private final Counter brokerRejectedCounter;
    private final Timer executionTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.jobsSubmittedCounter = Counter.builder("backtest.jobs.submitted")
                .description("Backtest jobs accepted and handed to the broker")
                .register(meterRegistry);

        this.jobsFinishedCounter = Counter.builder("backtest.jobs.finished")
                .description("Backtest jobs that produced a result artifact")
                .register(meterRegistry);

        this.brokerRejectedCounter = Counter.builder("backtest.broker.rejected")
                .description("Submissions the broker did not confirm")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("backtest.execution.time")
                .description("Backtest job execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    public void recordJobSubmitted() {
        jobsSubmittedCounter.increment();
    }

    public void recordBrokerRejected() {
        brokerRejectedCounter.increment();
    }

    /**
     * Record a successful job completion with execution time.
     */
    public void recordJobFinished(long executionTimeMs) {
        jobsFinishedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a job that ended in {@code failed}, tagged with the stage it failed in.
     */
    public void recordJobFailed(String stage) {
        Counter.builder("backtest.jobs.failed")
                .description("Backtest jobs that ended in the failed state")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a job body that ended with an unexpected error on the dispatch loop.
     */
    public void recordDispatchFailure(Throwable error) {
        Counter.builder("backtest.dispatch.failures")
                .description("Job bodies that ended with an unexpected error")
                .tag("exception", error.getClass().getSimpleName())
                .register(meterRegistry)
                .increment();
    }
}
