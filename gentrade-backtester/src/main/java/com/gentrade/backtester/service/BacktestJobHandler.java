package com.gentrade.backtester.service;

import com.gentrade.backtester.domain.BacktestJob;
import com.gentrade.backtester.domain.BacktestJobMessage;
import com.gentrade.backtester.domain.JobStatus;
import com.gentrade.backtester.domain.Strategy;
import com.gentrade.backtester.infrastructure.container.ContainerExecutionAdapter;
import com.gentrade.backtester.infrastructure.container.ContainerExecutionException;
import com.gentrade.backtester.infrastructure.container.ExecutionEnvironment;
import com.gentrade.backtester.infrastructure.dispatch.ExecutionContext;
import com.gentrade.backtester.infrastructure.dispatch.JobHandler;
import com.gentrade.backtester.infrastructure.persistence.TransactionScopeManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Worker side of the backtest lifecycle.
 *
 * <p>Drives one job through {@code created -> downloading_data -> running -> finished}
 * as a chain of steps on the job's execution context. Every status change commits in
 * its own scope under a row lock, so progress is visible to readers as it happens.
 * Data preparation and container failures end the job in {@code failed} and complete
 * normally; anything else also fails the job and is rethrown to the dispatch loop.
 */
@Service
@Slf4j
public class BacktestJobHandler implements JobHandler {

    static final String WORKER_STOPPED = "Worker stopped before the backtest completed";

    private final TransactionScopeManager scopeManager;
    private final MarketDataPreparer marketDataPreparer;
    private final ContainerExecutionAdapter executionAdapter;
    private final BacktestMetricsService metricsService;
    private final Path userdataRoot;

    public BacktestJobHandler(TransactionScopeManager scopeManager,
                              MarketDataPreparer marketDataPreparer,
                              ContainerExecutionAdapter executionAdapter,
                              BacktestMetricsService metricsService,
                              @Value("${backtest.freqtrade.userdata-dir:ft_userdata}") Path userdataRoot) {
        this.scopeManager = scopeManager;
        this.marketDataPreparer = marketDataPreparer;
        this.executionAdapter = executionAdapter;
        this.metricsService = metricsService;
        this.userdataRoot = userdataRoot;
    }

    @Override
    public CompletableFuture<Void> handle(BacktestJobMessage message, ExecutionContext context) {
        long startedAt = System.currentTimeMillis();
        Long jobId = message.getJobId();

        return context.supplyAsync(() -> claim(message, context.isRedelivered()))
                .thenCompose(run -> next(context, run, this::prepareData))
                .thenCompose(run -> next(context, run, this::startRun))
                .thenCompose(run -> next(context, run, r -> execute(r, startedAt)))
                .thenAccept(artifact -> log.debug("Job {} pipeline done in {}", jobId, context.getName()))
                .exceptionallyCompose(error -> failUnexpectedly(jobId, error));
    }

    /**
     * Lock the job and take it from {@code created} to {@code downloading_data}.
     * Returns null when there is nothing to do for this delivery.
     */
    private JobRun claim(BacktestJobMessage message, boolean redelivered) {
        Long jobId = message.getJobId();
        return scopeManager.withScope(uow -> {
            Optional<BacktestJob> found = uow.jobs().findByIdForUpdate(jobId);
            if (found.isEmpty()) {
                log.warn("Job {} no longer exists, dropping message", jobId);
                return null;
            }

            BacktestJob job = found.get();
            if (job.getStatus().isTerminal()) {
                log.info("Job {} already {}, nothing to do", jobId, job.getStatus().value());
                return null;
            }
            if (job.getStatus() != JobStatus.CREATED) {
                if (redelivered) {
                    log.warn("Job {} was left in {} by a stopped worker, marking failed",
                            jobId, job.getStatus().value());
                    job.fail(WORKER_STOPPED);
                    uow.jobs().save(job);
                    metricsService.recordJobFailed("redelivery");
                } else {
                    log.info("Job {} is {} on another worker, skipping", jobId, job.getStatus().value());
                }
                return null;
            }

            Optional<Strategy> strategy = uow.strategies().findById(job.getStrategyId());
            if (strategy.isEmpty()) {
                log.warn("Strategy {} of job {} no longer exists, dropping message", job.getStrategyId(), jobId);
                return null;
            }

            job.advanceTo(JobStatus.DOWNLOADING_DATA);
            uow.jobs().save(job);
            log.info("Started");

            return new JobRun(jobId, strategy.get(), job.getDateRange(),
                    ExecutionEnvironment.forUser(userdataRoot, message.getPrincipalId()));
        });
    }

    private JobRun prepareData(JobRun run) {
        try {
            marketDataPreparer.prepare(run.getEnvironment(), run.getStrategy(), run.getDateRange());
            return run;
        } catch (RuntimeException e) {
            log.error("Data preparation failed for job {}: {}", run.getJobId(), e.getMessage(), e);
            failJob(run.getJobId(), "Data preparation failed: " + e.getMessage(), "data_preparation");
            return null;
        }
    }

    private JobRun startRun(JobRun run) {
        boolean advanced = transition(run.getJobId(), job -> job.advanceTo(JobStatus.RUNNING));
        return advanced ? run : null;
    }

    private Path execute(JobRun run, long startedAt) {
        Path artifact;
        try {
            artifact = executionAdapter.execute(run.getEnvironment(), run.getStrategy().getFile(), run.getDateRange());
        } catch (ContainerExecutionException e) {
            log.error("Backtest execution failed for job {} [{}]: {}",
                    run.getJobId(), e.getFailureCause(), e.getMessage());
            failJob(run.getJobId(),
                    "Backtest execution failed [" + e.getFailureCause() + "]: " + e.getMessage(), "execution");
            return null;
        } catch (RuntimeException e) {
            log.error("Backtest execution failed for job {}: {}", run.getJobId(), e.getMessage(), e);
            failJob(run.getJobId(), "Backtest execution failed: " + e.getMessage(), "execution");
            return null;
        }

        if (transition(run.getJobId(), job -> job.finish(artifact.toString()))) {
            long executionTimeMs = System.currentTimeMillis() - startedAt;
            metricsService.recordJobFinished(executionTimeMs);
            log.info("Completed in {} ms", executionTimeMs);
        }
        return artifact;
    }

    private CompletableFuture<Void> failUnexpectedly(Long jobId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        log.error("Unexpected error while running job {}: {}", jobId, cause.getMessage(), cause);
        try {
            failJob(jobId, "Unexpected error: " + cause.getMessage(), "unexpected");
        } catch (RuntimeException e) {
            log.error("Could not mark job {} failed", jobId, e);
            cause.addSuppressed(e);
        }
        return CompletableFuture.failedFuture(cause);
    }

    private void failJob(Long jobId, String reason, String stage) {
        boolean failed = scopeManager.withScope(uow -> uow.jobs().findByIdForUpdate(jobId)
                .filter(job -> !job.getStatus().isTerminal())
                .map(job -> {
                    job.fail(reason);
                    uow.jobs().save(job);
                    return true;
                })
                .orElse(false));
        if (failed) {
            metricsService.recordJobFailed(stage);
        }
    }

    /**
     * Apply {@code change} to the locked row. False when the row is gone.
     */
    private boolean transition(Long jobId, Consumer<BacktestJob> change) {
        return scopeManager.withScope(uow -> uow.jobs().findByIdForUpdate(jobId)
                .map(job -> {
                    change.accept(job);
                    uow.jobs().save(job);
                    return true;
                })
                .orElseGet(() -> {
                    log.warn("Job {} disappeared mid-pipeline, stopping", jobId);
                    return false;
                }));
    }

    private static <T, R> CompletableFuture<R> next(ExecutionContext context, T input, Function<T, R> step) {
        if (input == null) {
            return CompletableFuture.completedFuture(null);
        }
        return context.supplyAsync(() -> step.apply(input));
    }

    @lombok.Value
    static class JobRun {
        Long jobId;
        Strategy strategy;
        String dateRange;
        ExecutionEnvironment environment;
    }
}
