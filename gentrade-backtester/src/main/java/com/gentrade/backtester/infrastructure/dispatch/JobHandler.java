package com.gentrade.backtester.infrastructure.dispatch;

import com.gentrade.backtester.domain.BacktestJobMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Body of a job, run by a {@link JobDispatchLoop} inside a fresh {@link ExecutionContext}.
 */
public interface JobHandler {

    /**
     * Start processing the job. All asynchronous work must be scheduled on
     * {@code context}; the returned future completes when the job is done.
     *
     * @param message the decoded broker message
     * @param context the execution context owned by this job
     * @return completion of the job body, exceptional if the body failed
     */
    CompletableFuture<Void> handle(BacktestJobMessage message, ExecutionContext context);
}
