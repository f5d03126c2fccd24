package com.gentrade.backtester.infrastructure.container;

import java.nio.file.Path;

/**
 * Runs a backtest for a strategy inside the user's isolated container environment.
 */
public interface ContainerExecutionAdapter {

    /**
     * Run the strategy named by {@code reference} over {@code dateRange} and return the
     * host path of the result artifact.
     *
     * @throws ContainerExecutionException when the run fails for a classified reason
     * @throws IllegalStateException when the strategy file is not in the sandbox
     */
    Path execute(ExecutionEnvironment environment, String reference, String dateRange);
}
