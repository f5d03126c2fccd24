package com.gentrade.backtester.infrastructure.container;

/**
 * Classified reasons a container run did not produce a result.
 */
public enum ExecutionFailureCause {
    TIMEOUT,
    NON_ZERO_EXIT,
    MISSING_ARTIFACT,
    RUNTIME_UNAVAILABLE
}
