package com.gentrade.backtester.infrastructure.container;

import lombok.Getter;

/**
 * A container run failed for a classified reason.
 */
@Getter
public class ContainerExecutionException extends RuntimeException {

    private final ExecutionFailureCause failureCause;

    public ContainerExecutionException(ExecutionFailureCause failureCause, String message) {
        super(message);
        this.failureCause = failureCause;
    }

    public ContainerExecutionException(ExecutionFailureCause failureCause, String message, Throwable cause) {
        super(message, cause);
        this.failureCause = failureCause;
    }
}
