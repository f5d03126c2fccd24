package com.gentrade.backtester.domain;

/**
 * Raised when a job is asked to move backwards, skip a stage, or leave a terminal state.
 */
public class IllegalJobTransitionException extends IllegalStateException {

    private final Long jobId;
    private final JobStatus from;
    private final JobStatus to;

    public IllegalJobTransitionException(Long jobId, JobStatus from, JobStatus to) {
        super(String.format("Backtest %s cannot move from %s to %s", jobId,
                from == null ? null : from.value(), to == null ? null : to.value()));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public Long getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
