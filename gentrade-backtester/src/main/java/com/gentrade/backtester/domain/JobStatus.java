package com.gentrade.backtester.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status enum for backtest job lifecycle.
 * Declaration order is the success path; FINISHED and FAILED are terminal.
 */
public enum JobStatus {
    CREATED("created"),
    DOWNLOADING_DATA("downloading_data"),
    RUNNING("running"),
    FINISHED("finished"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    /**
     * Persisted and serialized representation.
     */
    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }

    /**
     * A job may only step to its immediate successor on the success path,
     * or drop to FAILED from any non-terminal state.
     */
    public boolean canAdvanceTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return switch (this) {
            case CREATED -> next == DOWNLOADING_DATA;
            case DOWNLOADING_DATA -> next == RUNNING;
            case RUNNING -> next == FINISHED;
            default -> false;
        };
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
