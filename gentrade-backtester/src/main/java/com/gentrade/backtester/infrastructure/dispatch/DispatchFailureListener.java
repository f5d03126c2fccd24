package com.gentrade.backtester.infrastructure.dispatch;

/**
 * Operational channel for job bodies that ended with an unrecovered failure.
 */
@FunctionalInterface
public interface DispatchFailureListener {

    void onJobFailure(String workerName, String payload, Throwable error);
}
