package com.gentrade.backtester.exception;

import java.util.Map;

/**
 * The job could not be handed to the broker. Safe to retry; a job row committed
 * before the attempt stays {@code created} until it is re-submitted.
 */
public class BrokerUnavailableException extends BaseException {

    public BrokerUnavailableException(String message) {
        super(ErrorCode.BROKER_UNAVAILABLE, message, Map.of("retryable", true));
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.BROKER_UNAVAILABLE, message, Map.of("retryable", true), cause);
    }
}
