package com.gentrade.backtester.infrastructure.dispatch;

import lombok.Value;

/**
 * One message taken from the job queue and not yet acknowledged.
 */
@Value
public class Delivery {

    String payload;

    /**
     * True when the message was left unacknowledged by an earlier run of the same consumer.
     */
    boolean redelivered;
}
