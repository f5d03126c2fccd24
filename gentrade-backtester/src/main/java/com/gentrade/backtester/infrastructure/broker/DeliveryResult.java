package com.gentrade.backtester.infrastructure.broker;

import lombok.Builder;
import lombok.Value;

/**
 * Broker confirmation for one submitted job.
 */
@Value
@Builder
public class DeliveryResult {

    Long jobId;
    String queue;

    /**
     * Queue length reported by the broker right after the publish.
     */
    long queueDepth;

    int attempts;
}
