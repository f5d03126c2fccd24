package com.gentrade.backtester.infrastructure.dispatch;

import java.time.Duration;
import java.util.List;

/**
 * Worker-side view of the job queue with explicit acknowledgement.
 */
public interface JobQueueConsumer {

    /**
     * Take the next message, holding it for {@code consumer} until acknowledged.
     *
     * @param consumer unique name of the dispatch loop
     * @return the delivery, or null if nothing arrived before the poll timeout
     */
    Delivery receive(String consumer);

    /**
     * Drop a delivery for good.
     */
    void acknowledge(String consumer, Delivery delivery);

    /**
     * Deliveries the same consumer took earlier but never acknowledged, oldest first.
     */
    List<Delivery> unacknowledged(String consumer);

    /**
     * Mark {@code consumer} alive for {@code ttl}.
     */
    void heartbeat(String consumer, Duration ttl);

    /**
     * Hand the unacknowledged messages of consumers whose heartbeat has expired back to
     * the queue, to be received again as redeliveries.
     *
     * @return number of messages reclaimed
     */
    int reclaimOrphaned();
}
