package com.gentrade.backtester.infrastructure.broker;

/**
 * Submits job messages to the message broker.
 */
public interface BrokerConnectionPool {

    /**
     * Publish a job message and wait for the broker to confirm it.
     *
     * @param jobId   the job the payload refers to
     * @param payload the encoded job message
     * @return confirmation details
     * @throws com.gentrade.backtester.exception.BrokerUnavailableException if the
     *         broker could not confirm the message after one reconnect
     */
    DeliveryResult submit(Long jobId, String payload);
}
