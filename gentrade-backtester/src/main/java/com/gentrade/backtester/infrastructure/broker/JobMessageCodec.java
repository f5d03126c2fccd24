package com.gentrade.backtester.infrastructure.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentrade.backtester.domain.BacktestJobMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON wire format for {@link BacktestJobMessage}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobMessageCodec {

    private final ObjectMapper objectMapper;

    public String encode(BacktestJobMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize job message for job {}", message.getJobId(), e);
            throw new IllegalStateException("Failed to serialize job message", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is not a complete job message
     */
    public BacktestJobMessage decode(String payload) {
        BacktestJobMessage message;
        try {
            message = objectMapper.readValue(payload, BacktestJobMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed job message: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.getJobId() == null || message.getStrategyId() == null
                || message.getPrincipalId() == null || message.getDateRange() == null) {
            throw new IllegalArgumentException("Incomplete job message: " + payload);
        }
        return message;
    }
}
