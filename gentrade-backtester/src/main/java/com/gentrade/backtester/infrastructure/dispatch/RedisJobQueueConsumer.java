package com.gentrade.backtester.infrastructure.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Redis-based implementation of the JobQueueConsumer.
 * Uses BRPOPLPUSH to move each message atomically into a per-consumer processing
 * list, and LREM on that list as the acknowledgement. Messages left in a processing
 * list by a crashed worker are handed back to the same consumer on its next start.
 *
 * <p>Each consumer keeps an expiring heartbeat key. Processing lists whose consumer has
 * no live heartbeat belong to an instance that is gone; their messages are moved to a
 * redelivery list that every consumer drains before taking new messages.
 */
@Service
@Slf4j
public class RedisJobQueueConsumer implements JobQueueConsumer {

    private static final String PROCESSING_SUFFIX = ":processing:";
    private static final String HEARTBEAT_SUFFIX = ":consumer:";
    private static final String REDELIVER_SUFFIX = ":redeliver";

    private final StringRedisTemplate redisTemplate;
    private final String queueName;
    private final long pollTimeoutSeconds;

    public RedisJobQueueConsumer(StringRedisTemplate redisTemplate,
                                 @Value("${backtest.broker.queue:backtest-jobs}") String queueName,
                                 @Value("${backtest.worker.poll-timeout-seconds:1}") long pollTimeoutSeconds) {
        this.redisTemplate = redisTemplate;
        this.queueName = queueName;
        this.pollTimeoutSeconds = pollTimeoutSeconds;
    }

    @Override
    public Delivery receive(String consumer) {
        try {
            String reclaimed = redisTemplate.opsForList().rightPopAndLeftPush(redeliverKey(), processingKey(consumer));
            if (reclaimed != null) {
                log.info("{} took reclaimed message from {}", consumer, redeliverKey());
                return new Delivery(reclaimed, true);
            }

            String payload = redisTemplate.opsForList()
                    .rightPopAndLeftPush(queueName, processingKey(consumer), pollTimeoutSeconds, TimeUnit.SECONDS);
            if (payload == null) {
                return null;
            }
            log.debug("{} took message from {}", consumer, queueName);
            return new Delivery(payload, false);
        } catch (DataAccessException e) {
            log.error("Redis error while receiving from {}: {}", queueName, e.getMessage(), e);
            throw new IllegalStateException("Failed to receive job due to Redis error", e);
        }
    }

    @Override
    public void acknowledge(String consumer, Delivery delivery) {
        try {
            Long removed = redisTemplate.opsForList().remove(processingKey(consumer), 1, delivery.getPayload());
            if (removed == null || removed == 0) {
                log.warn("{} acknowledged a message that was not in its processing list", consumer);
            }
        } catch (DataAccessException e) {
            log.error("Redis error while acknowledging for {}: {}", consumer, e.getMessage(), e);
            throw new IllegalStateException("Failed to acknowledge job due to Redis error", e);
        }
    }

    @Override
    public List<Delivery> unacknowledged(String consumer) {
        List<String> payloads = redisTemplate.opsForList().range(processingKey(consumer), 0, -1);
        if (payloads == null || payloads.isEmpty()) {
            return List.of();
        }
        // LPUSH puts the newest message at the head
        List<String> oldestFirst = new ArrayList<>(payloads);
        Collections.reverse(oldestFirst);
        return oldestFirst.stream()
                .map(payload -> new Delivery(payload, true))
                .toList();
    }

    @Override
    public void heartbeat(String consumer, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(heartbeatKey(consumer), "alive", ttl);
        } catch (DataAccessException e) {
            log.error("Redis error while refreshing heartbeat of {}: {}", consumer, e.getMessage(), e);
            throw new IllegalStateException("Failed to refresh consumer heartbeat due to Redis error", e);
        }
    }

    @Override
    public int reclaimOrphaned() {
        String prefix = queueName + PROCESSING_SUFFIX;
        try {
            List<String> processingKeys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(100).build();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                while (cursor.hasNext()) {
                    processingKeys.add(cursor.next());
                }
            }

            int reclaimed = 0;
            for (String processingKey : processingKeys) {
                String consumer = processingKey.substring(prefix.length());
                if (Boolean.TRUE.equals(redisTemplate.hasKey(heartbeatKey(consumer)))) {
                    continue;
                }
                int moved = 0;
                // Oldest first: RPOPLPUSH takes the tail of the processing list
                while (redisTemplate.opsForList().rightPopAndLeftPush(processingKey, redeliverKey()) != null) {
                    moved++;
                }
                if (moved > 0) {
                    log.warn("Reclaimed {} unacknowledged messages of stopped consumer {}", moved, consumer);
                }
                reclaimed += moved;
            }
            return reclaimed;
        } catch (DataAccessException e) {
            log.error("Redis error while reclaiming orphaned messages from {}: {}", queueName, e.getMessage(), e);
            throw new IllegalStateException("Failed to reclaim orphaned jobs due to Redis error", e);
        }
    }

    String heartbeatKey(String consumer) {
        return queueName + HEARTBEAT_SUFFIX + consumer;
    }

    String redeliverKey() {
        return queueName + REDELIVER_SUFFIX;
    }

    String processingKey(String consumer) {
        return queueName + PROCESSING_SUFFIX + consumer;
    }
}
