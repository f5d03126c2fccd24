package com.gentrade.backtester.infrastructure.broker;

import com.gentrade.backtester.exception.BrokerUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool of Redis connections used to publish job messages.
 *
 * <p>Messages are pushed onto a Redis list; the list length returned by LPUSH is the
 * delivery confirmation. Idle connections are checked with PING before reuse. A
 * connection that fails during a publish is closed instead of being returned, and the
 * publish is retried once on a freshly opened connection.
 *
 * <p>Thread-safe. At most {@code maxTotal} connections are borrowed at any time and at
 * most {@code maxIdle} are kept between submissions. The pool owns its connection factory
 * and destroys it on close; the factory must open a separate transport per connection.
 */
@Slf4j
public class RedisBrokerConnectionPool implements BrokerConnectionPool, AutoCloseable {

    private static final int MAX_ATTEMPTS = 2;

    private final RedisConnectionFactory connectionFactory;
    private final String queueName;
    private final byte[] queueKey;
    private final int maxIdle;
    private final Duration borrowTimeout;
    private final Semaphore permits;
    private final Deque<RedisConnection> idle = new ArrayDeque<>();
    private final Object lock = new Object();

    private volatile boolean closed;

    public RedisBrokerConnectionPool(RedisConnectionFactory connectionFactory,
                                     String queueName,
                                     int maxIdle,
                                     int maxTotal,
                                     Duration borrowTimeout) {
        if (maxTotal < 1) {
            throw new IllegalArgumentException("maxTotal must be at least 1");
        }
        if (maxIdle < 0 || maxIdle > maxTotal) {
            throw new IllegalArgumentException("maxIdle must be between 0 and maxTotal");
        }
        this.connectionFactory = connectionFactory;
        this.queueName = queueName;
        this.queueKey = queueName.getBytes(StandardCharsets.UTF_8);
        this.maxIdle = maxIdle;
        this.borrowTimeout = borrowTimeout;
        this.permits = new Semaphore(maxTotal, true);
    }

    @Override
    public DeliveryResult submit(Long jobId, String payload) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("Payload cannot be empty");
        }
        if (closed) {
            throw new BrokerUnavailableException("Broker connection pool is closed");
        }

        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            RedisConnection connection;
            try {
                // A retry never reuses a pooled connection
                connection = borrow(attempt > 1);
            } catch (DataAccessException e) {
                log.warn("Could not open broker connection for job {} (attempt {}/{}): {}",
                        jobId, attempt, MAX_ATTEMPTS, e.getMessage());
                lastFailure = e;
                continue;
            }

            boolean healthy = false;
            try {
                Long depth = connection.listCommands().lPush(queueKey, body);
                if (depth == null) {
                    lastFailure = new IllegalStateException("Broker did not confirm the publish");
                    log.warn("Publish of job {} was not confirmed (attempt {}/{})", jobId, attempt, MAX_ATTEMPTS);
                    continue;
                }
                healthy = true;
                log.info("Job {} submitted to queue {} (depth {}, attempt {})", jobId, queueName, depth, attempt);
                return DeliveryResult.builder()
                        .jobId(jobId)
                        .queue(queueName)
                        .queueDepth(depth)
                        .attempts(attempt)
                        .build();
            } catch (DataAccessException e) {
                log.warn("Broker connection failed while submitting job {} (attempt {}/{}): {}",
                        jobId, attempt, MAX_ATTEMPTS, e.getMessage());
                lastFailure = e;
            } finally {
                if (healthy) {
                    release(connection);
                } else {
                    discard(connection);
                }
            }
        }

        log.error("Broker unavailable, job {} was not submitted", jobId);
        throw new BrokerUnavailableException(
                "Broker unavailable: job " + jobId + " was not submitted after " + MAX_ATTEMPTS + " attempts",
                lastFailure);
    }

    /**
     * Number of idle connections currently kept by the pool.
     */
    public int idleCount() {
        synchronized (lock) {
            return idle.size();
        }
    }

    /**
     * Number of connections that can still be borrowed without waiting.
     */
    public int availablePermits() {
        return permits.availablePermits();
    }

    @Override
    public void close() {
        closed = true;
        synchronized (lock) {
            while (!idle.isEmpty()) {
                closeQuietly(idle.pop());
            }
        }
        if (connectionFactory instanceof DisposableBean) {
            try {
                ((DisposableBean) connectionFactory).destroy();
            } catch (Exception e) {
                log.warn("Error while shutting down broker connection factory: {}", e.getMessage());
            }
        }
        log.info("Broker connection pool for queue {} closed", queueName);
    }

    private RedisConnection borrow(boolean fresh) {
        acquirePermit();
        try {
            if (!fresh) {
                RedisConnection pooled;
                while ((pooled = pollIdle()) != null) {
                    if (isUsable(pooled)) {
                        return pooled;
                    }
                    log.debug("Discarding dead idle broker connection");
                    closeQuietly(pooled);
                }
            }
            return connectionFactory.getConnection();
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    private void acquirePermit() {
        try {
            if (!permits.tryAcquire(borrowTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new BrokerUnavailableException(
                        "No broker connection available within " + borrowTimeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while waiting for a broker connection", e);
        }
    }

    private RedisConnection pollIdle() {
        synchronized (lock) {
            return idle.poll();
        }
    }

    private boolean isUsable(RedisConnection connection) {
        try {
            return !connection.isClosed() && "PONG".equalsIgnoreCase(connection.ping());
        } catch (DataAccessException e) {
            log.debug("Idle broker connection failed health check: {}", e.getMessage());
            return false;
        }
    }

    private void release(RedisConnection connection) {
        boolean kept = false;
        synchronized (lock) {
            if (!closed && idle.size() < maxIdle) {
                idle.push(connection);
                kept = true;
            }
        }
        if (!kept) {
            closeQuietly(connection);
        }
        permits.release();
    }

    private void discard(RedisConnection connection) {
        closeQuietly(connection);
        permits.release();
    }

    private void closeQuietly(RedisConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.debug("Error while closing broker connection: {}", e.getMessage());
        }
    }
}
