package com.gentrade.backtester.infrastructure.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Asynchronous runtime for exactly one job.
 *
 * <p>Each context owns a private single-thread executor, so the steps of a job run one
 * after another and nothing they hold (a transaction, a container process) is visible
 * to another job. The logging MDC of the opening thread is copied into every step.
 * Closing the context interrupts whatever is still running and discards the executor;
 * a closed context cannot be reused.
 */
@Slf4j
public final class ExecutionContext implements AutoCloseable {

    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final String name;
    private final boolean redelivered;
    private final ExecutorService executor;
    private final Map<String, String> mdc;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ExecutionContext(String name, boolean redelivered) {
        this.name = name;
        this.redelivered = redelivered;
        this.mdc = MDC.getCopyOfContextMap();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r);
            thread.setName(name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Open a fresh context for one delivery on the given dispatch loop.
     */
    public static ExecutionContext open(String workerName, boolean redelivered) {
        String name = workerName + "-ctx-" + SEQUENCE.incrementAndGet();
        return new ExecutionContext(name, redelivered);
    }

    public <T> CompletableFuture<T> supplyAsync(Supplier<T> step) {
        ensureOpen();
        return CompletableFuture.supplyAsync(withMdc(step), executor);
    }

    public CompletableFuture<Void> runAsync(Runnable step) {
        return supplyAsync(() -> {
            step.run();
            return null;
        });
    }

    public String getName() {
        return name;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Execution context {} did not stop within {}s", name, SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing execution context {}", name);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Execution context " + name + " is closed");
        }
    }

    private <T> Supplier<T> withMdc(Supplier<T> step) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return step.get();
            } finally {
                MDC.clear();
            }
        };
    }
}
