package com.gentrade.backtester.infrastructure.dispatch;

import com.gentrade.backtester.domain.BacktestJobMessage;
import com.gentrade.backtester.infrastructure.broker.JobMessageCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Background dispatch loop that takes job messages from the queue one at a time.
 * Each job runs to completion inside its own {@link ExecutionContext} before the next
 * message is taken. Messages are acknowledged once the job body has finished, whether
 * it succeeded or not; failures are additionally reported to the failure listener.
 */
@RequiredArgsConstructor
@Slf4j
public class JobDispatchLoop implements Runnable {

    private static final long ERROR_BACKOFF_MS = 1000;

    private final JobQueueConsumer queueConsumer;
    private final JobMessageCodec messageCodec;
    private final JobHandler jobHandler;
    private final DispatchFailureListener failureListener;
    private final String workerName;

    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started", workerName);

        redeliverUnacknowledged();

        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Delivery delivery = queueConsumer.receive(workerName);

                if (delivery != null) {
                    dispatch(delivery);
                }

            } catch (Exception e) {
                log.error("{} encountered error while polling queue: {}",
                        workerName, e.getMessage(), e);

                // Brief pause before retrying to avoid tight loop on persistent errors
                try {
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during error recovery", workerName);
                    break;
                }
            }
        }

        log.info("{} stopped", workerName);
    }

    /**
     * Finish what a previous run of this loop left unacknowledged.
     */
    private void redeliverUnacknowledged() {
        List<Delivery> leftovers;
        try {
            leftovers = queueConsumer.unacknowledged(workerName);
        } catch (Exception e) {
            log.error("{} could not read unacknowledged messages: {}", workerName, e.getMessage(), e);
            return;
        }

        if (!leftovers.isEmpty()) {
            log.warn("{} found {} unacknowledged message(s) from a previous run", workerName, leftovers.size());
        }
        for (Delivery delivery : leftovers) {
            if (!running || Thread.currentThread().isInterrupted()) {
                return;
            }
            dispatch(delivery);
        }
    }

    /**
     * Run a single delivery in a fresh execution context.
     */
    void dispatch(Delivery delivery) {
        MDC.put("worker", workerName);

        Throwable failure = null;
        boolean interrupted = false;

        try {
            BacktestJobMessage message = messageCodec.decode(delivery.getPayload());
            MDC.put("jobId", String.valueOf(message.getJobId()));
            log.info("{} received job (redelivered: {})", workerName, delivery.isRedelivered());

            try (ExecutionContext context = ExecutionContext.open(workerName, delivery.isRedelivered())) {
                CompletableFuture<Void> completion = jobHandler.handle(message, context);
                if (completion == null) {
                    throw new IllegalStateException("Job handler returned no completion");
                }
                completion.get();
            }

            log.info("{} finished job", workerName);

        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            // Shutting down mid-job: leave the message for redelivery
            Thread.currentThread().interrupt();
            interrupted = true;
            running = false;
            log.warn("{} interrupted while a job was in flight; message left unacknowledged", workerName);
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            try {
                if (!interrupted) {
                    acknowledge(delivery);
                }
                if (failure != null) {
                    failureListener.onJobFailure(workerName, delivery.getPayload(), failure);
                }
            } finally {
                MDC.remove("jobId");
                MDC.remove("worker");
            }
        }
    }

    private void acknowledge(Delivery delivery) {
        try {
            queueConsumer.acknowledge(workerName, delivery);
        } catch (RuntimeException e) {
            log.error("{} failed to acknowledge message: {}", workerName, e.getMessage(), e);
        }
    }

    /**
     * Gracefully stop the loop after the current job.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }

    public String getWorkerName() {
        return workerName;
    }
}
