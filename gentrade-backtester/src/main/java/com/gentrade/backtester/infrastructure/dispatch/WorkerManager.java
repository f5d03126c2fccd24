package com.gentrade.backtester.infrastructure.dispatch;

import com.gentrade.backtester.infrastructure.broker.JobMessageCodec;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages lifecycle of the dispatch loops.
 * Starts loops on application startup and gracefully shuts them down.
 * While running it keeps the loops' consumer heartbeats alive and reclaims messages
 * left behind by instances that stopped heartbeating.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerManager {

    private final ExecutorService workerExecutorService;
    private final JobQueueConsumer queueConsumer;
    private final JobMessageCodec messageCodec;
    private final JobHandler jobHandler;
    private final DispatchFailureListener failureListener;

    @Value("${backtest.worker.thread-count:3}")
    private int workerThreadCount;

    @Value("${backtest.worker.enabled:true}")
    private boolean workersEnabled;

    @Value("${backtest.worker.instance-id:local}")
    private String instanceId;

    @Value("${backtest.worker.heartbeat-ttl-seconds:30}")
    private long heartbeatTtlSeconds;

    private final List<JobDispatchLoop> loops = new ArrayList<>();
    private volatile boolean stopping;

    @PostConstruct
    public void startWorkers() {
        if (!workersEnabled) {
            log.info("Dispatch loops are disabled");
            return;
        }

        log.info("Starting {} dispatch loops for instance {}", workerThreadCount, instanceId);

        for (int i = 0; i < workerThreadCount; i++) {
            // Stable names: a restarted loop picks up its own unacknowledged messages
            String workerName = instanceId + "-dispatch-" + (i + 1);
            // Alive before the loop starts, so no other instance reclaims its leftovers
            queueConsumer.heartbeat(workerName, heartbeatTtl());
            JobDispatchLoop loop = new JobDispatchLoop(
                    queueConsumer,
                    messageCodec,
                    jobHandler,
                    failureListener,
                    workerName);

            loops.add(loop);
            workerExecutorService.submit(loop);

            log.info("Started {}", workerName);
        }
    }

    /**
     * Refresh this instance's heartbeats, then move the unacknowledged messages of dead
     * consumers to the redelivery list.
     */
    @Scheduled(fixedDelayString = "${backtest.worker.heartbeat-interval-ms:10000}")
    public void maintainConsumers() {
        if (stopping || loops.isEmpty()) {
            return;
        }
        try {
            for (JobDispatchLoop loop : loops) {
                queueConsumer.heartbeat(loop.getWorkerName(), heartbeatTtl());
            }
            int reclaimed = queueConsumer.reclaimOrphaned();
            if (reclaimed > 0) {
                log.warn("Reclaimed {} messages from stopped consumers", reclaimed);
            }
        } catch (RuntimeException e) {
            log.error("Consumer maintenance failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void stopWorkers() {
        log.info("Stopping all dispatch loops...");
        stopping = true;

        loops.forEach(JobDispatchLoop::stop);

        workerExecutorService.shutdown();

        try {
            if (!workerExecutorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Dispatch loops did not terminate gracefully, forcing shutdown");
                workerExecutorService.shutdownNow();
            } else {
                log.info("All dispatch loops stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for dispatch loops to stop", e);
            workerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Duration heartbeatTtl() {
        return Duration.ofSeconds(heartbeatTtlSeconds);
    }

    public List<JobDispatchLoop> getLoops() {
        return List.copyOf(loops);
    }
}
