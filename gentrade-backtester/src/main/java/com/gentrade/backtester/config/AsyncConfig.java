package com.gentrade.backtester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pool hosting the long-running dispatch loops.
 * Each loop owns one thread for its whole lifetime. Scheduling drives the consumer
 * heartbeats.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${backtest.worker.thread-count:3}")
    private int workerThreadCount;

    @Bean(name = "workerExecutorService")
    public ExecutorService workerExecutorService() {
        return Executors.newFixedThreadPool(Math.max(1, workerThreadCount),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("BacktestDispatch-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
