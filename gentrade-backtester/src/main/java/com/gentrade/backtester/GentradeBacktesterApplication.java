package com.gentrade.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the backtest orchestration service.
 * Accepts backtest requests over HTTP and runs them on internal dispatch loops.
 */
@SpringBootApplication
public class GentradeBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(GentradeBacktesterApplication.class, args);
    }

}
