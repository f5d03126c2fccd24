package com.gentrade.backtester.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the backtest, strategy and user tables.
 * Transaction boundaries are drawn by TransactionScopeManager rather than
 * by annotations on service methods.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.gentrade.backtester.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
