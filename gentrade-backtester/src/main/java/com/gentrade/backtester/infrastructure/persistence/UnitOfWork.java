package com.gentrade.backtester.infrastructure.persistence;

import com.gentrade.backtester.repository.BacktestJobRepository;
import com.gentrade.backtester.repository.StrategyRepository;
import com.gentrade.backtester.repository.UserRepository;
import org.springframework.transaction.TransactionStatus;

/**
 * Repository handle bound to one transactional scope.
 * Only valid while the scope that created it is open.
 */
public class UnitOfWork {

    private final BacktestJobRepository jobs;
    private final StrategyRepository strategies;
    private final UserRepository users;
    private final TransactionStatus transaction;

    UnitOfWork(BacktestJobRepository jobs,
               StrategyRepository strategies,
               UserRepository users,
               TransactionStatus transaction) {
        this.jobs = jobs;
        this.strategies = strategies;
        this.users = users;
        this.transaction = transaction;
    }

    public BacktestJobRepository jobs() {
        return jobs;
    }

    public StrategyRepository strategies() {
        return strategies;
    }

    public UserRepository users() {
        return users;
    }

    /**
     * Roll the scope back on exit even though the operation returns normally.
     */
    public void markRollbackOnly() {
        transaction.setRollbackOnly();
    }
}
