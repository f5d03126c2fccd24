package com.gentrade.backtester.infrastructure.persistence;

import com.gentrade.backtester.repository.BacktestJobRepository;
import com.gentrade.backtester.repository.StrategyRepository;
import com.gentrade.backtester.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs an operation inside its own database transaction.
 *
 * <p>Every call opens a new transaction (REQUIRES_NEW), so a scope requested from
 * inside another scope never joins it: the outer transaction is suspended and the
 * inner one commits or rolls back on its own connection. The operation's return
 * value commits the scope; any runtime exception or error rolls it back and is
 * rethrown unchanged.
 *
 * <p>The manager holds no per-operation state. The connection pool behind the
 * transaction manager is created at startup and closed at shutdown by Spring.
 */
@Component
@Slf4j
public class TransactionScopeManager {

    private final TransactionTemplate readWriteTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final BacktestJobRepository jobRepository;
    private final StrategyRepository strategyRepository;
    private final UserRepository userRepository;

    public TransactionScopeManager(PlatformTransactionManager transactionManager,
                                   BacktestJobRepository jobRepository,
                                   StrategyRepository strategyRepository,
                                   UserRepository userRepository) {
        this.readWriteTemplate = newTemplate(transactionManager, false);
        this.readOnlyTemplate = newTemplate(transactionManager, true);
        this.jobRepository = jobRepository;
        this.strategyRepository = strategyRepository;
        this.userRepository = userRepository;
    }

    /**
     * Run {@code operation} in a fresh read-write transaction and return its result.
     */
    public <T> T withScope(Function<UnitOfWork, T> operation) {
        return execute(readWriteTemplate, operation);
    }

    /**
     * Variant of {@link #withScope(Function)} for operations without a result.
     */
    public void inScope(Consumer<UnitOfWork> operation) {
        execute(readWriteTemplate, uow -> {
            operation.accept(uow);
            return null;
        });
    }

    /**
     * Run {@code operation} in a fresh read-only transaction.
     */
    public <T> T withReadOnlyScope(Function<UnitOfWork, T> operation) {
        return execute(readOnlyTemplate, operation);
    }

    private <T> T execute(TransactionTemplate template, Function<UnitOfWork, T> operation) {
        return template.execute(status -> {
            UnitOfWork uow = new UnitOfWork(jobRepository, strategyRepository, userRepository, status);
            try {
                return operation.apply(uow);
            } catch (RuntimeException | Error e) {
                log.debug("Rolling back scope after {}: {}", e.getClass().getSimpleName(), e.getMessage());
                throw e;
            }
        });
    }

    private static TransactionTemplate newTemplate(PlatformTransactionManager transactionManager, boolean readOnly) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setReadOnly(readOnly);
        return template;
    }
}
