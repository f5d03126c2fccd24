package com.gentrade.backtester.infrastructure.persistence;

import com.gentrade.backtester.repository.BacktestJobRepository;
import com.gentrade.backtester.repository.StrategyRepository;
import com.gentrade.backtester.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransactionScopeManager commit and rollback behaviour.
 */
@ExtendWith(MockitoExtension.class)
class TransactionScopeManagerTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private BacktestJobRepository jobRepository;

    @Mock
    private StrategyRepository strategyRepository;

    @Mock
    private UserRepository userRepository;

    private TransactionScopeManager scopeManager;
    private SimpleTransactionStatus status;

    @BeforeEach
    void setUp() {
        status = new SimpleTransactionStatus(true);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        scopeManager = new TransactionScopeManager(transactionManager, jobRepository, strategyRepository, userRepository);
    }

    @Test
    void testWithScope_CommitsOnNormalReturn() {
        // Act
        String result = scopeManager.withScope(uow -> {
            assertSame(jobRepository, uow.jobs());
            assertSame(strategyRepository, uow.strategies());
            assertSame(userRepository, uow.users());
            return "done";
        });

        // Assert
        assertEquals("done", result);
        verify(transactionManager).commit(status);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void testWithScope_RollsBackAndRethrowsSameException() {
        // Arrange
        IllegalStateException failure = new IllegalStateException("write failed");

        // Act
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> scopeManager.withScope(uow -> {
                    throw failure;
                }));

        // Assert
        assertSame(failure, thrown);
        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void testWithScope_EveryScopeIsNewReadCommittedTransaction() {
        // Act
        scopeManager.inScope(uow -> scopeManager.withReadOnlyScope(inner -> null));

        // Assert
        ArgumentCaptor<TransactionDefinition> definitions = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager, times(2)).getTransaction(definitions.capture());
        List<TransactionDefinition> captured = definitions.getAllValues();

        assertEquals(TransactionDefinition.PROPAGATION_REQUIRES_NEW, captured.get(0).getPropagationBehavior());
        assertEquals(TransactionDefinition.ISOLATION_READ_COMMITTED, captured.get(0).getIsolationLevel());
        assertFalse(captured.get(0).isReadOnly());

        assertEquals(TransactionDefinition.PROPAGATION_REQUIRES_NEW, captured.get(1).getPropagationBehavior());
        assertTrue(captured.get(1).isReadOnly());

        verify(transactionManager, times(2)).commit(status);
    }

    @Test
    void testMarkRollbackOnly_ReturnsResultButRollsBack() {
        // Act
        Integer result = scopeManager.withScope(uow -> {
            uow.markRollbackOnly();
            return 1;
        });

        // Assert
        assertEquals(1, result);
        assertTrue(status.isRollbackOnly());
    }
}
