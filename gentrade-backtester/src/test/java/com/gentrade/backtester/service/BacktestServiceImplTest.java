package com.gentrade.backtester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentrade.backtester.controller.dto.BacktestCreatedResponse;
import com.gentrade.backtester.controller.dto.BacktestView;
import com.gentrade.backtester.domain.BacktestJob;
import com.gentrade.backtester.domain.BacktestJobMessage;
import com.gentrade.backtester.domain.JobStatus;
import com.gentrade.backtester.domain.Strategy;
import com.gentrade.backtester.domain.User;
import com.gentrade.backtester.exception.BrokerUnavailableException;
import com.gentrade.backtester.exception.ForbiddenException;
import com.gentrade.backtester.exception.InvalidRequestException;
import com.gentrade.backtester.exception.ResourceNotFoundException;
import com.gentrade.backtester.infrastructure.broker.BrokerConnectionPool;
import com.gentrade.backtester.infrastructure.broker.DeliveryResult;
import com.gentrade.backtester.infrastructure.broker.JobMessageCodec;
import com.gentrade.backtester.infrastructure.persistence.TransactionScopeManager;
import com.gentrade.backtester.repository.BacktestJobRepository;
import com.gentrade.backtester.repository.StrategyRepository;
import com.gentrade.backtester.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl focusing on submission ordering and ownership.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    private static final String PRINCIPAL = "user_alice";
    private static final String RANGE = "20240101-20240201";

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private BacktestJobRepository jobRepository;

    @Mock
    private StrategyRepository strategyRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private BrokerConnectionPool brokerPool;

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestServiceImpl backtestService;
    private JobMessageCodec codec;
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus(true));
        lenient().when(userRepository.findByClerkId(PRINCIPAL))
                .thenReturn(Optional.of(User.builder().id(1L).clerkId(PRINCIPAL).build()));
        lenient().when(strategyRepository.findById(7L))
                .thenReturn(Optional.of(Strategy.builder().id(7L).userId(1L).file("MomentumStrategy.py").build()));
        lenient().when(jobRepository.save(any(BacktestJob.class))).thenAnswer(invocation -> {
            BacktestJob job = invocation.getArgument(0);
            job.setId(ids.incrementAndGet());
            return job;
        });

        codec = new JobMessageCodec(new ObjectMapper());
        TransactionScopeManager scopeManager = new TransactionScopeManager(
                transactionManager, jobRepository, strategyRepository, userRepository);
        backtestService = new BacktestServiceImpl(scopeManager, new OwnershipGuard(), brokerPool, codec, metricsService);
    }

    @Test
    void testCreate_CommitsBeforeSubmitting() {
        // Arrange
        when(brokerPool.submit(anyLong(), anyString())).thenReturn(DeliveryResult.builder()
                .jobId(101L).queue("backtest-jobs").queueDepth(1).attempts(1).build());

        // Act
        BacktestCreatedResponse response = backtestService.create(PRINCIPAL, 7L, RANGE);

        // Assert
        assertEquals(101L, response.getJobId());

        InOrder order = inOrder(jobRepository, transactionManager, brokerPool);
        order.verify(jobRepository).save(any(BacktestJob.class));
        order.verify(transactionManager).commit(any());
        order.verify(brokerPool).submit(eq(101L), anyString());

        ArgumentCaptor<BacktestJob> saved = ArgumentCaptor.forClass(BacktestJob.class);
        verify(jobRepository).save(saved.capture());
        assertEquals(JobStatus.CREATED, saved.getValue().getStatus());
        assertEquals(7L, saved.getValue().getStrategyId());
        assertEquals(RANGE, saved.getValue().getDateRange());
        verify(metricsService).recordJobSubmitted();
    }

    @Test
    void testCreate_MessageCarriesJobDetails() {
        // Arrange
        when(brokerPool.submit(anyLong(), anyString())).thenReturn(DeliveryResult.builder()
                .jobId(101L).queue("backtest-jobs").queueDepth(1).attempts(1).build());

        // Act
        backtestService.create(PRINCIPAL, 7L, RANGE);

        // Assert
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(brokerPool).submit(eq(101L), payload.capture());
        BacktestJobMessage message = codec.decode(payload.getValue());
        assertEquals(101L, message.getJobId());
        assertEquals(7L, message.getStrategyId());
        assertEquals(PRINCIPAL, message.getPrincipalId());
        assertEquals(RANGE, message.getDateRange());
    }

    @Test
    void testCreate_EveryCallIsNewJob() {
        // Arrange
        when(brokerPool.submit(anyLong(), anyString())).thenReturn(DeliveryResult.builder()
                .jobId(0L).queue("backtest-jobs").queueDepth(1).attempts(1).build());

        // Act
        Long first = backtestService.create(PRINCIPAL, 7L, RANGE).getJobId();
        Long second = backtestService.create(PRINCIPAL, 7L, RANGE).getJobId();

        // Assert
        assertNotEquals(first, second);
        verify(jobRepository, times(2)).save(any(BacktestJob.class));
        verify(brokerPool, times(2)).submit(anyLong(), anyString());
    }

    @Test
    void testCreate_StrategyNotFoundCreatesNothing() {
        // Arrange
        when(strategyRepository.findById(99L)).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> backtestService.create(PRINCIPAL, 99L, RANGE));
        verify(jobRepository, never()).save(any());
        verify(transactionManager).rollback(any());
        verifyNoInteractions(brokerPool);
    }

    @Test
    void testCreate_OtherUsersStrategyForbidden() {
        // Arrange
        when(strategyRepository.findById(8L)).thenReturn(Optional.of(Strategy.builder().id(8L).userId(2L).build()));

        // Act & Assert
        assertThrows(ForbiddenException.class, () -> backtestService.create(PRINCIPAL, 8L, RANGE));
        verify(jobRepository, never()).save(any());
        verifyNoInteractions(brokerPool);
    }

    @Test
    void testCreate_BrokerUnavailableLeavesJobCreated() {
        // Arrange
        when(brokerPool.submit(anyLong(), anyString()))
                .thenThrow(new BrokerUnavailableException("Broker unavailable"));

        // Act
        assertThrows(BrokerUnavailableException.class, () -> backtestService.create(PRINCIPAL, 7L, RANGE));

        // Assert
        ArgumentCaptor<BacktestJob> saved = ArgumentCaptor.forClass(BacktestJob.class);
        verify(jobRepository).save(saved.capture());
        assertEquals(JobStatus.CREATED, saved.getValue().getStatus());
        verify(transactionManager).commit(any());
        verify(metricsService).recordBrokerRejected();
        verify(metricsService, never()).recordJobSubmitted();
    }

    @Test
    void testCreate_InvalidDateRangeRejectedUpFront() {
        assertThrows(InvalidRequestException.class, () -> backtestService.create(PRINCIPAL, 7L, "2024-01-01"));
        assertThrows(InvalidRequestException.class, () -> backtestService.create(PRINCIPAL, 7L, "20240301-20240201"));
        assertThrows(InvalidRequestException.class, () -> backtestService.create(PRINCIPAL, 7L, "20240230-20240301"));
        assertThrows(InvalidRequestException.class, () -> backtestService.create(PRINCIPAL, 7L, null));

        verifyNoInteractions(transactionManager, brokerPool);
    }

    @Test
    void testCreate_SingleDayRangeAccepted() {
        assertDoesNotThrow(() -> BacktestServiceImpl.validateDateRange("20240101-20240101"));
    }

    @Test
    void testGet_FinishedJobShowsArtifact() {
        // Arrange
        BacktestJob job = BacktestJob.builder()
                .id(5L)
                .strategyId(7L)
                .dateRange(RANGE)
                .status(JobStatus.FINISHED)
                .resultPath("/ft_userdata/user_alice/user_data/backtest_results/backtest-1.meta.json")
                .build();
        when(jobRepository.findById(5L)).thenReturn(Optional.of(job));

        // Act
        BacktestView view = backtestService.get(PRINCIPAL, 5L);

        // Assert
        assertEquals(JobStatus.FINISHED, view.getStatus());
        assertEquals(job.getResultPath(), view.getArtifactPath());
        assertNull(view.getErrorMessage());
    }

    @Test
    void testGet_FailedJobShowsErrorOnly() {
        // Arrange
        BacktestJob job = BacktestJob.builder()
                .id(6L)
                .strategyId(7L)
                .dateRange(RANGE)
                .status(JobStatus.FAILED)
                .errorMessage("Data preparation failed: no candles")
                .build();
        when(jobRepository.findById(6L)).thenReturn(Optional.of(job));

        // Act
        BacktestView view = backtestService.get(PRINCIPAL, 6L);

        // Assert
        assertEquals("Data preparation failed: no candles", view.getErrorMessage());
        assertNull(view.getArtifactPath());
    }

    @Test
    void testGet_UnknownJobNotFound() {
        when(jobRepository.findById(404L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> backtestService.get(PRINCIPAL, 404L));
    }
}
