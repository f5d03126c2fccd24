package com.gentrade.backtester.service;

import com.gentrade.backtester.controller.dto.BacktestCreatedResponse;
import com.gentrade.backtester.controller.dto.BacktestView;
import com.gentrade.backtester.domain.BacktestJob;
import com.gentrade.backtester.domain.BacktestJobMessage;
import com.gentrade.backtester.exception.BrokerUnavailableException;
import com.gentrade.backtester.exception.InvalidRequestException;
import com.gentrade.backtester.infrastructure.broker.BrokerConnectionPool;
import com.gentrade.backtester.infrastructure.broker.DeliveryResult;
import com.gentrade.backtester.infrastructure.broker.JobMessageCodec;
import com.gentrade.backtester.infrastructure.persistence.TransactionScopeManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Implementation of BacktestService.
 *
 * <p>The job row is committed before the message is published, so a worker can never
 * receive a job it cannot read. If the broker then refuses the message the row stays
 * {@code created} and the caller sees {@link BrokerUnavailableException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private static final Pattern DATE_RANGE = Pattern.compile("\\d{8}-\\d{8}");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final TransactionScopeManager scopeManager;
    private final OwnershipGuard ownershipGuard;
    private final BrokerConnectionPool brokerPool;
    private final JobMessageCodec messageCodec;
    private final BacktestMetricsService metricsService;

    @Override
    public BacktestCreatedResponse create(String principalId, Long strategyId, String dateRange) {
        log.info("Received backtest request for strategy: {}, range: {}", strategyId, dateRange);

        validateDateRange(dateRange);

        BacktestJob job = scopeManager.withScope(uow -> {
            ownershipGuard.requireStrategy(uow, principalId, strategyId);
            return uow.jobs().save(BacktestJob.builder()
                    .strategyId(strategyId)
                    .dateRange(dateRange)
                    .build());
        });

        log.info("Created backtest job with ID: {}", job.getId());

        BacktestJobMessage message = BacktestJobMessage.builder()
                .jobId(job.getId())
                .strategyId(strategyId)
                .principalId(principalId)
                .dateRange(dateRange)
                .build();

        DeliveryResult delivery;
        try {
            delivery = brokerPool.submit(job.getId(), messageCodec.encode(message));
        } catch (BrokerUnavailableException e) {
            metricsService.recordBrokerRejected();
            log.error("Job {} stays created: broker did not accept it", job.getId(), e);
            throw e;
        }

        metricsService.recordJobSubmitted();
        log.info("Job {} submitted to {} (depth {}, attempts {})",
                job.getId(), delivery.getQueue(), delivery.getQueueDepth(), delivery.getAttempts());

        return BacktestCreatedResponse.builder()
                .jobId(job.getId())
                .build();
    }

    @Override
    public BacktestView get(String principalId, Long jobId) {
        return scopeManager.withReadOnlyScope(uow ->
                BacktestView.from(ownershipGuard.requireBacktest(uow, principalId, jobId)));
    }

    static void validateDateRange(String dateRange) {
        if (dateRange == null || !DATE_RANGE.matcher(dateRange).matches()) {
            throw new InvalidRequestException("Date range must be YYYYMMDD-YYYYMMDD",
                    Map.of("dateRange", String.valueOf(dateRange)));
        }
        try {
            LocalDate start = LocalDate.parse(dateRange.substring(0, 8), DATE_FORMAT);
            LocalDate end = LocalDate.parse(dateRange.substring(9), DATE_FORMAT);
            if (start.isAfter(end)) {
                throw new InvalidRequestException("Date range start must not be after its end",
                        Map.of("dateRange", dateRange));
            }
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Date range contains an invalid date",
                    Map.of("dateRange", dateRange));
        }
    }
}
