package com.gentrade.backtester.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentrade.backtester.domain.BacktestJob;
import com.gentrade.backtester.domain.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Read model of a backtest job.
 * {@code artifactPath} is only present once finished, {@code errorMessage} only once failed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BacktestView {

    private Long id;
    private Long strategyId;
    private String dateRange;
    private JobStatus status;
    private String artifactPath;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static BacktestView from(BacktestJob job) {
        return BacktestView.builder()
                .id(job.getId())
                .strategyId(job.getStrategyId())
                .dateRange(job.getDateRange())
                .status(job.getStatus())
                .artifactPath(job.getStatus() == JobStatus.FINISHED ? job.getResultPath() : null)
                .errorMessage(job.getStatus() == JobStatus.FAILED ? job.getErrorMessage() : null)
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
