package com.gentrade.backtester.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Broker payload for one backtest job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestJobMessage {

    @JsonProperty("job_id")
    private Long jobId;

    @JsonProperty("strategy_id")
    private Long strategyId;

    @JsonProperty("principal_id")
    private String principalId;

    @JsonProperty("date_range")
    private String dateRange;
}
