package com.gentrade.backtester.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a backtest of a stored strategy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestStartRequest {

    @NotNull(message = "Strategy ID is required")
    private Long strategyId;

    @NotBlank(message = "Date range is required")
    @Pattern(regexp = "\\d{8}-\\d{8}", message = "Date range must be YYYYMMDD-YYYYMMDD")
    private String dateRange;
}
