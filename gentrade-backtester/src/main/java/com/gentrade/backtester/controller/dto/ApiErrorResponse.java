package com.gentrade.backtester.controller.dto;

import com.gentrade.backtester.exception.ErrorCode;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every failed request.
 */
@Getter
@Builder
public class ApiErrorResponse {

    private final String code;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
