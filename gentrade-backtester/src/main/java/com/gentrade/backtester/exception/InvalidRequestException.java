package com.gentrade.backtester.exception;

import java.util.Map;

public class InvalidRequestException extends BaseException {

    public InvalidRequestException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidRequestException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
