package com.gentrade.backtester.exception;

public class ForbiddenException extends BaseException {

    public ForbiddenException(String resourceType, Object identifier) {
        super(ErrorCode.FORBIDDEN, String.format("%s %s belongs to another user", resourceType, identifier));
    }
}
