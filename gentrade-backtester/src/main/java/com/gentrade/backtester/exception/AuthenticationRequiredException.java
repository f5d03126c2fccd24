package com.gentrade.backtester.exception;

/**
 * The caller's principal does not map to a registered user.
 */
public class AuthenticationRequiredException extends BaseException {

    public AuthenticationRequiredException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
