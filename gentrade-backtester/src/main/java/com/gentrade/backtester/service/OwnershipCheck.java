package com.gentrade.backtester.service;

import com.gentrade.backtester.domain.User;
import com.gentrade.backtester.exception.ForbiddenException;
import com.gentrade.backtester.exception.ResourceNotFoundException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of an ownership check. Not-found and forbidden are never conflated.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OwnershipCheck<T> {

    public enum Outcome {
        GRANTED,
        NOT_FOUND,
        FORBIDDEN
    }

    private final Outcome outcome;
    private final User user;
    private final T resource;
    private final String resourceType;
    private final Object resourceId;

    static <T> OwnershipCheck<T> granted(User user, T resource, String resourceType, Object resourceId) {
        return new OwnershipCheck<>(Outcome.GRANTED, user, resource, resourceType, resourceId);
    }

    static <T> OwnershipCheck<T> notFound(User user, String resourceType, Object resourceId) {
        return new OwnershipCheck<>(Outcome.NOT_FOUND, user, null, resourceType, resourceId);
    }

    static <T> OwnershipCheck<T> forbidden(User user, String resourceType, Object resourceId) {
        return new OwnershipCheck<>(Outcome.FORBIDDEN, user, null, resourceType, resourceId);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }

    /**
     * The resource when granted, otherwise the matching domain exception.
     */
    public T orElseThrow() {
        switch (outcome) {
            case GRANTED:
                return resource;
            case NOT_FOUND:
                throw new ResourceNotFoundException(resourceType, resourceId);
            default:
                throw new ForbiddenException(resourceType, resourceId);
        }
    }
}
