package com.gentrade.backtester.service;

import com.gentrade.backtester.domain.BacktestJob;
import com.gentrade.backtester.domain.Strategy;
import com.gentrade.backtester.domain.User;
import com.gentrade.backtester.exception.AuthenticationRequiredException;
import com.gentrade.backtester.infrastructure.persistence.UnitOfWork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Verifies that the calling principal owns a resource before an operation uses it.
 * Runs inside the caller's scope and reads through its unit of work.
 */
@Component
@Slf4j
public class OwnershipGuard {

    static final String STRATEGY = "Strategy";
    static final String BACKTEST = "Backtest";

    /**
     * Resolve the principal to a user, load the resource and compare owners.
     *
     * @param finder        loads the resource by id
     * @param ownerResolver maps the resource to its owning user id, or null when unknown
     * @throws AuthenticationRequiredException when the principal is not a registered user
     */
    public <T, ID> OwnershipCheck<T> check(UnitOfWork uow,
                                           String principalId,
                                           String resourceType,
                                           ID resourceId,
                                           BiFunction<UnitOfWork, ID, Optional<T>> finder,
                                           BiFunction<UnitOfWork, T, Long> ownerResolver) {
        User user = resolveUser(uow, principalId);

        Optional<T> resource = resourceId == null ? Optional.empty() : finder.apply(uow, resourceId);
        if (resource.isEmpty()) {
            log.debug("{} {} not found for user {}", resourceType, resourceId, user.getId());
            return OwnershipCheck.notFound(user, resourceType, resourceId);
        }

        Long ownerId = ownerResolver.apply(uow, resource.get());
        if (!Objects.equals(ownerId, user.getId())) {
            log.warn("User {} denied access to {} {}", user.getId(), resourceType, resourceId);
            return OwnershipCheck.forbidden(user, resourceType, resourceId);
        }

        return OwnershipCheck.granted(user, resource.get(), resourceType, resourceId);
    }

    public OwnershipCheck<Strategy> checkStrategy(UnitOfWork uow, String principalId, Long strategyId) {
        return check(uow, principalId, STRATEGY, strategyId,
                (u, id) -> u.strategies().findById(id),
                (u, strategy) -> strategy.getUserId());
    }

    /**
     * A backtest belongs to whoever owns its strategy.
     */
    public OwnershipCheck<BacktestJob> checkBacktest(UnitOfWork uow, String principalId, Long jobId) {
        return check(uow, principalId, BACKTEST, jobId,
                (u, id) -> u.jobs().findById(id),
                (u, job) -> u.strategies().findById(job.getStrategyId())
                        .map(Strategy::getUserId)
                        .orElse(null));
    }

    public Strategy requireStrategy(UnitOfWork uow, String principalId, Long strategyId) {
        return checkStrategy(uow, principalId, strategyId).orElseThrow();
    }

    public BacktestJob requireBacktest(UnitOfWork uow, String principalId, Long jobId) {
        return checkBacktest(uow, principalId, jobId).orElseThrow();
    }

    private User resolveUser(UnitOfWork uow, String principalId) {
        if (principalId == null || principalId.isBlank()) {
            throw new AuthenticationRequiredException("Authentication required");
        }
        return uow.users().findByClerkId(principalId)
                .orElseThrow(() -> new AuthenticationRequiredException("Unknown principal: " + principalId));
    }
}
