package com.gentrade.backtester.repository;

import com.gentrade.backtester.domain.Strategy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to strategies owned by the strategy service.
 */
@Repository
public interface StrategyRepository extends JpaRepository<Strategy, Long> {
}
