package com.gentrade.backtester.repository;

import com.gentrade.backtester.domain.BacktestJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for BacktestJob entity.
 * Provides data access operations for backtest jobs.
 */
@Repository
public interface BacktestJobRepository extends JpaRepository<BacktestJob, Long> {

    /**
     * Find and lock a job by ID for update (pessimistic write lock).
     * Serializes status transitions on the same row.
     *
     * @param id the job ID
     * @return Optional containing the locked job if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM BacktestJob j WHERE j.id = :id")
    Optional<BacktestJob> findByIdForUpdate(@Param("id") Long id);
}
