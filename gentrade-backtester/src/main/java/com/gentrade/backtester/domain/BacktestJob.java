package com.gentrade.backtester.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Entity representing a backtest job in the system.
 * Tracks the lifecycle of a single backtest run of one strategy over one date range.
 * Status only moves forward; the result path is present exactly when the job finished.
 */
@Entity
@Table(name = "backtests", indexes = {
                @Index(name = "idx_backtests_status", columnList = "status"),
                @Index(name = "idx_backtests_strategy_id", columnList = "strategy_id"),
                @Index(name = "idx_backtests_created_at", columnList = "created_at")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestJob {

        private static final int MAX_ERROR_LENGTH = 1000;

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @Version
        @Column(name = "version")
        private Long version;

        @Column(name = "strategy_id", nullable = false, updatable = false)
        private Long strategyId;

        @Column(name = "date_range", nullable = false, updatable = false, length = 255)
        private String dateRange;

        @Convert(converter = JobStatusConverter.class)
        @Column(name = "status", nullable = false, length = 20)
        @Setter(AccessLevel.NONE)
        @Builder.Default
        private JobStatus status = JobStatus.CREATED;

        @Column(name = "result_path", length = 1024)
        @Setter(AccessLevel.NONE)
        private String resultPath;

        @Column(name = "error_message", columnDefinition = "TEXT")
        @Setter(AccessLevel.NONE)
        private String errorMessage;

        @CreatedDate
        @Column(name = "created_at", nullable = false, updatable = false)
        private LocalDateTime createdAt;

        @LastModifiedDate
        @Column(name = "updated_at", nullable = false)
        private LocalDateTime updatedAt;

        /**
         * Move to the next non-terminal stage of the pipeline.
         */
        public void advanceTo(JobStatus next) {
                if (next == JobStatus.FINISHED || next == JobStatus.FAILED) {
                        throw new IllegalArgumentException("Use finish() or fail() to reach " + next.value());
                }
                requireTransition(next);
                this.status = next;
                this.updatedAt = LocalDateTime.now();
        }

        /**
         * Record the result artifact and mark the job finished.
         */
        public void finish(String artifactPath) {
                if (artifactPath == null || artifactPath.isBlank()) {
                        throw new IllegalArgumentException("Finished backtest requires a result path");
                }
                requireTransition(JobStatus.FINISHED);
                this.status = JobStatus.FINISHED;
                this.resultPath = artifactPath;
                this.errorMessage = null;
                this.updatedAt = LocalDateTime.now();
        }

        /**
         * Mark the job failed with a human-readable cause.
         */
        public void fail(String reason) {
                requireTransition(JobStatus.FAILED);
                this.status = JobStatus.FAILED;
                this.resultPath = null;
                this.errorMessage = truncate(reason);
                this.updatedAt = LocalDateTime.now();
        }

        private void requireTransition(JobStatus next) {
                if (status == null || !status.canAdvanceTo(next)) {
                        throw new IllegalJobTransitionException(id, status, next);
                }
        }

        private static String truncate(String reason) {
                if (reason == null || reason.isBlank()) {
                        return "Unknown error";
                }
                // Keep the column bounded
                if (reason.length() > MAX_ERROR_LENGTH) {
                        return reason.substring(0, MAX_ERROR_LENGTH - 3) + "...";
                }
                return reason;
        }
}
