package com.gentrade.backtester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * A generated trading strategy owned by a user.
 * Maintained by the strategy service; this module only reads it.
 */
@Entity
@Table(name = "strategies", indexes = {
        @Index(name = "idx_strategies_user_id", columnList = "user_id")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Strategy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * Strategy file inside the owner's strategies directory.
     */
    @Column(name = "file", nullable = false, length = 255)
    private String file;

    @Column(name = "pairs", columnDefinition = "TEXT")
    private String pairs;

    @Column(name = "timeframes", length = 255)
    private String timeframes;

    @Column(name = "exchange", length = 50)
    @Builder.Default
    private String exchange = "binance";

    @Column(name = "trading_mode", length = 20)
    @Builder.Default
    private String tradingMode = "futures";

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public List<String> pairList() {
        return split(pairs);
    }

    public List<String> timeframeList() {
        return split(timeframes);
    }

    private static List<String> split(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
