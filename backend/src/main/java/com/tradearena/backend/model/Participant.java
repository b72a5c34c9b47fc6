package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "participants", uniqueConstraints = {
        @UniqueConstraint(name = "uk_participant_contest_user", columnNames = {"contest_id", "user_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contest_id", nullable = false)
    private Long contestId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal startingCapital;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal currentCapital;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal availableCapital;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal usedMargin;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal grossProfit;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal grossLoss;

    @Column(nullable = false)
    private int totalTrades;

    @Column(nullable = false)
    private int winningTrades;

    @Column(nullable = false)
    private int losingTrades;

    private Integer currentRank;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(nullable = false)
    private int marginCallWarnings;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private MarginStatus lastMarginStatus;

    @Column(precision = 19, scale = 4)
    private BigDecimal prizeAmount;

    @Column(length = 255)
    private String statusReason;

    @Column(nullable = false)
    private Instant joinedAt;

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (joinedAt == null) {
            joinedAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public BigDecimal getPnl() {
        return currentCapital.subtract(startingCapital);
    }

    public enum Status {
        ACTIVE,
        LIQUIDATED,
        DISQUALIFIED,
        COMPLETED,
        REFUNDED
    }
}
