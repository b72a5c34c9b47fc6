package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A leveraged exposure inside a contest. Transitions OPEN to CLOSED exactly once.
 */
@Entity
@Table(name = "positions", indexes = {
        @Index(name = "idx_positions_participant_status", columnList = "participant_id, status"),
        @Index(name = "idx_positions_contest_status", columnList = "contest_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contest_id", nullable = false)
    private Long contestId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Side side;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal entryPrice;

    @Column(precision = 19, scale = 6)
    private BigDecimal currentPrice;

    @Column(precision = 19, scale = 6)
    private BigDecimal exitPrice;

    @Column(nullable = false)
    private int leverage;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal marginUsed;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(precision = 19, scale = 6)
    private BigDecimal stopLoss;

    @Column(precision = 19, scale = 6)
    private BigDecimal takeProfit;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Status status;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private CloseReason closeReason;

    @Column(nullable = false)
    private Instant openedAt;

    private Instant closedAt;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == Status.OPEN;
    }

    public enum Side {
        LONG,
        SHORT
    }

    public enum Status {
        OPEN,
        CLOSED
    }

    public enum CloseReason {
        USER,
        STOP_LOSS,
        TAKE_PROFIT,
        MARGIN_CALL,
        CONTEST_END,
        ADMIN
    }
}
