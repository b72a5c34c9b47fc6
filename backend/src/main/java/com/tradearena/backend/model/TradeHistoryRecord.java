package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trade_history", uniqueConstraints = {
        @UniqueConstraint(name = "uk_trade_history_position", columnNames = "position_id")
}, indexes = {
        @Index(name = "idx_trade_history_contest", columnList = "contest_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", nullable = false)
    private Long positionId;

    @Column(name = "contest_id", nullable = false)
    private Long contestId;

    @Column(nullable = false)
    private Long participantId;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Position.Side side;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal entryPrice;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal exitPrice;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal priceChange;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnlPct;

    @Column(nullable = false)
    private int leverage;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal marginUsed;

    @Column(nullable = false)
    private long holdingTimeSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Position.CloseReason closeReason;

    @Column(nullable = false)
    private boolean winner;

    @Column(nullable = false)
    private Instant openedAt;

    @Column(nullable = false)
    private Instant closedAt;
}
