package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One immutable credit movement. {@code balanceAfter = balanceBefore + amount} always holds;
 * only {@link #status} may change after insert.
 */
@Entity
@Table(name = "ledger_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_ledger_idempotency_key", columnNames = "idempotency_key"),
        indexes = {
                @Index(name = "idx_ledger_user_created", columnList = "user_id, created_at"),
                @Index(name = "idx_ledger_correlation", columnList = "correlation_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Type type;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balanceBefore;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balanceAfter;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "correlation_id", length = 128)
    private String correlationId;

    @Column(name = "idempotency_key", length = 160)
    private String idempotencyKey;

    @Column(length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum Type {
        DEPOSIT,
        WITHDRAWAL,
        ENTRY_FEE,
        PRIZE,
        REFUND,
        FEE,
        ADJUSTMENT,
        PAYOUT_REVERSAL
    }

    public enum Status {
        PENDING,
        COMPLETED,
        FAILED
    }
}
