package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A withdrawal handed to the external payout provider. The credits leave the wallet when the
 * request is created; a FAILED outcome reverses them once.
 */
@Entity
@Table(name = "payout_requests", indexes = {
        @Index(name = "idx_payout_status_created", columnList = "status, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false)
    private Long ledgerTransactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(length = 128)
    private String providerReference;

    @Column(length = 500)
    private String failureReason;

    @Column(nullable = false)
    private boolean flaggedForReview;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public boolean isTerminal() {
        return status == Status.PAID || status == Status.FAILED;
    }

    public enum Status {
        PROCESSING,
        PAID,
        FAILED
    }
}
