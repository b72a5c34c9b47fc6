package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "credit_wallets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditWallet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long userId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalDeposited;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalWithdrawn;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalWon;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalSpent;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalRefunded;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
