package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * A time-boxed competition or 1v1 challenge. COMPLETED and CANCELLED are terminal.
 */
@Entity
@Table(name = "contests", indexes = {
        @Index(name = "idx_contests_status_end", columnList = "status, end_time"),
        @Index(name = "idx_contests_status_start", columnList = "status, start_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Contest {

    private static final Set<Status> JOINABLE = Set.of(Status.UPCOMING, Status.ACTIVE);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Type type;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Long organizerId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal entryFee;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal startingCapital;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal prizePool;

    @Column(nullable = false, precision = 7, scale = 4)
    private BigDecimal platformFeePct;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "contest_prize_tiers", joinColumns = @JoinColumn(name = "contest_id"))
    @Builder.Default
    private List<PrizeTier> prizeDistribution = new ArrayList<>();

    @Embedded
    private ContestRules rules;

    @Embedded
    private MarginThresholds marginThresholds;

    @Column(nullable = false)
    private int maxParticipants;

    @Column(nullable = false)
    private int currentParticipants;

    @Column(length = 500)
    private String cancellationReason;

    private Long challengedUserId;

    private Instant acceptDeadline;

    private Long durationSeconds;

    private Instant finalizedAt;

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

    public boolean isJoinable() {
        return JOINABLE.contains(status);
    }

    public boolean isTerminal() {
        return status == Status.COMPLETED || status == Status.CANCELLED;
    }

    public boolean hasEnded(Instant now) {
        return !now.isBefore(endTime);
    }

    public List<PrizeTier> sortedPrizeDistribution() {
        List<PrizeTier> sorted = new ArrayList<>(prizeDistribution);
        sorted.sort(Comparator.comparingInt(PrizeTier::getRank));
        return sorted;
    }

    public enum Type {
        COMPETITION,
        CHALLENGE
    }

    public enum Status {
        DRAFT,
        UPCOMING,
        ACTIVE,
        COMPLETED,
        CANCELLED
    }
}
