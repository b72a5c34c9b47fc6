package com.tradearena.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Final standing of one participant, written once when a contest completes.
 */
@Entity
@Table(name = "leaderboard_entries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_leaderboard_contest_participant", columnNames = {"contest_id", "participant_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contest_id", nullable = false)
    private Long contestId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(nullable = false)
    private Long userId;

    @Column(name = "rank_position", nullable = false)
    private int rank;

    @Column(nullable = false)
    private int displayOrder;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal finalCapital;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal pnl;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal pnlPercentage;

    @Column(nullable = false)
    private int totalTrades;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal winRate;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal prizeAmount;

    @Column(nullable = false)
    private boolean tied;

    @Column(nullable = false)
    private boolean qualified;

    @Column(length = 255)
    private String disqualificationReason;
}
