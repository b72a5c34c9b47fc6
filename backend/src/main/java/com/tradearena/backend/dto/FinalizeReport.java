package com.tradearena.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.LeaderboardEntry;

import java.util.List;

/**
 * Result of a finalize attempt. {@code leaderboard} is read back from the stored snapshot, so a
 * completed contest always reports the same rows.
 */
public record FinalizeReport(
        Long contestId,
        Contest.Status status,
        List<LeaderboardEntry> leaderboard,
        BatchResult batch
) {
    @JsonProperty
    public boolean completed() {
        return status == Contest.Status.COMPLETED;
    }
}
