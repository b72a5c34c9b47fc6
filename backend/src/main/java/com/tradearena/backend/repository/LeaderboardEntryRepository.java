package com.tradearena.backend.repository;

import com.tradearena.backend.model.LeaderboardEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LeaderboardEntryRepository extends JpaRepository<LeaderboardEntry, Long> {

    List<LeaderboardEntry> findByContestIdOrderByDisplayOrderAsc(Long contestId);

    Optional<LeaderboardEntry> findByContestIdAndParticipantId(Long contestId, Long participantId);
}
