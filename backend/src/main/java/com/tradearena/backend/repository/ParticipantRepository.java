package com.tradearena.backend.repository;

import com.tradearena.backend.model.Participant;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    Optional<Participant> findByContestIdAndUserId(Long contestId, Long userId);

    List<Participant> findByContestIdOrderByJoinedAtAscIdAsc(Long contestId);

    List<Participant> findByContestIdAndStatus(Long contestId, Participant.Status status);

    long countByContestId(Long contestId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Participant p where p.id = :id")
    Optional<Participant> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Participant p where p.contestId = :contestId and p.userId = :userId")
    Optional<Participant> findByContestIdAndUserIdForUpdate(@Param("contestId") Long contestId,
                                                            @Param("userId") Long userId);
}
