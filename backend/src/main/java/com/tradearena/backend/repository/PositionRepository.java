package com.tradearena.backend.repository;

import com.tradearena.backend.model.Position;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    List<Position> findByParticipantIdAndStatusOrderByIdAsc(Long participantId, Position.Status status);

    List<Position> findByContestIdAndStatus(Long contestId, Position.Status status);

    long countByParticipantIdAndStatus(Long participantId, Position.Status status);

    @Query("select distinct p.participantId from Position p where p.status = :status")
    List<Long> findParticipantIdsByPositionStatus(@Param("status") Position.Status status);
}
