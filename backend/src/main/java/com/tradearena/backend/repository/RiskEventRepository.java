package com.tradearena.backend.repository;

import com.tradearena.backend.model.RiskEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RiskEventRepository extends JpaRepository<RiskEvent, Long> {
    List<RiskEvent> findByParticipantIdOrderByCreatedAtAscIdAsc(Long participantId);
}
