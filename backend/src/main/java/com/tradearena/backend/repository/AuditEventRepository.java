package com.tradearena.backend.repository;

import com.tradearena.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {
    List<AuditEvent> findByContestIdOrderByCreatedAtAscIdAsc(Long contestId);
}
