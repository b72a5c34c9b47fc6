package com.tradearena.backend.repository;

import com.tradearena.backend.model.TradeHistoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TradeHistoryRecordRepository extends JpaRepository<TradeHistoryRecord, Long> {

    Optional<TradeHistoryRecord> findByPositionId(Long positionId);

    List<TradeHistoryRecord> findByContestIdOrderByClosedAtAscIdAsc(Long contestId);

    long countByPositionId(Long positionId);
}
