package com.tradearena.backend.repository;

import com.tradearena.backend.model.LedgerTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    Optional<LedgerTransaction> findByIdempotencyKey(String idempotencyKey);

    List<LedgerTransaction> findByUserIdOrderByIdAsc(Long userId);

    List<LedgerTransaction> findByUserIdAndType(Long userId, LedgerTransaction.Type type);

    List<LedgerTransaction> findByCorrelationIdOrderByIdAsc(String correlationId);
}
