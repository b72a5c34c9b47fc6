package com.tradearena.backend.repository;

import com.tradearena.backend.model.PayoutRequest;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PayoutRequestRepository extends JpaRepository<PayoutRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from PayoutRequest r where r.id = :id")
    Optional<PayoutRequest> findByIdForUpdate(@Param("id") Long id);

    List<PayoutRequest> findByStatusAndFlaggedForReviewFalseAndCreatedAtBefore(PayoutRequest.Status status, Instant cutoff);
}
