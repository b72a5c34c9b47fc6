package com.tradearena.backend.repository;

import com.tradearena.backend.model.Contest;
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
public interface ContestRepository extends JpaRepository<Contest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Contest c where c.id = :id")
    Optional<Contest> findByIdForUpdate(@Param("id") Long id);

    List<Contest> findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(Contest.Status status, Instant now);

    List<Contest> findByStatusAndStartTimeLessThanEqualOrderByStartTimeAsc(Contest.Status status, Instant now);

    List<Contest> findByTypeAndStatusAndAcceptDeadlineBefore(Contest.Type type, Contest.Status status, Instant now);
}
