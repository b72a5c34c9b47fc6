package com.tradearena.backend.repository;

import com.tradearena.backend.model.FailedOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface FailedOperationRepository extends JpaRepository<FailedOperation, Long> {
    List<FailedOperation> findByResolvedFalse();

    List<FailedOperation> findByOperationTypeAndResolvedFalse(String operationType);
}
