package com.tradearena.backend.service;

import com.tradearena.backend.exception.TransactionAbortException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * One all-or-nothing transactional unit. Ledger writes, position and participant updates and
 * counter increments issued inside {@code work} commit or roll back together.
 * <p>
 * When the commit loses a race the whole unit is re-run from scratch, never resumed. Work
 * started inside an already active transaction joins it and leaves retrying to the outer unit.
 */
@Slf4j
@Component
public class UnitOfWork {

    private final TransactionTemplate transactionTemplate;
    private final Retry unitOfWorkRetry;

    public UnitOfWork(PlatformTransactionManager transactionManager,
                      @Qualifier("unitOfWorkRetry") Retry unitOfWorkRetry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.unitOfWorkRetry = unitOfWorkRetry;
    }

    public <T> T execute(String name, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        Supplier<T> attempt = () -> transactionTemplate.execute(status -> work.get());
        try {
            return Retry.decorateSupplier(unitOfWorkRetry, attempt).get();
        } catch (ObjectOptimisticLockingFailureException | PessimisticLockingFailureException
                 | DataIntegrityViolationException e) {
            log.warn("Unit of work {} aborted after {} attempts: {}", name,
                    unitOfWorkRetry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw new TransactionAbortException("Unit of work " + name + " could not commit", e);
        }
    }

    public void run(String name, Runnable work) {
        execute(name, () -> {
            work.run();
            return null;
        });
    }
}
