package com.tradearena.backend.config;

import com.tradearena.backend.exception.ExternalDependencyException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public Retry priceFeedRetry(SettlementProperties properties) {
        SettlementProperties.Price price = properties.getPrice();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(price.getBaseDelayMs()),
                2.0,
                price.getJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(price.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(ExternalDependencyException.class)
                .build();
        return Retry.of("priceFeed", config);
    }

    /**
     * Retries a whole unit of work when the commit lost a race: stale version, lock timeout,
     * or a concurrent insert of the same unique key.
     */
    @Bean
    public Retry unitOfWorkRetry(SettlementProperties properties) {
        SettlementProperties.UnitOfWork unitOfWork = properties.getUnitOfWork();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(unitOfWork.getBaseDelayMs()),
                2.0,
                unitOfWork.getJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(unitOfWork.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(
                        ObjectOptimisticLockingFailureException.class,
                        PessimisticLockingFailureException.class,
                        CannotAcquireLockException.class,
                        DataIntegrityViolationException.class)
                .build();
        return Retry.of("unitOfWork", config);
    }
}
