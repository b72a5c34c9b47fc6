package com.tradearena.backend.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Best-effort delivery to the {@link NotificationSink}. Sending happens after the surrounding
 * transaction commits, off the settlement thread, and a failing sink is only logged.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final NotificationSink sink;
    private final Executor executor;

    public NotificationDispatcher(NotificationSink sink, @Qualifier("notificationExecutor") Executor executor) {
        this.sink = sink;
        this.executor = executor;
    }

    public void notifyAfterCommit(Long userId, String event, Map<String, Object> payload) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(userId, event, payload);
                }
            });
            return;
        }
        dispatch(userId, event, payload);
    }

    private void dispatch(Long userId, String event, Map<String, Object> payload) {
        try {
            executor.execute(() -> deliver(userId, event, payload));
        } catch (RejectedExecutionException e) {
            log.warn("Notification {} for user {} dropped: executor saturated", event, userId);
        }
    }

    private void deliver(Long userId, String event, Map<String, Object> payload) {
        try {
            sink.notify(userId, event, payload);
        } catch (Exception e) {
            log.warn("Notification {} for user {} failed: {}", event, userId, e.getMessage());
        }
    }
}
