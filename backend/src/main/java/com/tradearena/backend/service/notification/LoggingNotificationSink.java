package com.tradearena.backend.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void notify(Long userId, String event, Map<String, Object> payload) {
        log.info("notify user={} event={} payload={}", userId, event, payload);
    }
}
