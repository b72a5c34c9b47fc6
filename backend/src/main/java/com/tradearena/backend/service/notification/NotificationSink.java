package com.tradearena.backend.service.notification;

import java.util.Map;

public interface NotificationSink {

    void notify(Long userId, String event, Map<String, Object> payload);
}
