package com.tradearena.backend.service;

import com.tradearena.backend.model.RiskEvent;
import com.tradearena.backend.repository.RiskEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@RequiredArgsConstructor
public class RiskEventService {

    private final RiskEventRepository riskEventRepository;
    private final Clock clock;

    public RiskEvent record(Long userId, Long participantId, String type, String description, String metadata) {
        if (userId == null) {
            return null;
        }
        RiskEvent event = RiskEvent.builder()
                .userId(userId)
                .participantId(participantId)
                .type(type)
                .description(description)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build();
        return riskEventRepository.save(event);
    }
}
