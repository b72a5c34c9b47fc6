package com.tradearena.backend.service.ranking;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record PrizeAllocation(
        List<PrizeAward> awards,
        BigDecimal totalAwarded,
        BigDecimal residue
) {
    public Optional<PrizeAward> awardFor(Long participantId) {
        return awards.stream().filter(award -> award.participantId().equals(participantId)).findFirst();
    }
}
