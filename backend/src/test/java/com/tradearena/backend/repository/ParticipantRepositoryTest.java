package com.tradearena.backend.repository;

import com.tradearena.backend.model.Participant;
import com.tradearena.backend.util.MoneyUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class ParticipantRepositoryTest {

    private static final Instant JOINED = Instant.parse("2026-06-01T09:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ParticipantRepository participantRepository;

    @Test
    void userCanJoinAContestOnlyOnce() {
        participantRepository.saveAndFlush(participant(1L, 10L, JOINED));

        assertThatThrownBy(() -> participantRepository.saveAndFlush(participant(1L, 10L, JOINED.plusSeconds(1))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void participantsAreListedInJoinOrderScopedToContest() {
        Participant late = entityManager.persist(participant(1L, 12L, JOINED.plusSeconds(30)));
        Participant early = entityManager.persist(participant(1L, 11L, JOINED));
        Participant sameInstant = entityManager.persist(participant(1L, 13L, JOINED));
        entityManager.persist(participant(2L, 11L, JOINED));
        entityManager.flush();

        assertThat(participantRepository.findByContestIdOrderByJoinedAtAscIdAsc(1L))
                .containsExactly(early, sameInstant, late);
        assertThat(participantRepository.countByContestId(2L)).isEqualTo(1);
        assertThat(participantRepository.findByContestIdAndUserId(2L, 12L)).isEmpty();
    }

    @Test
    void statusFilterExcludesLiquidated() {
        entityManager.persist(participant(3L, 20L, JOINED));
        Participant liquidated = participant(3L, 21L, JOINED);
        liquidated.setStatus(Participant.Status.LIQUIDATED);
        entityManager.persist(liquidated);
        entityManager.flush();

        assertThat(participantRepository.findByContestIdAndStatus(3L, Participant.Status.ACTIVE))
                .extracting(Participant::getUserId)
                .containsExactly(20L);
    }

    private Participant participant(Long contestId, Long userId, Instant joinedAt) {
        BigDecimal capital = MoneyUtils.bd(1000);
        return Participant.builder()
                .contestId(contestId)
                .userId(userId)
                .startingCapital(capital)
                .currentCapital(capital)
                .availableCapital(capital)
                .usedMargin(MoneyUtils.ZERO)
                .realizedPnl(MoneyUtils.ZERO)
                .unrealizedPnl(MoneyUtils.ZERO)
                .grossProfit(MoneyUtils.ZERO)
                .grossLoss(MoneyUtils.ZERO)
                .status(Participant.Status.ACTIVE)
                .joinedAt(joinedAt)
                .build();
    }
}
