package com.tradearena.backend.integration;

import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.CreateChallengeRequest;
import com.tradearena.backend.dto.FinalizeReport;
import com.tradearena.backend.dto.ItemOutcome;
import com.tradearena.backend.dto.OpenPositionRequest;
import com.tradearena.backend.exception.ConflictException;
import com.tradearena.backend.exception.InsufficientFundsException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.AuditEvent;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.ContestRules;
import com.tradearena.backend.model.FailedOperation;
import com.tradearena.backend.model.LeaderboardEntry;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.model.PrizeTier;
import com.tradearena.backend.model.TieBreaker;
import com.tradearena.backend.model.TiePrizePolicy;
import com.tradearena.backend.service.PositionService;
import org.assertj.core.api.recursive.comparison.RecursiveComparisonConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ContestLifecycleIntegrationTest extends SettlementIntegrationTestSupport {

    private static final List<PrizeTier> SEVENTY_THIRTY = List.of(PrizeTier.of(1, 70), PrizeTier.of(2, 30));
    private static final ContestRules RULES = ContestRules.defaults().toBuilder()
            .tieBreak1(TieBreaker.WIN_RATE)
            .tieBreak2(TieBreaker.TRADES_COUNT)
            .tiePrizePolicy(TiePrizePolicy.SPLIT_EQUALLY)
            .build();

    @Autowired
    private PositionService positionService;

    @Test
    void joinDebitsEntryFeeOnceAndGrowsPool() {
        fund(21L, "100");
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null);

        Participant first = contestService.join(contest.getId(), 21L);
        Participant again = contestService.join(contest.getId(), 21L);

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(balance(21L)).isEqualByComparingTo("90");
        Contest reloaded = contestService.get(contest.getId());
        assertThat(reloaded.getPrizePool()).isEqualByComparingTo("9");
        assertThat(reloaded.getCurrentParticipants()).isEqualTo(1);
        assertThat(first.getCurrentCapital()).isEqualByComparingTo("10000");
    }

    @Test
    void failedJoinLeavesNoTrace() {
        fund(22L, "5");
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null);

        assertThatThrownBy(() -> contestService.join(contest.getId(), 22L))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(participantRepository.countByContestId(contest.getId())).isZero();
        assertThat(contestService.get(contest.getId()).getPrizePool()).isEqualByComparingTo("0");
        assertThat(balance(22L)).isEqualByComparingTo("5");
    }

    @Test
    void cancelRefundsEveryParticipantExactlyOnce() {
        fund(23L, "50");
        fund(24L, "50");
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null);
        contestService.join(contest.getId(), 23L);
        contestService.join(contest.getId(), 24L);

        BatchResult first = contestLifecycleService.cancelAndRefund(contest.getId(), "Feed outage");
        BatchResult second = contestLifecycleService.cancelAndRefund(contest.getId(), "Feed outage");

        assertThat(first.succeeded()).isEqualTo(2);
        assertThat(first.complete()).isTrue();
        assertThat(second.succeeded()).isZero();
        assertThat(second.skipped()).isEqualTo(2);
        assertThat(balance(23L)).isEqualByComparingTo("50");
        assertThat(balance(24L)).isEqualByComparingTo("50");
        assertThat(ledgerTransactionRepository.findByUserIdAndType(23L, LedgerTransaction.Type.REFUND)).hasSize(1);

        Contest cancelled = contestService.get(contest.getId());
        assertThat(cancelled.getStatus()).isEqualTo(Contest.Status.CANCELLED);
        assertThat(cancelled.getPrizePool()).isEqualByComparingTo("0");
        assertThat(participantRepository.findByContestIdOrderByJoinedAtAscIdAsc(contest.getId()))
                .allMatch(participant -> participant.getStatus() == Participant.Status.REFUNDED);
    }

    @Test
    void cancelClosesOpenPositionsWithoutSettlingPnl() {
        fund(25L, "50");
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null);
        contestService.join(contest.getId(), 25L);
        startContests();
        quote("EURUSD", "1.0848", "1.0850");
        Position position = positionService.openPosition(contest.getId(), longEurUsd(25L, "0.1"));

        contestLifecycleService.cancelAndRefund(contest.getId(), "Operator error");

        Position closed = positionRepository.findById(position.getId()).orElseThrow();
        assertThat(closed.getStatus()).isEqualTo(Position.Status.CLOSED);
        assertThat(closed.getCloseReason()).isEqualTo(Position.CloseReason.CONTEST_END);
        assertThat(closed.getRealizedPnl()).isEqualByComparingTo("0");
        assertThat(balance(25L)).isEqualByComparingTo("50");
    }

    @Test
    void finalizeSplitsTiedFirstPlaceAndPaysNextGroupTheSecondShare() {
        fund(31L, "100");
        fund(32L, "100");
        fund(33L, "100");
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null);
        contestService.join(contest.getId(), 31L);
        contestService.join(contest.getId(), 32L);
        contestService.join(contest.getId(), 33L);
        startContests();
        quote("EURUSD", "1.0848", "1.0850");
        Position losing = positionService.openPosition(contest.getId(), longEurUsd(33L, "0.1"));
        positionService.closePosition(losing.getId(), Position.CloseReason.USER);
        endContests();

        FinalizeReport report = contestLifecycleService.finalizeContest(contest.getId());

        assertThat(report.completed()).isTrue();
        assertThat(report.leaderboard()).extracting(LeaderboardEntry::getUserId).containsExactly(31L, 32L, 33L);
        assertThat(report.leaderboard()).extracting(LeaderboardEntry::getRank).containsExactly(1, 1, 3);
        assertThat(report.leaderboard()).extracting(LeaderboardEntry::getPrizeAmount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("9.45"), new BigDecimal("9.45"), new BigDecimal("8.10"));
        assertThat(balance(31L)).isEqualByComparingTo("99.45");
        assertThat(balance(33L)).isEqualByComparingTo("98.10");
        assertThat(contestService.get(contest.getId()).getStatus()).isEqualTo(Contest.Status.COMPLETED);
    }

    @Test
    void finalizeTwicePaysPrizesOnce() {
        fund(34L, "100");
        fund(35L, "100");
        Contest contest = upcomingCompetition("20", "10000", List.of(PrizeTier.of(1, 100)), RULES, null);
        contestService.join(contest.getId(), 34L);
        contestService.join(contest.getId(), 35L);
        startContests();
        quote("EURUSD", "1.0848", "1.0850");
        List<Position> opened = List.of(
                positionService.openPosition(contest.getId(), longEurUsd(34L, "0.1")),
                positionService.openPosition(contest.getId(), longEurUsd(34L, "0.2")),
                positionService.openPosition(contest.getId(), longEurUsd(35L, "0.1")),
                positionService.openPosition(contest.getId(), longEurUsd(35L, "0.3")));
        quote("EURUSD", "1.0870", "1.0872");
        endContests();

        FinalizeReport first = contestLifecycleService.finalizeContest(contest.getId());
        FinalizeReport second = contestLifecycleService.finalizeContest(contest.getId());

        assertThat(first.batch().items()).filteredOn(item -> item.itemType().equals("position")).hasSize(4);
        assertThat(second.completed()).isTrue();
        assertThat(second.batch().items()).isEmpty();
        for (Position position : opened) {
            assertThat(tradeHistoryRecordRepository.countByPositionId(position.getId())).isEqualTo(1);
        }
        assertThat(tradeHistoryRecordRepository.findByContestIdOrderByClosedAtAscIdAsc(contest.getId())).hasSize(4);
        assertThat(second.leaderboard())
                .usingRecursiveFieldByFieldElementComparator(RecursiveComparisonConfiguration.builder()
                        .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                        .build())
                .containsExactlyElementsOf(first.leaderboard());
        assertThat(contestLifecycleService.leaderboard(contest.getId()))
                .extracting(LeaderboardEntry::getUserId, LeaderboardEntry::getRank)
                .containsExactly(tuple(35L, 1), tuple(34L, 2));
        assertThat(ledgerTransactionRepository.findByCorrelationIdOrderByIdAsc("contest:" + contest.getId()))
                .filteredOn(tx -> tx.getType() == LedgerTransaction.Type.PRIZE)
                .singleElement()
                .satisfies(tx -> assertThat(tx.getUserId()).isEqualTo(35L));
        assertThat(balance(34L).add(balance(35L))).isEqualByComparingTo("196");
        assertThatThrownBy(() -> contestLifecycleService.cancelAndRefund(contest.getId(), "too late"))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void concurrentJoinsBySameUserChargeOnce() throws Exception {
        fund(37L, "100");
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null);

        List<Object> outcomes = runConcurrently(4, () -> contestService.join(contest.getId(), 37L).getId());

        assertThat(outcomes).hasSize(4).allMatch(outcome -> outcome instanceof Long).containsOnly(outcomes.get(0));
        assertThat(participantRepository.countByContestId(contest.getId())).isEqualTo(1);
        assertThat(ledgerTransactionRepository.findByUserIdAndType(37L, LedgerTransaction.Type.ENTRY_FEE)).hasSize(1);
        assertThat(balance(37L)).isEqualByComparingTo("90");
        assertThat(contestService.get(contest.getId()).getCurrentParticipants()).isEqualTo(1);
    }

    @Test
    void usersRacingForLastSeatAdmitExactlyOne() throws Exception {
        Contest contest = upcomingCompetition("10", "10000", SEVENTY_THIRTY, RULES, null, 3);
        for (long userId = 51; userId <= 56; userId++) {
            fund(userId, "50");
        }
        contestService.join(contest.getId(), 51L);
        contestService.join(contest.getId(), 52L);

        AtomicLong nextUser = new AtomicLong(53);
        List<Object> outcomes = runConcurrently(4, () -> contestService.join(contest.getId(), nextUser.getAndIncrement()));

        assertThat(outcomes).filteredOn(outcome -> outcome instanceof Participant).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> outcome instanceof ValidationException)
                .hasSize(3)
                .allSatisfy(outcome -> assertThat(((ValidationException) outcome).getMessage()).contains("is full"));
        Contest full = contestService.get(contest.getId());
        assertThat(full.getCurrentParticipants()).isEqualTo(3);
        assertThat(participantRepository.countByContestId(contest.getId())).isEqualTo(3);
        assertThat(full.getPrizePool()).isEqualByComparingTo("27");
        BigDecimal racersTotal = BigDecimal.ZERO;
        for (long userId = 53; userId <= 56; userId++) {
            racersTotal = racersTotal.add(balance(userId));
        }
        assertThat(racersTotal).isEqualByComparingTo("190");
    }

    @Test
    void finalizeRacingCancelEndsInExactlyOneTerminalState() throws Exception {
        fund(38L, "100");
        fund(39L, "100");
        Contest contest = upcomingCompetition("20", "10000", List.of(PrizeTier.of(1, 100)), RULES, null);
        contestService.join(contest.getId(), 38L);
        contestService.join(contest.getId(), 39L);
        startContests();
        endContests();

        AtomicInteger turn = new AtomicInteger();
        List<Object> outcomes = runConcurrently(2, () -> turn.getAndIncrement() == 0
                ? contestLifecycleService.finalizeContest(contest.getId())
                : contestLifecycleService.cancelAndRefund(contest.getId(), "Operator stop"));

        assertThat(outcomes).filteredOn(outcome -> outcome instanceof ConflictException).hasSize(1);
        Contest settled = contestService.get(contest.getId());
        List<LedgerTransaction> prizes = ledgerTransactionRepository
                .findByCorrelationIdOrderByIdAsc("contest:" + contest.getId()).stream()
                .filter(tx -> tx.getType() == LedgerTransaction.Type.PRIZE)
                .toList();
        List<LedgerTransaction> refunds = new ArrayList<>(ledgerTransactionRepository.findByUserIdAndType(38L, LedgerTransaction.Type.REFUND));
        refunds.addAll(ledgerTransactionRepository.findByUserIdAndType(39L, LedgerTransaction.Type.REFUND));
        if (settled.getStatus() == Contest.Status.COMPLETED) {
            assertThat(prizes).hasSize(1);
            assertThat(refunds).isEmpty();
            assertThat(balance(38L).add(balance(39L))).isEqualByComparingTo("196");
        } else {
            assertThat(settled.getStatus()).isEqualTo(Contest.Status.CANCELLED);
            assertThat(prizes).isEmpty();
            assertThat(refunds).hasSize(2);
            assertThat(leaderboardEntryRepository.findByContestIdOrderByDisplayOrderAsc(contest.getId())).isEmpty();
            assertThat(balance(38L).add(balance(39L))).isEqualByComparingTo("200");
        }
    }

    @Test
    void strangerCannotTakeTheSecondSeatOfAChallenge() {
        fund(46L, "100");
        fund(47L, "100");
        fund(48L, "100");
        Contest challenge = contestService.createChallenge(challenge(46L, 47L));

        assertThatThrownBy(() -> contestService.join(challenge.getId(), 48L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("reserved");
        assertThat(balance(48L)).isEqualByComparingTo("100");

        Contest accepted = contestService.acceptChallenge(challenge.getId(), 47L);

        assertThat(accepted.getStatus()).isEqualTo(Contest.Status.ACTIVE);
        assertThat(participantRepository.findByContestIdOrderByJoinedAtAscIdAsc(challenge.getId()))
                .extracting(Participant::getUserId)
                .containsExactly(46L, 47L);
    }

    @Test
    void finalizeWaitsWhileAPriceIsUnavailable() {
        fund(36L, "100");
        Contest contest = upcomingCompetition("10", "10000", List.of(PrizeTier.of(1, 100)), RULES, null);
        contestService.join(contest.getId(), 36L);
        startContests();
        quote("GBPUSD", "1.2500", "1.2502");
        positionService.openPosition(contest.getId(), OpenPositionRequest.builder()
                .userId(36L)
                .symbol("GBPUSD")
                .side(Position.Side.SHORT)
                .quantity(new BigDecimal("0.1"))
                .leverage(20)
                .build());
        endContests();
        priceFeed.withdraw("GBPUSD");

        FinalizeReport deferred = contestLifecycleService.finalizeContest(contest.getId());

        assertThat(deferred.status()).isEqualTo(Contest.Status.ACTIVE);
        assertThat(deferred.batch().failed()).isEqualTo(1);
        assertThat(failedOperationRepository.findByOperationTypeAndResolvedFalse("CONTEST_END_CLOSE_FAILED"))
                .extracting(FailedOperation::getTimestamp)
                .containsExactly(clock.instant());
        assertThat(positionRepository.findByContestIdAndStatus(contest.getId(), Position.Status.OPEN)).hasSize(1);

        quote("GBPUSD", "1.2490", "1.2492");
        BatchResult sweep = schedulerTick.finalizeSweep();

        assertThat(sweep.succeeded()).isEqualTo(1);
        assertThat(contestService.get(contest.getId()).getStatus()).isEqualTo(Contest.Status.COMPLETED);
        assertThat(tradeHistoryRecordRepository.findByContestIdOrderByClosedAtAscIdAsc(contest.getId()))
                .singleElement()
                .satisfies(record -> assertThat(record.getCloseReason()).isEqualTo(Position.CloseReason.CONTEST_END));
    }

    @Test
    void acceptedChallengeStartsImmediately() {
        fund(41L, "100");
        fund(42L, "100");
        Contest challenge = contestService.createChallenge(challenge(41L, 42L));

        assertThat(challenge.getStatus()).isEqualTo(Contest.Status.UPCOMING);
        assertThat(balance(41L)).isEqualByComparingTo("75");

        Contest accepted = contestService.acceptChallenge(challenge.getId(), 42L);

        assertThat(accepted.getStatus()).isEqualTo(Contest.Status.ACTIVE);
        assertThat(accepted.getStartTime()).isEqualTo(clock.instant());
        assertThat(accepted.getEndTime()).isEqualTo(clock.instant().plusSeconds(3600));
        assertThat(accepted.getPrizePool()).isEqualByComparingTo("45");
        assertThat(contestService.acceptChallenge(challenge.getId(), 42L).getId()).isEqualTo(challenge.getId());
    }

    @Test
    void unansweredChallengeExpiresWithRefund() {
        fund(43L, "100");
        Contest challenge = contestService.createChallenge(challenge(43L, 44L));
        clock.advance(Duration.ofHours(25));

        List<BatchResult> expired = schedulerTick.challengeExpirySweep();

        assertThat(expired).hasSize(1);
        assertThat(expired.get(0).items()).extracting(ItemOutcome::status).containsExactly(ItemOutcome.Status.SUCCEEDED);
        assertThat(contestService.get(challenge.getId()).getStatus()).isEqualTo(Contest.Status.CANCELLED);
        assertThat(balance(43L)).isEqualByComparingTo("100");
        assertThat(schedulerTick.challengeExpirySweep()).isEmpty();
    }

    @Test
    void auditTrailRecordsLifecycle() {
        fund(45L, "100");
        Contest contest = upcomingCompetition("0", "5000", List.of(PrizeTier.of(1, 100)), RULES, null);
        contestService.join(contest.getId(), 45L);
        startContests();
        endContests();
        contestLifecycleService.finalizeContest(contest.getId());

        assertThat(auditEventRepository.findByContestIdOrderByCreatedAtAscIdAsc(contest.getId()))
                .extracting(AuditEvent::getAction, AuditEvent::getCreatedAt)
                .containsExactly(
                        tuple("CREATED", TestClockConfig.START),
                        tuple("PUBLISHED", TestClockConfig.START),
                        tuple("ACTIVATED", TestClockConfig.START.plus(Duration.ofMinutes(2))),
                        tuple("FINALIZED", TestClockConfig.START.plus(Duration.ofMinutes(122))));
        assertThat(failedOperationRepository.findByResolvedFalse()).extracting(FailedOperation::getOperationType).isEmpty();
    }

    private static OpenPositionRequest longEurUsd(Long userId, String lots) {
        return OpenPositionRequest.builder()
                .userId(userId)
                .symbol("EUR/USD")
                .side(Position.Side.LONG)
                .quantity(new BigDecimal(lots))
                .leverage(10)
                .build();
    }

    /**
     * Runs the task on {@code threads} threads released together and returns each result or the
     * exception it threw.
     */
    private static List<Object> runConcurrently(int threads, Callable<Object> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    return task.call();
                } catch (RuntimeException e) {
                    return e;
                }
            }));
        }
        start.countDown();
        List<Object> outcomes = new ArrayList<>();
        for (Future<Object> future : futures) {
            outcomes.add(future.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        return outcomes;
    }

    private static CreateChallengeRequest challenge(Long challengerId, Long challengedId) {
        return CreateChallengeRequest.builder()
                .challengerId(challengerId)
                .challengedId(challengedId)
                .entryFee(new BigDecimal("25"))
                .durationSeconds(3600L)
                .build();
    }
}
