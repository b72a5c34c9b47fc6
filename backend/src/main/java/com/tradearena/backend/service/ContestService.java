package com.tradearena.backend.service;

import com.tradearena.backend.config.RiskProperties;
import com.tradearena.backend.config.SettlementProperties;
import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.CreateChallengeRequest;
import com.tradearena.backend.dto.CreateCompetitionRequest;
import com.tradearena.backend.dto.ItemOutcome;
import com.tradearena.backend.exception.ConflictException;
import com.tradearena.backend.exception.NotFoundException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.ContestRules;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.model.MarginThresholds;
import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.PrizeTier;
import com.tradearena.backend.repository.ContestRepository;
import com.tradearena.backend.repository.ParticipantRepository;
import com.tradearena.backend.service.notification.NotificationDispatcher;
import com.tradearena.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Contest creation, activation and entry. Terminal transitions live in
 * {@link ContestLifecycleService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContestService {

    private final ContestRepository contestRepository;
    private final ParticipantRepository participantRepository;
    private final CreditLedgerService ledger;
    private final UnitOfWork unitOfWork;
    private final AuditEventService auditEventService;
    private final NotificationDispatcher notifications;
    private final RiskProperties riskProperties;
    private final SettlementProperties settlementProperties;
    private final Clock clock;

    public Contest createCompetition(CreateCompetitionRequest request) {
        Instant now = clock.instant();
        if (!request.getEndTime().isAfter(request.getStartTime())) {
            throw new ValidationException("End time must be after start time");
        }
        if (!request.getEndTime().isAfter(now)) {
            throw new ValidationException("End time must be in the future");
        }
        validatePrizeDistribution(request.getPrizeDistribution());
        ContestRules rules = validatedRules(request.getRules());
        MarginThresholds thresholds = MarginThresholds.resolve(request.getMarginThresholds(), riskProperties);
        if (!thresholds.isDescending()) {
            throw new ValidationException("Margin thresholds must be positive and strictly descending");
        }

        Contest contest = contestRepository.save(Contest.builder()
                .type(Contest.Type.COMPETITION)
                .name(request.getName())
                .organizerId(request.getOrganizerId())
                .entryFee(MoneyUtils.scale(request.getEntryFee()))
                .startingCapital(MoneyUtils.scale(request.getStartingCapital()))
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .status(Contest.Status.DRAFT)
                .prizePool(MoneyUtils.ZERO)
                .platformFeePct(request.getPlatformFeePct())
                .prizeDistribution(new ArrayList<>(request.getPrizeDistribution()))
                .rules(rules)
                .marginThresholds(thresholds)
                .maxParticipants(request.getMaxParticipants())
                .currentParticipants(0)
                .build());
        auditEventService.contestTransition(contest.getId(), "CREATED",
                "Competition created: " + contest.getName(), Map.of("organizerId", contest.getOrganizerId()));
        log.info("Competition {} '{}' created by organizer {}", contest.getId(), contest.getName(), contest.getOrganizerId());
        return contest;
    }

    public Contest publish(Long contestId) {
        return unitOfWork.execute("publish-contest", () -> {
            Contest contest = lockContest(contestId);
            if (contest.getStatus() == Contest.Status.UPCOMING) {
                return contest;
            }
            if (contest.getStatus() != Contest.Status.DRAFT) {
                throw new ConflictException("Contest " + contestId + " is " + contest.getStatus() + ", cannot publish");
            }
            contest.setStatus(Contest.Status.UPCOMING);
            auditEventService.contestTransition(contestId, "PUBLISHED", "Contest published");
            return contestRepository.save(contest);
        });
    }

    /**
     * Moves every UPCOMING competition whose start time has passed to ACTIVE. Challenges start
     * when accepted, not here.
     */
    public BatchResult activateDue(Instant now) {
        List<ItemOutcome> items = new ArrayList<>();
        for (Contest due : contestRepository.findByStatusAndStartTimeLessThanEqualOrderByStartTimeAsc(
                Contest.Status.UPCOMING, now)) {
            if (due.getType() != Contest.Type.COMPETITION) {
                continue;
            }
            MDC.put("contestId", String.valueOf(due.getId()));
            try {
                boolean activated = unitOfWork.execute("activate-contest", () -> {
                    Contest contest = lockContest(due.getId());
                    if (contest.getStatus() != Contest.Status.UPCOMING) {
                        return false;
                    }
                    contest.setStatus(Contest.Status.ACTIVE);
                    contestRepository.save(contest);
                    auditEventService.contestTransition(contest.getId(), "ACTIVATED", "Contest started");
                    return true;
                });
                items.add(activated
                        ? ItemOutcome.succeeded("contest", due.getId(), null, "ACTIVE")
                        : ItemOutcome.skipped("contest", due.getId(), null, "No longer UPCOMING"));
            } catch (Exception e) {
                log.warn("Activation of contest {} failed: {}", due.getId(), e.getMessage());
                items.add(ItemOutcome.failed("contest", due.getId(), null, e.getMessage()));
            } finally {
                MDC.remove("contestId");
            }
        }
        return new BatchResult("activateDue", null, null, items);
    }

    /**
     * Entry is atomic: the fee debit, the participant row, the counter and the prize pool change
     * commit together or not at all. Joining again returns the existing participant.
     */
    public Participant join(Long contestId, Long userId) {
        return unitOfWork.execute("join-contest", () -> {
            Contest contest = lockContest(contestId);
            Participant existing = participantRepository.findByContestIdAndUserId(contestId, userId).orElse(null);
            if (existing != null) {
                return existing;
            }
            if (contest.getType() == Contest.Type.CHALLENGE
                    && !userId.equals(contest.getOrganizerId())
                    && !userId.equals(contest.getChallengedUserId())) {
                throw new ValidationException("Challenge " + contestId + " is reserved for users "
                        + contest.getOrganizerId() + " and " + contest.getChallengedUserId());
            }
            Instant now = clock.instant();
            if (!contest.isJoinable()) {
                throw new ValidationException("Contest " + contestId + " is " + contest.getStatus() + ", not open for entry");
            }
            if (contest.hasEnded(now)) {
                throw new ValidationException("Contest " + contestId + " has already ended");
            }
            if (contest.getCurrentParticipants() >= contest.getMaxParticipants()) {
                throw new ValidationException("Contest " + contestId + " is full");
            }

            if (MoneyUtils.isPositive(contest.getEntryFee())) {
                ledger.debit(userId, contest.getEntryFee(), LedgerTransaction.Type.ENTRY_FEE,
                        "contest:" + contestId, "entry:" + contestId + ":" + userId,
                        "Entry fee for contest " + contest.getName());
            }
            BigDecimal capital = contest.getStartingCapital();
            Participant participant = participantRepository.save(Participant.builder()
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
                    .joinedAt(now)
                    .build());

            contest.setCurrentParticipants(contest.getCurrentParticipants() + 1);
            contest.setPrizePool(MoneyUtils.add(contest.getPrizePool(), poolContribution(contest)));
            contestRepository.save(contest);

            notifications.notifyAfterCommit(userId, "CONTEST_JOINED",
                    Map.of("contestId", contestId, "startingCapital", capital));
            log.info("User {} joined contest {} ({}/{}) prizePool={}", userId, contestId,
                    contest.getCurrentParticipants(), contest.getMaxParticipants(), contest.getPrizePool());
            return participant;
        });
    }

    public Contest createChallenge(CreateChallengeRequest request) {
        if (request.getChallengerId().equals(request.getChallengedId())) {
            throw new ValidationException("A user cannot challenge themselves");
        }
        ContestRules rules = validatedRules(request.getRules());
        SettlementProperties.Challenge defaults = settlementProperties.getChallenge();
        BigDecimal startingCapital = request.getStartingCapital() != null
                ? request.getStartingCapital() : defaults.getStartingCapital();

        return unitOfWork.execute("create-challenge", () -> {
            Instant now = clock.instant();
            Instant acceptDeadline = now.plus(defaults.getAcceptWindow());
            List<PrizeTier> winnerTakesAll = new ArrayList<>();
            winnerTakesAll.add(PrizeTier.of(1, 100));
            Contest contest = contestRepository.save(Contest.builder()
                    .type(Contest.Type.CHALLENGE)
                    .name("Challenge " + request.getChallengerId() + " vs " + request.getChallengedId())
                    .organizerId(request.getChallengerId())
                    .entryFee(MoneyUtils.scale(request.getEntryFee()))
                    .startingCapital(MoneyUtils.scale(startingCapital))
                    .startTime(acceptDeadline)
                    .endTime(acceptDeadline.plusSeconds(request.getDurationSeconds()))
                    .status(Contest.Status.UPCOMING)
                    .prizePool(MoneyUtils.ZERO)
                    .platformFeePct(defaults.getPlatformFeePct())
                    .prizeDistribution(winnerTakesAll)
                    .rules(rules)
                    .marginThresholds(MarginThresholds.defaults(riskProperties))
                    .maxParticipants(2)
                    .currentParticipants(0)
                    .challengedUserId(request.getChallengedId())
                    .acceptDeadline(acceptDeadline)
                    .durationSeconds(request.getDurationSeconds())
                    .build());
            join(contest.getId(), request.getChallengerId());
            notifications.notifyAfterCommit(request.getChallengedId(), "CHALLENGE_RECEIVED",
                    Map.of("contestId", contest.getId(), "challengerId", request.getChallengerId(),
                            "acceptDeadline", acceptDeadline.toString()));
            auditEventService.challengeTransition(contest.getId(), "CREATED", contest.getName());
            return contest;
        });
    }

    /**
     * The challenged user joins and the clock starts. Accepting an already running challenge
     * again is a no-op.
     */
    public Contest acceptChallenge(Long contestId, Long userId) {
        return unitOfWork.execute("accept-challenge", () -> {
            Contest contest = lockContest(contestId);
            if (contest.getType() != Contest.Type.CHALLENGE) {
                throw new ValidationException("Contest " + contestId + " is not a challenge");
            }
            if (!userId.equals(contest.getChallengedUserId())) {
                throw new ValidationException("Only the challenged user can accept challenge " + contestId);
            }
            if (contest.getStatus() == Contest.Status.ACTIVE
                    && participantRepository.findByContestIdAndUserId(contestId, userId).isPresent()) {
                return contest;
            }
            if (contest.getStatus() != Contest.Status.UPCOMING) {
                throw new ConflictException("Challenge " + contestId + " is " + contest.getStatus());
            }
            Instant now = clock.instant();
            if (contest.getAcceptDeadline() != null && now.isAfter(contest.getAcceptDeadline())) {
                throw new ValidationException("Challenge " + contestId + " has expired");
            }
            join(contestId, userId);
            contest.setStatus(Contest.Status.ACTIVE);
            contest.setStartTime(now);
            contest.setEndTime(now.plusSeconds(contest.getDurationSeconds()));
            notifications.notifyAfterCommit(contest.getOrganizerId(), "CHALLENGE_ACCEPTED",
                    Map.of("contestId", contestId, "endTime", contest.getEndTime().toString()));
            auditEventService.challengeTransition(contestId, "ACCEPTED", "Challenge accepted by " + userId);
            return contestRepository.save(contest);
        });
    }

    public Contest get(Long contestId) {
        return contestRepository.findById(contestId)
                .orElseThrow(() -> new NotFoundException("Contest not found: " + contestId));
    }

    public List<Participant> participants(Long contestId) {
        return participantRepository.findByContestIdOrderByJoinedAtAscIdAsc(contestId);
    }

    BigDecimal poolContribution(Contest contest) {
        BigDecimal retainedPct = MoneyUtils.HUNDRED.subtract(contest.getPlatformFeePct());
        return MoneyUtils.percentOf(contest.getEntryFee(), retainedPct);
    }

    private Contest lockContest(Long contestId) {
        return contestRepository.findByIdForUpdate(contestId)
                .orElseThrow(() -> new NotFoundException("Contest not found: " + contestId));
    }

    private ContestRules validatedRules(ContestRules requested) {
        ContestRules rules = ContestRules.resolve(requested);
        if (rules.getMaxLeverage() < 1 || rules.getMaxLeverage() > riskProperties.getLimits().getMaxLeverage()) {
            throw new ValidationException("Contest max leverage must be between 1 and "
                    + riskProperties.getLimits().getMaxLeverage());
        }
        if (rules.getMaxOpenPositions() < 1) {
            throw new ValidationException("Contest must allow at least one open position");
        }
        if (rules.getMinimumTrades() < 0) {
            throw new ValidationException("Minimum trades cannot be negative");
        }
        return rules;
    }

    private void validatePrizeDistribution(List<PrizeTier> distribution) {
        if (distribution == null || distribution.isEmpty()) {
            throw new ValidationException("Prize distribution is required");
        }
        Set<Integer> ranks = new HashSet<>();
        BigDecimal total = BigDecimal.ZERO;
        for (PrizeTier tier : distribution) {
            if (tier.getRank() < 1) {
                throw new ValidationException("Prize ranks must be positive");
            }
            if (!ranks.add(tier.getRank())) {
                throw new ValidationException("Duplicate prize rank " + tier.getRank());
            }
            if (tier.getPercentage() == null || tier.getPercentage().signum() <= 0) {
                throw new ValidationException("Prize percentage for rank " + tier.getRank() + " must be positive");
            }
            total = total.add(tier.getPercentage());
        }
        if (total.compareTo(MoneyUtils.HUNDRED) > 0) {
            throw new ValidationException("Prize distribution sums to " + total.toPlainString() + "%, above 100%");
        }
    }
}
