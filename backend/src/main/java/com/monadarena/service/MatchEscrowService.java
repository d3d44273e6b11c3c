package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import com.monadarena.dto.MatchRequests;
import com.monadarena.dto.MatchResponses;
import com.monadarena.mapper.ArenaResponseMapper;
import com.monadarena.model.ArenaMatch;
import com.monadarena.model.CancellationReason;
import com.monadarena.model.GameType;
import com.monadarena.model.MatchStatus;
import com.monadarena.model.ResolutionMethod;
import com.monadarena.repository.ArenaMatchRepository;
import com.monadarena.web.ArenaOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Lifecycle of a two-party wagered match.
 *
 * <pre>
 * CREATED --join--> COMMIT_PHASE --both committed--> REVEAL_PHASE --both revealed--> RESOLVED
 * CREATED --cancel / timeout--> CANCELLED
 * COMMIT_PHASE, REVEAL_PHASE --resolver--> RESOLVED
 * COMMIT_PHASE, REVEAL_PHASE --timeout--> RESOLVED (one side acted) or CANCELLED (neither acted)
 * </pre>
 *
 * Every mutating call locks the match row first and re-checks its preconditions
 * against committed state, so each call is indivisible per match.
 */
@Service
public class MatchEscrowService {

    private static final Logger log = LoggerFactory.getLogger(MatchEscrowService.class);

    private final ArenaMatchRepository arenaMatchRepository;
    private final LedgerService ledgerService;
    private final PlayerStatsService playerStatsService;
    private final PlatformFeeCalculator platformFeeCalculator;
    private final MoveOutcomeResolverRegistry moveOutcomeResolverRegistry;
    private final ResolverAuthorization resolverAuthorization;
    private final ArenaResponseMapper arenaResponseMapper;
    private final ArenaProperties arenaProperties;

    public MatchEscrowService(
            ArenaMatchRepository arenaMatchRepository,
            LedgerService ledgerService,
            PlayerStatsService playerStatsService,
            PlatformFeeCalculator platformFeeCalculator,
            MoveOutcomeResolverRegistry moveOutcomeResolverRegistry,
            ResolverAuthorization resolverAuthorization,
            ArenaResponseMapper arenaResponseMapper,
            ArenaProperties arenaProperties
    ) {
        this.arenaMatchRepository = arenaMatchRepository;
        this.ledgerService = ledgerService;
        this.playerStatsService = playerStatsService;
        this.platformFeeCalculator = platformFeeCalculator;
        this.moveOutcomeResolverRegistry = moveOutcomeResolverRegistry;
        this.resolverAuthorization = resolverAuthorization;
        this.arenaResponseMapper = arenaResponseMapper;
        this.arenaProperties = arenaProperties;
    }

    @Transactional
    public MatchResponses.MatchDetail createMatch(MatchRequests.CreateMatchRequest request) {
        String creatorWallet = WalletAddresses.normalize(request.wallet());
        long wager = request.wager();
        ArenaProperties.Match matchConfig = arenaProperties.getMatch();
        if (wager < matchConfig.getMinWager()) {
            throw ArenaOperationException.wagerTooLow(wager, matchConfig.getMinWager());
        }
        if (wager > matchConfig.getMaxWager()) {
            throw ArenaOperationException.wagerTooHigh(wager, matchConfig.getMaxWager());
        }

        ledgerService.collect(creatorWallet, wager, "match wager");

        OffsetDateTime now = OffsetDateTime.now();
        ArenaMatch match = new ArenaMatch();
        match.setGameType(request.gameType());
        match.setCreatorWallet(creatorWallet);
        match.setWager(wager);
        match.setEscrowBalance(wager);
        match.setStatus(MatchStatus.CREATED);
        match.setJoinDeadlineAt(now.plusSeconds(matchConfig.getCommitTimeoutSeconds()));
        match.setCreatedAt(now);
        match.setUpdatedAt(now);

        ArenaMatch saved = arenaMatchRepository.save(match);
        log.info("Match {} created by {} ({}, wager {})", saved.getMatchId(), creatorWallet, saved.getGameType(), wager);
        return arenaResponseMapper.toMatchDetailResponse(saved);
    }

    @Transactional
    public MatchResponses.MatchDetail joinMatch(Long matchId, MatchRequests.JoinMatchRequest request) {
        String opponentWallet = WalletAddresses.normalize(request.wallet());
        ArenaMatch match = lockMatch(matchId);
        requireStatus(match, MatchStatus.CREATED);
        if (match.getCreatorWallet().equals(opponentWallet)) {
            throw ArenaOperationException.cannotJoinOwnMatch(matchId);
        }
        if (request.wager() != match.getWager().longValue()) {
            throw ArenaOperationException.wagerMismatch(match.getWager(), request.wager());
        }

        ledgerService.collect(opponentWallet, match.getWager(), "match wager");

        OffsetDateTime now = OffsetDateTime.now();
        match.setOpponentWallet(opponentWallet);
        match.setEscrowBalance(Math.multiplyExact(match.getWager(), 2L));
        match.setStatus(MatchStatus.COMMIT_PHASE);
        match.setJoinedAt(now);
        match.setCommitDeadlineAt(now.plusSeconds(arenaProperties.getMatch().getCommitTimeoutSeconds()));
        match.setUpdatedAt(now);

        ArenaMatch saved = arenaMatchRepository.save(match);
        log.info("Match {} joined by {}; escrow {}", matchId, opponentWallet, saved.getEscrowBalance());
        return arenaResponseMapper.toMatchDetailResponse(saved);
    }

    @Transactional
    public MatchResponses.MatchDetail commitMove(Long matchId, MatchRequests.CommitMoveRequest request) {
        String wallet = WalletAddresses.normalize(request.wallet());
        ArenaMatch match = lockMatch(matchId);
        requireStatus(match, MatchStatus.COMMIT_PHASE);
        boolean isCreator = requireParticipant(match, wallet);

        String commitment;
        try {
            commitment = CommitmentCodec.normalizeCommitment(request.commitment());
        } catch (IllegalArgumentException ex) {
            throw ArenaOperationException.invalidCommitment(ex.getMessage());
        }

        if (isCreator) {
            if (match.getCreatorCommitment() != null) {
                throw ArenaOperationException.alreadyCommitted(matchId);
            }
            match.setCreatorCommitment(commitment);
        } else {
            if (match.getOpponentCommitment() != null) {
                throw ArenaOperationException.alreadyCommitted(matchId);
            }
            match.setOpponentCommitment(commitment);
        }

        OffsetDateTime now = OffsetDateTime.now();
        log.info("Match {}: {} committed", matchId, wallet);
        if (match.getCreatorCommitment() != null && match.getOpponentCommitment() != null) {
            match.setStatus(MatchStatus.REVEAL_PHASE);
            match.setRevealPhaseStartedAt(now);
            match.setRevealDeadlineAt(now.plusSeconds(arenaProperties.getMatch().getRevealTimeoutSeconds()));
            log.info("Match {} entered reveal phase", matchId);
        }
        match.setUpdatedAt(now);

        return arenaResponseMapper.toMatchDetailResponse(arenaMatchRepository.save(match));
    }

    @Transactional
    public MatchResponses.MatchDetail revealMove(Long matchId, MatchRequests.RevealMoveRequest request) {
        String wallet = WalletAddresses.normalize(request.wallet());
        ArenaMatch match = lockMatch(matchId);
        requireStatus(match, MatchStatus.REVEAL_PHASE);
        boolean isCreator = requireParticipant(match, wallet);

        String existingReveal = isCreator ? match.getCreatorReveal() : match.getOpponentReveal();
        if (existingReveal != null) {
            throw ArenaOperationException.alreadyRevealed(matchId);
        }

        byte[] move;
        String recomputed;
        try {
            move = CommitmentCodec.decodeHex(request.move());
            recomputed = CommitmentCodec.computeCommitment(move, CommitmentCodec.decodeHex(request.salt()));
        } catch (IllegalArgumentException ex) {
            throw ArenaOperationException.invalidCommitment(ex.getMessage());
        }

        String storedCommitment = isCreator ? match.getCreatorCommitment() : match.getOpponentCommitment();
        if (!recomputed.equals(storedCommitment)) {
            throw ArenaOperationException.commitmentMismatch(matchId);
        }

        String reveal = CommitmentCodec.encodeHex(move);
        if (isCreator) {
            match.setCreatorReveal(reveal);
        } else {
            match.setOpponentReveal(reveal);
        }
        match.setUpdatedAt(OffsetDateTime.now());
        log.info("Match {}: {} revealed", matchId, wallet);

        if (match.getCreatorReveal() != null && match.getOpponentReveal() != null) {
            MoveOutcome outcome = moveOutcomeResolverRegistry.resolverFor(match.getGameType()).decide(
                    CommitmentCodec.decodeHex(match.getCreatorReveal()),
                    CommitmentCodec.decodeHex(match.getOpponentReveal())
            );
            String winner = outcome == MoveOutcome.CREATOR ? match.getCreatorWallet() : match.getOpponentWallet();
            settle(match, winner, ResolutionMethod.REVEAL);
        }

        return arenaResponseMapper.toMatchDetailResponse(arenaMatchRepository.save(match));
    }

    @Transactional
    public MatchResponses.MatchDetail resolveByResolver(Long matchId, MatchRequests.ResolveMatchRequest request) {
        resolverAuthorization.requireResolver(request.wallet());
        ArenaMatch match = lockMatch(matchId);
        if (match.getStatus() != MatchStatus.COMMIT_PHASE && match.getStatus() != MatchStatus.REVEAL_PHASE) {
            throw ArenaOperationException.invalidState(
                    "Match " + matchId + " cannot be resolved from status " + match.getStatus()
            );
        }

        String winner = WalletAddresses.normalize(request.winner());
        if (!winner.equals(match.getCreatorWallet()) && !winner.equals(match.getOpponentWallet())) {
            throw ArenaOperationException.invalidWinner(winner);
        }

        settle(match, winner, ResolutionMethod.RESOLVER);
        return arenaResponseMapper.toMatchDetailResponse(arenaMatchRepository.save(match));
    }

    @Transactional
    public MatchResponses.MatchDetail cancelMatch(Long matchId, MatchRequests.ParticipantRequest request) {
        String wallet = WalletAddresses.normalize(request.wallet());
        ArenaMatch match = lockMatch(matchId);
        if (!match.getCreatorWallet().equals(wallet)) {
            throw ArenaOperationException.notCreator(matchId);
        }
        requireStatus(match, MatchStatus.CREATED);

        ledgerService.payout(match.getCreatorWallet(), match.getEscrowBalance(), "match " + matchId + " cancelled");
        markCancelled(match, CancellationReason.CREATOR_CANCELLED);
        log.info("Match {} cancelled by creator; refunded {}", matchId, match.getWager());
        return arenaResponseMapper.toMatchDetailResponse(arenaMatchRepository.save(match));
    }

    /**
     * Forces a stalled match to a terminal state once the current phase deadline has passed.
     * The side that acted in the stalled phase wins outright; when neither acted, every
     * deposit is refunded.
     */
    @Transactional
    public MatchResponses.MatchDetail claimTimeout(Long matchId, MatchRequests.ParticipantRequest request) {
        String wallet = WalletAddresses.normalize(request.wallet());
        ArenaMatch match = lockMatch(matchId);
        if (match.getStatus().isTerminal()) {
            throw ArenaOperationException.invalidState("Match " + matchId + " is already " + match.getStatus());
        }
        requireParticipant(match, wallet);

        OffsetDateTime now = OffsetDateTime.now();
        OffsetDateTime deadline = switch (match.getStatus()) {
            case CREATED -> match.getJoinDeadlineAt();
            case COMMIT_PHASE -> match.getCommitDeadlineAt();
            case REVEAL_PHASE -> match.getRevealDeadlineAt();
            default -> throw ArenaOperationException.invalidState("Match " + matchId + " has no timeout");
        };
        if (deadline == null || now.isBefore(deadline)) {
            log.warn("Rejected timeout claim on match {} by {}: deadline {} not reached", matchId, wallet, deadline);
            throw ArenaOperationException.timeoutNotReached(matchId);
        }

        if (match.getStatus() == MatchStatus.CREATED) {
            ledgerService.payout(match.getCreatorWallet(), match.getEscrowBalance(), "match " + matchId + " join timeout");
            markCancelled(match, CancellationReason.TIMEOUT_NO_ACTION);
            log.info("Match {} timed out unjoined; refunded creator {}", matchId, match.getWager());
            return arenaResponseMapper.toMatchDetailResponse(arenaMatchRepository.save(match));
        }

        boolean creatorActed;
        boolean opponentActed;
        if (match.getStatus() == MatchStatus.COMMIT_PHASE) {
            creatorActed = match.getCreatorCommitment() != null;
            opponentActed = match.getOpponentCommitment() != null;
        } else {
            creatorActed = match.getCreatorReveal() != null;
            opponentActed = match.getOpponentReveal() != null;
        }

        if (creatorActed != opponentActed) {
            String winner = creatorActed ? match.getCreatorWallet() : match.getOpponentWallet();
            log.info("Match {} timed out in {}; {} wins by default", matchId, match.getStatus(), winner);
            settle(match, winner, ResolutionMethod.TIMEOUT);
        } else {
            String reason = "match " + matchId + " timeout refund";
            ledgerService.payout(match.getCreatorWallet(), match.getWager(), reason);
            ledgerService.payout(match.getOpponentWallet(), match.getWager(), reason);
            log.info("Match {} timed out in {} with no action; refunded both sides", matchId, match.getStatus());
            markCancelled(match, CancellationReason.TIMEOUT_NO_ACTION);
        }
        return arenaResponseMapper.toMatchDetailResponse(arenaMatchRepository.save(match));
    }

    @Transactional(readOnly = true)
    public MatchResponses.MatchDetail getMatch(Long matchId) {
        ArenaMatch match = arenaMatchRepository.findById(matchId)
                .orElseThrow(() -> ArenaOperationException.matchNotFound(matchId));
        return arenaResponseMapper.toMatchDetailResponse(match);
    }

    @Transactional(readOnly = true)
    public List<MatchResponses.MatchSummary> listOpenMatches(GameType gameType) {
        List<ArenaMatch> matches = gameType == null
                ? arenaMatchRepository.findByStatusOrderByCreatedAtAsc(MatchStatus.CREATED)
                : arenaMatchRepository.findByStatusAndGameTypeOrderByCreatedAtAsc(MatchStatus.CREATED, gameType);
        return arenaResponseMapper.toMatchSummaryResponses(matches);
    }

    @Transactional(readOnly = true)
    public List<MatchResponses.MatchSummary> listMatchesForParticipant(String wallet) {
        String walletAddress = WalletAddresses.normalize(wallet);
        return arenaResponseMapper.toMatchSummaryResponses(
                arenaMatchRepository.findByCreatorWalletOrOpponentWalletOrderByMatchIdAsc(walletAddress, walletAddress)
        );
    }

    @Transactional(readOnly = true)
    public long countMatches() {
        return arenaMatchRepository.count();
    }

    /**
     * Pays the pot minus the platform fee to the winner and empties escrow.
     * A refused payout propagates and rolls back the enclosing transaction.
     */
    private void settle(ArenaMatch match, String winner, ResolutionMethod method) {
        String loser = winner.equals(match.getCreatorWallet()) ? match.getOpponentWallet() : match.getCreatorWallet();
        long pot = match.getEscrowBalance();
        long fee = platformFeeCalculator.feeFor(pot);
        long payout = platformFeeCalculator.payoutFor(pot);
        OffsetDateTime now = OffsetDateTime.now();

        match.setWinnerWallet(winner);
        match.setStatus(MatchStatus.RESOLVED);
        match.setResolutionMethod(method);
        match.setPayoutAmount(payout);
        match.setPlatformFee(fee);
        match.setEscrowBalance(0L);
        match.setResolvedAt(now);
        match.setUpdatedAt(now);

        playerStatsService.recordMatchResult(winner, loser, match.getWager(), payout);
        String reason = "match " + match.getMatchId() + " " + method.name().toLowerCase(Locale.ROOT);
        ledgerService.payout(winner, payout, reason);
        ledgerService.payPlatformFee(fee, reason);

        log.info(
                "Match {} resolved by {}: winner {} paid {} (fee {})",
                match.getMatchId(),
                method,
                winner,
                payout,
                fee
        );
    }

    private static void markCancelled(ArenaMatch match, CancellationReason reason) {
        OffsetDateTime now = OffsetDateTime.now();
        match.setStatus(MatchStatus.CANCELLED);
        match.setCancellationReason(reason);
        match.setEscrowBalance(0L);
        match.setCancelledAt(now);
        match.setUpdatedAt(now);
    }

    private ArenaMatch lockMatch(Long matchId) {
        return arenaMatchRepository.findByMatchIdForUpdate(matchId)
                .orElseThrow(() -> ArenaOperationException.matchNotFound(matchId));
    }

    private static void requireStatus(ArenaMatch match, MatchStatus expected) {
        if (match.getStatus() != expected) {
            throw ArenaOperationException.invalidState(
                    "Match " + match.getMatchId() + " is " + match.getStatus() + ", expected " + expected
            );
        }
    }

    /**
     * @return true when the wallet is the creator, false when it is the opponent
     */
    private static boolean requireParticipant(ArenaMatch match, String wallet) {
        if (wallet.equals(match.getCreatorWallet())) {
            return true;
        }
        if (wallet.equals(match.getOpponentWallet())) {
            return false;
        }
        throw ArenaOperationException.notAPlayer(match.getMatchId());
    }
}
