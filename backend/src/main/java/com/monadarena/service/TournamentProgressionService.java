package com.monadarena.service;

import com.monadarena.model.BracketMatch;
import com.monadarena.model.Tournament;
import com.monadarena.model.TournamentEntrant;
import com.monadarena.model.TournamentStatus;
import com.monadarena.repository.BracketMatchRepository;
import com.monadarena.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Round generation and prize distribution. Callers hold the tournament row lock
 * and run inside their own transaction.
 */
@Service
@RequiredArgsConstructor
public class TournamentProgressionService {

    private static final Logger log = LoggerFactory.getLogger(TournamentProgressionService.class);

    private final TournamentRepository tournamentRepository;
    private final BracketMatchRepository bracketMatchRepository;
    private final TournamentBracketBuilder tournamentBracketBuilder;
    private final PlatformFeeCalculator platformFeeCalculator;
    private final LedgerService ledgerService;
    private final PlayerStatsService playerStatsService;

    public void startTournament(Tournament tournament, List<TournamentEntrant> entrants, OffsetDateTime now) {
        if (tournament.getStatus() != TournamentStatus.REGISTRATION) {
            throw new IllegalStateException(
                    "Tournament " + tournament.getTournamentId() + " cannot start from " + tournament.getStatus()
            );
        }

        List<String> seats = entrants.stream()
                .map(TournamentEntrant::getWalletAddress)
                .toList();
        generateRound(tournament, 1, seats, now);

        tournament.setStatus(TournamentStatus.ACTIVE);
        tournament.setStartedAt(now);
        tournament.setUpdatedAt(now);
        tournamentRepository.save(tournament);
        log.info("Tournament {} started with {} entrants", tournament.getTournamentId(), seats.size());
    }

    /**
     * Generates the next round or pays the champion once every match of the current round is complete.
     *
     * @return true when the round was complete and the tournament moved on
     */
    public boolean advanceIfRoundComplete(Tournament tournament, OffsetDateTime now) {
        if (tournament.getStatus() != TournamentStatus.ACTIVE) {
            return false;
        }

        List<BracketMatch> currentRound = bracketMatchRepository.findByTournamentIdAndRoundOrderByMatchIndexAsc(
                tournament.getTournamentId(),
                tournament.getCurrentRound()
        );
        if (currentRound.isEmpty() || currentRound.stream().anyMatch(match -> !Boolean.TRUE.equals(match.getCompleted()))) {
            return false;
        }

        List<String> winners = currentRound.stream()
                .map(BracketMatch::getWinnerWallet)
                .toList();
        if (winners.size() == 1) {
            completeTournament(tournament, winners.get(0), now);
        } else {
            generateRound(tournament, tournament.getCurrentRound() + 1, winners, now);
            tournament.setUpdatedAt(now);
            tournamentRepository.save(tournament);
        }
        return true;
    }

    private void generateRound(Tournament tournament, int round, List<String> contestants, OffsetDateTime now) {
        int firstBracketIndex = Math.toIntExact(bracketMatchRepository.countByTournamentId(tournament.getTournamentId()));
        TournamentBracketBuilder.RoundPlan plan =
                tournamentBracketBuilder.build(tournament.getTournamentId(), round, firstBracketIndex, contestants);

        List<BracketMatch> matches = plan.matches().stream()
                .map(planned -> {
                    BracketMatch match = new BracketMatch();
                    match.setTournamentId(planned.tournamentId());
                    match.setRound(planned.round());
                    match.setMatchIndex(planned.matchIndex());
                    match.setBracketIndex(planned.bracketIndex());
                    match.setContestantA(planned.contestantA());
                    match.setContestantB(planned.contestantB());
                    match.setCompleted(false);
                    match.setCreatedAt(now);
                    return match;
                })
                .toList();
        bracketMatchRepository.saveAll(matches);

        tournament.setCurrentRound(round);
        log.info(
                "Tournament {} round {} generated with {} matches",
                tournament.getTournamentId(),
                round,
                matches.size()
        );
    }

    private void completeTournament(Tournament tournament, String champion, OffsetDateTime now) {
        long prizePool = tournament.getPrizePool();
        long fee = platformFeeCalculator.feeFor(prizePool);
        long payout = platformFeeCalculator.payoutFor(prizePool);

        tournament.setWinnerWallet(champion);
        tournament.setPayoutAmount(payout);
        tournament.setPlatformFee(fee);
        tournament.setStatus(TournamentStatus.COMPLETED);
        tournament.setCompletedAt(now);
        tournament.setUpdatedAt(now);

        playerStatsService.recordPrize(champion, payout);
        String reason = "tournament " + tournament.getTournamentId() + " prize";
        ledgerService.payout(champion, payout, reason);
        ledgerService.payPlatformFee(fee, reason);
        tournamentRepository.save(tournament);

        log.info(
                "Tournament {} completed: champion {} paid {} (fee {})",
                tournament.getTournamentId(),
                champion,
                payout,
                fee
        );
    }
}
