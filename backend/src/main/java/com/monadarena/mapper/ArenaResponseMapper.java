package com.monadarena.mapper;

import com.monadarena.dto.LedgerResponses;
import com.monadarena.dto.MatchResponses;
import com.monadarena.dto.PlayerStatsResponse;
import com.monadarena.dto.TournamentResponses;
import com.monadarena.model.ArenaMatch;
import com.monadarena.model.BracketMatch;
import com.monadarena.model.LedgerAccount;
import com.monadarena.model.PlayerStats;
import com.monadarena.model.Tournament;
import com.monadarena.model.TournamentEntrant;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class ArenaResponseMapper {

    public LedgerResponses.AccountBalance toAccountBalanceResponse(LedgerAccount account) {
        return new LedgerResponses.AccountBalance(
                account.getWalletAddress(),
                nullSafe(account.getBalance()),
                Boolean.TRUE.equals(account.getPayoutsBlocked()),
                account.getUpdatedAt()
        );
    }

    public MatchResponses.MatchSummary toMatchSummaryResponse(ArenaMatch match) {
        return new MatchResponses.MatchSummary(
                match.getMatchId(),
                match.getGameType(),
                match.getCreatorWallet(),
                match.getOpponentWallet(),
                nullSafe(match.getWager()),
                match.getStatus(),
                match.getWinnerWallet(),
                match.getCreatedAt()
        );
    }

    public List<MatchResponses.MatchSummary> toMatchSummaryResponses(Collection<ArenaMatch> matches) {
        return matches.stream()
                .map(this::toMatchSummaryResponse)
                .toList();
    }

    public MatchResponses.MatchDetail toMatchDetailResponse(ArenaMatch match) {
        return new MatchResponses.MatchDetail(
                match.getMatchId(),
                match.getGameType(),
                match.getCreatorWallet(),
                match.getOpponentWallet(),
                nullSafe(match.getWager()),
                nullSafe(match.getEscrowBalance()),
                match.getStatus(),
                match.getWinnerWallet(),
                match.getCreatorCommitment(),
                match.getOpponentCommitment(),
                match.getCreatorReveal(),
                match.getOpponentReveal(),
                match.getResolutionMethod(),
                match.getCancellationReason(),
                match.getPayoutAmount(),
                match.getPlatformFee(),
                match.getJoinDeadlineAt(),
                match.getCommitDeadlineAt(),
                match.getRevealDeadlineAt(),
                match.getCreatedAt(),
                match.getJoinedAt(),
                match.getResolvedAt(),
                match.getCancelledAt()
        );
    }

    public TournamentResponses.TournamentDetail toTournamentDetailResponse(Tournament tournament) {
        return new TournamentResponses.TournamentDetail(
                tournament.getTournamentId(),
                tournament.getName(),
                tournament.getGameType(),
                tournament.getCreatorWallet(),
                nullSafe(tournament.getEntryFee()),
                nullSafe(tournament.getCapacity()),
                nullSafe(tournament.getRegisteredCount()),
                tournament.getStatus(),
                nullSafe(tournament.getCurrentRound()),
                nullSafe(tournament.getPrizePool()),
                tournament.getWinnerWallet(),
                tournament.getPayoutAmount(),
                tournament.getPlatformFee(),
                tournament.getCreatedAt(),
                tournament.getStartedAt(),
                tournament.getCompletedAt(),
                tournament.getCancelledAt()
        );
    }

    public List<TournamentResponses.TournamentDetail> toTournamentDetailResponses(Collection<Tournament> tournaments) {
        return tournaments.stream()
                .map(this::toTournamentDetailResponse)
                .toList();
    }

    public TournamentResponses.Entrant toEntrantResponse(TournamentEntrant entrant) {
        return new TournamentResponses.Entrant(
                entrant.getTournamentId(),
                entrant.getWalletAddress(),
                nullSafe(entrant.getSeatIndex()),
                nullSafe(entrant.getEntryFeePaid()),
                Boolean.TRUE.equals(entrant.getRefunded()),
                entrant.getCreatedAt()
        );
    }

    public List<TournamentResponses.Entrant> toEntrantResponses(Collection<TournamentEntrant> entrants) {
        return entrants.stream()
                .map(this::toEntrantResponse)
                .toList();
    }

    public TournamentResponses.BracketMatchSummary toBracketMatchResponse(BracketMatch bracketMatch) {
        return new TournamentResponses.BracketMatchSummary(
                bracketMatch.getTournamentId(),
                nullSafe(bracketMatch.getRound()),
                nullSafe(bracketMatch.getMatchIndex()),
                nullSafe(bracketMatch.getBracketIndex()),
                bracketMatch.getContestantA(),
                bracketMatch.getContestantB(),
                bracketMatch.getWinnerWallet(),
                bracketMatch.getLinkedMatchId(),
                Boolean.TRUE.equals(bracketMatch.getCompleted()),
                bracketMatch.getCompletedAt()
        );
    }

    public List<TournamentResponses.BracketMatchSummary> toBracketMatchResponses(Collection<BracketMatch> matches) {
        return matches.stream()
                .map(this::toBracketMatchResponse)
                .toList();
    }

    public PlayerStatsResponse toPlayerStatsResponse(PlayerStats stats) {
        return new PlayerStatsResponse(
                stats.getWalletAddress(),
                nullSafe(stats.getGamesPlayed()),
                nullSafe(stats.getWins()),
                nullSafe(stats.getLosses()),
                nullSafe(stats.getTotalWagered()),
                nullSafe(stats.getTotalWon())
        );
    }

    private static long nullSafe(Long value) {
        return value == null ? 0L : value;
    }

    private static int nullSafe(Integer value) {
        return value == null ? 0 : value;
    }
}
