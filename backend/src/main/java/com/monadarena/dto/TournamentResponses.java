package com.monadarena.dto;

import com.monadarena.model.GameType;
import com.monadarena.model.TournamentStatus;

import java.time.OffsetDateTime;

public final class TournamentResponses {

    private TournamentResponses() {
    }

    public record TournamentDetail(
            Long tournamentId,
            String name,
            GameType gameType,
            String creatorWallet,
            long entryFee,
            int capacity,
            int registeredCount,
            TournamentStatus status,
            int currentRound,
            long prizePool,
            String winnerWallet,
            Long payoutAmount,
            Long platformFee,
            OffsetDateTime createdAt,
            OffsetDateTime startedAt,
            OffsetDateTime completedAt,
            OffsetDateTime cancelledAt
    ) {
    }

    public record Entrant(
            Long tournamentId,
            String walletAddress,
            int seatIndex,
            long entryFeePaid,
            boolean refunded,
            OffsetDateTime createdAt
    ) {
    }

    public record BracketMatchSummary(
            Long tournamentId,
            int round,
            int matchIndex,
            int bracketIndex,
            String contestantA,
            String contestantB,
            String winnerWallet,
            Long linkedMatchId,
            boolean completed,
            OffsetDateTime completedAt
    ) {
    }
}
