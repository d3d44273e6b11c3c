package com.monadarena.dto;

import com.monadarena.model.CancellationReason;
import com.monadarena.model.GameType;
import com.monadarena.model.MatchStatus;
import com.monadarena.model.ResolutionMethod;

import java.time.OffsetDateTime;

public final class MatchResponses {

    private MatchResponses() {
    }

    public record MatchSummary(
            Long matchId,
            GameType gameType,
            String creatorWallet,
            String opponentWallet,
            long wager,
            MatchStatus status,
            String winnerWallet,
            OffsetDateTime createdAt
    ) {
    }

    public record MatchDetail(
            Long matchId,
            GameType gameType,
            String creatorWallet,
            String opponentWallet,
            long wager,
            long escrowBalance,
            MatchStatus status,
            String winnerWallet,
            String creatorCommitment,
            String opponentCommitment,
            String creatorReveal,
            String opponentReveal,
            ResolutionMethod resolutionMethod,
            CancellationReason cancellationReason,
            Long payoutAmount,
            Long platformFee,
            OffsetDateTime joinDeadlineAt,
            OffsetDateTime commitDeadlineAt,
            OffsetDateTime revealDeadlineAt,
            OffsetDateTime createdAt,
            OffsetDateTime joinedAt,
            OffsetDateTime resolvedAt,
            OffsetDateTime cancelledAt
    ) {
    }

    public record MatchCount(long total) {
    }
}
