package com.monadarena.dto;

import com.monadarena.model.GameType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public final class MatchRequests {

    private MatchRequests() {
    }

    public record CreateMatchRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotNull(message = "gameType is required")
            GameType gameType,

            @NotNull(message = "wager is required")
            @Positive(message = "wager must be positive")
            Long wager
    ) {
    }

    public record JoinMatchRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotNull(message = "wager is required")
            @Positive(message = "wager must be positive")
            Long wager
    ) {
    }

    public record CommitMoveRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotBlank(message = "commitment is required")
            String commitment
    ) {
    }

    public record RevealMoveRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotBlank(message = "move is required")
            String move,

            @NotBlank(message = "salt is required")
            String salt
    ) {
    }

    public record ResolveMatchRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotBlank(message = "winner is required")
            String winner
    ) {
    }

    public record ParticipantRequest(
            @NotBlank(message = "wallet is required")
            String wallet
    ) {
    }
}
