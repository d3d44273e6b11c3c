package com.monadarena.dto;

import com.monadarena.model.GameType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public final class TournamentRequests {

    private TournamentRequests() {
    }

    public record CreateTournamentRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotBlank(message = "name is required")
            @Size(max = 200, message = "name must be at most 200 characters")
            String name,

            @NotNull(message = "gameType is required")
            GameType gameType,

            @NotNull(message = "entryFee is required")
            @Positive(message = "entryFee must be positive")
            Long entryFee,

            @NotNull(message = "capacity is required")
            Integer capacity
    ) {
    }

    public record RegisterRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotNull(message = "payment is required")
            @Positive(message = "payment must be positive")
            Long payment
    ) {
    }

    public record ResolveBracketMatchRequest(
            @NotBlank(message = "wallet is required")
            String wallet,

            @NotBlank(message = "winner is required")
            String winner,

            Long linkedMatchId
    ) {
    }

    public record CancelTournamentRequest(
            @NotBlank(message = "wallet is required")
            String wallet
    ) {
    }
}
