package com.monadarena.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public final class LedgerRequests {

    private LedgerRequests() {
    }

    public record DepositRequest(
            @NotNull(message = "amount is required")
            @Positive(message = "amount must be positive")
            Long amount
    ) {
    }

    public record PayoutBlockRequest(
            @NotBlank(message = "wallet is required")
            String wallet,
            @NotNull(message = "blocked is required")
            Boolean blocked
    ) {
    }
}
