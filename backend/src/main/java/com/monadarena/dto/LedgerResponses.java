package com.monadarena.dto;

import java.time.OffsetDateTime;

public final class LedgerResponses {

    private LedgerResponses() {
    }

    public record AccountBalance(
            String walletAddress,
            long balance,
            boolean payoutsBlocked,
            OffsetDateTime updatedAt
    ) {
    }

    public record EscrowSummary(
            long matchEscrow,
            long tournamentEscrow,
            long totalEscrow
    ) {
    }
}
