package com.monadarena.dto;

public record PlayerStatsResponse(
        String walletAddress,
        long gamesPlayed,
        long wins,
        long losses,
        long totalWagered,
        long totalWon
) {
}
