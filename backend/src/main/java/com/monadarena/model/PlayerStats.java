package com.monadarena.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "player_stats")
public class PlayerStats {

    @Id
    @Column(name = "wallet_address", nullable = false, updatable = false, length = 42)
    private String walletAddress;

    @Column(name = "games_played", nullable = false)
    private Long gamesPlayed = 0L;

    @Column(name = "wins", nullable = false)
    private Long wins = 0L;

    @Column(name = "losses", nullable = false)
    private Long losses = 0L;

    @Column(name = "total_wagered", nullable = false)
    private Long totalWagered = 0L;

    @Column(name = "total_won", nullable = false)
    private Long totalWon = 0L;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
