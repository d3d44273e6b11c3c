package com.monadarena.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "tournaments")
public class Tournament {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private Long tournamentId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", nullable = false, updatable = false, length = 32)
    private GameType gameType;

    @Column(name = "creator_wallet", nullable = false, updatable = false, length = 42)
    private String creatorWallet;

    @Column(name = "entry_fee", nullable = false, updatable = false)
    private Long entryFee;

    @Column(name = "capacity", nullable = false, updatable = false)
    private Integer capacity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private TournamentStatus status = TournamentStatus.REGISTRATION;

    @Column(name = "registered_count", nullable = false)
    private Integer registeredCount = 0;

    @Column(name = "current_round", nullable = false)
    private Integer currentRound = 0;

    @Column(name = "prize_pool", nullable = false)
    private Long prizePool = 0L;

    @Column(name = "winner_wallet", length = 42)
    private String winnerWallet;

    @Column(name = "payout_amount")
    private Long payoutAmount;

    @Column(name = "platform_fee")
    private Long platformFee;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;
}
