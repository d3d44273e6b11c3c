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

/**
 * One two-party wagered match. Rows are never deleted; terminal matches stay
 * for audit with a zero escrow balance.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
public class ArenaMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "match_id", nullable = false, updatable = false)
    private Long matchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_type", nullable = false, updatable = false, length = 32)
    private GameType gameType;

    @Column(name = "creator_wallet", nullable = false, updatable = false, length = 42)
    private String creatorWallet;

    @Column(name = "opponent_wallet", length = 42)
    private String opponentWallet;

    @Column(name = "wager", nullable = false, updatable = false)
    private Long wager;

    @Column(name = "escrow_balance", nullable = false)
    private Long escrowBalance = 0L;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MatchStatus status = MatchStatus.CREATED;

    @Column(name = "winner_wallet", length = 42)
    private String winnerWallet;

    @Column(name = "creator_commitment", length = 66)
    private String creatorCommitment;

    @Column(name = "opponent_commitment", length = 66)
    private String opponentCommitment;

    @Column(name = "creator_reveal", columnDefinition = "TEXT")
    private String creatorReveal;

    @Column(name = "opponent_reveal", columnDefinition = "TEXT")
    private String opponentReveal;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_method", length = 32)
    private ResolutionMethod resolutionMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_reason", length = 32)
    private CancellationReason cancellationReason;

    @Column(name = "payout_amount")
    private Long payoutAmount;

    @Column(name = "platform_fee")
    private Long platformFee;

    @Column(name = "join_deadline_at")
    private OffsetDateTime joinDeadlineAt;

    @Column(name = "commit_deadline_at")
    private OffsetDateTime commitDeadlineAt;

    @Column(name = "reveal_deadline_at")
    private OffsetDateTime revealDeadlineAt;

    @Column(name = "joined_at")
    private OffsetDateTime joinedAt;

    @Column(name = "reveal_phase_started_at")
    private OffsetDateTime revealPhaseStartedAt;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
