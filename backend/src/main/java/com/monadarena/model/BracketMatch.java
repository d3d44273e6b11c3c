package com.monadarena.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Addressed by (tournamentId, round, matchIndex); bracketIndex is the
 * tournament-wide generation order.
 */
@Getter
@Setter
@Entity
@Table(name = "bracket_matches")
public class BracketMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "bracket_match_id", nullable = false, updatable = false)
    private Long bracketMatchId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private Long tournamentId;

    @Column(name = "round", nullable = false, updatable = false)
    private Integer round;

    @Column(name = "match_index", nullable = false, updatable = false)
    private Integer matchIndex;

    @Column(name = "bracket_index", nullable = false, updatable = false)
    private Integer bracketIndex;

    @Column(name = "contestant_a", nullable = false, updatable = false, length = 42)
    private String contestantA;

    @Column(name = "contestant_b", nullable = false, updatable = false, length = 42)
    private String contestantB;

    @Column(name = "winner_wallet", length = 42)
    private String winnerWallet;

    @Column(name = "linked_match_id")
    private Long linkedMatchId;

    @Column(name = "completed", nullable = false)
    private Boolean completed = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
