package com.monadarena.service;

import com.monadarena.model.GameType;

import java.util.Set;

/**
 * Decides a revealed match from both payloads. Implementations must be
 * deterministic and return {@link MoveOutcome#CREATOR} on a tie.
 */
public interface MoveOutcomeResolver {

    /**
     * Game types this resolver owns. An empty set marks the fallback used for
     * any game type without a dedicated resolver.
     */
    Set<GameType> gameTypes();

    MoveOutcome decide(byte[] creatorMove, byte[] opponentMove);
}
