package com.monadarena.service;

import com.monadarena.model.GameType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;

/**
 * Compares payloads as unsigned byte strings; a strict prefix sorts lower.
 */
@Component
public class LexicographicMoveOutcomeResolver implements MoveOutcomeResolver {

    @Override
    public Set<GameType> gameTypes() {
        return Set.of();
    }

    @Override
    public MoveOutcome decide(byte[] creatorMove, byte[] opponentMove) {
        return Arrays.compareUnsigned(opponentMove, creatorMove) > 0
                ? MoveOutcome.OPPONENT
                : MoveOutcome.CREATOR;
    }
}
