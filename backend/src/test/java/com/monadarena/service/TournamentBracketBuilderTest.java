package com.monadarena.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TournamentBracketBuilderTest {

    private final TournamentBracketBuilder builder = new TournamentBracketBuilder();

    @Test
    void build_pairsContestantsInSeatOrder() {
        TournamentBracketBuilder.RoundPlan plan = builder.build(9L, 1, 0, List.of("w0", "w1", "w2", "w3", "w4", "w5", "w6", "w7"));

        assertEquals(4, plan.matches().size());
        for (int i = 0; i < 4; i++) {
            TournamentBracketBuilder.PlannedBracketMatch match = plan.matches().get(i);
            assertEquals(i, match.matchIndex());
            assertEquals(i, match.bracketIndex());
            assertEquals("w" + (2 * i), match.contestantA());
            assertEquals("w" + (2 * i + 1), match.contestantB());
        }
    }

    @Test
    void build_laterRoundContinuesBracketIndex() {
        TournamentBracketBuilder.RoundPlan plan = builder.build(9L, 2, 4, List.of("w1", "w2", "w5", "w6"));

        assertEquals(2, plan.round());
        assertEquals(List.of(4, 5), plan.matches().stream().map(TournamentBracketBuilder.PlannedBracketMatch::bracketIndex).toList());
        assertEquals(List.of(0, 1), plan.matches().stream().map(TournamentBracketBuilder.PlannedBracketMatch::matchIndex).toList());
    }

    @Test
    void build_rejectsOddOrDuplicateContestants() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(9L, 1, 0, List.of("w0", "w1", "w2")));
        assertThrows(IllegalArgumentException.class, () -> builder.build(9L, 1, 0, List.of("w0")));
        assertThrows(IllegalArgumentException.class, () -> builder.build(9L, 1, 0, List.of("w0", "w0")));
    }
}
