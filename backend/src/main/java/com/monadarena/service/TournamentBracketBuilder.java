package com.monadarena.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairs contestants in fixed order [0,1], [2,3], ... for one round.
 */
@Component
public class TournamentBracketBuilder {

    public RoundPlan build(Long tournamentId, int round, int firstBracketIndex, List<String> contestants) {
        if (round < 1) {
            throw new IllegalArgumentException("Round must be at least 1: " + round);
        }
        if (contestants == null || contestants.size() < 2 || Integer.bitCount(contestants.size()) != 1) {
            throw new IllegalArgumentException(
                    "A round needs a power-of-two number of contestants, got "
                            + (contestants == null ? 0 : contestants.size())
            );
        }
        validateContestants(contestants);

        List<PlannedBracketMatch> matches = new ArrayList<>(contestants.size() / 2);
        for (int matchIndex = 0; matchIndex < contestants.size() / 2; matchIndex++) {
            matches.add(new PlannedBracketMatch(
                    tournamentId,
                    round,
                    matchIndex,
                    firstBracketIndex + matchIndex,
                    contestants.get(matchIndex * 2),
                    contestants.get(matchIndex * 2 + 1)
            ));
        }
        return new RoundPlan(round, List.copyOf(matches));
    }

    private static void validateContestants(List<String> contestants) {
        Set<String> seen = new HashSet<>();
        for (String contestant : contestants) {
            if (contestant == null) {
                throw new IllegalArgumentException("Contestant wallet is missing");
            }
            if (!seen.add(contestant)) {
                throw new IllegalArgumentException("Duplicate contestant in round: " + contestant);
            }
        }
    }

    public record RoundPlan(
            int round,
            List<PlannedBracketMatch> matches
    ) {
    }

    public record PlannedBracketMatch(
            Long tournamentId,
            int round,
            int matchIndex,
            int bracketIndex,
            String contestantA,
            String contestantB
    ) {
    }
}
