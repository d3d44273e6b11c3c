package com.monadarena.repository;

import com.monadarena.model.BracketMatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BracketMatchRepository extends JpaRepository<BracketMatch, Long> {

    List<BracketMatch> findByTournamentIdOrderByBracketIndexAsc(Long tournamentId);

    List<BracketMatch> findByTournamentIdAndRoundOrderByMatchIndexAsc(Long tournamentId, Integer round);

    Optional<BracketMatch> findByTournamentIdAndBracketIndex(Long tournamentId, Integer bracketIndex);

    long countByTournamentId(Long tournamentId);

    boolean existsByLinkedMatchId(Long linkedMatchId);
}
