package com.monadarena.repository;

import com.monadarena.model.TournamentEntrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TournamentEntrantRepository extends JpaRepository<TournamentEntrant, Long> {

    boolean existsByTournamentIdAndWalletAddress(Long tournamentId, String walletAddress);

    List<TournamentEntrant> findByTournamentIdOrderBySeatIndexAsc(Long tournamentId);
}
