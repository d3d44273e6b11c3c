package com.monadarena.repository;

import com.monadarena.model.ArenaMatch;
import com.monadarena.model.GameType;
import com.monadarena.model.MatchStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ArenaMatchRepository extends JpaRepository<ArenaMatch, Long> {

    List<ArenaMatch> findByStatusOrderByCreatedAtAsc(MatchStatus status);

    List<ArenaMatch> findByStatusAndGameTypeOrderByCreatedAtAsc(MatchStatus status, GameType gameType);

    List<ArenaMatch> findByCreatorWalletOrOpponentWalletOrderByMatchIdAsc(String creatorWallet, String opponentWallet);

    @Query("select coalesce(sum(m.escrowBalance), 0) from ArenaMatch m")
    long sumEscrowBalance();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from ArenaMatch m where m.matchId = :matchId")
    Optional<ArenaMatch> findByMatchIdForUpdate(@Param("matchId") Long matchId);
}
