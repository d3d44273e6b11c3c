package com.monadarena.repository;

import com.monadarena.model.Tournament;
import com.monadarena.model.TournamentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TournamentRepository extends JpaRepository<Tournament, Long> {

    List<Tournament> findAllByOrderByTournamentIdAsc();

    List<Tournament> findByStatusOrderByTournamentIdAsc(TournamentStatus status);

    @Query("select coalesce(sum(t.prizePool), 0) from Tournament t where t.status in :statuses")
    long sumPrizePoolByStatusIn(@Param("statuses") Collection<TournamentStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Tournament t where t.tournamentId = :tournamentId")
    Optional<Tournament> findByTournamentIdForUpdate(@Param("tournamentId") Long tournamentId);
}
