package com.monadarena.repository;

import com.monadarena.model.PlayerStats;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerStatsRepository extends JpaRepository<PlayerStats, String> {

    List<PlayerStats> findAllByOrderByWinsDescTotalWonDescWalletAddressAsc(Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from PlayerStats s where s.walletAddress = :walletAddress")
    Optional<PlayerStats> findByWalletAddressForUpdate(@Param("walletAddress") String walletAddress);
}
