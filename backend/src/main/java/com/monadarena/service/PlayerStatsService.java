package com.monadarena.service;

import com.monadarena.dto.PlayerStatsResponse;
import com.monadarena.mapper.ArenaResponseMapper;
import com.monadarena.model.PlayerStats;
import com.monadarena.repository.PlayerStatsRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Cumulative per-wallet counters. Written only from match and bracket
 * resolution; counters never decrease.
 */
@Service
public class PlayerStatsService {

    static final int MAX_LEADERBOARD_SIZE = 100;

    private final PlayerStatsRepository playerStatsRepository;
    private final ArenaResponseMapper arenaResponseMapper;

    public PlayerStatsService(PlayerStatsRepository playerStatsRepository, ArenaResponseMapper arenaResponseMapper) {
        this.playerStatsRepository = playerStatsRepository;
        this.arenaResponseMapper = arenaResponseMapper;
    }

    @Transactional
    public void recordMatchResult(String winnerWallet, String loserWallet, long wager, long winnings) {
        OffsetDateTime now = OffsetDateTime.now();

        PlayerStats winner = lockOrCreate(winnerWallet);
        winner.setGamesPlayed(winner.getGamesPlayed() + 1);
        winner.setWins(winner.getWins() + 1);
        winner.setTotalWagered(Math.addExact(winner.getTotalWagered(), wager));
        winner.setTotalWon(Math.addExact(winner.getTotalWon(), winnings));
        winner.setUpdatedAt(now);
        playerStatsRepository.save(winner);

        PlayerStats loser = lockOrCreate(loserWallet);
        loser.setGamesPlayed(loser.getGamesPlayed() + 1);
        loser.setLosses(loser.getLosses() + 1);
        loser.setTotalWagered(Math.addExact(loser.getTotalWagered(), wager));
        loser.setUpdatedAt(now);
        playerStatsRepository.save(loser);
    }

    @Transactional
    public void recordBracketResult(String winnerWallet, String loserWallet) {
        recordMatchResult(winnerWallet, loserWallet, 0L, 0L);
    }

    @Transactional
    public void recordPrize(String walletAddress, long prize) {
        PlayerStats stats = lockOrCreate(walletAddress);
        stats.setTotalWon(Math.addExact(stats.getTotalWon(), prize));
        stats.setUpdatedAt(OffsetDateTime.now());
        playerStatsRepository.save(stats);
    }

    @Transactional(readOnly = true)
    public PlayerStatsResponse getStats(String wallet) {
        String walletAddress = WalletAddresses.normalize(wallet);
        PlayerStats stats = playerStatsRepository.findById(walletAddress)
                .orElseGet(() -> newStats(walletAddress));
        return arenaResponseMapper.toPlayerStatsResponse(stats);
    }

    @Transactional(readOnly = true)
    public List<PlayerStatsResponse> leaderboard(int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_LEADERBOARD_SIZE));
        return playerStatsRepository.findAllByOrderByWinsDescTotalWonDescWalletAddressAsc(PageRequest.of(0, pageSize))
                .stream()
                .map(arenaResponseMapper::toPlayerStatsResponse)
                .toList();
    }

    private PlayerStats lockOrCreate(String walletAddress) {
        return playerStatsRepository.findByWalletAddressForUpdate(walletAddress)
                .orElseGet(() -> newStats(walletAddress));
    }

    private static PlayerStats newStats(String walletAddress) {
        PlayerStats stats = new PlayerStats();
        stats.setWalletAddress(walletAddress);
        return stats;
    }
}
