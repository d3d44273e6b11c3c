package com.monadarena.controller;

import com.monadarena.dto.PlayerStatsResponse;
import com.monadarena.service.PlayerStatsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final PlayerStatsService playerStatsService;

    public StatsController(PlayerStatsService playerStatsService) {
        this.playerStatsService = playerStatsService;
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<PlayerStatsResponse>> leaderboard(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(playerStatsService.leaderboard(limit));
    }

    @GetMapping("/{wallet}")
    public ResponseEntity<PlayerStatsResponse> getStats(@PathVariable String wallet) {
        return ResponseEntity.ok(playerStatsService.getStats(wallet));
    }
}
