package com.monadarena.controller;

import com.monadarena.dto.PlayerStatsResponse;
import com.monadarena.service.PlayerStatsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StatsController.class)
class StatsControllerTest {

    private static final String ALICE = "0x" + "a".repeat(40);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PlayerStatsService playerStatsService;

    @Test
    void leaderboardUsesDefaultLimit() throws Exception {
        when(playerStatsService.leaderboard(10)).thenReturn(List.of(
                new PlayerStatsResponse(ALICE, 3L, 2L, 1L, 30_000_000L, 39_000_000L)
        ));

        mockMvc.perform(get("/api/stats/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].walletAddress").value(ALICE))
                .andExpect(jsonPath("$[0].wins").value(2));
    }

    @Test
    void getStatsReturnsCounters() throws Exception {
        when(playerStatsService.getStats(ALICE)).thenReturn(new PlayerStatsResponse(ALICE, 0L, 0L, 0L, 0L, 0L));

        mockMvc.perform(get("/api/stats/" + ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gamesPlayed").value(0));
    }
}
