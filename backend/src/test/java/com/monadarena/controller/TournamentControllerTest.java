package com.monadarena.controller;

import com.monadarena.dto.TournamentResponses;
import com.monadarena.model.GameType;
import com.monadarena.model.TournamentStatus;
import com.monadarena.service.TournamentService;
import com.monadarena.web.ArenaOperationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TournamentController.class)
class TournamentControllerTest {

    private static final String P1 = "0x" + "1".repeat(40);
    private static final String P2 = "0x" + "2".repeat(40);
    private static final String RESOLVER = "0x" + "e".repeat(40);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TournamentService tournamentService;

    @Test
    void createTournamentReturnsCreatedPayload() throws Exception {
        when(tournamentService.createTournament(any())).thenReturn(sampleDetail(TournamentStatus.REGISTRATION));

        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "wallet": "%s",
                                  "name": "Friday Night Poker",
                                  "gameType": "POKER",
                                  "entryFee": 10000000,
                                  "capacity": 4
                                }
                                """.formatted(P1)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.tournamentId").value(3))
                .andExpect(jsonPath("$.status").value("REGISTRATION"))
                .andExpect(jsonPath("$.capacity").value(4));
    }

    @Test
    void createTournamentValidationFailureReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tournaments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "wallet": "%s",
                                  "name": " ",
                                  "gameType": "POKER",
                                  "entryFee": 10000000
                                }
                                """.formatted(P1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.name").value("name is required"))
                .andExpect(jsonPath("$.fieldErrors.capacity").value("capacity is required"));

        verify(tournamentService, never()).createTournament(any());
    }

    @Test
    void registerWithWrongFeeReturnsBadRequest() throws Exception {
        when(tournamentService.register(eq(3L), any()))
                .thenThrow(ArenaOperationException.entryFeeMismatch(10_000_000L, 9L));

        mockMvc.perform(post("/api/tournaments/3/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet": "%s", "payment": 9}
                                """.formatted(P2)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("entry_fee_mismatch"));
    }

    @Test
    void resolveBracketMatchPassesFlatIndex() throws Exception {
        when(tournamentService.resolveMatch(eq(3L), eq(2), any()))
                .thenReturn(sampleDetail(TournamentStatus.COMPLETED));

        mockMvc.perform(post("/api/tournaments/3/matches/2/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet": "%s", "winner": "%s"}
                                """.formatted(RESOLVER, P2)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void resolveAlreadyResolvedMatchReturnsConflict() throws Exception {
        when(tournamentService.resolveMatch(eq(3L), eq(0), any()))
                .thenThrow(ArenaOperationException.matchAlreadyResolved(0));

        mockMvc.perform(post("/api/tournaments/3/matches/0/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet": "%s", "winner": "%s"}
                                """.formatted(RESOLVER, P2)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("match_already_resolved"));
    }

    @Test
    void listBracketMatchesReturnsFlatOrder() throws Exception {
        when(tournamentService.listBracketMatches(3L)).thenReturn(List.of(
                new TournamentResponses.BracketMatchSummary(3L, 1, 0, 0, P1, P2, P2, null, true, null),
                new TournamentResponses.BracketMatchSummary(3L, 1, 1, 1, P1, P2, null, null, false, null)
        ));

        mockMvc.perform(get("/api/tournaments/3/matches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].bracketIndex").value(0))
                .andExpect(jsonPath("$[0].completed").value(true))
                .andExpect(jsonPath("$[1].bracketIndex").value(1));
    }

    @Test
    void getTournamentReturnsNotFoundForUnknownId() throws Exception {
        when(tournamentService.getTournament(99L)).thenThrow(ArenaOperationException.tournamentNotFound(99L));

        mockMvc.perform(get("/api/tournaments/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("tournament_not_found"));
    }

    private static TournamentResponses.TournamentDetail sampleDetail(TournamentStatus status) {
        OffsetDateTime createdAt = OffsetDateTime.parse("2026-03-01T10:00:00Z");
        return new TournamentResponses.TournamentDetail(
                3L,
                "Friday Night Poker",
                GameType.POKER,
                P1,
                10_000_000L,
                4,
                0,
                status,
                0,
                0L,
                null,
                null,
                null,
                createdAt,
                null,
                null,
                null
        );
    }
}
