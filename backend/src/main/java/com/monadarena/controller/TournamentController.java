package com.monadarena.controller;

import com.monadarena.dto.TournamentRequests;
import com.monadarena.dto.TournamentResponses;
import com.monadarena.model.TournamentStatus;
import com.monadarena.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;

    public TournamentController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    @PostMapping
    public ResponseEntity<TournamentResponses.TournamentDetail> createTournament(
            @Valid @RequestBody TournamentRequests.CreateTournamentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tournamentService.createTournament(request));
    }

    @GetMapping
    public ResponseEntity<List<TournamentResponses.TournamentDetail>> listTournaments(
            @RequestParam(required = false) TournamentStatus status
    ) {
        return ResponseEntity.ok(tournamentService.listTournaments(status));
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> getTournament(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(tournamentService.getTournament(tournamentId));
    }

    @PostMapping("/{tournamentId}/register")
    public ResponseEntity<TournamentResponses.TournamentDetail> register(
            @PathVariable Long tournamentId,
            @Valid @RequestBody TournamentRequests.RegisterRequest request
    ) {
        return ResponseEntity.ok(tournamentService.register(tournamentId, request));
    }

    @GetMapping("/{tournamentId}/entrants")
    public ResponseEntity<List<TournamentResponses.Entrant>> listEntrants(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(tournamentService.listEntrants(tournamentId));
    }

    @GetMapping("/{tournamentId}/matches")
    public ResponseEntity<List<TournamentResponses.BracketMatchSummary>> listBracketMatches(
            @PathVariable Long tournamentId
    ) {
        return ResponseEntity.ok(tournamentService.listBracketMatches(tournamentId));
    }

    @PostMapping("/{tournamentId}/matches/{bracketIndex}/resolve")
    public ResponseEntity<TournamentResponses.TournamentDetail> resolveMatch(
            @PathVariable Long tournamentId,
            @PathVariable Integer bracketIndex,
            @Valid @RequestBody TournamentRequests.ResolveBracketMatchRequest request
    ) {
        return ResponseEntity.ok(tournamentService.resolveMatch(tournamentId, bracketIndex, request));
    }

    @PostMapping("/{tournamentId}/cancel")
    public ResponseEntity<TournamentResponses.TournamentDetail> cancelTournament(
            @PathVariable Long tournamentId,
            @Valid @RequestBody TournamentRequests.CancelTournamentRequest request
    ) {
        return ResponseEntity.ok(tournamentService.cancelTournament(tournamentId, request));
    }
}
