package com.monadarena.controller;

import com.monadarena.dto.MatchRequests;
import com.monadarena.dto.MatchResponses;
import com.monadarena.model.GameType;
import com.monadarena.service.MatchEscrowService;
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
@RequestMapping("/api/matches")
public class MatchController {

    private final MatchEscrowService matchEscrowService;

    public MatchController(MatchEscrowService matchEscrowService) {
        this.matchEscrowService = matchEscrowService;
    }

    @PostMapping
    public ResponseEntity<MatchResponses.MatchDetail> createMatch(
            @Valid @RequestBody MatchRequests.CreateMatchRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(matchEscrowService.createMatch(request));
    }

    @GetMapping
    public ResponseEntity<List<MatchResponses.MatchSummary>> listOpenMatches(
            @RequestParam(required = false) GameType gameType
    ) {
        return ResponseEntity.ok(matchEscrowService.listOpenMatches(gameType));
    }

    @GetMapping("/count")
    public ResponseEntity<MatchResponses.MatchCount> countMatches() {
        return ResponseEntity.ok(new MatchResponses.MatchCount(matchEscrowService.countMatches()));
    }

    @GetMapping("/participants/{wallet}")
    public ResponseEntity<List<MatchResponses.MatchSummary>> listMatchesForParticipant(@PathVariable String wallet) {
        return ResponseEntity.ok(matchEscrowService.listMatchesForParticipant(wallet));
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<MatchResponses.MatchDetail> getMatch(@PathVariable Long matchId) {
        return ResponseEntity.ok(matchEscrowService.getMatch(matchId));
    }

    @PostMapping("/{matchId}/join")
    public ResponseEntity<MatchResponses.MatchDetail> joinMatch(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.JoinMatchRequest request
    ) {
        return ResponseEntity.ok(matchEscrowService.joinMatch(matchId, request));
    }

    @PostMapping("/{matchId}/commit")
    public ResponseEntity<MatchResponses.MatchDetail> commitMove(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.CommitMoveRequest request
    ) {
        return ResponseEntity.ok(matchEscrowService.commitMove(matchId, request));
    }

    @PostMapping("/{matchId}/reveal")
    public ResponseEntity<MatchResponses.MatchDetail> revealMove(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.RevealMoveRequest request
    ) {
        return ResponseEntity.ok(matchEscrowService.revealMove(matchId, request));
    }

    @PostMapping("/{matchId}/resolve")
    public ResponseEntity<MatchResponses.MatchDetail> resolveMatch(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.ResolveMatchRequest request
    ) {
        return ResponseEntity.ok(matchEscrowService.resolveByResolver(matchId, request));
    }

    @PostMapping("/{matchId}/cancel")
    public ResponseEntity<MatchResponses.MatchDetail> cancelMatch(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.ParticipantRequest request
    ) {
        return ResponseEntity.ok(matchEscrowService.cancelMatch(matchId, request));
    }

    @PostMapping("/{matchId}/claim-timeout")
    public ResponseEntity<MatchResponses.MatchDetail> claimTimeout(
            @PathVariable Long matchId,
            @Valid @RequestBody MatchRequests.ParticipantRequest request
    ) {
        return ResponseEntity.ok(matchEscrowService.claimTimeout(matchId, request));
    }
}
