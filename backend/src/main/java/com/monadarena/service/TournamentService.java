package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import com.monadarena.dto.TournamentRequests;
import com.monadarena.dto.TournamentResponses;
import com.monadarena.mapper.ArenaResponseMapper;
import com.monadarena.model.ArenaMatch;
import com.monadarena.model.BracketMatch;
import com.monadarena.model.MatchStatus;
import com.monadarena.model.Tournament;
import com.monadarena.model.TournamentEntrant;
import com.monadarena.model.TournamentStatus;
import com.monadarena.repository.ArenaMatchRepository;
import com.monadarena.repository.BracketMatchRepository;
import com.monadarena.repository.TournamentEntrantRepository;
import com.monadarena.repository.TournamentRepository;
import com.monadarena.web.ArenaOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

@Service
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentEntrantRepository tournamentEntrantRepository;
    private final BracketMatchRepository bracketMatchRepository;
    private final ArenaMatchRepository arenaMatchRepository;
    private final TournamentProgressionService tournamentProgressionService;
    private final LedgerService ledgerService;
    private final PlayerStatsService playerStatsService;
    private final ResolverAuthorization resolverAuthorization;
    private final ArenaResponseMapper arenaResponseMapper;
    private final ArenaProperties arenaProperties;

    public TournamentService(
            TournamentRepository tournamentRepository,
            TournamentEntrantRepository tournamentEntrantRepository,
            BracketMatchRepository bracketMatchRepository,
            ArenaMatchRepository arenaMatchRepository,
            TournamentProgressionService tournamentProgressionService,
            LedgerService ledgerService,
            PlayerStatsService playerStatsService,
            ResolverAuthorization resolverAuthorization,
            ArenaResponseMapper arenaResponseMapper,
            ArenaProperties arenaProperties
    ) {
        this.tournamentRepository = tournamentRepository;
        this.tournamentEntrantRepository = tournamentEntrantRepository;
        this.bracketMatchRepository = bracketMatchRepository;
        this.arenaMatchRepository = arenaMatchRepository;
        this.tournamentProgressionService = tournamentProgressionService;
        this.ledgerService = ledgerService;
        this.playerStatsService = playerStatsService;
        this.resolverAuthorization = resolverAuthorization;
        this.arenaResponseMapper = arenaResponseMapper;
        this.arenaProperties = arenaProperties;
    }

    @Transactional
    public TournamentResponses.TournamentDetail createTournament(TournamentRequests.CreateTournamentRequest request) {
        String creatorWallet = WalletAddresses.normalize(request.wallet());
        Integer capacity = request.capacity();
        if (capacity == null || !arenaProperties.getTournament().getAllowedCapacities().contains(capacity)) {
            throw ArenaOperationException.invalidCapacity(capacity);
        }
        long entryFee = request.entryFee();
        ArenaProperties.Match matchConfig = arenaProperties.getMatch();
        if (entryFee < matchConfig.getMinWager() || entryFee > matchConfig.getMaxWager()) {
            throw ArenaOperationException.invalidEntryFee(entryFee);
        }

        OffsetDateTime now = OffsetDateTime.now();
        Tournament tournament = new Tournament();
        tournament.setName(request.name().trim());
        tournament.setGameType(request.gameType());
        tournament.setCreatorWallet(creatorWallet);
        tournament.setEntryFee(entryFee);
        tournament.setCapacity(capacity);
        tournament.setStatus(TournamentStatus.REGISTRATION);
        tournament.setRegisteredCount(0);
        tournament.setCurrentRound(0);
        tournament.setPrizePool(0L);
        tournament.setCreatedAt(now);
        tournament.setUpdatedAt(now);

        Tournament saved = tournamentRepository.save(tournament);
        log.info(
                "Tournament {} '{}' created by {} (capacity {}, entry fee {})",
                saved.getTournamentId(),
                saved.getName(),
                creatorWallet,
                capacity,
                entryFee
        );
        return arenaResponseMapper.toTournamentDetailResponse(saved);
    }

    /**
     * Collects the entry fee and takes the next seat. Filling the last seat starts round 1.
     */
    @Transactional
    public TournamentResponses.TournamentDetail register(Long tournamentId, TournamentRequests.RegisterRequest request) {
        String wallet = WalletAddresses.normalize(request.wallet());
        Tournament tournament = lockTournament(tournamentId);
        if (tournament.getStatus() != TournamentStatus.REGISTRATION) {
            throw ArenaOperationException.invalidState(
                    "Tournament " + tournamentId + " is not open for registration: " + tournament.getStatus()
            );
        }
        if (tournament.getRegisteredCount() >= tournament.getCapacity()) {
            throw ArenaOperationException.tournamentFull(tournamentId);
        }
        if (tournamentEntrantRepository.existsByTournamentIdAndWalletAddress(tournamentId, wallet)) {
            throw ArenaOperationException.alreadyRegistered(tournamentId);
        }
        if (request.payment() != tournament.getEntryFee().longValue()) {
            throw ArenaOperationException.entryFeeMismatch(tournament.getEntryFee(), request.payment());
        }

        ledgerService.collect(wallet, tournament.getEntryFee(), "tournament " + tournamentId + " entry fee");

        OffsetDateTime now = OffsetDateTime.now();
        TournamentEntrant entrant = new TournamentEntrant();
        entrant.setTournamentId(tournamentId);
        entrant.setWalletAddress(wallet);
        entrant.setSeatIndex(tournament.getRegisteredCount());
        entrant.setEntryFeePaid(tournament.getEntryFee());
        entrant.setRefunded(false);
        entrant.setCreatedAt(now);
        tournamentEntrantRepository.save(entrant);

        tournament.setRegisteredCount(tournament.getRegisteredCount() + 1);
        tournament.setPrizePool(Math.addExact(tournament.getPrizePool(), tournament.getEntryFee()));
        tournament.setUpdatedAt(now);
        log.info(
                "{} registered for tournament {} ({}/{})",
                wallet,
                tournamentId,
                tournament.getRegisteredCount(),
                tournament.getCapacity()
        );

        if (tournament.getRegisteredCount().equals(tournament.getCapacity())) {
            List<TournamentEntrant> entrants = tournamentEntrantRepository.findByTournamentIdOrderBySeatIndexAsc(tournamentId);
            tournamentProgressionService.startTournament(tournament, entrants, now);
        } else {
            tournamentRepository.save(tournament);
        }
        return arenaResponseMapper.toTournamentDetailResponse(tournament);
    }

    /**
     * Records a bracket match winner declared by a resolver, then advances the bracket
     * when that completes the current round.
     */
    @Transactional
    public TournamentResponses.TournamentDetail resolveMatch(
            Long tournamentId,
            Integer bracketIndex,
            TournamentRequests.ResolveBracketMatchRequest request
    ) {
        resolverAuthorization.requireResolver(request.wallet());
        Tournament tournament = lockTournament(tournamentId);
        if (tournament.getStatus() != TournamentStatus.ACTIVE) {
            throw ArenaOperationException.invalidState(
                    "Tournament " + tournamentId + " is not active: " + tournament.getStatus()
            );
        }

        BracketMatch bracketMatch = bracketMatchRepository.findByTournamentIdAndBracketIndex(tournamentId, bracketIndex)
                .orElseThrow(() -> ArenaOperationException.bracketMatchNotFound(tournamentId, bracketIndex));
        if (Boolean.TRUE.equals(bracketMatch.getCompleted())) {
            throw ArenaOperationException.matchAlreadyResolved(bracketIndex);
        }

        String winner = WalletAddresses.normalize(request.winner());
        String loser;
        if (winner.equals(bracketMatch.getContestantA())) {
            loser = bracketMatch.getContestantB();
        } else if (winner.equals(bracketMatch.getContestantB())) {
            loser = bracketMatch.getContestantA();
        } else {
            throw ArenaOperationException.invalidWinner(winner);
        }
        if (request.linkedMatchId() != null) {
            requireLinkedMatchAgrees(request.linkedMatchId(), bracketMatch, winner);
        }

        OffsetDateTime now = OffsetDateTime.now();
        bracketMatch.setWinnerWallet(winner);
        bracketMatch.setLinkedMatchId(request.linkedMatchId());
        bracketMatch.setCompleted(true);
        bracketMatch.setCompletedAt(now);
        bracketMatchRepository.save(bracketMatch);
        // a linked arena match already counted this contest when it settled
        if (request.linkedMatchId() == null) {
            playerStatsService.recordBracketResult(winner, loser);
        }
        log.info(
                "Tournament {} bracket match {} (round {}) won by {}",
                tournamentId,
                bracketIndex,
                bracketMatch.getRound(),
                winner
        );

        tournamentProgressionService.advanceIfRoundComplete(tournament, now);
        return arenaResponseMapper.toTournamentDetailResponse(tournament);
    }

    @Transactional
    public TournamentResponses.TournamentDetail cancelTournament(
            Long tournamentId,
            TournamentRequests.CancelTournamentRequest request
    ) {
        resolverAuthorization.requireResolver(request.wallet());
        Tournament tournament = lockTournament(tournamentId);
        if (tournament.getStatus() != TournamentStatus.REGISTRATION && tournament.getStatus() != TournamentStatus.ACTIVE) {
            throw ArenaOperationException.invalidState(
                    "Tournament " + tournamentId + " cannot be cancelled from " + tournament.getStatus()
            );
        }

        List<TournamentEntrant> entrants = tournamentEntrantRepository.findByTournamentIdOrderBySeatIndexAsc(tournamentId);
        String reason = "tournament " + tournamentId + " cancelled";
        for (TournamentEntrant entrant : entrants) {
            if (Boolean.TRUE.equals(entrant.getRefunded())) {
                continue;
            }
            ledgerService.payout(entrant.getWalletAddress(), entrant.getEntryFeePaid(), reason);
            entrant.setRefunded(true);
        }
        tournamentEntrantRepository.saveAll(entrants);

        OffsetDateTime now = OffsetDateTime.now();
        tournament.setStatus(TournamentStatus.CANCELLED);
        tournament.setCancelledAt(now);
        tournament.setUpdatedAt(now);
        Tournament saved = tournamentRepository.save(tournament);
        log.info("Tournament {} cancelled; refunded {} entrants", tournamentId, entrants.size());
        return arenaResponseMapper.toTournamentDetailResponse(saved);
    }

    @Transactional(readOnly = true)
    public TournamentResponses.TournamentDetail getTournament(Long tournamentId) {
        Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> ArenaOperationException.tournamentNotFound(tournamentId));
        return arenaResponseMapper.toTournamentDetailResponse(tournament);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.TournamentDetail> listTournaments(TournamentStatus status) {
        List<Tournament> tournaments = status == null
                ? tournamentRepository.findAllByOrderByTournamentIdAsc()
                : tournamentRepository.findByStatusOrderByTournamentIdAsc(status);
        return arenaResponseMapper.toTournamentDetailResponses(tournaments);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.BracketMatchSummary> listBracketMatches(Long tournamentId) {
        requireTournamentExists(tournamentId);
        return arenaResponseMapper.toBracketMatchResponses(
                bracketMatchRepository.findByTournamentIdOrderByBracketIndexAsc(tournamentId)
        );
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.Entrant> listEntrants(Long tournamentId) {
        requireTournamentExists(tournamentId);
        return arenaResponseMapper.toEntrantResponses(
                tournamentEntrantRepository.findByTournamentIdOrderBySeatIndexAsc(tournamentId)
        );
    }

    private void requireLinkedMatchAgrees(Long linkedMatchId, BracketMatch bracketMatch, String winner) {
        ArenaMatch linked = arenaMatchRepository.findById(linkedMatchId)
                .orElseThrow(() -> ArenaOperationException.matchNotFound(linkedMatchId));
        if (bracketMatchRepository.existsByLinkedMatchId(linkedMatchId)) {
            throw ArenaOperationException.linkedMatchMismatch(
                    "Linked match " + linkedMatchId + " already decided another bracket match"
            );
        }
        if (linked.getStatus() != MatchStatus.RESOLVED) {
            throw ArenaOperationException.linkedMatchMismatch(
                    "Linked match " + linkedMatchId + " is not resolved: " + linked.getStatus()
            );
        }
        Set<String> contestants = Set.of(bracketMatch.getContestantA(), bracketMatch.getContestantB());
        if (!contestants.contains(linked.getCreatorWallet()) || !contestants.contains(linked.getOpponentWallet())) {
            throw ArenaOperationException.linkedMatchMismatch(
                    "Linked match " + linkedMatchId + " was not played between the bracket contestants"
            );
        }
        if (!winner.equals(linked.getWinnerWallet())) {
            throw ArenaOperationException.linkedMatchMismatch(
                    "Linked match " + linkedMatchId + " was won by " + linked.getWinnerWallet()
            );
        }
    }

    private Tournament lockTournament(Long tournamentId) {
        return tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> ArenaOperationException.tournamentNotFound(tournamentId));
    }

    private void requireTournamentExists(Long tournamentId) {
        if (!tournamentRepository.existsById(tournamentId)) {
            throw ArenaOperationException.tournamentNotFound(tournamentId);
        }
    }
}
