package com.monadarena.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A rejected precondition. Thrown before any side effect is committed; the
 * {@code code} is stable so callers can tell retriable misuse apart.
 */
@Getter
public class ArenaOperationException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ArenaOperationException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static ArenaOperationException matchNotFound(Long matchId) {
        return new ArenaOperationException(HttpStatus.NOT_FOUND, "match_not_found", "Match not found: " + matchId);
    }

    public static ArenaOperationException tournamentNotFound(Long tournamentId) {
        return new ArenaOperationException(
                HttpStatus.NOT_FOUND,
                "tournament_not_found",
                "Tournament not found: " + tournamentId
        );
    }

    public static ArenaOperationException bracketMatchNotFound(Long tournamentId, Integer bracketIndex) {
        return new ArenaOperationException(
                HttpStatus.NOT_FOUND,
                "bracket_match_not_found",
                "Bracket match " + bracketIndex + " not found in tournament " + tournamentId
        );
    }

    public static ArenaOperationException invalidState(String detail) {
        return new ArenaOperationException(HttpStatus.CONFLICT, "invalid_state", detail);
    }

    public static ArenaOperationException wagerTooLow(long wager, long minWager) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "wager_too_low",
                "Wager too low: " + wager + " < " + minWager
        );
    }

    public static ArenaOperationException wagerTooHigh(long wager, long maxWager) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "wager_too_high",
                "Wager too high: " + wager + " > " + maxWager
        );
    }

    public static ArenaOperationException wagerMismatch(long expected, long actual) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "wager_mismatch",
                "Wager mismatch: expected " + expected + ", got " + actual
        );
    }

    public static ArenaOperationException cannotJoinOwnMatch(Long matchId) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "cannot_join_own_match",
                "Cannot join own match: " + matchId
        );
    }

    public static ArenaOperationException notAPlayer(Long matchId) {
        return new ArenaOperationException(HttpStatus.FORBIDDEN, "not_a_player", "Not a player in match: " + matchId);
    }

    public static ArenaOperationException notCreator(Long matchId) {
        return new ArenaOperationException(
                HttpStatus.FORBIDDEN,
                "not_creator",
                "Only the creator may cancel match: " + matchId
        );
    }

    public static ArenaOperationException notResolver() {
        return new ArenaOperationException(HttpStatus.FORBIDDEN, "not_resolver", "Caller is not a trusted resolver");
    }

    public static ArenaOperationException alreadyCommitted(Long matchId) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "already_committed",
                "Move already committed in match: " + matchId
        );
    }

    public static ArenaOperationException alreadyRevealed(Long matchId) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "already_revealed",
                "Move already revealed in match: " + matchId
        );
    }

    public static ArenaOperationException invalidCommitment(String detail) {
        return new ArenaOperationException(HttpStatus.BAD_REQUEST, "invalid_commitment", detail);
    }

    public static ArenaOperationException commitmentMismatch(Long matchId) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "commitment_mismatch",
                "Revealed move does not match commitment in match: " + matchId
        );
    }

    public static ArenaOperationException invalidWinner(String winner) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "invalid_winner",
                "Winner is not a contestant: " + winner
        );
    }

    public static ArenaOperationException timeoutNotReached(Long matchId) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "timeout_not_reached",
                "Timeout not reached for match: " + matchId
        );
    }

    public static ArenaOperationException invalidCapacity(Integer capacity) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "invalid_capacity",
                "Unsupported tournament capacity: " + capacity
        );
    }

    public static ArenaOperationException invalidEntryFee(long entryFee) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "invalid_entry_fee",
                "Entry fee outside accepted range: " + entryFee
        );
    }

    public static ArenaOperationException alreadyRegistered(Long tournamentId) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "already_registered",
                "Already registered for tournament: " + tournamentId
        );
    }

    public static ArenaOperationException tournamentFull(Long tournamentId) {
        return new ArenaOperationException(HttpStatus.CONFLICT, "tournament_full", "Tournament is full: " + tournamentId);
    }

    public static ArenaOperationException entryFeeMismatch(long expected, long actual) {
        return new ArenaOperationException(
                HttpStatus.BAD_REQUEST,
                "entry_fee_mismatch",
                "Entry fee mismatch: expected " + expected + ", got " + actual
        );
    }

    public static ArenaOperationException matchAlreadyResolved(Integer bracketIndex) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "match_already_resolved",
                "Bracket match already resolved: " + bracketIndex
        );
    }

    public static ArenaOperationException linkedMatchMismatch(String detail) {
        return new ArenaOperationException(HttpStatus.CONFLICT, "linked_match_mismatch", detail);
    }

    public static ArenaOperationException insufficientBalance(String wallet, long balance, long amount) {
        return new ArenaOperationException(
                HttpStatus.CONFLICT,
                "insufficient_balance",
                "Insufficient balance for " + wallet + ": " + balance + " < " + amount
        );
    }

    public static ArenaOperationException invalidWallet(String detail) {
        return new ArenaOperationException(HttpStatus.BAD_REQUEST, "invalid_wallet", detail);
    }

    public static ArenaOperationException invalidAmount(String detail) {
        return new ArenaOperationException(HttpStatus.BAD_REQUEST, "invalid_amount", detail);
    }
}
