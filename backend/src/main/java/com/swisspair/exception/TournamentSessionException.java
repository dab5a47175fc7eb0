package com.swisspair.exception;

import com.swisspair.model.PlayerPair;
import com.swisspair.model.SessionState;
import lombok.Getter;

import java.util.UUID;

/**
 * Caller mistakes against a tournament session. These are reported immediately and are not retried.
 */
@Getter
public class TournamentSessionException extends RuntimeException {

    public static final String UNEXPECTED_PAIR = "unexpected_pair";
    public static final String DUPLICATE_REPORT = "duplicate_report";
    public static final String TOURNAMENT_INCOMPLETE = "tournament_incomplete";
    public static final String INVALID_STATE = "invalid_state";
    public static final String SESSION_BUSY = "session_busy";

    private final String code;

    public TournamentSessionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static TournamentSessionException unexpectedPair(int roundNumber, PlayerPair pair) {
        return new TournamentSessionException(
                UNEXPECTED_PAIR,
                "Pair " + pair + " is not scheduled in round " + roundNumber
        );
    }

    public static TournamentSessionException unexpectedBye(int roundNumber, int playerId) {
        return new TournamentSessionException(
                UNEXPECTED_PAIR,
                "Player " + playerId + " does not have the bye in round " + roundNumber
        );
    }

    public static TournamentSessionException duplicateReport(int roundNumber, String detail) {
        return new TournamentSessionException(
                DUPLICATE_REPORT,
                "Result already reported in round " + roundNumber + ": " + detail
        );
    }

    public static TournamentSessionException tournamentIncomplete(UUID tournamentId, int roundsCompleted, int roundCount) {
        return new TournamentSessionException(
                TOURNAMENT_INCOMPLETE,
                "Tournament " + tournamentId + " has completed " + roundsCompleted + " of " + roundCount + " rounds"
        );
    }

    public static TournamentSessionException invalidState(String operation, SessionState state) {
        return new TournamentSessionException(
                INVALID_STATE,
                "Cannot " + operation + " while session is " + state
        );
    }

    public static TournamentSessionException sessionBusy(UUID tournamentId) {
        return new TournamentSessionException(
                SESSION_BUSY,
                "Tournament " + tournamentId + " is owned by another caller"
        );
    }
}
