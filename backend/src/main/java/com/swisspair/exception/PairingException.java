package com.swisspair.exception;

import lombok.Getter;

/**
 * Raised when no legal pairing exists for the next round. Never resolved by allowing a rematch.
 */
@Getter
public class PairingException extends RuntimeException {

    public static final String NO_ELIGIBLE_BYE_CANDIDATE = "no_eligible_bye_candidate";
    public static final String NO_VALID_PAIRING = "no_valid_pairing";
    public static final String INSUFFICIENT_PLAYERS = "insufficient_players";

    private final String code;

    public PairingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static PairingException noEligibleByeCandidate(int roundNumber) {
        return new PairingException(
                NO_ELIGIBLE_BYE_CANDIDATE,
                "Every player has already received a bye; round " + roundNumber + " cannot assign one"
        );
    }

    public static PairingException noValidPairing(int roundNumber, int playerId) {
        return new PairingException(
                NO_VALID_PAIRING,
                "No opponent left for player " + playerId + " in round " + roundNumber + " without a rematch"
        );
    }

    public static PairingException insufficientPlayers(int playerCount) {
        return new PairingException(
                INSUFFICIENT_PLAYERS,
                "At least 2 players are required to pair a round, found " + playerCount
        );
    }
}
