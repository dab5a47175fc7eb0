package com.swisspair.model;

import com.swisspair.service.ScoringRules;

/**
 * Cumulative record of one player. Instances are immutable; {@link #apply(ScoreDelta)} returns
 * the updated standing.
 */
public record Standing(
        int playerId,
        int wins,
        int losses,
        int ties,
        int byes,
        int score,
        int matches
) {
    public Standing {
        if (wins < 0 || losses < 0 || ties < 0 || byes < 0 || matches < 0) {
            throw new IllegalArgumentException("Standing counters must not be negative for player " + playerId);
        }
        if (byes > 1) {
            throw new IllegalArgumentException("Player " + playerId + " cannot receive more than one bye");
        }
        int expectedScore = ScoringRules.WIN_POINTS * wins + ScoringRules.TIE_POINTS * ties
                + ScoringRules.BYE_POINTS * byes;
        if (score != expectedScore) {
            throw new IllegalArgumentException(
                    "Score " + score + " does not match record for player " + playerId + " (expected " + expectedScore + ")"
            );
        }
        if (matches != wins + losses + ties) {
            throw new IllegalArgumentException("Match count does not match results for player " + playerId);
        }
    }

    public static Standing initial(int playerId) {
        return new Standing(playerId, 0, 0, 0, 0, 0, 0);
    }

    public Standing apply(ScoreDelta delta) {
        return new Standing(
                playerId,
                wins + delta.wins(),
                losses + delta.losses(),
                ties + delta.ties(),
                byes + delta.byes(),
                score + delta.points(),
                matches + delta.matches()
        );
    }

    public boolean hasHadBye() {
        return byes > 0;
    }

    /**
     * Rounds this player has taken part in, counting a bye as a round.
     */
    public int roundsPlayed() {
        return matches + byes;
    }
}
