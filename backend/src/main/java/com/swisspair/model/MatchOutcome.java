package com.swisspair.model;

/**
 * Result reported for a paired match: either a winner or a tie.
 */
public record MatchOutcome(
        Integer winnerId,
        boolean tie
) {
    public MatchOutcome {
        if (tie && winnerId != null) {
            throw new IllegalArgumentException("A tied match has no winner");
        }
        if (!tie && winnerId == null) {
            throw new IllegalArgumentException("winnerId is required unless the match is a tie");
        }
    }

    public static MatchOutcome win(int winnerId) {
        return new MatchOutcome(winnerId, false);
    }

    public static MatchOutcome tied() {
        return new MatchOutcome(null, true);
    }
}
