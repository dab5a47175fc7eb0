package com.swisspair.model;

import java.util.UUID;

/**
 * One reported match or bye. For a tie, winner and loser only carry the two players;
 * for a bye, {@code loserId} is null.
 */
public record MatchRecord(
        UUID tournamentId,
        int matchId,
        int roundNumber,
        int winnerId,
        Integer loserId,
        boolean tie,
        boolean bye
) {
    public MatchRecord {
        if (bye && (loserId != null || tie)) {
            throw new IllegalArgumentException("A bye record has a single player and no tie");
        }
        if (!bye && loserId == null) {
            throw new IllegalArgumentException("Match " + matchId + " requires two players");
        }
    }

    public static MatchRecord win(UUID tournamentId, int matchId, int roundNumber, int winnerId, int loserId) {
        return new MatchRecord(tournamentId, matchId, roundNumber, winnerId, loserId, false, false);
    }

    public static MatchRecord tie(UUID tournamentId, int matchId, int roundNumber, PlayerPair pair) {
        return new MatchRecord(
                tournamentId, matchId, roundNumber, pair.firstPlayerId(), pair.secondPlayerId(), true, false);
    }

    public static MatchRecord bye(UUID tournamentId, int matchId, int roundNumber, int playerId) {
        return new MatchRecord(tournamentId, matchId, roundNumber, playerId, null, false, true);
    }

    /**
     * The pair this match was played by, or null for a bye.
     */
    public PlayerPair pair() {
        return bye ? null : PlayerPair.of(winnerId, loserId);
    }
}
