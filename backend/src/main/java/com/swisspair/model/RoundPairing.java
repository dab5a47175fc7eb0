package com.swisspair.model;

import java.util.List;

/**
 * Pairings for one round in board order, plus the player sitting out on a bye (if any).
 */
public record RoundPairing(
        int roundNumber,
        List<PlayerPair> pairs,
        Integer byePlayerId
) {
    public RoundPairing {
        pairs = List.copyOf(pairs);
    }

    public static RoundPairing empty(int roundNumber) {
        return new RoundPairing(roundNumber, List.of(), null);
    }

    public boolean hasBye() {
        return byePlayerId != null;
    }

    public int expectedReports() {
        return pairs.size() + (hasBye() ? 1 : 0);
    }
}
