package com.swisspair.model;

/**
 * Unordered pair of players. The lower id is always stored first, so (a, b) and (b, a) are equal.
 */
public record PlayerPair(
        int firstPlayerId,
        int secondPlayerId
) {
    public PlayerPair {
        if (firstPlayerId == secondPlayerId) {
            throw new IllegalArgumentException("A player cannot be paired with themselves: " + firstPlayerId);
        }
        if (firstPlayerId > secondPlayerId) {
            int swap = firstPlayerId;
            firstPlayerId = secondPlayerId;
            secondPlayerId = swap;
        }
    }

    public static PlayerPair of(int playerId, int opponentId) {
        return new PlayerPair(playerId, opponentId);
    }

    public boolean contains(int playerId) {
        return firstPlayerId == playerId || secondPlayerId == playerId;
    }

    public int opponentOf(int playerId) {
        if (playerId == firstPlayerId) {
            return secondPlayerId;
        }
        if (playerId == secondPlayerId) {
            return firstPlayerId;
        }
        throw new IllegalArgumentException("Player " + playerId + " is not part of pair " + this);
    }

    @Override
    public String toString() {
        return "(" + firstPlayerId + ", " + secondPlayerId + ")";
    }
}
