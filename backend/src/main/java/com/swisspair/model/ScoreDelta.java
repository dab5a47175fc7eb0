package com.swisspair.model;

/**
 * Increment applied to a single {@link Standing} after a match or bye.
 */
public record ScoreDelta(
        int points,
        int wins,
        int losses,
        int ties,
        int byes,
        int matches
) {
}
