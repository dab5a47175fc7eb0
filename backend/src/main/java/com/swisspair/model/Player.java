package com.swisspair.model;

/**
 * A registered tournament participant. Ids are allocated by the owning session in
 * registration order, so a lower id means an earlier registration.
 */
public record Player(
        int id,
        String name
) {
    public Player {
        if (id <= 0) {
            throw new IllegalArgumentException("Player id must be positive: " + id);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Player name is required");
        }
        name = name.trim();
    }
}
