package com.swisspair.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The final commit did not complete. Nothing was written, so the whole commit may be retried.
 */
@Getter
public class CommitFailedException extends RuntimeException {

    private final UUID tournamentId;

    public CommitFailedException(UUID tournamentId, String message, Throwable cause) {
        super(message, cause);
        this.tournamentId = tournamentId;
    }
}
