package com.swisspair.service;

import com.swisspair.exception.CommitFailedException;
import com.swisspair.model.MatchRecord;
import com.swisspair.model.Player;
import com.swisspair.model.Standing;

import java.util.List;
import java.util.UUID;

/**
 * Durable record of finished tournaments. Sessions call it once, from {@code finish()}.
 */
public interface TournamentStore {

    /**
     * Writes players, standings and match history of one tournament in a single transaction.
     * Committing an id that is already stored is a no-op, so a failed commit can be retried as a whole.
     *
     * @return the committed tournament id
     * @throws CommitFailedException if nothing could be written
     */
    UUID commitTournament(
            UUID tournamentId,
            int roundCount,
            List<Player> players,
            List<Standing> standings,
            List<MatchRecord> matches
    );
}
