package com.swisspair.service;

import com.swisspair.config.SwissTournamentProperties;
import com.swisspair.exception.TournamentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live sessions, one per tournament id. Sessions are dropped once they commit, are discarded,
 * or sit idle before their first round.
 */
@Service
public class TournamentSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(TournamentSessionRegistry.class);

    private final Map<UUID, TournamentSession> sessions = new ConcurrentHashMap<>();

    private final SwissPairingEngine swissPairingEngine;
    private final ScoringRules scoringRules;
    private final TournamentStore tournamentStore;
    private final SwissTournamentProperties swissTournamentProperties;

    public TournamentSessionRegistry(
            SwissPairingEngine swissPairingEngine,
            ScoringRules scoringRules,
            TournamentStore tournamentStore,
            SwissTournamentProperties swissTournamentProperties
    ) {
        this.swissPairingEngine = swissPairingEngine;
        this.scoringRules = scoringRules;
        this.tournamentStore = tournamentStore;
        this.swissTournamentProperties = swissTournamentProperties;
    }

    /**
     * Opens a session using the configured default round count.
     */
    public TournamentSession open() {
        int configured = swissTournamentProperties.getTournament().getDefaultRoundCount();
        return open(configured > 0 ? configured : null);
    }

    /**
     * Opens a session under a freshly allocated tournament id.
     *
     * @param roundCount rounds to play, or null to derive it from the registered player count
     */
    public TournamentSession open(Integer roundCount) {
        evictIdleSessions();
        UUID tournamentId = UUID.randomUUID();
        TournamentSession session = new TournamentSession(
                tournamentId,
                roundCount,
                swissTournamentProperties.getSession().getLockTimeoutMs(),
                swissPairingEngine,
                scoringRules,
                tournamentStore
        );
        sessions.put(tournamentId, session);
        log.info("Opened tournament session {} (rounds={})", tournamentId, roundCount != null ? roundCount : "auto");
        return session;
    }

    public TournamentSession get(UUID tournamentId) {
        TournamentSession session = sessions.get(tournamentId);
        if (session == null) {
            throw new TournamentNotFoundException(tournamentId);
        }
        return session;
    }

    /**
     * Commits the session and releases it. If the commit fails the session stays registered for a retry.
     */
    public UUID finish(UUID tournamentId) {
        UUID committedId = get(tournamentId).finish();
        sessions.remove(tournamentId);
        return committedId;
    }

    /**
     * Drops a session without committing anything.
     */
    public boolean discard(UUID tournamentId) {
        TournamentSession removed = sessions.remove(tournamentId);
        if (removed != null) {
            log.info("Discarded tournament session {} in state {}", tournamentId, removed.getState());
        }
        return removed != null;
    }

    /**
     * Drops sessions that were opened but never paired a round and have sat unused past
     * {@code swiss.session.idle-timeout-ms}. Sessions with rounds in play are released only by
     * {@link #finish(UUID)} or {@link #discard(UUID)}.
     */
    public int evictIdleSessions() {
        long idleTimeoutMs = swissTournamentProperties.getSession().getIdleTimeoutMs();
        if (idleTimeoutMs <= 0) {
            return 0;
        }
        return evictIdleSessions(Instant.now().minusMillis(idleTimeoutMs));
    }

    int evictIdleSessions(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<UUID, TournamentSession> entry : sessions.entrySet()) {
            if (entry.getValue().isIdleBeforeFirstRound(cutoff) && sessions.remove(entry.getKey(), entry.getValue())) {
                evicted++;
                log.info("Evicted tournament session {} idle since before {}", entry.getKey(), cutoff);
            }
        }
        return evicted;
    }

    public int activeSessionCount() {
        return sessions.size();
    }
}
