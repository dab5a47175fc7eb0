package com.swisspair.service;

import com.swisspair.exception.PairingException;
import com.swisspair.exception.TournamentSessionException;
import com.swisspair.model.MatchOutcome;
import com.swisspair.model.MatchRecord;
import com.swisspair.model.Player;
import com.swisspair.model.PlayerPair;
import com.swisspair.model.RoundPairing;
import com.swisspair.model.ScoreDelta;
import com.swisspair.model.SessionState;
import com.swisspair.model.Standing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory working set of one tournament, from registration to the final commit.
 *
 * <p>Every operation runs under the session's own lock, so a session has a single owner at a
 * time while independent sessions never share state. Nothing is written to the
 * {@link TournamentStore} until {@link #finish()} succeeds; an abandoned session leaves no data.
 */
public class TournamentSession {

    private static final Logger log = LoggerFactory.getLogger(TournamentSession.class);

    private final UUID tournamentId;
    private final Integer requestedRoundCount;
    private final long lockTimeoutMs;
    private final SwissPairingEngine pairingEngine;
    private final ScoringRules scoringRules;
    private final TournamentStore tournamentStore;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<Integer, Player> players = new LinkedHashMap<>();
    private final Map<Integer, Standing> standings = new LinkedHashMap<>();
    private final List<MatchRecord> matches = new ArrayList<>();
    private final Set<PlayerPair> playedPairs = new HashSet<>();
    private final Set<PlayerPair> reportedPairs = new HashSet<>();

    private volatile SessionState state = SessionState.NOT_STARTED;
    private volatile Instant lastActivityAt = Instant.now();
    private int roundCount;
    private int currentRound;
    private RoundPairing currentPairing;
    private boolean byeReported;
    private int nextPlayerId = 1;
    private int nextMatchId = 1;

    public TournamentSession(
            UUID tournamentId,
            Integer requestedRoundCount,
            long lockTimeoutMs,
            SwissPairingEngine pairingEngine,
            ScoringRules scoringRules,
            TournamentStore tournamentStore
    ) {
        if (tournamentId == null) {
            throw new IllegalArgumentException("tournamentId is required");
        }
        if (requestedRoundCount != null && requestedRoundCount < 1) {
            throw new IllegalArgumentException("Round count must be at least 1, got " + requestedRoundCount);
        }
        this.tournamentId = tournamentId;
        this.requestedRoundCount = requestedRoundCount;
        this.lockTimeoutMs = lockTimeoutMs;
        this.pairingEngine = pairingEngine;
        this.scoringRules = scoringRules;
        this.tournamentStore = tournamentStore;
    }

    /**
     * Registers players in the given order with zeroed standings. Names need not be unique.
     */
    public List<Player> start(List<String> playerNames) {
        return guarded(() -> {
            requireState("start", SessionState.NOT_STARTED);
            if (playerNames == null) {
                throw new IllegalArgumentException("playerNames is required");
            }

            List<Player> registered = new ArrayList<>(playerNames.size());
            int playerId = nextPlayerId;
            for (String name : playerNames) {
                registered.add(new Player(playerId++, name));
            }

            for (Player player : registered) {
                players.put(player.id(), player);
                standings.put(player.id(), Standing.initial(player.id()));
            }
            nextPlayerId = playerId;
            roundCount = requestedRoundCount != null
                    ? requestedRoundCount
                    : SwissPairingEngine.recommendedRoundCount(players.size());
            state = SessionState.READY;

            log.info("Started tournament {} with {} players over {} rounds",
                    tournamentId, players.size(), roundCount);
            return List.copyOf(players.values());
        });
    }

    /**
     * Pairs the next round from a snapshot of the current standings and the full match history.
     * A pairing failure leaves the session unchanged.
     */
    public RoundPairing beginRound() {
        return guarded(() -> {
            if (state != SessionState.READY && state != SessionState.ROUND_COMPLETE) {
                throw TournamentSessionException.invalidState("begin a round", state);
            }
            if (currentRound >= roundCount) {
                throw new TournamentSessionException(
                        TournamentSessionException.INVALID_STATE,
                        "All " + roundCount + " rounds of tournament " + tournamentId + " have been played"
                );
            }

            int roundNumber = currentRound + 1;
            RoundPairing pairing;
            try {
                pairing = pairingEngine.pairRound(
                        roundNumber,
                        List.copyOf(standings.values()),
                        Set.copyOf(playedPairs)
                );
            } catch (PairingException ex) {
                log.warn("Tournament {} could not pair round {}: {}", tournamentId, roundNumber, ex.getMessage());
                throw ex;
            }

            currentRound = roundNumber;
            currentPairing = pairing;
            reportedPairs.clear();
            byeReported = false;
            state = pairing.expectedReports() == 0 ? SessionState.ROUND_COMPLETE : SessionState.ROUND_IN_PROGRESS;

            log.info("Tournament {} round {} begins: {} matches, bye={}",
                    tournamentId, roundNumber, pairing.pairs().size(), pairing.byePlayerId());
            return pairing;
        });
    }

    public MatchRecord reportResult(PlayerPair pair, MatchOutcome outcome) {
        return guarded(() -> {
            requireRoundOpen("report a result");
            if (pair == null || outcome == null) {
                throw new IllegalArgumentException("pair and outcome are required");
            }
            if (!currentPairing.pairs().contains(pair)) {
                throw TournamentSessionException.unexpectedPair(currentRound, pair);
            }
            if (reportedPairs.contains(pair)) {
                throw TournamentSessionException.duplicateReport(currentRound, "pair " + pair);
            }
            if (!outcome.tie() && !pair.contains(outcome.winnerId())) {
                throw new IllegalArgumentException(
                        "Winner " + outcome.winnerId() + " is not part of pair " + pair);
            }

            ScoringRules.ResultDeltas deltas = scoringRules.applyResult(outcome);
            MatchRecord record;
            if (outcome.tie()) {
                record = MatchRecord.tie(tournamentId, nextMatchId++, currentRound, pair);
            } else {
                int winnerId = outcome.winnerId();
                record = MatchRecord.win(tournamentId, nextMatchId++, currentRound, winnerId, pair.opponentOf(winnerId));
            }

            Standing winner = standings.get(record.winnerId()).apply(deltas.winner());
            Standing loser = standings.get(record.loserId()).apply(deltas.loser());
            standings.put(winner.playerId(), winner);
            standings.put(loser.playerId(), loser);
            matches.add(record);
            playedPairs.add(pair);
            reportedPairs.add(pair);

            log.debug("Tournament {} round {} result {}: winner={} tie={}",
                    tournamentId, currentRound, pair, record.tie() ? null : record.winnerId(), record.tie());
            completeRoundIfReported();
            return record;
        });
    }

    public MatchRecord reportBye(int playerId) {
        return guarded(() -> {
            requireRoundOpen("report a bye");
            if (!currentPairing.hasBye() || currentPairing.byePlayerId() != playerId) {
                throw TournamentSessionException.unexpectedBye(currentRound, playerId);
            }
            if (byeReported) {
                throw TournamentSessionException.duplicateReport(currentRound, "bye for player " + playerId);
            }

            ScoreDelta delta = scoringRules.applyBye();
            MatchRecord record = MatchRecord.bye(tournamentId, nextMatchId++, currentRound, playerId);
            standings.put(playerId, standings.get(playerId).apply(delta));
            matches.add(record);
            byeReported = true;

            log.debug("Tournament {} round {} bye recorded for player {}", tournamentId, currentRound, playerId);
            completeRoundIfReported();
            return record;
        });
    }

    /**
     * Commits the finished tournament. Before the last round is fully reported this fails with
     * {@code tournament_incomplete} and the store is not called. A failed commit leaves the
     * session in {@link SessionState#ROUND_COMPLETE} so it can be retried.
     */
    public UUID finish() {
        return guarded(() -> {
            if (state == SessionState.FINISHED) {
                throw TournamentSessionException.invalidState("finish", state);
            }
            if (state != SessionState.ROUND_COMPLETE || currentRound < roundCount) {
                int roundsCompleted = state == SessionState.ROUND_COMPLETE ? currentRound : Math.max(0, currentRound - 1);
                throw TournamentSessionException.tournamentIncomplete(tournamentId, roundsCompleted, roundCount);
            }

            UUID committedId = tournamentStore.commitTournament(
                    tournamentId,
                    roundCount,
                    List.copyOf(players.values()),
                    SwissPairingEngine.rank(standings.values()),
                    List.copyOf(matches)
            );
            state = SessionState.FINISHED;
            log.info("Tournament {} finished after {} rounds with {} match records",
                    committedId, roundCount, matches.size());
            return committedId;
        });
    }

    public UUID getTournamentId() {
        return tournamentId;
    }

    public SessionState getState() {
        return guarded(() -> state);
    }

    public int getRoundCount() {
        return guarded(() -> roundCount);
    }

    public int getCurrentRound() {
        return guarded(() -> currentRound);
    }

    public RoundPairing currentPairing() {
        return guarded(() -> currentPairing);
    }

    public int countPlayers() {
        return guarded(players::size);
    }

    public List<Player> players() {
        return guarded(() -> List.copyOf(players.values()));
    }

    /**
     * Standings ranked by score, then registration order.
     */
    public List<Standing> standings() {
        return guarded(() -> SwissPairingEngine.rank(standings.values()));
    }

    public Standing standingOf(int playerId) {
        return guarded(() -> {
            Standing standing = standings.get(playerId);
            if (standing == null) {
                throw new IllegalArgumentException("Unknown player " + playerId + " in tournament " + tournamentId);
            }
            return standing;
        });
    }

    public List<MatchRecord> matches() {
        return guarded(() -> List.copyOf(matches));
    }

    public Set<PlayerPair> playedPairs() {
        return guarded(() -> Set.copyOf(playedPairs));
    }

    /**
     * Players sharing the highest score.
     */
    public List<Player> winners() {
        return guarded(() -> {
            List<Player> leaders = new ArrayList<>();
            List<Standing> ranked = SwissPairingEngine.rank(standings.values());
            if (ranked.isEmpty()) {
                return leaders;
            }
            int topScore = ranked.get(0).score();
            for (Standing standing : ranked) {
                if (standing.score() != topScore) {
                    break;
                }
                leaders.add(players.get(standing.playerId()));
            }
            return leaders;
        });
    }

    /**
     * True when no round has been paired yet and nobody has used the session since {@code cutoff}.
     * Reads without taking the session lock.
     */
    public boolean isIdleBeforeFirstRound(Instant cutoff) {
        SessionState current = state;
        return (current == SessionState.NOT_STARTED || current == SessionState.READY)
                && lastActivityAt.isBefore(cutoff);
    }

    private void completeRoundIfReported() {
        int reported = reportedPairs.size() + (byeReported ? 1 : 0);
        if (reported == currentPairing.expectedReports()) {
            state = SessionState.ROUND_COMPLETE;
            log.info("Tournament {} round {} complete", tournamentId, currentRound);
        }
    }

    private void requireRoundOpen(String operation) {
        if (currentPairing == null
                || (state != SessionState.ROUND_IN_PROGRESS && state != SessionState.ROUND_COMPLETE)) {
            throw TournamentSessionException.invalidState(operation, state);
        }
    }

    private void requireState(String operation, SessionState expected) {
        if (state != expected) {
            throw TournamentSessionException.invalidState(operation, state);
        }
    }

    private <T> T guarded(Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw TournamentSessionException.sessionBusy(tournamentId);
        }
        if (!acquired) {
            throw TournamentSessionException.sessionBusy(tournamentId);
        }
        try {
            lastActivityAt = Instant.now();
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
