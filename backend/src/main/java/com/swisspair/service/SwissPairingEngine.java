package com.swisspair.service;

import com.swisspair.exception.PairingException;
import com.swisspair.model.PlayerPair;
import com.swisspair.model.RoundPairing;
import com.swisspair.model.Standing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Swiss pairing for a single round.
 *
 * <p>Players are ranked by score, ties broken by registration order (player id). When the pool is
 * odd, the lowest-ranked player without a previous bye sits out. The remaining players are paired
 * greedily from the top: each player takes the nearest-ranked opponent they have not met yet.
 * A round that cannot be paired without a rematch fails instead of allowing one.
 */
@Component
public class SwissPairingEngine {

    private static final Logger log = LoggerFactory.getLogger(SwissPairingEngine.class);

    static final Comparator<Standing> RANKING_ORDER =
            Comparator.comparingInt(Standing::score)
                    .reversed()
                    .thenComparingInt(Standing::playerId);

    public RoundPairing pairRound(int roundNumber, Collection<Standing> standings, Set<PlayerPair> history) {
        if (standings == null || standings.isEmpty()) {
            log.info("Round {} has no players; producing an empty pairing", roundNumber);
            return RoundPairing.empty(roundNumber);
        }
        if (standings.size() == 1) {
            throw PairingException.insufficientPlayers(1);
        }

        List<Standing> pool = rank(standings);
        validateDistinctPlayers(pool);
        Set<PlayerPair> playedPairs = history != null ? history : Set.of();

        Integer byePlayerId = null;
        if (pool.size() % 2 == 1) {
            Standing byeRecipient = selectByeRecipient(pool, roundNumber);
            pool.remove(byeRecipient);
            byePlayerId = byeRecipient.playerId();
            log.debug("Round {} bye assigned to player {} (score {})",
                    roundNumber, byePlayerId, byeRecipient.score());
        }

        List<Integer> unpaired = new ArrayList<>(pool.size());
        for (Standing standing : pool) {
            unpaired.add(standing.playerId());
        }

        List<PlayerPair> pairs = new ArrayList<>(unpaired.size() / 2);
        while (!unpaired.isEmpty()) {
            int playerId = unpaired.remove(0);
            int opponentIndex = findOpponent(playerId, unpaired, playedPairs);
            if (opponentIndex < 0) {
                log.warn("Round {} pairing conflict: player {} has played every remaining opponent {}",
                        roundNumber, playerId, unpaired);
                throw PairingException.noValidPairing(roundNumber, playerId);
            }
            int opponentId = unpaired.remove(opponentIndex);
            pairs.add(PlayerPair.of(playerId, opponentId));
            log.debug("Round {} board {}: {} vs {}", roundNumber, pairs.size(), playerId, opponentId);
        }

        log.info("Paired round {}: {} matches, bye={}", roundNumber, pairs.size(), byePlayerId);
        return new RoundPairing(roundNumber, pairs, byePlayerId);
    }

    /**
     * Standings sorted by score descending, then registration order.
     */
    public static List<Standing> rank(Collection<Standing> standings) {
        List<Standing> ordered = new ArrayList<>(standings);
        ordered.sort(RANKING_ORDER);
        return ordered;
    }

    /**
     * Default length of a tournament: log2 of the player count (rounded down to even),
     * rounded up, and never less than one round.
     */
    public static int recommendedRoundCount(int playerCount) {
        int evenPlayers = playerCount - (playerCount % 2);
        if (evenPlayers <= 2) {
            return 1;
        }
        return Integer.SIZE - Integer.numberOfLeadingZeros(evenPlayers - 1);
    }

    private static Standing selectByeRecipient(List<Standing> rankedPool, int roundNumber) {
        for (int i = rankedPool.size() - 1; i >= 0; i--) {
            Standing candidate = rankedPool.get(i);
            if (!candidate.hasHadBye()) {
                return candidate;
            }
        }
        throw PairingException.noEligibleByeCandidate(roundNumber);
    }

    private static int findOpponent(int playerId, List<Integer> candidates, Set<PlayerPair> playedPairs) {
        for (int i = 0; i < candidates.size(); i++) {
            if (!playedPairs.contains(PlayerPair.of(playerId, candidates.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private static void validateDistinctPlayers(List<Standing> standings) {
        Set<Integer> playerIds = new HashSet<>();
        for (Standing standing : standings) {
            if (!playerIds.add(standing.playerId())) {
                throw new IllegalArgumentException("Duplicate standing for player " + standing.playerId());
            }
        }
    }
}
