package com.swisspair.service;

import com.swisspair.entity.PlayerEntity;
import com.swisspair.entity.StandingEntity;
import com.swisspair.entity.TournamentPlayerKey;
import com.swisspair.exception.TournamentNotFoundException;
import com.swisspair.mapper.TournamentRecordMapper;
import com.swisspair.model.MatchRecord;
import com.swisspair.model.Player;
import com.swisspair.model.Standing;
import com.swisspair.repository.MatchRepository;
import com.swisspair.repository.PlayerRepository;
import com.swisspair.repository.StandingRepository;
import com.swisspair.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read side of committed tournaments.
 */
@Service
@RequiredArgsConstructor
public class TournamentResultsService {

    private static final Logger log = LoggerFactory.getLogger(TournamentResultsService.class);

    private final TournamentRepository tournamentRepository;
    private final PlayerRepository playerRepository;
    private final StandingRepository standingRepository;
    private final MatchRepository matchRepository;
    private final TournamentRecordMapper tournamentRecordMapper;

    @Transactional(readOnly = true)
    public boolean isCommitted(UUID tournamentId) {
        return tournamentRepository.existsById(tournamentId);
    }

    @Transactional(readOnly = true)
    public long countPlayers(UUID tournamentId) {
        requireTournament(tournamentId);
        return playerRepository.countByTournamentId(tournamentId);
    }

    @Transactional(readOnly = true)
    public List<Player> findPlayers(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentRecordMapper.toPlayers(playerRepository.findByTournamentIdOrderByPlayerIdAsc(tournamentId));
    }

    /**
     * Final standings, highest score first, ties in registration order.
     */
    @Transactional(readOnly = true)
    public List<Standing> findStandings(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentRecordMapper.toStandings(
                standingRepository.findByTournamentIdOrderByScoreDescPlayerIdAsc(tournamentId));
    }

    /**
     * Every player sharing the top score.
     */
    @Transactional(readOnly = true)
    public List<Player> findWinners(UUID tournamentId) {
        requireTournament(tournamentId);
        List<Player> winners = new ArrayList<>();
        for (StandingEntity leader : standingRepository.findLeaders(tournamentId)) {
            PlayerEntity player = playerRepository.findById(new TournamentPlayerKey(tournamentId, leader.getPlayerId()))
                    .orElseThrow(() -> new IllegalStateException(
                            "Standing without player " + leader.getPlayerId() + " in tournament " + tournamentId));
            winners.add(tournamentRecordMapper.toPlayer(player));
        }
        return winners;
    }

    @Transactional(readOnly = true)
    public List<MatchRecord> findMatches(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentRecordMapper.toMatchRecords(matchRepository.findByTournamentIdOrderByMatchIdAsc(tournamentId));
    }

    @Transactional(readOnly = true)
    public List<MatchRecord> findRound(UUID tournamentId, int roundNumber) {
        requireTournament(tournamentId);
        return tournamentRecordMapper.toMatchRecords(
                matchRepository.findByTournamentIdAndRoundNumOrderByMatchIdAsc(tournamentId, roundNumber));
    }

    /**
     * Removes a committed tournament with its players, standings and matches.
     */
    @Transactional
    public void deleteTournament(UUID tournamentId) {
        requireTournament(tournamentId);
        int deletedMatches = matchRepository.deleteByTournamentId(tournamentId);
        standingRepository.deleteByTournamentId(tournamentId);
        int deletedPlayers = playerRepository.deleteByTournamentId(tournamentId);
        tournamentRepository.deleteById(tournamentId);
        log.info("Deleted committed tournament {} ({} players, {} match records)",
                tournamentId, deletedPlayers, deletedMatches);
    }

    private void requireTournament(UUID tournamentId) {
        if (!tournamentRepository.existsById(tournamentId)) {
            throw new TournamentNotFoundException(tournamentId);
        }
    }
}
