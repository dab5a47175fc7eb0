package com.swisspair.service;

import com.swisspair.entity.TournamentEntity;
import com.swisspair.exception.CommitFailedException;
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
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Relational {@link TournamentStore}. The whole tournament is written inside one transaction,
 * including the final flush, so a failure rolls back every row.
 */
@Service
@RequiredArgsConstructor
public class JpaTournamentStore implements TournamentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTournamentStore.class);

    private final TournamentRepository tournamentRepository;
    private final PlayerRepository playerRepository;
    private final StandingRepository standingRepository;
    private final MatchRepository matchRepository;
    private final TournamentRecordMapper tournamentRecordMapper;
    private final TransactionTemplate transactionTemplate;

    @Override
    public UUID commitTournament(
            UUID tournamentId,
            int roundCount,
            List<Player> players,
            List<Standing> standings,
            List<MatchRecord> matches
    ) {
        try {
            UUID committedId = transactionTemplate.execute(status ->
                    writeTournament(tournamentId, roundCount, players, standings, matches));
            log.info("Committed tournament {}: {} players, {} match records", tournamentId, players.size(), matches.size());
            return committedId;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Commit of tournament {} failed and was rolled back", tournamentId, ex);
            throw new CommitFailedException(tournamentId, "Commit failed for tournament " + tournamentId, ex);
        }
    }

    private UUID writeTournament(
            UUID tournamentId,
            int roundCount,
            List<Player> players,
            List<Standing> standings,
            List<MatchRecord> matches
    ) {
        if (tournamentRepository.existsById(tournamentId)) {
            log.info("Tournament {} is already committed; skipping write", tournamentId);
            return tournamentId;
        }

        TournamentEntity tournament = new TournamentEntity();
        tournament.setTournamentId(tournamentId);
        tournament.setRoundCount(roundCount);
        tournament.setPlayerCount(players.size());
        tournament.setCommittedAt(OffsetDateTime.now());
        tournamentRepository.saveAndFlush(tournament);

        playerRepository.saveAllAndFlush(players.stream()
                .map(player -> tournamentRecordMapper.toPlayerEntity(tournamentId, player))
                .toList());
        standingRepository.saveAll(standings.stream()
                .map(standing -> tournamentRecordMapper.toStandingEntity(tournamentId, standing))
                .toList());
        matchRepository.saveAll(matches.stream()
                .map(tournamentRecordMapper::toMatchEntity)
                .toList());
        matchRepository.flush();
        return tournamentId;
    }
}
