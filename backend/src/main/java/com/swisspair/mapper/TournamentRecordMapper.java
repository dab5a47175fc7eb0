package com.swisspair.mapper;

import com.swisspair.entity.MatchEntity;
import com.swisspair.entity.PlayerEntity;
import com.swisspair.entity.StandingEntity;
import com.swisspair.model.MatchRecord;
import com.swisspair.model.Player;
import com.swisspair.model.Standing;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class TournamentRecordMapper {

    public PlayerEntity toPlayerEntity(UUID tournamentId, Player player) {
        PlayerEntity entity = new PlayerEntity();
        entity.setTournamentId(tournamentId);
        entity.setPlayerId(player.id());
        entity.setName(player.name());
        return entity;
    }

    public StandingEntity toStandingEntity(UUID tournamentId, Standing standing) {
        StandingEntity entity = new StandingEntity();
        entity.setTournamentId(tournamentId);
        entity.setPlayerId(standing.playerId());
        entity.setWins(standing.wins());
        entity.setLosses(standing.losses());
        entity.setTies(standing.ties());
        entity.setByes(standing.byes());
        entity.setScore(standing.score());
        entity.setMatches(standing.matches());
        return entity;
    }

    public MatchEntity toMatchEntity(MatchRecord match) {
        MatchEntity entity = new MatchEntity();
        entity.setTournamentId(match.tournamentId());
        entity.setMatchId(match.matchId());
        entity.setWinnerId(match.winnerId());
        entity.setLoserId(match.loserId());
        entity.setTie(match.tie());
        entity.setBye(match.bye());
        entity.setRoundNum(match.roundNumber());
        return entity;
    }

    public Player toPlayer(PlayerEntity entity) {
        return new Player(entity.getPlayerId(), entity.getName());
    }

    public Standing toStanding(StandingEntity entity) {
        return new Standing(
                entity.getPlayerId(),
                entity.getWins(),
                entity.getLosses(),
                entity.getTies(),
                entity.getByes(),
                entity.getScore(),
                entity.getMatches()
        );
    }

    public MatchRecord toMatchRecord(MatchEntity entity) {
        return new MatchRecord(
                entity.getTournamentId(),
                entity.getMatchId(),
                entity.getRoundNum(),
                entity.getWinnerId(),
                entity.getLoserId(),
                Boolean.TRUE.equals(entity.getTie()),
                Boolean.TRUE.equals(entity.getBye())
        );
    }

    public List<Player> toPlayers(List<PlayerEntity> entities) {
        return entities.stream().map(this::toPlayer).toList();
    }

    public List<Standing> toStandings(List<StandingEntity> entities) {
        return entities.stream().map(this::toStanding).toList();
    }

    public List<MatchRecord> toMatchRecords(List<MatchEntity> entities) {
        return entities.stream().map(this::toMatchRecord).toList();
    }
}
