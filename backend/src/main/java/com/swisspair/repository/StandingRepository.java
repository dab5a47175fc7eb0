package com.swisspair.repository;

import com.swisspair.entity.StandingEntity;
import com.swisspair.entity.TournamentPlayerKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StandingRepository extends JpaRepository<StandingEntity, TournamentPlayerKey> {
    List<StandingEntity> findByTournamentIdOrderByScoreDescPlayerIdAsc(UUID tournamentId);

    @Query("""
            select s from StandingEntity s
            where s.tournamentId = :tournamentId
              and s.score = (select max(top.score) from StandingEntity top where top.tournamentId = :tournamentId)
            order by s.playerId asc
            """)
    List<StandingEntity> findLeaders(@Param("tournamentId") UUID tournamentId);

    @Modifying
    @Query("delete from StandingEntity e where e.tournamentId = :tournamentId")
    int deleteByTournamentId(@Param("tournamentId") UUID tournamentId);
}
