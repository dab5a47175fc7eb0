package com.swisspair.repository;

import com.swisspair.entity.MatchEntity;
import com.swisspair.entity.TournamentMatchKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MatchRepository extends JpaRepository<MatchEntity, TournamentMatchKey> {
    List<MatchEntity> findByTournamentIdOrderByMatchIdAsc(UUID tournamentId);

    List<MatchEntity> findByTournamentIdAndRoundNumOrderByMatchIdAsc(UUID tournamentId, Integer roundNum);

    @Modifying
    @Query("delete from MatchEntity e where e.tournamentId = :tournamentId")
    int deleteByTournamentId(@Param("tournamentId") UUID tournamentId);
}
