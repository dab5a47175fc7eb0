package com.swisspair.repository;

import com.swisspair.entity.PlayerEntity;
import com.swisspair.entity.TournamentPlayerKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PlayerRepository extends JpaRepository<PlayerEntity, TournamentPlayerKey> {
    List<PlayerEntity> findByTournamentIdOrderByPlayerIdAsc(UUID tournamentId);

    long countByTournamentId(UUID tournamentId);

    @Modifying
    @Query("delete from PlayerEntity e where e.tournamentId = :tournamentId")
    int deleteByTournamentId(@Param("tournamentId") UUID tournamentId);
}
