package com.swisspair.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "standings")
@IdClass(TournamentPlayerKey.class)
public class StandingEntity {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Id
    @Column(name = "player_id", nullable = false, updatable = false)
    private Integer playerId;

    @Column(name = "wins", nullable = false)
    private Integer wins = 0;

    @Column(name = "losses", nullable = false)
    private Integer losses = 0;

    @Column(name = "ties", nullable = false)
    private Integer ties = 0;

    @Column(name = "byes", nullable = false)
    private Integer byes = 0;

    @Column(name = "score", nullable = false)
    private Integer score = 0;

    @Column(name = "matches", nullable = false)
    private Integer matches = 0;
}
