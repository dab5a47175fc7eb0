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
@Table(name = "players")
@IdClass(TournamentPlayerKey.class)
public class PlayerEntity {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Id
    @Column(name = "player_id", nullable = false, updatable = false)
    private Integer playerId;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;
}
