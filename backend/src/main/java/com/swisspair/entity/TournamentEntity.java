package com.swisspair.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "tournaments")
public class TournamentEntity {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "round_count", nullable = false)
    private Integer roundCount;

    @Column(name = "player_count", nullable = false)
    private Integer playerCount;

    @Column(name = "committed_at", nullable = false, updatable = false)
    private OffsetDateTime committedAt = OffsetDateTime.now();
}
