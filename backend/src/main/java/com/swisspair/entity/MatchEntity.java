package com.swisspair.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Row of the matches table. A bye is stored with the player in {@code winnerId} and a null {@code loserId}.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
@IdClass(TournamentMatchKey.class)
public class MatchEntity {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private Integer matchId;

    @Column(name = "winner_id", nullable = false)
    private Integer winnerId;

    @Column(name = "loser_id")
    private Integer loserId;

    @Column(name = "tie", nullable = false)
    private Boolean tie = false;

    @Column(name = "bye", nullable = false)
    private Boolean bye = false;

    @Column(name = "round_num", nullable = false)
    private Integer roundNum;
}
