package com.swisspair.service;

import com.swisspair.exception.CommitFailedException;
import com.swisspair.model.MatchOutcome;
import com.swisspair.model.MatchRecord;
import com.swisspair.model.Player;
import com.swisspair.model.PlayerPair;
import com.swisspair.model.RoundPairing;
import com.swisspair.model.Standing;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Testcontainers(disabledWithoutDocker = true)
class TournamentCommitIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    }

    @Autowired
    private TournamentSessionRegistry tournamentSessionRegistry;

    @Autowired
    private TournamentStore tournamentStore;

    @Autowired
    private TournamentResultsService tournamentResultsService;

    @Test
    void finishedTournamentIsCommittedAndQueryable() {
        TournamentSession session = tournamentSessionRegistry.open();
        UUID tournamentId = session.getTournamentId();
        session.start(List.of("Ada", "Grace", "Linus", "Barbara", "Edsger"));
        assertEquals(2, session.getRoundCount());

        playRoundLowerIdWins(session);
        playRoundLowerIdWins(session);
        List<Standing> liveStandings = session.standings();
        List<MatchRecord> liveMatches = session.matches();

        assertEquals(tournamentId, tournamentSessionRegistry.finish(tournamentId));

        assertTrue(tournamentResultsService.isCommitted(tournamentId));
        assertEquals(5L, tournamentResultsService.countPlayers(tournamentId));
        assertEquals(liveStandings, tournamentResultsService.findStandings(tournamentId));
        assertEquals(liveMatches, tournamentResultsService.findMatches(tournamentId));
        assertEquals(3, tournamentResultsService.findRound(tournamentId, 1).size());
        assertEquals(List.of(new Player(1, "Ada")), tournamentResultsService.findWinners(tournamentId));
    }

    @Test
    void repeatedCommitOfSameTournamentIsNoOp() {
        UUID tournamentId = UUID.randomUUID();
        List<Player> players = List.of(new Player(1, "Ada"), new Player(2, "Grace"));
        List<Standing> standings = List.of(new Standing(1, 0, 0, 1, 0, 1, 1), new Standing(2, 0, 0, 1, 0, 1, 1));
        List<MatchRecord> matches = List.of(MatchRecord.tie(tournamentId, 1, 1, PlayerPair.of(1, 2)));

        tournamentStore.commitTournament(tournamentId, 1, players, standings, matches);
        UUID again = tournamentStore.commitTournament(tournamentId, 1, players, standings, matches);

        assertEquals(tournamentId, again);
        assertEquals(2L, tournamentResultsService.countPlayers(tournamentId));
        assertEquals(1, tournamentResultsService.findMatches(tournamentId).size());
        assertEquals(2, tournamentResultsService.findWinners(tournamentId).size());
    }

    @Test
    void rejectedCommitLeavesNothingBehind() {
        UUID tournamentId = UUID.randomUUID();
        List<Player> players = List.of(new Player(1, "Ada"), new Player(2, "Grace"));
        List<Standing> standings = List.of(new Standing(1, 2, 0, 0, 0, 4, 2), new Standing(2, 0, 2, 0, 0, 0, 2));
        List<MatchRecord> rematch = List.of(
                MatchRecord.win(tournamentId, 1, 1, 1, 2),
                MatchRecord.win(tournamentId, 2, 2, 1, 2)
        );

        assertThrows(CommitFailedException.class,
                () -> tournamentStore.commitTournament(tournamentId, 2, players, standings, rematch));

        assertFalse(tournamentResultsService.isCommitted(tournamentId));
    }

    @Test
    void discardedSessionWritesNothing() {
        TournamentSession session = tournamentSessionRegistry.open(1);
        UUID tournamentId = session.getTournamentId();
        session.start(List.of("Ada", "Grace"));
        playRoundLowerIdWins(session);

        assertTrue(tournamentSessionRegistry.discard(tournamentId));

        assertFalse(tournamentResultsService.isCommitted(tournamentId));
    }

    @Test
    void deleteTournamentRemovesCommittedRows() {
        TournamentSession session = tournamentSessionRegistry.open(1);
        UUID tournamentId = session.getTournamentId();
        session.start(List.of("Ada", "Grace", "Linus"));
        playRoundLowerIdWins(session);
        tournamentSessionRegistry.finish(tournamentId);

        tournamentResultsService.deleteTournament(tournamentId);

        assertFalse(tournamentResultsService.isCommitted(tournamentId));
    }

    private static void playRoundLowerIdWins(TournamentSession session) {
        RoundPairing pairing = session.beginRound();
        for (PlayerPair pair : pairing.pairs()) {
            session.reportResult(pair, MatchOutcome.win(pair.firstPlayerId()));
        }
        if (pairing.hasBye()) {
            session.reportBye(pairing.byePlayerId());
        }
    }
}
