package com.swisspair.service;

import com.swisspair.entity.MatchEntity;
import com.swisspair.entity.PlayerEntity;
import com.swisspair.entity.StandingEntity;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaTournamentStoreTest {

    private static final UUID TOURNAMENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000202");

    @Mock
    private TournamentRepository tournamentRepository;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private StandingRepository standingRepository;

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    @Captor
    private ArgumentCaptor<List<PlayerEntity>> playersCaptor;

    @Captor
    private ArgumentCaptor<List<StandingEntity>> standingsCaptor;

    @Captor
    private ArgumentCaptor<List<MatchEntity>> matchesCaptor;

    private JpaTournamentStore store;

    @BeforeEach
    void setUp() {
        store = new JpaTournamentStore(
                tournamentRepository,
                playerRepository,
                standingRepository,
                matchRepository,
                new TournamentRecordMapper(),
                transactionTemplate
        );
        when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(null);
        });
    }

    @Test
    void commitTournament_writesTournamentPlayersStandingsAndMatches() {
        when(tournamentRepository.existsById(TOURNAMENT_ID)).thenReturn(false);

        UUID committedId = store.commitTournament(TOURNAMENT_ID, 2, players(), standings(), matches());

        assertEquals(TOURNAMENT_ID, committedId);

        ArgumentCaptor<TournamentEntity> tournamentCaptor = ArgumentCaptor.forClass(TournamentEntity.class);
        verify(tournamentRepository).saveAndFlush(tournamentCaptor.capture());
        TournamentEntity tournament = tournamentCaptor.getValue();
        assertEquals(TOURNAMENT_ID, tournament.getTournamentId());
        assertEquals(2, tournament.getRoundCount());
        assertEquals(3, tournament.getPlayerCount());

        verify(playerRepository).saveAllAndFlush(playersCaptor.capture());
        assertEquals(List.of("Ada", "Grace", "Linus"),
                playersCaptor.getValue().stream().map(PlayerEntity::getName).toList());

        verify(standingRepository).saveAll(standingsCaptor.capture());
        assertEquals(List.of(1, 3, 2),
                standingsCaptor.getValue().stream().map(StandingEntity::getPlayerId).toList());

        verify(matchRepository).saveAll(matchesCaptor.capture());
        List<MatchEntity> matchEntities = matchesCaptor.getValue();
        assertEquals(2, matchEntities.size());
        MatchEntity bye = matchEntities.get(1);
        assertTrue(bye.getBye());
        assertEquals(3, bye.getWinnerId());
        assertNull(bye.getLoserId());
        verify(matchRepository).flush();
    }

    @Test
    void commitTournament_alreadyCommitted_skipsWrites() {
        when(tournamentRepository.existsById(TOURNAMENT_ID)).thenReturn(true);

        UUID committedId = store.commitTournament(TOURNAMENT_ID, 2, players(), standings(), matches());

        assertEquals(TOURNAMENT_ID, committedId);
        verify(tournamentRepository, never()).saveAndFlush(any());
        verify(playerRepository, never()).saveAllAndFlush(anyList());
        verify(matchRepository, never()).saveAll(anyList());
    }

    @Test
    void commitTournament_constraintViolation_wrappedAsCommitFailure() {
        DataIntegrityViolationException violation = new DataIntegrityViolationException("uq_matches_tournament_pair");
        when(tournamentRepository.existsById(TOURNAMENT_ID)).thenReturn(false);
        when(matchRepository.saveAll(anyList())).thenThrow(violation);

        CommitFailedException ex = assertThrows(
                CommitFailedException.class,
                () -> store.commitTournament(TOURNAMENT_ID, 2, players(), standings(), matches())
        );

        assertEquals(TOURNAMENT_ID, ex.getTournamentId());
        assertSame(violation, ex.getCause());
    }

    private static List<Player> players() {
        return List.of(new Player(1, "Ada"), new Player(2, "Grace"), new Player(3, "Linus"));
    }

    private static List<Standing> standings() {
        return List.of(
                new Standing(1, 1, 0, 0, 0, 2, 1),
                new Standing(3, 0, 0, 0, 1, 1, 0),
                new Standing(2, 0, 1, 0, 0, 0, 1)
        );
    }

    private static List<MatchRecord> matches() {
        return List.of(
                MatchRecord.win(TOURNAMENT_ID, 1, 1, 1, 2),
                MatchRecord.bye(TOURNAMENT_ID, 2, 1, 3)
        );
    }
}
