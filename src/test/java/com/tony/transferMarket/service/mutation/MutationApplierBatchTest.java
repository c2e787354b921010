package com.tony.transferMarket.service.mutation;

import com.tony.transferMarket.exception.BatchApplyException;
import com.tony.transferMarket.model.GameSave;
import com.tony.transferMarket.model.Team;
import com.tony.transferMarket.repository.GameSaveRepository;
import com.tony.transferMarket.repository.TeamRepository;
import com.tony.transferMarket.support.MarketJpaTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Application découpée hors transaction de test : chaque morceau est réellement validé.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MutationApplierBatchTest extends MarketJpaTest {

    private static final long MISSING_TEAM_ID = 999_999L;

    @Autowired
    private MutationApplier mutationApplier;
    @Autowired
    private GameSaveRepository saveRepository;
    @Autowired
    private TeamRepository teamRepository;

    private GameSave save;
    private Team team;

    @BeforeEach
    void setUp() {
        save = saveRepository.save(new GameSave("Lot", 2026, 4));
        team = teamRepository.save(new Team(save, "AS Montagne", 55, 5_000_000L, 1_000_000L));
    }

    @AfterEach
    void tearDown() {
        teamRepository.deleteAll();
        saveRepository.deleteAll();
    }

    @Test
    @DisplayName("Un échec au second morceau laisse le premier appliqué et annule le second")
    void failureInSecondChunkKeepsFirst() {
        // ARRANGE : 33 crédits de 3 valeurs remplissent le premier morceau (99 valeurs)
        List<MarketMutation> mutations = new ArrayList<>();
        for (int i = 0; i < 33; i++) {
            mutations.add(new AdjustBalance(team.getId(), 1_000L));
        }
        mutations.add(new AdjustBalance(team.getId(), 1_000L));
        mutations.add(new AdjustBalance(MISSING_TEAM_ID, 1_000L));

        // ACT
        BatchApplyException failure = catchThrowableOfType(
                () -> mutationApplier.applyChunked(mutations), BatchApplyException.class);

        // ASSERT
        assertThat(failure).isNotNull();
        assertThat(failure.getFailedChunk()).isEqualTo(1);
        assertThat(failure.getTotalChunks()).isEqualTo(2);
        assertThat(failure).hasMessageContaining("team " + MISSING_TEAM_ID + " not found");

        Team reloaded = teamRepository.findById(team.getId()).orElseThrow();
        assertThat(reloaded.getBudget()).isEqualTo(5_033_000L);
        assertThat(reloaded.getBalance()).isEqualTo(5_033_000L);
    }

    @Test
    @DisplayName("Sans échec, tous les morceaux sont appliqués")
    void appliesEveryChunk() {
        List<MarketMutation> mutations = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            mutations.add(new AdjustBalance(team.getId(), -1_000L));
        }

        int chunks = mutationApplier.applyChunked(mutations);

        assertThat(chunks).isEqualTo(2);
        assertThat(teamRepository.findById(team.getId()).orElseThrow().getBudget()).isEqualTo(4_960_000L);
    }
}
