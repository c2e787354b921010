package com.tony.transferMarket.service;

import com.tony.transferMarket.exception.NotFoundException;
import com.tony.transferMarket.exception.ValidationException;
import com.tony.transferMarket.model.GameSave;
import com.tony.transferMarket.model.Team;
import com.tony.transferMarket.model.dto.AiTaskStatus;
import com.tony.transferMarket.model.dto.AiTransferSummary;
import com.tony.transferMarket.repository.GameSaveRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AiMarketTaskSupervisorTest {

    @Mock
    private MarketOrchestrator orchestrator;

    @Mock
    private GameSaveRepository saveRepository;

    private AiMarketTaskSupervisor supervisor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        // Exécution synchrone : la tâche est terminée au retour de submit
        supervisor = new AiMarketTaskSupervisor(orchestrator, saveRepository, new SyncTaskExecutor(), clock);
    }

    private GameSave saveWithHumanTeam() {
        Team human = new Team();
        human.setId(10L);
        GameSave save = new GameSave("Démo", 2026, 7);
        save.setId(1L);
        save.setHumanTeam(human);
        return save;
    }

    @Test
    @DisplayName("La journée IA tourne pour la saison et la journée courantes")
    void runsCurrentRound() {
        // ARRANGE
        when(saveRepository.findById(1L)).thenReturn(Optional.of(saveWithHumanTeam()));
        AiTransferSummary summary = AiTransferSummary.builder().newOffers(4).build();
        when(orchestrator.processAITransfers(1L, 10L, 2026, 7, null)).thenReturn(summary);

        // ACT
        CompletableFuture<AiTransferSummary> task = supervisor.submit(1L);

        // ASSERT
        assertThat(task).isCompletedWithValue(summary);
        AiTaskStatus status = supervisor.status(1L).orElseThrow();
        assertThat(status.getState()).isEqualTo(AiTaskStatus.State.SUCCEEDED);
        assertThat(status.getRound()).isEqualTo(7);
        assertThat(status.getSummary().getNewOffers()).isEqualTo(4);
        assertThat(status.getFinishedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Un échec est journalisé et exposé dans l'état, jamais relancé à l'appelant")
    void failureIsRecorded() {
        when(saveRepository.findById(1L)).thenReturn(Optional.of(saveWithHumanTeam()));
        when(orchestrator.processAITransfers(eq(1L), eq(10L), anyInt(), anyInt(), any()))
                .thenThrow(new IllegalStateException("chunk 2/3 failed"));

        CompletableFuture<AiTransferSummary> task = supervisor.submit(1L);

        assertThat(task).isCompletedExceptionally();
        AiTaskStatus status = supervisor.status(1L).orElseThrow();
        assertThat(status.getState()).isEqualTo(AiTaskStatus.State.FAILED);
        assertThat(status.getError()).isEqualTo("chunk 2/3 failed");
    }

    @Test
    @DisplayName("Une journée terminée peut être relancée")
    void canResubmitAfterCompletion() {
        when(saveRepository.findById(1L)).thenReturn(Optional.of(saveWithHumanTeam()));
        when(orchestrator.processAITransfers(eq(1L), eq(10L), anyInt(), anyInt(), any()))
                .thenReturn(AiTransferSummary.builder().build());

        supervisor.submit(1L);
        supervisor.submit(1L);

        verify(orchestrator, times(2)).processAITransfers(eq(1L), eq(10L), anyInt(), anyInt(), any());
    }

    @Test
    @DisplayName("Partie inconnue ou sans club humain")
    void rejectsInvalidSave() {
        when(saveRepository.findById(2L)).thenReturn(Optional.empty());
        GameSave orphan = new GameSave("Sans club", 2026, 1);
        orphan.setId(3L);
        when(saveRepository.findById(3L)).thenReturn(Optional.of(orphan));

        assertThatThrownBy(() -> supervisor.submit(2L)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> supervisor.submit(3L)).isInstanceOf(ValidationException.class);
        assertThat(supervisor.status(3L)).isEmpty();
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Une journée refusée par l'exécuteur est marquée en échec, pas en cours")
    void rejectedTaskIsRecordedAsFailed() {
        // ARRANGE
        when(saveRepository.findById(1L)).thenReturn(Optional.of(saveWithHumanTeam()));
        TaskExecutor saturated = runnable -> {
            throw new TaskRejectedException("queue full");
        };
        AiMarketTaskSupervisor busy = new AiMarketTaskSupervisor(orchestrator, saveRepository, saturated,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));

        // ACT
        CompletableFuture<AiTransferSummary> task = busy.submit(1L);

        // ASSERT
        assertThat(task).isCompletedExceptionally();
        AiTaskStatus status = busy.status(1L).orElseThrow();
        assertThat(status.getState()).isEqualTo(AiTaskStatus.State.FAILED);
        assertThat(status.getError()).isEqualTo("queue full");
        verifyNoInteractions(orchestrator);
    }
}
