package com.tony.transferMarket.service;

import com.tony.transferMarket.exception.NotFoundException;
import com.tony.transferMarket.exception.ValidationException;
import com.tony.transferMarket.model.GameSave;
import com.tony.transferMarket.model.dto.AiTaskStatus;
import com.tony.transferMarket.model.dto.AiTransferSummary;
import com.tony.transferMarket.repository.GameSaveRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Lance la journée IA en arrière-plan, après la réponse au passage de journée.
 * Les échecs sont journalisés et visibles uniquement via {@link #status(Long)} :
 * ils ne remontent jamais à l'appelant.
 */
@Service
@Slf4j
public class AiMarketTaskSupervisor {

    private final MarketOrchestrator orchestrator;
    private final GameSaveRepository saveRepository;
    private final TaskExecutor executor;
    private final Clock clock;

    private final Map<Long, CompletableFuture<AiTransferSummary>> running = new ConcurrentHashMap<>();
    private final Map<Long, AiTaskStatus> statuses = new ConcurrentHashMap<>();

    public AiMarketTaskSupervisor(MarketOrchestrator orchestrator,
                                  GameSaveRepository saveRepository,
                                  @Qualifier("aiMarketExecutor") TaskExecutor executor,
                                  Clock clock) {
        this.orchestrator = orchestrator;
        this.saveRepository = saveRepository;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Démarre la journée IA de la partie (saison et journée courantes).
     * Si une journée tourne déjà pour cette partie, renvoie la tâche en cours.
     */
    public CompletableFuture<AiTransferSummary> submit(Long saveId) {
        GameSave save = saveRepository.findById(saveId).orElseThrow(() -> NotFoundException.of("save", saveId));
        if (save.getHumanTeam() == null) {
            throw new ValidationException("save " + saveId + " has no human-controlled team");
        }
        Long humanTeamId = save.getHumanTeam().getId();
        int season = save.getCurrentSeason();
        int round = save.getCurrentRound();

        synchronized (running) {
            CompletableFuture<AiTransferSummary> current = running.get(saveId);
            if (current != null && !current.isDone()) {
                return current;
            }
            statuses.put(saveId, AiTaskStatus.builder()
                    .saveId(saveId).state(AiTaskStatus.State.RUNNING)
                    .season(season).round(round)
                    .startedAt(clock.instant())
                    .build());
            log.info("🚀 Journée IA lancée (partie {}, saison {}, journée {})", saveId, season, round);
            CompletableFuture<AiTransferSummary> task;
            try {
                task = CompletableFuture
                        .supplyAsync(() -> orchestrator.processAITransfers(saveId, humanTeamId, season, round, null), executor)
                        .whenComplete((summary, error) -> finish(saveId, season, round, summary, error));
            } catch (RejectedExecutionException e) {
                // File d'attente pleine : la journée n'a jamais démarré
                log.warn("⚠️ Journée IA refusée par l'exécuteur (partie {}, journée {})", saveId, round);
                finish(saveId, season, round, null, e);
                return CompletableFuture.failedFuture(e);
            }
            running.put(saveId, task);
            return task;
        }
    }

    public Optional<AiTaskStatus> status(Long saveId) {
        return Optional.ofNullable(statuses.get(saveId));
    }

    private void finish(Long saveId, int season, int round, AiTransferSummary summary, Throwable error) {
        AiTaskStatus previous = statuses.get(saveId);
        AiTaskStatus.AiTaskStatusBuilder next = AiTaskStatus.builder()
                .saveId(saveId).season(season).round(round)
                .startedAt(previous != null ? previous.getStartedAt() : null)
                .finishedAt(clock.instant());
        if (error == null) {
            statuses.put(saveId, next.state(AiTaskStatus.State.SUCCEEDED).summary(summary).build());
        } else {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            log.error("❌ Journée IA en échec (partie {}, journée {}), à relancer entièrement", saveId, round, cause);
            statuses.put(saveId, next.state(AiTaskStatus.State.FAILED).error(cause.getMessage()).build());
        }
        running.remove(saveId);
    }
}
