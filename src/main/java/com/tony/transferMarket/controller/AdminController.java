package com.tony.transferMarket.controller;

import com.tony.transferMarket.job.NegotiationSweepJob;
import com.tony.transferMarket.model.dto.AiTaskStatus;
import com.tony.transferMarket.model.dto.MarketDiagnostics;
import com.tony.transferMarket.service.AiMarketTaskSupervisor;
import com.tony.transferMarket.service.TransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final AiMarketTaskSupervisor supervisor;
    private final TransferService transferService;
    private final NegotiationSweepJob sweepJob;

    /**
     * Lance la journée IA de la partie en arrière-plan. Répond immédiatement :
     * le résultat se consulte sur {@code /ai-market/status}.
     */
    @PostMapping("/saves/{saveId}/ai-market")
    public ResponseEntity<AiTaskStatus> processAiMarket(@PathVariable Long saveId) {
        log.info("🚀 Journée IA demandée par l'admin pour la partie {}", saveId);
        supervisor.submit(saveId);
        return supervisor.status(saveId)
                .map(status -> ResponseEntity.accepted().body(status))
                .orElse(ResponseEntity.accepted().build());
    }

    @GetMapping("/saves/{saveId}/ai-market/status")
    public ResponseEntity<AiTaskStatus> aiMarketStatus(@PathVariable Long saveId) {
        return supervisor.status(saveId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/saves/{saveId}/diagnostics")
    public ResponseEntity<MarketDiagnostics> diagnostics(@PathVariable Long saveId) {
        return ResponseEntity.ok(transferService.getDiagnostics(saveId));
    }

    @PostMapping("/negotiations/sweep")
    public ResponseEntity<Map<String, String>> sweepNegotiations() {
        sweepJob.sweepExpiredSessions();
        return ResponseEntity.ok(Map.of("message", "Sessions expirées purgées."));
    }
}
