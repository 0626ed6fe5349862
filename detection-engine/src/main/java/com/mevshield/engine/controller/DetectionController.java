package com.mevshield.engine.controller;

import com.mevshield.common.model.EngineStats;
import com.mevshield.common.model.ExternalAlert;
import com.mevshield.common.model.Opportunity;
import com.mevshield.engine.cycle.CycleReport;
import com.mevshield.engine.cycle.DetectionCycleService;
import com.mevshield.engine.ingest.ExternalAlertService;
import com.mevshield.engine.ledger.OpportunityLedger;
import com.mevshield.engine.stats.EngineStatsTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class DetectionController {

    private static final int MAX_LIMIT = 500;

    private final ExternalAlertService externalAlertService;
    private final DetectionCycleService cycleService;
    private final EngineStatsTracker statsTracker;
    private final OpportunityLedger ledger;

    public DetectionController(ExternalAlertService externalAlertService,
                               DetectionCycleService cycleService,
                               EngineStatsTracker statsTracker,
                               OpportunityLedger ledger) {
        this.externalAlertService = externalAlertService;
        this.cycleService         = cycleService;
        this.statsTracker         = statsTracker;
        this.ledger               = ledger;
    }

    @PostMapping("/alerts")
    public Mono<ResponseEntity<Opportunity>> ingest(@RequestBody ExternalAlert alert) {
        return externalAlertService.ingestExternal(alert)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public ResponseEntity<EngineStats> stats() {
        return ResponseEntity.ok(statsTracker.getStats());
    }

    @GetMapping("/opportunities")
    public ResponseEntity<List<Opportunity>> opportunities(
            @RequestParam(value = "poolId", required = false) String poolId,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        return ResponseEntity.ok(ledger.latest(poolId, Math.min(limit, MAX_LIMIT)));
    }

    @PostMapping("/cycle")
    public Mono<ResponseEntity<CycleReport>> triggerCycle() {
        return cycleService.runCycle()
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
