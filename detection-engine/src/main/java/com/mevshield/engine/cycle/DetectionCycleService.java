package com.mevshield.engine.cycle;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.trace.CycleTraceUtil;
import com.mevshield.engine.alert.AlertDispatchService;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.detector.DetectorDispatchService;
import com.mevshield.engine.enhance.ScoreEnhancementService;
import com.mevshield.engine.ledger.OpportunityLedger;
import com.mevshield.engine.snapshot.ResolvedSnapshots;
import com.mevshield.engine.snapshot.SnapshotService;
import com.mevshield.engine.stats.EngineStatsTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One detection pass over all configured pools.
 *
 * <pre>
 *   IDLE --runCycle()--> RUNNING: fetch -> detect -> enhance -> ledger -> alerts --> IDLE
 * </pre>
 *
 * <p>{@link #runCycle()} is a no-op ({@link CycleStatus#SKIPPED}) while another cycle is
 * running or when less than {@code mevshield.cycle.interval} has passed since the last
 * completed cycle started. This guard is authoritative; callers may tick as often as
 * they like.
 *
 * <p>Failures are contained per cycle: the returned {@link Mono} never errors, a failed
 * cycle reports {@link CycleStatus#FAILED} and does not advance the interval guard.
 */
@Service
public class DetectionCycleService {

    private static final Logger log = LoggerFactory.getLogger(DetectionCycleService.class);

    private final SnapshotService snapshotService;
    private final DetectorDispatchService detectorDispatch;
    private final ScoreEnhancementService enhancementService;
    private final OpportunityLedger ledger;
    private final AlertDispatchService alertDispatch;
    private final EngineStatsTracker stats;
    private final Clock clock;
    private final List<String> pools;
    private final Duration interval;

    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private final Object idleMonitor = new Object();
    private volatile Instant lastCycleStart;
    private volatile String currentCycleId;

    public DetectionCycleService(SnapshotService snapshotService,
                                 DetectorDispatchService detectorDispatch,
                                 ScoreEnhancementService enhancementService,
                                 OpportunityLedger ledger,
                                 AlertDispatchService alertDispatch,
                                 EngineStatsTracker stats,
                                 Clock clock,
                                 MevShieldProperties properties) {
        this.snapshotService    = snapshotService;
        this.detectorDispatch   = detectorDispatch;
        this.enhancementService = enhancementService;
        this.ledger             = ledger;
        this.alertDispatch      = alertDispatch;
        this.stats              = stats;
        this.clock              = clock;
        this.pools              = List.copyOf(properties.getPools());
        this.interval           = properties.getCycle().getInterval();
    }

    public Mono<CycleReport> runCycle() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            if (!state.compareAndSet(CycleState.IDLE, CycleState.RUNNING)) {
                log.debug("CYCLE_SKIPPED reason=already-running cycleId={}", currentCycleId);
                return Mono.just(CycleReport.skipped(now, "cycle already running"));
            }
            Instant last = lastCycleStart;
            if (last != null && Duration.between(last, now).compareTo(interval) < 0) {
                release();
                log.debug("CYCLE_SKIPPED reason=too-soon sinceLastMs={}", Duration.between(last, now).toMillis());
                return Mono.just(CycleReport.skipped(now, "interval not elapsed"));
            }

            String cycleId = CycleTraceUtil.newCycleId();
            currentCycleId = cycleId;
            return CycleTraceUtil.withCycleId(execute(cycleId, now), cycleId)
                .doOnTerminate(this::release)
                .doOnCancel(this::release);
        });
    }

    public CycleState state() {
        return state.get();
    }

    public Instant lastCycleStart() {
        return lastCycleStart;
    }

    public String currentCycleId() {
        return currentCycleId;
    }

    /**
     * Blocks until no cycle is running or {@code timeout} elapses.
     *
     * @return {@code true} if the engine is idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (state.get() == CycleState.RUNNING) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
        }
        return true;
    }

    private Mono<CycleReport> execute(String cycleId, Instant startedAt) {
        CycleTraceUtil.withMdc(cycleId, () ->
            log.info("CYCLE_STARTED cycleId={} pools={}", cycleId, pools.size()));

        return snapshotService.resolve(pools)
            .flatMap(resolved -> detectorDispatch.detectAll(resolved.pools(), resolved.blockReference(), startedAt)
                .map(candidates -> seal(enhancementService.enhanceAll(candidates)))
                .flatMap(sealed -> alertDispatch.dispatchQualifying(sealed)
                    .map(sent -> completed(cycleId, startedAt, resolved, sealed, sent))))
            .onErrorResume(e -> {
                stats.recordCycleFailed();
                CycleTraceUtil.withMdc(cycleId, () ->
                    log.error("CYCLE_FAILED cycleId={} reason={}", cycleId, e.getMessage(), e));
                return Mono.just(CycleReport.failed(cycleId, startedAt, String.valueOf(e.getMessage())));
            });
    }

    private List<Opportunity> seal(List<Opportunity> enhanced) {
        ledger.appendAll(enhanced);
        stats.recordDetected(enhanced.size());
        return enhanced;
    }

    private CycleReport completed(String cycleId, Instant startedAt, ResolvedSnapshots resolved,
                                  List<Opportunity> sealed, int alertsSent) {
        lastCycleStart = startedAt;
        stats.recordCycleCompleted();
        CycleReport report = new CycleReport(CycleStatus.COMPLETED, cycleId, startedAt,
            resolved.blockReference(), resolved.pools().size(), (int) resolved.staleCount(),
            List.copyOf(sealed), alertsSent, null);
        CycleTraceUtil.withMdc(cycleId, () ->
            log.info("CYCLE_COMPLETED cycleId={} block={} pools={} stale={} opportunities={} alerts={} ledgerSize={}",
                     cycleId, report.blockReference(), report.poolsEvaluated(), report.stalePools(),
                     sealed.size(), alertsSent, ledger.size()));
        return report;
    }

    private void release() {
        synchronized (idleMonitor) {
            state.set(CycleState.IDLE);
            idleMonitor.notifyAll();
        }
    }
}
