package com.mevshield.engine.cycle;

import com.mevshield.engine.config.MevShieldProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Fixed-interval driver of {@link DetectionCycleService#runCycle()}.
 *
 * <pre>
 *   interval tick -> (drop if a cycle is still in flight) -> runCycle() -> next tick
 * </pre>
 *
 * <p>Ticks that arrive while a cycle runs are dropped rather than queued, and the cycle
 * service's own interval guard absorbs early ticks, so a slow cycle never causes a burst
 * of catch-up cycles. {@code runCycle()} never errors; the loop only ends on shutdown.
 *
 * <p>Shutdown stops accepting ticks, waits up to {@code mevshield.scheduler.shutdown-timeout}
 * for the in-flight cycle, then disposes the timer.
 */
@Component
public class DetectionCycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(DetectionCycleScheduler.class);

    private final DetectionCycleService cycleService;
    private final boolean enabled;
    private final Duration interval;
    private final Duration shutdownTimeout;

    private volatile boolean stopping;
    private volatile Disposable subscription;

    public DetectionCycleScheduler(DetectionCycleService cycleService, MevShieldProperties properties) {
        this.cycleService    = cycleService;
        this.enabled         = properties.getScheduler().isEnabled();
        this.interval        = properties.getCycle().getInterval();
        this.shutdownTimeout = properties.getScheduler().getShutdownTimeout();
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Detection scheduler disabled (mevshield.scheduler.enabled=false). Cycles run on demand only.");
            return;
        }
        log.info("Detection scheduler started. intervalMs={}", interval.toMillis());
        subscription = Flux.interval(interval, interval, Schedulers.parallel())
            .onBackpressureDrop(tick -> log.debug("CYCLE_TICK_DROPPED tick={}", tick))
            .concatMap(tick -> stopping ? Mono.<CycleReport>empty() : cycleService.runCycle(), 1)
            .subscribe(
                report -> log.debug("Cycle tick handled. status={} cycleId={}", report.status(), report.cycleId()),
                err -> log.error("Detection scheduler terminated unexpectedly", err)
            );
    }

    @PreDestroy
    public void stop() {
        stopping = true;
        Disposable current = subscription;
        if (current == null) {
            return;
        }
        try {
            if (!cycleService.awaitIdle(shutdownTimeout)) {
                log.warn("SCHEDULER_SHUTDOWN_TIMEOUT cycleId={} waitedMs={}; in-flight cycle cancelled and may be partially applied",
                         cycleService.currentCycleId(), shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("SCHEDULER_SHUTDOWN_INTERRUPTED cycleId={}", cycleService.currentCycleId());
        } finally {
            current.dispose();
            log.info("Detection scheduler stopped.");
        }
    }

    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }
}
