package com.mevshield.engine.stats;

import com.mevshield.common.model.EngineStats;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.ledger.OpportunityLedger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters of the detection engine plus the uptime origin.
 * Serves the statistics query together with the current ledger size.
 */
@Component
public class EngineStatsTracker {

    private final AtomicLong opportunitiesDetected = new AtomicLong();
    private final AtomicLong alertsSent            = new AtomicLong();
    private final AtomicLong alertFailures         = new AtomicLong();
    private final AtomicLong cyclesCompleted       = new AtomicLong();
    private final AtomicLong cyclesFailed          = new AtomicLong();

    private final Clock clock;
    private final Instant uptimeOrigin;
    private final OpportunityLedger ledger;
    private final Duration cycleInterval;

    public EngineStatsTracker(Clock clock, OpportunityLedger ledger, MevShieldProperties properties) {
        this.clock         = clock;
        this.uptimeOrigin  = clock.instant();
        this.ledger        = ledger;
        this.cycleInterval = properties.getCycle().getInterval();
    }

    public void recordDetected(int count)  { opportunitiesDetected.addAndGet(count); }
    public void recordAlertSent()          { alertsSent.incrementAndGet(); }
    public void recordAlertFailure()       { alertFailures.incrementAndGet(); }
    public void recordCycleCompleted()     { cyclesCompleted.incrementAndGet(); }
    public void recordCycleFailed()        { cyclesFailed.incrementAndGet(); }

    public EngineStats getStats() {
        double uptimeHours = Duration.between(uptimeOrigin, clock.instant()).toMillis() / 3_600_000.0;
        return new EngineStats(
            opportunitiesDetected.get(),
            alertsSent.get(),
            uptimeHours,
            ledger.size(),
            cycleInterval.toMillis() / 1000.0,
            cyclesCompleted.get(),
            cyclesFailed.get(),
            alertFailures.get()
        );
    }
}
