package com.mevshield.engine.detector;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.snapshot.PoolSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/** Liquidation pressure, proxied by pool volatility. */
@Component
public class LiquidationDetector implements OpportunityDetector {

    private final MevShieldProperties.Liquidation policy;

    public LiquidationDetector(MevShieldProperties properties) {
        this.policy = properties.getDetection().getLiquidation();
    }

    @Override
    public OpportunityKind kind() { return OpportunityKind.LIQUIDATION; }

    @Override
    public Optional<Opportunity> detect(PoolSnapshot pool, long blockReference, Instant detectedAt) {
        double volatility = pool.snapshot().volatility();
        if (!(volatility > policy.getVolatilityThreshold())) {
            return Optional.empty();
        }
        double value = ValueBounds.cap(volatility * policy.getValueMultiplier(), policy.getValueCap());
        double risk  = ValueBounds.unit(volatility);

        return Optional.of(Opportunity.detected(pool.poolId(), kind(), value, risk,
            policy.getConfidence(), detectedAt, blockReference, pool.stale()));
    }
}
