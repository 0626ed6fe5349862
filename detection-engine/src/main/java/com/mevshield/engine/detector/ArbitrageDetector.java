package com.mevshield.engine.detector;

import com.mevshield.common.model.MarketSnapshot;
import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.snapshot.PoolSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Flags pools whose token0/token1 price ratio deviates from the reference ratio.
 *
 * <pre>
 *   ratio     = token0Price / token1Price
 *   deviation = |ratio - reference| / reference        fires iff deviation > threshold
 *   value     = min(liquidity * deviation * valueFactor, cap)
 *   risk      = min(deviation * riskMultiplier, 1.0)
 * </pre>
 * A zero or non-finite ratio is treated as no signal.
 */
@Component
public class ArbitrageDetector implements OpportunityDetector {

    private final MevShieldProperties.Arbitrage policy;

    public ArbitrageDetector(MevShieldProperties properties) {
        this.policy = properties.getDetection().getArbitrage();
    }

    @Override
    public OpportunityKind kind() { return OpportunityKind.ARBITRAGE; }

    @Override
    public Optional<Opportunity> detect(PoolSnapshot pool, long blockReference, Instant detectedAt) {
        MarketSnapshot s = pool.snapshot();
        if (s.token1Price() == 0.0) {
            return Optional.empty();
        }
        double ratio = s.token0Price() / s.token1Price();
        if (!Double.isFinite(ratio)) {
            return Optional.empty();
        }

        double reference = policy.getReferenceRatio();
        double deviation = Math.abs(ratio - reference) / reference;
        if (!(deviation > policy.getDeviationThreshold())) {
            return Optional.empty();
        }

        double value = ValueBounds.cap(s.liquidity() * deviation * policy.getValueFactor(), policy.getValueCap());
        double risk  = ValueBounds.unit(deviation * policy.getRiskMultiplier());

        return Optional.of(Opportunity.detected(pool.poolId(), kind(), value, risk,
            policy.getConfidence(), detectedAt, blockReference, pool.stale()));
    }
}
