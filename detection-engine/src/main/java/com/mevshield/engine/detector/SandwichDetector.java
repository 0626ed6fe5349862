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
 * Sandwich exposure: high price impact on a thin pool. Both conditions must hold
 * (strict comparisons).
 */
@Component
public class SandwichDetector implements OpportunityDetector {

    private final MevShieldProperties.Sandwich policy;

    public SandwichDetector(MevShieldProperties properties) {
        this.policy = properties.getDetection().getSandwich();
    }

    @Override
    public OpportunityKind kind() { return OpportunityKind.SANDWICH; }

    @Override
    public Optional<Opportunity> detect(PoolSnapshot pool, long blockReference, Instant detectedAt) {
        MarketSnapshot s = pool.snapshot();
        boolean highImpact    = s.priceImpact() > policy.getImpactThreshold();
        boolean thinLiquidity = s.liquidity() < policy.getLiquidityThreshold();
        if (!highImpact || !thinLiquidity) {
            return Optional.empty();
        }

        double value = ValueBounds.cap(s.volume24h() * policy.getVolumeFactor() * s.priceImpact(),
                                       policy.getValueCap());
        // thinner pool relative to the norm -> higher risk
        double liquidityGap = 1.0 - s.liquidity() / policy.getLiquidityNorm();
        double risk = ValueBounds.unit((s.priceImpact() + liquidityGap) / 2.0);

        return Optional.of(Opportunity.detected(pool.poolId(), kind(), value, risk,
            policy.getConfidence(), detectedAt, blockReference, pool.stale()));
    }
}
