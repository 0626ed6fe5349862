package com.mevshield.engine.enhance;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.engine.config.MevShieldProperties;

import java.util.List;

/**
 * Default {@link ScoreEnhancer}. Two independent rules, always applied in this order:
 * <ol>
 *   <li>High-value, low-risk arbitrage: {@code confidence += confidenceBoost} (max 1.0).</li>
 *   <li>Clustered activity, more than {@code triggerCount} same-pool entries in the
 *       window: {@code riskScore += riskBoost} (max 1.0).</li>
 * </ol>
 * Stateless; the window itself is applied by the caller when it selects {@code history}.
 */
public class CorrelationScoreEnhancer implements ScoreEnhancer {

    private final MevShieldProperties.Correlation policy;

    public CorrelationScoreEnhancer(MevShieldProperties.Correlation policy) {
        this.policy = policy;
    }

    @Override
    public Opportunity enhance(Opportunity candidate, List<Opportunity> history) {
        Opportunity result = candidate;

        if (candidate.kind() == OpportunityKind.ARBITRAGE
                && candidate.estimatedValue() > policy.getArbitrageValueFloor()
                && candidate.riskScore() < policy.getArbitrageRiskCeiling()) {
            result = result.withConfidence(Math.min(result.confidence() + policy.getConfidenceBoost(), 1.0));
        }

        long samePool = history.stream()
            .filter(h -> h.poolId().equals(candidate.poolId()))
            .count();
        if (samePool > policy.getTriggerCount()) {
            result = result.withRiskScore(Math.min(result.riskScore() + policy.getRiskBoost(), 1.0));
        }
        return result;
    }
}
