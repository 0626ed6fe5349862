package com.mevshield.engine.config;

import com.mevshield.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup check of {@link MevShieldProperties}. Collects every violation and
 * reports them together in one {@link ConfigurationException}.
 */
public final class PolicyValidator {

    private static final String COMPONENT = "PolicyValidator";

    private PolicyValidator() {}

    public static void validate(MevShieldProperties props) {
        List<String> errors = new ArrayList<>();

        positive(errors, "mevshield.cycle.interval", props.getCycle().getInterval());
        unit(errors, "mevshield.alerts.risk-threshold", props.getAlerts().getRiskThreshold());
        positive(errors, "mevshield.alerts.send-timeout", props.getAlerts().getSendTimeout());
        if (props.getLedger().getCapacity() < 1) {
            errors.add("mevshield.ledger.capacity must be >= 1, got " + props.getLedger().getCapacity());
        }
        positive(errors, "mevshield.snapshot.fetch-timeout", props.getSnapshot().getFetchTimeout());
        if (props.getSnapshot().getMaxAge() != null) {
            positive(errors, "mevshield.snapshot.max-age", props.getSnapshot().getMaxAge());
        }
        for (String pool : props.getPools()) {
            if (pool == null || pool.isBlank()) {
                errors.add("mevshield.pools must not contain blank pool ids");
                break;
            }
        }

        MevShieldProperties.Arbitrage arb = props.getDetection().getArbitrage();
        positive(errors, "mevshield.detection.arbitrage.reference-ratio", arb.getReferenceRatio());
        nonNegative(errors, "mevshield.detection.arbitrage.deviation-threshold", arb.getDeviationThreshold());
        nonNegative(errors, "mevshield.detection.arbitrage.value-factor", arb.getValueFactor());
        nonNegative(errors, "mevshield.detection.arbitrage.risk-multiplier", arb.getRiskMultiplier());
        positive(errors, "mevshield.detection.arbitrage.value-cap", arb.getValueCap());
        unit(errors, "mevshield.detection.arbitrage.confidence", arb.getConfidence());

        MevShieldProperties.Sandwich sw = props.getDetection().getSandwich();
        nonNegative(errors, "mevshield.detection.sandwich.impact-threshold", sw.getImpactThreshold());
        positive(errors, "mevshield.detection.sandwich.liquidity-threshold", sw.getLiquidityThreshold());
        positive(errors, "mevshield.detection.sandwich.liquidity-norm", sw.getLiquidityNorm());
        nonNegative(errors, "mevshield.detection.sandwich.volume-factor", sw.getVolumeFactor());
        positive(errors, "mevshield.detection.sandwich.value-cap", sw.getValueCap());
        unit(errors, "mevshield.detection.sandwich.confidence", sw.getConfidence());

        MevShieldProperties.Liquidation liq = props.getDetection().getLiquidation();
        nonNegative(errors, "mevshield.detection.liquidation.volatility-threshold", liq.getVolatilityThreshold());
        nonNegative(errors, "mevshield.detection.liquidation.value-multiplier", liq.getValueMultiplier());
        positive(errors, "mevshield.detection.liquidation.value-cap", liq.getValueCap());
        unit(errors, "mevshield.detection.liquidation.confidence", liq.getConfidence());

        MevShieldProperties.Correlation corr = props.getCorrelation();
        positive(errors, "mevshield.correlation.window", corr.getWindow());
        if (corr.getTriggerCount() < 0) {
            errors.add("mevshield.correlation.trigger-count must be >= 0, got " + corr.getTriggerCount());
        }
        unit(errors, "mevshield.correlation.risk-boost", corr.getRiskBoost());
        unit(errors, "mevshield.correlation.confidence-boost", corr.getConfidenceBoost());
        nonNegative(errors, "mevshield.correlation.arbitrage-value-floor", corr.getArbitrageValueFloor());
        unit(errors, "mevshield.correlation.arbitrage-risk-ceiling", corr.getArbitrageRiskCeiling());

        positive(errors, "mevshield.scheduler.shutdown-timeout", props.getScheduler().getShutdownTimeout());

        if (!errors.isEmpty()) {
            throw new ConfigurationException(COMPONENT,
                "Invalid detection policy: " + String.join("; ", errors));
        }
    }

    private static void positive(List<String> errors, String key, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            errors.add(key + " must be a finite value > 0, got " + value);
        }
    }

    private static void nonNegative(List<String> errors, String key, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            errors.add(key + " must be a finite value >= 0, got " + value);
        }
    }

    private static void unit(List<String> errors, String key, double value) {
        if (!(value >= 0 && value <= 1)) {
            errors.add(key + " must be within [0, 1], got " + value);
        }
    }

    private static void positive(List<String> errors, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(key + " must be a positive duration, got " + value);
        }
    }
}
