package com.mevshield.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A detected (or externally reported) MEV opportunity on a single pool.
 *
 * <p>Immutable. The correlation stage derives adjusted copies through
 * {@link #withRiskScore(double)} and {@link #withConfidence(double)} before the
 * record is sealed into the ledger; nothing changes it afterwards.
 *
 * <p>Invariants: {@code 0 <= riskScore <= 1}, {@code 0 <= confidence <= 1},
 * {@code estimatedValue >= 0}. Violations throw {@link IllegalArgumentException}.
 */
public record Opportunity(
    @JsonProperty("poolId") String poolId,
    @JsonProperty("kind") OpportunityKind kind,
    @JsonProperty("estimatedValue") double estimatedValue,
    @JsonProperty("riskScore") double riskScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("detectedAt") Instant detectedAt,
    @JsonProperty("blockReference") long blockReference,
    @JsonProperty("transactionRef") String transactionRef,     // nullable
    @JsonProperty("source") OpportunitySource source,
    @JsonProperty("staleData") boolean staleData
) {

    /** Confidence assigned to opportunities reported by peers rather than detected here. */
    public static final double EXTERNAL_CONFIDENCE = 0.8;

    public Opportunity {
        Objects.requireNonNull(poolId, "poolId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detectedAt, "detectedAt");
        if (source == null) {
            source = OpportunitySource.DETECTOR;
        }
        requireUnit("riskScore", riskScore);
        requireUnit("confidence", confidence);
        if (!(estimatedValue >= 0.0) || Double.isInfinite(estimatedValue)) {
            throw new IllegalArgumentException("estimatedValue must be a finite value >= 0, got " + estimatedValue);
        }
    }

    public static Opportunity detected(String poolId, OpportunityKind kind, double estimatedValue,
                                       double riskScore, double confidence, Instant detectedAt,
                                       long blockReference, boolean staleData) {
        return new Opportunity(poolId, kind, estimatedValue, riskScore, confidence, detectedAt,
                               blockReference, null, OpportunitySource.DETECTOR, staleData);
    }

    public Opportunity withRiskScore(double newRiskScore) {
        return new Opportunity(poolId, kind, estimatedValue, newRiskScore, confidence, detectedAt,
                               blockReference, transactionRef, source, staleData);
    }

    public Opportunity withConfidence(double newConfidence) {
        return new Opportunity(poolId, kind, estimatedValue, riskScore, newConfidence, detectedAt,
                               blockReference, transactionRef, source, staleData);
    }

    private static void requireUnit(String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        }
    }
}
