package com.mevshield.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound alert from a peer agent or external monitor.
 *
 * <p>{@code kind} stays a raw string so that an unknown kind surfaces as a
 * validation error from the ingestion path rather than a deserialization failure.
 * Numeric fields are boxed so that a missing value reads as {@code null} and is
 * rejected, never defaulted to zero.
 */
public record ExternalAlert(
    @JsonProperty("poolId") String poolId,
    @JsonProperty("kind") String kind,
    @JsonProperty("estimatedValue") Double estimatedValue,
    @JsonProperty("riskScore") Double riskScore,
    @JsonProperty("blockReference") Long blockReference,
    @JsonProperty("transactionRef") String transactionRef    // optional
) {}
