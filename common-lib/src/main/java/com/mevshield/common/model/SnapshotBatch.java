package com.mevshield.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One fetch result from the market data provider: the block the figures were read
 * at and the snapshot for every pool the provider could serve.
 * Pools missing from {@code snapshots} count as failed for that fetch.
 */
public record SnapshotBatch(
    @JsonProperty("blockReference") long blockReference,
    @JsonProperty("snapshots") Map<String, MarketSnapshot> snapshots
) {
    public SnapshotBatch {
        snapshots = snapshots == null ? Map.of() : Map.copyOf(snapshots);
    }
}
