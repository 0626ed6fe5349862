package com.mevshield.engine.snapshot;

import com.mevshield.common.model.MarketSnapshot;

import java.time.Instant;

/** Cache entry: the latest snapshot of one pool and when it was fetched. */
public record CachedSnapshot(
    MarketSnapshot snapshot,
    Instant fetchedAt
) {}
