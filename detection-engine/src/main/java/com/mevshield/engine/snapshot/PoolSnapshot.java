package com.mevshield.engine.snapshot;

import com.mevshield.common.model.MarketSnapshot;

/**
 * A pool's snapshot as handed to the detector set.
 * {@code stale} is true when the figures came from the cache instead of this cycle's fetch.
 */
public record PoolSnapshot(String poolId, MarketSnapshot snapshot, boolean stale) {

    public static PoolSnapshot fresh(String poolId, MarketSnapshot snapshot) {
        return new PoolSnapshot(poolId, snapshot, false);
    }

    public static PoolSnapshot stale(String poolId, MarketSnapshot snapshot) {
        return new PoolSnapshot(poolId, snapshot, true);
    }
}
