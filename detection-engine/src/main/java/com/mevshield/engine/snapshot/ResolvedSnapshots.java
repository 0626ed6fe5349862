package com.mevshield.engine.snapshot;

import java.util.List;

/**
 * Input of one detection cycle after fallback resolution.
 * Pools with neither fresh nor cached data are absent from {@code pools}.
 */
public record ResolvedSnapshots(long blockReference, List<PoolSnapshot> pools) {

    public long staleCount() {
        return pools.stream().filter(PoolSnapshot::stale).count();
    }
}
