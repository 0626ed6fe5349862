package com.mevshield.engine.provider;

import com.mevshield.common.model.SnapshotBatch;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of per-pool market figures: a remote data provider, or the simulator
 * under profile {@code simulated}.
 */
public interface MarketSnapshotProvider {

    /**
     * @param poolIds pools to fetch; the batch may omit pools the provider cannot serve
     * @return the fetched batch, or an error signal when the whole fetch failed
     */
    Mono<SnapshotBatch> fetch(List<String> poolIds);
}
