package com.mevshield.engine.snapshot;

import com.mevshield.common.exception.DataSourceException;
import com.mevshield.common.model.MarketSnapshot;
import com.mevshield.common.model.SnapshotBatch;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.provider.MarketSnapshotProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces the per-cycle pool snapshots.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Fetch all configured pools from the {@link MarketSnapshotProvider}, bounded by
 *       {@code mevshield.snapshot.fetch-timeout}.</li>
 *   <li>Pools present in the batch are fresh and refresh the {@link MarketSnapshotCache}.</li>
 *   <li>Pools missing from the batch, or every pool when the fetch failed, fall back to
 *       the cache and are marked stale.</li>
 *   <li>Pools with no cached entry are skipped for this cycle.</li>
 * </ol>
 *
 * <p>The block reference never goes backwards: a fallback cycle reuses the last known block.
 * Fetch failures never propagate; the returned {@link Mono} always completes with a value.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final MarketSnapshotProvider provider;
    private final MarketSnapshotCache cache;
    private final Duration fetchTimeout;
    private final AtomicLong lastBlock = new AtomicLong(0);

    public SnapshotService(MarketSnapshotProvider provider, MarketSnapshotCache cache,
                           MevShieldProperties properties) {
        this.provider     = provider;
        this.cache        = cache;
        this.fetchTimeout = properties.getSnapshot().getFetchTimeout();
    }

    public Mono<ResolvedSnapshots> resolve(List<String> poolIds) {
        return Mono.defer(() -> provider.fetch(poolIds))
            .timeout(fetchTimeout)
            .onErrorMap(e -> !(e instanceof DataSourceException), e -> new DataSourceException(
                "SnapshotService",
                e instanceof TimeoutException
                    ? "Snapshot fetch timed out after " + fetchTimeout.toMillis() + "ms"
                    : "Snapshot fetch failed: " + e.getMessage(),
                e))
            .map(batch -> merge(poolIds, batch))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("SNAPSHOT_FETCH_EMPTY pools={}, using cache fallback", poolIds.size());
                return fromCache(poolIds);
            }))
            .onErrorResume(DataSourceException.class, e -> {
                log.warn("SNAPSHOT_FETCH_FAILED pools={} reason={}, using cache fallback",
                         poolIds.size(), e.getMessage());
                return Mono.just(fromCache(poolIds));
            });
    }

    public long lastBlockReference() {
        return lastBlock.get();
    }

    private ResolvedSnapshots merge(List<String> poolIds, SnapshotBatch batch) {
        long block = lastBlock.accumulateAndGet(batch.blockReference(), Math::max);
        if (batch.blockReference() < block) {
            log.warn("SNAPSHOT_BLOCK_REGRESSION fetched={} kept={}", batch.blockReference(), block);
        }
        List<PoolSnapshot> resolved = new ArrayList<>(poolIds.size());
        for (String poolId : poolIds) {
            MarketSnapshot fresh = batch.snapshots().get(poolId);
            if (fresh != null) {
                cache.put(poolId, fresh);
                resolved.add(PoolSnapshot.fresh(poolId, fresh));
            } else {
                fallback(poolId).ifPresent(resolved::add);
            }
        }
        return new ResolvedSnapshots(block, List.copyOf(resolved));
    }

    private ResolvedSnapshots fromCache(List<String> poolIds) {
        List<PoolSnapshot> resolved = new ArrayList<>(poolIds.size());
        for (String poolId : poolIds) {
            fallback(poolId).ifPresent(resolved::add);
        }
        return new ResolvedSnapshots(lastBlock.get(), List.copyOf(resolved));
    }

    private Optional<PoolSnapshot> fallback(String poolId) {
        Optional<PoolSnapshot> cached = cache.get(poolId)
            .map(entry -> PoolSnapshot.stale(poolId, entry.snapshot()));
        if (cached.isEmpty()) {
            log.info("SNAPSHOT_POOL_SKIPPED poolId={} reason=no-fresh-or-cached-data", poolId);
        }
        return cached;
    }
}
