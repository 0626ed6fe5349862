package com.mevshield.engine.snapshot;

import com.mevshield.common.model.MarketSnapshot;
import com.mevshield.engine.config.MevShieldProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest observed {@link MarketSnapshot} per pool, used as fallback when a fetch fails.
 *
 * <p>Only the newest snapshot per pool is kept. When {@code mevshield.snapshot.max-age}
 * is set, older entries are evicted on lookup and reported as a miss.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; all methods are non-blocking lookups.
 */
@Component
public class MarketSnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(MarketSnapshotCache.class);

    private final ConcurrentHashMap<String, CachedSnapshot> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration maxAge;   // null = unlimited

    public MarketSnapshotCache(MevShieldProperties properties, Clock clock) {
        this.clock  = clock;
        this.maxAge = properties.getSnapshot().getMaxAge();
    }

    public Optional<CachedSnapshot> get(String poolId) {
        CachedSnapshot entry = store.get(poolId);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            store.remove(poolId, entry);
            log.info("SNAPSHOT_CACHE_EXPIRED poolId={} fetchedAt={}", poolId, entry.fetchedAt());
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String poolId, MarketSnapshot snapshot) {
        store.put(poolId, new CachedSnapshot(snapshot, clock.instant()));
        log.debug("SNAPSHOT_CACHE_REFRESH poolId={}", poolId);
    }

    public int size() {
        return store.size();
    }

    boolean isExpired(CachedSnapshot entry) {
        if (maxAge == null) {
            return false;
        }
        return clock.instant().isAfter(entry.fetchedAt().plus(maxAge));
    }
}
