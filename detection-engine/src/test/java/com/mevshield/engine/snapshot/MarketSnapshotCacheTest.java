package com.mevshield.engine.snapshot;

import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.support.MutableClock;
import com.mevshield.engine.support.Snapshots;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MarketSnapshotCacheTest {

    private final MutableClock clock = new MutableClock(Snapshots.T0);

    @Test
    @DisplayName("newest snapshot per pool wins")
    void newestWins() {
        MarketSnapshotCache cache = new MarketSnapshotCache(new MevShieldProperties(), clock);
        cache.put("p", Snapshots.quiet());
        clock.advance(Duration.ofSeconds(1));
        cache.put("p", Snapshots.volatileMarket(0.7));

        CachedSnapshot entry = cache.get("p").orElseThrow();
        assertEquals(0.7, entry.snapshot().volatility());
        assertEquals(Snapshots.T0.plusSeconds(1), entry.fetchedAt());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("without max-age entries never expire")
    void unlimited() {
        MarketSnapshotCache cache = new MarketSnapshotCache(new MevShieldProperties(), clock);
        cache.put("p", Snapshots.quiet());
        clock.advance(Duration.ofDays(30));

        assertTrue(cache.get("p").isPresent());
    }

    @Test
    @DisplayName("entries older than max-age are evicted on lookup")
    void maxAge() {
        MevShieldProperties properties = new MevShieldProperties();
        properties.getSnapshot().setMaxAge(Duration.ofSeconds(30));
        MarketSnapshotCache cache = new MarketSnapshotCache(properties, clock);
        cache.put("p", Snapshots.quiet());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(cache.get("p").isPresent(), "exactly max-age is still valid");

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("p").isEmpty());
        assertEquals(0, cache.size());
    }
}
