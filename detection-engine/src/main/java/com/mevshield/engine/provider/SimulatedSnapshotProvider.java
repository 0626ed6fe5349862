package com.mevshield.engine.provider;

import com.mevshield.common.model.MarketSnapshot;
import com.mevshield.common.model.SnapshotBatch;
import com.mevshield.engine.config.MevShieldProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Random market figures for local runs without a data provider.
 *
 * <p>Active under profile {@code simulated}. Prices wander up to ±2% around the
 * configured reference ratio so that arbitrage fires now and then; each fetch
 * advances the block reference by one.
 */
@Component
@Profile("simulated")
public class SimulatedSnapshotProvider implements MarketSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSnapshotProvider.class);

    private final double referenceRatio;
    private final AtomicLong block;

    public SimulatedSnapshotProvider(MevShieldProperties properties,
                                     @Value("${mevshield.simulation.start-block:19000000}") long startBlock) {
        this.referenceRatio = properties.getDetection().getArbitrage().getReferenceRatio();
        this.block          = new AtomicLong(startBlock);
    }

    @Override
    public Mono<SnapshotBatch> fetch(List<String> poolIds) {
        return Mono.fromSupplier(() -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            Map<String, MarketSnapshot> snapshots = new LinkedHashMap<>();
            for (String poolId : poolIds) {
                double drift = (rnd.nextDouble() - 0.5) * 0.04;
                snapshots.put(poolId, MarketSnapshot.of(
                    referenceRatio * (1 + drift),
                    1.0,
                    500_000 + rnd.nextDouble() * 2_000_000,
                    500_000 + rnd.nextDouble() * 5_500_000,
                    rnd.nextDouble() * 0.5,
                    rnd.nextDouble() * 0.8));
            }
            long current = block.incrementAndGet();
            log.debug("SNAPSHOTS_FETCHED provider=simulated block={} pools={}", current, snapshots.size());
            return new SnapshotBatch(current, snapshots);
        });
    }
}
