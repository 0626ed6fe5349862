package com.mevshield.engine.detector;

import com.mevshield.common.model.Opportunity;
import com.mevshield.engine.snapshot.PoolSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every {@link OpportunityDetector} against every pool of a cycle.
 *
 * <p>Pools are evaluated in parallel on {@code boundedElastic}. A failing detector
 * or pool is logged and contributes nothing; other pools are unaffected. The result
 * is sorted by pool id, then kind, so downstream stages see a deterministic order
 * regardless of completion order.
 */
@Service
public class DetectorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(DetectorDispatchService.class);

    static final Comparator<Opportunity> CYCLE_ORDER =
        Comparator.comparing(Opportunity::poolId).thenComparing(Opportunity::kind);

    private final List<OpportunityDetector> detectors;

    public DetectorDispatchService(List<OpportunityDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public Mono<List<Opportunity>> detectAll(List<PoolSnapshot> pools, long blockReference, Instant detectedAt) {
        log.debug("Dispatching {} detectors across {} pools. block={}",
                  detectors.size(), pools.size(), blockReference);
        return Flux.fromIterable(pools)
            .flatMap(pool -> Mono.fromCallable(() -> detectPool(pool, blockReference, detectedAt))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("POOL_DETECTION_FAILED poolId={}", pool.poolId(), e);
                    return Mono.just(List.of());
                }))
            .flatMapIterable(found -> found)
            .collectSortedList(CYCLE_ORDER);
    }

    List<Opportunity> detectPool(PoolSnapshot pool, long blockReference, Instant detectedAt) {
        List<Opportunity> found = new ArrayList<>(detectors.size());
        for (OpportunityDetector detector : detectors) {
            try {
                detector.detect(pool, blockReference, detectedAt).ifPresent(opportunity -> {
                    found.add(opportunity);
                    log.info("OPPORTUNITY_DETECTED poolId={} kind={} value={} risk={} confidence={} stale={}",
                             opportunity.poolId(), opportunity.kind(),
                             String.format("%.4f", opportunity.estimatedValue()),
                             String.format("%.3f", opportunity.riskScore()),
                             opportunity.confidence(), opportunity.staleData());
                });
            } catch (RuntimeException e) {
                log.error("DETECTOR_FAILED detector={} poolId={}", detector.detectorName(), pool.poolId(), e);
            }
        }
        return found;
    }
}
