package com.mevshield.engine.support;

import com.mevshield.common.model.MarketSnapshot;
import com.mevshield.common.model.SnapshotBatch;
import com.mevshield.engine.provider.MarketSnapshotProvider;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Scriptable provider: returns whatever the current responder produces and counts fetches. */
public class StubSnapshotProvider implements MarketSnapshotProvider {

    private final AtomicInteger fetches = new AtomicInteger();
    private volatile Function<List<String>, Mono<SnapshotBatch>> responder =
        pools -> Mono.just(new SnapshotBatch(1, Map.of()));

    public StubSnapshotProvider respondWith(long block, Map<String, MarketSnapshot> snapshots) {
        this.responder = pools -> Mono.just(new SnapshotBatch(block, snapshots));
        return this;
    }

    public StubSnapshotProvider respond(Function<List<String>, Mono<SnapshotBatch>> responder) {
        this.responder = responder;
        return this;
    }

    public StubSnapshotProvider fail(RuntimeException error) {
        this.responder = pools -> Mono.error(error);
        return this;
    }

    public int fetchCount() {
        return fetches.get();
    }

    @Override
    public Mono<SnapshotBatch> fetch(List<String> poolIds) {
        fetches.incrementAndGet();
        return responder.apply(poolIds);
    }
}
