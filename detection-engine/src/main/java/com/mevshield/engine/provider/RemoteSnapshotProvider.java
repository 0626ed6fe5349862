package com.mevshield.engine.provider;

import com.mevshield.common.exception.DataSourceException;
import com.mevshield.common.model.SnapshotBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches pool snapshots from the market data provider over HTTP.
 *
 * <p>{@code GET /api/v1/pools/snapshots?poolIds=a,b,c} returning a {@link SnapshotBatch}.
 * Transport and decoding failures surface as {@link DataSourceException}; the caller
 * owns the per-cycle deadline and the cache fallback.
 */
@Component
@Profile("!simulated")
public class RemoteSnapshotProvider implements MarketSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(RemoteSnapshotProvider.class);

    private final WebClient marketDataClient;

    public RemoteSnapshotProvider(WebClient marketDataClient) {
        this.marketDataClient = marketDataClient;
    }

    @Override
    public Mono<SnapshotBatch> fetch(List<String> poolIds) {
        return marketDataClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/pools/snapshots")
                .queryParam("poolIds", String.join(",", poolIds))
                .build())
            .retrieve()
            .bodyToMono(SnapshotBatch.class)
            .switchIfEmpty(Mono.error(() ->
                new DataSourceException("RemoteSnapshotProvider", "Empty snapshot response")))
            .doOnSuccess(batch -> log.info("SNAPSHOTS_FETCHED provider=remote block={} pools={}",
                                           batch.blockReference(), batch.snapshots().size()))
            .onErrorMap(e -> !(e instanceof DataSourceException),
                        e -> new DataSourceException("RemoteSnapshotProvider",
                                                     "Snapshot fetch failed: " + e.getMessage(), e));
    }
}
