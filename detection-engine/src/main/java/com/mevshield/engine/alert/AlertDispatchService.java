package com.mevshield.engine.alert;

import com.mevshield.common.exception.DispatchException;
import com.mevshield.common.model.Opportunity;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.stats.EngineStatsTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Forwards opportunities with {@code riskScore >= mevshield.alerts.risk-threshold}
 * to the {@link AlertSink}.
 *
 * <p>Sends are sequential, each bounded by {@code mevshield.alerts.send-timeout}. A failed
 * or timed-out send is logged, counted and not retried; it never fails the caller.
 */
@Service
public class AlertDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatchService.class);

    private final AlertSink sink;
    private final EngineStatsTracker stats;
    private final double riskThreshold;
    private final Duration sendTimeout;

    public AlertDispatchService(AlertSink sink, EngineStatsTracker stats, MevShieldProperties properties) {
        this.sink          = sink;
        this.stats         = stats;
        this.riskThreshold = properties.getAlerts().getRiskThreshold();
        this.sendTimeout   = properties.getAlerts().getSendTimeout();
    }

    public boolean qualifies(Opportunity opportunity) {
        return opportunity.riskScore() >= riskThreshold;
    }

    /** @return number of alerts delivered successfully */
    public Mono<Integer> dispatchQualifying(List<Opportunity> opportunities) {
        return Flux.fromIterable(opportunities)
            .filter(this::qualifies)
            .concatMap(this::dispatch)
            .filter(Boolean::booleanValue)
            .count()
            .map(Long::intValue);
    }

    /** @return {@code true} when delivered, {@code false} when the send failed */
    public Mono<Boolean> dispatch(Opportunity opportunity) {
        return Mono.defer(() -> sink.send(opportunity))
            .timeout(sendTimeout)
            .thenReturn(Boolean.TRUE)
            .doOnNext(ok -> {
                stats.recordAlertSent();
                log.info("ALERT_SENT poolId={} kind={} risk={} block={}",
                         opportunity.poolId(), opportunity.kind(),
                         opportunity.riskScore(), opportunity.blockReference());
            })
            .onErrorResume(e -> {
                DispatchException failure = e instanceof DispatchException de ? de
                    : new DispatchException("AlertDispatchService",
                                            "Alert send failed for poolId=" + opportunity.poolId(), e);
                stats.recordAlertFailure();
                log.warn("ALERT_FAILED poolId={} kind={} reason={}",
                         opportunity.poolId(), opportunity.kind(), failure.getMessage());
                return Mono.just(Boolean.FALSE);
            });
    }
}
