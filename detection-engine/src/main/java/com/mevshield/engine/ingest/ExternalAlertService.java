package com.mevshield.engine.ingest;

import com.mevshield.common.model.ExternalAlert;
import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.common.model.OpportunitySource;
import com.mevshield.engine.alert.AlertDispatchService;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.detector.ValueBounds;
import com.mevshield.engine.enhance.ScoreEnhancementService;
import com.mevshield.engine.ledger.OpportunityLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Accepts opportunities reported by peers and routes them through the same
 * enhancement, ledger and alert path as detector output.
 *
 * <p>Reported values are trusted only within bounds: the estimated value is clamped to
 * the kind's cap and the risk score to {@code [0, 1]}. Confidence is fixed at
 * {@link Opportunity#EXTERNAL_CONFIDENCE}. Ingestion does not touch the cycle counters.
 */
@Service
public class ExternalAlertService {

    private static final Logger log = LoggerFactory.getLogger(ExternalAlertService.class);

    private final ScoreEnhancementService enhancementService;
    private final OpportunityLedger ledger;
    private final AlertDispatchService alertDispatch;
    private final Clock clock;
    private final boolean enhance;
    private final Map<OpportunityKind, Double> valueCaps;

    public ExternalAlertService(ScoreEnhancementService enhancementService,
                                OpportunityLedger ledger,
                                AlertDispatchService alertDispatch,
                                Clock clock,
                                MevShieldProperties properties) {
        this.enhancementService = enhancementService;
        this.ledger             = ledger;
        this.alertDispatch      = alertDispatch;
        this.clock              = clock;
        this.enhance            = properties.getIngest().isEnhance();
        MevShieldProperties.Detection detection = properties.getDetection();
        this.valueCaps = Map.of(
            OpportunityKind.ARBITRAGE,   detection.getArbitrage().getValueCap(),
            OpportunityKind.SANDWICH,    detection.getSandwich().getValueCap(),
            OpportunityKind.LIQUIDATION, detection.getLiquidation().getValueCap()
        );
    }

    /**
     * Validates, seals and forwards an external alert.
     *
     * @return the opportunity as stored in the ledger
     * @throws IllegalArgumentException (as an error signal) when the alert is malformed
     */
    public Mono<Opportunity> ingestExternal(ExternalAlert alert) {
        return Mono.fromCallable(() -> seal(toOpportunity(alert)))
            .flatMap(sealed -> alertDispatch.qualifies(sealed)
                ? alertDispatch.dispatch(sealed).thenReturn(sealed)
                : Mono.just(sealed));
    }

    Opportunity toOpportunity(ExternalAlert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("Alert body is required");
        }
        if (alert.poolId() == null || alert.poolId().isBlank()) {
            throw new IllegalArgumentException("poolId is required");
        }
        OpportunityKind kind = OpportunityKind.fromWire(alert.kind());
        if (alert.estimatedValue() == null) {
            throw new IllegalArgumentException("estimatedValue is required");
        }
        if (alert.riskScore() == null) {
            throw new IllegalArgumentException("riskScore is required");
        }
        if (alert.blockReference() == null) {
            throw new IllegalArgumentException("blockReference is required");
        }
        if (!(alert.estimatedValue() >= 0)) {
            throw new IllegalArgumentException("estimatedValue must be >= 0, got " + alert.estimatedValue());
        }
        if (Double.isNaN(alert.riskScore())) {
            throw new IllegalArgumentException("riskScore must be a number");
        }
        if (alert.blockReference() < 0) {
            throw new IllegalArgumentException("blockReference must be >= 0, got " + alert.blockReference());
        }
        return new Opportunity(
            alert.poolId().trim(),
            kind,
            ValueBounds.cap(alert.estimatedValue(), valueCaps.get(kind)),
            ValueBounds.unit(alert.riskScore()),
            Opportunity.EXTERNAL_CONFIDENCE,
            clock.instant(),
            alert.blockReference(),
            alert.transactionRef(),
            OpportunitySource.EXTERNAL,
            false
        );
    }

    private Opportunity seal(Opportunity opportunity) {
        Opportunity sealed = enhance ? enhancementService.enhance(opportunity) : opportunity;
        ledger.append(sealed);
        log.info("EXTERNAL_ALERT_INGESTED poolId={} kind={} value={} risk={} block={} tx={}",
                 sealed.poolId(), sealed.kind(), sealed.estimatedValue(), sealed.riskScore(),
                 sealed.blockReference(), sealed.transactionRef());
        return sealed;
    }
}
