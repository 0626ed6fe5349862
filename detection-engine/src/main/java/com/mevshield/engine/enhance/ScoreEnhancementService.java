package com.mevshield.engine.enhance;

import com.mevshield.common.exception.EnhancementException;
import com.mevshield.common.model.Opportunity;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.ledger.OpportunityLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies the configured {@link ScoreEnhancer} to candidates, feeding it the
 * same-pool ledger history inside the correlation window.
 *
 * <p>Enhancement never drops a candidate: when the enhancer (or the history lookup)
 * fails, or returns a record differing in anything but {@code riskScore} and
 * {@code confidence}, the failure is logged as an {@link EnhancementException} and
 * the unmodified candidate is returned.
 */
@Service
public class ScoreEnhancementService {

    private static final Logger log = LoggerFactory.getLogger(ScoreEnhancementService.class);

    private final ScoreEnhancer enhancer;
    private final OpportunityLedger ledger;
    private final Duration window;

    public ScoreEnhancementService(ScoreEnhancer enhancer, OpportunityLedger ledger,
                                   MevShieldProperties properties) {
        this.enhancer = enhancer;
        this.ledger   = ledger;
        this.window   = properties.getCorrelation().getWindow();
    }

    /**
     * Enhances a whole cycle's candidates against the ledger as it stood before the
     * cycle; none of the candidates is visible to another's history.
     */
    public List<Opportunity> enhanceAll(List<Opportunity> candidates) {
        List<Opportunity> enhanced = new ArrayList<>(candidates.size());
        for (Opportunity candidate : candidates) {
            enhanced.add(enhance(candidate));
        }
        return enhanced;
    }

    public Opportunity enhance(Opportunity candidate) {
        try {
            List<Opportunity> history = ledger.recentForPool(candidate.poolId(), candidate.detectedAt(), window);
            Opportunity result = enhancer.enhance(candidate, history);
            if (result == null) {
                throw new EnhancementException("ScoreEnhancementService", "Enhancer returned null");
            }
            if (!sameIdentity(candidate, result)) {
                throw new EnhancementException("ScoreEnhancementService",
                    "Enhancer may only adjust riskScore and confidence");
            }
            if (result.riskScore() != candidate.riskScore() || result.confidence() != candidate.confidence()) {
                log.info("OPPORTUNITY_ENHANCED poolId={} kind={} history={} risk={}->{} confidence={}->{}",
                         candidate.poolId(), candidate.kind(), history.size(),
                         candidate.riskScore(), result.riskScore(),
                         candidate.confidence(), result.confidence());
            }
            return result;
        } catch (RuntimeException e) {
            EnhancementException failure = e instanceof EnhancementException ee ? ee
                : new EnhancementException("ScoreEnhancementService",
                                           "Enhancement failed for poolId=" + candidate.poolId(), e);
            log.warn("ENHANCEMENT_FAILED poolId={} kind={} passing through unmodified. reason={}",
                     candidate.poolId(), candidate.kind(), failure.getMessage(), failure);
            return candidate;
        }
    }

    private static boolean sameIdentity(Opportunity a, Opportunity b) {
        return a.poolId().equals(b.poolId())
            && a.kind() == b.kind()
            && Double.compare(a.estimatedValue(), b.estimatedValue()) == 0
            && a.detectedAt().equals(b.detectedAt())
            && a.blockReference() == b.blockReference()
            && Objects.equals(a.transactionRef(), b.transactionRef())
            && a.source() == b.source()
            && a.staleData() == b.staleData();
    }
}
