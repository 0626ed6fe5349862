package com.mevshield.engine.enhance;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.ledger.OpportunityLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.mevshield.engine.support.Snapshots.T0;
import static com.mevshield.engine.support.Snapshots.opportunity;
import static org.junit.jupiter.api.Assertions.*;

class ScoreEnhancementServiceTest {

    private final MevShieldProperties properties = new MevShieldProperties();
    private final OpportunityLedger ledger = new OpportunityLedger(properties);

    @Test
    @DisplayName("history passed to the enhancer is limited to the correlation window")
    void windowedHistory() {
        List<Integer> seen = new ArrayList<>();
        ScoreEnhancementService service = new ScoreEnhancementService(
            (candidate, history) -> { seen.add(history.size()); return candidate; }, ledger, properties);

        ledger.append(opportunity("p", OpportunityKind.SANDWICH, 1, 0.4, 0.75, T0.minus(Duration.ofMinutes(6))));
        ledger.append(opportunity("p", OpportunityKind.SANDWICH, 1, 0.4, 0.75, T0.minus(Duration.ofMinutes(5))));
        ledger.append(opportunity("p", OpportunityKind.SANDWICH, 1, 0.4, 0.75, T0.minusSeconds(1)));
        ledger.append(opportunity("q", OpportunityKind.SANDWICH, 1, 0.4, 0.75, T0.minusSeconds(1)));

        service.enhance(opportunity("p", OpportunityKind.LIQUIDATION, 1.3, 0.65, 0.65, T0));

        assertEquals(List.of(2), seen);
    }

    @Test
    @DisplayName("a failing enhancer passes the candidate through unmodified")
    void failurePassesThrough() {
        ScoreEnhancementService service = new ScoreEnhancementService(
            (candidate, history) -> { throw new IllegalStateException("backend down"); }, ledger, properties);
        Opportunity candidate = opportunity("p", OpportunityKind.ARBITRAGE, 5.0, 0.3, 0.85, T0);

        assertSame(candidate, service.enhance(candidate));
    }

    @Test
    @DisplayName("a null result is treated as a failure")
    void nullResult() {
        ScoreEnhancementService service = new ScoreEnhancementService(
            (candidate, history) -> null, ledger, properties);
        Opportunity candidate = opportunity("p", OpportunityKind.ARBITRAGE, 5.0, 0.3, 0.85, T0);

        assertSame(candidate, service.enhance(candidate));
    }

    @Test
    @DisplayName("an enhancer rewriting pool, kind, value or block is rejected")
    void identityChangesRejected() {
        Opportunity candidate = opportunity("p", OpportunityKind.ARBITRAGE, 5.0, 0.3, 0.85, T0);
        List<ScoreEnhancer> rewriters = List.of(
            (c, history) -> new Opportunity("other", c.kind(), c.estimatedValue(), 0.9, c.confidence(),
                c.detectedAt(), c.blockReference(), c.transactionRef(), c.source(), c.staleData()),
            (c, history) -> new Opportunity(c.poolId(), OpportunityKind.SANDWICH, c.estimatedValue(), 0.9,
                c.confidence(), c.detectedAt(), c.blockReference(), c.transactionRef(), c.source(), c.staleData()),
            (c, history) -> new Opportunity(c.poolId(), c.kind(), 9.0, 0.9, c.confidence(),
                c.detectedAt(), c.blockReference(), c.transactionRef(), c.source(), c.staleData()),
            (c, history) -> new Opportunity(c.poolId(), c.kind(), c.estimatedValue(), 0.9, c.confidence(),
                c.detectedAt(), c.blockReference() + 1, c.transactionRef(), c.source(), c.staleData()));

        for (ScoreEnhancer rewriter : rewriters) {
            ScoreEnhancementService service = new ScoreEnhancementService(rewriter, ledger, properties);
            assertSame(candidate, service.enhance(candidate));
        }
    }

    @Test
    @DisplayName("adjusting only risk and confidence is accepted")
    void scoreChangesAccepted() {
        ScoreEnhancementService service = new ScoreEnhancementService(
            (c, history) -> c.withRiskScore(0.9).withConfidence(0.95), ledger, properties);

        Opportunity result = service.enhance(opportunity("p", OpportunityKind.ARBITRAGE, 5.0, 0.3, 0.85, T0));

        assertEquals(0.9, result.riskScore());
        assertEquals(0.95, result.confidence());
    }

    @Test
    @DisplayName("enhanceAll falls back per candidate and keeps order")
    void perCandidateFallback() {
        ScoreEnhancementService service = new ScoreEnhancementService((candidate, history) -> {
            if (candidate.poolId().equals("bad")) {
                throw new IllegalStateException("bad");
            }
            return candidate.withRiskScore(0.99);
        }, ledger, properties);

        List<Opportunity> result = service.enhanceAll(List.of(
            opportunity("bad", OpportunityKind.ARBITRAGE, 1, 0.1, 0.85, T0),
            opportunity("good", OpportunityKind.ARBITRAGE, 1, 0.1, 0.85, T0)));

        assertEquals(0.1, result.get(0).riskScore());
        assertEquals(0.99, result.get(1).riskScore());
    }
}
