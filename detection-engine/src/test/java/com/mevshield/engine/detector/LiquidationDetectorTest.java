package com.mevshield.engine.detector;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.support.Snapshots;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.mevshield.engine.support.Snapshots.T0;
import static org.junit.jupiter.api.Assertions.*;

class LiquidationDetectorTest {

    private final LiquidationDetector detector = new LiquidationDetector(new MevShieldProperties());

    private Optional<Opportunity> detect(double volatility) {
        return detector.detect(Snapshots.pool("pool-l", Snapshots.volatileMarket(volatility)), 3L, T0);
    }

    @Test
    @DisplayName("volatility 0.6 does not fire")
    void atThreshold() {
        assertTrue(detect(0.6).isEmpty());
    }

    @Test
    @DisplayName("volatility 0.61 → value 1.22, risk 0.61, confidence 0.65")
    void fires() {
        Opportunity o = detect(0.61).orElseThrow();

        assertEquals(OpportunityKind.LIQUIDATION, o.kind());
        assertEquals(1.22, o.estimatedValue(), 1e-9);
        assertEquals(0.61, o.riskScore(), 1e-9);
        assertEquals(0.65, o.confidence());
    }

    @Test
    @DisplayName("volatility above 1 is capped")
    void capped() {
        Opportunity o = detect(5.0).orElseThrow();
        assertEquals(3.0, o.estimatedValue());
        assertEquals(1.0, o.riskScore());
    }

    @Test
    @DisplayName("volatility 0 never fires")
    void calm() {
        assertTrue(detect(0.0).isEmpty());
    }
}
