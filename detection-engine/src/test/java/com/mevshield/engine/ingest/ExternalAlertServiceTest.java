package com.mevshield.engine.ingest;

import com.mevshield.common.model.ExternalAlert;
import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.common.model.OpportunitySource;
import com.mevshield.engine.config.MevShieldProperties;
import com.mevshield.engine.support.EngineFixture;
import com.mevshield.engine.support.Snapshots;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExternalAlertServiceTest {

    private final EngineFixture f = new EngineFixture(EngineFixture.properties("pool-a"));

    private static ExternalAlert alert(String poolId, String kind, double value, double risk) {
        return new ExternalAlert(poolId, kind, value, risk, 19_000_001L, "0xfeed");
    }

    @Nested
    @DisplayName("accepted alerts")
    class Accepted {

        @Test
        @DisplayName("stored with confidence 0.8, source EXTERNAL, detectedAt = now")
        void sealed() {
            Opportunity o = f.externalAlertService.ingestExternal(alert("pool-x", "sandwich", 1.5, 0.4)).block();

            assertEquals(OpportunityKind.SANDWICH, o.kind());
            assertEquals(0.8, o.confidence());
            assertEquals(OpportunitySource.EXTERNAL, o.source());
            assertEquals(Snapshots.T0, o.detectedAt());
            assertEquals(19_000_001L, o.blockReference());
            assertEquals("0xfeed", o.transactionRef());
            assertEquals(1, f.ledger.size());
            assertEquals(o, f.ledger.latest("pool-x", 1).get(0));
        }

        @Test
        @DisplayName("reported value and risk are clamped to the kind's bounds")
        void clamped() {
            Opportunity o = f.externalAlertService.ingestExternal(alert("pool-x", "LIQUIDATION", 1_000, 4.0)).block();

            assertEquals(3.0, o.estimatedValue());
            assertEquals(1.0, o.riskScore());
        }

        @Test
        @DisplayName("risky alert is forwarded to the sink")
        void forwarded() {
            f.externalAlertService.ingestExternal(alert("pool-x", "arbitrage", 1, 0.75)).block();

            assertEquals(1, f.sink.delivered().size());
            assertEquals(1, f.stats.getStats().alertsSentTotal());
        }

        @Test
        @DisplayName("does not count as a detector opportunity")
        void notCounted() {
            f.externalAlertService.ingestExternal(alert("pool-x", "arbitrage", 1, 0.2)).block();

            assertEquals(0, f.stats.getStats().opportunitiesDetectedTotal());
            assertEquals(1, f.stats.getStats().activeOpportunityCount());
        }

        @Test
        @DisplayName("external alerts count toward later correlation")
        void feedsCorrelation() {
            for (int i = 0; i < 3; i++) {
                f.externalAlertService.ingestExternal(alert("pool-x", "sandwich", 1, 0.3)).block();
                f.clock.advance(Duration.ofSeconds(1));
            }
            Opportunity fourth = f.externalAlertService.ingestExternal(alert("pool-x", "sandwich", 1, 0.3)).block();

            assertEquals(0.5, fourth.riskScore(), 1e-9);
        }

        @Test
        @DisplayName("enhancement can be switched off")
        void enhancementDisabled() {
            MevShieldProperties properties = EngineFixture.properties("pool-a");
            properties.getIngest().setEnhance(false);
            EngineFixture plain = new EngineFixture(properties);
            for (int i = 0; i < 4; i++) {
                plain.externalAlertService.ingestExternal(alert("pool-x", "sandwich", 1, 0.3)).block();
            }

            assertEquals(0.3, plain.ledger.latest("pool-x", 1).get(0).riskScore());
        }
    }

    @Nested
    @DisplayName("rejected alerts")
    class Rejected {

        @Test
        @DisplayName("unknown kind → IllegalArgumentException, ledger untouched")
        void unknownKind() {
            StepVerifier.create(f.externalAlertService.ingestExternal(alert("pool-x", "frontrun", 1, 0.5)))
                .expectError(IllegalArgumentException.class)
                .verify();
            assertEquals(0, f.ledger.size());
        }

        @Test
        @DisplayName("blank pool, negative value, NaN risk and negative block are rejected")
        void invalidFields() {
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(alert(" ", "sandwich", 1, 0.5)));
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(alert("p", "sandwich", -1, 0.5)));
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(alert("p", "sandwich", 1, Double.NaN)));
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(new ExternalAlert("p", "sandwich", 1.0, 0.5, -1L, null)));
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(null));
        }

        @Test
        @DisplayName("missing value, risk or block → IllegalArgumentException, never defaulted to 0")
        void missingNumbers() {
            IllegalArgumentException noRisk = assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(new ExternalAlert("p", "arbitrage", 1.0, null, 5L, null)));
            assertTrue(noRisk.getMessage().contains("riskScore"));
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(new ExternalAlert("p", "arbitrage", null, 0.5, 5L, null)));
            assertThrows(IllegalArgumentException.class,
                () -> f.externalAlertService.toOpportunity(new ExternalAlert("p", "arbitrage", 1.0, 0.5, null, null)));
        }
    }
}
