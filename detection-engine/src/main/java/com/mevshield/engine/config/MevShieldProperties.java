package com.mevshield.engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable policy surface of the detection engine, bound from {@code mevshield.*}.
 *
 * <p>Field defaults are the production defaults; {@code application.yml} only
 * repeats the ones operators are expected to touch. Values are checked by
 * {@link PolicyValidator} as soon as binding completes, so an invalid policy
 * fails the context before any consumer (the scheduler included) is created.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "mevshield")
public class MevShieldProperties implements InitializingBean {

    private List<String> pools = new ArrayList<>();

    private Cycle cycle = new Cycle();
    private Alerts alerts = new Alerts();
    private Ledger ledger = new Ledger();
    private Snapshot snapshot = new Snapshot();
    private Detection detection = new Detection();
    private Correlation correlation = new Correlation();
    private Scheduler scheduler = new Scheduler();
    private Ingest ingest = new Ingest();

    @Override
    public void afterPropertiesSet() {
        PolicyValidator.validate(this);
    }

    @Getter
    @Setter
    public static class Cycle {
        private Duration interval = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Alerts {
        private double riskThreshold = 0.7;
        private Duration sendTimeout = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Ledger {
        private int capacity = 100;
    }

    @Getter
    @Setter
    public static class Snapshot {
        private Duration fetchTimeout = Duration.ofSeconds(2);
        /** Cached snapshots older than this are not used as fallback. Unset = no limit. */
        private Duration maxAge;
    }

    @Getter
    @Setter
    public static class Detection {
        private Arbitrage arbitrage = new Arbitrage();
        private Sandwich sandwich = new Sandwich();
        private Liquidation liquidation = new Liquidation();
    }

    @Getter
    @Setter
    public static class Arbitrage {
        private double referenceRatio = 2000.0;
        private double deviationThreshold = 0.01;
        private double valueFactor = 0.1;
        private double riskMultiplier = 10.0;
        private double valueCap = 10.0;
        private double confidence = 0.85;
    }

    @Getter
    @Setter
    public static class Sandwich {
        private double impactThreshold = 0.3;
        private double liquidityThreshold = 1_000_000;
        private double liquidityNorm = 10_000_000;
        private double volumeFactor = 0.001;
        private double valueCap = 5.0;
        private double confidence = 0.75;
    }

    @Getter
    @Setter
    public static class Liquidation {
        private double volatilityThreshold = 0.6;
        private double valueMultiplier = 2.0;
        private double valueCap = 3.0;
        private double confidence = 0.65;
    }

    @Getter
    @Setter
    public static class Correlation {
        private Duration window = Duration.ofMinutes(5);
        /** Risk is raised when the same pool has MORE than this many entries in the window. */
        private int triggerCount = 2;
        private double riskBoost = 0.2;
        private double arbitrageValueFloor = 2.0;
        private double arbitrageRiskCeiling = 0.5;
        private double confidenceBoost = 0.1;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Ingest {
        /** Run externally reported opportunities through the score enhancer before insertion. */
        private boolean enhance = true;
    }
}
