package com.mevshield.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Exploit pattern an {@link Opportunity} was classified as.
 * Declaration order is the tie-break order used when sorting detections of one pool.
 */
public enum OpportunityKind {
    ARBITRAGE,
    SANDWICH,
    LIQUIDATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for inbound alerts ("arbitrage", "ARBITRAGE", " Sandwich ").
     *
     * @throws IllegalArgumentException for null or unrecognised values
     */
    @JsonCreator
    public static OpportunityKind fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Opportunity kind is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown opportunity kind '" + value + "'", e);
        }
    }
}
