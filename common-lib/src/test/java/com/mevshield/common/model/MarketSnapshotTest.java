package com.mevshield.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarketSnapshotTest {

    @Test
    @DisplayName("negative price, volume, liquidity, impact or volatility → IllegalArgumentException")
    void negativeFigures() {
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(-2000.0, 1.0, 1_200_000, 6_000_000, 0.05, 0.1));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, -1.0, 1_200_000, 6_000_000, 0.05, 0.1));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, 1.0, -1, 6_000_000, 0.05, 0.1));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, 1.0, 1_200_000, -1, 0.05, 0.1));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, 1.0, 1_200_000, 6_000_000, -0.05, 0.1));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, 1.0, 1_200_000, 6_000_000, 0.05, -0.1));
    }

    @Test
    @DisplayName("NaN or infinite figures → IllegalArgumentException")
    void nonFinite() {
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(Double.NaN, 1.0, 1, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, 1.0, Double.POSITIVE_INFINITY, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshot.of(2000.0, 1.0, 1, 1, 0, Double.NaN));
    }

    @Test
    @DisplayName("zero figures are accepted, including token1Price = 0")
    void zeroAccepted() {
        MarketSnapshot s = MarketSnapshot.of(2000.0, 0.0, 0, 0, 0, 0);
        assertEquals(0.0, s.token1Price());
    }

    @Test
    @DisplayName("invalid row fails JSON decoding")
    void decodingRejectsInvalidRow() {
        String json = "{\"token0Price\":-2000,\"token1Price\":1,\"volume24h\":1,\"liquidity\":1,"
                    + "\"priceImpact\":0,\"volatility\":0}";
        assertThrows(ValueInstantiationException.class,
            () -> new ObjectMapper().readValue(json, MarketSnapshot.class));
    }
}
