package com.mevshield.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Market metrics observed for one pool in one detection cycle.
 *
 * <p>Prices are USD; {@code priceImpact} and {@code volatility} are fractions.
 * Superseded by the next cycle's snapshot for the same pool.
 *
 * <p>Every figure must be finite and {@code >= 0}; violations throw
 * {@link IllegalArgumentException}. A zero price is accepted and read by the
 * detectors as "no signal".
 */
public record MarketSnapshot(
    @JsonProperty("token0Price") double token0Price,
    @JsonProperty("token1Price") double token1Price,
    @JsonProperty("volume24h") double volume24h,
    @JsonProperty("liquidity") double liquidity,
    @JsonProperty("priceImpact") double priceImpact,
    @JsonProperty("volatility") double volatility
) {
    public MarketSnapshot {
        requireNonNegative("token0Price", token0Price);
        requireNonNegative("token1Price", token1Price);
        requireNonNegative("volume24h", volume24h);
        requireNonNegative("liquidity", liquidity);
        requireNonNegative("priceImpact", priceImpact);
        requireNonNegative("volatility", volatility);
    }

    public static MarketSnapshot of(double token0Price, double token1Price, double volume24h,
                                    double liquidity, double priceImpact, double volatility) {
        return new MarketSnapshot(token0Price, token1Price, volume24h, liquidity, priceImpact, volatility);
    }

    private static void requireNonNegative(String field, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(field + " must be a finite value >= 0, got " + value);
        }
    }
}
