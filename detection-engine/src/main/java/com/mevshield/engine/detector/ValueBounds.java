package com.mevshield.engine.detector;

/**
 * Total clamping helpers. Every input, including NaN and infinities, maps into range.
 */
public final class ValueBounds {

    private ValueBounds() {}

    /** Clamps {@code raw} into {@code [0, cap]}; NaN maps to 0, +Infinity to {@code cap}. */
    public static double cap(double raw, double cap) {
        if (Double.isNaN(raw) || raw <= 0) return 0.0;
        return Math.min(raw, cap);
    }

    /** Clamps into {@code [0, 1]}; NaN maps to 0. */
    public static double unit(double raw) {
        return cap(raw, 1.0);
    }
}
