package com.latticenoise.math;

/**
 * Curve and easing helpers used by the interpolator: clamping,
 * linear interpolation, the cubic smoothstep and the fractional part.
 */
public final class Curve {

    private Curve() {}

    /** Linear interpolation between a and b by t. */
    public static double lerp(double a, double b, double t) {
        return a + t * (b - a);
    }

    /** Clamp value between min and max. */
    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Hermite smoothstep: 3t² - 2t³, with t clamped to [0, 1].
     * First derivative is zero at both ends, so blended noise has no crease at lattice nodes.
     */
    public static double smoothstep(double t) {
        t = clamp(t, 0, 1);
        return t * t * (3.0 - 2.0 * t);
    }

    /** Fractional part relative to floor: always in [0, 1) for finite input. */
    public static double fract(double x) {
        return x - Math.floor(x);
    }

    /** Floor as an int (lattice coordinates). */
    public static int floorToInt(double x) {
        return (int) Math.floor(x);
    }
}
