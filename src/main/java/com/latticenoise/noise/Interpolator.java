package com.latticenoise.noise;

import com.latticenoise.ConfigurationException;
import com.latticenoise.math.Curve;

/**
 * Blends the 2^n corner scalars of a cell into a single noise value.
 *
 * Each axis is blended with the smoothstep curve, whose zero derivative at 0
 * and 1 makes the field's gradient at every lattice node equal the stored
 * gradient. Output is always within [min, max] of the corner scalars.
 */
public final class Interpolator {

    private Interpolator() {}

    /** Classic smoothstep, t clamped to [0, 1]. */
    public static double smoothstep(double t) {
        return Curve.smoothstep(t);
    }

    /** Position of the point inside its cell, each component in [0, 1). */
    public static double[] fractional(double[] point) {
        double[] f = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            f[i] = Curve.fract(point[i]);
        }
        return f;
    }

    /** a0 + smoothstep(t) * (a1 - a0): a0 at node 0, a1 at node 1. */
    public static double interpolate1D(double a0, double a1, double t) {
        return Curve.lerp(a0, a1, smoothstep(t));
    }

    /**
     * Reduce corner scalars (ordered as {@link CellEvaluator} produces them) to one value.
     *
     * Axis 0 is blended first: corners 2k and 2k+1 differ only in axis 0's bit,
     * so pairing them halves the buffer into the cell of the remaining axes.
     * Repeating for each axis leaves the result in slot 0.
     *
     * @throws ConfigurationException if scalars.length != 2^point.length
     */
    public static double interpolate(double[] scalars, double[] point) {
        int dimension = point.length;
        if (dimension > NoiseConstants.MAX_DIMENSION) {
            throw new ConfigurationException("Point dimension " + dimension
                + " exceeds maximum of " + NoiseConstants.MAX_DIMENSION);
        }
        int expected = 1 << dimension;
        if (scalars.length != expected) {
            throw new ConfigurationException("The number of scalar values (" + scalars.length
                + ") must be equal to 2^" + dimension + " = " + expected);
        }

        double[] buf = scalars.clone();
        int len = expected;
        for (int d = 0; d < dimension; d++) {
            double s = smoothstep(Curve.fract(point[d]));
            len >>= 1;
            for (int k = 0; k < len; k++) {
                buf[k] = Curve.lerp(buf[2 * k], buf[2 * k + 1], s);
            }
        }
        return buf[0];
    }

    /** Linear rescale of a noise value. */
    public static double scaleNoiseValue(double value, double factor) {
        return value * factor;
    }

    public static double scaleNoiseValue(double value) {
        return scaleNoiseValue(value, 1.0);
    }
}
