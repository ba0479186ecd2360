package com.latticenoise.noise;

/**
 * Base abstract class for noise generators.
 * Defines the contract for sampling an n-dimensional field; all
 * implementations return values in roughly [-1, 1].
 */
public abstract class Noise {

    /** Number of coordinates every sample takes. */
    public abstract int dimension();

    /**
     * Sample the field.
     *
     * @throws com.latticenoise.DimensionMismatchException if coordinates.length != dimension()
     */
    public abstract double noise(double... coordinates);

    /** Sample 1D noise. */
    public double eval1D(double x) {
        return noise(x);
    }

    /** Sample 2D noise. */
    public double eval2D(double x, double y) {
        return noise(x, y);
    }

    /** Sample 3D noise. */
    public double eval3D(double x, double y, double z) {
        return noise(x, y, z);
    }
}
