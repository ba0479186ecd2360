package com.latticenoise.lattice;

import com.latticenoise.DimensionMismatchException;

import java.util.Arrays;

/**
 * Immutable gradient stored at a lattice intersection.
 * One-dimensional lattices hold a scalar in [-1, 1], kept here as a length-1
 * vector so the dot product needs no special case. Higher dimensions hold a
 * unit vector, or the zero vector when every raw component drew exactly zero.
 */
public final class Gradient {

    private final double[] components;

    private Gradient(double[] components) {
        this.components = components;
    }

    /** A 1-D gradient. */
    public static Gradient scalar(double value) {
        return new Gradient(new double[]{value});
    }

    /** A gradient with the given components, copied as-is. */
    public static Gradient of(double... components) {
        if (components.length == 0) {
            throw new IllegalArgumentException("Gradient needs at least one component");
        }
        return new Gradient(components.clone());
    }

    /** Scale raw to unit length; a zero-length input stays the zero vector. */
    public static Gradient normalized(double[] raw) {
        double sumSq = 0;
        for (double v : raw) sumSq += v * v;
        double magnitude = Math.sqrt(sumSq);

        double[] unit = new double[raw.length];
        if (magnitude != 0) {
            for (int i = 0; i < raw.length; i++) unit[i] = raw[i] / magnitude;
        }
        return new Gradient(unit);
    }

    public int dimension() { return components.length; }

    public double component(int axis) { return components[axis]; }

    /** The scalar value of a 1-D gradient. */
    public double scalar() {
        if (components.length != 1) {
            throw new IllegalStateException("Gradient of dimension " + components.length + " is not a scalar");
        }
        return components[0];
    }

    public double magnitude() {
        double sumSq = 0;
        for (double v : components) sumSq += v * v;
        return Math.sqrt(sumSq);
    }

    /** Dot product with an offset vector of the same dimension. */
    public double dot(double[] offset) {
        if (offset.length != components.length) {
            throw new DimensionMismatchException(components.length, offset.length);
        }
        double sum = 0;
        for (int i = 0; i < components.length; i++) sum += components[i] * offset[i];
        return sum;
    }

    public double[] toArray() { return components.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Gradient)) return false;
        return Arrays.equals(components, ((Gradient) o).components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return components.length == 1
            ? "Gradient(" + components[0] + ")"
            : "Gradient" + Arrays.toString(components);
    }
}
