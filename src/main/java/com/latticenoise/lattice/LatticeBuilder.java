package com.latticenoise.lattice;

import com.latticenoise.ConfigurationException;
import com.latticenoise.math.RNG;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.logging.Logger;

/**
 * Builds a gradient lattice from a dimension, per-axis cell counts and a seed.
 *
 * Intersections are visited in lexicographic order (axis 0 outermost, last
 * axis fastest) and each consumes its draws from one seeded stream, so the
 * same (dimension, shape, seed) always yields the same lattice.
 */
public final class LatticeBuilder {

    private static final Logger LOG = Logger.getLogger(LatticeBuilder.class.getName());

    private LatticeBuilder() {}

    /**
     * Build a lattice.
     *
     * @param dimension number of axes, at least 1
     * @param gridShape cell count per axis; must have exactly {@code dimension} entries
     * @param seed      seed of the gradient stream
     * @throws ConfigurationException on an invalid dimension or a mismatched shape
     */
    public static GradientLattice build(int dimension, int[] gridShape, long seed) {
        if (dimension < 1) {
            throw new ConfigurationException("Dimension must be a positive integer, got " + dimension);
        }
        if (gridShape == null) {
            throw new ConfigurationException("Grid shape must not be null");
        }
        if (gridShape.length != dimension) {
            throw new ConfigurationException("Size array length (" + gridShape.length
                + ") must match dimension (" + dimension + ")");
        }

        GridShape shape = GridShape.of(gridShape);
        RNG rng = new RNG(seed);
        int count = shape.pointCount();
        Int2ObjectOpenHashMap<Gradient> gradients = new Int2ObjectOpenHashMap<>(count);

        // Keys in increasing order == lexicographic coordinate order
        for (int key = 0; key < count; key++) {
            gradients.put(key, nextGradient(dimension, rng));
        }

        if (gradients.size() != count) {
            throw new IllegalStateException("Lattice holds " + gradients.size()
                + " gradients, expected " + count);
        }

        LOG.fine("[LatticeBuilder] Built " + count + " gradients for " + shape + " (seed=" + seed + ")");
        return new GradientLattice(shape, gradients);
    }

    /** Build with the dimension taken from the shape's length. */
    public static GradientLattice build(int[] gridShape, long seed) {
        if (gridShape == null) {
            throw new ConfigurationException("Grid shape must not be null");
        }
        return build(gridShape.length, gridShape, seed);
    }

    /** Build with a non-deterministic seed. */
    public static GradientLattice build(int[] gridShape) {
        return build(gridShape, RNG.randomSeed());
    }

    private static Gradient nextGradient(int dimension, RNG rng) {
        if (dimension == 1) {
            return Gradient.scalar(rng.nextRange(-1, 1));
        }
        double[] raw = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            raw[i] = rng.nextRange(-1, 1);
        }
        return Gradient.normalized(raw);
    }
}
