package com.latticenoise.noise;

import com.latticenoise.ConfigurationException;
import com.latticenoise.DimensionMismatchException;
import com.latticenoise.lattice.GradientLattice;
import com.latticenoise.lattice.LatticeBuilder;
import com.latticenoise.math.RNG;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Classic gradient noise over 1 to 10 dimensions.
 *
 * Owns one gradient lattice, built at construction and never changed.
 * Each query wraps its coordinates onto the grid, evaluates the enclosing
 * cell's corner scalars and blends them with smoothstep.
 * Thread-safe after construction (immutable lattice).
 */
public class NoiseField extends Noise {

    private static final Logger LOG = Logger.getLogger(NoiseField.class.getName());

    private final long seed;
    private final int[] gridSize;
    private final GradientLattice lattice;

    /** 64×64×64 grid, random seed. */
    public NoiseField() {
        this(NoiseConfig.defaultConfig());
    }

    /** Create noise with a specific seed and grid. */
    public NoiseField(long seed, int... gridSize) {
        this(new NoiseConfig().withSeed(seed).withGridSize(gridSize));
    }

    /**
     * @throws ConfigurationException if gridSize is null, has 0 or more than
     *                                {@value NoiseConstants#MAX_DIMENSION} entries, or any entry is below 1
     */
    public NoiseField(NoiseConfig config) {
        if (config == null) {
            throw new ConfigurationException("Noise config must not be null");
        }
        int[] size = config.gridSize != null ? config.gridSize.clone() : null;
        validateGridSize(size);

        this.seed = config.seed != null ? config.seed : RNG.randomSeed();
        this.gridSize = size;
        this.lattice = LatticeBuilder.build(size.length, size, seed);

        LOG.fine("[NoiseField] Ready: dimension=" + size.length
            + ", gridSize=" + Arrays.toString(size) + ", seed=" + seed);
    }

    private static void validateGridSize(int[] size) {
        if (size == null || size.length == 0 || size.length > NoiseConstants.MAX_DIMENSION) {
            throw new ConfigurationException("Grid size must have between 1 and "
                + NoiseConstants.MAX_DIMENSION + " entries, got "
                + (size == null ? "null" : Integer.toString(size.length)));
        }
        for (int i = 0; i < size.length; i++) {
            if (size[i] < 1) {
                throw new ConfigurationException("Grid size on axis " + i + " must be positive, got " + size[i]);
            }
        }
    }

    @Override
    public int dimension() { return gridSize.length; }

    public long seed() { return seed; }

    public int[] gridSize() { return gridSize.clone(); }

    public GradientLattice lattice() { return lattice; }

    /**
     * Sample the field. The value is not clamped and may stray slightly outside [-1, 1].
     *
     * @throws DimensionMismatchException if coordinates.length != dimension()
     */
    @Override
    public double noise(double... coordinates) {
        if (coordinates.length != gridSize.length) {
            throw new DimensionMismatchException(gridSize.length, coordinates.length);
        }
        double[] wrapped = wrap(coordinates);
        double[] scalars = CellEvaluator.evaluate(lattice, wrapped);
        return Interpolator.interpolate(scalars, wrapped);
    }

    /**
     * Fold each coordinate into [0, gridSize[i]).
     * The lattice stores gridSize[i] + 1 points per axis, so cell + 1 stays in range.
     */
    double[] wrap(double[] coordinates) {
        double[] wrapped = new double[coordinates.length];
        for (int i = 0; i < coordinates.length; i++) {
            double g = gridSize[i];
            wrapped[i] = ((coordinates[i] % g) + g) % g;
        }
        return wrapped;
    }

    @Override
    public String toString() {
        return "NoiseField{dimension=" + gridSize.length
            + ", gridSize=" + Arrays.toString(gridSize) + ", seed=" + seed + "}";
    }
}
