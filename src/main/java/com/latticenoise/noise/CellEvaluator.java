package com.latticenoise.noise;

import com.latticenoise.DimensionMismatchException;
import com.latticenoise.lattice.Gradient;
import com.latticenoise.lattice.GradientLattice;
import com.latticenoise.math.Curve;

/**
 * Computes the 2^n corner scalars of the lattice cell enclosing a point.
 *
 * Corner index i offsets axis d by {@code (i >> d) & 1}, so corner 0 is the
 * cell origin and corner 2^n - 1 is the opposite vertex. {@link Interpolator}
 * reduces the scalars in the same bit order.
 */
public final class CellEvaluator {

    private CellEvaluator() {}

    /**
     * Dot product of each corner's gradient with (point - corner).
     *
     * @throws DimensionMismatchException if point.length differs from the lattice dimension
     * @throws com.latticenoise.LatticeBoundsException if a corner has no gradient
     */
    public static double[] evaluate(GradientLattice lattice, double[] point) {
        int dimension = lattice.dimension();
        if (point.length != dimension) {
            throw new DimensionMismatchException(dimension, point.length);
        }

        int[] cell = findCell(point);
        int cornerCount = 1 << dimension;
        double[] scalars = new double[cornerCount];
        int[] corner = new int[dimension];
        double[] offset = new double[dimension];

        for (int i = 0; i < cornerCount; i++) {
            for (int d = 0; d < dimension; d++) {
                corner[d] = cell[d] + ((i >> d) & 1);
                offset[d] = point[d] - corner[d];
            }
            Gradient gradient = lattice.requireGradient(corner);
            scalars[i] = gradient.dot(offset);
        }
        return scalars;
    }

    /** Cell containing the point: floor of each coordinate. */
    public static int[] findCell(double[] point) {
        int[] cell = new int[point.length];
        for (int d = 0; d < point.length; d++) {
            cell[d] = Curve.floorToInt(point[d]);
        }
        return cell;
    }

    /** Lattice coordinates of corner {@code index} of the given cell. */
    public static int[] cornerOf(int[] cell, int index) {
        if (index < 0 || index >= 1 << cell.length) {
            throw new IndexOutOfBoundsException("Corner " + index + " outside [0, " + (1 << cell.length) + ")");
        }
        int[] corner = new int[cell.length];
        for (int d = 0; d < cell.length; d++) {
            corner[d] = cell[d] + ((index >> d) & 1);
        }
        return corner;
    }
}
