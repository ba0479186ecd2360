package com.latticenoise.lattice;

import com.latticenoise.ConfigurationException;

import java.util.Arrays;

/**
 * Per-axis cell counts of a gradient lattice. Axis i spans lattice
 * coordinates 0..cells[i] inclusive, i.e. cells[i] + 1 intersections.
 *
 * Coordinate tuples are packed into a single int key (mixed radix, axis 0
 * most significant) so the lattice can live in a primitive-keyed map.
 * Increasing key order is lexicographic order with the last axis fastest.
 */
public final class GridShape {

    private final int[] cells;
    private final int[] points;
    private final int pointCount;

    private GridShape(int[] cells, int pointCount) {
        this.cells = cells;
        this.points = new int[cells.length];
        for (int i = 0; i < cells.length; i++) points[i] = cells[i] + 1;
        this.pointCount = pointCount;
    }

    /**
     * Validate and wrap per-axis cell counts.
     *
     * @throws ConfigurationException if cells is null or empty, holds a negative count,
     *                                or describes more intersections than fit an int
     */
    public static GridShape of(int... cells) {
        if (cells == null || cells.length == 0) {
            throw new ConfigurationException("Grid shape needs at least one axis");
        }
        long total = 1;
        for (int axis = 0; axis < cells.length; axis++) {
            if (cells[axis] < 0) {
                throw new ConfigurationException("Cell count on axis " + axis
                    + " must not be negative, got " + cells[axis]);
            }
            total *= (long) cells[axis] + 1;
            if (total > Integer.MAX_VALUE) {
                throw new ConfigurationException("Grid shape " + Arrays.toString(cells)
                    + " has too many lattice points");
            }
        }
        return new GridShape(cells.clone(), (int) total);
    }

    public int dimension() { return cells.length; }

    public int cells(int axis) { return cells[axis]; }

    /** Number of lattice coordinates along an axis (cells + 1). */
    public int pointsOnAxis(int axis) { return points[axis]; }

    /** Total lattice intersections: product of (cells[i] + 1). */
    public int pointCount() { return pointCount; }

    public int[] toArray() { return cells.clone(); }

    /** Whether every component lies in [0, cells[i]]. */
    public boolean contains(int[] coordinates) {
        return key(coordinates) >= 0;
    }

    /**
     * Pack a coordinate tuple into its key.
     * Returns -1 if the arity is wrong or any component is out of range.
     */
    public int key(int[] coordinates) {
        if (coordinates.length != cells.length) return -1;
        int key = 0;
        for (int axis = 0; axis < cells.length; axis++) {
            int c = coordinates[axis];
            if (c < 0 || c > cells[axis]) return -1;
            key = key * points[axis] + c;
        }
        return key;
    }

    /** Unpack a key produced by {@link #key(int[])}. */
    public int[] coordinatesOf(int key) {
        if (key < 0 || key >= pointCount) {
            throw new IndexOutOfBoundsException("Key " + key + " outside [0, " + pointCount + ")");
        }
        int[] coords = new int[cells.length];
        for (int axis = cells.length - 1; axis >= 0; axis--) {
            coords[axis] = key % points[axis];
            key /= points[axis];
        }
        return coords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridShape)) return false;
        return Arrays.equals(cells, ((GridShape) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "GridShape" + Arrays.toString(cells);
    }
}
