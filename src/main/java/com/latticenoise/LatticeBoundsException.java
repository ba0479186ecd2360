package com.latticenoise;

import java.util.Arrays;

/**
 * Thrown when a lattice coordinate has no stored gradient.
 * The noise path wraps coordinates before lookup, so seeing this there means
 * the caller handed the evaluator a point outside the lattice.
 */
public class LatticeBoundsException extends IndexOutOfBoundsException {

    private final int[] coordinates;

    public LatticeBoundsException(int[] coordinates) {
        super("No gradient at lattice coordinate " + Arrays.toString(coordinates)
            + ". Point may be outside grid bounds.");
        this.coordinates = coordinates.clone();
    }

    public int[] getCoordinates() {
        return coordinates.clone();
    }
}
