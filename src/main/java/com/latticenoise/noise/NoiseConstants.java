package com.latticenoise.noise;

import java.util.Arrays;

/** Global noise field limits and defaults. */
public final class NoiseConstants {

    /** Highest supported dimension; 2^10 = 1024 corners per cell. */
    public static final int MAX_DIMENSION = 10;
    public static final int DEFAULT_DIMENSION = 3;
    public static final int DEFAULT_CELLS_PER_AXIS = 64;

    private NoiseConstants() {}

    /** Default grid: DEFAULT_CELLS_PER_AXIS cells on each of DEFAULT_DIMENSION axes. */
    public static int[] defaultGridSize() {
        int[] size = new int[DEFAULT_DIMENSION];
        Arrays.fill(size, DEFAULT_CELLS_PER_AXIS);
        return size;
    }
}
