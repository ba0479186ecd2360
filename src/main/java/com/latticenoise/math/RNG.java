package com.latticenoise.math;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Seedable random number generator for deterministic lattice construction.
 * The same seed always yields the same sequence; nothing else feeds it.
 * Not thread-safe: create one per build.
 */
public class RNG {

    /** Default seeds are drawn from [0, DEFAULT_SEED_BOUND). */
    public static final long DEFAULT_SEED_BOUND = 1_000_000L;

    private final Random random;
    private final long seed;

    public RNG(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /** A fresh seed from a non-deterministic source, for callers that did not supply one. */
    public static long randomSeed() {
        return ThreadLocalRandom.current().nextLong(DEFAULT_SEED_BOUND);
    }

    public double nextDouble() { return random.nextDouble(); }

    /** Uniform draw in [min, max). */
    public double nextRange(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    public long getSeed() { return seed; }
}
