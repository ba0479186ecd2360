package com.latticenoise;

/** Thrown when a query point's arity differs from the dimension of the noise it is sampled from. */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Expected " + expected + " coordinate(s), got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() { return expected; }
    public int actual() { return actual; }
}
