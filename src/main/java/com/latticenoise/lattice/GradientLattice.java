package com.latticenoise.lattice;

import com.latticenoise.LatticeBoundsException;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;

import java.util.function.BiConsumer;

/**
 * Immutable mapping from lattice coordinate tuple to {@link Gradient}.
 * Built once by {@link LatticeBuilder}; read-only afterwards, so concurrent
 * lookups need no locking.
 */
public final class GradientLattice {

    private final GridShape shape;
    // Primitive-keyed by GridShape.key (no boxing on lookup)
    private final Int2ObjectMap<Gradient> gradients;

    GradientLattice(GridShape shape, Int2ObjectMap<Gradient> gradients) {
        this.shape = shape;
        this.gradients = Int2ObjectMaps.unmodifiable(gradients);
    }

    public GridShape shape() { return shape; }

    public int dimension() { return shape.dimension(); }

    /** Number of stored gradients. */
    public int size() { return gradients.size(); }

    /**
     * Gradient at the given coordinates, or null if the lattice has none there.
     * Non-throwing probe; see {@link #requireGradient(int...)} for the strict form.
     */
    public Gradient getGradient(int... coordinates) {
        int key = shape.key(coordinates);
        if (key < 0) return null;
        return gradients.get(key);
    }

    public boolean contains(int... coordinates) {
        return getGradient(coordinates) != null;
    }

    /**
     * Gradient at the given coordinates.
     *
     * @throws LatticeBoundsException if no gradient is stored there
     */
    public Gradient requireGradient(int... coordinates) {
        Gradient g = getGradient(coordinates);
        if (g == null) throw new LatticeBoundsException(coordinates);
        return g;
    }

    /** Visit every entry. Order is unspecified; the coordinate array is a fresh copy per entry. */
    public void forEach(BiConsumer<int[], Gradient> action) {
        for (Int2ObjectMap.Entry<Gradient> e : gradients.int2ObjectEntrySet()) {
            action.accept(shape.coordinatesOf(e.getIntKey()), e.getValue());
        }
    }

    @Override
    public String toString() {
        return "GradientLattice{" + shape + ", size=" + size() + "}";
    }
}
