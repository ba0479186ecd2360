package com.latticenoise.noise;

/**
 * Grid presets. Each preset creates a NoiseConfig with a grid suited to a
 * common use; the seed is left unset.
 *
 * Presets:
 * - LINE:   1-D strip of 256 cells
 * - PLANE:  64×64 cells
 * - VOLUME: 64×64×64 cells (the default)
 * - HYPER:  16^4 cells, for animating a volume along a fourth axis
 */
public enum NoisePreset {

    LINE("Line", "One axis of 256 cells.", new int[]{256}),
    PLANE("Plane", "Two axes of 64 cells each.", new int[]{64, 64}),
    VOLUME("Volume", "Three axes of 64 cells each.", new int[]{64, 64, 64}),
    HYPER("Hyper-volume", "Four axes of 16 cells each.", new int[]{16, 16, 16, 16});

    private final String displayName;
    private final String description;
    private final int[] gridSize;

    NoisePreset(String displayName, String description, int[] gridSize) {
        this.displayName = displayName;
        this.description = description;
        this.gridSize = gridSize;
    }

    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }
    public int dimension() { return gridSize.length; }

    /** Create a NoiseConfig for this preset. */
    public NoiseConfig createConfig() {
        NoiseConfig c = new NoiseConfig();
        c.gridSize = gridSize.clone();
        c.presetName = name();
        return c;
    }

    /** Safe parse from string; defaults to VOLUME if unrecognized. */
    public static NoisePreset fromString(String s) {
        if (s == null) return VOLUME;
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return VOLUME;
        }
    }
}
