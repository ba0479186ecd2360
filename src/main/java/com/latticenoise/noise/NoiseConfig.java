package com.latticenoise.noise;

import com.latticenoise.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Noise field configuration. All fields are public for direct tweaking;
 * defaults give a 3-D 64×64×64 grid with a random seed.
 *
 * Can also be read from a key=value properties file:
 * <pre>
 * preset=PLANE          # optional, applied first
 * seed=123              # optional, omitted = random
 * gridSize=10,10        # optional, overrides the preset's grid
 * </pre>
 */
public class NoiseConfig {

    private static final Logger LOG = Logger.getLogger(NoiseConfig.class.getName());

    public static final String KEY_SEED = "seed";
    public static final String KEY_GRID_SIZE = "gridSize";
    public static final String KEY_PRESET = "preset";

    /** Seed of the gradient lattice. Null = draw one at construction. */
    public Long seed = null;

    /** Cells per axis; its length is the field's dimension. */
    public int[] gridSize = NoiseConstants.defaultGridSize();

    /** The preset this config was created from (null if custom). */
    public String presetName = NoisePreset.VOLUME.name();

    public static NoiseConfig defaultConfig() {
        return new NoiseConfig();
    }

    /** Fluent seed setter. */
    public NoiseConfig withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /** Fluent grid setter; marks the config as custom. */
    public NoiseConfig withGridSize(int... gridSize) {
        this.gridSize = gridSize != null ? gridSize.clone() : null;
        this.presetName = null;
        return this;
    }

    /**
     * Deep copy this config for safe modification.
     */
    public NoiseConfig copy() {
        NoiseConfig c = new NoiseConfig();
        c.seed = this.seed;
        c.gridSize = this.gridSize != null ? this.gridSize.clone() : null;
        c.presetName = this.presetName;
        return c;
    }

    // --- Properties ---

    /**
     * Build a config from properties. Missing keys keep their defaults.
     *
     * @throws ConfigurationException if a seed or grid entry is not an integer
     */
    public static NoiseConfig fromProperties(Properties props) {
        NoiseConfig c;
        String preset = props.getProperty(KEY_PRESET);
        if (preset != null) {
            NoisePreset p = NoisePreset.fromString(preset);
            if (!p.name().equalsIgnoreCase(preset.trim())) {
                LOG.warning("[NoiseConfig] Unknown preset '" + preset + "', using " + p.name());
            }
            c = p.createConfig();
        } else {
            c = defaultConfig();
        }

        String seed = props.getProperty(KEY_SEED);
        if (seed != null && !seed.isBlank()) {
            try {
                c.seed = Long.parseLong(seed.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid seed: '" + seed + "'", e);
            }
        }

        String grid = props.getProperty(KEY_GRID_SIZE);
        if (grid != null && !grid.isBlank()) {
            c.gridSize = parseGridSize(grid);
            c.presetName = null;
        }
        return c;
    }

    /**
     * Load a config from a properties file.
     * Returns the default config if the file doesn't exist.
     */
    public static NoiseConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            LOG.info("[NoiseConfig] " + file + " not found, using defaults");
            return defaultConfig();
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
        }
        LOG.info("[NoiseConfig] Loaded " + file);
        return fromProperties(props);
    }

    /**
     * Load a config from a classpath resource.
     *
     * @throws IOException if the resource is missing or unreadable
     */
    public static NoiseConfig loadResource(String path) throws IOException {
        Properties props = new Properties();
        try (InputStream is = NoiseConfig.class.getResourceAsStream(path)) {
            if (is == null) throw new IOException("Noise config resource not found: " + path);
            props.load(is);
        }
        LOG.info("[NoiseConfig] Loaded resource " + path);
        return fromProperties(props);
    }

    /** Properties that {@link #fromProperties(Properties)} reads back into an equal seed and grid. */
    public Properties toProperties() {
        Properties props = new Properties();
        if (seed != null) props.setProperty(KEY_SEED, Long.toString(seed));
        if (gridSize != null) props.setProperty(KEY_GRID_SIZE, formatGridSize(gridSize));
        return props;
    }

    static int[] parseGridSize(String value) {
        String[] parts = value.split(",");
        int[] size = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                size[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid grid size entry '" + parts[i].trim()
                    + "' in '" + value + "'", e);
            }
        }
        return size;
    }

    static String formatGridSize(int[] size) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(size[i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "NoiseConfig{preset=" + presetName +
            ", seed=" + (seed != null ? seed : "random") +
            ", gridSize=" + Arrays.toString(gridSize) + "}";
    }
}
