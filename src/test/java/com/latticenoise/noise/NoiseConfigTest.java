package com.latticenoise.noise;

import com.latticenoise.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link NoiseConfig} and {@link NoisePreset}.
 */
class NoiseConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("default config is a random-seeded 64^3 volume")
    void defaultConfig() {
        NoiseConfig c = NoiseConfig.defaultConfig();
        assertNull(c.seed);
        assertArrayEquals(new int[]{64, 64, 64}, c.gridSize);
        assertEquals("VOLUME", c.presetName);
    }

    @Test
    @DisplayName("copy is deep")
    void copy_isDeep() {
        NoiseConfig c = new NoiseConfig().withSeed(5).withGridSize(3, 4);
        NoiseConfig d = c.copy();
        d.gridSize[0] = 99;
        d.seed = 6L;
        assertNotSame(c.gridSize, d.gridSize);
        assertArrayEquals(new int[]{3, 4}, c.gridSize);
        assertEquals(Long.valueOf(5L), c.seed);
    }

    @Test
    @DisplayName("empty properties give the defaults")
    void fromProperties_empty() {
        NoiseConfig c = NoiseConfig.fromProperties(new Properties());
        assertNull(c.seed);
        assertArrayEquals(new int[]{64, 64, 64}, c.gridSize);
    }

    @Test
    @DisplayName("seed and grid size are parsed")
    void fromProperties_values() {
        Properties props = new Properties();
        props.setProperty("seed", " 123 ");
        props.setProperty("gridSize", "10, 20");
        NoiseConfig c = NoiseConfig.fromProperties(props);
        assertEquals(Long.valueOf(123L), c.seed);
        assertArrayEquals(new int[]{10, 20}, c.gridSize);
        assertNull(c.presetName);
    }

    @Test
    @DisplayName("an explicit grid overrides the preset's")
    void fromProperties_gridOverridesPreset() {
        Properties props = new Properties();
        props.setProperty("preset", "HYPER");
        props.setProperty("gridSize", "5");
        assertArrayEquals(new int[]{5}, NoiseConfig.fromProperties(props).gridSize);
    }

    @Test
    @DisplayName("unknown presets fall back to VOLUME")
    void fromProperties_unknownPreset() {
        Properties props = new Properties();
        props.setProperty("preset", "wobbly");
        NoiseConfig c = NoiseConfig.fromProperties(props);
        assertArrayEquals(new int[]{64, 64, 64}, c.gridSize);
        assertEquals("VOLUME", c.presetName);
    }

    @Test
    @DisplayName("malformed values are configuration errors")
    void fromProperties_malformed() {
        Properties badSeed = new Properties();
        badSeed.setProperty("seed", "twelve");
        assertThrows(ConfigurationException.class, () -> NoiseConfig.fromProperties(badSeed));

        Properties badGrid = new Properties();
        badGrid.setProperty("gridSize", "8,x,8");
        assertThrows(ConfigurationException.class, () -> NoiseConfig.fromProperties(badGrid));
    }

    @Test
    @DisplayName("toProperties reads back to the same seed and grid")
    void toProperties_readsBack() {
        NoiseConfig c = new NoiseConfig().withSeed(-77).withGridSize(7, 1, 9);
        NoiseConfig back = NoiseConfig.fromProperties(c.toProperties());
        assertEquals(Long.valueOf(-77L), back.seed);
        assertArrayEquals(new int[]{7, 1, 9}, back.gridSize);
    }

    @Test
    @DisplayName("load returns defaults for a missing file")
    void load_missingFile() throws IOException {
        NoiseConfig c = NoiseConfig.load(tempDir.resolve("absent.properties"));
        assertNull(c.seed);
        assertArrayEquals(new int[]{64, 64, 64}, c.gridSize);
    }

    @Test
    @DisplayName("load reads a properties file")
    void load_file() throws IOException {
        Path file = tempDir.resolve("noise.properties");
        Properties props = new Properties();
        props.setProperty("seed", "9");
        props.setProperty("gridSize", "12,12");
        try (OutputStream os = Files.newOutputStream(file)) {
            props.store(os, "test");
        }

        NoiseConfig c = NoiseConfig.load(file);
        assertEquals(Long.valueOf(9L), c.seed);
        assertArrayEquals(new int[]{12, 12}, c.gridSize);
        assertEquals(2, new NoiseField(c).dimension());
    }

    @Test
    @DisplayName("loadResource reads from the classpath")
    void loadResource() throws IOException {
        NoiseConfig c = NoiseConfig.loadResource("/noise-plane.properties");
        assertEquals(Long.valueOf(42L), c.seed);
        assertArrayEquals(new int[]{64, 64}, c.gridSize);
        assertEquals("PLANE", c.presetName);
    }

    @Test
    @DisplayName("loadResource fails on a missing resource")
    void loadResource_missing() {
        assertThrows(IOException.class, () -> NoiseConfig.loadResource("/no-such-noise.properties"));
    }

    @Test
    @DisplayName("presets build fields of their own dimension")
    void presets() {
        for (NoisePreset preset : NoisePreset.values()) {
            NoiseConfig c = preset.createConfig();
            assertEquals(preset.dimension(), c.gridSize.length);
            assertEquals(preset.name(), c.presetName);
            assertTrue(preset.getDisplayName().length() > 0);
            assertTrue(preset.getDescription().length() > 0);
        }
        assertEquals(1, new NoiseField(NoisePreset.LINE.createConfig().withSeed(1)).dimension());
    }

    @Test
    @DisplayName("preset parsing is lenient")
    void presetFromString() {
        assertEquals(NoisePreset.PLANE, NoisePreset.fromString("plane"));
        assertEquals(NoisePreset.HYPER, NoisePreset.fromString(" HYPER "));
        assertEquals(NoisePreset.VOLUME, NoisePreset.fromString(null));
        assertEquals(NoisePreset.VOLUME, NoisePreset.fromString("nope"));
    }

    @Test
    @DisplayName("preset configs are independent copies")
    void presetConfigsIndependent() {
        NoiseConfig a = NoisePreset.PLANE.createConfig();
        a.gridSize[0] = 1;
        assertArrayEquals(new int[]{64, 64}, NoisePreset.PLANE.createConfig().gridSize);
    }
}
