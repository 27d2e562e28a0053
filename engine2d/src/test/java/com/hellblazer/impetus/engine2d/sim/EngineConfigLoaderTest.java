/** Copyright (C) 2025 Hal Hildebrand. All rights reserved. */
package com.hellblazer.impetus.engine2d.sim;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class EngineConfigLoaderTest {

    private final EngineConfigLoader loader = new EngineConfigLoader();

    @Test
    void bundledResourceMatchesDefaults() {
        assertEquals(EngineConfig.defaultConfig(), loader.loadDefault());
    }

    @Test
    void emptyObjectGivesDefaults() {
        var config = loader.parse("{}");
        assertEquals(EngineConfig.defaultConfig(), config);
        assertTrue(Double.isNaN(config.elasticity()));
    }

    @Test
    void overridesAndEnumSpelling() {
        var config = loader.parse("""
                                  {
                                    "distanceTol": 0.02,
                                    "elasticity": 0.5,
                                    "randomSeed": 12345,
                                    "collisionHandling": "serial separate lastpass",
                                    "extraAccel": "velocity",
                                    "jointSmallImpacts": true,
                                    "timeStep": 0.01,
                                    "somethingElse": "ignored"
                                  }
                                  """);
        assertEquals(0.02, config.distanceTol());
        assertEquals(0.5, config.velocityTol());
        assertEquals(0.5, config.elasticity());
        assertEquals(12345L, config.randomSeed());
        assertEquals(CollisionHandling.SERIAL_SEPARATE_LASTPASS, config.collisionHandling());
        assertEquals(ExtraAccel.VELOCITY, config.extraAccel());
        assertTrue(config.jointSmallImpacts());
        assertEquals(0.01, config.timeStep());
        assertEquals(0.01, config.advanceConfig().timeStep());
        assertTrue(config.advanceConfig().jointSmallImpacts());
    }

    @Test
    void rejectsBadValues() {
        var e = assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"extraAccel\": \"warp\"}"));
        assertTrue(e.getMessage().contains("VELOCITY_AND_DISTANCE"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"distanceTol\": \"small\"}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"distanceTol\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"collisionAccuracy\": 1.5}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"elasticity\": 2}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("[1, 2]"));
        assertThrows(UncheckedIOException.class, () -> loader.parse("{ not json"));
    }

    @Test
    void randomSeedMustBeUnsigned32BitInteger() {
        assertEquals(4294967295L, loader.parse("{\"randomSeed\": 4294967295}").randomSeed());
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"randomSeed\": \"abc\"}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"randomSeed\": 1.5}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"randomSeed\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{\"randomSeed\": 4294967296}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaultConfig().withRandomSeed(-5));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("engine.json");
        Files.writeString(file, "{\"velocityTol\": 0.25, \"collisionHandling\": \"HYBRID\"}");
        var config = loader.load(file);
        assertEquals(0.25, config.velocityTol());
        assertEquals(CollisionHandling.HYBRID, config.collisionHandling());
        assertThrows(UncheckedIOException.class, () -> loader.load(dir.resolve("missing.json")));
    }

    @Test
    void recordDefaultsNullOptions() {
        var config = new EngineConfig(0.01, 0.5, 0.6, Double.NaN, 0, null, null, 0.025, false, 0.025);
        assertEquals(CollisionHandling.SERIAL_GROUPED_LASTPASS, config.collisionHandling());
        assertEquals(ExtraAccel.VELOCITY_AND_DISTANCE_JOINTS, config.extraAccel());
        assertEquals(ExtraAccel.NONE, config.withExtraAccel(ExtraAccel.NONE).extraAccel());
        assertEquals(9L, config.withRandomSeed(9).randomSeed());
    }
}
