/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Impetus.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.impetus.engine2d.sim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Reads an {@link EngineConfig} from JSON. Missing fields take the default values, unknown fields are ignored. A
 * null or missing elasticity keeps each body's own.
 *
 * <pre>
 * {
 *   "distanceTol": 0.01,
 *   "velocityTol": 0.5,
 *   "collisionAccuracy": 0.6,
 *   "randomSeed": 0,
 *   "collisionHandling": "SERIAL_GROUPED_LASTPASS",
 *   "extraAccel": "VELOCITY_AND_DISTANCE_JOINTS",
 *   "extraAccelTimeStep": 0.025,
 *   "jointSmallImpacts": false,
 *   "timeStep": 0.025
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class EngineConfigLoader {

    public static final String DEFAULT_RESOURCE = "/impetus-engine.json";

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Loads the bundled configuration, or the defaults when it is absent.
     */
    public EngineConfig loadDefault() {
        try (InputStream is = getClass().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.warn("Engine config resource not found: {}, using defaults", DEFAULT_RESOURCE);
                return EngineConfig.defaultConfig();
            }
            return parse(objectMapper.readTree(is), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public EngineConfig load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(objectMapper.readTree(is), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine config " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if a value is out of range or names an unknown option
     */
    public EngineConfig parse(String json) {
        try {
            return parse(objectMapper.readTree(json), "string");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse engine config", e);
        }
    }

    private EngineConfig parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("engine config must be a JSON object: " + source);
        }
        var defaults = EngineConfig.defaultConfig();
        var config = new EngineConfig(doubleValue(root, "distanceTol", defaults.distanceTol()),
                                      doubleValue(root, "velocityTol", defaults.velocityTol()),
                                      doubleValue(root, "collisionAccuracy", defaults.collisionAccuracy()),
                                      doubleValue(root, "elasticity", defaults.elasticity()),
                                      longValue(root, "randomSeed", defaults.randomSeed()),
                                      enumValue(root, "collisionHandling", CollisionHandling.class,
                                                defaults.collisionHandling()),
                                      enumValue(root, "extraAccel", ExtraAccel.class, defaults.extraAccel()),
                                      doubleValue(root, "extraAccelTimeStep", defaults.extraAccelTimeStep()),
                                      root.has("jointSmallImpacts") ? root.get("jointSmallImpacts").asBoolean()
                                                                    : defaults.jointSmallImpacts(),
                                      doubleValue(root, "timeStep", defaults.timeStep()));
        log.info("Loaded engine config from {}: {}", source, config);
        return config;
    }

    private static double doubleValue(JsonNode root, String field, double defaultValue) {
        var node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number: " + node);
        }
        return node.asDouble();
    }

    private static long longValue(JsonNode root, String field, long defaultValue) {
        var node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new IllegalArgumentException(field + " must be an integer: " + node);
        }
        return node.asLong();
    }

    private static <E extends Enum<E>> E enumValue(JsonNode root, String field, Class<E> type, E defaultValue) {
        var node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        var name = node.asText().trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
            "unknown " + field + " '" + node.asText() + "', expected one of " + Arrays.toString(
            type.getEnumConstants()), e);
        }
    }
}
