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

import com.hellblazer.impetus.common.RandomLCG;
import com.hellblazer.impetus.simulation.CollisionAdvance.AdvanceConfig;

/**
 * Tolerances and options of the engine.
 *
 * @param distanceTol        gap below which bodies are in contact
 * @param velocityTol        normal speed below which a close pair is a contact rather than a collision
 * @param collisionAccuracy  fraction of the half gap within which a collision is accepted for handling, in (0, 1]
 * @param elasticity         elasticity applied to every body, or NaN to keep each body's own
 * @param randomSeed         seed of the random collision and contact treatment order, in [0, 2^32)
 * @param collisionHandling  how simultaneous collisions are resolved
 * @param extraAccel         extra acceleration that removes residual velocity at contacts
 * @param extraAccelTimeStep time over which the extra acceleration acts
 * @param jointSmallImpacts  whether small impulses are applied to joints at the end of each step
 * @param timeStep           default time step
 * @author hal.hildebrand
 */
public record EngineConfig(double distanceTol, double velocityTol, double collisionAccuracy, double elasticity,
                           long randomSeed, CollisionHandling collisionHandling, ExtraAccel extraAccel,
                           double extraAccelTimeStep, boolean jointSmallImpacts, double timeStep) {

    public EngineConfig {
        if (!(distanceTol > 0) || !(velocityTol > 0)) {
            throw new IllegalArgumentException("tolerances must be positive: " + distanceTol + ", " + velocityTol);
        }
        if (!(collisionAccuracy > 0 && collisionAccuracy <= 1)) {
            throw new IllegalArgumentException("collision accuracy must be in (0, 1]: " + collisionAccuracy);
        }
        if (!Double.isNaN(elasticity) && !(elasticity >= 0 && elasticity <= 1)) {
            throw new IllegalArgumentException("elasticity must be in [0, 1]: " + elasticity);
        }
        if (!(extraAccelTimeStep > 0) || !(timeStep > 0)) {
            throw new IllegalArgumentException("time steps must be positive: " + extraAccelTimeStep + ", " + timeStep);
        }
        if (!RandomLCG.isValidSeed(randomSeed)) {
            throw new IllegalArgumentException("random seed must be in [0, " + RandomLCG.MAX_SEED + "]: " + randomSeed);
        }
        if (collisionHandling == null) {
            collisionHandling = CollisionHandling.SERIAL_GROUPED_LASTPASS;
        }
        if (extraAccel == null) {
            extraAccel = ExtraAccel.VELOCITY_AND_DISTANCE_JOINTS;
        }
    }

    public static EngineConfig defaultConfig() {
        return new EngineConfig(0.01, 0.5, 0.6, Double.NaN, 0, CollisionHandling.SERIAL_GROUPED_LASTPASS,
                                ExtraAccel.VELOCITY_AND_DISTANCE_JOINTS, 0.025, false, 0.025);
    }

    /**
     * @return the stepping configuration for {@link com.hellblazer.impetus.simulation.CollisionAdvance}
     */
    public AdvanceConfig advanceConfig() {
        return AdvanceConfig.defaultConfig()
                            .withTimeStep(timeStep)
                            .withJointSmallImpacts(jointSmallImpacts);
    }

    public EngineConfig withExtraAccel(ExtraAccel extraAccel) {
        return new EngineConfig(distanceTol, velocityTol, collisionAccuracy, elasticity, randomSeed,
                                collisionHandling, extraAccel, extraAccelTimeStep, jointSmallImpacts, timeStep);
    }

    public EngineConfig withElasticity(double elasticity) {
        return new EngineConfig(distanceTol, velocityTol, collisionAccuracy, elasticity, randomSeed,
                                collisionHandling, extraAccel, extraAccelTimeStep, jointSmallImpacts, timeStep);
    }

    public EngineConfig withRandomSeed(long randomSeed) {
        return new EngineConfig(distanceTol, velocityTol, collisionAccuracy, elasticity, randomSeed,
                                collisionHandling, extraAccel, extraAccelTimeStep, jointSmallImpacts, timeStep);
    }
}
