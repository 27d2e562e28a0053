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

/**
 * Extra acceleration requested at each contact so that small residual velocity, and optionally distance from the
 * target gap, are removed over a few time steps. Without it resting bodies jitter.
 *
 * @author hal.hildebrand
 */
public enum ExtraAccel {
    NONE(false, false),
    /** Removes normal velocity at contacts, but not at joints. */
    VELOCITY(true, false),
    /** Removes normal velocity at contacts and joints. */
    VELOCITY_JOINTS(true, true),
    /** Removes normal velocity and distance from the target gap at contacts, but not at joints. */
    VELOCITY_AND_DISTANCE(true, false),
    /** Removes normal velocity and distance from the target gap at contacts and joints. */
    VELOCITY_AND_DISTANCE_JOINTS(true, true);

    private final boolean velocity;
    private final boolean joints;

    ExtraAccel(boolean velocity, boolean joints) {
        this.velocity = velocity;
        this.joints = joints;
    }

    /**
     * The term added to the b vector of a contact.
     *
     * @param normalVelocity  normal velocity of the contact
     * @param distanceToGap   distance from the target gap
     * @param joint           whether the contact is a joint
     * @param timeStep        time over which the velocity should vanish
     */
    public double extraAccel(double normalVelocity, double distanceToGap, boolean joint, double timeStep) {
        if (!velocity || (joint && !joints)) {
            return 0;
        }
        return switch (this) {
            case VELOCITY, VELOCITY_JOINTS -> normalVelocity / timeStep;
            default -> (2 * normalVelocity * timeStep + distanceToGap) / (timeStep * timeStep);
        };
    }
}
