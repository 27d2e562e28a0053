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

import com.hellblazer.impetus.engine2d.collision.ConnectorCollision;
import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;

import java.util.List;

/**
 * A standing connection between two bodies that contributes a collision record to every detection pass.
 *
 * @author hal.hildebrand
 */
public interface Connector {

    /**
     * Adds the record of this connector to the front of the list.
     *
     * @param time current simulation time
     */
    void addCollision(List<RigidBodyCollision> collisions, double time);

    /**
     * Moves one of the bodies so that the connection holds exactly.
     */
    void align();

    RigidBody getBody1();

    RigidBody getBody2();

    String getName();

    /**
     * @return distance between the attach points measured along the normal
     */
    double getNormalDistance();

    /**
     * Recomputes the impact points, normal and distance of the record from the current body positions.
     */
    void updateCollision(ConnectorCollision collision);
}
