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
package com.hellblazer.impetus.engine2d.force;

import com.hellblazer.impetus.engine2d.geometry.RigidBody;

import java.util.List;

/**
 * Calculates the forces acting on a set of bodies from their current positions and velocities.
 *
 * @author hal.hildebrand
 */
public interface ForceLaw {

    List<Force> calculateForces();

    List<RigidBody> getBodies();

    /**
     * @return potential energy stored by this law, zero for dissipative laws
     */
    double getPotentialEnergy();
}
