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

import com.hellblazer.impetus.engine2d.force.CoordType;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Scrim;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;

/**
 * Helpers that create joints, add them to a simulation and align the bodies.
 *
 * @author hal.hildebrand
 */
public final class JointUtil {

    private JointUtil() {
    }

    /**
     * Joins two bodies with a double joint, two joints at the same attach points with perpendicular normals, which
     * pins them together at a point about which they may rotate freely.
     *
     * @param normalType whether the normals are fixed in the world or rotate with body2
     * @return the two joints
     */
    public static List<Joint> attachRigidBody(ContactSim sim, RigidBody body1, Point2d attach1, RigidBody body2,
                                              Point2d attach2, CoordType normalType) {
        var j1 = new Joint(body1, attach1, body2, attach2, normalType, new Vector2d(0, 1));
        var j2 = new Joint(body1, attach1, body2, attach2, normalType, new Vector2d(1, 0));
        sim.addConnector(j1);
        sim.addConnector(j2);
        sim.alignConnectors();
        return List.of(j1, j2);
    }

    /**
     * Pins the body to a fixed point in the world with a double joint to the {@link Scrim}.
     *
     * @param attach attach point in body coordinates
     * @param world  the fixed world location
     */
    public static List<Joint> addDoubleFixedJoint(ContactSim sim, RigidBody body, Point2d attach, Point2d world) {
        return attachRigidBody(sim, Scrim.getInstance(), world, body, attach, CoordType.WORLD);
    }

    /**
     * Constrains the attach point of the body to slide along a fixed line through the world location, with a single
     * joint to the {@link Scrim} whose normal is perpendicular to that line.
     *
     * @param normal world direction in which the attach point may not move
     */
    public static Joint addSingleFixedJoint(ContactSim sim, RigidBody body, Point2d attach, Point2d world,
                                            Vector2d normal) {
        var joint = new Joint(Scrim.getInstance(), world, body, attach, CoordType.WORLD, normal);
        sim.addConnector(joint);
        sim.alignConnectors();
        return joint;
    }
}
