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

import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Friction proportional to velocity: force {@code -k v} at the center of mass and torque {@code -k rotateRatio w}.
 *
 * @author hal.hildebrand
 */
public class DampingLaw implements ForceLaw {

    private final List<RigidBody> bodies = new ArrayList<>();
    private       double          damping;
    private       double          rotateRatio;

    public DampingLaw(double damping, double rotateRatio) {
        this.damping = damping;
        this.rotateRatio = rotateRatio;
    }

    public DampingLaw(double damping, double rotateRatio, Collection<? extends RigidBody> bodies) {
        this(damping, rotateRatio);
        bodies.forEach(this::addBody);
    }

    public void addBody(RigidBody body) {
        if (body.isMoveable() && !bodies.contains(body)) {
            bodies.add(body);
        }
    }

    public void removeBody(RigidBody body) {
        bodies.remove(body);
    }

    @Override
    public List<Force> calculateForces() {
        var forces = new ArrayList<Force>();
        if (damping == 0) {
            return forces;
        }
        for (var body : bodies) {
            forces.add(new Force("damping", body, body.getPosition(), CoordType.WORLD,
                                 Geometry.scaled(body.getVelocity(), -damping), CoordType.WORLD,
                                 -damping * rotateRatio * body.getAngularVelocity()));
        }
        return forces;
    }

    @Override
    public List<RigidBody> getBodies() {
        return new ArrayList<>(bodies);
    }

    public double getDamping() {
        return damping;
    }

    public void setDamping(double damping) {
        this.damping = damping;
    }

    @Override
    public double getPotentialEnergy() {
        return 0;
    }

    public double getRotateRatio() {
        return rotateRatio;
    }

    public void setRotateRatio(double rotateRatio) {
        this.rotateRatio = rotateRatio;
    }

    @Override
    public String toString() {
        return "DampingLaw{damping=" + damping + ", rotateRatio=" + rotateRatio + ", bodies=" + bodies.size() + '}';
    }
}
