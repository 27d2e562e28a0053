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

import javax.vecmath.Vector2d;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Uniform gravity pulling every moveable body down (negative y). Potential energy is measured from each body's zero
 * energy level, or from the law's own level for bodies that don't set one.
 *
 * @author hal.hildebrand
 */
public class GravityLaw implements ForceLaw {

    private final List<RigidBody> bodies = new ArrayList<>();
    private       double          gravity;
    private       double          zeroEnergyLevel;

    public GravityLaw(double gravity) {
        this.gravity = gravity;
    }

    public GravityLaw(double gravity, Collection<? extends RigidBody> bodies) {
        this(gravity);
        addBodies(bodies);
    }

    public void addBodies(Collection<? extends RigidBody> bodies) {
        bodies.forEach(this::addBody);
    }

    /**
     * Adds the body if it has finite mass and is not already present.
     */
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
        for (var body : bodies) {
            forces.add(new Force("gravity", body, body.getPosition(), CoordType.WORLD,
                                 new Vector2d(0, -gravity * body.getMass()), CoordType.WORLD));
        }
        return forces;
    }

    @Override
    public List<RigidBody> getBodies() {
        return new ArrayList<>(bodies);
    }

    public double getGravity() {
        return gravity;
    }

    public void setGravity(double gravity) {
        this.gravity = gravity;
    }

    @Override
    public double getPotentialEnergy() {
        double pe = 0;
        for (var body : bodies) {
            double zel = body.getZeroEnergyLevel();
            zel = Double.isNaN(zel) ? zeroEnergyLevel : zel;
            pe += (body.getPosition().y - zel) * body.getMass() * gravity;
        }
        return pe;
    }

    public double getZeroEnergyLevel() {
        return zeroEnergyLevel;
    }

    public void setZeroEnergyLevel(double zeroEnergyLevel) {
        this.zeroEnergyLevel = zeroEnergyLevel;
    }

    @Override
    public String toString() {
        return "GravityLaw{gravity=" + gravity + ", zeroEnergyLevel=" + zeroEnergyLevel + ", bodies=" + bodies.size()
        + '}';
    }
}
