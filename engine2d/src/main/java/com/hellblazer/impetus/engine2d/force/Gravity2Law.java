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
 * Mutual attraction between every pair of bodies, {@code F = G m1 m2 / r^2}.
 *
 * @author hal.hildebrand
 */
public class Gravity2Law implements ForceLaw {

    private final List<RigidBody> bodies = new ArrayList<>();
    private       double          gravity;

    public Gravity2Law(double gravity) {
        this.gravity = gravity;
    }

    public Gravity2Law(double gravity, Collection<? extends RigidBody> bodies) {
        this(gravity);
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
        for (int j = 0; j < bodies.size(); j++) {
            var body1 = bodies.get(j);
            for (int k = j + 1; k < bodies.size(); k++) {
                var body2 = bodies.get(k);
                var vector = Geometry.between(body2.getPosition(), body1.getPosition());
                double r = vector.length();
                if (r == 0) {
                    continue;
                }
                var direction = Geometry.scaled(vector, gravity * body1.getMass() * body2.getMass() / (r * r * r));
                forces.add(new Force("gravity", body2, body2.getPosition(), CoordType.WORLD, direction,
                                     CoordType.WORLD));
                direction.negate();
                forces.add(new Force("gravity", body1, body1.getPosition(), CoordType.WORLD, direction,
                                     CoordType.WORLD));
            }
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

    /**
     * Zero potential energy for a pair is at their closest possible separation, the sum of their minimum heights, so
     * the energy is never negative.
     *
     * @throws IllegalStateException when both bodies of a pair have zero minimum height
     */
    @Override
    public double getPotentialEnergy() {
        double pe = 0;
        for (int j = 0; j < bodies.size(); j++) {
            var body1 = bodies.get(j);
            for (int k = j + 1; k < bodies.size(); k++) {
                var body2 = bodies.get(k);
                double h = body1.getMinHeight() + body2.getMinHeight();
                if (!(h > 0)) {
                    throw new IllegalStateException(
                    "zero minimum separation between " + body1.getName() + " and " + body2.getName());
                }
                double r = Geometry.distance(body1.getPosition(), body2.getPosition());
                pe += gravity * body1.getMass() * body2.getMass() * (1 / h - 1 / r);
            }
        }
        return pe;
    }

    @Override
    public String toString() {
        return "Gravity2Law{gravity=" + gravity + ", bodies=" + bodies.size() + '}';
    }
}
