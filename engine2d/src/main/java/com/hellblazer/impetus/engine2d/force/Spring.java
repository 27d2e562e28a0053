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

import com.hellblazer.impetus.common.Util;
import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;

/**
 * A spring between attachment points on two bodies, with optional damping proportional to the relative velocity of
 * the attachment points. Attach to an infinite mass body or the {@link com.hellblazer.impetus.engine2d.geometry.Scrim}
 * for a fixed end.
 * <p>
 * A compress only spring acts normally when shorter than its rest length; when longer its end point is held at rest
 * length from the start point, so it exerts no force.
 *
 * @author hal.hildebrand
 */
public class Spring implements ForceLaw {

    private final String    name;
    private final RigidBody body1;
    private final Point2d   attach1;
    private final RigidBody body2;
    private final Point2d   attach2;
    private final boolean   compressOnly;
    private       double    restLength;
    private       double    stiffness;
    private       double    damping;

    public Spring(String name, RigidBody body1, Point2d attach1, RigidBody body2, Point2d attach2, double restLength,
                  double stiffness) {
        this(name, body1, attach1, body2, attach2, restLength, stiffness, false);
    }

    public Spring(String name, RigidBody body1, Point2d attach1, RigidBody body2, Point2d attach2, double restLength,
                  double stiffness, boolean compressOnly) {
        this.name = name;
        this.body1 = body1;
        this.attach1 = new Point2d(attach1);
        this.body2 = body2;
        this.attach2 = new Point2d(attach2);
        this.restLength = restLength;
        this.stiffness = stiffness;
        this.compressOnly = compressOnly;
    }

    /**
     * @throws IllegalStateException when the spring has zero length, so the force has no direction
     */
    @Override
    public List<Force> calculateForces() {
        var point1 = getStartPoint();
        var point2 = getEndPoint();
        var v = Geometry.between(point1, point2);
        double len = v.length();
        if (len < Util.TINY_POSITIVE) {
            throw new IllegalStateException("zero length spring " + name);
        }
        var f = Geometry.scaled(v, stiffness * (len - restLength) / len);
        if (damping != 0 && (!compressOnly || len < restLength - Util.TINY_POSITIVE)) {
            var df = Geometry.between(body1.getVelocity(attach1), body2.getVelocity(attach2));
            df.scale(damping);
            f.add(df);
        }
        var f2 = new Vector2d(f);
        f2.negate();
        return List.of(new Force(name, body1, point1, CoordType.WORLD, f, CoordType.WORLD),
                       new Force(name, body2, point2, CoordType.WORLD, f2, CoordType.WORLD));
    }

    public Point2d getAttach1() {
        return new Point2d(attach1);
    }

    public Point2d getAttach2() {
        return new Point2d(attach2);
    }

    @Override
    public List<RigidBody> getBodies() {
        return List.of(body1, body2);
    }

    public RigidBody getBody1() {
        return body1;
    }

    public RigidBody getBody2() {
        return body2;
    }

    public double getDamping() {
        return damping;
    }

    public Spring setDamping(double damping) {
        this.damping = damping;
        return this;
    }

    public Point2d getEndPoint() {
        var p2 = body2.bodyToWorld(attach2);
        if (!compressOnly) {
            return p2;
        }
        var p1 = getStartPoint();
        double dist = p1.distance(p2);
        if (dist <= restLength) {
            return p2;
        }
        return Geometry.offset(p1, Geometry.scaled(Geometry.between(p1, p2), 1 / dist), restLength);
    }

    public double getLength() {
        return getStartPoint().distance(getEndPoint());
    }

    public String getName() {
        return name;
    }

    @Override
    public double getPotentialEnergy() {
        double stretch = getStretch();
        return 0.5 * stiffness * stretch * stretch;
    }

    public double getRestLength() {
        return restLength;
    }

    public void setRestLength(double restLength) {
        this.restLength = restLength;
    }

    public Point2d getStartPoint() {
        return body1.bodyToWorld(attach1);
    }

    public double getStiffness() {
        return stiffness;
    }

    public void setStiffness(double stiffness) {
        this.stiffness = stiffness;
    }

    public double getStretch() {
        return getLength() - restLength;
    }

    public boolean isCompressOnly() {
        return compressOnly;
    }

    @Override
    public String toString() {
        return "Spring{" + name + ", body1=" + body1.getName() + ", attach1=" + attach1 + ", body2=" + body2.getName()
        + ", attach2=" + attach2 + ", restLength=" + Util.nf7(restLength) + ", stiffness=" + Util.nf7(stiffness)
        + ", damping=" + Util.nf7(damping) + ", compressOnly=" + compressOnly + '}';
    }
}
