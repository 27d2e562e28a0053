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
import com.hellblazer.impetus.engine2d.force.CoordType;
import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.RigidBody;
import com.hellblazer.impetus.engine2d.geometry.Scrim;

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connects two bodies at an attach point on each, along a normal direction. The contact solver keeps the
 * acceleration between the attach points along the normal at zero, pushing or pulling as needed; perpendicular to
 * the normal the bodies move freely. Two joints at the same attach points with perpendicular normals make a double
 * joint, which pins the bodies together.
 * <p>
 * A world normal is fixed; a body normal is in the coordinates of the second body and rotates with it. The order of
 * the bodies matters to {@link #align()}, which moves the second body when it can. Joints are immutable, and the
 * joined bodies never collide with each other.
 *
 * @author hal.hildebrand
 */
public final class Joint implements Connector {

    private static final AtomicInteger nextJointNum = new AtomicInteger(1);

    private final String    name;
    private final RigidBody body1;
    private final Point2d   attach1;
    private final RigidBody body2;
    private final Point2d   attach2;
    private final CoordType normalType;
    private final Vector2d  normal;

    /**
     * @param attach1    attach point in the body coordinates of body1
     * @param attach2    attach point in the body coordinates of body2
     * @param normalType whether the normal is in world coordinates or the body coordinates of body2
     * @param normal     direction along which the joint operates
     */
    public Joint(RigidBody body1, Point2d attach1, RigidBody body2, Point2d attach2, CoordType normalType,
                 Vector2d normal) {
        if (body1 == body2) {
            throw new IllegalArgumentException("joint must connect two different bodies: " + body1.getName());
        }
        this.name = "JOINT" + nextJointNum.getAndIncrement();
        this.body1 = body1;
        this.attach1 = new Point2d(attach1);
        this.body2 = body2;
        this.attach2 = new Point2d(attach2);
        this.normalType = normalType;
        this.normal = new Vector2d(normal);
        this.normal.normalize();
        // the scrim is shared, its non-collide set stays empty
        if (!(body1 instanceof Scrim)) {
            body1.addNonCollide(List.of(body2));
        }
        if (!(body2 instanceof Scrim)) {
            body2.addNonCollide(List.of(body1));
        }
    }

    @Override
    public void addCollision(List<RigidBodyCollision> collisions, double time) {
        var c = new ConnectorCollision(body1, body2, this, true);
        updateCollision(c);
        c.setDetectedTime(time);
        collisions.add(0, c);
    }

    /**
     * Moves the second body so its attach point meets the first body's attach point, or the first body if the
     * second can't move. Afterwards the simulation variables must be updated from the bodies.
     */
    @Override
    public void align() {
        if (body2.isMoveable()) {
            body2.alignTo(attach2, body1.bodyToWorld(attach1));
        } else if (body1.isMoveable()) {
            body1.alignTo(attach1, body2.bodyToWorld(attach2));
        }
    }

    public Point2d getAttach1() {
        return new Point2d(attach1);
    }

    public Point2d getAttach2() {
        return new Point2d(attach2);
    }

    @Override
    public RigidBody getBody1() {
        return body1;
    }

    @Override
    public RigidBody getBody2() {
        return body2;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public double getNormalDistance() {
        var c = new ConnectorCollision(body1, body2, this, true);
        updateCollision(c);
        return c.getDistance();
    }

    public CoordType getNormalType() {
        return normalType;
    }

    /**
     * @return the normal in world coordinates
     */
    public Vector2d getNormalWorld() {
        return normalType == CoordType.WORLD ? new Vector2d(normal) : body2.rotateBodyToWorld(normal);
    }

    @Override
    public void updateCollision(ConnectorCollision c) {
        if (c.getPrimaryBody() != body1 || c.getNormalBody() != body2) {
            throw new IllegalArgumentException("collision does not belong to " + name);
        }
        var impact1 = body1.bodyToWorld(attach1);
        var impact2 = body2.bodyToWorld(attach2);
        var normalWorld = getNormalWorld();
        c.setImpact1(impact1);
        c.setImpact2(impact2);
        c.setNormalFixed(normalType == CoordType.WORLD);
        c.setNormal(normalWorld);
        c.setDistance(normalWorld.dot(Geometry.between(impact2, impact1)));
    }

    @Override
    public String toString() {
        return "Joint{" + name + ", body1=" + body1.getName() + ", attach1=" + attach1 + ", body2=" + body2.getName()
        + ", attach2=" + attach2 + ", normalType=" + normalType + ", normal=" + normal + '}';
    }
}
