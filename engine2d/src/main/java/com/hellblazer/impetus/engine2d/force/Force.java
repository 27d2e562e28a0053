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

import javax.vecmath.Point2d;
import javax.vecmath.Vector2d;

/**
 * A force applied to a body at a location, with an optional additional torque about the center of mass. Location
 * and direction may each be given in body or world coordinates; the accessors always answer in world coordinates.
 *
 * @author hal.hildebrand
 */
public final class Force {

    private final String    name;
    private final RigidBody body;
    private final Point2d   location;
    private final CoordType locationType;
    private final Vector2d  direction;
    private final CoordType directionType;
    private final double    torque;

    public Force(String name, RigidBody body, Point2d location, CoordType locationType, Vector2d direction,
                 CoordType directionType) {
        this(name, body, location, locationType, direction, directionType, 0);
    }

    public Force(String name, RigidBody body, Point2d location, CoordType locationType, Vector2d direction,
                 CoordType directionType, double torque) {
        this.name = name;
        this.body = body;
        this.location = new Point2d(location);
        this.locationType = locationType;
        this.direction = new Vector2d(direction);
        this.directionType = directionType;
        this.torque = torque;
    }

    public RigidBody getBody() {
        return body;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the point of application, world coordinates
     */
    public Point2d getStartPoint() {
        return locationType == CoordType.BODY ? body.bodyToWorld(location) : new Point2d(location);
    }

    /**
     * @return the force vector, world coordinates
     */
    public Vector2d getVector() {
        return directionType == CoordType.BODY ? body.rotateBodyToWorld(direction) : new Vector2d(direction);
    }

    public double getTorque() {
        return torque;
    }

    /**
     * @return torque of the force about the body's center of mass, including the additional torque
     */
    public double torqueAboutCM() {
        var r = Geometry.between(body.getPosition(), getStartPoint());
        return Geometry.cross(r, getVector()) + torque;
    }

    @Override
    public String toString() {
        return "Force{" + name + ", body=" + body.getName() + ", location=" + getStartPoint() + ", direction="
        + getVector() + ", torque=" + torque + '}';
    }
}
