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
package com.hellblazer.impetus.engine2d.geometry;

import com.hellblazer.impetus.engine2d.collision.RigidBodyCollision;

import javax.vecmath.Point2d;
import java.util.List;

/**
 * The fixed background of the world: an immoveable body of infinite mass whose body coordinates are world
 * coordinates. Used as the second body of a joint that pins a body to a point in space. It never collides.
 *
 * @author hal.hildebrand
 */
public final class Scrim extends RigidBody {

    private static final Scrim INSTANCE = new Scrim();

    private Scrim() {
        super("scrim");
        setMass(Double.POSITIVE_INFINITY);
    }

    public static Scrim getInstance() {
        return INSTANCE;
    }

    @Override
    public void checkCollision(List<RigidBodyCollision> collisions, RigidBody other, double time) {
    }

    @Override
    public boolean doesNotCollide(RigidBody other) {
        return true;
    }

    @Override
    public double getBottomBody() {
        return 0;
    }

    @Override
    public double getLeftBody() {
        return 0;
    }

    @Override
    public double getRightBody() {
        return 0;
    }

    @Override
    public double getTopBody() {
        return 0;
    }

    @Override
    public Point2d getCentroidBody() {
        return new Point2d(0, 0);
    }

    @Override
    public double getCentroidRadius() {
        return 0;
    }

    @Override
    public List<Edge> getEdges() {
        return List.of();
    }

    @Override
    public double getMinHeight() {
        return 0;
    }

    @Override
    public List<Vertex> getVertexes() {
        return List.of();
    }

    @Override
    public void setPosition(Point2d locWorld, double angle) {
        if (locWorld.x != 0 || locWorld.y != 0 || angle != 0) {
            throw new UnsupportedOperationException("the scrim cannot be moved");
        }
    }
}
