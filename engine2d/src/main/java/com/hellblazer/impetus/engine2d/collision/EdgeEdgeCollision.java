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
package com.hellblazer.impetus.engine2d.collision;

import com.hellblazer.impetus.engine2d.geometry.CircularEdge;
import com.hellblazer.impetus.engine2d.geometry.Edge;
import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.Vertex;
import com.hellblazer.impetus.simulation.Collision;

import javax.vecmath.Vector2d;

/**
 * A curved edge of the primary body against an edge of the normal body. The geometry is recomputed from the circle
 * centers on every update, which is more precise than the vertices decorating the arc.
 *
 * @author hal.hildebrand
 */
public class EdgeEdgeCollision extends RigidBodyCollision {

    private static final double MIN_NORMALITY = 0.9;

    private final Edge primaryEdge;
    private final Edge normalEdge;

    public EdgeEdgeCollision(Edge primaryEdge, Edge normalEdge) {
        super(primaryEdge.getBody(), normalEdge.getBody(), false);
        this.primaryEdge = primaryEdge;
        this.normalEdge = normalEdge;
    }

    public Edge getPrimaryEdge() {
        return primaryEdge;
    }

    public Edge getNormalEdge() {
        return normalEdge;
    }

    @Override
    public Vector2d getU1() {
        if (ballObject && primaryEdge instanceof CircularEdge circle) {
            return Geometry.between(primaryBody.getPosition(), circle.getCenterWorld());
        }
        return getR1();
    }

    @Override
    public Vector2d getU2() {
        if (ballNormal && normalEdge instanceof CircularEdge circle) {
            return Geometry.between(normalBody.getPosition(), circle.getCenterWorld());
        }
        return getR2();
    }

    @Override
    public boolean hasEdge(Edge edge) {
        if (edge == null) {
            return false;
        }
        return edge == normalEdge || edge == primaryEdge;
    }

    @Override
    public boolean hasVertex(Vertex v) {
        return false;
    }

    @Override
    public boolean similarTo(Collision other) {
        if (!(other instanceof RigidBodyCollision c) || !c.hasBody(primaryBody) || !c.hasBody(normalBody)) {
            return false;
        }
        if (!c.hasEdge(normalEdge) || !c.hasEdge(primaryEdge)) {
            return false;
        }
        double nearness = Geometry.nearness(radius1, radius2, getDistanceTol());
        if (Geometry.distanceSquared(impact1, c.impact1) > nearness * nearness) {
            return false;
        }
        return Math.abs(Geometry.dot(normal, c.normal)) >= MIN_NORMALITY;
    }

    @Override
    public void updateCollision(double time) {
        primaryEdge.improveAccuracyEdge(this, normalEdge);
        super.updateCollision(time);
    }

    @Override
    public String toString() {
        var s = super.toString();
        return s.substring(0, s.length() - 1) + ", primaryEdge=" + primaryEdge.getIndex() + ", normalEdge="
        + normalEdge.getIndex() + '}';
    }
}
