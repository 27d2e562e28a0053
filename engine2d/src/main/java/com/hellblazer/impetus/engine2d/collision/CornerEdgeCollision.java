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
 * A vertex of the primary body against an edge of the normal body.
 *
 * @author hal.hildebrand
 */
public class CornerEdgeCollision extends RigidBodyCollision {

    private static final double MIN_NORMALITY = 0.9;

    private final Vertex vertex;
    private final Edge   normalEdge;
    private final Edge   primaryEdge;
    private final Edge   primaryEdge2;

    public CornerEdgeCollision(Vertex vertex, Edge normalEdge) {
        super(vertex.getEdge1().getBody(), normalEdge.getBody(), false);
        this.vertex = vertex;
        this.normalEdge = normalEdge;
        this.primaryEdge = vertex.getEdge1();
        this.primaryEdge2 = vertex.isEndPoint() ? vertex.getEdge2() : null;
        this.radius1 = vertex.getCurvature();
        this.ballObject = false;
    }

    public Vertex getVertex() {
        return vertex;
    }

    public Edge getNormalEdge() {
        return normalEdge;
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
        return edge == normalEdge || edge == primaryEdge || edge == primaryEdge2;
    }

    @Override
    public boolean hasVertex(Vertex v) {
        return v == vertex;
    }

    @Override
    public boolean similarTo(Collision other) {
        if (!(other instanceof RigidBodyCollision c) || !c.hasBody(primaryBody) || !c.hasBody(normalBody)) {
            return false;
        }
        if (c.hasVertex(vertex)) {
            return true;
        }
        if (!c.hasEdge(normalEdge)) {
            return false;
        }
        if (!c.hasEdge(primaryEdge) && !c.hasEdge(primaryEdge2)) {
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
        var pbw = primaryBody.bodyToWorld(vertex.locBody());
        var pnb = normalBody.worldToBody(pbw);
        var pn = normalEdge.getPointOnEdge(pnb);
        impact1 = normalBody.bodyToWorld(pn.point());
        setNormal(normalBody.rotateBodyToWorld(pn.normal()));
        distance = normalEdge.distanceToLine(pnb);
        super.updateCollision(time);
    }

    @Override
    public String toString() {
        var s = super.toString();
        return s.substring(0, s.length() - 1) + ", vertex=" + vertex.getId() + ", primaryEdge="
        + primaryEdge.getIndex() + ", primaryEdge2=" + (primaryEdge2 != null ? primaryEdge2.getIndex() : "null")
        + ", normalEdge=" + normalEdge.getIndex() + '}';
    }
}
