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

import com.hellblazer.impetus.engine2d.geometry.Edge;
import com.hellblazer.impetus.engine2d.geometry.Geometry;
import com.hellblazer.impetus.engine2d.geometry.Vertex;
import com.hellblazer.impetus.simulation.Collision;

import javax.vecmath.Vector2d;

/**
 * A vertex of the primary body close to a vertex of the normal body, beyond the ends of the adjoining edges. The
 * normal vertex is treated as a tiny ball whose radius is the distance between the vertices, so the normal always
 * points from the normal vertex to the primary vertex.
 *
 * @author hal.hildebrand
 */
public class CornerCornerCollision extends RigidBodyCollision {

    private final Vertex vertex;
    private final Vertex normalVertex;

    public CornerCornerCollision(Vertex vertex, Vertex normalVertex) {
        super(vertex.getBody(), normalVertex.getBody(), false);
        this.vertex = vertex;
        this.normalVertex = normalVertex;
        this.ballObject = false;
        this.ballNormal = true;
    }

    public Vertex getVertex() {
        return vertex;
    }

    public Vertex getNormalVertex() {
        return normalVertex;
    }

    @Override
    public Vector2d getU2() {
        return Geometry.between(normalBody.getPosition(), normalBody.bodyToWorld(normalVertex.locBody()));
    }

    @Override
    public boolean hasEdge(Edge edge) {
        return false;
    }

    @Override
    public boolean hasVertex(Vertex v) {
        return v == vertex || v == normalVertex;
    }

    @Override
    public boolean similarTo(Collision other) {
        if (!(other instanceof RigidBodyCollision c) || !c.hasBody(primaryBody) || !c.hasBody(normalBody)) {
            return false;
        }
        return c.hasVertex(vertex) && c.hasVertex(normalVertex);
    }

    @Override
    public void updateCollision(double time) {
        var pv = primaryBody.bodyToWorld(vertex.locBody());
        impact1 = normalBody.bodyToWorld(normalVertex.locBody());
        distance = Geometry.distance(pv, impact1);
        if (distance > 0) {
            var n = Geometry.between(impact1, pv);
            n.scale(1 / distance);
            setNormal(n);
        }
        radius2 = distance;
        super.updateCollision(time);
    }

    @Override
    public String toString() {
        var s = super.toString();
        return s.substring(0, s.length() - 1) + ", vertex=" + vertex.getId() + ", normalVertex="
        + normalVertex.getId() + '}';
    }
}
