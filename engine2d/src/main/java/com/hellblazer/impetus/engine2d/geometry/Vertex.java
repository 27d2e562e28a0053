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

import javax.vecmath.Point2d;

/**
 * A point on the outline of a {@link Polygon}, in body coordinates. An end point joins the previous and next edge of
 * a path. A decorated mid point lies on a curved edge, which is then both its previous and next edge; mid points let
 * the vertex tests see curved edges that move fast.
 *
 * @author hal.hildebrand
 */
public final class Vertex {

    private final Point2d locBody;
    private final boolean endPoint;
    private final int     id;
    private       Edge    edge1;
    private       Edge    edge2;

    Vertex(Point2d locBody, int id) {
        this.locBody = new Point2d(locBody);
        this.endPoint = true;
        this.id = id;
    }

    Vertex(Point2d locBody, Edge edge, int id) {
        this.locBody = new Point2d(locBody);
        this.endPoint = false;
        this.edge1 = edge;
        this.edge2 = edge;
        this.id = id;
    }

    public Point2d locBody() {
        return new Point2d(locBody);
    }

    public boolean isEndPoint() {
        return endPoint;
    }

    /**
     * @return previous edge
     */
    public Edge getEdge1() {
        return edge1;
    }

    /**
     * @return next edge
     */
    public Edge getEdge2() {
        return edge2;
    }

    public int getId() {
        return id;
    }

    public Polygon getBody() {
        if (edge1 == null) {
            throw new IllegalStateException("vertex " + id + " is not connected");
        }
        return edge1.getBody();
    }

    /**
     * Radius of curvature at this vertex: infinite between straight edges, negative for concave edges. Between two
     * edges the radius of smaller magnitude is used.
     */
    public double getCurvature() {
        double c1 = edge1 == null ? Double.POSITIVE_INFINITY : edge1.getCurvature(locBody);
        if (!endPoint) {
            return c1;
        }
        double c2 = edge2 == null ? Double.POSITIVE_INFINITY : edge2.getCurvature(locBody);
        return Math.abs(c1) < Math.abs(c2) ? c1 : c2;
    }

    void setEdge1(Edge edge) {
        if (!endPoint) {
            throw new IllegalStateException("cannot reconnect mid point vertex " + id);
        }
        this.edge1 = edge;
    }

    void setEdge2(Edge edge) {
        if (!endPoint) {
            throw new IllegalStateException("cannot reconnect mid point vertex " + id);
        }
        this.edge2 = edge;
    }

    @Override
    public String toString() {
        return "Vertex{id=" + id + ", loc=" + locBody + ", endPoint=" + endPoint + ", edge1="
        + (edge1 == null ? "-" : edge1.getIndex()) + ", edge2=" + (edge2 == null ? "-" : edge2.getIndex()) + "}";
    }
}
